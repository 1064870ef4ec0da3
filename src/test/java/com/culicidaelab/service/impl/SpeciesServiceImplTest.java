package com.culicidaelab.service.impl;

import com.culicidaelab.config.CulicidaeLabProperties;
import com.culicidaelab.exception.ResourceNotFoundException;
import com.culicidaelab.localization.CacheDomain;
import com.culicidaelab.localization.LocalizationCache;
import com.culicidaelab.model.Disease;
import com.culicidaelab.model.SpeciesDetail;
import com.culicidaelab.model.SpeciesList;
import com.culicidaelab.model.SpeciesSummary;
import com.culicidaelab.repository.DiseaseRepository;
import com.culicidaelab.repository.SpeciesRepository;
import com.culicidaelab.store.StoreException;
import com.culicidaelab.store.StoreTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class SpeciesServiceImplTest {

    @Mock
    private SpeciesRepository speciesRepository;

    @Mock
    private DiseaseRepository diseaseRepository;

    @Mock
    private LocalizationCache localizationCache;

    @Spy
    private CulicidaeLabProperties properties = new CulicidaeLabProperties();

    @InjectMocks
    private SpeciesServiceImpl speciesService;

    @BeforeEach
    public void setUp() {
        properties.setStaticUrlBase("http://static.test/");
    }

    @Test
    public void testGetSpeciesResolvesRegionsAndImage() {
        // Given
        SpeciesDetail detail = SpeciesDetail.builder()
                .id("aedes_aegypti")
                .scientificName("Aedes aegypti")
                .geographicRegions(List.of("z_region", "unknown_region"))
                .build();
        when(speciesRepository.findById("aedes_aegypti", "ru")).thenReturn(Optional.of(detail));
        when(localizationCache.resolve(CacheDomain.REGION, "ru", "z_region")).thenReturn("Альфа");
        when(localizationCache.resolve(CacheDomain.REGION, "ru", "unknown_region")).thenReturn("unknown_region");

        // When
        SpeciesDetail species = speciesService.getSpecies("aedes_aegypti", "ru");

        // Then
        assertEquals(List.of("Альфа", "unknown_region"), species.getGeographicRegions());
        assertEquals("http://static.test/static/images/species/aedes_aegypti/detail.jpg", species.getImageUrl());
    }

    @Test
    public void testUnknownSpecies() {
        when(speciesRepository.findById("missing", "en")).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> speciesService.getSpecies("missing", null));
    }

    @Test
    public void testTimeoutIsNotReportedAsMissing() {
        when(speciesRepository.findById("slow", "en")).thenThrow(new StoreTimeoutException("timed out", null));

        assertThrows(StoreTimeoutException.class, () -> speciesService.getSpecies("slow", "en"));
    }

    @Test
    public void testListSpeciesLimitsAndThumbnails() {
        when(speciesRepository.search("aedes", "en", 200)).thenReturn(summaries("aedes_aegypti"));
        when(speciesRepository.search(null, "en", 50)).thenReturn(new ArrayList<>());

        SpeciesList capped = speciesService.listSpecies(" ", "aedes", 1000);
        SpeciesList defaulted = speciesService.listSpecies("en", null, null);

        assertEquals(1, capped.getCount());
        assertEquals("http://static.test/static/images/species/aedes_aegypti/thumbnail.jpg",
                capped.getSpecies().get(0).getImageUrl());
        assertEquals(0, defaulted.getCount());
    }

    @Test
    public void testListSpeciesStoreFailureIsEmpty() {
        when(speciesRepository.search(null, "en", 50)).thenThrow(new StoreException("down"));

        assertEquals(0, speciesService.listSpecies("en", null, null).getCount());
    }

    @Test
    public void testVectorSpeciesWithoutDisease() {
        when(speciesRepository.findVectorSpecies("en", 200)).thenReturn(summaries("aedes_aegypti", "aedes_albopictus"));

        assertEquals(2, speciesService.listVectorSpecies("en", null).getCount());
        verifyNoInteractions(diseaseRepository);
    }

    @Test
    public void testVectorSpeciesOfDisease() {
        Disease dengue = Disease.builder().id("dengue").vectors(List.of("aedes_aegypti")).build();
        when(diseaseRepository.findById("dengue", "en")).thenReturn(Optional.of(dengue));
        when(speciesRepository.findByIds(List.of("aedes_aegypti"), "en", 200)).thenReturn(summaries("aedes_aegypti"));

        SpeciesList vectors = speciesService.listVectorSpecies("en", "dengue");

        assertEquals(1, vectors.getCount());
        assertEquals("aedes_aegypti", vectors.getSpecies().get(0).getId());
    }

    @Test
    public void testVectorSpeciesOfUnknownDisease() {
        when(diseaseRepository.findById("missing", "en")).thenReturn(Optional.empty());

        assertEquals(0, speciesService.listVectorSpecies("en", "missing").getCount());
        verifyNoInteractions(speciesRepository);
    }

    private static List<SpeciesSummary> summaries(String... ids) {
        List<SpeciesSummary> species = new ArrayList<>();
        for (String id : ids) {
            species.add(SpeciesSummary.builder().id(id).build());
        }
        return species;
    }
}
