package com.culicidaelab.service.impl;

import com.culicidaelab.config.CulicidaeLabProperties;
import com.culicidaelab.exception.ResourceNotFoundException;
import com.culicidaelab.model.Disease;
import com.culicidaelab.repository.DiseaseRepository;
import com.culicidaelab.store.StoreException;
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
public class DiseaseServiceImplTest {

    @Mock
    private DiseaseRepository diseaseRepository;

    @Spy
    private CulicidaeLabProperties properties = new CulicidaeLabProperties();

    @InjectMocks
    private DiseaseServiceImpl diseaseService;

    @Test
    public void testGetDiseaseSetsImage() {
        when(diseaseRepository.findById("dengue", "en"))
                .thenReturn(Optional.of(Disease.builder().id("dengue").name("Dengue fever").build()));

        Disease disease = diseaseService.getDisease("dengue", "en");

        assertEquals("http://localhost:8000/static/images/diseases/dengue/detail.jpg", disease.getImageUrl());
    }

    @Test
    public void testUnknownDisease() {
        when(diseaseRepository.findById("missing", "en")).thenReturn(Optional.empty());

        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
                () -> diseaseService.getDisease("missing", "en"));
        assertTrue(e.getMessage().contains("missing"));
    }

    @Test
    public void testListDiseases() {
        List<Disease> diseases = new ArrayList<>(List.of(Disease.builder().id("malaria").build()));
        when(diseaseRepository.search("fever", "ru", 50)).thenReturn(diseases);

        assertEquals(1, diseaseService.listDiseases("ru", "fever", -1).getCount());
    }

    @Test
    public void testDiseasesByVectorDegradeOnStoreFailure() {
        when(diseaseRepository.findByVector("aedes_aegypti", "en")).thenThrow(new StoreException("down"));

        assertTrue(diseaseService.listDiseasesByVector("aedes_aegypti", "en").isEmpty());
    }
}
