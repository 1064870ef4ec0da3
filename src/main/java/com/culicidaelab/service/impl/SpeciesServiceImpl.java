package com.culicidaelab.service.impl;

import com.culicidaelab.aspect.Timed;
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
import com.culicidaelab.service.SpeciesService;
import com.culicidaelab.store.StoreException;
import com.culicidaelab.store.StoreTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Service
public class SpeciesServiceImpl implements SpeciesService {

    private static final Logger logger = LoggerFactory.getLogger(SpeciesServiceImpl.class);

    private static final String THUMBNAIL = "thumbnail";
    private static final String DETAIL = "detail";

    @Autowired
    private SpeciesRepository speciesRepository;

    @Autowired
    private DiseaseRepository diseaseRepository;

    @Autowired
    private LocalizationCache localizationCache;

    @Autowired
    private CulicidaeLabProperties properties;

    @Override
    @Timed("listSpecies")
    public SpeciesList listSpecies(String language, String search, Integer limit) {
        String lang = CatalogSupport.language(language, properties);
        try {
            return SpeciesList.of(withThumbnails(
                    speciesRepository.search(search, lang, CatalogSupport.limit(limit, properties))));
        } catch (StoreException e) {
            logger.warn("Species list unavailable: {}", e.getMessage());
            return SpeciesList.of(Collections.emptyList());
        }
    }

    @Override
    @Timed("getSpecies")
    public SpeciesDetail getSpecies(String id, String language) {
        String lang = CatalogSupport.language(language, properties);
        Optional<SpeciesDetail> found;
        try {
            found = speciesRepository.findById(id, lang);
        } catch (StoreTimeoutException e) {
            throw e;
        } catch (StoreException e) {
            logger.warn("Species '{}' unavailable: {}", id, e.getMessage());
            found = Optional.empty();
        }

        SpeciesDetail species = found.orElseThrow(() -> new ResourceNotFoundException("Species", id));
        species.setImageUrl(CatalogSupport.speciesImage(properties, species.getId(), DETAIL));

        if (species.getGeographicRegions() != null) {
            List<String> regionNames = new ArrayList<>();
            for (String regionId : species.getGeographicRegions()) {
                regionNames.add(localizationCache.resolve(CacheDomain.REGION, lang, regionId));
            }
            species.setGeographicRegions(regionNames);
        }
        return species;
    }

    @Override
    @Timed("listVectorSpecies")
    public SpeciesList listVectorSpecies(String language, String diseaseId) {
        String lang = CatalogSupport.language(language, properties);
        int limit = properties.getCatalog().getVectorLimit();
        try {
            if (diseaseId == null || diseaseId.isBlank()) {
                return SpeciesList.of(withThumbnails(speciesRepository.findVectorSpecies(lang, limit)));
            }
            Optional<Disease> disease = diseaseRepository.findById(diseaseId, lang);
            if (disease.isEmpty() || disease.get().getVectors().isEmpty()) {
                return SpeciesList.of(Collections.emptyList());
            }
            return SpeciesList.of(withThumbnails(
                    speciesRepository.findByIds(disease.get().getVectors(), lang, limit)));
        } catch (StoreException e) {
            logger.warn("Vector species unavailable: {}", e.getMessage());
            return SpeciesList.of(Collections.emptyList());
        }
    }

    private List<SpeciesSummary> withThumbnails(List<SpeciesSummary> species) {
        species.forEach(s -> s.setImageUrl(CatalogSupport.speciesImage(properties, s.getId(), THUMBNAIL)));
        return species;
    }
}
