package com.culicidaelab.service.impl;

import com.culicidaelab.aspect.Timed;
import com.culicidaelab.config.CulicidaeLabProperties;
import com.culicidaelab.exception.ResourceNotFoundException;
import com.culicidaelab.model.Disease;
import com.culicidaelab.model.DiseaseList;
import com.culicidaelab.repository.DiseaseRepository;
import com.culicidaelab.service.DiseaseService;
import com.culicidaelab.store.StoreException;
import com.culicidaelab.store.StoreTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Service
public class DiseaseServiceImpl implements DiseaseService {

    private static final Logger logger = LoggerFactory.getLogger(DiseaseServiceImpl.class);

    @Autowired
    private DiseaseRepository diseaseRepository;

    @Autowired
    private CulicidaeLabProperties properties;

    @Override
    @Timed("listDiseases")
    public DiseaseList listDiseases(String language, String search, Integer limit) {
        String lang = CatalogSupport.language(language, properties);
        try {
            return DiseaseList.of(withImages(
                    diseaseRepository.search(search, lang, CatalogSupport.limit(limit, properties))));
        } catch (StoreException e) {
            logger.warn("Disease list unavailable: {}", e.getMessage());
            return DiseaseList.of(Collections.emptyList());
        }
    }

    @Override
    @Timed("getDisease")
    public Disease getDisease(String id, String language) {
        String lang = CatalogSupport.language(language, properties);
        Optional<Disease> found;
        try {
            found = diseaseRepository.findById(id, lang);
        } catch (StoreTimeoutException e) {
            throw e;
        } catch (StoreException e) {
            logger.warn("Disease '{}' unavailable: {}", id, e.getMessage());
            found = Optional.empty();
        }
        Disease disease = found.orElseThrow(() -> new ResourceNotFoundException("Disease", id));
        disease.setImageUrl(CatalogSupport.diseaseImage(properties, disease.getId()));
        return disease;
    }

    @Override
    @Timed("listDiseasesByVector")
    public List<Disease> listDiseasesByVector(String speciesId, String language) {
        String lang = CatalogSupport.language(language, properties);
        try {
            return withImages(diseaseRepository.findByVector(speciesId, lang));
        } catch (StoreException e) {
            logger.warn("Diseases for vector '{}' unavailable: {}", speciesId, e.getMessage());
            return Collections.emptyList();
        }
    }

    private List<Disease> withImages(List<Disease> diseases) {
        diseases.forEach(d -> d.setImageUrl(CatalogSupport.diseaseImage(properties, d.getId())));
        return diseases;
    }
}
