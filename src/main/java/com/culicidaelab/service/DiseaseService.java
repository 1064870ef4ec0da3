package com.culicidaelab.service;

import com.culicidaelab.model.Disease;
import com.culicidaelab.model.DiseaseList;

import java.util.List;

public interface DiseaseService {

    DiseaseList listDiseases(String language, String search, Integer limit);

    /**
     * @throws com.culicidaelab.exception.ResourceNotFoundException for an unknown id
     */
    Disease getDisease(String id, String language);

    List<Disease> listDiseasesByVector(String speciesId, String language);
}
