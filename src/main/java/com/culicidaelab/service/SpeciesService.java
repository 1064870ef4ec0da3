package com.culicidaelab.service;

import com.culicidaelab.model.SpeciesDetail;
import com.culicidaelab.model.SpeciesList;

public interface SpeciesService {

    SpeciesList listSpecies(String language, String search, Integer limit);

    /**
     * @throws com.culicidaelab.exception.ResourceNotFoundException for an unknown id
     */
    SpeciesDetail getSpecies(String id, String language);

    /**
     * Vectors of the given disease, or every species with a known vector status
     * when no disease is given
     */
    SpeciesList listVectorSpecies(String language, String diseaseId);
}
