package com.culicidaelab.repository;

import com.culicidaelab.model.Disease;

import java.util.List;
import java.util.Optional;

/**
 * Localized reads of the {@code diseases} table, without image URLs
 */
public interface DiseaseRepository {

    /**
     * @param search case-insensitive fragment of the name or description in any
     *               supported language, null for all
     */
    List<Disease> search(String search, String language, int limit);

    Optional<Disease> findById(String id, String language);

    /**
     * Diseases whose {@code vectors} list holds the species id
     */
    List<Disease> findByVector(String speciesId, String language);
}
