package com.culicidaelab.repository;

import com.culicidaelab.model.SpeciesDetail;
import com.culicidaelab.model.SpeciesSummary;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Localized reads of the {@code species} table. Entries come back without image URLs
 * and with raw region ids; both are filled in by the service layer.
 * Store failures propagate as {@link com.culicidaelab.store.StoreException}.
 */
public interface SpeciesRepository {

    /**
     * @param search case-insensitive fragment of the scientific name or of a common name
     *               in any supported language, null for all
     */
    List<SpeciesSummary> search(String search, String language, int limit);

    Optional<SpeciesDetail> findById(String id, String language);

    List<SpeciesSummary> findByIds(Collection<String> ids, String language, int limit);

    /**
     * Species with a known vector status, i.e. neither {@code None} nor {@code Unknown}
     */
    List<SpeciesSummary> findVectorSpecies(String language, int limit);

    /**
     * Scientific names of every species, in table order, possibly with duplicates
     */
    List<String> findScientificNames();
}
