package com.culicidaelab.repository.impl;

import com.culicidaelab.config.CulicidaeLabProperties;
import com.culicidaelab.localization.LabelFallback;
import com.culicidaelab.model.SpeciesDetail;
import com.culicidaelab.model.SpeciesSummary;
import com.culicidaelab.repository.SpeciesRepository;
import com.culicidaelab.store.DocumentStore;
import com.culicidaelab.store.QueryPredicate;
import com.culicidaelab.store.QueryWindow;
import com.culicidaelab.store.Row;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public class SpeciesRepositoryImpl implements SpeciesRepository {

    public static final String TABLE = "species";

    private static final String ID = "id";
    private static final String SCIENTIFIC_NAME = "scientific_name";
    private static final String VECTOR_STATUS = "vector_status";
    private static final String COMMON_NAME = "common_name";
    private static final String DESCRIPTION = "description";
    private static final String KEY_CHARACTERISTICS = "key_characteristics";
    private static final String HABITAT_PREFERENCES = "habitat_preferences";
    private static final String GEOGRAPHIC_REGIONS = "geographic_regions";
    private static final String RELATED_DISEASES = "related_diseases";

    private static final List<String> NON_VECTOR_STATUSES = List.of("None", "Unknown");

    private final DocumentStore documentStore;
    private final CulicidaeLabProperties properties;

    public SpeciesRepositoryImpl(DocumentStore documentStore, CulicidaeLabProperties properties) {
        this.documentStore = documentStore;
        this.properties = properties;
    }

    @Override
    public List<SpeciesSummary> search(String search, String language, int limit) {
        QueryPredicate predicate = null;
        if (search != null && !search.isBlank()) {
            List<QueryPredicate> fields = new ArrayList<>();
            fields.add(QueryPredicate.containsIgnoreCase(SCIENTIFIC_NAME, search.trim()));
            for (String supported : properties.getSupportedLanguages()) {
                fields.add(QueryPredicate.containsIgnoreCase(LabelFallback.column(COMMON_NAME, supported), search.trim()));
            }
            predicate = QueryPredicate.or(fields);
        }
        return summaries(query(predicate, limit), language);
    }

    @Override
    public Optional<SpeciesDetail> findById(String id, String language) {
        List<Row> rows = query(QueryPredicate.eq(ID, id), 1);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        Row row = rows.get(0);
        String defaultLanguage = properties.getDefaultLanguage();

        return Optional.of(SpeciesDetail.builder()
                .id(row.getString(ID))
                .scientificName(row.getString(SCIENTIFIC_NAME))
                .commonName(LabelFallback.localizedField(row, COMMON_NAME, language, defaultLanguage))
                .vectorStatus(row.getString(VECTOR_STATUS))
                .description(LabelFallback.localizedField(row, DESCRIPTION, language, defaultLanguage))
                .keyCharacteristics(LabelFallback.localizedList(row, KEY_CHARACTERISTICS, language, defaultLanguage))
                .habitatPreferences(LabelFallback.localizedList(row, HABITAT_PREFERENCES, language, defaultLanguage))
                .geographicRegions(row.getStringList(GEOGRAPHIC_REGIONS))
                .relatedDiseases(row.getStringList(RELATED_DISEASES))
                .build());
    }

    @Override
    public List<SpeciesSummary> findByIds(Collection<String> ids, String language, int limit) {
        if (ids == null || ids.isEmpty()) {
            return new ArrayList<>();
        }
        return summaries(query(QueryPredicate.in(ID, ids), limit), language);
    }

    @Override
    public List<SpeciesSummary> findVectorSpecies(String language, int limit) {
        QueryPredicate predicate = QueryPredicate.and(List.of(
                QueryPredicate.exists(VECTOR_STATUS),
                QueryPredicate.notIn(VECTOR_STATUS, NON_VECTOR_STATUSES)));
        return summaries(query(predicate, limit), language);
    }

    @Override
    public List<String> findScientificNames() {
        return documentStore.openTable(TABLE)
                .query(QueryPredicate.exists(SCIENTIFIC_NAME))
                .stream()
                .map(row -> row.getString(SCIENTIFIC_NAME))
                .collect(Collectors.toList());
    }

    private List<Row> query(QueryPredicate predicate, int limit) {
        return documentStore.openTable(TABLE).query(predicate, QueryWindow.limit(limit));
    }

    private List<SpeciesSummary> summaries(List<Row> rows, String language) {
        String defaultLanguage = properties.getDefaultLanguage();
        List<SpeciesSummary> species = new ArrayList<>(rows.size());
        for (Row row : rows) {
            species.add(SpeciesSummary.builder()
                    .id(row.getString(ID))
                    .scientificName(row.getString(SCIENTIFIC_NAME))
                    .commonName(LabelFallback.localizedField(row, COMMON_NAME, language, defaultLanguage))
                    .vectorStatus(row.getString(VECTOR_STATUS))
                    .build());
        }
        return species;
    }
}
