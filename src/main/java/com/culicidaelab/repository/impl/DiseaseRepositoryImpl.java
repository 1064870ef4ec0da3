package com.culicidaelab.repository.impl;

import com.culicidaelab.config.CulicidaeLabProperties;
import com.culicidaelab.localization.LabelFallback;
import com.culicidaelab.model.Disease;
import com.culicidaelab.repository.DiseaseRepository;
import com.culicidaelab.store.DocumentStore;
import com.culicidaelab.store.QueryPredicate;
import com.culicidaelab.store.QueryWindow;
import com.culicidaelab.store.Row;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class DiseaseRepositoryImpl implements DiseaseRepository {

    public static final String TABLE = "diseases";

    private static final String ID = "id";
    private static final String NAME = "name";
    private static final String DESCRIPTION = "description";
    private static final String SYMPTOMS = "symptoms";
    private static final String TREATMENT = "treatment";
    private static final String PREVENTION = "prevention";
    private static final String PREVALENCE = "prevalence";
    private static final String VECTORS = "vectors";

    private final DocumentStore documentStore;
    private final CulicidaeLabProperties properties;

    public DiseaseRepositoryImpl(DocumentStore documentStore, CulicidaeLabProperties properties) {
        this.documentStore = documentStore;
        this.properties = properties;
    }

    @Override
    public List<Disease> search(String search, String language, int limit) {
        QueryPredicate predicate = null;
        if (search != null && !search.isBlank()) {
            List<QueryPredicate> fields = new ArrayList<>();
            for (String supported : properties.getSupportedLanguages()) {
                fields.add(QueryPredicate.containsIgnoreCase(LabelFallback.column(NAME, supported), search.trim()));
                fields.add(QueryPredicate.containsIgnoreCase(LabelFallback.column(DESCRIPTION, supported), search.trim()));
            }
            predicate = QueryPredicate.or(fields);
        }
        return toDiseases(documentStore.openTable(TABLE).query(predicate, QueryWindow.limit(limit)), language);
    }

    @Override
    public Optional<Disease> findById(String id, String language) {
        List<Row> rows = documentStore.openTable(TABLE).query(QueryPredicate.eq(ID, id), QueryWindow.limit(1));
        return toDiseases(rows, language).stream().findFirst();
    }

    @Override
    public List<Disease> findByVector(String speciesId, String language) {
        return toDiseases(documentStore.openTable(TABLE).query(QueryPredicate.arrayContains(VECTORS, speciesId)),
                language);
    }

    private List<Disease> toDiseases(List<Row> rows, String language) {
        String defaultLanguage = properties.getDefaultLanguage();
        List<Disease> diseases = new ArrayList<>(rows.size());
        for (Row row : rows) {
            diseases.add(Disease.builder()
                    .id(row.getString(ID))
                    .name(LabelFallback.localizedField(row, NAME, language, defaultLanguage))
                    .description(LabelFallback.localizedField(row, DESCRIPTION, language, defaultLanguage))
                    .symptoms(LabelFallback.localizedField(row, SYMPTOMS, language, defaultLanguage))
                    .treatment(LabelFallback.localizedField(row, TREATMENT, language, defaultLanguage))
                    .prevention(LabelFallback.localizedField(row, PREVENTION, language, defaultLanguage))
                    .prevalence(LabelFallback.localizedField(row, PREVALENCE, language, defaultLanguage))
                    .vectors(row.getStringList(VECTORS))
                    .build());
        }
        return diseases;
    }
}
