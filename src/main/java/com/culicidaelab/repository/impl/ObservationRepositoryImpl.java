package com.culicidaelab.repository.impl;

import com.culicidaelab.exception.StorageWriteFailedException;
import com.culicidaelab.model.Observation;
import com.culicidaelab.model.ObservationPage;
import com.culicidaelab.repository.ObservationRepository;
import com.culicidaelab.repository.ObservationRowMapper;
import com.culicidaelab.store.DocumentStore;
import com.culicidaelab.store.QueryPredicate;
import com.culicidaelab.store.QueryWindow;
import com.culicidaelab.store.Row;
import com.culicidaelab.store.StoreException;
import com.culicidaelab.store.StoreTimeoutException;
import com.culicidaelab.store.TableHandle;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Observation repository over the document store. Filters and the limit/offset
 * window are always pushed down to the store, over its stable insertion order.
 */
@Repository
public class ObservationRepositoryImpl implements ObservationRepository {

    private static final Logger logger = LoggerFactory.getLogger(ObservationRepositoryImpl.class);

    public static final String TABLE = "observations";

    private final DocumentStore documentStore;
    private final ObservationRowMapper rowMapper;

    public ObservationRepositoryImpl(DocumentStore documentStore, ObservationRowMapper rowMapper) {
        this.documentStore = documentStore;
        this.rowMapper = rowMapper;
    }

    @Override
    public Observation create(Observation observation) {
        try {
            Row row = rowMapper.toRow(observation);
            documentStore.openTable(TABLE).insert(row);
            logger.debug("Stored observation {}", observation.getId());
            return observation;
        } catch (JsonProcessingException | StoreException e) {
            throw new StorageWriteFailedException(
                    "Failed to save observation " + observation.getId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public ObservationPage list(String userId, String speciesId, int limit, int offset) {
        QueryPredicate predicate = buildPredicate(userId, speciesId);

        try {
            TableHandle table = documentStore.openTable(TABLE);
            long total = table.count(predicate);
            List<Row> rows = table.query(predicate, QueryWindow.of(limit, offset));

            List<Observation> observations = new ArrayList<>(rows.size());
            for (Row row : rows) {
                rowMapper.fromRow(row).ifPresent(observations::add);
            }
            return new ObservationPage(total, observations);
        } catch (StoreTimeoutException e) {
            throw e;
        } catch (StoreException e) {
            logger.warn("Failed to list observations, returning empty page: {}", e.getMessage());
            return ObservationPage.empty();
        }
    }

    /**
     * Conjunction of the present filters, null when there are none
     */
    static QueryPredicate buildPredicate(String userId, String speciesId) {
        List<QueryPredicate> conditions = new ArrayList<>();
        if (userId != null && !userId.isBlank() && !ANONYMOUS_USER_ID.equals(userId)) {
            conditions.add(QueryPredicate.or(List.of(
                    QueryPredicate.eq(ObservationRowMapper.OBSERVER_ID, userId),
                    QueryPredicate.eq(ObservationRowMapper.USER_ID, userId))));
        }
        if (speciesId != null && !speciesId.isBlank()) {
            conditions.add(QueryPredicate.eq(ObservationRowMapper.SPECIES_SCIENTIFIC_NAME, speciesId));
        }
        return QueryPredicate.allOf(conditions);
    }
}
