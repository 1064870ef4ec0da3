package com.culicidaelab.repository;

import com.culicidaelab.model.Observation;
import com.culicidaelab.model.ObservationPage;

/**
 * Observation persistence over the {@code observations} table
 */
public interface ObservationRepository {

    /**
     * User id meaning "no authenticated user"; never used as a filter value
     */
    String ANONYMOUS_USER_ID = "default_user_id";

    /**
     * Write one observation and return it unchanged
     *
     * @throws com.culicidaelab.exception.StorageWriteFailedException if the store rejects the write
     */
    Observation create(Observation observation);

    /**
     * List observations in creation order
     *
     * @param userId    observer filter, ignored when null, blank or {@link #ANONYMOUS_USER_ID}
     * @param speciesId species scientific name filter, ignored when null or blank
     * @return rows {@code [offset, offset + limit)} of the matches and the total match count
     */
    ObservationPage list(String userId, String speciesId, int limit, int offset);
}
