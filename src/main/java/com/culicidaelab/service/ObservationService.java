package com.culicidaelab.service;

import com.culicidaelab.model.Observation;
import com.culicidaelab.model.ObservationPage;

public interface ObservationService {

    /**
     * Store a new observation
     *
     * @throws com.culicidaelab.exception.StorageWriteFailedException if it could not be stored
     */
    Observation createObservation(Observation observation);

    /**
     * Page of observations; limit is clamped to the configured maximum and offset to zero or more
     */
    ObservationPage listObservations(String userId, String speciesId, int limit, int offset);
}
