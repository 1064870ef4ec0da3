package com.culicidaelab.service.impl;

import com.culicidaelab.aspect.Timed;
import com.culicidaelab.config.CulicidaeLabProperties;
import com.culicidaelab.exception.StorageWriteFailedException;
import com.culicidaelab.model.Observation;
import com.culicidaelab.model.ObservationPage;
import com.culicidaelab.repository.ObservationRepository;
import com.culicidaelab.service.ObservationService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ObservationServiceImpl implements ObservationService {

    private static final Logger logger = LoggerFactory.getLogger(ObservationServiceImpl.class);

    private final ObservationRepository observationRepository;
    private final CulicidaeLabProperties properties;
    private final Counter createdCounter;
    private final Counter createFailedCounter;

    public ObservationServiceImpl(ObservationRepository observationRepository,
                                  CulicidaeLabProperties properties, MeterRegistry meterRegistry) {
        this.observationRepository = observationRepository;
        this.properties = properties;
        this.createdCounter = Counter.builder("culicidaelab.observations.created")
                .description("Observations stored")
                .register(meterRegistry);
        this.createFailedCounter = Counter.builder("culicidaelab.observations.create_failed")
                .description("Observations rejected by the store")
                .register(meterRegistry);
    }

    @Override
    @Timed(value = "createObservation", logLevel = Timed.LogLevel.INFO)
    public Observation createObservation(Observation observation) {
        try {
            Observation created = observationRepository.create(observation);
            createdCounter.increment();
            logger.info("Created observation {} of {}", created.getId(), created.getSpeciesScientificName());
            return created;
        } catch (StorageWriteFailedException e) {
            createFailedCounter.increment();
            throw e;
        }
    }

    @Override
    @Timed("listObservations")
    public ObservationPage listObservations(String userId, String speciesId, int limit, int offset) {
        int maxLimit = properties.getObservations().getMaxLimit();
        int window = Math.max(1, Math.min(limit, maxLimit));
        return observationRepository.list(userId, speciesId, window, Math.max(0, offset));
    }
}
