package com.culicidaelab.service.impl;

import com.culicidaelab.config.CulicidaeLabProperties;
import com.culicidaelab.exception.StorageWriteFailedException;
import com.culicidaelab.model.Location;
import com.culicidaelab.model.Observation;
import com.culicidaelab.model.ObservationPage;
import com.culicidaelab.repository.ObservationRepository;
import com.culicidaelab.store.StoreException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class ObservationServiceImplTest {

    @Mock
    private ObservationRepository observationRepository;

    private SimpleMeterRegistry meterRegistry;
    private ObservationServiceImpl observationService;

    @BeforeEach
    public void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        observationService = new ObservationServiceImpl(
                observationRepository, new CulicidaeLabProperties(), meterRegistry);
    }

    @Test
    public void testCreateCountsStoredObservations() {
        Observation observation = observation();
        when(observationRepository.create(observation)).thenReturn(observation);

        Observation created = observationService.createObservation(observation);

        assertSame(observation, created);
        assertEquals(1.0, meterRegistry.get("culicidaelab.observations.created").counter().count());
        assertEquals(0.0, meterRegistry.get("culicidaelab.observations.create_failed").counter().count());
    }

    @Test
    public void testCreateFailureIsCountedAndRethrown() {
        Observation observation = observation();
        when(observationRepository.create(observation))
                .thenThrow(new StorageWriteFailedException("write failed", new StoreException("disk full")));

        assertThrows(StorageWriteFailedException.class, () -> observationService.createObservation(observation));
        assertEquals(1.0, meterRegistry.get("culicidaelab.observations.create_failed").counter().count());
        assertEquals(0.0, meterRegistry.get("culicidaelab.observations.created").counter().count());
    }

    @Test
    public void testListClampsWindow() {
        when(observationRepository.list(any(), any(), anyInt(), anyInt())).thenReturn(ObservationPage.empty());

        observationService.listObservations("u", "Aedes aegypti", 5000, -3);
        observationService.listObservations("u", null, 0, 5);

        verify(observationRepository).list("u", "Aedes aegypti", 1000, 0);
        verify(observationRepository).list("u", null, 1, 5);
    }

    private static Observation observation() {
        return Observation.builder()
                .id(UUID.randomUUID())
                .speciesScientificName("Aedes aegypti")
                .count(1)
                .location(new Location(1.0, 2.0))
                .observedAt("2023-07-20")
                .build();
    }
}
