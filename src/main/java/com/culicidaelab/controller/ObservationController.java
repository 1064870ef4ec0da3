package com.culicidaelab.controller;

import com.culicidaelab.model.Observation;
import com.culicidaelab.model.ObservationPage;
import com.culicidaelab.repository.ObservationRepository;
import com.culicidaelab.service.ObservationService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Field observation submission and listing
 */
@RestController
@RequestMapping("/api")
public class ObservationController {

    private static final Logger logger = LoggerFactory.getLogger(ObservationController.class);

    @Autowired
    private ObservationService observationService;

    /**
     * POST /api/observations
     * Id and user id are generated when the client leaves them out.
     */
    @PostMapping("/observations")
    public ResponseEntity<Observation> createObservation(@Valid @RequestBody Observation observation) {
        if (observation.getId() == null) {
            observation.setId(UUID.randomUUID());
        }
        if (observation.getUserId() == null || observation.getUserId().isBlank()) {
            observation.setUserId(UUID.randomUUID().toString());
            logger.debug("Generated user id {} for observation {}", observation.getUserId(), observation.getId());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(observationService.createObservation(observation));
    }

    @GetMapping("/observations")
    public ResponseEntity<ObservationPage> listObservations(
            @RequestParam(name = "species_id", required = false) String speciesId,
            @RequestParam(name = "user_id", defaultValue = ObservationRepository.ANONYMOUS_USER_ID) String userId,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        return ResponseEntity.ok(observationService.listObservations(userId, speciesId, limit, offset));
    }
}
