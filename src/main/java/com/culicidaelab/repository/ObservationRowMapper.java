package com.culicidaelab.repository;

import com.culicidaelab.geo.IsoDates;
import com.culicidaelab.model.Location;
import com.culicidaelab.model.Observation;
import com.culicidaelab.store.Row;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Converts between {@link Observation} and its stored row.
 *
 * <p>Stored rows keep the point as {@code geometry_type = "Point"} and
 * {@code coordinates = [lng, lat]}; {@code metadata} and structured
 * {@code data_source} values are stored as JSON text.
 */
@Component
public class ObservationRowMapper {

    private static final Logger logger = LoggerFactory.getLogger(ObservationRowMapper.class);

    public static final String ID = "id";
    public static final String SPECIES_SCIENTIFIC_NAME = "species_scientific_name";
    public static final String OBSERVED_AT = "observed_at";
    public static final String COUNT = "count";
    public static final String OBSERVER_ID = "observer_id";
    public static final String USER_ID = "user_id";
    public static final String LOCATION_ACCURACY_M = "location_accuracy_m";
    public static final String NOTES = "notes";
    public static final String DATA_SOURCE = "data_source";
    public static final String IMAGE_FILENAME = "image_filename";
    public static final String MODEL_ID = "model_id";
    public static final String CONFIDENCE = "confidence";
    public static final String GEOMETRY_TYPE = "geometry_type";
    public static final String COORDINATES = "coordinates";
    public static final String METADATA = "metadata";

    private static final String POINT = "Point";

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ObservationRowMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Build the stored row. Null and empty-string values are left out.
     *
     * @throws JsonProcessingException if metadata or data source cannot be written as JSON
     */
    public Row toRow(Observation observation) throws JsonProcessingException {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(ID, observation.getId() != null ? observation.getId().toString() : null);
        fields.put(SPECIES_SCIENTIFIC_NAME, observation.getSpeciesScientificName());
        fields.put(OBSERVED_AT, IsoDates.datePart(observation.getObservedAt()));
        fields.put(COUNT, observation.getCount());
        fields.put(OBSERVER_ID, observation.getUserId());
        fields.put(LOCATION_ACCURACY_M, observation.getLocationAccuracyM());
        fields.put(NOTES, observation.getNotes());
        fields.put(DATA_SOURCE, toJsonText(observation.getDataSource()));
        fields.put(IMAGE_FILENAME, observation.getImageFilename());
        fields.put(MODEL_ID, observation.getModelId());
        fields.put(CONFIDENCE, observation.getConfidence());

        Location location = observation.getLocation();
        if (location != null && location.getLat() != null && location.getLng() != null) {
            fields.put(GEOMETRY_TYPE, POINT);
            fields.put(COORDINATES, List.of(location.getLng(), location.getLat()));
        }
        fields.put(METADATA, toJsonText(observation.getMetadata()));

        Row row = new Row();
        fields.forEach((key, value) -> {
            if (!(value instanceof String && ((String) value).isEmpty())) {
                row.put(key, value);
            }
        });
        return row;
    }

    /**
     * Read a stored row; empty when the row has no usable id or location
     */
    public Optional<Observation> fromRow(Row row) {
        String rowId = row.getString(ID);
        UUID id;
        try {
            id = rowId != null ? UUID.fromString(rowId) : null;
        } catch (IllegalArgumentException e) {
            logger.warn("Skipping observation with invalid id '{}'", rowId);
            return Optional.empty();
        }

        Location location = readLocation(row.get(COORDINATES));
        if (location == null) {
            logger.warn("Skipping observation '{}' with malformed location", rowId);
            return Optional.empty();
        }

        String userId = row.getString(USER_ID);
        if (userId == null || userId.isEmpty()) {
            userId = row.getString(OBSERVER_ID);
        }

        return Optional.of(Observation.builder()
                .id(id)
                .speciesScientificName(row.getString(SPECIES_SCIENTIFIC_NAME))
                .count(row.getInteger(COUNT))
                .location(location)
                .observedAt(row.getString(OBSERVED_AT))
                .notes(row.getString(NOTES))
                .userId(userId)
                .locationAccuracyM(row.getInteger(LOCATION_ACCURACY_M))
                .dataSource(row.getString(DATA_SOURCE))
                .imageFilename(row.getString(IMAGE_FILENAME))
                .modelId(row.getString(MODEL_ID))
                .confidence(row.getDouble(CONFIDENCE))
                .metadata(readMetadata(rowId, row.get(METADATA)))
                .build());
    }

    private String toJsonText(Object value) throws JsonProcessingException {
        if (value == null || value instanceof String) {
            return (String) value;
        }
        return objectMapper.writeValueAsString(value);
    }

    private static Location readLocation(Object coordinates) {
        if (!(coordinates instanceof List)) {
            return null;
        }
        List<?> values = (List<?>) coordinates;
        if (values.size() != 2 || !(values.get(0) instanceof Number) || !(values.get(1) instanceof Number)) {
            return null;
        }
        double lng = ((Number) values.get(0)).doubleValue();
        double lat = ((Number) values.get(1)).doubleValue();
        return new Location(lat, lng);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> readMetadata(String rowId, Object metadata) {
        if (metadata instanceof Map) {
            return new LinkedHashMap<>((Map<String, Object>) metadata);
        }
        if (!(metadata instanceof String) || ((String) metadata).isBlank()) {
            return Collections.emptyMap();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue((String) metadata, METADATA_TYPE);
            return parsed != null ? parsed : Collections.emptyMap();
        } catch (JsonProcessingException e) {
            logger.warn("Could not decode metadata for observation '{}'", rowId);
            return Collections.emptyMap();
        }
    }
}
