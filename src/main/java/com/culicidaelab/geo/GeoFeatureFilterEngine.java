package com.culicidaelab.geo;

import com.culicidaelab.model.GeoFeature;
import com.culicidaelab.store.Row;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns raw store rows into GeoJSON features and applies species, bounding-box and
 * date-range predicates. Holds no mutable state; output keeps input order.
 *
 * <p>Rows are read in one of two layouts: a {@code geometry} field holding a GeoJSON
 * geometry (object or JSON text), or {@code geometry_type} plus {@code coordinates}.
 * Rows that cannot be turned into a feature are dropped.
 */
@Slf4j
@Component
public class GeoFeatureFilterEngine {

    public static final String ID = "id";
    public static final String SPECIES = "species";
    public static final String SPECIES_SCIENTIFIC_NAME = "species_scientific_name";
    public static final String OBSERVED_AT = "observed_at";
    public static final String GEOMETRY = "geometry";
    public static final String GEOMETRY_TYPE = "geometry_type";
    public static final String COORDINATES = "coordinates";

    private static final Set<String> GEOMETRY_FIELDS = Set.of(GEOMETRY, GEOMETRY_TYPE, COORDINATES);

    private final GeometryFactory geometryFactory;
    private final ObjectMapper objectMapper;

    public GeoFeatureFilterEngine(GeometryFactory geometryFactory, ObjectMapper objectMapper) {
        this.geometryFactory = geometryFactory;
        this.objectMapper = objectMapper;
    }

    public List<GeoFeature> filter(List<Row> rows, GeoFilter filter) {
        GeoFilter predicates = filter != null ? filter : GeoFilter.none();
        List<GeoFeature> features = new ArrayList<>();
        int dropped = 0;

        for (Row row : rows) {
            Optional<GeoFeature> feature = toFeature(row);
            if (feature.isEmpty()) {
                dropped++;
                continue;
            }
            if (matches(feature.get(), predicates)) {
                features.add(feature.get());
            }
        }

        if (dropped > 0) {
            log.debug("Dropped {} malformed rows out of {}", dropped, rows.size());
        }
        return features;
    }

    /**
     * Build the feature for a row, empty when the row has no id or no readable geometry
     */
    public Optional<GeoFeature> toFeature(Row row) {
        String id = row.getString(ID);
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }

        Geometry geometry;
        try {
            geometry = readGeometry(row);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            log.debug("Row '{}' has malformed geometry: {}", id, e.getMessage());
            return Optional.empty();
        }
        if (geometry == null || geometry.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Object> properties = new LinkedHashMap<>();
        for (Map.Entry<String, Object> field : row.asMap().entrySet()) {
            if (!GEOMETRY_FIELDS.contains(field.getKey())) {
                properties.put(field.getKey(), field.getValue());
            }
        }
        if (!properties.containsKey(SPECIES)) {
            properties.put(SPECIES, row.get(SPECIES_SCIENTIFIC_NAME));
        }

        return Optional.of(GeoFeature.builder()
                .id(id)
                .geometry(geometry)
                .properties(properties)
                .build());
    }

    private boolean matches(GeoFeature feature, GeoFilter filter) {
        if (filter.hasSpeciesFilter()) {
            Object species = feature.getProperties().get(SPECIES);
            if (!(species instanceof String) || !filter.getSpecies().contains(species)) {
                return false;
            }
        }

        if (filter.getBbox() != null) {
            Point point = representativePoint(feature.getGeometry());
            if (!filter.getBbox().contains(point.getX(), point.getY())) {
                return false;
            }
        }

        if (filter.hasDateFilter()) {
            Optional<LocalDate> date = IsoDates.tryParse(feature.getProperties().get(OBSERVED_AT));
            return date.isPresent() && filter.acceptsDate(date.get());
        }

        return true;
    }

    /**
     * The point itself for points, the centroid for every other geometry
     */
    static Point representativePoint(Geometry geometry) {
        if (geometry instanceof Point) {
            return (Point) geometry;
        }
        return geometry.getCentroid();
    }

    private Geometry readGeometry(Row row) throws JsonProcessingException {
        Object geometry = row.get(GEOMETRY);
        if (geometry instanceof String) {
            return GeoJsonGeometries.read(objectMapper.readTree((String) geometry), geometryFactory);
        }
        if (geometry instanceof Map) {
            return GeoJsonGeometries.read(objectMapper.valueToTree(geometry), geometryFactory);
        }

        Object coordinates = row.get(COORDINATES);
        if (coordinates == null) {
            throw new IllegalArgumentException("Row has no geometry");
        }
        String type = row.getString(GEOMETRY_TYPE);
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", type != null ? type : GeoJsonGeometries.POINT);
        node.set(COORDINATES, objectMapper.<JsonNode>valueToTree(coordinates));
        return GeoJsonGeometries.read(node, geometryFactory);
    }
}
