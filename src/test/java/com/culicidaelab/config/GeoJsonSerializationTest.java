package com.culicidaelab.config;

import com.culicidaelab.model.FeatureCollection;
import com.culicidaelab.model.GeoFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GeoJSON wire shape produced by the application's ObjectMapper
 */
public class GeoJsonSerializationTest {

    private GeometryFactory geometryFactory;
    private ObjectMapper objectMapper;

    @BeforeEach
    public void setUp() {
        CulicidaeLabConfiguration configuration = new CulicidaeLabConfiguration();
        geometryFactory = configuration.geometryFactory();
        objectMapper = configuration.objectMapper(geometryFactory);
    }

    @Test
    public void testFeatureCollectionShape() throws Exception {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("id", "obs-1");
        properties.put("species", "Aedes aegypti");
        GeoFeature feature = GeoFeature.builder()
                .id("obs-1")
                .geometry(geometryFactory.createPoint(new Coordinate(10.0, 20.0)))
                .properties(properties)
                .build();
        FeatureCollection collection = new FeatureCollection(new ArrayList<>(List.of(feature)));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(collection));

        assertEquals("FeatureCollection", json.get("type").asText());
        JsonNode first = json.get("features").get(0);
        assertEquals("Feature", first.get("type").asText());
        assertFalse(first.has("id"));
        assertEquals("obs-1", first.get("properties").get("id").asText());
        assertEquals("Point", first.get("geometry").get("type").asText());
        assertEquals(10.0, first.get("geometry").get("coordinates").get(0).asDouble());
        assertEquals(20.0, first.get("geometry").get("coordinates").get(1).asDouble());
    }

    @Test
    public void testGeometryReadBack() throws Exception {
        String json = "{\"type\":\"Polygon\",\"coordinates\":[[[0,0],[2,0],[2,2],[0,2],[0,0]]]}";

        Geometry geometry = objectMapper.readValue(json, Geometry.class);

        assertEquals("Polygon", geometry.getGeometryType());
        assertEquals(4.0, geometry.getArea());
    }

    @Test
    public void testEmptyCollection() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(FeatureCollection.empty()));

        assertEquals(0, json.get("features").size());
    }
}
