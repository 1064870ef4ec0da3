package com.culicidaelab.config.serializer;

import com.culicidaelab.geo.GeoJsonGeometries;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import java.io.IOException;

/**
 * Reads GeoJSON geometry objects into JTS geometries
 */
public class GeometryDeserializer extends JsonDeserializer<Geometry> {

    private final GeometryFactory geometryFactory;

    public GeometryDeserializer(GeometryFactory geometryFactory) {
        this.geometryFactory = geometryFactory;
    }

    @Override
    public Geometry deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);

        if (node == null || node.isNull()) {
            return null;
        }

        try {
            return GeoJsonGeometries.read(node, geometryFactory);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid GeoJSON geometry: " + e.getMessage(), e);
        }
    }
}
