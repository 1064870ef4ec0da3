package com.culicidaelab.config.serializer;

import com.culicidaelab.geo.GeoJsonGeometries;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import org.locationtech.jts.geom.Geometry;

import java.io.IOException;

/**
 * Writes JTS geometries as GeoJSON geometry objects
 */
public class GeometrySerializer extends JsonSerializer<Geometry> {

    @Override
    public void serialize(Geometry geometry, JsonGenerator gen, SerializerProvider serializers)
            throws IOException {
        if (geometry == null) {
            gen.writeNull();
            return;
        }
        GeoJsonGeometries.write(geometry, gen);
    }
}
