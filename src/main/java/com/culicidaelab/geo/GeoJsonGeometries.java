package com.culicidaelab.geo;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.MultiPoint;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

import java.io.IOException;

/**
 * Conversion between GeoJSON geometry objects and JTS geometries.
 * Positions are {@code [lon, lat]}; a third ordinate is kept as z.
 */
public final class GeoJsonGeometries {

    public static final String POINT = "Point";
    public static final String LINE_STRING = "LineString";
    public static final String POLYGON = "Polygon";
    public static final String MULTI_POINT = "MultiPoint";
    public static final String MULTI_LINE_STRING = "MultiLineString";
    public static final String MULTI_POLYGON = "MultiPolygon";
    public static final String GEOMETRY_COLLECTION = "GeometryCollection";

    private GeoJsonGeometries() {
    }

    /**
     * Build a geometry from a GeoJSON {@code {type, coordinates}} node
     *
     * @throws IllegalArgumentException if the node is not a well-formed GeoJSON geometry
     */
    public static Geometry read(JsonNode node, GeometryFactory factory) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Geometry must be a JSON object");
        }
        JsonNode typeNode = node.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new IllegalArgumentException("Geometry has no type");
        }
        String type = typeNode.asText();

        if (GEOMETRY_COLLECTION.equals(type)) {
            JsonNode members = requireArray(node.get("geometries"), "geometries");
            Geometry[] geometries = new Geometry[members.size()];
            for (int i = 0; i < members.size(); i++) {
                geometries[i] = read(members.get(i), factory);
            }
            return factory.createGeometryCollection(geometries);
        }

        JsonNode coordinates = requireArray(node.get("coordinates"), "coordinates");
        switch (type) {
            case POINT:
                return factory.createPoint(position(coordinates));
            case LINE_STRING:
                return factory.createLineString(positions(coordinates));
            case POLYGON:
                return polygon(coordinates, factory);
            case MULTI_POINT:
                return factory.createMultiPointFromCoords(positions(coordinates));
            case MULTI_LINE_STRING: {
                LineString[] lines = new LineString[coordinates.size()];
                for (int i = 0; i < coordinates.size(); i++) {
                    lines[i] = factory.createLineString(positions(requireArray(coordinates.get(i), "line")));
                }
                return factory.createMultiLineString(lines);
            }
            case MULTI_POLYGON: {
                Polygon[] polygons = new Polygon[coordinates.size()];
                for (int i = 0; i < coordinates.size(); i++) {
                    polygons[i] = polygon(requireArray(coordinates.get(i), "polygon"), factory);
                }
                return factory.createMultiPolygon(polygons);
            }
            default:
                throw new IllegalArgumentException("Unsupported geometry type: " + type);
        }
    }

    /**
     * Write a geometry as a GeoJSON {@code {type, coordinates}} object
     */
    public static void write(Geometry geometry, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", geometry.getGeometryType());

        if (geometry instanceof Point) {
            gen.writeFieldName("coordinates");
            writePosition(((Point) geometry).getCoordinate(), gen);
        } else if (geometry instanceof LineString) {
            gen.writeFieldName("coordinates");
            writePositions(geometry.getCoordinates(), gen);
        } else if (geometry instanceof Polygon) {
            gen.writeFieldName("coordinates");
            writePolygon((Polygon) geometry, gen);
        } else if (geometry instanceof MultiPoint) {
            gen.writeFieldName("coordinates");
            writePositions(geometry.getCoordinates(), gen);
        } else if (geometry instanceof MultiLineString) {
            gen.writeFieldName("coordinates");
            gen.writeStartArray();
            for (int i = 0; i < geometry.getNumGeometries(); i++) {
                writePositions(geometry.getGeometryN(i).getCoordinates(), gen);
            }
            gen.writeEndArray();
        } else if (geometry instanceof MultiPolygon) {
            gen.writeFieldName("coordinates");
            gen.writeStartArray();
            for (int i = 0; i < geometry.getNumGeometries(); i++) {
                writePolygon((Polygon) geometry.getGeometryN(i), gen);
            }
            gen.writeEndArray();
        } else if (geometry instanceof GeometryCollection) {
            gen.writeFieldName("geometries");
            gen.writeStartArray();
            for (int i = 0; i < geometry.getNumGeometries(); i++) {
                write(geometry.getGeometryN(i), gen);
            }
            gen.writeEndArray();
        }

        gen.writeEndObject();
    }

    private static Polygon polygon(JsonNode rings, GeometryFactory factory) {
        if (rings.size() == 0) {
            return factory.createPolygon();
        }
        LinearRing shell = factory.createLinearRing(positions(requireArray(rings.get(0), "ring")));
        LinearRing[] holes = new LinearRing[rings.size() - 1];
        for (int i = 1; i < rings.size(); i++) {
            holes[i - 1] = factory.createLinearRing(positions(requireArray(rings.get(i), "ring")));
        }
        return factory.createPolygon(shell, holes);
    }

    private static Coordinate[] positions(JsonNode array) {
        Coordinate[] coordinates = new Coordinate[array.size()];
        for (int i = 0; i < array.size(); i++) {
            coordinates[i] = position(requireArray(array.get(i), "position"));
        }
        return coordinates;
    }

    private static Coordinate position(JsonNode array) {
        if (array.size() < 2 || array.size() > 3) {
            throw new IllegalArgumentException("Position must have two or three numbers");
        }
        for (JsonNode ordinate : array) {
            if (!ordinate.isNumber()) {
                throw new IllegalArgumentException("Position ordinate is not a number: " + ordinate);
            }
        }
        double x = array.get(0).asDouble();
        double y = array.get(1).asDouble();
        return array.size() == 3 ? new Coordinate(x, y, array.get(2).asDouble()) : new Coordinate(x, y);
    }

    private static JsonNode requireArray(JsonNode node, String name) {
        if (node == null || !node.isArray()) {
            throw new IllegalArgumentException("Geometry " + name + " must be an array");
        }
        return node;
    }

    private static void writePolygon(Polygon polygon, JsonGenerator gen) throws IOException {
        gen.writeStartArray();
        if (!polygon.isEmpty()) {
            writePositions(polygon.getExteriorRing().getCoordinates(), gen);
            for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
                writePositions(polygon.getInteriorRingN(i).getCoordinates(), gen);
            }
        }
        gen.writeEndArray();
    }

    private static void writePositions(Coordinate[] coordinates, JsonGenerator gen) throws IOException {
        gen.writeStartArray();
        for (Coordinate coordinate : coordinates) {
            writePosition(coordinate, gen);
        }
        gen.writeEndArray();
    }

    private static void writePosition(Coordinate coordinate, JsonGenerator gen) throws IOException {
        gen.writeStartArray();
        if (coordinate != null) {
            gen.writeNumber(coordinate.x);
            gen.writeNumber(coordinate.y);
            if (!Double.isNaN(coordinate.getZ())) {
                gen.writeNumber(coordinate.getZ());
            }
        }
        gen.writeEndArray();
    }
}
