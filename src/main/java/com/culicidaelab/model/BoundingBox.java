package com.culicidaelab.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.locationtech.jts.geom.Envelope;

/**
 * Axis-aligned lon/lat rectangle, inclusive on all four edges
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BoundingBox {
    private double minLon;
    private double minLat;
    private double maxLon;
    private double maxLat;

    /**
     * Parse {@code minLon,minLat,maxLon,maxLat}
     *
     * @throws IllegalArgumentException if the text is not four finite numbers
     *         or min exceeds max on either axis
     */
    public static BoundingBox parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("bbox must not be empty");
        }
        String[] parts = text.split(",");
        if (parts.length != 4) {
            throw new IllegalArgumentException("bbox must be minLon,minLat,maxLon,maxLat: " + text);
        }
        double[] values = new double[4];
        for (int i = 0; i < 4; i++) {
            try {
                values[i] = Double.parseDouble(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("bbox value is not a number: " + parts[i].trim());
            }
            if (!Double.isFinite(values[i])) {
                throw new IllegalArgumentException("bbox value is not finite: " + parts[i].trim());
            }
        }
        if (values[0] > values[2] || values[1] > values[3]) {
            throw new IllegalArgumentException("bbox min must not exceed max: " + text);
        }
        return new BoundingBox(values[0], values[1], values[2], values[3]);
    }

    public boolean contains(double lon, double lat) {
        return toEnvelope().covers(lon, lat);
    }

    public Envelope toEnvelope() {
        return new Envelope(minLon, maxLon, minLat, maxLat);
    }
}
