package com.culicidaelab.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Map layers served by the geo endpoint
 */
public enum LayerType {
    DISTRIBUTION("distribution"),
    OBSERVATIONS("observations"),
    MODELED("modeled"),
    BREEDING_SITES("breeding_sites");

    private final String path;

    LayerType(String path) {
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    public static Optional<LayerType> fromPath(String path) {
        if (path == null) {
            return Optional.empty();
        }
        String normalized = path.trim().toLowerCase(Locale.ROOT);
        for (LayerType type : values()) {
            if (type.path.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
