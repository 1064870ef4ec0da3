package com.culicidaelab.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

/**
 * Validated geo layer request
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeoQuery {

    private LayerType layerType;

    @Builder.Default
    private List<String> species = Collections.emptyList();

    private BoundingBox bbox;
    private LocalDate startDate;
    private LocalDate endDate;

    /**
     * Max rows read from the store, 0 or less for the configured default
     */
    private int limit;
}
