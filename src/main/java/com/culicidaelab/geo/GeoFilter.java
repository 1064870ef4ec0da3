package com.culicidaelab.geo;

import com.culicidaelab.model.BoundingBox;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Set;

/**
 * Predicates applied by {@link GeoFeatureFilterEngine}; every part is optional
 * and the parts are combined with AND
 */
@Value
@Builder
public class GeoFilter {

    /**
     * Accepted scientific names, exact and case-sensitive; empty accepts all
     */
    @Builder.Default
    Set<String> species = Collections.emptySet();

    BoundingBox bbox;

    LocalDate startDate;

    LocalDate endDate;

    public static GeoFilter none() {
        return GeoFilter.builder().build();
    }

    public boolean hasSpeciesFilter() {
        return species != null && !species.isEmpty();
    }

    public boolean hasDateFilter() {
        return startDate != null || endDate != null;
    }

    public boolean acceptsDate(LocalDate date) {
        return (startDate == null || !date.isBefore(startDate))
                && (endDate == null || !date.isAfter(endDate));
    }
}
