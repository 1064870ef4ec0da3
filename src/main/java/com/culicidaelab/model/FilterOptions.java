package com.culicidaelab.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

/**
 * Localized options for the map filter panel
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FilterOptions {

    @Builder.Default
    private List<String> species = Collections.emptyList();

    @Builder.Default
    private List<FilterOption> regions = Collections.emptyList();

    @Builder.Default
    private List<FilterOption> dataSources = Collections.emptyList();
}
