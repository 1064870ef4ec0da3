package com.culicidaelab.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.UUID;

/**
 * Field observation of mosquito specimens at one point
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Observation {

    private UUID id;

    @NotBlank
    private String speciesScientificName;

    @NotNull
    @Positive
    private Integer count;

    @NotNull
    @Valid
    private Location location;

    @NotBlank
    private String observedAt;

    private String notes;

    private String userId;

    private Integer locationAccuracyM;

    // Either a plain string or structured JSON
    private Object dataSource;

    private String imageFilename;

    private String modelId;

    @DecimalMin(value = "0.0")
    @DecimalMax(value = "1.0")
    private Double confidence;

    private Map<String, Object> metadata;
}
