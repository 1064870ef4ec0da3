package com.culicidaelab.model;

import com.culicidaelab.model.base.CatalogEntry;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Mosquito-borne disease with localized text fields
 */
@Data
@SuperBuilder
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Disease extends CatalogEntry {

    private String name;
    private String description;
    private String symptoms;
    private String treatment;
    private String prevention;
    private String prevalence;

    /**
     * Ids of the species that transmit the disease
     */
    @Builder.Default
    private List<String> vectors = new ArrayList<>();
}
