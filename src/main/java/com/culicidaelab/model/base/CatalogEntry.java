package com.culicidaelab.model.base;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Base class for localized catalog entries (species, diseases).
 * Holds the canonical id and the image URL built for the entry.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public abstract class CatalogEntry {

    /**
     * Canonical id
     */
    private String id;

    /**
     * Absolute image URL under the static URL base
     */
    private String imageUrl;
}
