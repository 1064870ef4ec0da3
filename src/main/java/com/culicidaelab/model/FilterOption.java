package com.culicidaelab.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Selectable filter value: canonical id and its localized name
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterOption {
    private String id;
    private String name;
}
