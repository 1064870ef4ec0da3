package com.culicidaelab.service;

import com.culicidaelab.model.FilterOptions;

/**
 * Composes the localized options shown in the map filter panel
 */
public interface FilterOptionsService {

    /**
     * Species names sorted ascending; regions and data sources as {@code {id, name}}
     * pairs sorted by localized name, then id. Each list degrades to empty on its own
     * when its source cannot be read.
     */
    FilterOptions getFilterOptions(String language);
}
