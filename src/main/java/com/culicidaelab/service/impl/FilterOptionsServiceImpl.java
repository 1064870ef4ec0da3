package com.culicidaelab.service.impl;

import com.culicidaelab.aspect.Timed;
import com.culicidaelab.localization.CacheDomain;
import com.culicidaelab.localization.LocalizationCache;
import com.culicidaelab.localization.LocalizationNotLoadedException;
import com.culicidaelab.model.FilterOption;
import com.culicidaelab.model.FilterOptions;
import com.culicidaelab.repository.SpeciesRepository;
import com.culicidaelab.service.FilterOptionsService;
import com.culicidaelab.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

@Service
public class FilterOptionsServiceImpl implements FilterOptionsService {

    private static final Logger logger = LoggerFactory.getLogger(FilterOptionsServiceImpl.class);

    private static final Comparator<FilterOption> BY_NAME_THEN_ID =
            Comparator.comparing(FilterOption::getName).thenComparing(FilterOption::getId);

    @Autowired
    private SpeciesRepository speciesRepository;

    @Autowired
    private LocalizationCache localizationCache;

    @Override
    @Timed("getFilterOptions")
    public FilterOptions getFilterOptions(String language) {
        return FilterOptions.builder()
                .species(speciesNames())
                .regions(options(CacheDomain.REGION, language))
                .dataSources(options(CacheDomain.DATA_SOURCE, language))
                .build();
    }

    private List<String> speciesNames() {
        try {
            TreeSet<String> names = new TreeSet<>();
            for (String name : speciesRepository.findScientificNames()) {
                if (name != null && !name.isBlank()) {
                    names.add(name);
                }
            }
            return new ArrayList<>(names);
        } catch (StoreException e) {
            logger.warn("Species names unavailable for filter options: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    private List<FilterOption> options(CacheDomain domain, String language) {
        List<String> ids;
        try {
            ids = localizationCache.ids(domain);
        } catch (LocalizationNotLoadedException e) {
            logger.error("Filter options for {} unavailable: {}", domain, e.getMessage());
            return Collections.emptyList();
        }

        List<FilterOption> options = new ArrayList<>(ids.size());
        for (String id : ids) {
            options.add(new FilterOption(id, localizationCache.resolve(domain, language, id)));
        }
        options.sort(BY_NAME_THEN_ID);
        return options;
    }
}
