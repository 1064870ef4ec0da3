package com.culicidaelab.service.impl;

import com.culicidaelab.aspect.Timed;
import com.culicidaelab.localization.CacheDomain;
import com.culicidaelab.localization.LocalizationCache;
import com.culicidaelab.service.LocalizationService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

@Service
public class LocalizationServiceImpl implements LocalizationService {

    @Autowired
    private LocalizationCache localizationCache;

    @Override
    @Timed(value = "reloadLocalization", logLevel = Timed.LogLevel.INFO)
    public Map<CacheDomain, Integer> reload() {
        localizationCache.reload();

        Map<CacheDomain, Integer> sizes = new EnumMap<>(CacheDomain.class);
        for (CacheDomain domain : CacheDomain.values()) {
            sizes.put(domain, localizationCache.size(domain));
        }
        return sizes;
    }
}
