package com.culicidaelab.service;

import com.culicidaelab.localization.CacheDomain;

import java.util.Map;

public interface LocalizationService {

    /**
     * Re-read every loaded translation domain and swap it in atomically
     *
     * @return entry count per domain after the reload
     */
    Map<CacheDomain, Integer> reload();
}
