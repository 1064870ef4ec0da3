package com.culicidaelab.service.impl;

import com.culicidaelab.config.CulicidaeLabProperties;

/**
 * Request normalization and image URLs shared by the catalog services
 */
final class CatalogSupport {

    private CatalogSupport() {
    }

    static String language(String requested, CulicidaeLabProperties properties) {
        return requested == null || requested.isBlank() ? properties.getDefaultLanguage() : requested.trim();
    }

    /**
     * Requested limit, the default when absent or not positive, capped at the maximum
     */
    static int limit(Integer requested, CulicidaeLabProperties properties) {
        CulicidaeLabProperties.Catalog catalog = properties.getCatalog();
        if (requested == null || requested <= 0) {
            return catalog.getDefaultLimit();
        }
        return Math.min(requested, catalog.getMaxLimit());
    }

    static String speciesImage(CulicidaeLabProperties properties, String id, String variant) {
        return imageBase(properties) + "/species/" + id + "/" + variant + ".jpg";
    }

    static String diseaseImage(CulicidaeLabProperties properties, String id) {
        return imageBase(properties) + "/diseases/" + id + "/detail.jpg";
    }

    private static String imageBase(CulicidaeLabProperties properties) {
        String base = properties.getStaticUrlBase() != null ? properties.getStaticUrlBase() : "";
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/static/images";
    }
}
