package com.culicidaelab.localization;

import com.culicidaelab.store.Row;

import java.util.List;

/**
 * Language fallback chain: requested language, then default language, then a last resort.
 * Blank labels count as missing.
 */
public final class LabelFallback {

    private LabelFallback() {
    }

    /**
     * Resolve a label through the three-step chain
     *
     * @param requested  label in the requested language, may be null
     * @param fallback   label in the default language, may be null
     * @param lastResort value used when neither label is present, may be null
     */
    public static String resolve(String requested, String fallback, String lastResort) {
        if (isPresent(requested)) {
            return requested;
        }
        if (isPresent(fallback)) {
            return fallback;
        }
        return lastResort;
    }

    /**
     * Column holding a localized field, e.g. {@code name_en}
     */
    public static String column(String prefix, String language) {
        return prefix + "_" + language;
    }

    /**
     * Localized text field of a row with no last resort
     */
    public static String localizedField(Row row, String prefix, String language, String defaultLanguage) {
        return resolve(row.getString(column(prefix, language)),
                row.getString(column(prefix, defaultLanguage)),
                null);
    }

    /**
     * Localized list field of a row; empty when neither language has values
     */
    public static List<String> localizedList(Row row, String prefix, String language, String defaultLanguage) {
        List<String> requested = row.getStringList(column(prefix, language));
        if (!requested.isEmpty()) {
            return requested;
        }
        return row.getStringList(column(prefix, defaultLanguage));
    }

    private static boolean isPresent(String label) {
        return label != null && !label.isBlank();
    }
}
