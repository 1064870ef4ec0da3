package com.culicidaelab.localization;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One translated record of a cache domain: canonical id plus its label per language
 */
@Value
@Builder
public class LocalizedEntry {

    String id;

    @Singular
    Map<String, String> labels;

    public String label(String language) {
        return labels.get(language);
    }
}
