package com.culicidaelab.localization;

/**
 * A label was requested from a cache domain whose load never ran
 */
public class LocalizationNotLoadedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public LocalizationNotLoadedException(CacheDomain domain) {
        super("Localization domain " + domain + " has not been loaded");
    }
}
