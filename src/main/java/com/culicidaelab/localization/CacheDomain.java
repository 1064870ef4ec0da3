package com.culicidaelab.localization;

/**
 * Translation domains held by the {@link LocalizationCache}, each backed by one table
 */
public enum CacheDomain {

    REGION("regions"),
    DATA_SOURCE("data_sources");

    private final String tableName;

    CacheDomain(String tableName) {
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
