package com.culicidaelab.store;

public class TableNotFoundException extends StoreException {

    private static final long serialVersionUID = 1L;

    public TableNotFoundException(String table) {
        super("Table '" + table + "' not found");
    }
}
