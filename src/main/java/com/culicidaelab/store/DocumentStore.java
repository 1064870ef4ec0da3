package com.culicidaelab.store;

/**
 * Document store collaborator: a set of named tables holding untyped rows
 */
public interface DocumentStore {

    /**
     * Open a table by name
     *
     * @throws TableNotFoundException if the backend has no such table
     */
    TableHandle openTable(String name);
}
