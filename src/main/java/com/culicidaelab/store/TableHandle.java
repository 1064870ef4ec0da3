package com.culicidaelab.store;

import java.util.List;

/**
 * Handle to one table of the document store
 */
public interface TableHandle {

    /**
     * Table name
     */
    String getName();

    /**
     * Query rows matching the predicate (null matches all), in the table's stable
     * insertion order, restricted to the window
     */
    List<Row> query(QueryPredicate predicate, QueryWindow window);

    /**
     * Query all rows matching the predicate
     */
    default List<Row> query(QueryPredicate predicate) {
        return query(predicate, QueryWindow.unbounded());
    }

    /**
     * Count rows matching the predicate (null counts all)
     */
    long count(QueryPredicate predicate);

    /**
     * Append one row
     */
    void insert(Row row);
}
