package com.culicidaelab.store.memory;

import com.culicidaelab.store.QueryPredicate;
import com.culicidaelab.store.QueryWindow;
import com.culicidaelab.store.Row;
import com.culicidaelab.store.TableHandle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only in-memory table. Insertion order is the stable query order.
 */
public class InMemoryTable implements TableHandle {

    private final String name;

    private final List<Row> rows = new CopyOnWriteArrayList<>();

    InMemoryTable(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<Row> query(QueryPredicate predicate, QueryWindow window) {
        List<Row> matches = new ArrayList<>();
        for (Row row : rows) {
            if (predicate == null || predicate.matches(row)) {
                matches.add(row.copy());
            }
        }

        // Apply pagination
        int startIndex = Math.max(0, window.getOffset());
        if (startIndex >= matches.size()) {
            return Collections.emptyList();
        }
        int endIndex = window.isBounded()
                ? (int) Math.min(matches.size(), (long) startIndex + window.getLimit())
                : matches.size();

        return new ArrayList<>(matches.subList(startIndex, endIndex));
    }

    @Override
    public long count(QueryPredicate predicate) {
        if (predicate == null) {
            return rows.size();
        }
        return rows.stream().filter(predicate::matches).count();
    }

    @Override
    public void insert(Row row) {
        rows.add(row.copy());
    }

    /**
     * Append many rows at once
     */
    public void insertAll(List<Row> batch) {
        List<Row> copies = new ArrayList<>(batch.size());
        for (Row row : batch) {
            copies.add(row.copy());
        }
        rows.addAll(copies);
    }

    public int size() {
        return rows.size();
    }
}
