package com.culicidaelab.store.memory;

import com.culicidaelab.store.DocumentStore;
import com.culicidaelab.store.TableHandle;
import com.culicidaelab.store.TableNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Document store keeping every table in memory.
 * Tables must be created before they can be opened.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final Map<String, InMemoryTable> tables = new ConcurrentHashMap<>();

    @Override
    public TableHandle openTable(String name) {
        InMemoryTable table = tables.get(name);
        if (table == null) {
            throw new TableNotFoundException(name);
        }
        return table;
    }

    /**
     * Create a table if it does not exist yet and return it
     */
    public InMemoryTable createTable(String name) {
        return tables.computeIfAbsent(name, key -> {
            logger.debug("Created in-memory table '{}'", key);
            return new InMemoryTable(key);
        });
    }

    public Set<String> tableNames() {
        return new TreeSet<>(tables.keySet());
    }

    /**
     * Drop a table and all its rows
     */
    public void drop(String name) {
        if (tables.remove(name) != null) {
            logger.info("Dropped in-memory table '{}'", name);
        }
    }
}
