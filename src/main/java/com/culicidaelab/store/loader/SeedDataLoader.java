package com.culicidaelab.store.loader;

import com.culicidaelab.store.Row;
import com.culicidaelab.store.memory.InMemoryDocumentStore;
import com.culicidaelab.store.memory.InMemoryTable;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Loads catalog tables into an {@link InMemoryDocumentStore} from a JSON document
 * shaped as {@code { "table_name": [ {row}, ... ] }}
 */
public class SeedDataLoader {

    private static final Logger logger = LoggerFactory.getLogger(SeedDataLoader.class);

    /**
     * Tables the catalog always expects, created even when the seed omits them
     */
    public static final List<String> CATALOG_TABLES =
            List.of("regions", "data_sources", "species", "diseases", "observations");

    private static final int BATCH_SIZE = 1000;

    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private final InMemoryDocumentStore store;
    private final ObjectMapper objectMapper;

    public SeedDataLoader(InMemoryDocumentStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    /**
     * Create the catalog tables without loading any rows
     */
    public void createCatalogTables() {
        CATALOG_TABLES.forEach(store::createTable);
    }

    /**
     * Load every table found in the resource
     */
    public LoadResult load(Resource resource) {
        createCatalogTables();
        if (resource == null || !resource.exists()) {
            String location = resource != null ? resource.getDescription() : "null";
            return new LoadResult(false, 0, 0, "Seed not found: " + location);
        }

        logger.info("Starting seed data load from: {}", resource.getDescription());
        long startTime = System.currentTimeMillis();

        try (InputStream in = resource.getInputStream()) {
            return load(objectMapper.readTree(in), startTime);
        } catch (IOException e) {
            long endTime = System.currentTimeMillis();
            String error = "Failed to load seed: " + e.getMessage();
            logger.error(error, e);
            return new LoadResult(false, 0, endTime - startTime, error);
        }
    }

    private LoadResult load(JsonNode root, long startTime) {
        long totalRecords = 0;

        Iterator<Map.Entry<String, JsonNode>> tablesIterator = root.fields();
        while (tablesIterator.hasNext()) {
            Map.Entry<String, JsonNode> tableEntry = tablesIterator.next();
            String tableName = tableEntry.getKey();
            JsonNode rowsArray = tableEntry.getValue();

            if (!rowsArray.isArray()) {
                logger.warn("Skipping seed entry '{}': expected an array of rows", tableName);
                continue;
            }

            InMemoryTable table = store.createTable(tableName);
            List<Row> batch = new ArrayList<>();

            for (JsonNode rowNode : rowsArray) {
                if (!rowNode.isObject()) {
                    logger.warn("Skipping non-object row in table '{}'", tableName);
                    continue;
                }
                batch.add(Row.of(objectMapper.convertValue(rowNode, ROW_TYPE)));
                totalRecords++;

                if (batch.size() >= BATCH_SIZE) {
                    table.insertAll(batch);
                    batch.clear();
                }
            }

            if (!batch.isEmpty()) {
                table.insertAll(batch);
            }
            logger.info("Seeded table '{}' with {} rows", tableName, table.size());
        }

        long endTime = System.currentTimeMillis();
        String message = String.format("Successfully loaded %d records from seed in %dms",
                                      totalRecords, (endTime - startTime));
        logger.info(message);

        return new LoadResult(true, totalRecords, endTime - startTime, message);
    }
}
