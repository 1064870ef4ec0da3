package com.culicidaelab.store.loader;

import com.culicidaelab.store.QueryPredicate;
import com.culicidaelab.store.Row;
import com.culicidaelab.store.memory.InMemoryDocumentStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SeedDataLoaderTest {

    private InMemoryDocumentStore store;
    private SeedDataLoader loader;

    @BeforeEach
    public void setUp() {
        store = new InMemoryDocumentStore();
        loader = new SeedDataLoader(store, new ObjectMapper());
    }

    @Test
    public void testLoadSeedFile() {
        LoadResult result = loader.load(new ClassPathResource("seed/test-catalog.json"));

        assertTrue(result.isSuccess(), result.getMessage());
        assertEquals(14, result.getRecordsLoaded());
        assertEquals(3, store.openTable("regions").count(null));
        assertEquals(4, store.openTable("observations").count(null));

        Row observation = store.openTable("observations")
                .query(QueryPredicate.eq("id", "11111111-1111-4111-8111-111111111111")).get(0);
        assertEquals(List.of(10.0, 20.0), observation.get("coordinates"));
    }

    @Test
    public void testMissingSeedStillCreatesCatalogTables() {
        LoadResult result = loader.load(new ClassPathResource("seed/does-not-exist.json"));

        assertFalse(result.isSuccess());
        assertTrue(store.tableNames().containsAll(SeedDataLoader.CATALOG_TABLES));
        assertEquals(0, store.openTable("species").count(null));
    }

    @Test
    public void testNonArrayEntriesAndNonObjectRowsAreSkipped() {
        String json = "{\"species\": [{\"id\": \"a\"}, 42], \"version\": \"1\"}";

        LoadResult result = loader.load(new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8)));

        assertTrue(result.isSuccess());
        assertEquals(1, result.getRecordsLoaded());
        assertFalse(store.tableNames().contains("version"));
    }

    @Test
    public void testMalformedJsonFails() {
        LoadResult result = loader.load(new ByteArrayResource("{not json".getBytes(StandardCharsets.UTF_8)));

        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().startsWith("Failed to load seed"));
    }
}
