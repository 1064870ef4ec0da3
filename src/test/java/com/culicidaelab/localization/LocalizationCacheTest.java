package com.culicidaelab.localization;

import com.culicidaelab.store.DocumentStore;
import com.culicidaelab.store.StoreException;
import com.culicidaelab.store.memory.InMemoryDocumentStore;
import com.culicidaelab.store.memory.InMemoryTable;
import com.culicidaelab.store.Row;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class LocalizationCacheTest {

    private static final List<String> LANGUAGES = List.of("en", "ru");

    private InMemoryDocumentStore store;
    private InMemoryTable regions;
    private LocalizationCache cache;

    @BeforeEach
    public void setUp() {
        store = new InMemoryDocumentStore();
        regions = store.createTable("regions");
        regions.insert(new Row().put("id", "eu").put("name_en", "Europe").put("name_ru", "Европа"));
        regions.insert(new Row().put("id", "af").put("name_en", "Africa"));
        regions.insert(new Row().put("id", "xx"));
        regions.insert(new Row().put("id", "bl").put("name_en", "Blank").put("name_ru", "  "));
        regions.insert(new Row().put("id", "eu").put("name_en", "Duplicate"));
        regions.insert(new Row().put("name_en", "No id"));

        cache = new LocalizationCache(store, "en");
        cache.load(CacheDomain.REGION, LANGUAGES);
    }

    @Test
    public void testResolveFallbackChain() {
        assertEquals("Европа", cache.resolve(CacheDomain.REGION, "ru", "eu"));
        assertEquals("Africa", cache.resolve(CacheDomain.REGION, "ru", "af"));
        assertEquals("xx", cache.resolve(CacheDomain.REGION, "en", "xx"));
        assertEquals("Blank", cache.resolve(CacheDomain.REGION, "ru", "bl"));
    }

    @Test
    public void testFirstDuplicateWinsAndRowsWithoutIdAreSkipped() {
        assertEquals(List.of("eu", "af", "xx", "bl"), cache.ids(CacheDomain.REGION));
        assertEquals("Europe", cache.resolve(CacheDomain.REGION, "en", "eu"));
    }

    @Test
    public void testEveryLoadedLabelIsNonEmpty() {
        for (LocalizedEntry entry : cache.entries(CacheDomain.REGION)) {
            for (String language : LANGUAGES) {
                String label = cache.resolve(CacheDomain.REGION, language, entry.getId());
                assertNotNull(label);
                assertFalse(label.isBlank());
            }
        }
    }

    @Test
    public void testUnsupportedLanguageAndUnknownIdReturnId() {
        assertEquals("eu", cache.resolve(CacheDomain.REGION, "de", "eu"));
        assertEquals("nowhere", cache.resolve(CacheDomain.REGION, "en", "nowhere"));
    }

    @Test
    public void testDomainNeverLoaded() {
        assertFalse(cache.isLoaded(CacheDomain.DATA_SOURCE));
        assertEquals(0, cache.size(CacheDomain.DATA_SOURCE));
        assertThrows(LocalizationNotLoadedException.class,
                () -> cache.resolve(CacheDomain.DATA_SOURCE, "en", "gbif"));
        assertThrows(LocalizationNotLoadedException.class, () -> cache.ids(CacheDomain.DATA_SOURCE));
    }

    @Test
    public void testMissingTableLoadsAsEmptyDomain() {
        cache.load(CacheDomain.DATA_SOURCE, LANGUAGES);

        assertTrue(cache.isLoaded(CacheDomain.DATA_SOURCE));
        assertFalse(cache.isReadable(CacheDomain.DATA_SOURCE));
        assertTrue(cache.ids(CacheDomain.DATA_SOURCE).isEmpty());
        assertEquals("gbif", cache.resolve(CacheDomain.DATA_SOURCE, "en", "gbif"));
    }

    @Test
    public void testStoreFailureLoadsAsEmptyDomain() {
        DocumentStore failing = mock(DocumentStore.class);
        when(failing.openTable("data_sources")).thenThrow(new StoreException("connection refused"));
        LocalizationCache failingCache = new LocalizationCache(failing, "en");

        failingCache.load(CacheDomain.DATA_SOURCE, LANGUAGES);

        assertFalse(failingCache.isReadable(CacheDomain.DATA_SOURCE));
        assertEquals(0, failingCache.size(CacheDomain.DATA_SOURCE));
    }

    @Test
    public void testReloadSwapsSnapshot() {
        List<LocalizedEntry> before = cache.entries(CacheDomain.REGION);
        regions.insert(new Row().put("id", "as").put("name_en", "Asia").put("name_ru", "Азия"));

        cache.reload();

        assertEquals(4, before.size());
        assertEquals(5, cache.size(CacheDomain.REGION));
        assertEquals("Азия", cache.resolve(CacheDomain.REGION, "ru", "as"));
        assertEquals(LANGUAGES, List.copyOf(cache.loadedLanguages(CacheDomain.REGION)));
    }

    @Test
    public void testFailedReloadKeepsPreviousTranslations() {
        store.drop("regions");

        cache.reload();

        assertEquals("Европа", cache.resolve(CacheDomain.REGION, "ru", "eu"));
        assertEquals(4, cache.size(CacheDomain.REGION));
    }
}
