package com.culicidaelab.localization;

import com.culicidaelab.store.DocumentStore;
import com.culicidaelab.store.Row;
import com.culicidaelab.store.StoreException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-mostly translation cache for regions and data sources.
 *
 * <p>Each domain is read from its backing table once by {@link #load} and served from memory
 * afterwards. The cache publishes an immutable snapshot; {@link #load} and {@link #reload}
 * build a new snapshot and swap the reference, so readers never lock and never observe a
 * partially built table. Loads are expected from a single thread during startup or from an
 * explicit reload.
 *
 * <p>Resolution order for a label is requested language, default language, raw id.
 */
@Slf4j
public class LocalizationCache {

    private static final String ID_COLUMN = "id";
    private static final String NAME_PREFIX = "name";

    private final DocumentStore store;
    private final String defaultLanguage;

    private volatile Map<CacheDomain, DomainTable> snapshot = Collections.emptyMap();

    public LocalizationCache(DocumentStore store, String defaultLanguage) {
        this.store = store;
        this.defaultLanguage = defaultLanguage;
    }

    /**
     * Read all rows of the domain's table and publish labels for each supported language.
     * A table that cannot be read is published as an empty domain.
     */
    public synchronized void load(CacheDomain domain, Collection<String> supportedLanguages) {
        Set<String> languages = new LinkedHashSet<>(supportedLanguages);
        DomainTable table = readDomain(domain, languages);
        if (table == null) {
            table = DomainTable.unreadable(languages);
        }

        Map<CacheDomain, DomainTable> next = copySnapshot();
        next.put(domain, table);
        snapshot = Collections.unmodifiableMap(next);
    }

    /**
     * Re-read every loaded domain with the languages it was loaded with and swap the whole
     * snapshot at once. A domain whose table cannot be read keeps its previous contents.
     */
    public synchronized void reload() {
        Map<CacheDomain, DomainTable> current = snapshot;
        Map<CacheDomain, DomainTable> next = new EnumMap<>(CacheDomain.class);

        for (Map.Entry<CacheDomain, DomainTable> entry : current.entrySet()) {
            DomainTable fresh = readDomain(entry.getKey(), entry.getValue().languages);
            if (fresh == null) {
                log.warn("Keeping previous translations for {} after failed reload", entry.getKey());
                fresh = entry.getValue();
            }
            next.put(entry.getKey(), fresh);
        }

        snapshot = Collections.unmodifiableMap(next);
        log.info("Reloaded localization cache for domains {}", next.keySet());
    }

    /**
     * Display label of an id.
     *
     * @return the cached label, or {@code id} itself when the language was not loaded or the
     *         id is unknown
     * @throws LocalizationNotLoadedException if the domain was never loaded
     */
    public String resolve(CacheDomain domain, String language, String id) {
        Map<String, String> labels = requireTable(domain).labelsByLanguage.get(language);
        if (labels == null) {
            return id;
        }
        String label = labels.get(id);
        return label != null ? label : id;
    }

    /**
     * Canonical ids of a domain in load order
     */
    public List<String> ids(CacheDomain domain) {
        List<String> ids = new ArrayList<>();
        for (LocalizedEntry entry : requireTable(domain).entries) {
            ids.add(entry.getId());
        }
        return ids;
    }

    public List<LocalizedEntry> entries(CacheDomain domain) {
        return requireTable(domain).entries;
    }

    public boolean isLoaded(CacheDomain domain) {
        return snapshot.containsKey(domain);
    }

    /**
     * Whether the domain was loaded and its table could be read
     */
    public boolean isReadable(CacheDomain domain) {
        DomainTable table = snapshot.get(domain);
        return table != null && table.readable;
    }

    public Set<String> loadedLanguages(CacheDomain domain) {
        return requireTable(domain).languages;
    }

    public int size(CacheDomain domain) {
        DomainTable table = snapshot.get(domain);
        return table != null ? table.entries.size() : 0;
    }

    public String getDefaultLanguage() {
        return defaultLanguage;
    }

    private DomainTable requireTable(CacheDomain domain) {
        DomainTable table = snapshot.get(domain);
        if (table == null) {
            throw new LocalizationNotLoadedException(domain);
        }
        return table;
    }

    private Map<CacheDomain, DomainTable> copySnapshot() {
        Map<CacheDomain, DomainTable> next = new EnumMap<>(CacheDomain.class);
        next.putAll(snapshot);
        return next;
    }

    /**
     * @return the domain table, or null if the backing table could not be read
     */
    private DomainTable readDomain(CacheDomain domain, Set<String> languages) {
        log.info("Loading {} translations from table '{}' for languages {}",
                domain, domain.getTableName(), languages);

        List<Row> rows;
        try {
            rows = store.openTable(domain.getTableName()).query(null);
        } catch (StoreException e) {
            log.error("Failed to load {} translations: {}", domain, e.getMessage(), e);
            return null;
        }

        Map<String, LocalizedEntry> entries = new LinkedHashMap<>();
        for (Row row : rows) {
            String id = row.getString(ID_COLUMN);
            if (id == null || id.isBlank()) {
                continue;
            }
            if (entries.containsKey(id)) {
                log.warn("Duplicate {} id '{}' ignored", domain, id);
                continue;
            }

            String fallbackLabel = row.getString(LabelFallback.column(NAME_PREFIX, defaultLanguage));
            LocalizedEntry.LocalizedEntryBuilder entry = LocalizedEntry.builder().id(id);
            for (String language : languages) {
                String requested = row.getString(LabelFallback.column(NAME_PREFIX, language));
                entry.label(language, LabelFallback.resolve(requested, fallbackLabel, id));
            }
            entries.put(id, entry.build());
        }

        DomainTable table = DomainTable.of(languages, new ArrayList<>(entries.values()));
        log.info("Loaded {} {} entries", table.entries.size(), domain);
        return table;
    }

    /**
     * Immutable per-domain view: entries in load order and id-to-label maps per language
     */
    private static final class DomainTable {

        private final Set<String> languages;
        private final List<LocalizedEntry> entries;
        private final Map<String, Map<String, String>> labelsByLanguage;
        private final boolean readable;

        private DomainTable(Set<String> languages, List<LocalizedEntry> entries, boolean readable) {
            this.languages = Collections.unmodifiableSet(new LinkedHashSet<>(languages));
            this.entries = Collections.unmodifiableList(entries);
            this.readable = readable;

            Map<String, Map<String, String>> byLanguage = new LinkedHashMap<>();
            for (String language : languages) {
                Map<String, String> labels = new LinkedHashMap<>();
                for (LocalizedEntry entry : entries) {
                    labels.put(entry.getId(), entry.label(language));
                }
                byLanguage.put(language, Collections.unmodifiableMap(labels));
            }
            this.labelsByLanguage = Collections.unmodifiableMap(byLanguage);
        }

        static DomainTable of(Set<String> languages, List<LocalizedEntry> entries) {
            return new DomainTable(languages, entries, true);
        }

        static DomainTable unreadable(Set<String> languages) {
            return new DomainTable(languages, Collections.emptyList(), false);
        }
    }
}
