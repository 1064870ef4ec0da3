package com.culicidaelab.config;

import com.culicidaelab.config.serializer.GeometryDeserializer;
import com.culicidaelab.config.serializer.GeometrySerializer;
import com.culicidaelab.localization.CacheDomain;
import com.culicidaelab.localization.LocalizationCache;
import com.culicidaelab.store.DocumentStore;
import com.culicidaelab.store.loader.LoadResult;
import com.culicidaelab.store.loader.SeedDataLoader;
import com.culicidaelab.store.memory.InMemoryDocumentStore;
import com.culicidaelab.store.mongo.MongoDocumentStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Application wiring: JSON mapping, the document store backend and the localization cache
 */
@Slf4j
@Configuration
public class CulicidaeLabConfiguration {

    @Bean
    public GeometryFactory geometryFactory() {
        return new GeometryFactory();
    }

    @Bean
    public ObjectMapper objectMapper(GeometryFactory geometryFactory) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        // GeoJSON for JTS geometries
        SimpleModule geometryModule = new SimpleModule();
        geometryModule.addSerializer(Geometry.class, new GeometrySerializer());
        geometryModule.addDeserializer(Geometry.class, new GeometryDeserializer(geometryFactory));
        mapper.registerModule(geometryModule);

        return mapper;
    }

    @Bean
    public DocumentStore documentStore(CulicidaeLabProperties properties, ObjectMapper objectMapper,
                                       ResourceLoader resourceLoader) {
        CulicidaeLabProperties.Store storeProperties = properties.getStore();

        if (storeProperties.getType() == CulicidaeLabProperties.StoreType.MONGODB) {
            log.info("Using MongoDB document store, database '{}'", storeProperties.getMongo().getDatabase());
            return MongoDocumentStore.connect(storeProperties.getMongo().getUri(),
                    storeProperties.getMongo().getDatabase(), storeProperties.getQueryTimeoutMs());
        }

        log.info("Using in-memory document store");
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        SeedDataLoader loader = new SeedDataLoader(store, objectMapper);
        if (properties.getSeed().isEnabled()) {
            LoadResult result = loader.load(resourceLoader.getResource(properties.getSeed().getLocation()));
            if (result.isSuccess()) {
                log.info("Seed loaded: {}", result);
            } else {
                log.warn("Seed not loaded, starting with empty tables: {}", result.getMessage());
            }
        } else {
            loader.createCatalogTables();
        }
        return store;
    }

    /**
     * Built and fully loaded before any request handler can receive it
     */
    @Bean
    public LocalizationCache localizationCache(DocumentStore documentStore, CulicidaeLabProperties properties) {
        LocalizationCache cache = new LocalizationCache(documentStore, properties.getDefaultLanguage());
        for (CacheDomain domain : CacheDomain.values()) {
            cache.load(domain, properties.getSupportedLanguages());
        }
        return cache;
    }
}
