package com.culicidaelab.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings under the {@code culicidaelab} prefix
 */
@Data
@ConfigurationProperties(prefix = "culicidaelab")
public class CulicidaeLabProperties {

    private String defaultLanguage = "en";

    private List<String> supportedLanguages = new ArrayList<>(List.of("en", "ru"));

    /**
     * Base for species and disease image URLs, without trailing slash
     */
    private String staticUrlBase = "http://localhost:8000";

    private Store store = new Store();
    private Seed seed = new Seed();
    private Geo geo = new Geo();
    private Observations observations = new Observations();
    private Catalog catalog = new Catalog();

    public enum StoreType {
        MEMORY,
        MONGODB
    }

    @Data
    public static class Store {
        private StoreType type = StoreType.MEMORY;
        private long queryTimeoutMs = 5000;
        private Mongo mongo = new Mongo();
    }

    @Data
    public static class Mongo {
        private String uri = "mongodb://localhost:27017";
        private String database = "culicidaelab";
    }

    @Data
    public static class Seed {
        private boolean enabled = true;
        private String location = "classpath:seed/catalog.json";
    }

    @Data
    public static class Geo {
        private int defaultLimit = 10000;
    }

    @Data
    public static class Observations {
        private int maxLimit = 1000;
    }

    @Data
    public static class Catalog {
        private int defaultLimit = 50;
        private int maxLimit = 200;
        private int vectorLimit = 200;
    }
}
