package com.culicidaelab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * CulicidaeLab Server - localized species, disease and observation catalog
 * with map-ready geographic layers
 */
@SpringBootApplication(exclude = MongoAutoConfiguration.class)
@ConfigurationPropertiesScan
public class CulicidaeLabApplication {
    public static void main(String[] args) {
        SpringApplication.run(CulicidaeLabApplication.class, args);
    }
}
