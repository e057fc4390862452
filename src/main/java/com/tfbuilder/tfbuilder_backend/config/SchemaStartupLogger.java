package com.tfbuilder.tfbuilder_backend.config;

import com.tfbuilder.tfbuilder_backend.schema.SchemaProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Logs at startup whether the provider schema loaded. Without it nodes get
 * no defaults, no descriptions and no typed property lists.
 */
@Slf4j
@Component
public class SchemaStartupLogger implements ApplicationRunner {

    private final SchemaProvider schemaProvider;
    private final Environment env;

    public SchemaStartupLogger(SchemaProvider schemaProvider, Environment env) {
        this.schemaProvider = schemaProvider;
        this.env = env;
    }

    @Override
    public void run(ApplicationArguments args) {
        String location = env.getProperty("app.schema.location", "classpath:schema/aws-provider-schema.json");
        if (schemaProvider.isInitialized()) {
            log.info("[SCHEMA] Provider schema loaded from {}: {} resource types", location, schemaProvider.getResourceCount());
        } else {
            log.warn("[SCHEMA] Provider schema from {} is not initialized; property defaults are unavailable", location);
        }
    }
}
