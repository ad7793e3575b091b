package com.example.inventory.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

@Slf4j
@Configuration
public class InventoryConfiguration {

    @Bean
    public ColumnConfig columnConfig(InventoryProperties properties, ObjectMapper objectMapper) {
        ClassPathResource resource = new ClassPathResource(properties.getColumnConfig());
        if (!resource.exists()) {
            log.warn("Column config {} not found on the classpath, using canonical headers only",
                    properties.getColumnConfig());
        }
        ColumnConfig config = ColumnConfig.load(resource, objectMapper);
        log.debug("Column aliases: inventory={}, roster={}", config.inventory(), config.roster());
        return config;
    }
}
