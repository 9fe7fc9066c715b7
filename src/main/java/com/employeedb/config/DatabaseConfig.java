package com.employeedb.config;

import com.employeedb.database.Sleeper;
import io.github.resilience4j.core.IntervalFunction;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

/**
 * Beans backing the startup readiness loop.
 *
 * The pool itself (HikariCP) and the {@code JdbcTemplate} come from Spring Boot
 * auto-configuration, sized through {@code spring.datasource.hikari.*}.
 */
@Configuration
public class DatabaseConfig {

    /**
     * Capped exponential backoff: attempt n waits
     * {@code min(initial * multiplier^(n-1), max)}.
     */
    @Bean
    public IntervalFunction startupBackoff(StartupProperties properties) {
        return IntervalFunction.ofExponentialBackoff(
                properties.initialInterval(),
                properties.multiplier(),
                properties.maxInterval());
    }

    @Bean
    public ResourceDatabasePopulator schemaPopulator(StartupProperties properties,
                                                     ResourceLoader resourceLoader) {
        Resource schema = resourceLoader.getResource(properties.schemaLocation());
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(schema);
        populator.setContinueOnError(false);
        populator.setSqlScriptEncoding("UTF-8");
        return populator;
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }
}
