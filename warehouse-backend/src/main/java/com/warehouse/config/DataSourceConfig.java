package com.warehouse.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Wires the resolved {@link WarehouseConfig} and the pooled, read-only warehouse DataSource.
 */
@Slf4j
@Configuration
public class DataSourceConfig {

    static final String POOL_NAME = "warehouse-pool";

    @Bean
    public WarehouseConfig warehouseConfig(Environment environment) {
        WarehouseConfig config = WarehouseConfig.fromEnvironment(environment);
        log.info("Resolved configuration: {}", config);
        if (config.apiToken() == null || config.apiToken().isEmpty()) {
            log.warn("API_TOKEN is empty; every /api request will be rejected with 401");
        }
        return config;
    }

    @Bean(destroyMethod = "close")
    public HikariDataSource warehouseDataSource(WarehouseConfig config) {
        return new HikariDataSource(buildHikariConfig(config));
    }

    static HikariConfig buildHikariConfig(WarehouseConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName(POOL_NAME);
        hikari.setExceptionOverrideClassName(WarehouseSqlExceptionOverride.class.getName());
        hikari.setJdbcUrl(config.jdbcUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPassword());
        hikari.setReadOnly(true);
        hikari.setMaximumPoolSize(Math.max(1, config.poolSize()));
        hikari.setMinimumIdle(0);
        // Start without a live database; the first request surfaces connectivity errors.
        hikari.setInitializationFailTimeout(-1);

        if (config.usesDerivedPostgresUrl()) {
            hikari.setDriverClassName("org.postgresql.Driver");
            // Shows up as pg_stat_activity.application_name.
            hikari.addDataSourceProperty("ApplicationName", "warehouse-api");
        }
        return hikari;
    }
}
