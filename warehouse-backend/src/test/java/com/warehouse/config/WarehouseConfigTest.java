package com.warehouse.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.SQLExceptionOverride;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

import static org.assertj.core.api.Assertions.assertThat;

class WarehouseConfigTest {

    @Test
    void defaultsApplyWhenNothingIsSet() {
        WarehouseConfig config = WarehouseConfig.fromEnvironment(new MockEnvironment());

        assertThat(config.dbHost()).isEqualTo("localhost");
        assertThat(config.dbPort()).isEqualTo(5432);
        assertThat(config.dbName()).isEqualTo("warehouse");
        assertThat(config.dbUser()).isEqualTo("postgres");
        assertThat(config.dbPassword()).isEmpty();
        assertThat(config.paginationColumn()).isEqualTo("id");
        assertThat(config.apiToken()).isEmpty();
        assertThat(config.poolSize()).isEqualTo(5);
        assertThat(config.queryTimeoutSeconds()).isZero();
        assertThat(config.jdbcUrl()).isEqualTo("jdbc:postgresql://localhost:5432/warehouse");
    }

    @Test
    void environmentVariableNamesAreHonoured() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("DB_HOST", "db.internal")
                .withProperty("DB_PORT", "6543")
                .withProperty("DB_NAME", "dw")
                .withProperty("PAGINATION_COLUMN", "store_id")
                .withProperty("API_TOKEN", "t0ken");

        WarehouseConfig config = WarehouseConfig.fromEnvironment(env);

        assertThat(config.jdbcUrl()).isEqualTo("jdbc:postgresql://db.internal:6543/dw");
        assertThat(config.paginationColumn()).isEqualTo("store_id");
        assertThat(config.apiToken()).isEqualTo("t0ken");
    }

    @Test
    void springPropertiesWinOverEnvironmentNames() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("warehouse.db.pagination-column", "sk")
                .withProperty("PAGINATION_COLUMN", "store_id");

        assertThat(WarehouseConfig.fromEnvironment(env).paginationColumn()).isEqualTo("sk");
    }

    @Test
    void nonNumericPortFallsBackToDefault() {
        MockEnvironment env = new MockEnvironment().withProperty("DB_PORT", "fivefour");

        assertThat(WarehouseConfig.fromEnvironment(env).dbPort()).isEqualTo(5432);
    }

    @Test
    void explicitUrlOverridesDerivedOne() {
        MockEnvironment env = new MockEnvironment().withProperty("DB_URL", "jdbc:h2:mem:x");
        WarehouseConfig config = WarehouseConfig.fromEnvironment(env);

        assertThat(config.jdbcUrl()).isEqualTo("jdbc:h2:mem:x");
        assertThat(config.usesDerivedPostgresUrl()).isFalse();
    }

    @Test
    void toStringNeverShowsSecrets() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("DB_PASSWORD", "hunter2")
                .withProperty("API_TOKEN", "t0ken")
                .withProperty("DB_URL", "jdbc:postgresql://u:hunter2@db/dw?password=hunter2");

        String rendered = WarehouseConfig.fromEnvironment(env).toString();

        assertThat(rendered).doesNotContain("hunter2").doesNotContain("t0ken").contains("apiTokenConfigured=true");
    }

    @Test
    void hikariPoolIsReadOnlyAndUsesPostgresDriverForDerivedUrl() {
        WarehouseConfig config = WarehouseConfig.fromEnvironment(new MockEnvironment().withProperty("DB_POOL_SIZE", "8"));

        HikariConfig hikari = DataSourceConfig.buildHikariConfig(config);

        assertThat(hikari.isReadOnly()).isTrue();
        assertThat(hikari.getMaximumPoolSize()).isEqualTo(8);
        assertThat(hikari.getPoolName()).isEqualTo("warehouse-pool");
        assertThat(hikari.getDriverClassName()).isEqualTo("org.postgresql.Driver");
        assertThat(hikari.getExceptionOverrideClassName()).isEqualTo(WarehouseSqlExceptionOverride.class.getName());
    }

    @Test
    void statementLevelErrorsDoNotEvictConnections() {
        WarehouseSqlExceptionOverride override = new WarehouseSqlExceptionOverride();

        assertThat(override.adjudicate(new SQLException("bad input", "22P02"))).isEqualTo(SQLExceptionOverride.Override.DO_NOT_EVICT);
        assertThat(override.adjudicate(new SQLException("no relation", "42P01"))).isEqualTo(SQLExceptionOverride.Override.DO_NOT_EVICT);
        assertThat(override.adjudicate(new SQLFeatureNotSupportedException("nope"))).isEqualTo(SQLExceptionOverride.Override.DO_NOT_EVICT);
        assertThat(override.adjudicate(new SQLException("connection lost", "08006"))).isEqualTo(SQLExceptionOverride.Override.CONTINUE_EVICT);
        assertThat(override.adjudicate(new SQLException("no state"))).isEqualTo(SQLExceptionOverride.Override.CONTINUE_EVICT);
    }
}
