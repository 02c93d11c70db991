package com.warehouse.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;

/**
 * Immutable process configuration resolved once at startup.
 *
 * <p>Each value is read from a Spring property first and then from the matching environment
 * variable, so {@code application.yml}, system properties and a plain {@code DB_HOST=...} export
 * all work.
 *
 * @param dbHost database host
 * @param dbPort database port
 * @param dbName database name
 * @param dbUser database user
 * @param dbPassword database password
 * @param jdbcUrlOverride explicit JDBC URL, or null to derive one from host/port/name
 * @param paginationColumn column used for ORDER BY when paging
 * @param poolSize maximum pooled connections
 * @param queryTimeoutSeconds statement timeout applied to data queries, 0 for none
 * @param apiToken bearer token required on /api routes
 */
public record WarehouseConfig(
        String dbHost,
        int dbPort,
        String dbName,
        String dbUser,
        String dbPassword,
        String jdbcUrlOverride,
        String paginationColumn,
        int poolSize,
        int queryTimeoutSeconds,
        String apiToken
) {
    private static final Logger log = LoggerFactory.getLogger(WarehouseConfig.class);

    public static final String DEFAULT_DB_HOST = "localhost";
    public static final int DEFAULT_DB_PORT = 5432;
    public static final String DEFAULT_DB_NAME = "warehouse";
    public static final String DEFAULT_DB_USER = "postgres";
    public static final String DEFAULT_PAGINATION_COLUMN = "id";
    public static final int DEFAULT_POOL_SIZE = 5;

    static WarehouseConfig fromEnvironment(Environment environment) {
        return new WarehouseConfig(
                getOrDefault(environment, "warehouse.db.host", "DB_HOST", DEFAULT_DB_HOST),
                getInt(environment, "warehouse.db.port", "DB_PORT", DEFAULT_DB_PORT),
                getOrDefault(environment, "warehouse.db.name", "DB_NAME", DEFAULT_DB_NAME),
                getOrDefault(environment, "warehouse.db.user", "DB_USER", DEFAULT_DB_USER),
                getRaw(environment, "warehouse.db.password", "DB_PASSWORD", ""),
                getTrimmed(environment, "warehouse.db.url", "DB_URL"),
                getOrDefault(environment, "warehouse.db.pagination-column", "PAGINATION_COLUMN", DEFAULT_PAGINATION_COLUMN),
                getInt(environment, "warehouse.db.pool-size", "DB_POOL_SIZE", DEFAULT_POOL_SIZE),
                getInt(environment, "warehouse.db.query-timeout-seconds", "QUERY_TIMEOUT_SECONDS", 0),
                getRaw(environment, "warehouse.api.token", "API_TOKEN", "")
        );
    }

    /**
     * Resolve the JDBC URL, preferring the explicit override.
     *
     * @return jdbc url
     */
    public String jdbcUrl() {
        if (jdbcUrlOverride != null && !jdbcUrlOverride.isBlank()) {
            return jdbcUrlOverride;
        }
        return String.format("jdbc:postgresql://%s:%d/%s", dbHost, dbPort, dbName);
    }

    public boolean usesDerivedPostgresUrl() {
        return jdbcUrlOverride == null || jdbcUrlOverride.isBlank();
    }

    @Override
    public String toString() {
        return "WarehouseConfig[jdbcUrl=" + maskUrl(jdbcUrl())
                + ", dbUser=" + dbUser
                + ", paginationColumn=" + paginationColumn
                + ", poolSize=" + poolSize
                + ", queryTimeoutSeconds=" + queryTimeoutSeconds
                + ", apiTokenConfigured=" + (apiToken != null && !apiToken.isEmpty()) + "]";
    }

    static String maskUrl(String url) {
        if (url == null) return null;
        return url.replaceAll("(?i)(password=)[^&;]*", "$1****").replaceAll(":[^@:/]+@", ":****@");
    }

    private static String getOrDefault(Environment environment, String propKey, String envKey, String defaultValue) {
        String v = getTrimmed(environment, propKey, envKey);
        return v != null && !v.isBlank() ? v : defaultValue;
    }

    private static int getInt(Environment environment, String propKey, String envKey, int defaultValue) {
        String raw = getTrimmed(environment, propKey, envKey);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric value '{}' for {} / {}, using {}", raw, propKey, envKey, defaultValue);
            return defaultValue;
        }
    }

    private static String getRaw(Environment environment, String propKey, String envKey, String defaultValue) {
        String v;
        if (environment != null) {
            // Spring's environment already exposes OS environment variables as properties.
            v = environment.getProperty(propKey);
            if (v == null) {
                v = environment.getProperty(envKey);
            }
        } else {
            v = System.getenv(envKey);
        }
        return v != null ? v : defaultValue;
    }

    private static String getTrimmed(Environment environment, String propKey, String envKey) {
        String v = getRaw(environment, propKey, envKey, null);
        return v != null ? v.trim() : null;
    }
}
