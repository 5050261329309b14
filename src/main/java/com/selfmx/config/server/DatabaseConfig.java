package com.selfmx.config.server;

import com.selfmx.config.BasicConfig;

import java.util.Map;

/**
 * Database configuration.
 */
public class DatabaseConfig extends BasicConfig {

    /**
     * Constructs a new DatabaseConfig instance.
     *
     * @param map Configuration map.
     */
    public DatabaseConfig(Map<String, Object> map) {
        super(map);
    }

    public String getJdbcUrl() {
        return getStringProperty("jdbcUrl", "jdbc:h2:./data/selfmx;MODE=PostgreSQL");
    }

    public String getUser() {
        return getStringProperty("user", "sa");
    }

    public String getPassword() {
        return getStringProperty("password", "");
    }

    public int getMaxPoolSize() {
        return Math.toIntExact(getLongProperty("maxPoolSize", 8L));
    }

    /**
     * Whether to apply {@code schema.sql} on startup.
     *
     * @return Boolean.
     */
    public boolean isInitSchema() {
        return getBooleanProperty("initSchema", true);
    }
}
