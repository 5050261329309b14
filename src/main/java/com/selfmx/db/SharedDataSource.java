package com.selfmx.db;

import com.selfmx.config.server.DatabaseConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds the single HikariCP pool every repository of the process shares.
 *
 * <p>The caller owns the returned pool and closes it on shutdown.
 */
public final class SharedDataSource {
    private static final Logger log = LogManager.getLogger(SharedDataSource.class);

    private SharedDataSource() {
    }

    /**
     * Opens a pool for the {@code database} section of {@code server.json5}.
     *
     * @param database Database configuration.
     * @param poolName Name shown in HikariCP logs and thread names.
     * @return Started pool.
     */
    public static HikariDataSource create(DatabaseConfig database, String poolName) {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName(poolName);
        hikari.setJdbcUrl(database.getJdbcUrl());
        if (!database.getUser().isEmpty()) {
            hikari.setUsername(database.getUser());
            hikari.setPassword(database.getPassword());
        }
        hikari.setMaximumPoolSize(Math.max(2, database.getMaxPoolSize()));
        try {
            HikariDataSource pool = new HikariDataSource(hikari);
            log.info("Opened pool {} for {} (max {} connections)",
                    poolName, database.getJdbcUrl(), hikari.getMaximumPoolSize());
            return pool;
        } catch (RuntimeException e) {
            log.error("Failed to open pool {} for {}: {}", poolName, database.getJdbcUrl(), e.getMessage());
            throw e;
        }
    }
}
