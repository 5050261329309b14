package com.selfmx.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies the bundled {@code db/schema.sql} to a data source.
 *
 * <p>Every statement is idempotent ({@code IF NOT EXISTS}) so this runs on every startup.
 */
public final class SchemaInitializer {
    private static final Logger log = LogManager.getLogger(SchemaInitializer.class);

    /**
     * Classpath location of the schema script.
     */
    public static final String SCHEMA_RESOURCE = "db/schema.sql";

    private SchemaInitializer() {
        // static utility
    }

    /**
     * Creates missing tables and indexes.
     *
     * @param dataSource Target data source.
     */
    public static void apply(DataSource dataSource) {
        List<String> statements = statements(readSchema());
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
            log.info("Schema applied: statements={}", statements.size());
        } catch (SQLException e) {
            log.error("apply() failed: {}", e.getMessage());
            throw new IllegalStateException("Failed to apply database schema", e);
        }
    }

    /**
     * Splits a script into statements, dropping comment lines.
     *
     * @param script SQL script.
     * @return Statements without trailing semicolons.
     */
    static List<String> statements(String script) {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String line : script.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("--")) {
                continue;
            }
            current.append(line).append('\n');
            if (trimmed.endsWith(";")) {
                String sql = current.toString().trim();
                out.add(sql.substring(0, sql.length() - 1));
                current.setLength(0);
            }
        }
        if (!current.toString().isBlank()) {
            out.add(current.toString().trim());
        }
        return out;
    }

    private static String readSchema() {
        try (InputStream is = SchemaInitializer.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema resource", e);
        }
    }
}
