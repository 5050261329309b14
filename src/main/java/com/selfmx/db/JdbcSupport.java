package com.selfmx.db;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collections;

/**
 * Small helpers shared by the JDBC repositories.
 */
public final class JdbcSupport {

    /**
     * SQLState for a unique constraint violation (H2 and PostgreSQL).
     */
    public static final String UNIQUE_VIOLATION = "23505";

    /**
     * SQLState for a foreign key violation (H2 and PostgreSQL).
     */
    public static final String FOREIGN_KEY_VIOLATION = "23503";

    private JdbcSupport() {
        // static utility
    }

    public static void setTimestamp(PreparedStatement ps, int idx, OffsetDateTime dt) throws SQLException {
        if (dt == null) {
            ps.setNull(idx, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            ps.setObject(idx, dt);
        }
    }

    public static OffsetDateTime toOffsetDateTime(Timestamp ts) {
        return ts == null ? null : ts.toInstant().atOffset(ZoneOffset.UTC);
    }

    /**
     * Checks the exception chain for a given SQLState.
     *
     * @param e        Exception.
     * @param sqlState Expected state.
     * @return Boolean.
     */
    public static boolean hasState(SQLException e, String sqlState) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            if (sqlState.equals(cur.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Builds a comma separated list of {@code n} placeholders.
     *
     * @param n Count, at least one.
     * @return Placeholder list.
     */
    public static String placeholders(int n) {
        return String.join(", ", Collections.nCopies(n, "?"));
    }
}
