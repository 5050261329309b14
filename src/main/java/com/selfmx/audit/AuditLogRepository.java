package com.selfmx.audit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static com.selfmx.db.JdbcSupport.setTimestamp;
import static com.selfmx.db.JdbcSupport.toOffsetDateTime;

/**
 * JDBC DAO for {@code audit_logs}.
 */
public class AuditLogRepository {

    private static final Logger log = LogManager.getLogger(AuditLogRepository.class);

    private static final String INSERT =
            "INSERT INTO audit_logs (created_at, action, actor_type, actor_id, resource_type, resource_id, " +
            "status_code, error_message, details, ip_address, user_agent) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final DataSource dataSource;

    public AuditLogRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Writes entries with one JDBC batch in a single transaction.
     *
     * @param entries Entries to write.
     */
    public void insertBatch(List<AuditEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(INSERT)) {
                for (AuditEntry entry : entries) {
                    setTimestamp(ps, 1, entry.getTimestamp());
                    ps.setString(2, entry.getAction());
                    ps.setString(3, entry.getActorType());
                    ps.setString(4, entry.getActorId());
                    ps.setString(5, entry.getResourceType());
                    ps.setString(6, entry.getResourceId());
                    ps.setInt(7, entry.getStatusCode());
                    ps.setString(8, entry.getErrorMessage());
                    ps.setString(9, entry.getDetails());
                    ps.setString(10, entry.getIpAddress());
                    ps.setString(11, truncate(entry.getUserAgent(), 500));
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.error("insertBatch({}) failed: {}", entries.size(), e.getMessage());
            throw new IllegalStateException("Failed to write audit entries", e);
        }
    }

    /**
     * Lists entries matching the query, newest first.
     */
    public List<AuditEntry> find(AuditQuery query) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT * FROM audit_logs" + where(query, params)
                + " ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?";
        params.add(query.getLimit());
        params.add(query.getOffset());

        List<AuditEntry> entries = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(map(rs));
                }
            }
        } catch (SQLException e) {
            log.error("find(action={}, actorId={}) failed: {}", query.getAction(), query.getActorId(), e.getMessage());
            throw new IllegalStateException("Failed to list audit entries", e);
        }
        return entries;
    }

    /**
     * Counts entries matching the query filters.
     */
    public int count(AuditQuery query) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT COUNT(*) FROM audit_logs" + where(query, params);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            log.error("count() failed: {}", e.getMessage());
            throw new IllegalStateException("Failed to count audit entries", e);
        }
    }

    private static String where(AuditQuery query, List<Object> params) {
        List<String> clauses = new ArrayList<>();
        if (query.getAction() != null) {
            clauses.add("action = ?");
            params.add(query.getAction());
        }
        if (query.getActorId() != null) {
            clauses.add("actor_id = ?");
            params.add(query.getActorId());
        }
        if (query.getFrom() != null) {
            clauses.add("created_at >= ?");
            params.add(query.getFrom());
        }
        if (query.getTo() != null) {
            clauses.add("created_at <= ?");
            params.add(query.getTo());
        }
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }

    private AuditEntry map(ResultSet rs) throws SQLException {
        AuditEntry entry = new AuditEntry()
                .setTimestamp(toOffsetDateTime(rs.getTimestamp("created_at")))
                .setAction(rs.getString("action"))
                .setActorType(rs.getString("actor_type"))
                .setActorId(rs.getString("actor_id"))
                .setResourceType(rs.getString("resource_type"))
                .setResourceId(rs.getString("resource_id"))
                .setStatusCode(rs.getInt("status_code"))
                .setErrorMessage(rs.getString("error_message"))
                .setDetails(rs.getString("details"))
                .setIpAddress(rs.getString("ip_address"))
                .setUserAgent(rs.getString("user_agent"));
        entry.setId(rs.getLong("id"));
        return entry;
    }
}
