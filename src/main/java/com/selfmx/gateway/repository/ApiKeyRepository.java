package com.selfmx.gateway.repository;

import com.selfmx.gateway.domain.ApiKey;
import com.selfmx.gateway.domain.RevokedApiKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.selfmx.db.JdbcSupport.placeholders;
import static com.selfmx.db.JdbcSupport.setTimestamp;
import static com.selfmx.db.JdbcSupport.toOffsetDateTime;

/**
 * JDBC DAO for {@code api_keys}, {@code api_key_domains} and {@code revoked_api_keys}.
 */
public class ApiKeyRepository {

    private static final Logger log = LogManager.getLogger(ApiKeyRepository.class);

    private static final String INSERT_KEY =
            "INSERT INTO api_keys (id, name, key_hash, key_salt, key_prefix, is_admin, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)";

    private static final String INSERT_DOMAIN_LINK =
            "INSERT INTO api_key_domains (api_key_id, domain_id) VALUES (?, ?)";

    private static final String SELECT_BY_ID =
            "SELECT * FROM api_keys WHERE id = ?";

    private static final String SELECT_ACTIVE_BY_PREFIX =
            "SELECT * FROM api_keys WHERE key_prefix = ? AND revoked_at IS NULL";

    private static final String SELECT_PAGE =
            "SELECT * FROM api_keys ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?";

    private static final String COUNT_ALL =
            "SELECT COUNT(*) FROM api_keys";

    private static final String SELECT_REVOKED_BEFORE =
            "SELECT * FROM api_keys WHERE revoked_at IS NOT NULL AND revoked_at < ? " +
            "ORDER BY revoked_at ASC LIMIT ?";

    private static final String REVOKE =
            "UPDATE api_keys SET revoked_at = ? WHERE id = ? AND revoked_at IS NULL";

    private static final String UPDATE_LAST_USED =
            "UPDATE api_keys SET last_used_at = ?, last_used_ip = ? WHERE id = ?";

    private static final String INSERT_ARCHIVE =
            "INSERT INTO revoked_api_keys " +
            "(id, name, key_prefix, is_admin, created_at, revoked_at, archived_at, last_used_at, last_used_ip, allowed_domain_ids) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String DELETE_DOMAIN_LINKS =
            "DELETE FROM api_key_domains WHERE api_key_id = ?";

    private static final String DELETE_REVOKED_KEY =
            "DELETE FROM api_keys WHERE id = ? AND revoked_at IS NOT NULL";

    private static final String SELECT_ARCHIVED_PAGE =
            "SELECT * FROM revoked_api_keys ORDER BY archived_at DESC, id DESC LIMIT ? OFFSET ?";

    private static final String COUNT_ARCHIVED =
            "SELECT COUNT(*) FROM revoked_api_keys";

    private final DataSource dataSource;

    public ApiKeyRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Inserts a key and its domain allow-list in one transaction.
     *
     * @param key key with id, hash, salt, prefix and createdAt populated
     * @return the same instance
     */
    public ApiKey insert(ApiKey key) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(INSERT_KEY);
                 PreparedStatement links = conn.prepareStatement(INSERT_DOMAIN_LINK)) {
                ps.setString(1, key.getId());
                ps.setString(2, key.getName());
                ps.setString(3, key.getKeyHash());
                ps.setString(4, key.getKeySalt());
                ps.setString(5, key.getKeyPrefix());
                ps.setBoolean(6, key.isAdmin());
                setTimestamp(ps, 7, key.getCreatedAt());
                ps.executeUpdate();

                for (String domainId : key.getAllowedDomainIds()) {
                    links.setString(1, key.getId());
                    links.setString(2, domainId);
                    links.addBatch();
                }
                if (!key.getAllowedDomainIds().isEmpty()) {
                    links.executeBatch();
                }
                conn.commit();
                return key;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.error("insert({}) failed: {}", key.getKeyPrefix(), e.getMessage());
            throw new IllegalStateException("Failed to insert API key", e);
        }
    }

    /**
     * Returns a live key (active or revoked) by id.
     */
    public Optional<ApiKey> findById(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_BY_ID)) {
            ps.setString(1, id);
            List<ApiKey> keys = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    keys.add(map(rs));
                }
            }
            loadDomainIds(conn, keys);
            return keys.isEmpty() ? Optional.empty() : Optional.of(keys.get(0));
        } catch (SQLException e) {
            log.error("findById({}) failed: {}", id, e.getMessage());
            throw new IllegalStateException("Failed to find API key by id", e);
        }
    }

    /**
     * Returns the non-revoked keys sharing a display prefix.
     */
    public List<ApiKey> findActiveByPrefix(String prefix) {
        return query(SELECT_ACTIVE_BY_PREFIX, "findActiveByPrefix", ps -> ps.setString(1, prefix));
    }

    /**
     * Returns one page of live keys, newest first.
     */
    public List<ApiKey> findPage(int limit, long offset) {
        return query(SELECT_PAGE, "findPage", ps -> {
            ps.setInt(1, limit);
            ps.setLong(2, offset);
        });
    }

    /**
     * Returns keys revoked before the cutoff, oldest revocation first.
     */
    public List<ApiKey> findRevokedBefore(OffsetDateTime cutoff, int limit) {
        return query(SELECT_REVOKED_BEFORE, "findRevokedBefore", ps -> {
            setTimestamp(ps, 1, cutoff);
            ps.setInt(2, limit);
        });
    }

    /**
     * Counts live keys.
     */
    public int count() {
        return count(COUNT_ALL, "count");
    }

    /**
     * Sets {@code revoked_at} on an active key.
     *
     * @return true when the key was active and is now revoked
     */
    public boolean revoke(String id, OffsetDateTime revokedAt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(REVOKE)) {
            setTimestamp(ps, 1, revokedAt);
            ps.setString(2, id);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            log.error("revoke({}) failed: {}", id, e.getMessage());
            throw new IllegalStateException("Failed to revoke API key", e);
        }
    }

    /**
     * Records the last successful use of a key.
     */
    public void updateLastUsed(String id, OffsetDateTime usedAt, String ip) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPDATE_LAST_USED)) {
            setTimestamp(ps, 1, usedAt);
            ps.setString(2, ip);
            ps.setString(3, id);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("updateLastUsed({}) failed: {}", id, e.getMessage());
            throw new IllegalStateException("Failed to update API key usage", e);
        }
    }

    /**
     * Copies a revoked key into the archive and purges the live row and its links, in one transaction.
     *
     * @return true when the live row was removed
     */
    public boolean archive(RevokedApiKey archived) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement insert = conn.prepareStatement(INSERT_ARCHIVE);
                 PreparedStatement links = conn.prepareStatement(DELETE_DOMAIN_LINKS);
                 PreparedStatement delete = conn.prepareStatement(DELETE_REVOKED_KEY)) {
                insert.setString(1, archived.getId());
                insert.setString(2, archived.getName());
                insert.setString(3, archived.getKeyPrefix());
                insert.setBoolean(4, archived.isAdmin());
                setTimestamp(insert, 5, archived.getCreatedAt());
                setTimestamp(insert, 6, archived.getRevokedAt());
                setTimestamp(insert, 7, archived.getArchivedAt());
                setTimestamp(insert, 8, archived.getLastUsedAt());
                insert.setString(9, archived.getLastUsedIp());
                insert.setString(10, String.join(",", archived.getAllowedDomainIds()));
                insert.executeUpdate();

                links.setString(1, archived.getId());
                links.executeUpdate();

                delete.setString(1, archived.getId());
                int deleted = delete.executeUpdate();
                if (deleted != 1) {
                    conn.rollback();
                    return false;
                }
                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.error("archive({}) failed: {}", archived.getId(), e.getMessage());
            throw new IllegalStateException("Failed to archive API key", e);
        }
    }

    /**
     * Returns one page of archived keys, most recently archived first.
     */
    public List<RevokedApiKey> findArchivedPage(int limit, long offset) {
        List<RevokedApiKey> keys = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_ARCHIVED_PAGE)) {
            ps.setInt(1, limit);
            ps.setLong(2, offset);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    keys.add(mapArchived(rs));
                }
            }
        } catch (SQLException e) {
            log.error("findArchivedPage(limit={}, offset={}) failed: {}", limit, offset, e.getMessage());
            throw new IllegalStateException("Failed to list archived API keys", e);
        }
        return keys;
    }

    /**
     * Counts archived keys.
     */
    public int countArchived() {
        return count(COUNT_ARCHIVED, "countArchived");
    }

    private List<ApiKey> query(String sql, String method, Binder binder) {
        List<ApiKey> keys = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    keys.add(map(rs));
                }
            }
            loadDomainIds(conn, keys);
        } catch (SQLException e) {
            log.error("{}() failed: {}", method, e.getMessage());
            throw new IllegalStateException("Failed to query API keys", e);
        }
        return keys;
    }

    private int count(String sql, String method) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            log.error("{}() failed: {}", method, e.getMessage());
            throw new IllegalStateException("Failed to count API keys", e);
        }
    }

    private void loadDomainIds(Connection conn, List<ApiKey> keys) throws SQLException {
        if (keys.isEmpty()) {
            return;
        }
        Map<String, ApiKey> byId = new LinkedHashMap<>();
        for (ApiKey key : keys) {
            byId.put(key.getId(), key);
        }
        String sql = "SELECT api_key_id, domain_id FROM api_key_domains WHERE api_key_id IN ("
                + placeholders(byId.size()) + ") ORDER BY domain_id";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int idx = 1;
            for (String id : byId.keySet()) {
                ps.setString(idx++, id);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    byId.get(rs.getString("api_key_id")).getAllowedDomainIds().add(rs.getString("domain_id"));
                }
            }
        }
    }

    private ApiKey map(ResultSet rs) throws SQLException {
        ApiKey key = new ApiKey();
        key.setId(rs.getString("id"));
        key.setName(rs.getString("name"));
        key.setKeyHash(rs.getString("key_hash"));
        key.setKeySalt(rs.getString("key_salt"));
        key.setKeyPrefix(rs.getString("key_prefix"));
        key.setAdmin(rs.getBoolean("is_admin"));
        key.setCreatedAt(toOffsetDateTime(rs.getTimestamp("created_at")));
        key.setRevokedAt(toOffsetDateTime(rs.getTimestamp("revoked_at")));
        key.setLastUsedAt(toOffsetDateTime(rs.getTimestamp("last_used_at")));
        key.setLastUsedIp(rs.getString("last_used_ip"));
        return key;
    }

    private RevokedApiKey mapArchived(ResultSet rs) throws SQLException {
        RevokedApiKey key = new RevokedApiKey();
        key.setId(rs.getString("id"));
        key.setName(rs.getString("name"));
        key.setKeyPrefix(rs.getString("key_prefix"));
        key.setAdmin(rs.getBoolean("is_admin"));
        key.setCreatedAt(toOffsetDateTime(rs.getTimestamp("created_at")));
        key.setRevokedAt(toOffsetDateTime(rs.getTimestamp("revoked_at")));
        key.setArchivedAt(toOffsetDateTime(rs.getTimestamp("archived_at")));
        key.setLastUsedAt(toOffsetDateTime(rs.getTimestamp("last_used_at")));
        key.setLastUsedIp(rs.getString("last_used_ip"));
        String ids = rs.getString("allowed_domain_ids");
        if (ids != null && !ids.isBlank()) {
            key.setAllowedDomainIds(new ArrayList<>(Arrays.asList(ids.split(","))));
        }
        return key;
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
