package com.selfmx.gateway.repository;

import com.selfmx.gateway.domain.DnsRecordCodec;
import com.selfmx.gateway.domain.Domain;
import com.selfmx.gateway.domain.DomainStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static com.selfmx.db.JdbcSupport.FOREIGN_KEY_VIOLATION;
import static com.selfmx.db.JdbcSupport.UNIQUE_VIOLATION;
import static com.selfmx.db.JdbcSupport.hasState;
import static com.selfmx.db.JdbcSupport.placeholders;
import static com.selfmx.db.JdbcSupport.setTimestamp;
import static com.selfmx.db.JdbcSupport.toOffsetDateTime;

/**
 * JDBC DAO for {@code domains}.
 *
 * <p>Name uniqueness is enforced by the {@code uq_domains_name} constraint, not by a prior lookup.
 * <p>State changes are written as a single UPDATE guarded by the expected current status so a
 * late writer can never move a domain backwards.
 */
public class DomainRepository {

    private static final Logger log = LogManager.getLogger(DomainRepository.class);

    private static final String INSERT =
            "INSERT INTO domains (id, name, status, created_at) VALUES (?, ?, ?, ?)";

    private static final String UPDATE_STATE =
            "UPDATE domains SET " +
            "status = ?, verification_started_at = ?, verified_at = ?, last_checked_at = ?, " +
            "failure_reason = ?, provider_identity_ref = ?, dns_records = ? " +
            "WHERE id = ? AND status = ?";

    private static final String SELECT_BY_ID =
            "SELECT * FROM domains WHERE id = ?";

    private static final String SELECT_BY_NAME =
            "SELECT * FROM domains WHERE name = ?";

    private static final String SELECT_BY_STATUS =
            "SELECT * FROM domains WHERE status = ? ORDER BY created_at ASC";

    private static final String SELECT_PAGE =
            "SELECT * FROM domains ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?";

    private static final String COUNT_ALL =
            "SELECT COUNT(*) FROM domains";

    private static final String COUNT_ACTIVE_KEY_REFERENCES =
            "SELECT COUNT(*) FROM api_key_domains akd JOIN api_keys k ON k.id = akd.api_key_id " +
            "WHERE akd.domain_id = ? AND k.revoked_at IS NULL";

    private static final String DELETE_REVOKED_KEY_LINKS =
            "DELETE FROM api_key_domains WHERE domain_id = ? " +
            "AND api_key_id IN (SELECT id FROM api_keys WHERE revoked_at IS NOT NULL)";

    private static final String DELETE =
            "DELETE FROM domains WHERE id = ?";

    private final DataSource dataSource;

    public DomainRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Inserts a new domain.
     *
     * @param domain domain with id, name, status and createdAt populated
     * @return the same instance
     * @throws DuplicateDomainException when the name is already taken
     */
    public Domain insert(Domain domain) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT)) {
            ps.setString(1, domain.getId());
            ps.setString(2, domain.getName());
            ps.setString(3, domain.getStatus().name());
            setTimestamp(ps, 4, domain.getCreatedAt());
            ps.executeUpdate();
            return domain;
        } catch (SQLException e) {
            if (hasState(e, UNIQUE_VIOLATION)) {
                throw new DuplicateDomainException(domain.getName(), e);
            }
            log.error("insert({}) failed: {}", domain.getName(), e.getMessage());
            throw new IllegalStateException("Failed to insert domain", e);
        }
    }

    /**
     * Persists every mutable column in one statement if the stored status still matches.
     *
     * @param domain   domain carrying the new state
     * @param expected status the row must currently have
     * @return true when the row was updated
     */
    public boolean updateState(Domain domain, DomainStatus expected) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(UPDATE_STATE)) {
            ps.setString(1, domain.getStatus().name());
            setTimestamp(ps, 2, domain.getVerificationStartedAt());
            setTimestamp(ps, 3, domain.getVerifiedAt());
            setTimestamp(ps, 4, domain.getLastCheckedAt());
            ps.setString(5, domain.getFailureReason());
            ps.setString(6, domain.getProviderIdentityRef());
            ps.setString(7, DnsRecordCodec.encode(domain.getDnsRecords()));
            ps.setString(8, domain.getId());
            ps.setString(9, expected.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            log.error("updateState({}) failed: {}", domain.getId(), e.getMessage());
            throw new IllegalStateException("Failed to update domain state", e);
        }
    }

    /**
     * Returns a domain by id.
     */
    public Optional<Domain> findById(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_BY_ID)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            log.error("findById({}) failed: {}", id, e.getMessage());
            throw new IllegalStateException("Failed to find domain by id", e);
        }
    }

    /**
     * Returns a domain by its lowercase name.
     */
    public Optional<Domain> findByName(String name) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_BY_NAME)) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            log.error("findByName({}) failed: {}", name, e.getMessage());
            throw new IllegalStateException("Failed to find domain by name", e);
        }
    }

    /**
     * Returns all domains in a status, oldest first.
     */
    public List<Domain> findByStatus(DomainStatus status) {
        List<Domain> domains = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_BY_STATUS)) {
            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    domains.add(map(rs));
                }
            }
        } catch (SQLException e) {
            log.error("findByStatus({}) failed: {}", status, e.getMessage());
            throw new IllegalStateException("Failed to find domains by status", e);
        }
        return domains;
    }

    /**
     * Returns one page of domains, newest first.
     *
     * @param scope  domain ids the caller may see, or null for all
     * @param limit  page size
     * @param offset rows to skip
     */
    public List<Domain> findPage(Collection<String> scope, int limit, long offset) {
        if (scope != null && scope.isEmpty()) {
            return new ArrayList<>();
        }
        String sql = scope == null ? SELECT_PAGE
                : "SELECT * FROM domains WHERE id IN (" + placeholders(scope.size()) + ") " +
                  "ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?";
        List<Domain> domains = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            int idx = 1;
            if (scope != null) {
                for (String id : scope) {
                    ps.setString(idx++, id);
                }
            }
            ps.setInt(idx++, limit);
            ps.setLong(idx, offset);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    domains.add(map(rs));
                }
            }
        } catch (SQLException e) {
            log.error("findPage(limit={}, offset={}) failed: {}", limit, offset, e.getMessage());
            throw new IllegalStateException("Failed to list domains", e);
        }
        return domains;
    }

    /**
     * Counts domains visible to a scope.
     *
     * @param scope domain ids the caller may see, or null for all
     */
    public int count(Collection<String> scope) {
        if (scope != null && scope.isEmpty()) {
            return 0;
        }
        String sql = scope == null ? COUNT_ALL
                : "SELECT COUNT(*) FROM domains WHERE id IN (" + placeholders(scope.size()) + ")";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            int idx = 1;
            if (scope != null) {
                for (String id : scope) {
                    ps.setString(idx++, id);
                }
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            log.error("count() failed: {}", e.getMessage());
            throw new IllegalStateException("Failed to count domains", e);
        }
    }

    /**
     * Counts non-revoked API keys whose allow-list contains the domain.
     */
    public int countActiveKeyReferences(String domainId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(COUNT_ACTIVE_KEY_REFERENCES)) {
            ps.setString(1, domainId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            log.error("countActiveKeyReferences({}) failed: {}", domainId, e.getMessage());
            throw new IllegalStateException("Failed to count API key references", e);
        }
    }

    /**
     * Deletes a domain together with allow-list links held by revoked keys, in one transaction.
     * Links of active keys are protected by the foreign key and abort the delete.
     *
     * @return true when a row was deleted
     * @throws DomainInUseException when an active key still references the domain
     */
    public boolean delete(String domainId) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement links = conn.prepareStatement(DELETE_REVOKED_KEY_LINKS);
                 PreparedStatement ps = conn.prepareStatement(DELETE)) {
                links.setString(1, domainId);
                links.executeUpdate();
                ps.setString(1, domainId);
                int deleted = ps.executeUpdate();
                conn.commit();
                return deleted == 1;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            if (hasState(e, FOREIGN_KEY_VIOLATION)) {
                throw new DomainInUseException(domainId, e);
            }
            log.error("delete({}) failed: {}", domainId, e.getMessage());
            throw new IllegalStateException("Failed to delete domain", e);
        }
    }

    private Domain map(ResultSet rs) throws SQLException {
        Domain domain = new Domain();
        domain.setId(rs.getString("id"));
        domain.setName(rs.getString("name"));
        domain.setStatus(DomainStatus.valueOf(rs.getString("status")));
        domain.setCreatedAt(toOffsetDateTime(rs.getTimestamp("created_at")));
        domain.setVerificationStartedAt(toOffsetDateTime(rs.getTimestamp("verification_started_at")));
        domain.setVerifiedAt(toOffsetDateTime(rs.getTimestamp("verified_at")));
        domain.setLastCheckedAt(toOffsetDateTime(rs.getTimestamp("last_checked_at")));
        domain.setFailureReason(rs.getString("failure_reason"));
        domain.setProviderIdentityRef(rs.getString("provider_identity_ref"));
        domain.setDnsRecords(DnsRecordCodec.decode(rs.getString("dns_records")));
        return domain;
    }
}
