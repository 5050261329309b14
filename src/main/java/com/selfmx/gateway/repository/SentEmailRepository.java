package com.selfmx.gateway.repository;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.selfmx.gateway.domain.SentEmail;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.lang.reflect.Type;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static com.selfmx.db.JdbcSupport.placeholders;
import static com.selfmx.db.JdbcSupport.setTimestamp;
import static com.selfmx.db.JdbcSupport.toOffsetDateTime;

/**
 * JDBC DAO for {@code sent_emails}.
 *
 * <p>Address lists are stored as JSON arrays.
 */
public class SentEmailRepository {

    private static final Logger log = LogManager.getLogger(SentEmailRepository.class);
    private static final Gson GSON = new Gson();
    private static final Type LIST_TYPE = new TypeToken<List<String>>() {}.getType();

    private static final String INSERT =
            "INSERT INTO sent_emails (id, message_id, sent_at, from_address, to_addresses, cc_addresses, " +
            "bcc_addresses, reply_to, subject, html_body, text_body, domain_id, api_key_id) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SELECT_BY_ID =
            "SELECT * FROM sent_emails WHERE id = ?";

    private static final String DELETE_OLDER_THAN =
            "DELETE FROM sent_emails WHERE id IN " +
            "(SELECT id FROM sent_emails WHERE sent_at < ? ORDER BY sent_at ASC LIMIT ?)";

    private final DataSource dataSource;

    public SentEmailRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public SentEmail insert(SentEmail email) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT)) {
            ps.setString(1, email.getId());
            ps.setString(2, email.getMessageId());
            setTimestamp(ps, 3, email.getSentAt());
            ps.setString(4, email.getFromAddress());
            ps.setString(5, toJson(email.getTo()));
            ps.setString(6, toJson(email.getCc()));
            ps.setString(7, toJson(email.getBcc()));
            ps.setString(8, toJson(email.getReplyTo()));
            ps.setString(9, email.getSubject());
            ps.setString(10, email.getHtmlBody());
            ps.setString(11, email.getTextBody());
            ps.setString(12, email.getDomainId());
            ps.setString(13, email.getApiKeyId());
            ps.executeUpdate();
            return email;
        } catch (SQLException e) {
            log.error("insert({}) failed: {}", email.getMessageId(), e.getMessage());
            throw new IllegalStateException("Failed to insert sent email", e);
        }
    }

    public Optional<SentEmail> findById(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_BY_ID)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            log.error("findById({}) failed: {}", id, e.getMessage());
            throw new IllegalStateException("Failed to find sent email", e);
        }
    }

    /**
     * Returns emails strictly after a keyset position, ordered {@code sent_at DESC, id DESC}.
     *
     * @param scope       domain ids the caller may see, or null for all
     * @param domainId    optional single-domain filter
     * @param afterSentAt cursor timestamp, or null for the first page
     * @param afterId     cursor id, paired with {@code afterSentAt}
     * @param limit       rows to return
     */
    public List<SentEmail> findPage(Collection<String> scope, String domainId,
                                    OffsetDateTime afterSentAt, String afterId, int limit) {
        if (scope != null && scope.isEmpty()) {
            return new ArrayList<>();
        }
        StringBuilder sql = new StringBuilder("SELECT * FROM sent_emails WHERE 1 = 1");
        if (scope != null) {
            sql.append(" AND domain_id IN (").append(placeholders(scope.size())).append(")");
        }
        if (domainId != null) {
            sql.append(" AND domain_id = ?");
        }
        if (afterSentAt != null) {
            sql.append(" AND (sent_at < ? OR (sent_at = ? AND id < ?))");
        }
        sql.append(" ORDER BY sent_at DESC, id DESC LIMIT ?");

        List<SentEmail> emails = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            int idx = 1;
            if (scope != null) {
                for (String id : scope) {
                    ps.setString(idx++, id);
                }
            }
            if (domainId != null) {
                ps.setString(idx++, domainId);
            }
            if (afterSentAt != null) {
                setTimestamp(ps, idx++, afterSentAt);
                setTimestamp(ps, idx++, afterSentAt);
                ps.setString(idx++, afterId);
            }
            ps.setInt(idx, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    emails.add(map(rs));
                }
            }
        } catch (SQLException e) {
            log.error("findPage(domainId={}, limit={}) failed: {}", domainId, limit, e.getMessage());
            throw new IllegalStateException("Failed to list sent emails", e);
        }
        return emails;
    }

    /**
     * Deletes at most {@code batchSize} emails sent before the cutoff in a single statement.
     *
     * @return rows deleted
     */
    public int deleteOlderThan(OffsetDateTime cutoff, int batchSize) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(DELETE_OLDER_THAN)) {
            setTimestamp(ps, 1, cutoff);
            ps.setInt(2, batchSize);
            return ps.executeUpdate();
        } catch (SQLException e) {
            log.error("deleteOlderThan({}) failed: {}", cutoff, e.getMessage());
            throw new IllegalStateException("Failed to delete sent emails", e);
        }
    }

    private static String toJson(List<String> list) {
        return list == null || list.isEmpty() ? null : GSON.toJson(list);
    }

    private static List<String> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        List<String> list = GSON.fromJson(json, LIST_TYPE);
        return list != null ? list : new ArrayList<>();
    }

    private SentEmail map(ResultSet rs) throws SQLException {
        SentEmail email = new SentEmail();
        email.setId(rs.getString("id"));
        email.setMessageId(rs.getString("message_id"));
        email.setSentAt(toOffsetDateTime(rs.getTimestamp("sent_at")));
        email.setFromAddress(rs.getString("from_address"));
        email.setTo(fromJson(rs.getString("to_addresses")));
        email.setCc(fromJson(rs.getString("cc_addresses")));
        email.setBcc(fromJson(rs.getString("bcc_addresses")));
        email.setReplyTo(fromJson(rs.getString("reply_to")));
        email.setSubject(rs.getString("subject"));
        email.setHtmlBody(rs.getString("html_body"));
        email.setTextBody(rs.getString("text_body"));
        email.setDomainId(rs.getString("domain_id"));
        email.setApiKeyId(rs.getString("api_key_id"));
        return email;
    }
}
