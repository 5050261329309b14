package com.selfmx.gateway.service;

import com.selfmx.config.server.AdminConfig;
import com.selfmx.config.server.AwsConfig;
import com.selfmx.provider.ses.IdentityProviderClient;
import com.selfmx.provider.ses.IdentityProviderException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Readiness checks reported by {@code /system/status}.
 */
public class SystemStatusService {
    private static final Logger log = LogManager.getLogger(SystemStatusService.class);

    private final DataSource dataSource;
    private final IdentityProviderClient identityProvider;
    private final AwsConfig aws;
    private final AdminConfig admin;
    private final Clock clock;

    public SystemStatusService(DataSource dataSource, IdentityProviderClient identityProvider,
                               AwsConfig aws, AdminConfig admin, Clock clock) {
        this.dataSource = dataSource;
        this.identityProvider = identityProvider;
        this.aws = aws;
        this.admin = admin;
        this.clock = clock;
    }

    /**
     * Runs every check.
     *
     * @return Status with the issues found.
     */
    public SystemStatus check() {
        List<String> issues = new ArrayList<>();

        try {
            if (!identityProvider.isSendingEnabled()) {
                issues.add("AWS SES: sending is disabled for this account");
            }
        } catch (IdentityProviderException e) {
            log.warn("SES account check failed: {}", e.getMessage());
            issues.add("AWS SES: " + e.getMessage());
        }

        try (Connection conn = dataSource.getConnection()) {
            if (!conn.isValid(5)) {
                issues.add("Database: connection is not valid");
            }
        } catch (SQLException e) {
            log.warn("Database connectivity check failed: {}", e.getMessage());
            issues.add("Database: " + e.getMessage());
        }

        if (aws.getRegion().isBlank()) {
            issues.add("AWS: region not configured (aws.region)");
        }
        if (aws.getAccessKeyId().isBlank() != aws.getSecretAccessKey().isBlank()) {
            issues.add("AWS: accessKeyId and secretAccessKey must be set together");
        }
        if (admin.getPasswordHash().isBlank()) {
            issues.add("Admin: password hash not configured (admin.passwordHash)");
        }

        return new SystemStatus(issues.isEmpty(), issues, OffsetDateTime.now(clock));
    }

    /**
     * Outcome of the readiness checks.
     *
     * @param healthy   True when no issue was found.
     * @param issues    Human readable issues.
     * @param timestamp Check time.
     */
    public record SystemStatus(boolean healthy, List<String> issues, OffsetDateTime timestamp) {
    }
}
