package com.selfmx.auth;

import at.favre.lib.crypto.bcrypt.BCrypt;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Admin password login against a configured BCrypt hash.
 *
 * <p>Without a configured hash every login attempt fails.
 */
public class AdminLoginService {
    private static final Logger log = LogManager.getLogger(AdminLoginService.class);

    static final int BCRYPT_COST = 12;

    private final String passwordHash;
    private final AdminSessionStore sessions;

    public AdminLoginService(String passwordHash, AdminSessionStore sessions) {
        this.passwordHash = passwordHash;
        this.sessions = sessions;
        if (!isConfigured()) {
            log.warn("Admin password hash not configured, admin login is disabled");
        }
    }

    /**
     * Verifies the password and opens a session.
     *
     * @param password Presented password.
     * @return Session token on success.
     */
    public Optional<String> login(String password) {
        if (!isConfigured() || password == null || password.isEmpty()) {
            return Optional.empty();
        }
        BCrypt.Result result = BCrypt.verifyer().verify(password.toCharArray(), passwordHash);
        if (!result.validFormat) {
            log.error("Admin password hash is not a valid BCrypt hash: {}", result.formatErrorMessage);
            return Optional.empty();
        }
        if (!result.verified) {
            log.info("Admin login failed: password mismatch");
            return Optional.empty();
        }
        log.info("Admin login succeeded");
        return Optional.of(sessions.create());
    }

    public void logout(String token) {
        sessions.invalidate(token);
    }

    public boolean isConfigured() {
        return passwordHash != null && !passwordHash.isBlank();
    }

    /**
     * Hashes a password for the admin configuration.
     *
     * @param password Plain password.
     * @return BCrypt hash.
     */
    public static String hashPassword(String password) {
        return BCrypt.withDefaults().hashToString(BCRYPT_COST, password.toCharArray());
    }
}
