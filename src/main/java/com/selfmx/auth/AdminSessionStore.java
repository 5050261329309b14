package com.selfmx.auth;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory admin sessions keyed by an opaque cookie token.
 *
 * <p>Sessions do not survive a restart.
 */
public class AdminSessionStore {
    private static final Logger log = LogManager.getLogger(AdminSessionStore.class);

    private final ConcurrentMap<String, Instant> sessions = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();
    private final Duration lifetime;
    private final Clock clock;

    public AdminSessionStore(Duration lifetime, Clock clock) {
        this.lifetime = lifetime;
        this.clock = clock;
    }

    /**
     * Opens a session.
     *
     * @return Session token.
     */
    public String create() {
        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        String token = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        sessions.put(token, clock.instant().plus(lifetime));
        purgeExpired();
        log.debug("Admin session created, active sessions={}", sessions.size());
        return token;
    }

    /**
     * Checks a token.
     *
     * @param token Cookie value.
     * @return True when known and not expired.
     */
    public boolean isValid(String token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        Instant expires = sessions.get(token);
        if (expires == null) {
            return false;
        }
        if (!clock.instant().isBefore(expires)) {
            sessions.remove(token);
            return false;
        }
        return true;
    }

    public void invalidate(String token) {
        if (token != null) {
            sessions.remove(token);
        }
    }

    public Duration getLifetime() {
        return lifetime;
    }

    /**
     * Drops expired sessions.
     *
     * @return Number removed.
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.values().removeIf(expires -> !now.isBefore(expires));
        return before - sessions.size();
    }
}
