package com.selfmx.auth;

import com.sun.net.httpserver.HttpExchange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the caller of a request.
 *
 * <p>A bearer API key is tried first, then the admin session cookie.
 */
public class AuthorizationGate {
    private static final Logger log = LogManager.getLogger(AuthorizationGate.class);

    public static final String SESSION_COOKIE = "selfmx_session";
    private static final String BEARER = "Bearer ";

    private final ApiKeyService apiKeys;
    private final AdminSessionStore sessions;

    public AuthorizationGate(ApiKeyService apiKeys, AdminSessionStore sessions) {
        this.apiKeys = apiKeys;
        this.sessions = sessions;
    }

    /**
     * Authenticates a request.
     *
     * @param exchange HTTP exchange.
     * @return Actor, or empty when no valid credential was presented.
     */
    public Optional<Actor> authenticate(HttpExchange exchange) {
        String header = exchange.getRequestHeaders().getFirst("Authorization");
        if (header != null && header.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            String token = header.substring(BEARER.length()).trim();
            Optional<Actor> actor = apiKeys.validate(token, clientIp(exchange)).map(Actor::forApiKey);
            if (actor.isEmpty()) {
                log.debug("Authentication failed: invalid API key from {}", exchange.getRemoteAddress());
            }
            return actor;
        }

        String session = sessionToken(exchange);
        if (session != null) {
            if (sessions.isValid(session)) {
                return Optional.of(Actor.adminSession());
            }
            log.debug("Authentication failed: unknown or expired session from {}", exchange.getRemoteAddress());
        }
        return Optional.empty();
    }

    /**
     * Extracts the session cookie value.
     *
     * @param exchange HTTP exchange.
     * @return Token or null.
     */
    public static String sessionToken(HttpExchange exchange) {
        List<String> cookies = exchange.getRequestHeaders().get("Cookie");
        if (cookies == null) {
            return null;
        }
        for (String header : cookies) {
            for (String part : header.split(";")) {
                String cookie = part.trim();
                int eq = cookie.indexOf('=');
                if (eq > 0 && SESSION_COOKIE.equals(cookie.substring(0, eq).trim())) {
                    String value = cookie.substring(eq + 1).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }

    /**
     * Gets the remote IP of a request.
     *
     * @param exchange HTTP exchange.
     * @return IP string or "unknown".
     */
    public static String clientIp(HttpExchange exchange) {
        InetSocketAddress remote = exchange.getRemoteAddress();
        if (remote == null || remote.getAddress() == null) {
            return "unknown";
        }
        return remote.getAddress().getHostAddress();
    }
}
