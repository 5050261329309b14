package com.selfmx.gateway.endpoint;

import com.selfmx.audit.AuditActions;
import com.selfmx.audit.AuditEntry;
import com.selfmx.audit.AuditRecorder;
import com.selfmx.auth.ActorType;
import com.selfmx.auth.AdminLoginService;
import com.selfmx.auth.AdminSessionStore;
import com.selfmx.auth.AuthorizationGate;
import com.selfmx.auth.ratelimit.RateLimiter;
import com.selfmx.endpoints.ApiEndpointUtils;
import com.selfmx.endpoints.HttpEndpoint;
import com.selfmx.error.ApiError;
import com.selfmx.error.ApiException;
import com.sun.net.httpserver.HttpExchange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Handler for admin session endpoints.
 *
 * <ul>
 *   <li><b>POST /admin/login</b>: password login, sets the session cookie.</li>
 *   <li><b>POST /admin/logout</b>: ends the session and clears the cookie.</li>
 *   <li><b>GET /admin/me</b>: reports whether the session cookie is valid.</li>
 * </ul>
 */
public class AdminHandler extends ApiRouter {
    private static final Logger log = LogManager.getLogger(AdminHandler.class);

    private final AdminLoginService login;
    private final AdminSessionStore sessions;
    private final RateLimiter loginLimiter;
    private final AuditRecorder audit;
    private final boolean secureCookie;

    public AdminHandler(HttpEndpoint endpoint, AuthorizationGate gate, AdminLoginService login,
                        AdminSessionStore sessions, RateLimiter loginLimiter, AuditRecorder audit,
                        boolean secureCookie) {
        super("/admin", endpoint, gate, null);
        this.login = login;
        this.sessions = sessions;
        this.loginLimiter = loginLimiter;
        this.audit = audit;
        this.secureCookie = secureCookie;
    }

    @Override
    protected void route(HttpExchange exchange, String method, String tail) throws IOException {
        switch (tail) {
            case "/login" -> {
                if (!"POST".equals(method)) throw methodNotAllowed();
                handleLogin(exchange);
            }
            case "/logout" -> {
                if (!"POST".equals(method)) throw methodNotAllowed();
                handleLogout(exchange);
            }
            case "/me" -> {
                if (!"GET".equals(method)) throw methodNotAllowed();
                handleMe(exchange);
            }
            default -> throw notFound();
        }
    }

    private void handleLogin(HttpExchange exchange) throws IOException {
        rateLimit(exchange, loginLimiter);
        Map<String, Object> body = readJson(exchange);
        String password = ApiEndpointUtils.getString(body, "password");
        if (password == null || password.isEmpty()) {
            throw new ApiException(ApiError.INVALID_REQUEST, "Password is required");
        }

        Optional<String> token = login.login(password);
        String ip = AuthorizationGate.clientIp(exchange);
        if (token.isEmpty()) {
            record(AuditActions.ADMIN_LOGIN, 401, "Invalid password", ip, userAgent(exchange));
            throw new ApiException(ApiError.UNAUTHORIZED, "Invalid password");
        }

        exchange.getResponseHeaders().add("Set-Cookie", cookie(token.get(), sessions.getLifetime().getSeconds()));
        record(AuditActions.ADMIN_LOGIN, 200, null, ip, userAgent(exchange));
        log.info("Admin login from {}", ip);
        sendJson(exchange, 200, Map.of("success", true));
    }

    private void handleLogout(HttpExchange exchange) throws IOException {
        String token = AuthorizationGate.sessionToken(exchange);
        if (token != null) {
            login.logout(token);
            record(AuditActions.ADMIN_LOGOUT, 200, null, AuthorizationGate.clientIp(exchange), userAgent(exchange));
        }
        exchange.getResponseHeaders().add("Set-Cookie", cookie("", 0));
        sendJson(exchange, 200, Map.of("success", true));
    }

    private void handleMe(HttpExchange exchange) throws IOException {
        String token = AuthorizationGate.sessionToken(exchange);
        if (token == null || !sessions.isValid(token)) {
            throw new ApiException(ApiError.UNAUTHORIZED);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("authenticated", true);
        body.put("actorType", ActorType.ADMIN.apiName());
        sendJson(exchange, 200, body);
    }

    /**
     * Builds the session cookie header value.
     *
     * @param value         Token, empty to clear.
     * @param maxAgeSeconds Lifetime, 0 to expire immediately.
     * @return Header value.
     */
    String cookie(String value, long maxAgeSeconds) {
        StringBuilder sb = new StringBuilder(AuthorizationGate.SESSION_COOKIE)
                .append('=').append(value)
                .append("; Path=/; HttpOnly; SameSite=Strict; Max-Age=").append(maxAgeSeconds);
        if (secureCookie) {
            sb.append("; Secure");
        }
        return sb.toString();
    }

    private void record(String action, int status, String error, String ip, String userAgent) {
        audit.record(new AuditEntry()
                .setAction(action)
                .setActorType(ActorType.ADMIN.apiName())
                .setResourceType("session")
                .setStatusCode(status)
                .setErrorMessage(error)
                .setIpAddress(ip)
                .setUserAgent(userAgent));
    }
}
