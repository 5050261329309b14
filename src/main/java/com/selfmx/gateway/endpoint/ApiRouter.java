package com.selfmx.gateway.endpoint;

import com.google.gson.Gson;
import com.selfmx.auth.Actor;
import com.selfmx.auth.AuthorizationGate;
import com.selfmx.auth.ratelimit.RateLimitDecision;
import com.selfmx.auth.ratelimit.RateLimiter;
import com.selfmx.endpoints.ApiEndpointUtils;
import com.selfmx.endpoints.ApiHandler;
import com.selfmx.endpoints.HttpEndpoint;
import com.selfmx.error.ApiError;
import com.selfmx.error.ApiException;
import com.selfmx.gateway.endpoint.dto.ErrorDto;
import com.selfmx.metrics.GatewayMetrics;
import com.sun.net.httpserver.HttpExchange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Base class for the gateway API handlers.
 *
 * <p>Dispatches on method and the path remainder after {@link #getPath()}, converts
 * {@link ApiException} into the JSON error envelope and any other failure into
 * {@code internal_error}. Authenticated routes pass the API rate limiter before credentials
 * are checked.
 */
public abstract class ApiRouter implements ApiHandler {
    private static final Logger log = LogManager.getLogger(ApiRouter.class);

    protected final HttpEndpoint endpoint;
    protected final AuthorizationGate gate;
    protected final Gson gson = ApiEndpointUtils.getGson();
    private final RateLimiter apiLimiter;
    private final String path;

    /**
     * Constructs a new ApiRouter.
     *
     * @param path       Path prefix.
     * @param endpoint   Parent endpoint for response utilities.
     * @param gate       Caller authentication.
     * @param apiLimiter Limiter applied before authentication.
     */
    protected ApiRouter(String path, HttpEndpoint endpoint, AuthorizationGate gate, RateLimiter apiLimiter) {
        this.path = path;
        this.endpoint = endpoint;
        this.gate = gate;
        this.apiLimiter = apiLimiter;
    }

    @Override
    public String getPath() {
        return path;
    }

    @Override
    public final void handle(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod().toUpperCase();
        String requestPath = exchange.getRequestURI().getPath();
        String tail = requestPath.length() > path.length() ? requestPath.substring(path.length()) : "";
        if (tail.endsWith("/")) {
            tail = tail.substring(0, tail.length() - 1);
        }
        log.debug("{} {} from {}", method, requestPath, exchange.getRemoteAddress());

        try {
            // The server matches contexts by plain prefix, so /domainsfoo lands here too.
            if (!tail.isEmpty() && !tail.startsWith("/")) {
                throw notFound();
            }
            route(exchange, method, tail);
        } catch (ApiException e) {
            sendError(exchange, e.getError(), e.getMessage());
        } catch (Exception e) {
            log.error("{} {} failed: {}", method, requestPath, e.getMessage(), e);
            sendError(exchange, ApiError.INTERNAL_ERROR, ApiError.INTERNAL_ERROR.getMessage());
        }
    }

    /**
     * Handles a request.
     *
     * @param exchange HTTP exchange.
     * @param method   Upper case method.
     * @param tail     Path after the prefix without a trailing slash, empty for the collection.
     * @throws IOException If an I/O error occurs.
     */
    protected abstract void route(HttpExchange exchange, String method, String tail) throws IOException;

    /**
     * Applies the API limiter then resolves the caller.
     *
     * @param exchange HTTP exchange.
     * @return Actor.
     */
    protected Actor authenticate(HttpExchange exchange) {
        rateLimit(exchange, apiLimiter);
        return gate.authenticate(exchange)
                .orElseThrow(() -> new ApiException(ApiError.UNAUTHORIZED));
    }

    /**
     * Resolves the caller and requires admin rights.
     *
     * @param exchange HTTP exchange.
     * @return Admin actor.
     */
    protected Actor requireAdmin(HttpExchange exchange) {
        Actor actor = authenticate(exchange);
        if (!actor.isAdmin()) {
            throw new ApiException(ApiError.FORBIDDEN, "Admin access required");
        }
        return actor;
    }

    /**
     * Consumes a permit for the caller address or rejects with 429 and {@code Retry-After}.
     *
     * @param exchange HTTP exchange.
     * @param limiter  Limiter, null to skip.
     */
    protected void rateLimit(HttpExchange exchange, RateLimiter limiter) {
        if (limiter == null) {
            return;
        }
        String ip = AuthorizationGate.clientIp(exchange);
        RateLimitDecision decision = limiter.tryAcquire(ip);
        if (!decision.allowed()) {
            GatewayMetrics.incrementRateLimited(limiter.getName());
            log.info("Rate limit {} exceeded by {}, retry in {}s", limiter.getName(), ip, decision.retryAfterSeconds());
            exchange.getResponseHeaders().set("Retry-After", String.valueOf(decision.retryAfterSeconds()));
            throw new ApiException(ApiError.RATE_LIMITED);
        }
    }

    protected Map<String, Object> readJson(HttpExchange exchange) {
        try {
            return ApiEndpointUtils.parseJsonBody(exchange.getRequestBody());
        } catch (IOException e) {
            throw new ApiException(ApiError.INVALID_REQUEST, "Invalid JSON body");
        }
    }

    protected List<Map<String, Object>> readJsonArray(HttpExchange exchange) {
        try {
            return ApiEndpointUtils.parseJsonArrayBody(exchange.getRequestBody());
        } catch (IOException e) {
            throw new ApiException(ApiError.INVALID_REQUEST, "Invalid JSON body");
        }
    }

    protected Map<String, String> query(HttpExchange exchange) {
        return ApiEndpointUtils.parseQuery(exchange.getRequestURI());
    }

    protected void sendJson(HttpExchange exchange, int status, Object payload) throws IOException {
        endpoint.sendJson(exchange, status, gson.toJson(payload));
    }

    protected void sendError(HttpExchange exchange, ApiError error, String message) throws IOException {
        if (error.getStatus() >= 500) {
            log.warn("Responding {} {}", error.getStatus(), error.getCode());
        }
        sendJson(exchange, error.getStatus(), ErrorDto.of(error.getCode(), message));
    }

    protected static ApiException methodNotAllowed() {
        return new ApiException(ApiError.METHOD_NOT_ALLOWED);
    }

    protected static ApiException notFound() {
        return new ApiException(ApiError.NOT_FOUND);
    }

    /**
     * Reads the page number, falling back to 1.
     */
    protected static int page(Map<String, String> query) {
        int page = ApiEndpointUtils.toInt(query.get("page"), 1);
        return page < 1 ? 1 : page;
    }

    /**
     * Reads a limit, falling back to the default when outside 1..max.
     */
    protected static int limit(Map<String, String> query, int fallback, int max) {
        int limit = ApiEndpointUtils.toInt(query.get("limit"), fallback);
        return limit < 1 || limit > max ? fallback : limit;
    }

    /**
     * Extracts the id segment from a tail such as {@code /abc} or {@code /abc/verify}.
     */
    protected static String segment(String tail, int index) {
        String[] parts = tail.startsWith("/") ? tail.substring(1).split("/") : tail.split("/");
        return index < parts.length ? ApiEndpointUtils.urlDecode(parts[index]) : null;
    }

    protected static int segmentCount(String tail) {
        if (tail.isEmpty()) {
            return 0;
        }
        return (tail.startsWith("/") ? tail.substring(1) : tail).split("/").length;
    }

    protected static String toIso(OffsetDateTime value) {
        return value != null ? value.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME) : null;
    }

    protected static String userAgent(HttpExchange exchange) {
        return exchange.getRequestHeaders().getFirst("User-Agent");
    }
}
