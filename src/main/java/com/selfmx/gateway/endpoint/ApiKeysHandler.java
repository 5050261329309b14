package com.selfmx.gateway.endpoint;

import com.selfmx.audit.AuditActions;
import com.selfmx.audit.AuditEntry;
import com.selfmx.audit.AuditRecorder;
import com.selfmx.auth.Actor;
import com.selfmx.auth.ApiKeyService;
import com.selfmx.auth.AuthorizationGate;
import com.selfmx.auth.ratelimit.RateLimiter;
import com.selfmx.endpoints.ApiEndpointUtils;
import com.selfmx.endpoints.HttpEndpoint;
import com.selfmx.error.ApiError;
import com.selfmx.error.ApiException;
import com.selfmx.gateway.domain.ApiKey;
import com.selfmx.gateway.domain.RevokedApiKey;
import com.selfmx.gateway.endpoint.dto.ApiKeyDto;
import com.selfmx.gateway.endpoint.dto.PageDto;
import com.selfmx.gateway.endpoint.dto.RevokedApiKeyDto;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handler for API key management. Admin only.
 *
 * <ul>
 *   <li><b>GET /api-keys</b>: paginated list of active and revoked keys.</li>
 *   <li><b>POST /api-keys</b>: creates a key, the secret is returned once.</li>
 *   <li><b>GET /api-keys/revoked</b>: archived keys.</li>
 *   <li><b>GET /api-keys/{id}</b>: one key.</li>
 *   <li><b>DELETE /api-keys/{id}</b>: revokes a key.</li>
 * </ul>
 */
public class ApiKeysHandler extends ApiRouter {

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private final ApiKeyService keys;
    private final AuditRecorder audit;

    public ApiKeysHandler(HttpEndpoint endpoint, AuthorizationGate gate, RateLimiter apiLimiter,
                          ApiKeyService keys, AuditRecorder audit) {
        super("/api-keys", endpoint, gate, apiLimiter);
        this.keys = keys;
        this.audit = audit;
    }

    @Override
    protected void route(HttpExchange exchange, String method, String tail) throws IOException {
        Actor actor = requireAdmin(exchange);

        if (tail.isEmpty()) {
            switch (method) {
                case "GET" -> handleList(exchange);
                case "POST" -> handleCreate(exchange, actor);
                default -> throw methodNotAllowed();
            }
            return;
        }

        if ("/revoked".equals(tail)) {
            if (!"GET".equals(method)) throw methodNotAllowed();
            handleListRevoked(exchange);
            return;
        }

        if (segmentCount(tail) == 1) {
            String id = segment(tail, 0);
            switch (method) {
                case "GET" -> {
                    ApiKey key = keys.get(id).orElseThrow(() -> new ApiException(ApiError.NOT_FOUND, "API key not found"));
                    sendJson(exchange, 200, toDto(key, null));
                }
                case "DELETE" -> handleRevoke(exchange, actor, id);
                default -> throw methodNotAllowed();
            }
            return;
        }

        throw notFound();
    }

    private void handleList(HttpExchange exchange) throws IOException {
        Map<String, String> query = query(exchange);
        int page = page(query);
        int limit = limit(query, DEFAULT_LIMIT, MAX_LIMIT);
        List<ApiKeyDto> data = new ArrayList<>();
        for (ApiKey key : keys.list(page, limit)) {
            data.add(toDto(key, null));
        }
        sendJson(exchange, 200, new PageDto<>(data, page, limit, keys.count()));
    }

    private void handleListRevoked(HttpExchange exchange) throws IOException {
        Map<String, String> query = query(exchange);
        int page = page(query);
        int limit = limit(query, DEFAULT_LIMIT, MAX_LIMIT);
        List<RevokedApiKeyDto> data = new ArrayList<>();
        for (RevokedApiKey key : keys.listArchived(page, limit)) {
            data.add(new RevokedApiKeyDto(key.getId(), key.getName(), key.getKeyPrefix(), key.isAdmin(),
                    toIso(key.getCreatedAt()), toIso(key.getRevokedAt()), toIso(key.getArchivedAt()),
                    toIso(key.getLastUsedAt()), key.getLastUsedIp(), key.getAllowedDomainIds()));
        }
        sendJson(exchange, 200, new PageDto<>(data, page, limit, keys.countArchived()));
    }

    private void handleCreate(HttpExchange exchange, Actor actor) throws IOException {
        Map<String, Object> body = readJson(exchange);
        String name = ApiEndpointUtils.getString(body, "name");
        boolean admin = Boolean.TRUE.equals(body.get("isAdmin"));
        Object domainIds = body.containsKey("allowedDomainIds") ? body.get("allowedDomainIds") : body.get("domainIds");

        ApiKeyService.CreatedApiKey created;
        try {
            created = keys.create(name, admin, ApiEndpointUtils.toStringList(domainIds));
        } catch (ApiException e) {
            audit.record(entry(AuditActions.API_KEY_CREATE, actor, exchange, null, e.getStatus())
                    .setErrorMessage(e.getMessage()));
            throw e;
        }

        ApiKey key = created.key();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("name", key.getName());
        details.put("isAdmin", key.isAdmin());
        details.put("allowedDomainIds", key.getAllowedDomainIds());
        audit.record(entry(AuditActions.API_KEY_CREATE, actor, exchange, key.getId(), 201)
                .setDetails(gson.toJson(details)));
        sendJson(exchange, 201, toDto(key, created.secret()));
    }

    private void handleRevoke(HttpExchange exchange, Actor actor, String id) throws IOException {
        ApiKey key;
        try {
            key = keys.revoke(id);
        } catch (ApiException e) {
            audit.record(entry(AuditActions.API_KEY_REVOKE, actor, exchange, id, e.getStatus())
                    .setErrorMessage(e.getMessage()));
            throw e;
        }
        audit.record(entry(AuditActions.API_KEY_REVOKE, actor, exchange, id, 200));
        sendJson(exchange, 200, toDto(key, null));
    }

    private AuditEntry entry(String action, Actor actor, HttpExchange exchange, String keyId, int status) {
        return new AuditEntry()
                .setAction(action)
                .setActorType(actor.getType().apiName())
                .setActorId(actor.getActorId())
                .setResourceType("api_key")
                .setResourceId(keyId)
                .setStatusCode(status)
                .setIpAddress(AuthorizationGate.clientIp(exchange))
                .setUserAgent(userAgent(exchange));
    }

    static ApiKeyDto toDto(ApiKey key, String secret) {
        return new ApiKeyDto(
                key.getId(),
                key.getName(),
                secret,
                key.getKeyPrefix(),
                key.isAdmin(),
                toIso(key.getCreatedAt()),
                toIso(key.getRevokedAt()),
                toIso(key.getLastUsedAt()),
                key.getLastUsedIp(),
                key.getAllowedDomainIds());
    }
}
