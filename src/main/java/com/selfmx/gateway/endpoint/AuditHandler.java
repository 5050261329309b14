package com.selfmx.gateway.endpoint;

import com.selfmx.audit.AuditEntry;
import com.selfmx.audit.AuditLogRepository;
import com.selfmx.audit.AuditQuery;
import com.selfmx.auth.AuthorizationGate;
import com.selfmx.auth.ratelimit.RateLimiter;
import com.selfmx.endpoints.HttpEndpoint;
import com.selfmx.error.ApiError;
import com.selfmx.error.ApiException;
import com.selfmx.gateway.endpoint.dto.AuditEntryDto;
import com.selfmx.gateway.endpoint.dto.PageDto;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Handler for GET /audit. Admin only.
 *
 * <p>Filters: {@code action}, {@code actorId}, {@code from} and {@code to} as ISO-8601
 * timestamps. Newest entries first.
 */
public class AuditHandler extends ApiRouter {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 100;

    private final AuditLogRepository repository;

    public AuditHandler(HttpEndpoint endpoint, AuthorizationGate gate, RateLimiter apiLimiter,
                        AuditLogRepository repository) {
        super("/audit", endpoint, gate, apiLimiter);
        this.repository = repository;
    }

    @Override
    protected void route(HttpExchange exchange, String method, String tail) throws IOException {
        requireAdmin(exchange);
        if (!tail.isEmpty()) throw notFound();
        if (!"GET".equals(method)) throw methodNotAllowed();

        Map<String, String> params = query(exchange);
        AuditQuery query = new AuditQuery()
                .setPage(page(params))
                .setLimit(limit(params, DEFAULT_LIMIT, MAX_LIMIT))
                .setAction(blankToNull(params.get("action")))
                .setActorId(blankToNull(params.get("actorId")))
                .setFrom(parseTime(params.get("from"), "from"))
                .setTo(parseTime(params.get("to"), "to"));

        List<AuditEntryDto> data = new ArrayList<>();
        for (AuditEntry entry : repository.find(query)) {
            data.add(new AuditEntryDto(entry.getId(), toIso(entry.getTimestamp()), entry.getAction(),
                    entry.getActorType(), entry.getActorId(), entry.getResourceType(), entry.getResourceId(),
                    entry.getStatusCode(), entry.getErrorMessage(), entry.getDetails(),
                    entry.getIpAddress(), entry.getUserAgent()));
        }
        sendJson(exchange, 200, new PageDto<>(data, query.getPage(), query.getLimit(), repository.count(query)));
    }

    static OffsetDateTime parseTime(String value, String name) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ApiException(ApiError.INVALID_REQUEST, "Invalid '" + name + "' timestamp");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
