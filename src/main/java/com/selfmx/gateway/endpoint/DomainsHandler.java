package com.selfmx.gateway.endpoint;

import com.selfmx.audit.AuditActions;
import com.selfmx.audit.AuditEntry;
import com.selfmx.audit.AuditRecorder;
import com.selfmx.auth.Actor;
import com.selfmx.auth.AuthorizationGate;
import com.selfmx.auth.ratelimit.RateLimiter;
import com.selfmx.endpoints.ApiEndpointUtils;
import com.selfmx.endpoints.HttpEndpoint;
import com.selfmx.error.ApiException;
import com.selfmx.gateway.domain.DnsRecord;
import com.selfmx.gateway.domain.Domain;
import com.selfmx.gateway.endpoint.dto.DnsRecordDto;
import com.selfmx.gateway.endpoint.dto.DomainDto;
import com.selfmx.gateway.endpoint.dto.IdDto;
import com.selfmx.gateway.endpoint.dto.PageDto;
import com.selfmx.gateway.service.DomainSetupDispatcher;
import com.selfmx.gateway.service.DomainVerificationService;
import com.selfmx.gateway.service.EmailService;
import com.selfmx.gateway.service.TestEmailRequest;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Handler for the /domains endpoints.
 *
 * <ul>
 *   <li><b>GET /domains</b>: paginated list, limited to the caller's domains.</li>
 *   <li><b>POST /domains</b>: registers a domain and queues its setup.</li>
 *   <li><b>GET /domains/{id}</b>: domain with DNS records and next check time.</li>
 *   <li><b>DELETE /domains/{id}</b>: deletes a domain not referenced by active keys.</li>
 *   <li><b>POST /domains/{id}/verify</b>: immediate verification check.</li>
 *   <li><b>POST /domains/{id}/test-email</b>: sends a test email from the domain.</li>
 * </ul>
 */
public class DomainsHandler extends ApiRouter {

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private final DomainVerificationService domains;
    private final DomainSetupDispatcher dispatcher;
    private final EmailService emails;
    private final AuditRecorder audit;

    public DomainsHandler(HttpEndpoint endpoint, AuthorizationGate gate, RateLimiter apiLimiter,
                          DomainVerificationService domains, DomainSetupDispatcher dispatcher,
                          EmailService emails, AuditRecorder audit) {
        super("/domains", endpoint, gate, apiLimiter);
        this.domains = domains;
        this.dispatcher = dispatcher;
        this.emails = emails;
        this.audit = audit;
    }

    @Override
    protected void route(HttpExchange exchange, String method, String tail) throws IOException {
        Actor actor = authenticate(exchange);
        int segments = segmentCount(tail);

        if (segments == 0) {
            switch (method) {
                case "GET" -> handleList(exchange, actor);
                case "POST" -> handleCreate(exchange, actor);
                default -> throw methodNotAllowed();
            }
            return;
        }

        String id = segment(tail, 0);
        if (segments == 1) {
            switch (method) {
                case "GET" -> sendJson(exchange, 200, toDto(domains.getDomain(actor, id)));
                case "DELETE" -> handleDelete(exchange, actor, id);
                default -> throw methodNotAllowed();
            }
            return;
        }

        if (segments == 2 && "verify".equals(segment(tail, 1))) {
            if (!"POST".equals(method)) throw methodNotAllowed();
            Domain domain = domains.verifyNow(actor, id);
            audit.record(entry(AuditActions.DOMAIN_VERIFY, actor, exchange, id, 200));
            sendJson(exchange, 200, toDto(domain));
            return;
        }

        if (segments == 2 && "test-email".equals(segment(tail, 1))) {
            if (!"POST".equals(method)) throw methodNotAllowed();
            Map<String, Object> body = readJson(exchange);
            TestEmailRequest request = new TestEmailRequest(
                    ApiEndpointUtils.getString(body, "senderPrefix"),
                    ApiEndpointUtils.getString(body, "to"),
                    ApiEndpointUtils.getString(body, "subject"),
                    ApiEndpointUtils.getString(body, "text"));
            String emailId = emails.sendTestEmail(actor, id, request,
                    AuthorizationGate.clientIp(exchange), userAgent(exchange));
            sendJson(exchange, 200, new IdDto(emailId));
            return;
        }

        throw notFound();
    }

    private void handleList(HttpExchange exchange, Actor actor) throws IOException {
        Map<String, String> query = query(exchange);
        int page = page(query);
        int limit = limit(query, DEFAULT_LIMIT, MAX_LIMIT);
        List<DomainDto> data = new ArrayList<>();
        for (Domain domain : domains.listDomains(actor, page, limit)) {
            data.add(toDto(domain));
        }
        sendJson(exchange, 200, new PageDto<>(data, page, limit, domains.countDomains(actor)));
    }

    private void handleCreate(HttpExchange exchange, Actor actor) throws IOException {
        Map<String, Object> body = readJson(exchange);
        Domain domain;
        try {
            domain = domains.createDomain(ApiEndpointUtils.getString(body, "name"));
        } catch (ApiException e) {
            audit.record(entry(AuditActions.DOMAIN_CREATE, actor, exchange, null, e.getStatus())
                    .setErrorMessage(e.getMessage()));
            throw e;
        }
        dispatcher.submit(domain.getId());
        audit.record(entry(AuditActions.DOMAIN_CREATE, actor, exchange, domain.getId(), 201)
                .setDetails(gson.toJson(Map.of("name", domain.getName()))));
        exchange.getResponseHeaders().set("Location", "/domains/" + domain.getId());
        sendJson(exchange, 201, toDto(domain));
    }

    private void handleDelete(HttpExchange exchange, Actor actor, String id) throws IOException {
        try {
            domains.deleteDomain(actor, id);
        } catch (ApiException e) {
            audit.record(entry(AuditActions.DOMAIN_DELETE, actor, exchange, id, e.getStatus())
                    .setErrorMessage(e.getMessage()));
            throw e;
        }
        audit.record(entry(AuditActions.DOMAIN_DELETE, actor, exchange, id, 204));
        endpoint.sendNoContent(exchange, 204);
    }

    private AuditEntry entry(String action, Actor actor, HttpExchange exchange, String domainId, int status) {
        return new AuditEntry()
                .setAction(action)
                .setActorType(actor.getType().apiName())
                .setActorId(actor.getActorId())
                .setResourceType("domain")
                .setResourceId(domainId)
                .setStatusCode(status)
                .setIpAddress(AuthorizationGate.clientIp(exchange))
                .setUserAgent(userAgent(exchange));
    }

    DomainDto toDto(Domain domain) {
        List<DnsRecordDto> records = new ArrayList<>();
        if (domain.getDnsRecords() != null) {
            for (DnsRecord record : domain.getDnsRecords()) {
                records.add(new DnsRecordDto(record.getType(), record.getName(), record.getValue(),
                        record.getPriority(), record.isVerified()));
            }
        }
        return new DomainDto(
                domain.getId(),
                domain.getName(),
                domain.getStatus().apiName(),
                toIso(domain.getCreatedAt()),
                toIso(domain.getVerificationStartedAt()),
                toIso(domain.getVerifiedAt()),
                toIso(domain.getLastCheckedAt()),
                toIso(domains.nextCheckAt(domain)),
                domain.getFailureReason(),
                records);
    }
}
