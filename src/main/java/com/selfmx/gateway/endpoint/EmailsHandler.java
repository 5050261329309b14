package com.selfmx.gateway.endpoint;

import com.selfmx.auth.Actor;
import com.selfmx.auth.AuthorizationGate;
import com.selfmx.auth.ratelimit.RateLimiter;
import com.selfmx.endpoints.ApiEndpointUtils;
import com.selfmx.endpoints.HttpEndpoint;
import com.selfmx.gateway.domain.SentEmail;
import com.selfmx.gateway.endpoint.dto.CursorPageDto;
import com.selfmx.gateway.endpoint.dto.IdDto;
import com.selfmx.gateway.endpoint.dto.SentEmailDetailDto;
import com.selfmx.gateway.endpoint.dto.SentEmailSummaryDto;
import com.selfmx.gateway.service.EmailService;
import com.selfmx.gateway.service.SendEmailRequest;
import com.selfmx.gateway.service.SentEmailPage;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Handler for the Resend-compatible /emails endpoints.
 *
 * <ul>
 *   <li><b>POST /emails</b>: sends one email.</li>
 *   <li><b>POST /emails/batch</b>: sends up to 100 emails, all validated first.</li>
 *   <li><b>GET /emails</b>: cursor paginated history without bodies.</li>
 *   <li><b>GET /emails/{id}</b>: one sent email without BCC.</li>
 * </ul>
 */
public class EmailsHandler extends ApiRouter {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 100;

    private final EmailService emails;

    public EmailsHandler(HttpEndpoint endpoint, AuthorizationGate gate, RateLimiter apiLimiter, EmailService emails) {
        super("/emails", endpoint, gate, apiLimiter);
        this.emails = emails;
    }

    @Override
    protected void route(HttpExchange exchange, String method, String tail) throws IOException {
        Actor actor = authenticate(exchange);
        String ip = AuthorizationGate.clientIp(exchange);

        if (tail.isEmpty()) {
            switch (method) {
                case "POST" -> {
                    String id = emails.send(actor, toRequest(readJson(exchange)), ip, userAgent(exchange));
                    sendJson(exchange, 200, new IdDto(id));
                }
                case "GET" -> handleList(exchange, actor);
                default -> throw methodNotAllowed();
            }
            return;
        }

        if ("/batch".equals(tail)) {
            if (!"POST".equals(method)) throw methodNotAllowed();
            List<SendEmailRequest> requests = new ArrayList<>();
            for (Map<String, Object> item : readJsonArray(exchange)) {
                requests.add(toRequest(item));
            }
            List<IdDto> data = new ArrayList<>();
            for (String id : emails.sendBatch(actor, requests, ip, userAgent(exchange))) {
                data.add(new IdDto(id));
            }
            sendJson(exchange, 200, Map.of("data", data));
            return;
        }

        if (segmentCount(tail) == 1) {
            if (!"GET".equals(method)) throw methodNotAllowed();
            sendJson(exchange, 200, toDetail(emails.getSent(actor, segment(tail, 0))));
            return;
        }

        throw notFound();
    }

    private void handleList(HttpExchange exchange, Actor actor) throws IOException {
        Map<String, String> query = query(exchange);
        int limit = Math.max(1, Math.min(MAX_LIMIT, ApiEndpointUtils.toInt(query.get("limit"), DEFAULT_LIMIT)));
        String domainId = query.get("domainId");
        SentEmailPage page = emails.listSent(actor, domainId != null && !domainId.isBlank() ? domainId : null,
                query.get("cursor"), limit);

        List<SentEmailSummaryDto> data = new ArrayList<>();
        for (SentEmail email : page.items()) {
            data.add(new SentEmailSummaryDto(email.getId(), email.getMessageId(), toIso(email.getSentAt()),
                    email.getFromAddress(), email.getTo(), email.getSubject(), email.getDomainId(), email.getApiKeyId()));
        }
        sendJson(exchange, 200, new CursorPageDto<>(data, page.nextCursor(), page.hasMore()));
    }

    static SendEmailRequest toRequest(Map<String, Object> body) {
        Object replyTo = body.containsKey("reply_to") ? body.get("reply_to") : body.get("replyTo");
        return new SendEmailRequest()
                .setFrom(ApiEndpointUtils.getString(body, "from"))
                .setTo(ApiEndpointUtils.toStringList(body.get("to")))
                .setCc(ApiEndpointUtils.toStringList(body.get("cc")))
                .setBcc(ApiEndpointUtils.toStringList(body.get("bcc")))
                .setReplyTo(ApiEndpointUtils.toStringList(replyTo))
                .setSubject(ApiEndpointUtils.getString(body, "subject"))
                .setHtml(ApiEndpointUtils.getString(body, "html"))
                .setText(ApiEndpointUtils.getString(body, "text"))
                .setHeaders(ApiEndpointUtils.toStringMap(body.get("headers")));
    }

    private static SentEmailDetailDto toDetail(SentEmail email) {
        return new SentEmailDetailDto(
                email.getId(),
                email.getMessageId(),
                toIso(email.getSentAt()),
                email.getFromAddress(),
                email.getTo(),
                email.getCc(),
                email.getReplyTo(),
                email.getSubject(),
                email.getHtmlBody(),
                email.getTextBody(),
                email.getDomainId(),
                email.getApiKeyId());
    }
}
