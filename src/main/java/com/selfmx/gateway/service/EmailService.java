package com.selfmx.gateway.service;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.selfmx.audit.AuditActions;
import com.selfmx.audit.AuditEntry;
import com.selfmx.audit.AuditRecorder;
import com.selfmx.auth.Actor;
import com.selfmx.error.ApiError;
import com.selfmx.error.ApiException;
import com.selfmx.gateway.domain.Domain;
import com.selfmx.gateway.domain.DomainStatus;
import com.selfmx.gateway.domain.SentEmail;
import com.selfmx.gateway.repository.DomainRepository;
import com.selfmx.gateway.repository.SentEmailRepository;
import com.selfmx.metrics.GatewayMetrics;
import com.selfmx.provider.ses.EmailSendException;
import com.selfmx.provider.ses.EmailSender;
import com.selfmx.provider.ses.OutboundEmail;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Sends email on behalf of an actor and keeps the sent-email history.
 *
 * <p>All validation happens before the provider is called. Every outcome of a send, including
 * rejections, is written to the audit log.
 */
public class EmailService {
    private static final Logger log = LogManager.getLogger(EmailService.class);
    private static final Gson GSON = new Gson();

    public static final int MAX_BATCH_SIZE = 100;

    static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    static final Pattern SENDER_PREFIX = Pattern.compile("^[a-zA-Z0-9._-]+$");

    private final DomainRepository domains;
    private final SentEmailRepository sentEmails;
    private final EmailSender sender;
    private final AuditRecorder audit;
    private final Clock clock;

    public EmailService(DomainRepository domains, SentEmailRepository sentEmails, EmailSender sender,
                        AuditRecorder audit, Clock clock) {
        this.domains = Objects.requireNonNull(domains, "domains");
        this.sentEmails = Objects.requireNonNull(sentEmails, "sentEmails");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Validates and sends a single email.
     *
     * @param actor     Caller.
     * @param request   Request.
     * @param ip        Caller address.
     * @param userAgent Caller user agent.
     * @return Id of the stored sent email.
     */
    public String send(Actor actor, SendEmailRequest request, String ip, String userAgent) {
        Domain domain;
        try {
            domain = validate(actor, request);
        } catch (ApiException e) {
            reject(AuditActions.EMAIL_SEND, "email", null, actor, ip, userAgent, e);
            throw e;
        }
        return deliver(actor, request, domain, ip, userAgent);
    }

    /**
     * Sends up to {@value #MAX_BATCH_SIZE} emails. Nothing is sent unless every request is valid.
     *
     * @param actor     Caller.
     * @param requests  Requests.
     * @param ip        Caller address.
     * @param userAgent Caller user agent.
     * @return Ids of the stored sent emails, in request order.
     */
    public List<String> sendBatch(Actor actor, List<SendEmailRequest> requests, String ip, String userAgent) {
        List<Domain> resolved = new ArrayList<>();
        try {
            if (requests == null || requests.isEmpty()) {
                throw new ApiException(ApiError.INVALID_REQUEST, "Batch must contain at least one email");
            }
            if (requests.size() > MAX_BATCH_SIZE) {
                throw new ApiException(ApiError.INVALID_REQUEST, "Batch is limited to " + MAX_BATCH_SIZE + " emails");
            }
            for (int i = 0; i < requests.size(); i++) {
                try {
                    resolved.add(validate(actor, requests.get(i)));
                } catch (ApiException e) {
                    throw new ApiException(e.getError(), "Email " + i + ": " + e.getMessage());
                }
            }
        } catch (ApiException e) {
            reject(AuditActions.EMAIL_BATCH, "email", null, actor, ip, userAgent, e);
            throw e;
        }

        List<String> ids = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            ids.add(deliver(actor, requests.get(i), resolved.get(i), ip, userAgent));
        }
        audit.record(entry(AuditActions.EMAIL_BATCH, actor, ip, userAgent)
                .setResourceType("email")
                .setStatusCode(200)
                .setDetails(details("count", ids.size())));
        return ids;
    }

    /**
     * Sends a plain text test email from a verified domain.
     *
     * @param actor     Caller.
     * @param domainId  Domain id.
     * @param request   Test email request.
     * @param ip        Caller address.
     * @param userAgent Caller user agent.
     * @return Id of the stored sent email.
     */
    public String sendTestEmail(Actor actor, String domainId, TestEmailRequest request, String ip, String userAgent) {
        Domain domain;
        SendEmailRequest send;
        try {
            if (request == null || isBlank(request.senderPrefix()) || isBlank(request.to())
                    || isBlank(request.subject()) || isBlank(request.text())) {
                throw new ApiException(ApiError.INVALID_REQUEST, "senderPrefix, to, subject and text are required");
            }
            if (!SENDER_PREFIX.matcher(request.senderPrefix()).matches()) {
                throw new ApiException(ApiError.INVALID_SENDER_PREFIX, "Invalid sender prefix: " + request.senderPrefix());
            }
            if (!isValidMailbox(request.to())) {
                throw new ApiException(ApiError.INVALID_RECIPIENT_EMAIL, "Invalid recipient email: " + request.to());
            }
            domain = domains.findById(domainId)
                    .orElseThrow(() -> new ApiException(ApiError.NOT_FOUND, "Domain not found"));
            if (!actor.canAccessDomain(domain.getId())) {
                throw new ApiException(ApiError.FORBIDDEN, "Not authorized for domain: " + domain.getName());
            }
            if (domain.getStatus() != DomainStatus.VERIFIED) {
                throw new ApiException(ApiError.DOMAIN_NOT_VERIFIED, "Domain not verified: " + domain.getName());
            }
            send = new SendEmailRequest()
                    .setFrom(request.senderPrefix() + "@" + domain.getName())
                    .setTo(List.of(request.to().trim()))
                    .setSubject(request.subject())
                    .setText(request.text());
        } catch (ApiException e) {
            reject(AuditActions.DOMAIN_TEST_EMAIL, "domain", domainId, actor, ip, userAgent, e);
            throw e;
        }

        String id = deliver(actor, send, domain, ip, userAgent);
        audit.record(entry(AuditActions.DOMAIN_TEST_EMAIL, actor, ip, userAgent)
                .setResourceType("domain")
                .setResourceId(domainId)
                .setStatusCode(200)
                .setDetails(details("emailId", id)));
        return id;
    }

    /**
     * Lists sent emails visible to the caller, newest first.
     *
     * @param actor    Caller.
     * @param domainId Optional domain filter.
     * @param cursor   Cursor from a previous page, or null.
     * @param limit    Page size.
     * @return Page.
     */
    public SentEmailPage listSent(Actor actor, String domainId, String cursor, int limit) {
        if (domainId != null && !actor.canAccessDomain(domainId)) {
            throw new ApiException(ApiError.FORBIDDEN);
        }
        Cursor position = cursor != null && !cursor.isBlank() ? Cursor.decode(cursor) : null;

        List<SentEmail> rows = sentEmails.findPage(actor.getDomainScope(), domainId,
                position != null ? position.sentAt : null,
                position != null ? position.id : null,
                limit + 1);
        boolean hasMore = rows.size() > limit;
        List<SentEmail> items = hasMore ? new ArrayList<>(rows.subList(0, limit)) : rows;
        String next = null;
        if (hasMore) {
            SentEmail last = items.get(items.size() - 1);
            next = new Cursor(last.getId(), last.getSentAt()).encode();
        }
        return new SentEmailPage(items, next, hasMore);
    }

    /**
     * Loads one sent email the caller may see.
     */
    public SentEmail getSent(Actor actor, String id) {
        SentEmail email = sentEmails.findById(id)
                .orElseThrow(() -> new ApiException(ApiError.NOT_FOUND, "Email not found"));
        if (!actor.canAccessDomain(email.getDomainId())) {
            throw new ApiException(ApiError.FORBIDDEN);
        }
        return email;
    }

    /**
     * Checks a request and resolves its sending domain.
     */
    private Domain validate(Actor actor, SendEmailRequest request) {
        if (request == null || isBlank(request.getFrom()) || request.getTo().isEmpty()
                || isBlank(request.getSubject()) || (isBlank(request.getHtml()) && isBlank(request.getText()))) {
            throw new ApiException(ApiError.INVALID_REQUEST, "from, to, subject and html or text are required");
        }

        String fromAddress = extractAddress(request.getFrom());
        if (fromAddress == null || !isValidAddress(fromAddress)) {
            throw new ApiException(ApiError.INVALID_FROM, "Invalid from address: " + request.getFrom());
        }
        checkRecipients(request.getTo());
        checkRecipients(request.getCc());
        checkRecipients(request.getBcc());
        checkRecipients(request.getReplyTo());

        String domainName = fromAddress.substring(fromAddress.lastIndexOf('@') + 1).toLowerCase(Locale.ROOT);
        Domain domain = domains.findByName(domainName)
                .orElseThrow(() -> new ApiException(ApiError.DOMAIN_NOT_VERIFIED, "Domain not verified: " + domainName));
        if (!actor.canAccessDomain(domain.getId())) {
            throw new ApiException(ApiError.FORBIDDEN, "Not authorized for domain: " + domainName);
        }
        if (domain.getStatus() != DomainStatus.VERIFIED) {
            throw new ApiException(ApiError.DOMAIN_NOT_VERIFIED, "Domain not verified: " + domainName);
        }
        return domain;
    }

    private static void checkRecipients(List<String> addresses) {
        for (String address : addresses) {
            if (!isValidMailbox(address)) {
                throw new ApiException(ApiError.INVALID_RECIPIENT_EMAIL, "Invalid recipient email: " + address);
            }
        }
    }

    private String deliver(Actor actor, SendEmailRequest request, Domain domain, String ip, String userAgent) {
        OutboundEmail outbound = new OutboundEmail()
                .setFrom(request.getFrom().trim())
                .setTo(trimAll(request.getTo()))
                .setCc(trimAll(request.getCc()))
                .setBcc(trimAll(request.getBcc()))
                .setReplyTo(trimAll(request.getReplyTo()))
                .setSubject(request.getSubject())
                .setHtml(request.getHtml())
                .setText(request.getText())
                .setHeaders(request.getHeaders());

        String messageId;
        try {
            messageId = sender.send(outbound);
        } catch (EmailSendException e) {
            log.error("Send from {} failed: {}", domain.getName(), e.getMessage());
            reject(AuditActions.EMAIL_SEND, "email", null, actor, ip, userAgent,
                    new ApiException(ApiError.INTERNAL_ERROR, "Provider error: " + e.getMessage()));
            throw new ApiException(ApiError.INTERNAL_ERROR, "Failed to send email");
        }

        SentEmail email = new SentEmail();
        email.setId(UUID.randomUUID().toString());
        email.setMessageId(messageId);
        email.setSentAt(OffsetDateTime.now(clock));
        email.setFromAddress(outbound.getFrom());
        email.setTo(outbound.getTo());
        email.setCc(outbound.getCc());
        email.setBcc(outbound.getBcc());
        email.setReplyTo(outbound.getReplyTo());
        email.setSubject(outbound.getSubject());
        email.setHtmlBody(outbound.getHtml());
        email.setTextBody(outbound.getText());
        email.setDomainId(domain.getId());
        email.setApiKeyId(actor.getKeyId());
        sentEmails.insert(email);

        GatewayMetrics.incrementEmailsSent();
        log.info("Email sent: id={}, messageId={}, domain={}, recipients={}",
                email.getId(), messageId, domain.getName(), outbound.getTo().size());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("domain", domain.getName());
        details.put("recipientCount", outbound.getTo().size());
        details.put("messageId", messageId);
        audit.record(entry(AuditActions.EMAIL_SEND, actor, ip, userAgent)
                .setResourceType("email")
                .setResourceId(email.getId())
                .setStatusCode(200)
                .setDetails(GSON.toJson(details)));
        return email.getId();
    }

    private void reject(String action, String resourceType, String resourceId, Actor actor,
                        String ip, String userAgent, ApiException e) {
        GatewayMetrics.incrementEmailsRejected(e.getError().getCode());
        log.info("{} rejected for {}: {} {}", action, actor, e.getError().getCode(), e.getMessage());
        audit.record(entry(action, actor, ip, userAgent)
                .setResourceType(resourceType)
                .setResourceId(resourceId)
                .setStatusCode(e.getStatus())
                .setErrorMessage(e.getMessage()));
    }

    private static AuditEntry entry(String action, Actor actor, String ip, String userAgent) {
        return new AuditEntry()
                .setAction(action)
                .setActorType(actor.getType().apiName())
                .setActorId(actor.getActorId())
                .setIpAddress(ip)
                .setUserAgent(userAgent);
    }

    private static String details(String key, Object value) {
        JsonObject json = new JsonObject();
        json.add(key, GSON.toJsonTree(value));
        return GSON.toJson(json);
    }

    /**
     * Parses one mailbox, {@code addr}, {@code Name <addr>} or {@code addr (comment)}.
     *
     * @param value Raw header value.
     * @return Bare address, or null when the value is not exactly one mailbox.
     */
    static String extractAddress(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new InternetAddress(value.trim(), true).getAddress();
        } catch (AddressException e) {
            log.debug("Unparseable address {}: {}", value, e.getMessage());
            return null;
        }
    }

    static boolean isValidMailbox(String value) {
        return isValidAddress(extractAddress(value));
    }

    static boolean isValidAddress(String address) {
        return address != null && EMAIL.matcher(address).matches();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static List<String> trimAll(List<String> values) {
        List<String> out = new ArrayList<>(values.size());
        for (String value : values) {
            out.add(value.trim());
        }
        return out;
    }

    /**
     * Keyset position, serialized as base64url JSON.
     */
    static final class Cursor {
        final String id;
        final OffsetDateTime sentAt;

        Cursor(String id, OffsetDateTime sentAt) {
            this.id = id;
            this.sentAt = sentAt;
        }

        String encode() {
            JsonObject json = new JsonObject();
            json.addProperty("id", id);
            json.addProperty("sentAt", sentAt.toString());
            return Base64.getUrlEncoder().withoutPadding()
                    .encodeToString(GSON.toJson(json).getBytes(StandardCharsets.UTF_8));
        }

        static Cursor decode(String value) {
            try {
                String json = new String(Base64.getUrlDecoder().decode(value.trim()), StandardCharsets.UTF_8);
                JsonObject obj = GSON.fromJson(json, JsonObject.class);
                if (obj == null || !obj.has("id") || !obj.has("sentAt")) {
                    throw new ApiException(ApiError.INVALID_REQUEST, "Invalid cursor");
                }
                return new Cursor(obj.get("id").getAsString(), OffsetDateTime.parse(obj.get("sentAt").getAsString()));
            } catch (IllegalArgumentException | JsonParseException | DateTimeParseException | IllegalStateException
                     | UnsupportedOperationException e) {
                throw new ApiException(ApiError.INVALID_REQUEST, "Invalid cursor");
            }
        }
    }
}
