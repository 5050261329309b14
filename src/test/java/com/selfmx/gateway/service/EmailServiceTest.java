package com.selfmx.gateway.service;

import com.selfmx.MutableClock;
import com.selfmx.audit.AuditActions;
import com.selfmx.audit.AuditEntry;
import com.selfmx.audit.AuditRecorder;
import com.selfmx.auth.Actor;
import com.selfmx.db.TestDatabase;
import com.selfmx.error.ApiError;
import com.selfmx.error.ApiException;
import com.selfmx.gateway.domain.ApiKey;
import com.selfmx.gateway.domain.Domain;
import com.selfmx.gateway.domain.DomainStatus;
import com.selfmx.gateway.domain.SentEmail;
import com.selfmx.gateway.repository.DomainRepository;
import com.selfmx.gateway.repository.SentEmailRepository;
import com.selfmx.provider.ses.EmailSendException;
import com.selfmx.provider.ses.EmailSender;
import com.selfmx.provider.ses.OutboundEmail;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EmailServiceTest {

    private static HikariDataSource ds;
    private static DomainRepository domains;
    private static SentEmailRepository sentEmails;

    @Mock
    private EmailSender sender;
    @Mock
    private AuditRecorder audit;

    private AutoCloseable mocks;
    private MutableClock clock;
    private EmailService service;
    private Domain verified;
    private Domain pending;

    @BeforeAll
    static void setupDatabase() {
        ds = TestDatabase.open("email_service_test");
        domains = new DomainRepository(ds);
        sentEmails = new SentEmailRepository(ds);
    }

    @AfterAll
    static void closeDatabase() {
        if (ds != null) {
            ds.close();
        }
    }

    @BeforeEach
    void init() throws Exception {
        TestDatabase.clear(ds);
        mocks = MockitoAnnotations.openMocks(this);
        clock = new MutableClock(Instant.parse("2026-02-27T00:00:00Z"));
        service = new EmailService(domains, sentEmails, sender, audit, clock);
        when(sender.send(any(OutboundEmail.class))).thenAnswer(invocation -> "ses-" + UUID.randomUUID());

        verified = insertDomain("example.com", DomainStatus.VERIFIED);
        pending = insertDomain("pending.com", DomainStatus.VERIFYING);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    private Domain insertDomain(String name, DomainStatus status) {
        Domain domain = new Domain();
        domain.setId(UUID.randomUUID().toString());
        domain.setName(name);
        domain.setStatus(status);
        domain.setCreatedAt(OffsetDateTime.now(clock));
        return domains.insert(domain);
    }

    private static Actor keyActor(String... domainIds) {
        ApiKey key = new ApiKey();
        key.setId("key-" + domainIds.length);
        key.setKeyPrefix("re_abcdefgh");
        key.setAllowedDomainIds(List.of(domainIds));
        return Actor.forApiKey(key);
    }

    private static SendEmailRequest request(String from) {
        return new SendEmailRequest()
                .setFrom(from)
                .setTo(List.of("user@customer.org"))
                .setSubject("Hello")
                .setText("Body");
    }

    private static ApiError errorOf(Runnable call) {
        return assertThrows(ApiException.class, call::run).getError();
    }

    // --- send ---

    @Test
    void sendStoresHistoryAndAudits() throws Exception {
        SendEmailRequest request = request("Support <support@example.com>")
                .setCc(List.of(" cc@customer.org "))
                .setBcc(List.of("hidden@customer.org"))
                .setHtml("<p>Body</p>");

        String id = service.send(keyActor(verified.getId()), request, "10.0.0.1", "curl/8");

        ArgumentCaptor<OutboundEmail> sent = ArgumentCaptor.forClass(OutboundEmail.class);
        verify(sender).send(sent.capture());
        assertEquals("Support <support@example.com>", sent.getValue().getFrom());
        assertEquals(List.of("cc@customer.org"), sent.getValue().getCc());

        SentEmail stored = sentEmails.findById(id).orElseThrow();
        assertEquals(verified.getId(), stored.getDomainId());
        assertEquals("key-1", stored.getApiKeyId());
        assertEquals(List.of("user@customer.org"), stored.getTo());
        assertEquals(List.of("hidden@customer.org"), stored.getBcc());
        assertTrue(stored.getMessageId().startsWith("ses-"));

        ArgumentCaptor<AuditEntry> entry = ArgumentCaptor.forClass(AuditEntry.class);
        verify(audit).record(entry.capture());
        assertEquals(AuditActions.EMAIL_SEND, entry.getValue().getAction());
        assertEquals(200, entry.getValue().getStatusCode());
        assertEquals(id, entry.getValue().getResourceId());
        assertEquals("10.0.0.1", entry.getValue().getIpAddress());
    }

    @Test
    void sendFromUnverifiedDomainNeverReachesProvider() throws Exception {
        assertEquals(ApiError.DOMAIN_NOT_VERIFIED,
                errorOf(() -> service.send(Actor.adminSession(), request("a@pending.com"), "ip", "ua")));
        assertEquals(ApiError.DOMAIN_NOT_VERIFIED,
                errorOf(() -> service.send(Actor.adminSession(), request("a@unknown.com"), "ip", "ua")));

        verify(sender, never()).send(any(OutboundEmail.class));
        ArgumentCaptor<AuditEntry> entry = ArgumentCaptor.forClass(AuditEntry.class);
        verify(audit, times(2)).record(entry.capture());
        assertEquals(409, entry.getValue().getStatusCode());
    }

    @Test
    void sendOutsideScopeIsForbidden() throws Exception {
        Domain other = insertDomain("other.com", DomainStatus.VERIFIED);

        assertEquals(ApiError.FORBIDDEN,
                errorOf(() -> service.send(keyActor(verified.getId()), request("a@other.com"), "ip", "ua")));
        verify(sender, never()).send(any(OutboundEmail.class));

        service.send(keyActor(other.getId()), request("a@other.com"), "ip", "ua");
        verify(sender, times(1)).send(any(OutboundEmail.class));
    }

    @Test
    void sendAcceptsCommentAndNamedMailboxes() throws Exception {
        SendEmailRequest request = request("sales@example.com (Sales)")
                .setTo(List.of("Jane Doe <jane@customer.org>"))
                .setReplyTo(List.of("\"Doe, Jane\" <reply@customer.org>"));

        String id = service.send(keyActor(verified.getId()), request, "ip", "ua");

        verify(sender).send(any(OutboundEmail.class));
        assertEquals(verified.getId(), sentEmails.findById(id).orElseThrow().getDomainId());
    }

    @Test
    void sendRejectsAddressLists() throws Exception {
        Actor admin = Actor.adminSession();
        assertEquals(ApiError.INVALID_FROM,
                errorOf(() -> service.send(admin, request("a@example.com, b@example.com"), "ip", "ua")));
        assertEquals(ApiError.INVALID_FROM, errorOf(() -> service.send(admin, request("a@example.com>"), "ip", "ua")));
        assertEquals(ApiError.INVALID_RECIPIENT_EMAIL,
                errorOf(() -> service.send(admin, request("a@example.com").setTo(List.of("Jane <jane@customer")), "ip", "ua")));
        verify(sender, never()).send(any(OutboundEmail.class));
    }

    @Test
    void sendValidatesFieldsInOrder() {
        Actor admin = Actor.adminSession();
        assertEquals(ApiError.INVALID_REQUEST, errorOf(() -> service.send(admin, request("a@example.com").setSubject(" "), "ip", "ua")));
        assertEquals(ApiError.INVALID_REQUEST, errorOf(() -> service.send(admin, request("a@example.com").setText(null), "ip", "ua")));
        assertEquals(ApiError.INVALID_REQUEST, errorOf(() -> service.send(admin, request("a@example.com").setTo(List.of()), "ip", "ua")));
        assertEquals(ApiError.INVALID_FROM, errorOf(() -> service.send(admin, request("not-an-address"), "ip", "ua")));
        assertEquals(ApiError.INVALID_FROM, errorOf(() -> service.send(admin, request("Name <a@example.com"), "ip", "ua")));
        assertEquals(ApiError.INVALID_RECIPIENT_EMAIL,
                errorOf(() -> service.send(admin, request("a@example.com").setTo(List.of("bad")), "ip", "ua")));
        assertEquals(ApiError.INVALID_RECIPIENT_EMAIL,
                errorOf(() -> service.send(admin, request("a@example.com").setReplyTo(List.of("x@")), "ip", "ua")));
        // from is checked before the domain lookup
        assertEquals(ApiError.INVALID_FROM, errorOf(() -> service.send(admin, request("@pending.com"), "ip", "ua")));
    }

    @Test
    void providerFailureIsInternalErrorWithoutHistory() throws Exception {
        when(sender.send(any(OutboundEmail.class))).thenThrow(new EmailSendException("MessageRejected", null));

        ApiException e = assertThrows(ApiException.class,
                () -> service.send(Actor.adminSession(), request("a@example.com"), "ip", "ua"));

        assertEquals(ApiError.INTERNAL_ERROR, e.getError());
        assertEquals("Failed to send email", e.getMessage());
        assertTrue(sentEmails.findPage(null, null, null, null, 10).isEmpty());
        ArgumentCaptor<AuditEntry> entry = ArgumentCaptor.forClass(AuditEntry.class);
        verify(audit).record(entry.capture());
        assertEquals(500, entry.getValue().getStatusCode());
        assertEquals("Provider error: MessageRejected", entry.getValue().getErrorMessage());
    }

    // --- batch ---

    @Test
    void batchSendsAllWhenAllValid() throws Exception {
        List<SendEmailRequest> batch = List.of(request("a@example.com"), request("b@example.com"));

        List<String> ids = service.sendBatch(Actor.adminSession(), batch, "ip", "ua");

        assertEquals(2, ids.size());
        verify(sender, times(2)).send(any(OutboundEmail.class));
    }

    @Test
    void batchWithOneInvalidEmailSendsNothing() throws Exception {
        List<SendEmailRequest> batch = List.of(request("a@example.com"), request("b@pending.com"));

        ApiException e = assertThrows(ApiException.class,
                () -> service.sendBatch(Actor.adminSession(), batch, "ip", "ua"));

        assertEquals(ApiError.DOMAIN_NOT_VERIFIED, e.getError());
        assertTrue(e.getMessage().startsWith("Email 1: "));
        verify(sender, never()).send(any(OutboundEmail.class));
    }

    @Test
    void batchSizeIsBounded() {
        List<SendEmailRequest> batch = new ArrayList<>();
        for (int i = 0; i <= EmailService.MAX_BATCH_SIZE; i++) {
            batch.add(request("a@example.com"));
        }
        assertEquals(ApiError.INVALID_REQUEST, errorOf(() -> service.sendBatch(Actor.adminSession(), batch, "ip", "ua")));
        assertEquals(ApiError.INVALID_REQUEST, errorOf(() -> service.sendBatch(Actor.adminSession(), List.of(), "ip", "ua")));
    }

    // --- test email ---

    @Test
    void testEmailUsesPrefixAndDomain() throws Exception {
        String id = service.sendTestEmail(Actor.adminSession(), verified.getId(),
                new TestEmailRequest("noreply", "me@customer.org", "Test", "It works"), "ip", "ua");

        ArgumentCaptor<OutboundEmail> sent = ArgumentCaptor.forClass(OutboundEmail.class);
        verify(sender).send(sent.capture());
        assertEquals("noreply@example.com", sent.getValue().getFrom());
        assertEquals(verified.getId(), sentEmails.findById(id).orElseThrow().getDomainId());
        verify(audit, times(2)).record(any(AuditEntry.class));
    }

    @Test
    void testEmailRejectsBadInput() {
        Actor admin = Actor.adminSession();
        assertEquals(ApiError.INVALID_SENDER_PREFIX, errorOf(() -> service.sendTestEmail(admin, verified.getId(),
                new TestEmailRequest("no reply", "me@customer.org", "s", "t"), "ip", "ua")));
        assertEquals(ApiError.INVALID_RECIPIENT_EMAIL, errorOf(() -> service.sendTestEmail(admin, verified.getId(),
                new TestEmailRequest("noreply", "me", "s", "t"), "ip", "ua")));
        assertEquals(ApiError.NOT_FOUND, errorOf(() -> service.sendTestEmail(admin, "missing",
                new TestEmailRequest("noreply", "me@customer.org", "s", "t"), "ip", "ua")));
        assertEquals(ApiError.DOMAIN_NOT_VERIFIED, errorOf(() -> service.sendTestEmail(admin, pending.getId(),
                new TestEmailRequest("noreply", "me@customer.org", "s", "t"), "ip", "ua")));
        assertEquals(ApiError.FORBIDDEN, errorOf(() -> service.sendTestEmail(keyActor(pending.getId()), verified.getId(),
                new TestEmailRequest("noreply", "me@customer.org", "s", "t"), "ip", "ua")));
        verify(audit, atLeastOnce()).record(any(AuditEntry.class));
    }

    // --- history ---

    @Test
    void listPagesWithCursorWithoutDuplicates() {
        Set<String> sent = new HashSet<>();
        for (int i = 0; i < 5; i++) {
            sent.add(service.send(Actor.adminSession(), request("a@example.com"), "ip", "ua"));
            clock.advance(Duration.ofSeconds(1));
        }

        SentEmailPage first = service.listSent(Actor.adminSession(), null, null, 2);
        assertEquals(2, first.items().size());
        assertTrue(first.hasMore());

        Set<String> seen = new HashSet<>();
        SentEmailPage page = first;
        OffsetDateTime previous = null;
        while (true) {
            for (SentEmail email : page.items()) {
                assertTrue(seen.add(email.getId()), "duplicate " + email.getId());
                if (previous != null) {
                    assertFalse(email.getSentAt().isAfter(previous));
                }
                previous = email.getSentAt();
            }
            if (!page.hasMore()) {
                assertNull(page.nextCursor());
                break;
            }
            page = service.listSent(Actor.adminSession(), null, page.nextCursor(), 2);
        }
        assertEquals(sent, seen);
    }

    @Test
    void listIsScopedToActor() {
        Domain other = insertDomain("other.com", DomainStatus.VERIFIED);
        service.send(Actor.adminSession(), request("a@example.com"), "ip", "ua");
        service.send(Actor.adminSession(), request("a@other.com"), "ip", "ua");

        assertEquals(2, service.listSent(Actor.adminSession(), null, null, 10).items().size());
        List<SentEmail> scoped = service.listSent(keyActor(other.getId()), null, null, 10).items();
        assertEquals(1, scoped.size());
        assertEquals(other.getId(), scoped.get(0).getDomainId());
        assertEquals(1, service.listSent(Actor.adminSession(), verified.getId(), null, 10).items().size());
        assertEquals(ApiError.FORBIDDEN, errorOf(() -> service.listSent(keyActor(other.getId()), verified.getId(), null, 10)));
    }

    @Test
    void getSentEnforcesScope() {
        String id = service.send(Actor.adminSession(), request("a@example.com"), "ip", "ua");

        assertEquals(id, service.getSent(keyActor(verified.getId()), id).getId());
        assertEquals(ApiError.FORBIDDEN, errorOf(() -> service.getSent(keyActor(pending.getId()), id)));
        assertEquals(ApiError.NOT_FOUND, errorOf(() -> service.getSent(Actor.adminSession(), "missing")));
    }

    @Test
    void malformedCursorIsInvalidRequest() {
        assertEquals(ApiError.INVALID_REQUEST, errorOf(() -> service.listSent(Actor.adminSession(), null, "%%%", 10)));
        assertEquals(ApiError.INVALID_REQUEST, errorOf(() -> service.listSent(Actor.adminSession(), null, "e30", 10)));
    }

    @Test
    void cursorEncodesPosition() {
        OffsetDateTime at = OffsetDateTime.parse("2026-02-27T10:15:30Z");
        EmailService.Cursor decoded = EmailService.Cursor.decode(new EmailService.Cursor("abc", at).encode());
        assertEquals("abc", decoded.id);
        assertEquals(at, decoded.sentAt);
    }

    @Test
    void extractAddressHandlesNamedForm() {
        assertEquals("a@example.com", EmailService.extractAddress("a@example.com"));
        assertEquals("a@example.com", EmailService.extractAddress("  Support Team <a@example.com> "));
        assertEquals("a@example.com", EmailService.extractAddress("<a@example.com>"));
        assertEquals("x@y.com", EmailService.extractAddress("x@y.com (Sales)"));
        assertNull(EmailService.extractAddress("Name <a@example.com"));
        assertNull(EmailService.extractAddress(" "));
        assertTrue(EmailService.isValidMailbox("Jane Doe <jane@customer.org>"));
        assertFalse(EmailService.isValidMailbox("undisclosed-recipients:;"));
        assertFalse(EmailService.isValidAddress("a@b"));
        assertTrue(EmailService.isValidAddress("first.last+tag@sub.example.co.uk"));
    }
}
