package com.selfmx.auth;

import com.selfmx.MutableClock;
import com.selfmx.db.TestDatabase;
import com.selfmx.error.ApiError;
import com.selfmx.error.ApiException;
import com.selfmx.gateway.domain.ApiKey;
import com.selfmx.gateway.domain.ApiKeyState;
import com.selfmx.gateway.domain.Domain;
import com.selfmx.gateway.domain.DomainStatus;
import com.selfmx.gateway.domain.RevokedApiKey;
import com.selfmx.gateway.repository.ApiKeyRepository;
import com.selfmx.gateway.repository.DomainRepository;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApiKeyServiceTest {

    private static HikariDataSource ds;
    private static DomainRepository domains;
    private static ApiKeyRepository keys;

    private MutableClock clock;
    private ApiKeyService service;
    private Domain domain;

    @BeforeAll
    static void setupDatabase() {
        ds = TestDatabase.open("api_key_service_test");
        domains = new DomainRepository(ds);
        keys = new ApiKeyRepository(ds);
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
        clock = new MutableClock(Instant.parse("2026-02-27T00:00:00Z"));
        service = new ApiKeyService(keys, domains, Runnable::run, clock);

        domain = new Domain();
        domain.setId(UUID.randomUUID().toString());
        domain.setName("example.com");
        domain.setStatus(DomainStatus.VERIFIED);
        domain.setCreatedAt(OffsetDateTime.now(clock));
        domains.insert(domain);
    }

    @Test
    void createReturnsSecretOnceAndStoresHash() {
        ApiKeyService.CreatedApiKey created = service.create(" sender ", false, List.of(domain.getId(), domain.getId()));

        String secret = created.secret();
        assertTrue(secret.startsWith(ApiKeyService.KEY_PREFIX));
        assertFalse(secret.startsWith(ApiKeyService.ADMIN_KEY_PREFIX));
        assertEquals(ApiKeyService.KEY_PREFIX.length() + 32, secret.length());

        ApiKey stored = keys.findById(created.key().getId()).orElseThrow();
        assertEquals("sender", stored.getName());
        assertEquals(secret.substring(0, ApiKeyService.PREFIX_LENGTH), stored.getKeyPrefix());
        assertNotEquals(secret, stored.getKeyHash());
        assertFalse(stored.getKeyHash().contains(secret));
        assertEquals(List.of(domain.getId()), stored.getAllowedDomainIds());
        assertEquals(ApiKeyState.ACTIVE, stored.getState());
    }

    @Test
    void adminKeysUseAdminPrefixAndNeedNoDomains() {
        ApiKeyService.CreatedApiKey created = service.create("ops", true, null);

        assertTrue(created.secret().startsWith(ApiKeyService.ADMIN_KEY_PREFIX));
        assertTrue(created.key().isAdmin());
        assertTrue(created.key().getAllowedDomainIds().isEmpty());
    }

    @Test
    void createValidatesInput() {
        assertEquals(ApiError.INVALID_REQUEST,
                assertThrows(ApiException.class, () -> service.create(" ", false, List.of(domain.getId()))).getError());
        assertEquals(ApiError.INVALID_REQUEST,
                assertThrows(ApiException.class, () -> service.create("x".repeat(101), false, List.of(domain.getId()))).getError());
        assertEquals(ApiError.INVALID_REQUEST,
                assertThrows(ApiException.class, () -> service.create("scoped", false, List.of())).getError());
        ApiException unknown = assertThrows(ApiException.class, () -> service.create("scoped", false, List.of("nope")));
        assertEquals("Unknown domain id: nope", unknown.getMessage());
    }

    @Test
    void validateAcceptsOnlyTheIssuedSecret() {
        ApiKeyService.CreatedApiKey created = service.create("sender", false, List.of(domain.getId()));

        Optional<ApiKey> valid = service.validate(created.secret(), "10.1.2.3");
        assertTrue(valid.isPresent());
        assertEquals(created.key().getId(), valid.get().getId());

        String tampered = created.secret().substring(0, created.secret().length() - 1)
                + (created.secret().endsWith("A") ? "B" : "A");
        assertFalse(service.validate(tampered, "10.1.2.3").isPresent());
        assertFalse(service.validate("sk_live_whatever", "10.1.2.3").isPresent());
        assertFalse(service.validate("re_short", "10.1.2.3").isPresent());
        assertFalse(service.validate(null, "10.1.2.3").isPresent());
    }

    @Test
    void validateRecordsLastUse() {
        ApiKeyService.CreatedApiKey created = service.create("sender", false, List.of(domain.getId()));

        service.validate(created.secret(), "10.1.2.3");

        ApiKey stored = keys.findById(created.key().getId()).orElseThrow();
        assertEquals("10.1.2.3", stored.getLastUsedIp());
        assertEquals(OffsetDateTime.now(clock), stored.getLastUsedAt());
    }

    @Test
    void revokedKeyNoLongerAuthenticates() {
        ApiKeyService.CreatedApiKey created = service.create("sender", false, List.of(domain.getId()));

        ApiKey revoked = service.revoke(created.key().getId());

        assertEquals(ApiKeyState.REVOKED, revoked.getState());
        assertNotNull(revoked.getRevokedAt());
        assertFalse(service.validate(created.secret(), "ip").isPresent());
    }

    @Test
    void revokeIsIdempotent() {
        ApiKeyService.CreatedApiKey created = service.create("sender", false, List.of(domain.getId()));
        OffsetDateTime first = service.revoke(created.key().getId()).getRevokedAt();

        clock.advance(Duration.ofHours(1));

        assertEquals(first, service.revoke(created.key().getId()).getRevokedAt());
        assertEquals(ApiError.NOT_FOUND, assertThrows(ApiException.class, () -> service.revoke("missing")).getError());
    }

    @Test
    void revokedKeysAreArchivedAfterRetention() {
        ApiKeyService.CreatedApiKey created = service.create("sender", false, List.of(domain.getId()));
        service.create("active", false, List.of(domain.getId()));
        service.revoke(created.key().getId());

        clock.advance(Duration.ofDays(89));
        assertEquals(0, service.archiveRevoked(Duration.ofDays(90), 100));
        assertEquals(2, service.count());

        clock.advance(Duration.ofDays(2));
        assertEquals(1, service.archiveRevoked(Duration.ofDays(90), 100));

        assertFalse(service.get(created.key().getId()).isPresent());
        assertEquals(1, service.count());
        assertEquals(1, service.countArchived());
        RevokedApiKey archived = service.listArchived(1, 20).get(0);
        assertEquals(created.key().getId(), archived.getId());
        assertEquals(List.of(domain.getId()), archived.getAllowedDomainIds());
        assertEquals(OffsetDateTime.now(clock), archived.getArchivedAt());

        assertEquals(0, service.archiveRevoked(Duration.ofDays(90), 100));
    }

    @Test
    void archiveWorksThroughSeveralBatches() {
        for (int i = 0; i < 5; i++) {
            service.revoke(service.create("k" + i, false, List.of(domain.getId())).key().getId());
        }
        clock.advance(Duration.ofDays(91));

        assertEquals(5, service.archiveRevoked(Duration.ofDays(90), 2));
        assertEquals(0, service.count());
    }

    @Test
    void keyTransitionsOnlyMoveForward() {
        ApiKeyService.validateTransition(ApiKeyState.ACTIVE, ApiKeyState.REVOKED);
        ApiKeyService.validateTransition(ApiKeyState.REVOKED, ApiKeyState.ARCHIVED);
        assertThrows(IllegalStateException.class,
                () -> ApiKeyService.validateTransition(ApiKeyState.ACTIVE, ApiKeyState.ARCHIVED));
        assertThrows(IllegalStateException.class,
                () -> ApiKeyService.validateTransition(ApiKeyState.REVOKED, ApiKeyState.ACTIVE));
        assertThrows(IllegalStateException.class,
                () -> ApiKeyService.validateTransition(ApiKeyState.ARCHIVED, ApiKeyState.REVOKED));
    }

    @Test
    void listPagesNewestFirst() {
        service.create("first", true, null);
        clock.advance(Duration.ofSeconds(1));
        service.create("second", true, null);

        List<ApiKey> page = service.list(1, 1);
        assertEquals(1, page.size());
        assertEquals("second", page.get(0).getName());
        assertEquals("first", service.list(2, 1).get(0).getName());
        assertEquals(2, service.count());
    }

    @Test
    void pageFarPastTheEndIsEmpty() {
        service.create("only", true, null);

        assertTrue(service.list(30_000_000, 100).isEmpty());
        assertTrue(service.list(Integer.MAX_VALUE, 100).isEmpty());
        assertTrue(service.listArchived(Integer.MAX_VALUE, 100).isEmpty());
    }
}
