package com.selfmx.audit;

import com.selfmx.db.TestDatabase;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

class AuditRecorderTest {

    private static final Instant NOW = Instant.parse("2026-02-27T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static HikariDataSource ds;
    private static AuditLogRepository repository;

    @Mock
    private AuditLogRepository mockRepository;

    @BeforeAll
    static void setupDatabase() {
        ds = TestDatabase.open("audit_recorder_test");
        repository = new AuditLogRepository(ds);
    }

    @AfterAll
    static void closeDatabase() {
        if (ds != null) {
            ds.close();
        }
    }

    @BeforeEach
    void init() throws Exception {
        MockitoAnnotations.openMocks(this);
        TestDatabase.clear(ds);
    }

    private static AuditEntry entry(String action, String actorId) {
        return new AuditEntry()
                .setAction(action)
                .setActorType("api_key")
                .setActorId(actorId)
                .setResourceType("domain")
                .setResourceId("d-1")
                .setStatusCode(200)
                .setIpAddress("10.0.0.1");
    }

    // --- recorder ---

    @Test
    void closeFlushesQueuedEntries() {
        AuditRecorder recorder = new AuditRecorder(repository, 100, 10, CLOCK);
        for (int i = 0; i < 25; i++) {
            assertTrue(recorder.record(entry(AuditActions.EMAIL_SEND, "key-" + (i % 2))));
        }
        recorder.close();

        assertEquals(0, recorder.getPendingCount());
        assertEquals(25, repository.count(new AuditQuery()));
        AuditEntry stored = repository.find(new AuditQuery().setLimit(1)).get(0);
        assertEquals(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC), stored.getTimestamp());
        assertEquals("10.0.0.1", stored.getIpAddress());
    }

    @Test
    void recordAfterCloseIsRejected() {
        AuditRecorder recorder = new AuditRecorder(repository, 10, 5, CLOCK);
        recorder.close();

        assertFalse(recorder.record(entry(AuditActions.DOMAIN_CREATE, "admin")));
        assertEquals(0, repository.count(new AuditQuery()));
    }

    @Test
    void fullQueueDropsWithoutBlocking() throws Exception {
        CountDownLatch writing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<String> written = Collections.synchronizedList(new ArrayList<>());
        doAnswer(invocation -> {
            List<AuditEntry> batch = invocation.getArgument(0);
            batch.forEach(e -> written.add(e.getResourceId()));
            writing.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(mockRepository).insertBatch(anyList());

        AuditRecorder recorder = new AuditRecorder(mockRepository, 2, 1, CLOCK);
        assertTrue(recorder.record(entry(AuditActions.EMAIL_SEND, "k").setResourceId("first")));
        assertTrue(writing.await(5, TimeUnit.SECONDS));

        assertTrue(recorder.record(entry(AuditActions.EMAIL_SEND, "k").setResourceId("second")));
        assertTrue(recorder.record(entry(AuditActions.EMAIL_SEND, "k").setResourceId("third")));
        assertFalse(recorder.record(entry(AuditActions.EMAIL_SEND, "k").setResourceId("dropped")));
        assertEquals(1, recorder.getDroppedCount());

        release.countDown();
        recorder.close();

        assertEquals(List.of("first", "second", "third"), written);
    }

    @Test
    void writeFailureIsContained() {
        doThrow(new IllegalStateException("db down")).when(mockRepository).insertBatch(anyList());

        AuditRecorder recorder = new AuditRecorder(mockRepository, 10, 5, CLOCK);
        assertTrue(recorder.record(entry(AuditActions.EMAIL_SEND, "k")));
        recorder.close();

        verify(mockRepository).insertBatch(anyList());
        assertEquals(0, recorder.getPendingCount());
        assertEquals(0, recorder.getDroppedCount());
    }

    // --- repository queries ---

    @Test
    void findFiltersByActionActorAndTimeRange() {
        OffsetDateTime base = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);
        repository.insertBatch(List.of(
                entry(AuditActions.EMAIL_SEND, "key-1").setTimestamp(base.minusHours(2)),
                entry(AuditActions.EMAIL_SEND, "key-2").setTimestamp(base.minusHours(1)),
                entry(AuditActions.DOMAIN_DELETE, "admin").setTimestamp(base).setStatusCode(409)
                        .setErrorMessage("Domain is referenced by active API keys")));

        assertEquals(2, repository.count(new AuditQuery().setAction(AuditActions.EMAIL_SEND)));
        assertEquals(1, repository.count(new AuditQuery().setActorId("key-2")));
        assertEquals(2, repository.count(new AuditQuery().setFrom(base.minusHours(1))));
        assertEquals(1, repository.count(new AuditQuery().setTo(base.minusHours(2))));

        List<AuditEntry> newestFirst = repository.find(new AuditQuery());
        assertEquals(AuditActions.DOMAIN_DELETE, newestFirst.get(0).getAction());
        assertEquals(409, newestFirst.get(0).getStatusCode());
        assertEquals("key-1", newestFirst.get(2).getActorId());
        assertNull(newestFirst.get(2).getErrorMessage());

        List<AuditEntry> secondPage = repository.find(new AuditQuery().setPage(2).setLimit(2));
        assertEquals(1, secondPage.size());
        assertEquals("key-1", secondPage.get(0).getActorId());

        AuditQuery farPage = new AuditQuery().setPage(Integer.MAX_VALUE).setLimit(100);
        assertEquals((long) (Integer.MAX_VALUE - 1) * 100, farPage.getOffset());
        assertTrue(repository.find(farPage).isEmpty());
    }

    @Test
    void longUserAgentIsTruncated() {
        repository.insertBatch(List.of(entry(AuditActions.ADMIN_LOGIN, "admin")
                .setTimestamp(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC))
                .setUserAgent("x".repeat(800))));

        assertEquals(500, repository.find(new AuditQuery()).get(0).getUserAgent().length());
    }
}
