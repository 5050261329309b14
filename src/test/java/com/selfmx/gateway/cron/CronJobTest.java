package com.selfmx.gateway.cron;

import com.selfmx.auth.ApiKeyService;
import com.selfmx.auth.AdminSessionStore;
import com.selfmx.gateway.service.DomainVerificationService;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CronJobTest {

    @Test
    void failingPassDoesNotStopSchedule() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch secondRun = new CountDownLatch(2);
        CronJob job = new CronJob("test-cron", 0, 1) {
            @Override
            protected void execute() {
                secondRun.countDown();
                if (runs.incrementAndGet() == 1) {
                    throw new IllegalStateException("first pass fails");
                }
            }
        };

        job.start();
        job.start();
        try {
            assertTrue(secondRun.await(5, TimeUnit.SECONDS));
            assertTrue(job.isRunning());
            assertTrue(job.getLastExecutionEpochSeconds() > 0);
        } finally {
            job.close();
        }
        assertFalse(job.isRunning());
    }

    @Test
    void closeMarksRunningPassCancelled() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        AtomicInteger cancelledSeen = new AtomicInteger();
        CronJob job = new CronJob("cancel-cron", 0, 60) {
            @Override
            protected void execute() {
                entered.countDown();
                long deadline = System.currentTimeMillis() + 5000;
                while (!isCancelled() && System.currentTimeMillis() < deadline) {
                    Thread.onSpinWait();
                }
                if (isCancelled()) {
                    cancelledSeen.incrementAndGet();
                }
            }
        };

        job.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        job.close();

        assertEquals(1, cancelledSeen.get());
    }

    @Test
    void verificationCronPollsWithCancellationFlag() {
        DomainVerificationService service = mock(DomainVerificationService.class);
        DomainVerificationCron cron = new DomainVerificationCron(service, 30, 300);

        cron.execute();

        verify(service).pollVerifyingDomains(any(BooleanSupplier.class));
        assertEquals("domain-verification-cron", cron.getName());
    }

    @Test
    void revokedKeyCronArchivesWithRetention() {
        ApiKeyService service = mock(ApiKeyService.class);
        when(service.archiveRevoked(Duration.ofDays(90), RevokedApiKeyCleanupCron.BATCH_SIZE)).thenReturn(3);

        new RevokedApiKeyCleanupCron(service, Duration.ofDays(90), 60, 86400).execute();

        verify(service).archiveRevoked(Duration.ofDays(90), RevokedApiKeyCleanupCron.BATCH_SIZE);
    }

    @Test
    void sessionPurgeCronDropsExpiredSessions() {
        AdminSessionStore sessions = mock(AdminSessionStore.class);

        new AdminSessionPurgeCron(sessions, 3600, 3600).execute();

        verify(sessions).purgeExpired();
    }
}
