package com.selfmx.gateway.service;

import com.selfmx.gateway.repository.SentEmailRepository;
import com.selfmx.metrics.GatewayMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Deletes sent emails past their retention in adaptive chunks.
 *
 * <p>Chunks start at {@value #BASE_CHUNK} rows. A chunk that finished under 500ms doubles the
 * next one up to {@value #MAX_CHUNK}; one that took over 2s halves it, never below the base.
 */
public class SentEmailCleanupService {
    private static final Logger log = LogManager.getLogger(SentEmailCleanupService.class);

    static final int BASE_CHUNK = 1000;
    static final int MAX_CHUNK = 5000;
    static final int MAX_CHUNKS_PER_RUN = 500;
    static final long FAST_CHUNK_MILLIS = 500;
    static final long SLOW_CHUNK_MILLIS = 2000;

    private final SentEmailRepository repository;
    private final Clock clock;
    private final int retentionDays;
    private final long pauseMillis;

    public SentEmailCleanupService(SentEmailRepository repository, Clock clock, int retentionDays) {
        this(repository, clock, retentionDays, 100);
    }

    /**
     * Constructs a new SentEmailCleanupService.
     *
     * @param repository    Sent email repository.
     * @param clock         Clock.
     * @param retentionDays Days to keep sent emails, 0 or less disables cleanup.
     * @param pauseMillis   Pause between chunks.
     */
    public SentEmailCleanupService(SentEmailRepository repository, Clock clock, int retentionDays, long pauseMillis) {
        this.repository = repository;
        this.clock = clock;
        this.retentionDays = retentionDays;
        this.pauseMillis = pauseMillis;
    }

    public boolean isEnabled() {
        return retentionDays > 0;
    }

    /**
     * Runs one cleanup pass.
     *
     * @param cancelled Stop flag consulted before every chunk.
     * @return Rows deleted.
     */
    public int cleanup(BooleanSupplier cancelled) {
        if (!isEnabled()) {
            log.debug("Sent email retention disabled");
            return 0;
        }

        OffsetDateTime cutoff = OffsetDateTime.now(clock).minusDays(retentionDays);
        log.info("Sent email cleanup started: retention={} days, cutoff={}", retentionDays, cutoff);

        int total = 0;
        int chunks = 0;
        int chunkSize = BASE_CHUNK;
        long started = System.nanoTime();

        while (chunks < MAX_CHUNKS_PER_RUN) {
            if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                log.info("Sent email cleanup cancelled after {} chunks", chunks);
                break;
            }

            long chunkStart = System.nanoTime();
            int deleted = repository.deleteOlderThan(cutoff, chunkSize);
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - chunkStart);
            if (deleted == 0) {
                break;
            }
            total += deleted;
            chunks++;

            int next = nextChunkSize(chunkSize, elapsed);
            log.debug("Chunk {}: {} deleted in {}ms, next size {}", chunks, deleted, elapsed, next);
            chunkSize = next;

            if (!sleep()) {
                break;
            }
        }

        GatewayMetrics.addCleanupDeleted("sent_emails", total);
        log.info("Sent email cleanup finished: deleted={}, chunks={}, duration={}ms",
                total, chunks, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return total;
    }

    /**
     * Adapts the chunk size to how long the last chunk took.
     *
     * @param current       Current size.
     * @param elapsedMillis Duration of the last chunk.
     * @return Next size.
     */
    static int nextChunkSize(int current, long elapsedMillis) {
        if (elapsedMillis < FAST_CHUNK_MILLIS && current < MAX_CHUNK) {
            return Math.min(current * 2, MAX_CHUNK);
        }
        if (elapsedMillis > SLOW_CHUNK_MILLIS && current > BASE_CHUNK) {
            return Math.max(current / 2, BASE_CHUNK);
        }
        return current;
    }

    private boolean sleep() {
        if (pauseMillis <= 0) {
            return true;
        }
        try {
            Thread.sleep(pauseMillis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
