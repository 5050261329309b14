package com.selfmx.audit;

import com.selfmx.metrics.GatewayMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Asynchronous audit writer.
 *
 * <p>{@link #record(AuditEntry)} never blocks the caller. Entries go to a bounded queue and a
 * single daemon thread writes them in batches. When the queue is full the entry is dropped.
 * <p>Write failures are logged and the batch is discarded; they never reach request handling.
 */
public class AuditRecorder implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(AuditRecorder.class);

    public static final int DEFAULT_CAPACITY = 10_000;
    public static final int DEFAULT_BATCH_SIZE = 50;

    private final AuditLogRepository repository;
    private final BlockingQueue<AuditEntry> queue;
    private final int batchSize;
    private final Clock clock;
    private final Thread writer;
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean running = true;

    public AuditRecorder(AuditLogRepository repository) {
        this(repository, DEFAULT_CAPACITY, DEFAULT_BATCH_SIZE, Clock.systemUTC());
    }

    /**
     * Constructs a recorder and starts its writer thread.
     *
     * @param repository Target repository.
     * @param capacity   Queue capacity.
     * @param batchSize  Maximum entries per write.
     * @param clock      Clock used to stamp entries without a timestamp.
     */
    public AuditRecorder(AuditLogRepository repository, int capacity, int batchSize, Clock clock) {
        this.repository = repository;
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.batchSize = batchSize;
        this.clock = clock;
        this.writer = new Thread(this::drainLoop, "audit-writer");
        this.writer.setDaemon(true);
        this.writer.start();
        log.info("AuditRecorder started: capacity={}, batchSize={}", capacity, batchSize);
    }

    /**
     * Queues an entry for writing.
     *
     * @param entry Entry.
     * @return False when the entry was dropped.
     */
    public boolean record(AuditEntry entry) {
        if (!running) {
            log.warn("Audit entry dropped after shutdown: action={}", entry.getAction());
            return false;
        }
        if (entry.getTimestamp() == null) {
            entry.setTimestamp(OffsetDateTime.now(clock));
        }
        if (!queue.offer(entry)) {
            dropped.incrementAndGet();
            GatewayMetrics.incrementAuditDropped();
            log.warn("Audit queue full, entry dropped: action={}, resourceId={}", entry.getAction(), entry.getResourceId());
            return false;
        }
        return true;
    }

    /**
     * Number of entries dropped since startup.
     */
    public long getDroppedCount() {
        return dropped.get();
    }

    /**
     * Number of entries waiting to be written.
     */
    public int getPendingCount() {
        return queue.size();
    }

    private void drainLoop() {
        List<AuditEntry> batch = new ArrayList<>(batchSize);
        while (running || !queue.isEmpty()) {
            try {
                AuditEntry first = queue.poll(500, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, batchSize - 1);
                write(batch);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } finally {
                batch.clear();
            }
        }
        // Interrupted: flush the remainder inline.
        while (!queue.isEmpty()) {
            queue.drainTo(batch, batchSize);
            write(batch);
            batch.clear();
        }
        log.debug("Audit writer stopped");
    }

    private void write(List<AuditEntry> batch) {
        try {
            repository.insertBatch(batch);
            log.trace("Wrote {} audit entries", batch.size());
        } catch (RuntimeException e) {
            log.error("Audit batch of {} entries dropped: {}", batch.size(), e.getMessage());
        }
    }

    /**
     * Stops intake, writes everything still queued and waits for the writer.
     */
    @Override
    public void close() {
        if (!running) {
            return;
        }
        running = false;
        try {
            writer.join(TimeUnit.SECONDS.toMillis(30));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.interrupt();
        }
        log.info("AuditRecorder closed: pending={}, dropped={}", queue.size(), dropped.get());
    }
}
