package com.selfmx.gateway.cron;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-rate background job on its own single-thread scheduler.
 * <p>Subclasses do one pass in {@link #execute()} and should poll {@link #isCancelled()} between items.
 */
public abstract class CronJob implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(CronJob.class);

    private final String name;
    private final long initialDelaySeconds;
    private final long periodSeconds;

    private volatile ScheduledExecutorService scheduler;
    private volatile boolean cancelled;

    // Timing info (epoch seconds).
    private volatile long lastExecutionEpochSeconds = 0L;
    private volatile long nextExecutionEpochSeconds = 0L;

    protected CronJob(String name, long initialDelaySeconds, long periodSeconds) {
        this.name = name;
        this.initialDelaySeconds = initialDelaySeconds;
        this.periodSeconds = periodSeconds;
    }

    /**
     * Starts the schedule. Calling it again has no effect.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return; // Already running.
        }
        cancelled = false;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });

        Runnable task = () -> {
            try {
                lastExecutionEpochSeconds = Instant.now().getEpochSecond();
                nextExecutionEpochSeconds = lastExecutionEpochSeconds + periodSeconds;
                execute();
            } catch (Exception e) {
                log.error("{} task error: {}", name, e.getMessage(), e);
            }
        };

        nextExecutionEpochSeconds = Instant.now().getEpochSecond() + initialDelaySeconds;
        scheduler.scheduleAtFixedRate(task, initialDelaySeconds, periodSeconds, TimeUnit.SECONDS);
        log.info("{} scheduled: initialDelaySeconds={}, periodSeconds={}", name, initialDelaySeconds, periodSeconds);
    }

    /**
     * Runs one pass on the calling thread.
     */
    protected abstract void execute();

    protected boolean isCancelled() {
        return cancelled || Thread.currentThread().isInterrupted();
    }

    public boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    public String getName() {
        return name;
    }

    /** Last execution time (epoch seconds). */
    public long getLastExecutionEpochSeconds() {
        return lastExecutionEpochSeconds;
    }

    /** Next scheduled execution time (epoch seconds). */
    public long getNextExecutionEpochSeconds() {
        return nextExecutionEpochSeconds;
    }

    public long getInitialDelaySeconds() {
        return initialDelaySeconds;
    }

    public long getPeriodSeconds() {
        return periodSeconds;
    }

    /**
     * Cancels the running pass at its next item boundary and stops the schedule.
     */
    @Override
    public synchronized void close() {
        cancelled = true;
        if (scheduler == null) {
            return;
        }
        log.info("{} shutdown initiated", name);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        scheduler = null;
    }
}
