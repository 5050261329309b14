package com.selfmx.gateway.service;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs domain setup off the request thread on a small fixed pool.
 */
public class DomainSetupDispatcher implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(DomainSetupDispatcher.class);

    private final DomainVerificationService service;
    private final ExecutorService pool;

    public DomainSetupDispatcher(DomainVerificationService service, int workers) {
        this.service = service;
        AtomicInteger counter = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(Math.max(1, workers), r -> {
            Thread t = new Thread(r, "domain-setup-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queues setup for a domain.
     *
     * @param domainId Domain id.
     * @return Future of the setup run, or null when the pool no longer accepts work.
     */
    public Future<?> submit(String domainId) {
        try {
            return pool.submit(() -> {
                try {
                    service.setup(domainId);
                } catch (RuntimeException e) {
                    log.error("Setup job for {} failed: {}", domainId, e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Setup for {} not queued: {}", domainId, e.getMessage());
            return null;
        }
    }

    /**
     * Re-queues domains left PENDING by a previous run.
     *
     * @return Number of domains queued.
     */
    public int recoverPending() {
        List<String> pending = service.pendingDomainIds();
        for (String id : pending) {
            submit(id);
        }
        if (!pending.isEmpty()) {
            log.info("Re-queued setup for {} pending domains", pending.size());
        }
        return pending.size();
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
        log.info("Domain setup dispatcher stopped");
    }
}
