package com.selfmx.gateway.cron;

import com.selfmx.auth.ApiKeyService;
import com.selfmx.metrics.GatewayMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;

/**
 * Archives API keys revoked longer ago than the retention period.
 */
public class RevokedApiKeyCleanupCron extends CronJob {
    private static final Logger log = LogManager.getLogger(RevokedApiKeyCleanupCron.class);

    static final int BATCH_SIZE = 100;

    private final ApiKeyService service;
    private final Duration retention;

    public RevokedApiKeyCleanupCron(ApiKeyService service, Duration retention, long initialDelaySeconds, long periodSeconds) {
        super("revoked-key-cleanup-cron", initialDelaySeconds, periodSeconds);
        this.service = service;
        this.retention = retention;
    }

    @Override
    protected void execute() {
        if (isCancelled()) {
            return;
        }
        int archived = service.archiveRevoked(retention, BATCH_SIZE);
        GatewayMetrics.addCleanupDeleted("api_keys", archived);
        if (archived > 0) {
            log.info("Archived {} revoked API keys older than {} days", archived, retention.toDays());
        }
    }
}
