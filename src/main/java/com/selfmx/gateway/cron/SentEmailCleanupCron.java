package com.selfmx.gateway.cron;

import com.selfmx.gateway.service.SentEmailCleanupService;

/**
 * Applies sent email retention.
 */
public class SentEmailCleanupCron extends CronJob {

    private final SentEmailCleanupService service;

    public SentEmailCleanupCron(SentEmailCleanupService service, long initialDelaySeconds, long periodSeconds) {
        super("sent-email-cleanup-cron", initialDelaySeconds, periodSeconds);
        this.service = service;
    }

    @Override
    protected void execute() {
        service.cleanup(this::isCancelled);
    }
}
