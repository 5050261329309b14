package com.selfmx.gateway.cron;

import com.selfmx.gateway.service.DomainVerificationService;

/**
 * Polls VERIFYING domains.
 */
public class DomainVerificationCron extends CronJob {

    private final DomainVerificationService service;

    public DomainVerificationCron(DomainVerificationService service, long initialDelaySeconds, long periodSeconds) {
        super("domain-verification-cron", initialDelaySeconds, periodSeconds);
        this.service = service;
    }

    @Override
    protected void execute() {
        service.pollVerifyingDomains(this::isCancelled);
    }
}
