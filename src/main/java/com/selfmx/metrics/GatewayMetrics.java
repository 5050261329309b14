package com.selfmx.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Gateway Micrometer counters.
 *
 * <p>Every increment is a no-op until a registry is registered, so services and tests
 * can run without the metrics endpoint.
 */
public final class GatewayMetrics {
    private static final Logger log = LogManager.getLogger(GatewayMetrics.class);

    static final String EMAILS_SENT = "selfmx.emails.sent";
    static final String EMAILS_REJECTED = "selfmx.emails.rejected";
    static final String DOMAIN_TRANSITIONS = "selfmx.domain.transitions";
    static final String DNS_PUBLISH_FAILURES = "selfmx.dns.publish.failures";
    static final String AUDIT_DROPPED = "selfmx.audit.dropped";
    static final String RATE_LIMITED = "selfmx.ratelimit.rejected";
    static final String CLEANUP_DELETED = "selfmx.cleanup.deleted";

    /**
     * Private constructor for utility class.
     */
    private GatewayMetrics() {
    }

    /**
     * Registers the counters with zero values so they show up before any traffic.
     */
    public static void initialize() {
        MeterRegistry registry = MetricsRegistry.current().orElse(null);
        if (registry == null) {
            log.warn("Cannot initialize gateway metrics: no registry");
            return;
        }
        Counter.builder(EMAILS_SENT).description("Emails accepted by the provider").register(registry);
        Counter.builder(AUDIT_DROPPED).description("Audit entries dropped because the queue was full").register(registry);
        Counter.builder(DNS_PUBLISH_FAILURES).description("DNS records that could not be published").register(registry);
        for (String target : new String[]{"verifying", "verified", "failed"}) {
            Counter.builder(DOMAIN_TRANSITIONS)
                    .description("Domain status transitions")
                    .tag("status", target)
                    .register(registry);
        }
        log.info("Gateway metrics initialized");
    }

    public static void incrementEmailsSent() {
        increment(EMAILS_SENT, "Emails accepted by the provider", null, null);
    }

    /**
     * Counts a rejected send by error code.
     *
     * @param code API error code.
     */
    public static void incrementEmailsRejected(String code) {
        increment(EMAILS_REJECTED, "Send requests rejected before reaching the provider", "code", code);
    }

    /**
     * Counts a domain transition.
     *
     * @param status Target status, lowercase.
     */
    public static void incrementDomainTransition(String status) {
        increment(DOMAIN_TRANSITIONS, "Domain status transitions", "status", status);
    }

    public static void incrementDnsPublishFailure() {
        increment(DNS_PUBLISH_FAILURES, "DNS records that could not be published", null, null);
    }

    public static void incrementAuditDropped() {
        increment(AUDIT_DROPPED, "Audit entries dropped because the queue was full", null, null);
    }

    /**
     * Counts a request rejected by a rate limiter.
     *
     * @param limiter Limiter name.
     */
    public static void incrementRateLimited(String limiter) {
        increment(RATE_LIMITED, "Requests rejected by rate limiting", "limiter", limiter);
    }

    /**
     * Adds rows removed by a retention sweep.
     *
     * @param table Table name.
     * @param count Rows deleted.
     */
    public static void addCleanupDeleted(String table, long count) {
        MeterRegistry registry = MetricsRegistry.current().orElse(null);
        if (registry == null || count <= 0) {
            return;
        }
        try {
            Counter.builder(CLEANUP_DELETED)
                    .description("Rows removed by retention sweeps")
                    .tag("table", table)
                    .register(registry)
                    .increment(count);
        } catch (Exception e) {
            log.warn("Failed to increment cleanup counter: {}", e.getMessage());
        }
    }

    private static void increment(String name, String description, String tagKey, String tagValue) {
        MeterRegistry registry = MetricsRegistry.current().orElse(null);
        if (registry == null) {
            return;
        }
        try {
            Counter.Builder builder = Counter.builder(name).description(description);
            if (tagKey != null) {
                builder.tag(tagKey, tagValue != null ? tagValue : "unknown");
            }
            builder.register(registry).increment();
        } catch (Exception e) {
            log.warn("Failed to increment {}: {}", name, e.getMessage());
        }
    }
}
