package com.selfmx.provider.cloudflare;

import com.selfmx.config.server.CloudflareConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Creates the DNS publisher from configuration.
 */
public final class DnsPublisherFactory {
    private static final Logger log = LogManager.getLogger(DnsPublisherFactory.class);

    private DnsPublisherFactory() {
        // Utility class
    }

    /**
     * Returns a Cloudflare publisher when a token and zone are configured, otherwise a no-op.
     *
     * @param config Cloudflare configuration.
     * @return DnsPublisher instance.
     */
    public static DnsPublisher createFromConfig(CloudflareConfig config) {
        if (!config.isEnabled()) {
            log.info("Cloudflare not configured, DNS records must be published manually");
            return new NoopDnsPublisher();
        }
        log.info("Cloudflare DNS publishing enabled: zoneId={}", config.getZoneId());
        return new CloudflareDnsPublisher.Builder()
                .withBaseUrl(config.getBaseUrl())
                .withApiToken(config.getApiToken())
                .withZoneId(config.getZoneId())
                .withTimeout(Math.toIntExact(config.getTimeoutSeconds()))
                .build();
    }
}
