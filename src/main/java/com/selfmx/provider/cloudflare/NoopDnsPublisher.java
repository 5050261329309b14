package com.selfmx.provider.cloudflare;

import com.selfmx.gateway.domain.DnsRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Publisher used when no DNS provider is configured. Records must be created by hand.
 */
public class NoopDnsPublisher implements DnsPublisher {
    private static final Logger log = LogManager.getLogger(NoopDnsPublisher.class);

    @Override
    public String createRecord(DnsRecord record) throws DnsPublishException {
        throw new DnsPublishException("DNS provider not configured, publish " + record + " manually");
    }

    @Override
    public int deleteRecordsForDomain(String domain) {
        log.debug("DNS provider not configured, nothing to remove for {}", domain);
        return 0;
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
