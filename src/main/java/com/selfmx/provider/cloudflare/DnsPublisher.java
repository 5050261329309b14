package com.selfmx.provider.cloudflare;

import com.selfmx.gateway.domain.DnsRecord;

/**
 * Publishes DNS records into a managed zone.
 */
public interface DnsPublisher {

    /**
     * Creates one record.
     *
     * @param record Record to publish.
     * @return Provider record id.
     * @throws DnsPublishException on failure.
     */
    String createRecord(DnsRecord record) throws DnsPublishException;

    /**
     * Removes every record belonging to a domain or its subdomains.
     *
     * @param domain Domain name.
     * @return Number of records removed.
     * @throws DnsPublishException when the records cannot be listed.
     */
    int deleteRecordsForDomain(String domain) throws DnsPublishException;

    /**
     * Whether records are actually published.
     *
     * @return Boolean.
     */
    boolean isEnabled();
}
