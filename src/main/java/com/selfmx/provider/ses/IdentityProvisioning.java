package com.selfmx.provider.ses;

import com.selfmx.gateway.domain.DnsRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of creating a sending identity: the provider reference and the DNS records
 * the domain owner has to publish.
 */
public class IdentityProvisioning {
    private final String identityRef;
    private final List<DnsRecord> records;

    public IdentityProvisioning(String identityRef, List<DnsRecord> records) {
        this.identityRef = identityRef;
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
    }

    public String getIdentityRef() {
        return identityRef;
    }

    public List<DnsRecord> getRecords() {
        return records;
    }
}
