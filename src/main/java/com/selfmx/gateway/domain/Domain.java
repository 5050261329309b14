package com.selfmx.gateway.domain;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Sending domain stored in {@code domains}.
 */
public class Domain {

    private String id;
    private String name;
    private DomainStatus status;
    private OffsetDateTime createdAt;
    private OffsetDateTime verificationStartedAt;
    private OffsetDateTime verifiedAt;
    private OffsetDateTime lastCheckedAt;
    private String failureReason;
    private String providerIdentityRef;
    private List<DnsRecord> dnsRecords;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public DomainStatus getStatus() {
        return status;
    }

    public void setStatus(DomainStatus status) {
        this.status = status;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getVerificationStartedAt() {
        return verificationStartedAt;
    }

    public void setVerificationStartedAt(OffsetDateTime verificationStartedAt) {
        this.verificationStartedAt = verificationStartedAt;
    }

    public OffsetDateTime getVerifiedAt() {
        return verifiedAt;
    }

    public void setVerifiedAt(OffsetDateTime verifiedAt) {
        this.verifiedAt = verifiedAt;
    }

    public OffsetDateTime getLastCheckedAt() {
        return lastCheckedAt;
    }

    public void setLastCheckedAt(OffsetDateTime lastCheckedAt) {
        this.lastCheckedAt = lastCheckedAt;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public void setFailureReason(String failureReason) {
        this.failureReason = failureReason;
    }

    public String getProviderIdentityRef() {
        return providerIdentityRef;
    }

    public void setProviderIdentityRef(String providerIdentityRef) {
        this.providerIdentityRef = providerIdentityRef;
    }

    public List<DnsRecord> getDnsRecords() {
        return dnsRecords;
    }

    public void setDnsRecords(List<DnsRecord> dnsRecords) {
        this.dnsRecords = dnsRecords;
    }
}
