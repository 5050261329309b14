package com.selfmx.gateway.endpoint.dto;

import java.util.List;

/**
 * Response DTO for domains.
 */
public record DomainDto(
        String id,
        String name,
        String status,
        String createdAt,
        String verificationStartedAt,
        String verifiedAt,
        String lastCheckedAt,
        String nextCheckAt,
        String failureReason,
        List<DnsRecordDto> dnsRecords
) {
}
