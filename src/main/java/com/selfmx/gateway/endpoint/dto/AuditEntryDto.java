package com.selfmx.gateway.endpoint.dto;

public record AuditEntryDto(
        long id,
        String timestamp,
        String action,
        String actorType,
        String actorId,
        String resourceType,
        String resourceId,
        int statusCode,
        String errorMessage,
        String details,
        String ipAddress,
        String userAgent
) {
}
