package com.selfmx.gateway.endpoint.dto;

import java.util.List;

public record RevokedApiKeyDto(
        String id,
        String name,
        String keyPrefix,
        boolean isAdmin,
        String createdAt,
        String revokedAt,
        String archivedAt,
        String lastUsedAt,
        String lastUsedIp,
        List<String> allowedDomainIds
) {
}
