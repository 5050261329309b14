package com.selfmx.gateway.endpoint.dto;

import java.util.List;

/**
 * Response DTO for API keys.
 *
 * <p>Never carries the hash or salt. {@code key} holds the plain secret only in the response
 * to the create call and is null everywhere else.
 */
public record ApiKeyDto(
        String id,
        String name,
        String key,
        String keyPrefix,
        boolean isAdmin,
        String createdAt,
        String revokedAt,
        String lastUsedAt,
        String lastUsedIp,
        List<String> allowedDomainIds
) {
}
