package com.selfmx.gateway.endpoint.dto;

import java.util.List;

/**
 * Sent email list item. Bodies and BCC are not included.
 */
public record SentEmailSummaryDto(
        String id,
        String messageId,
        String sentAt,
        String from,
        List<String> to,
        String subject,
        String domainId,
        String apiKeyId
) {
}
