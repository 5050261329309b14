package com.selfmx.gateway.endpoint.dto;

import java.util.List;

/**
 * Sent email detail. BCC recipients are never returned.
 */
public record SentEmailDetailDto(
        String id,
        String messageId,
        String sentAt,
        String from,
        List<String> to,
        List<String> cc,
        List<String> replyTo,
        String subject,
        String html,
        String text,
        String domainId,
        String apiKeyId
) {
}
