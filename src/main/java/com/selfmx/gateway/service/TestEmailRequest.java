package com.selfmx.gateway.service;

/**
 * Test email sent from a verified domain.
 *
 * @param senderPrefix Local part of the sender address.
 * @param to           Recipient address.
 * @param subject      Subject.
 * @param text         Plain text body.
 */
public record TestEmailRequest(String senderPrefix, String to, String subject, String text) {
}
