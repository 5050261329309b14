package com.selfmx.provider.ses;

/**
 * Outbound email transport.
 */
public interface EmailSender {

    /**
     * Hands an email to the provider.
     *
     * @param email Validated email.
     * @return Provider message id.
     * @throws EmailSendException on provider failure.
     */
    String send(OutboundEmail email) throws EmailSendException;
}
