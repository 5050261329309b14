package com.selfmx.provider.ses;

/**
 * Provider rejected or failed to accept an outbound email.
 */
public class EmailSendException extends Exception {

    public EmailSendException(String message, Throwable cause) {
        super(message, cause);
    }
}
