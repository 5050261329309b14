package com.selfmx.provider.ses;

/**
 * Failure talking to the identity provider.
 */
public class IdentityProviderException extends Exception {

    public IdentityProviderException(String message) {
        super(message);
    }

    public IdentityProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
