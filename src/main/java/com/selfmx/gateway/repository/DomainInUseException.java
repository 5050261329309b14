package com.selfmx.gateway.repository;

/**
 * Raised when a domain cannot be deleted because active API keys reference it.
 */
public class DomainInUseException extends RuntimeException {

    public DomainInUseException(String domainId, Throwable cause) {
        super("Domain is referenced by active API keys: " + domainId, cause);
    }
}
