package com.selfmx.gateway.repository;

/**
 * Raised when the store rejects a domain because its name is already taken.
 */
public class DuplicateDomainException extends RuntimeException {

    public DuplicateDomainException(String name, Throwable cause) {
        super("Domain already exists: " + name, cause);
    }
}
