package com.selfmx.gateway.domain;

import java.util.Locale;

/**
 * Domain verification lifecycle state.
 *
 * <p>Allowed moves: PENDING to VERIFYING or FAILED, VERIFYING to VERIFIED or FAILED.
 * VERIFIED and FAILED are terminal.
 */
public enum DomainStatus {
    PENDING,
    VERIFYING,
    VERIFIED,
    FAILED;

    /**
     * Checks if no automatic transition leaves this state.
     *
     * @return Boolean.
     */
    public boolean isTerminal() {
        return this == VERIFIED || this == FAILED;
    }

    /**
     * Gets the lowercase name used in API responses.
     *
     * @return Lowercase status.
     */
    public String apiName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
