package com.selfmx.gateway.domain;

/**
 * API key lifecycle state.
 *
 * <p>ACTIVE keys authenticate. REVOKED keys are kept live for the retention window.
 * ARCHIVED keys only exist in {@code revoked_api_keys}.
 */
public enum ApiKeyState {
    ACTIVE,
    REVOKED,
    ARCHIVED
}
