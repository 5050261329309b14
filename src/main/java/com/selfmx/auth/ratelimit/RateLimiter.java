package com.selfmx.auth.ratelimit;

/**
 * Per-key request limiter.
 */
public interface RateLimiter {

    /**
     * Consumes one permit for the key when available.
     *
     * @param key Client key, usually the remote IP.
     * @return Decision.
     */
    RateLimitDecision tryAcquire(String key);

    /**
     * Limiter name used in logs and metrics.
     *
     * @return Name.
     */
    String getName();
}
