package com.selfmx.auth.ratelimit;

/**
 * Result of a rate limit check.
 *
 * @param allowed           whether the request may proceed
 * @param limit             permits per window
 * @param remaining         permits left in the current window
 * @param retryAfterSeconds seconds until a retry can succeed, zero when allowed
 */
public record RateLimitDecision(boolean allowed, int limit, int remaining, long retryAfterSeconds) {

    public static RateLimitDecision allow(int limit, int remaining) {
        return new RateLimitDecision(true, limit, remaining, 0);
    }

    public static RateLimitDecision reject(int limit, long retryAfterSeconds) {
        return new RateLimitDecision(false, limit, 0, Math.max(1, retryAfterSeconds));
    }
}
