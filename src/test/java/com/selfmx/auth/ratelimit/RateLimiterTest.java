package com.selfmx.auth.ratelimit;

import com.selfmx.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RateLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-02-27T00:00:00Z"));

    @Test
    void fixedWindowRejectsOverLimitUntilWindowResets() {
        RateLimiter limiter = new FixedWindowRateLimiter("login", 2, Duration.ofMinutes(1), clock);

        RateLimitDecision first = limiter.tryAcquire("10.0.0.1");
        assertTrue(first.allowed());
        assertEquals(1, first.remaining());
        assertTrue(limiter.tryAcquire("10.0.0.1").allowed());

        clock.advance(Duration.ofSeconds(15));
        RateLimitDecision rejected = limiter.tryAcquire("10.0.0.1");
        assertFalse(rejected.allowed());
        assertEquals(45, rejected.retryAfterSeconds());

        assertTrue(limiter.tryAcquire("10.0.0.2").allowed());

        clock.advance(Duration.ofSeconds(45));
        assertTrue(limiter.tryAcquire("10.0.0.1").allowed());
    }

    @Test
    void slidingWindowRejectsOverLimit() {
        RateLimiter limiter = new SlidingWindowRateLimiter("api", 3, Duration.ofMinutes(1), 6, clock);

        for (int i = 0; i < 3; i++) {
            assertTrue(limiter.tryAcquire("key").allowed());
        }
        RateLimitDecision rejected = limiter.tryAcquire("key");
        assertFalse(rejected.allowed());
        assertEquals(60, rejected.retryAfterSeconds());
        assertEquals("api", limiter.getName());

        clock.advance(Duration.ofSeconds(30));
        assertFalse(limiter.tryAcquire("key").allowed());

        clock.advance(Duration.ofSeconds(30));
        assertTrue(limiter.tryAcquire("key").allowed());
    }

    @Test
    void slidingWindowReleasesCapacityGradually() {
        RateLimiter limiter = new SlidingWindowRateLimiter("api", 3, Duration.ofMinutes(1), 6, clock);

        assertTrue(limiter.tryAcquire("key").allowed());
        clock.advance(Duration.ofSeconds(30));
        assertTrue(limiter.tryAcquire("key").allowed());
        assertTrue(limiter.tryAcquire("key").allowed());
        assertFalse(limiter.tryAcquire("key").allowed());

        // Only the first request has left the window.
        clock.advance(Duration.ofSeconds(30));
        assertTrue(limiter.tryAcquire("key").allowed());
        RateLimitDecision rejected = limiter.tryAcquire("key");
        assertFalse(rejected.allowed());
        assertEquals(30, rejected.retryAfterSeconds());
    }
}
