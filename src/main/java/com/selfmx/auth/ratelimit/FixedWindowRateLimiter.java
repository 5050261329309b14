package com.selfmx.auth.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Fixed window limiter: at most {@code limit} permits per key in each window.
 * The counter resets when the window that started with the first request ends.
 */
public class FixedWindowRateLimiter implements RateLimiter {
    private static final int PURGE_THRESHOLD = 10_000;

    private final String name;
    private final int limit;
    private final long windowMillis;
    private final Clock clock;
    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();

    public FixedWindowRateLimiter(String name, int limit, Duration window, Clock clock) {
        this.name = name;
        this.limit = limit;
        this.windowMillis = window.toMillis();
        this.clock = clock;
    }

    @Override
    public RateLimitDecision tryAcquire(String key) {
        long now = clock.millis();
        if (windows.size() > PURGE_THRESHOLD) {
            windows.values().removeIf(w -> w.expired(now, windowMillis));
        }
        Window window = windows.computeIfAbsent(key, k -> new Window(now));
        synchronized (window) {
            if (window.expired(now, windowMillis)) {
                window.start = now;
                window.count = 0;
            }
            if (window.count >= limit) {
                long retryMillis = window.start + windowMillis - now;
                return RateLimitDecision.reject(limit, (retryMillis + 999) / 1000);
            }
            window.count++;
            return RateLimitDecision.allow(limit, limit - window.count);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    private static final class Window {
        long start;
        int count;

        Window(long start) {
            this.start = start;
        }

        boolean expired(long now, long windowMillis) {
            return now - start >= windowMillis;
        }
    }
}
