package com.selfmx.auth.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Sliding window limiter.
 *
 * <p>The window is split into equal segments. A request is allowed when the permits counted
 * in the segments still inside the window are below the limit. Segments expire one by one,
 * so capacity returns gradually instead of all at once.
 */
public class SlidingWindowRateLimiter implements RateLimiter {
    private static final int PURGE_THRESHOLD = 10_000;

    private final String name;
    private final int limit;
    private final int segments;
    private final long segmentMillis;
    private final Clock clock;
    private final ConcurrentMap<String, Segments> counters = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(String name, int limit, Duration window, int segments, Clock clock) {
        if (segments < 1) {
            throw new IllegalArgumentException("segments must be positive");
        }
        this.name = name;
        this.limit = limit;
        this.segments = segments;
        this.segmentMillis = Math.max(1, window.toMillis() / segments);
        this.clock = clock;
    }

    @Override
    public RateLimitDecision tryAcquire(String key) {
        long current = clock.millis() / segmentMillis;
        if (counters.size() > PURGE_THRESHOLD) {
            counters.values().removeIf(s -> s.idle(current, segments));
        }
        Segments state = counters.computeIfAbsent(key, k -> new Segments(segments));
        synchronized (state) {
            int total = state.total(current, segments);
            if (total >= limit) {
                long oldest = state.oldestActive(current, segments);
                long retryMillis = (oldest + segments) * segmentMillis - clock.millis();
                return RateLimitDecision.reject(limit, (retryMillis + 999) / 1000);
            }
            state.add(current);
            return RateLimitDecision.allow(limit, limit - total - 1);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    private static final class Segments {
        final long[] ids;
        final int[] counts;

        Segments(int size) {
            ids = new long[size];
            counts = new int[size];
            for (int i = 0; i < size; i++) {
                ids[i] = Long.MIN_VALUE;
            }
        }

        int total(long current, int size) {
            int sum = 0;
            for (int i = 0; i < size; i++) {
                if (ids[i] > current - size) {
                    sum += counts[i];
                }
            }
            return sum;
        }

        long oldestActive(long current, int size) {
            long oldest = current;
            for (int i = 0; i < size; i++) {
                if (ids[i] > current - size && counts[i] > 0 && ids[i] < oldest) {
                    oldest = ids[i];
                }
            }
            return oldest;
        }

        void add(long current) {
            int slot = (int) Math.floorMod(current, (long) ids.length);
            if (ids[slot] != current) {
                ids[slot] = current;
                counts[slot] = 0;
            }
            counts[slot]++;
        }

        boolean idle(long current, int size) {
            for (long id : ids) {
                if (id > current - size) {
                    return false;
                }
            }
            return true;
        }
    }
}
