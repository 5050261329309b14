package com.selfmx.config.server;

import com.selfmx.config.BasicConfig;

import java.util.Map;

/**
 * Rate limit configuration.
 */
public class RateLimitConfig extends BasicConfig {

    /**
     * Constructs a new RateLimitConfig instance.
     *
     * @param map Configuration map.
     */
    public RateLimitConfig(Map<String, Object> map) {
        super(map);
    }

    public int getLoginPerMinute() {
        return Math.toIntExact(getLongProperty("loginPerMinute", 5L));
    }

    public int getApiPerMinute() {
        return Math.toIntExact(getLongProperty("apiPerMinute", 100L));
    }

    /**
     * Gets the number of segments for the sliding API window.
     *
     * @return Segment count.
     */
    public int getApiSegments() {
        return Math.toIntExact(getLongProperty("apiSegments", 6L));
    }
}
