package com.selfmx.config.server;

import com.selfmx.config.BasicConfig;

import java.time.Duration;
import java.util.Map;

/**
 * Domain verification timing configuration.
 */
public class VerificationConfig extends BasicConfig {

    /**
     * Constructs a new VerificationConfig instance.
     *
     * @param map Configuration map.
     */
    public VerificationConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets how long a domain may stay in verifying before it fails.
     *
     * @return Duration.
     */
    public Duration getTimeout() {
        return Duration.ofHours(getLongProperty("timeoutHours", 72L));
    }

    /**
     * Gets the interval between scheduled verification polls.
     *
     * @return Duration.
     */
    public Duration getPollInterval() {
        return Duration.ofSeconds(getLongProperty("pollIntervalSeconds", 300L));
    }

    /**
     * Gets the delay before the first scheduled poll.
     *
     * @return Seconds.
     */
    public long getInitialDelaySeconds() {
        return getLongProperty("initialDelaySeconds", 30L);
    }

    /**
     * Gets the bound applied to every provider or DNS call made during a poll.
     *
     * @return Duration.
     */
    public Duration getCallTimeout() {
        return Duration.ofSeconds(getLongProperty("callTimeoutSeconds", 10L));
    }

    public int getSetupWorkers() {
        return Math.toIntExact(getLongProperty("setupWorkers", 2L));
    }

    /**
     * Gets the fallback public resolver for direct DNS checks.
     *
     * @return Resolver address.
     */
    public String getFallbackResolver() {
        return getStringProperty("fallbackResolver", "8.8.8.8");
    }
}
