package com.selfmx.config.server;

import com.selfmx.config.BasicConfig;

import java.util.Map;

/**
 * Data retention configuration.
 */
public class RetentionConfig extends BasicConfig {

    /**
     * Constructs a new RetentionConfig instance.
     *
     * @param map Configuration map.
     */
    public RetentionConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets how many days sent emails are kept, 0 keeps them forever.
     *
     * @return Days.
     */
    public int getSentEmailDays() {
        return Math.toIntExact(getLongProperty("sentEmailDays", 0L));
    }

    /**
     * Gets how many days a revoked API key stays live before archival.
     *
     * @return Days.
     */
    public int getRevokedKeyDays() {
        return Math.toIntExact(getLongProperty("revokedKeyDays", 90L));
    }

    /**
     * Gets the interval between cleanup runs.
     *
     * @return Seconds.
     */
    public long getCleanupIntervalSeconds() {
        return getLongProperty("cleanupIntervalSeconds", 86400L);
    }
}
