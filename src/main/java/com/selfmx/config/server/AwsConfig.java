package com.selfmx.config.server;

import com.selfmx.config.BasicConfig;

import java.util.Map;

/**
 * AWS SES configuration.
 *
 * <p>Access keys are optional; when absent the SDK default credentials chain is used.
 */
public class AwsConfig extends BasicConfig {

    /**
     * Constructs a new AwsConfig instance.
     *
     * @param map Configuration map.
     */
    public AwsConfig(Map<String, Object> map) {
        super(map);
    }

    public String getRegion() {
        return getStringProperty("region", "");
    }

    public String getAccessKeyId() {
        return getStringProperty("accessKeyId", "");
    }

    public String getSecretAccessKey() {
        return getStringProperty("secretAccessKey", "");
    }

    /**
     * Gets the optional endpoint override (for LocalStack style testing).
     *
     * @return Endpoint URL or empty string.
     */
    public String getEndpointOverride() {
        return getStringProperty("endpointOverride", "");
    }

    /**
     * Gets per API call timeout.
     *
     * @return Seconds.
     */
    public long getCallTimeoutSeconds() {
        return getLongProperty("callTimeoutSeconds", 30L);
    }
}
