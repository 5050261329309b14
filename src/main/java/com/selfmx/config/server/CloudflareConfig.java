package com.selfmx.config.server;

import com.selfmx.config.BasicConfig;

import java.util.Map;

/**
 * Cloudflare DNS configuration.
 *
 * <p>DNS publishing is enabled only when both the API token and zone id are present.
 */
public class CloudflareConfig extends BasicConfig {

    /**
     * Constructs a new CloudflareConfig instance.
     *
     * @param map Configuration map.
     */
    public CloudflareConfig(Map<String, Object> map) {
        super(map);
    }

    public String getApiToken() {
        return getStringProperty("apiToken", "");
    }

    public String getZoneId() {
        return getStringProperty("zoneId", "");
    }

    public String getBaseUrl() {
        return getStringProperty("baseUrl", "https://api.cloudflare.com/client/v4/");
    }

    public long getTimeoutSeconds() {
        return getLongProperty("timeoutSeconds", 30L);
    }

    /**
     * Checks if Cloudflare integration is configured.
     *
     * @return Boolean.
     */
    public boolean isEnabled() {
        return !getApiToken().isBlank() && !getZoneId().isBlank();
    }
}
