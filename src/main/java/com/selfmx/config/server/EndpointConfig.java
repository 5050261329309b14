package com.selfmx.config.server;

import com.selfmx.config.BasicConfig;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Settings of one HTTP listener, the public API or the metrics scrape endpoint.
 *
 * <p>Keys: {@code port}, {@code workers}, {@code authType} ({@code none}, {@code basic}
 * or {@code bearer}), {@code authValue} ({@code user:password} or the token) and
 * {@code allowList} (addresses or CIDR blocks admitted without credentials).
 */
public class EndpointConfig extends BasicConfig {

    public EndpointConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Listening port.
     *
     * @param defaultPort Port used when the key is missing.
     * @return Port, 0 picks a free one.
     */
    public int getPort(int defaultPort) {
        long port = getLongProperty("port", (long) defaultPort);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        return (int) port;
    }

    /**
     * Request worker threads, at least one.
     *
     * @return Worker count.
     */
    public int getWorkers() {
        return (int) Math.max(1L, getLongProperty("workers", 16L));
    }

    public String getAuthType() {
        return getStringProperty("authType", "none").toLowerCase(Locale.ROOT);
    }

    public String getAuthValue() {
        return getStringProperty("authValue", "");
    }

    public List<String> getAllowList() {
        return getListProperty("allowList").stream()
                .filter(Objects::nonNull)
                .map(String::valueOf)
                .collect(Collectors.toList());
    }

    /**
     * Credentials are enforced only when a scheme and a value are both set.
     *
     * @return True when requests must authenticate.
     */
    public boolean isAuthEnabled() {
        return !"none".equals(getAuthType()) && !getAuthValue().isEmpty();
    }
}
