package com.selfmx.config.server;

import com.selfmx.config.ConfigFoundation;

import java.io.IOException;
import java.util.Map;

/**
 * Server configuration.
 *
 * <p>This class provides type safe access to the gateway configuration file ({@code server.json5}).
 * <p>Each top level section is exposed through its own typed view.
 *
 * @see EndpointConfig
 * @see DatabaseConfig
 * @see AwsConfig
 * @see CloudflareConfig
 */
public class ServerConfig extends ConfigFoundation {

    /**
     * Constructs a new ServerConfig instance.
     */
    public ServerConfig() {
        super();
    }

    /**
     * Constructs a new ServerConfig instance.
     *
     * @param map Configuration map.
     */
    public ServerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ServerConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ServerConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets bind address.
     *
     * @return Bind address string.
     */
    public String getBind() {
        return getStringProperty("bind", "0.0.0.0");
    }

    /**
     * Gets API endpoint configuration.
     *
     * @return EndpointConfig instance.
     */
    public EndpointConfig getApi() {
        return new EndpointConfig(getMapProperty("api"));
    }

    /**
     * Gets metrics scrape configuration.
     *
     * @return EndpointConfig instance.
     */
    public EndpointConfig getMetrics() {
        return new EndpointConfig(getMapProperty("metrics"));
    }

    /**
     * Gets database configuration.
     *
     * @return DatabaseConfig instance.
     */
    public DatabaseConfig getDatabase() {
        return new DatabaseConfig(getMapProperty("database"));
    }

    /**
     * Gets AWS configuration.
     *
     * @return AwsConfig instance.
     */
    public AwsConfig getAws() {
        return new AwsConfig(getMapProperty("aws"));
    }

    /**
     * Gets Cloudflare configuration.
     *
     * @return CloudflareConfig instance.
     */
    public CloudflareConfig getCloudflare() {
        return new CloudflareConfig(getMapProperty("cloudflare"));
    }

    /**
     * Gets domain verification configuration.
     *
     * @return VerificationConfig instance.
     */
    public VerificationConfig getVerification() {
        return new VerificationConfig(getMapProperty("verification"));
    }

    /**
     * Gets rate limit configuration.
     *
     * @return RateLimitConfig instance.
     */
    public RateLimitConfig getRateLimit() {
        return new RateLimitConfig(getMapProperty("rateLimit"));
    }

    /**
     * Gets retention configuration.
     *
     * @return RetentionConfig instance.
     */
    public RetentionConfig getRetention() {
        return new RetentionConfig(getMapProperty("retention"));
    }

    /**
     * Gets admin login configuration.
     *
     * @return AdminConfig instance.
     */
    public AdminConfig getAdmin() {
        return new AdminConfig(getMapProperty("admin"));
    }
}
