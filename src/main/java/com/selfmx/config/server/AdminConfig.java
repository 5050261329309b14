package com.selfmx.config.server;

import com.selfmx.config.BasicConfig;

import java.util.Map;

/**
 * Admin login configuration.
 */
public class AdminConfig extends BasicConfig {

    /**
     * Constructs a new AdminConfig instance.
     *
     * @param map Configuration map.
     */
    public AdminConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets the BCrypt hash of the admin password.
     *
     * @return Hash or empty string when admin login is disabled.
     */
    public String getPasswordHash() {
        return getStringProperty("passwordHash", "");
    }

    public int getSessionExpirationDays() {
        return Math.toIntExact(getLongProperty("sessionExpirationDays", 30L));
    }

    /**
     * Whether the session cookie is marked Secure.
     *
     * @return Boolean.
     */
    public boolean isSecureCookie() {
        return getBooleanProperty("secureCookie", false);
    }
}
