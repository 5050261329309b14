package com.selfmx.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Map backed configuration container.
 *
 * <p>Provides type safe accessors with defaults over a plain {@code Map}.
 * <p>Numbers parsed from JSON5 arrive as doubles, so numeric getters accept any {@link Number}
 * and numeric strings.
 */
@SuppressWarnings("unchecked")
public class BasicConfig {

    /**
     * Configuration map.
     */
    protected Map<String, Object> map;

    /**
     * Constructs a new BasicConfig instance with an empty map.
     */
    public BasicConfig() {
        this.map = new HashMap<>();
    }

    /**
     * Constructs a new BasicConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public BasicConfig(Map<String, Object> map) {
        this.map = map != null ? map : new HashMap<>();
    }

    /**
     * Gets configuration map.
     *
     * @return Map.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Checks if property exists.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return map.containsKey(name) && map.get(name) != null;
    }

    /**
     * Gets string property.
     *
     * @param name Property name.
     * @return String or null.
     */
    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets string property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String name, String defaultValue) {
        Object value = map.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Double d && d == Math.floor(d) && !Double.isInfinite(d)) {
            return String.valueOf(d.longValue());
        }
        return String.valueOf(value);
    }

    /**
     * Gets long property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long defaultValue) {
        Object value = map.get(name);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Gets boolean property, false when missing.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name) {
        return getBooleanProperty(name, false);
    }

    /**
     * Gets boolean property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean defaultValue) {
        Object value = map.get(name);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s.trim());
        }
        return defaultValue;
    }

    /**
     * Gets map property.
     *
     * @param name Property name.
     * @return Map, empty when missing.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = map.get(name);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return new HashMap<>();
    }

    /**
     * Gets list property.
     *
     * @param name Property name.
     * @return List, empty when missing.
     */
    public List<Object> getListProperty(String name) {
        Object value = map.get(name);
        if (value instanceof List) {
            return (List<Object>) value;
        }
        return new ArrayList<>();
    }
}
