package com.mimecast.listrunner.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration map wrapper.
 *
 * <p>Provides typed accessors over a map parsed from a JSON5 configuration file.
 * <p>Numbers parsed by Gson arrive as doubles so numeric accessors convert from any {@link Number}.
 */
@SuppressWarnings("unchecked")
public class BasicConfig {

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new BasicConfig instance.
     */
    public BasicConfig() {
    }

    /**
     * Constructs a new BasicConfig instance with given map.
     *
     * @param map Configuration map.
     */
    public BasicConfig(Map<String, Object> map) {
        if (map != null) {
            this.map = map;
        }
    }

    /**
     * Gets underlying map.
     *
     * @return Map.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Has property.
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
        return value != null ? String.valueOf(value) : defaultValue;
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
        if (value instanceof String string && !string.isBlank()) {
            return Long.parseLong(string.trim());
        }
        return defaultValue;
    }

    /**
     * Gets double property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Double.
     */
    public Double getDoubleProperty(String name, Double defaultValue) {
        Object value = map.get(name);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String string && !string.isBlank()) {
            return Double.parseDouble(string.trim());
        }
        return defaultValue;
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
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String string) {
            return Boolean.parseBoolean(string.trim());
        }
        return defaultValue;
    }

    /**
     * Gets boolean property defaulting to false.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name) {
        return getBooleanProperty(name, false);
    }

    /**
     * Gets list property.
     *
     * @param name Property name.
     * @return List, empty if missing.
     */
    public <T> List<T> getListProperty(String name) {
        Object value = map.get(name);
        if (value instanceof List) {
            return new ArrayList<>((List<T>) value);
        }
        return new ArrayList<>();
    }

    /**
     * Gets string list property.
     * <p>Non-string entries are converted with {@link String#valueOf(Object)}.
     *
     * @param name Property name.
     * @return List of strings, empty if missing.
     */
    public List<String> getStringListProperty(String name) {
        List<String> list = new ArrayList<>();
        for (Object entry : getListProperty(name)) {
            if (entry != null) {
                list.add(String.valueOf(entry));
            }
        }
        return list;
    }

    /**
     * Gets map property.
     *
     * @param name Property name.
     * @return Map, empty if missing.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = map.get(name);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Collections.emptyMap();
    }
}
