package com.mimecast.enquiry.config;

import com.google.gson.Gson;
import com.google.gson.JsonSyntaxException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Map backed container providing type safe accessors with defaults.
 * <p>Files are JSON5, read leniently with Gson so comments and unquoted keys are allowed.
 */
@SuppressWarnings("unchecked")
public class ConfigFoundation {

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new empty ConfigFoundation instance.
     */
    public ConfigFoundation() {
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        if (map != null) {
            this.map = map;
        }
    }

    /**
     * Constructs a new ConfigFoundation instance from a JSON5 file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(String path) throws IOException {
        String content = Files.readString(Path.of(path), StandardCharsets.UTF_8);
        try {
            Map<String, Object> parsed = new Gson().fromJson(content, Map.class);
            if (parsed != null) {
                this.map = parsed;
            }
        } catch (JsonSyntaxException e) {
            throw new IOException("Invalid configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Gets configuration map.
     *
     * @return Map of String, Object.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Is empty.
     *
     * @return Boolean.
     */
    public boolean isEmpty() {
        return map.isEmpty();
    }

    /**
     * Has property.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return map.containsKey(name);
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
     * <p>A key present with a null value yields null.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String name, String defaultValue) {
        if (map.containsKey(name)) {
            Object value = map.get(name);
            return value != null ? String.valueOf(value) : null;
        }

        return defaultValue;
    }

    /**
     * Gets boolean property.
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
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }

        return defaultValue;
    }

    /**
     * Gets long property with default.
     * <p>Gson reads all numbers as doubles hence the Number handling.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public long getLongProperty(String name, long defaultValue) {
        Object value = map.get(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
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
    public double getDoubleProperty(String name, double defaultValue) {
        Object value = map.get(name);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }

        return defaultValue;
    }

    /**
     * Gets list of strings property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return List of String.
     */
    public List<String> getStringListProperty(String name, List<String> defaultValue) {
        Object value = map.get(name);
        if (value instanceof List) {
            List<String> list = new ArrayList<>();
            for (Object entry : (List<Object>) value) {
                if (entry != null) {
                    list.add(String.valueOf(entry));
                }
            }
            return list;
        }

        return defaultValue;
    }

    /**
     * Gets map property.
     *
     * @param name Property name.
     * @return Map of String, Object, empty if missing or not a map.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = map.get(name);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }

        return Collections.emptyMap();
    }
}
