package com.mimecast.sharedqueue.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Map backed container with type safe accessors.
 * <p>JSON5 files are parsed with Gson which tolerates comments and unquoted keys.
 */
public class ConfigFoundation {

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

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
     * Constructs a new ConfigFoundation instance with configuration map.
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
     * @throws IOException Unable to read file.
     */
    public ConfigFoundation(String path) throws IOException {
        String content = Files.readString(Path.of(path), StandardCharsets.UTF_8);
        try {
            Map<String, Object> parsed = new Gson().fromJson(content, MAP_TYPE);
            if (parsed != null) {
                this.map = parsed;
            }
        } catch (JsonParseException e) {
            throw new ConfigurationException("Unable to parse configuration file " + path + ": " + e.getMessage(), e);
        }
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
     * Has property.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return map.containsKey(name);
    }

    /**
     * Gets String property.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return String.
     */
    public String getStringProperty(String name, String def) {
        Object value = map.get(name);
        return value != null ? String.valueOf(value) : def;
    }

    /**
     * Gets Long property.
     * <p>Gson reads every JSON number as a double so any integral Number is accepted.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Long.
     * @throws ConfigurationException If the value is not a whole number in long range.
     */
    public Long getLongProperty(String name, Long def) {
        Object value = map.get(name);
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number) || number != Math.rint(number)) {
                throw new ConfigurationException("Property " + name + " is not a whole number: " + value);
            }
            if (number < Long.MIN_VALUE || number >= (double) Long.MAX_VALUE) {
                throw new ConfigurationException("Property " + name + " is out of range: " + value);
            }
            return (long) number;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Property " + name + " is not a number: " + value, e);
            }
        }
        return def;
    }

    /**
     * Gets Integer property.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Integer.
     * @throws ConfigurationException If the value is not a whole number in int range.
     */
    public int getIntProperty(String name, int def) {
        long value = getLongProperty(name, (long) def);
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            throw new ConfigurationException("Property " + name + " is out of range: " + value, e);
        }
    }

    /**
     * Gets Boolean property.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean def) {
        Object value = map.get(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return def;
    }

    /**
     * Gets Map property.
     *
     * @param name Property name.
     * @return Map, empty if absent.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getMapProperty(String name) {
        Object value = map.get(name);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return new HashMap<>();
    }
}
