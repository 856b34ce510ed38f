package com.example.RagFlow.engine;

import java.util.Map;

/**
 * Read-only view over a component's {@code data} map. Each getter takes the camelCase key
 * first, then any legacy spellings, and falls back to the default when none is set or the
 * value cannot be read.
 */
public final class ComponentConfig {

    private final Map<String, Object> values;

    public ComponentConfig(Map<String, Object> values) {
        this.values = values == null ? Map.of() : values;
    }

    public String getString(String... keys) {
        Object value = find(keys);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    public int getInt(int defaultValue, String... keys) {
        Object value = find(keys);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(String.valueOf(value).trim());
            } catch (NumberFormatException ignored) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public double getDouble(double defaultValue, String... keys) {
        Object value = find(keys);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(String.valueOf(value).trim());
            } catch (NumberFormatException ignored) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public boolean getBoolean(boolean defaultValue, String... keys) {
        Object value = find(keys);
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value != null) {
            String text = String.valueOf(value).trim();
            if ("true".equalsIgnoreCase(text)) {
                return true;
            }
            if ("false".equalsIgnoreCase(text)) {
                return false;
            }
        }
        return defaultValue;
    }

    private Object find(String... keys) {
        for (String key : keys) {
            Object value = values.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
