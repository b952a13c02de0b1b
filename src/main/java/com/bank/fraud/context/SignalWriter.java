package com.bank.fraud.context;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Prefix-scoped sink for one signal group. A group can only write keys under its own
 * prefix, so two groups can never overwrite each other's signals.
 */
public final class SignalWriter {

    private final String prefix;
    private final Map<String, Object> values = new LinkedHashMap<>();

    SignalWriter(String prefix) {
        this.prefix = prefix;
    }

    public SignalWriter put(String name, Object value) {
        if (value != null && !isSupported(value)) {
            throw new IllegalArgumentException("Unsupported signal type for " + prefix + "." + name
                    + ": " + value.getClass().getName());
        }
        values.put(prefix + "." + name, value);
        return this;
    }

    /**
     * Record the signal as explicitly unknown.
     */
    public SignalWriter unknown(String name) {
        values.put(prefix + "." + name, null);
        return this;
    }

    public String getPrefix() {
        return prefix;
    }

    Map<String, Object> values() {
        return values;
    }

    private static boolean isSupported(Object value) {
        return value instanceof Boolean || value instanceof Number || value instanceof String
                || value instanceof List || value instanceof Map;
    }
}
