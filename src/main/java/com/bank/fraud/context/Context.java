package com.bank.fraud.context;

import com.bank.fraud.exception.MalformedContextException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Signals derived for one evaluation, keyed {@code <group>.<signal>}.
 *
 * Accessors treat a missing key and an explicit null the same way: unknown, which
 * never satisfies a rule. A key that is present with a value of the wrong type is a
 * malformed context and raises {@link MalformedContextException}.
 */
public final class Context {

    private final Map<String, Object> signals;

    Context(Map<String, Object> signals) {
        this.signals = Collections.unmodifiableMap(new LinkedHashMap<>(signals));
    }

    public static Context of(Map<String, ?> signals) {
        return new Context(new LinkedHashMap<>(signals));
    }

    public static Context empty() {
        return new Context(Collections.emptyMap());
    }

    public boolean has(String key) {
        return signals.get(key) != null;
    }

    public Object raw(String key) {
        return signals.get(key);
    }

    /**
     * True only when the signal is present and TRUE.
     */
    public boolean isTrue(String key) {
        Object value = signals.get(key);
        if (value == null) return false;
        if (value instanceof Boolean) return (Boolean) value;
        throw wrongType(key, "boolean", value);
    }

    /**
     * True only when the signal is present and FALSE. Unknown is neither true nor false.
     */
    public boolean isFalse(String key) {
        Object value = signals.get(key);
        if (value == null) return false;
        if (value instanceof Boolean) return !(Boolean) value;
        throw wrongType(key, "boolean", value);
    }

    public Optional<Double> number(String key) {
        Object value = signals.get(key);
        if (value == null) return Optional.empty();
        if (value instanceof Number) return Optional.of(((Number) value).doubleValue());
        throw wrongType(key, "number", value);
    }

    public Optional<String> text(String key) {
        Object value = signals.get(key);
        if (value == null) return Optional.empty();
        if (value instanceof String) return Optional.of((String) value);
        throw wrongType(key, "string", value);
    }

    @SuppressWarnings("unchecked")
    public List<Object> list(String key) {
        Object value = signals.get(key);
        if (value == null) return List.of();
        if (value instanceof List) return (List<Object>) value;
        throw wrongType(key, "list", value);
    }

    public boolean exceeds(String key, double threshold) {
        return number(key).map(v -> v > threshold).orElse(false);
    }

    public boolean atLeast(String key, double threshold) {
        return number(key).map(v -> v >= threshold).orElse(false);
    }

    /**
     * Present and strictly below the threshold. Unknown is not "below".
     */
    public boolean below(String key, double threshold) {
        return number(key).map(v -> v < threshold).orElse(false);
    }

    public boolean textEquals(String key, String expected) {
        return text(key).map(expected::equalsIgnoreCase).orElse(false);
    }

    public Map<String, Object> asMap() {
        return signals;
    }

    public int size() {
        return signals.size();
    }

    private static MalformedContextException wrongType(String key, String expected, Object value) {
        return new MalformedContextException(String.format(
                "Signal '%s' expected %s but held %s", key, expected, value.getClass().getSimpleName()));
    }

    @Override
    public String toString() {
        return "Context" + signals;
    }
}
