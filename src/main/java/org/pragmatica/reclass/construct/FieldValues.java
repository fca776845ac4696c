package org.pragmatica.reclass.construct;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Field values passed to an {@link InstanceFactory}.
 * Values are already converted; absent optional fields hold {@code null}.
 */
public final class FieldValues {
    private final String token;
    private final String matchedText;
    private final Map<String, Object> values;

    private FieldValues(String token, String matchedText, Map<String, Object> values) {
        this.token = token;
        this.matchedText = matchedText;
        this.values = values;
    }

    public static FieldValues of(String token, String matchedText, Map<String, Object> values) {
        return new FieldValues(token, matchedText, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * Name of the token being built.
     */
    public String token() {
        return token;
    }

    /**
     * Text matched by the whole token occurrence.
     */
    public String matchedText() {
        return matchedText;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    /**
     * Get field value, {@code null} when absent.
     *
     * <p>Unchecked cast, the caller knows the field type. For checked access use {@link #get(String, Class)}.
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String name) {
        return (T) values.get(name);
    }

    /**
     * Get field value with type checking.
     * Returns empty if the field is absent or of another type.
     */
    public <T> Optional<T> get(String name, Class<T> type) {
        var value = values.get(name);
        if (type.isInstance(value)) {
            return Optional.of(type.cast(value));
        }
        return Optional.empty();
    }

    /**
     * All values in field declaration order.
     */
    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "FieldValues{token='" + token + "', values=" + values + "}";
    }
}
