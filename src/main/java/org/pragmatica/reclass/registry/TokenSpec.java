package org.pragmatica.reclass.registry;

import org.pragmatica.reclass.construct.FieldNames;
import org.pragmatica.reclass.construct.InstanceFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registration request for a token.
 *
 * <p>Example usage:
 * <pre>{@code
 * registry.register(TokenSpec.of(Date.class, "<year>-<month>-<date>|<year>/<month>/<date>")
 *                            .name("DATE")
 *                            .pattern("year", "\\d{4}")
 *                            .pattern("month", "\\d{2}")
 *                            .pattern("date", "\\d{2}"));
 * }</pre>
 *
 * <p>Fields of record types are taken from the record components unless given explicitly.
 */
public final class TokenSpec<T> {
    private final Class<T> type;
    private String name;
    private String template;
    private String supertype;
    private InstanceFactory<T> factory;
    private final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
    private final Map<String, String> patterns = new LinkedHashMap<>();
    private final Set<String> optionals = new LinkedHashSet<>();
    private final Map<String, Object> defaults = new LinkedHashMap<>();
    private final Map<String, RepeatSpec> repeats = new LinkedHashMap<>();

    private TokenSpec(Class<T> type) {
        this.type = type;
    }

    public static <T> TokenSpec<T> of(Class<T> type) {
        return new TokenSpec<>(type);
    }

    public static <T> TokenSpec<T> of(Class<T> type, String template) {
        return new TokenSpec<>(type).template(template);
    }

    /**
     * Token name, defaults to the simple name of the type.
     */
    public TokenSpec<T> name(String name) {
        this.name = name;
        return this;
    }

    public TokenSpec<T> template(String template) {
        this.template = template;
        return this;
    }

    /**
     * Declare a field explicitly instead of deriving it from a record component.
     */
    public TokenSpec<T> field(FieldDefinition field) {
        fields.put(field.name(), field);
        return this;
    }

    public TokenSpec<T> field(String fieldName, FieldType fieldType) {
        return field(FieldDefinition.of(fieldName, fieldType));
    }

    /**
     * Override the pattern of a field (the item pattern for list fields).
     */
    public TokenSpec<T> pattern(String fieldName, String pattern) {
        patterns.put(fieldName, pattern);
        return this;
    }

    public TokenSpec<T> patterns(Map<String, String> fieldPatterns) {
        patterns.putAll(fieldPatterns);
        return this;
    }

    public TokenSpec<T> optional(String... fieldNames) {
        optionals.addAll(List.of(fieldNames));
        return this;
    }

    public TokenSpec<T> defaultValue(String fieldName, Object value) {
        defaults.put(fieldName, value);
        return this;
    }

    public TokenSpec<T> repeat(String fieldName, RepeatSpec repeat) {
        repeats.put(fieldName, repeat);
        return this;
    }

    /**
     * Link to a registered supertype token, inferred from the type hierarchy when not set.
     */
    public TokenSpec<T> supertype(String tokenName) {
        this.supertype = tokenName;
        return this;
    }

    public TokenSpec<T> factory(InstanceFactory<T> factory) {
        this.factory = factory;
        return this;
    }

    public Class<T> type() {
        return type;
    }

    public String tokenName() {
        return name == null
               ? type.getSimpleName()
               : name;
    }

    public Optional<String> template() {
        return Optional.ofNullable(template);
    }

    public Optional<String> supertype() {
        return Optional.ofNullable(supertype);
    }

    public Optional<InstanceFactory<T>> factory() {
        return Optional.ofNullable(factory);
    }

    Map<String, FieldDefinition> fields() {
        return fields;
    }

    Set<String> overriddenFields() {
        var names = new LinkedHashSet<String>();
        names.addAll(patterns.keySet());
        names.addAll(optionals);
        names.addAll(defaults.keySet());
        names.addAll(repeats.keySet());
        return names;
    }

    boolean hasPattern(String fieldName) {
        return lookup(patterns, fieldName).isPresent();
    }

    /**
     * Apply per-field overrides on top of a declared or derived field.
     */
    FieldDefinition customize(FieldDefinition field) {
        var result = field;
        var pattern = lookup(patterns, field.name());
        if (pattern.isPresent()) {
            result = result.withPattern(pattern.get());
        }
        if (optionals.stream()
                     .anyMatch(name -> FieldNames.matches(name, field.name()))) {
            result = result.asOptional();
        }
        var defaultKey = FieldNames.find(defaults.keySet(), field.name());
        if (defaultKey.isPresent()) {
            result = result.withDefault(defaults.get(defaultKey.get()));
        }
        var repeat = lookup(repeats, field.name());
        if (repeat.isPresent()) {
            result = result.withRepeat(repeat.get());
        }
        return result;
    }

    private static <V> Optional<V> lookup(Map<String, V> overrides, String fieldName) {
        return FieldNames.find(overrides.keySet(), fieldName)
                         .map(overrides::get);
    }
}
