package org.pragmatica.reclass.registry;

import java.util.Optional;

/**
 * A named field of a token.
 *
 * @param name         field name as used in {@code <name>} placeholders
 * @param type         semantic type
 * @param pattern      explicit pattern, replaces the type default
 * @param optional     field may be absent from a match
 * @param defaultValue value used when the field is not matched
 * @param repeat       item layout of list fields
 */
public record FieldDefinition(
 String name,
 FieldType type,
 Optional<String> pattern,
 boolean optional,
 Optional<Object> defaultValue,
 RepeatSpec repeat) {

    public static FieldDefinition of(String name, FieldType type) {
        return new FieldDefinition(name, type, Optional.empty(), false, Optional.empty(), RepeatSpec.DEFAULT);
    }

    public FieldDefinition withPattern(String pattern) {
        return new FieldDefinition(name, type, Optional.of(pattern), optional, defaultValue, repeat);
    }

    public FieldDefinition asOptional() {
        return new FieldDefinition(name, type, pattern, true, defaultValue, repeat);
    }

    /**
     * Value used when the field is not matched; a {@code null} default makes the field optional.
     */
    public FieldDefinition withDefault(Object value) {
        if (value == null) {
            return asOptional();
        }
        return new FieldDefinition(name, type, pattern, optional, Optional.of(value), repeat);
    }

    public FieldDefinition withRepeat(RepeatSpec repeat) {
        return new FieldDefinition(name, type, pattern, optional, defaultValue, repeat);
    }

    /**
     * Pattern matched by this field, or by one item for list fields.
     */
    public Optional<String> effectivePattern() {
        if (pattern.isPresent()) {
            return pattern;
        }
        return defaultPattern(type);
    }

    /**
     * Field may stay unbound by the template.
     */
    public boolean mayBeUnbound() {
        return optional || defaultValue.isPresent() || type instanceof FieldType.ListOf;
    }

    private static Optional<String> defaultPattern(FieldType type) {
        if (type instanceof ScalarType scalar) {
            return Optional.of(scalar.defaultPattern());
        }
        if (type instanceof FieldType.Nested nested) {
            return Optional.of("<" + nested.token() + ">");
        }
        var element = ((FieldType.ListOf) type).element();
        return element instanceof FieldType.ListOf
               ? Optional.empty()
               : defaultPattern(element);
    }
}
