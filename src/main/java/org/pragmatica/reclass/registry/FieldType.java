package org.pragmatica.reclass.registry;

/**
 * Declared semantic type of a field.
 */
public sealed interface FieldType permits ScalarType, FieldType.Nested, FieldType.ListOf {

    static FieldType nested(String token) {
        return new Nested(token);
    }

    static FieldType listOf(FieldType element) {
        return new ListOf(element);
    }

    /**
     * Field holding a record of another registered token.
     */
    record Nested(String token) implements FieldType {}

    /**
     * Repeated field; the element is a scalar or a nested token.
     */
    record ListOf(FieldType element) implements FieldType {}
}
