package org.pragmatica.reclass.registry;

import org.pragmatica.reclass.construct.FieldNames;
import org.pragmatica.reclass.construct.InstanceFactory;

import java.util.List;
import java.util.Optional;

/**
 * A registered token: name, template and the fields its template binds.
 * Tokens without template are abstract roots of a polymorphic family.
 */
public record TokenDefinition(
 String name,
 Class<?> type,
 Optional<String> template,
 List<FieldDefinition> fields,
 Optional<String> supertype,
 Optional<InstanceFactory<?>> factory) {

    /**
     * Field by name; {@code order_id} also finds a field named {@code orderId}.
     */
    public Optional<FieldDefinition> field(String fieldName) {
        return fields.stream()
                     .filter(f -> f.name()
                                   .equals(fieldName))
                     .findFirst()
                     .or(() -> fields.stream()
                                     .filter(f -> FieldNames.matches(fieldName, f.name()))
                                     .findFirst());
    }

    public boolean hasField(String fieldName) {
        return field(fieldName).isPresent();
    }

    public boolean isAbstract() {
        return template.isEmpty();
    }

    @Override
    public String toString() {
        return "TokenDefinition{" + name + " -> " + type.getSimpleName() + "}";
    }
}
