package org.pragmatica.reclass.compiler;

import org.pragmatica.reclass.registry.FieldDefinition;

import java.util.List;

/**
 * A field of a record node with every place its template binds it. The first occurrence taking part in a match
 * provides the value.
 */
public record FieldBinding(FieldDefinition field, List<GroupMap> occurrences) {
    public boolean isBound() {
        return !occurrences.isEmpty();
    }
}
