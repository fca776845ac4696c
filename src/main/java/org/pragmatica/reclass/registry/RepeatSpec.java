package org.pragmatica.reclass.registry;

import java.util.Optional;

/**
 * How a list field repeats its items.
 *
 * @param separator regex between items
 * @param required  list must contain at least one item
 * @param empty     regex of a literal standing for the empty list, e.g. {@code TBD}
 * @param joiner    text placed between items when rendering
 */
public record RepeatSpec(String separator, boolean required, Optional<String> empty, String joiner) {
    public static final RepeatSpec DEFAULT = new RepeatSpec("\\s*,\\s*", false, Optional.empty(), ", ");

    public RepeatSpec withSeparator(String separator, String joiner) {
        return new RepeatSpec(separator, required, empty, joiner);
    }

    public RepeatSpec withRequired(boolean required) {
        return new RepeatSpec(separator, required, empty, joiner);
    }

    public RepeatSpec withEmpty(String empty) {
        return new RepeatSpec(separator, required, Optional.of(empty), joiner);
    }
}
