package org.pragmatica.reclass.template;

import java.util.Optional;

/**
 * Pieces of a template produced by {@link TemplateLexer}.
 */
public sealed interface TemplatePart {
    /**
     * Offset of the part in the template.
     */
    int offset();

    /**
     * Regex text copied through unchanged.
     */
    record Literal(int offset, String text) implements TemplatePart {}

    /**
     * Opening of a capturing group written in the template: {@code (} or {@code (?<name>}.
     */
    record UserGroup(int offset, String text, Optional<String> name) implements TemplatePart {}

    /**
     * {@code \N}; all digits are kept, the engine decides how many of them form the group number.
     */
    record BackReference(int offset, String digits) implements TemplatePart {}

    /**
     * {@code <name>}, followed by an optional quantifier.
     */
    record Reference(int offset, String name, String source, String quantifier) implements TemplatePart {}

    /**
     * {@code <name=value>}, followed by an optional quantifier. The value has {@code \>} unescaped.
     */
    record Assignment(int offset, String name, String value, String source, String quantifier) implements TemplatePart {}

    record Error(int offset, String message) implements TemplatePart {}
}
