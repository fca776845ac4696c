package org.pragmatica.reclass.matcher;

/**
 * Text after replacing matches, with the number of replacements made.
 */
public record Substitution(String text, int count) {}
