package org.pragmatica.reclass.compiler;

import java.util.regex.Pattern;

/**
 * Precompiled patterns for splitting the text of a matched list back into items.
 * The engine keeps only the last repetition of a group, so items are re-scanned from the list text.
 *
 * @param itemScanner      one item, only where the rest of the text is a valid list tail
 * @param separatorScanner one separator, only where the rest is a valid list tail
 * @param item             map of a single item; group ordinals are relative to the item scanner
 */
public record ListItems(Pattern itemScanner, Pattern separatorScanner, GroupMap item) {}
