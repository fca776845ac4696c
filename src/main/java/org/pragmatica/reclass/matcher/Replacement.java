package org.pragmatica.reclass.matcher;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Replacement text whose group references count template groups only.
 * Syntax is the one of {@link java.util.regex.Matcher#appendReplacement}: {@code $n}, {@code ${name}} and
 * {@code \} quoting the next character. A group that did not take part in the match is replaced by nothing.
 */
final class Replacement implements Function<TemplateMatch, String> {
    private final List<Piece> pieces;

    private Replacement(List<Piece> pieces) {
        this.pieces = pieces;
    }

    /**
     * @throws IllegalArgumentException  on a malformed reference
     * @throws IndexOutOfBoundsException on a reference to a group the template does not have
     */
    static Replacement parse(String replacement, int groupCount) {
        var pieces = new ArrayList<Piece>();
        var text = new StringBuilder();
        int length = replacement.length();
        int i = 0;
        while (i < length) {
            char c = replacement.charAt(i);
            if (c == '\\') {
                i++ ;
                if (i == length) {
                    throw new IllegalArgumentException("character to be escaped is missing");
                }
                text.append(replacement.charAt(i++ ));
                continue;
            }
            if (c != '$') {
                text.append(c);
                i++ ;
                continue;
            }
            i++ ;
            if (i == length) {
                throw new IllegalArgumentException("Illegal group reference: group index is missing");
            }
            flush(text, pieces);
            if (replacement.charAt(i) == '{') {
                int close = replacement.indexOf('}', i);
                if (close < 0) {
                    throw new IllegalArgumentException("named capturing group is missing trailing '}'");
                }
                pieces.add(new GroupName(replacement.substring(i + 1, close)));
                i = close + 1;
                continue;
            }
            if (!Character.isDigit(replacement.charAt(i))) {
                throw new IllegalArgumentException("Illegal group reference");
            }
            int group = replacement.charAt(i++ ) - '0';
            while (i < length && Character.isDigit(replacement.charAt(i))) {
                int wider = group * 10 + (replacement.charAt(i) - '0');
                if (wider > groupCount) {
                    break;
                }
                group = wider;
                i++ ;
            }
            if (group > groupCount) {
                throw new IndexOutOfBoundsException("No group " + group);
            }
            pieces.add(new GroupNumber(group));
        }
        flush(text, pieces);
        return new Replacement(List.copyOf(pieces));
    }

    @Override
    public String apply(TemplateMatch match) {
        var out = new StringBuilder();
        for (var piece : pieces) {
            if (piece instanceof Text text) {
                out.append(text.text());
            } else if (piece instanceof GroupNumber number) {
                appendGroup(out, match.group(number.group()));
            } else if (piece instanceof GroupName name) {
                appendGroup(out, match.group(name.name()));
            }
        }
        return out.toString();
    }

    private static void appendGroup(StringBuilder out, String value) {
        if (value != null) {
            out.append(value);
        }
    }

    private static void flush(StringBuilder text, List<Piece> pieces) {
        if (text.length() > 0) {
            pieces.add(new Text(text.toString()));
            text.setLength(0);
        }
    }

    private sealed interface Piece {}

    private record Text(String text) implements Piece {}

    private record GroupNumber(int group) implements Piece {}

    private record GroupName(String name) implements Piece {}
}
