package org.pragmatica.reclass.template;

/**
 * Structural scanning of raw {@code java.util.regex} text: escapes, character classes and group openers.
 */
public final class RegexGroups {
    private RegexGroups() {}

    /**
     * Number of capturing groups in a regex fragment.
     */
    public static int count(String regex) {
        int count = 0;
        int i = 0;
        while (i < regex.length()) {
            char c = regex.charAt(i);
            if (c == '\\') {
                i = skipEscape(regex, i);
            } else if (c == '[') {
                i = skipCharClass(regex, i);
            } else {
                if (c == '(' && (!regex.startsWith("(?", i) || isNamedGroupOpen(regex, i))) {
                    count++ ;
                }
                i++ ;
            }
        }
        return count;
    }

    /**
     * Index just past the escape sequence starting at {@code start}.
     * Handles {@code \Q...\E}, {@code \k<name>} and braced forms like {@code \p{Alpha}}.
     */
    public static int skipEscape(String regex, int start) {
        int length = regex.length();
        if (start + 1 >= length) {
            return length;
        }
        char escaped = regex.charAt(start + 1);
        if (escaped == 'Q') {
            int end = regex.indexOf("\\E", start + 2);
            return end < 0
                   ? length
                   : end + 2;
        }
        if (escaped == 'k' && start + 2 < length && regex.charAt(start + 2) == '<') {
            return closeOf(regex, start + 3, '>');
        }
        if ("pPxN".indexOf(escaped) >= 0 && start + 2 < length && regex.charAt(start + 2) == '{') {
            return closeOf(regex, start + 3, '}');
        }
        return start + 2;
    }

    /**
     * Index just past the character class starting at {@code start}; nested classes are allowed.
     */
    public static int skipCharClass(String regex, int start) {
        int length = regex.length();
        int i = start + 1;
        if (i < length && regex.charAt(i) == '^') {
            i++ ;
        }
        if (i < length && regex.charAt(i) == ']') {
            i++ ;
        }
        int depth = 1;
        while (i < length) {
            char c = regex.charAt(i);
            if (c == '\\') {
                i = skipEscape(regex, i);
                continue;
            }
            if (c == '[') {
                depth++ ;
            } else if (c == ']') {
                depth-- ;
                if (depth == 0) {
                    return i + 1;
                }
            }
            i++ ;
        }
        return length;
    }

    /**
     * {@code (?<name>} at the index, as opposed to the look-behinds {@code (?<=} and {@code (?<!}.
     */
    public static boolean isNamedGroupOpen(String regex, int index) {
        return regex.startsWith("(?<", index)
               && index + 3 < regex.length()
               && Character.isLetter(regex.charAt(index + 3));
    }

    /**
     * Same regex with named groups turned into plain capturing groups, so a fragment can be emitted more
     * than once without duplicate group names. Group numbering is unchanged.
     */
    public static String unname(String regex) {
        var result = new StringBuilder(regex.length());
        int i = 0;
        while (i < regex.length()) {
            char c = regex.charAt(i);
            if (c == '\\') {
                int end = skipEscape(regex, i);
                result.append(regex, i, end);
                i = end;
            } else if (c == '[') {
                int end = skipCharClass(regex, i);
                result.append(regex, i, end);
                i = end;
            } else if (isNamedGroupOpen(regex, i)) {
                result.append('(');
                i = closeOf(regex, i + 3, '>');
            } else {
                result.append(c);
                i++ ;
            }
        }
        return result.toString();
    }

    private static int closeOf(String regex, int from, char close) {
        int end = regex.indexOf(close, from);
        return end < 0
               ? regex.length()
               : end + 1;
    }
}
