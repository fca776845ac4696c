package org.pragmatica.reclass.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a template into literal regex text, user-written capturing groups and placeholders.
 * Escapes, character classes, named group openers and {@code \k<name>} back-references are never read as
 * placeholders. Numbered back-references are split out, their number depends on the groups placeholders add.
 */
public final class TemplateLexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;

    private final String input;
    private final List<TemplatePart> parts = new ArrayList<>();
    private final StringBuilder literal = new StringBuilder();
    private int literalStart;
    private int pos;

    private TemplateLexer(String input, int pos) {
        this.input = input;
        this.pos = pos;
    }

    public static List<TemplatePart> tokenize(String template) {
        if (template.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Template exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new TemplateLexer(template, 0).tokenizeAll();
    }

    /**
     * Placeholder starting at the offset, if there is one.
     * Text that only looks like a placeholder start, e.g. {@code <a b>}, yields empty.
     */
    public static Optional<TemplatePart> placeholderAt(String template, int offset) {
        if (!isPlaceholderStart(template, offset)) {
            return Optional.empty();
        }
        var lexer = new TemplateLexer(template, offset);
        lexer.scanPlaceholder();
        return lexer.parts.isEmpty()
               ? Optional.empty()
               : Optional.of(lexer.parts.get(0));
    }

    /**
     * Length of template text covered by a placeholder part, including its quantifier.
     */
    public static int length(TemplatePart part) {
        if (part instanceof TemplatePart.Reference reference) {
            return reference.source()
                            .length() + reference.quantifier()
                                                 .length();
        }
        if (part instanceof TemplatePart.Assignment assignment) {
            return assignment.source()
                             .length() + assignment.quantifier()
                                                   .length();
        }
        return 0;
    }

    private List<TemplatePart> tokenizeAll() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\\' && isBackReference()) {
                scanBackReference();
            } else if (c == '\\') {
                copyThrough(RegexGroups.skipEscape(input, pos));
            } else if (c == '[') {
                copyThrough(RegexGroups.skipCharClass(input, pos));
            } else if (c == '(') {
                scanGroupOpen();
            } else if (isPlaceholderStart(input, pos)) {
                scanPlaceholder();
            } else {
                appendLiteral(advance());
            }
        }
        flushLiteral();
        return parts;
    }

    private void scanGroupOpen() {
        var start = pos;
        if (RegexGroups.isNamedGroupOpen(input, pos)) {
            int close = input.indexOf('>', pos + 3);
            if (close < 0) {
                flushLiteral();
                parts.add(new TemplatePart.Error(start, "Unterminated group name"));
                pos = input.length();
                return;
            }
            flushLiteral();
            pos = close + 1;
            parts.add(new TemplatePart.UserGroup(start,
                                                 input.substring(start, pos),
                                                 Optional.of(input.substring(start + 3, close))));
            return;
        }
        if (input.startsWith("(?", pos)) {
            appendLiteral(advance());
            return;
        }
        flushLiteral();
        advance();
        parts.add(new TemplatePart.UserGroup(start, "(", Optional.empty()));
    }

    private boolean isBackReference() {
        return pos + 1 < input.length() && input.charAt(pos + 1) >= '1' && input.charAt(pos + 1) <= '9';
    }

    private void scanBackReference() {
        var start = pos;
        advance();
        while (!isAtEnd() && Character.isDigit(peek())) {
            advance();
        }
        flushLiteral();
        parts.add(new TemplatePart.BackReference(start, input.substring(start + 1, pos)));
    }

    private void scanPlaceholder() {
        var start = pos;
        advance();
        // skip <
        var name = scanIdentifier();
        if (isAtEnd()) {
            flushLiteral();
            parts.add(new TemplatePart.Error(start, "Unterminated placeholder '<" + name + "'"));
            return;
        }
        char c = peek();
        if (c == '>') {
            advance();
            var source = input.substring(start, pos);
            var quantifier = scanQuantifier();
            flushLiteral();
            parts.add(new TemplatePart.Reference(start, name, source, quantifier));
            return;
        }
        if (c == '=') {
            advance();
            scanAssignment(start, name);
            return;
        }
        // Not a placeholder, keep the text as is
        if (literal.length() == 0) {
            literalStart = start;
        }
        literal.append(input, start, pos);
    }

    private void scanAssignment(int start, String name) {
        var value = new StringBuilder();
        while (!isAtEnd() && peek() != '>') {
            if (peek() == '\\' && pos + 1 < input.length() && input.charAt(pos + 1) == '>') {
                advance();
                value.append(advance());
            } else {
                value.append(advance());
            }
        }
        if (isAtEnd()) {
            flushLiteral();
            parts.add(new TemplatePart.Error(start, "Unterminated assignment '<" + name + "='"));
            return;
        }
        advance();
        // skip >
        var source = input.substring(start, pos);
        var quantifier = scanQuantifier();
        flushLiteral();
        parts.add(new TemplatePart.Assignment(start, name, value.toString(), source, quantifier));
    }

    private String scanIdentifier() {
        var start = pos;
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        return input.substring(start, pos);
    }

    private String scanQuantifier() {
        var start = pos;
        if (isAtEnd()) {
            return "";
        }
        char c = peek();
        if (c == '*' || c == '+' || c == '?') {
            advance();
        } else if (c == '{' && isRepetitionBrace()) {
            pos = input.indexOf('}', pos) + 1;
        } else {
            return "";
        }
        // lazy or possessive modifier
        if (!isAtEnd() && (peek() == '?' || peek() == '+')) {
            advance();
        }
        return input.substring(start, pos);
    }

    private boolean isRepetitionBrace() {
        int i = pos + 1;
        int digits = 0;
        while (i < input.length() && Character.isDigit(input.charAt(i))) {
            i++ ;
            digits++ ;
        }
        if (digits == 0) {
            return false;
        }
        if (i < input.length() && input.charAt(i) == ',') {
            i++ ;
            while (i < input.length() && Character.isDigit(input.charAt(i))) {
                i++ ;
            }
        }
        return i < input.length() && input.charAt(i) == '}';
    }

    private void copyThrough(int end) {
        appendText(input.substring(pos, end));
        pos = end;
    }

    private void appendLiteral(char c) {
        if (literal.length() == 0) {
            literalStart = pos - 1;
        }
        literal.append(c);
    }

    private void appendText(String text) {
        if (literal.length() == 0) {
            literalStart = pos;
        }
        literal.append(text);
    }

    private void flushLiteral() {
        if (literal.length() > 0) {
            parts.add(new TemplatePart.Literal(literalStart, literal.toString()));
            literal.setLength(0);
        }
    }

    private static boolean isPlaceholderStart(String input, int index) {
        return index + 1 < input.length()
               && input.charAt(index) == '<'
               && isIdentifierStart(input.charAt(index + 1));
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        return input.charAt(pos++ );
    }
}
