package org.pragmatica.reclass.template;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateLexerTest {

    // === Placeholders ===

    @Test
    void reference_betweenLiterals_splitsIntoThreeParts() {
        var parts = TemplateLexer.tokenize("a <b> c");

        assertThat(parts).containsExactly(new TemplatePart.Literal(0, "a "),
                                          new TemplatePart.Reference(2, "b", "<b>", ""),
                                          new TemplatePart.Literal(5, " c"));
    }

    @Test
    void reference_withLazyQuantifier_capturesQuantifier() {
        var parts = TemplateLexer.tokenize("<b>+?x");

        assertThat(parts.get(0)).isEqualTo(new TemplatePart.Reference(0, "b", "<b>", "+?"));
        assertThat(parts.get(1)).isEqualTo(new TemplatePart.Literal(5, "x"));
    }

    @Test
    void reference_withRepetitionBraces_capturesBraces() {
        var parts = TemplateLexer.tokenize("<item>{2,3}");

        assertThat(parts).containsExactly(new TemplatePart.Reference(0, "item", "<item>", "{2,3}"));
    }

    @Test
    void reference_followedByNonRepetitionBrace_keepsBraceLiteral() {
        var parts = TemplateLexer.tokenize("<item>{x}");

        assertThat(parts).containsExactly(new TemplatePart.Reference(0, "item", "<item>", ""),
                                          new TemplatePart.Literal(6, "{x}"));
    }

    @Test
    void assignment_simpleValue_isParsed() {
        var parts = TemplateLexer.tokenize("<unit=km>");

        assertThat(parts).containsExactly(new TemplatePart.Assignment(0, "unit", "km", "<unit=km>", ""));
    }

    @Test
    void assignment_escapedCloser_becomesLiteralGreaterThan() {
        var parts = TemplateLexer.tokenize("<kind=-\\>>");

        assertThat(parts).hasSize(1);
        var assignment = (TemplatePart.Assignment) parts.get(0);
        assertThat(assignment.value()).isEqualTo("->");
        assertThat(assignment.source()).isEqualTo("<kind=-\\>>");
    }

    @Test
    void snakeCaseName_isOnePlaceholder() {
        var parts = TemplateLexer.tokenize("<order_id>");

        assertThat(parts).containsExactly(new TemplatePart.Reference(0, "order_id", "<order_id>", ""));
    }

    // === Text that is not a placeholder ===

    @Test
    void angleBracketWithSpace_staysLiteral() {
        var parts = TemplateLexer.tokenize("<a b>");

        assertThat(parts).containsExactly(new TemplatePart.Literal(0, "<a b>"));
    }

    @Test
    void lessThanBeforeDigit_staysLiteral() {
        var parts = TemplateLexer.tokenize("x < 3");

        assertThat(parts).containsExactly(new TemplatePart.Literal(0, "x < 3"));
    }

    @Test
    void escapedAngleBracket_isNotPlaceholder() {
        var parts = TemplateLexer.tokenize("\\<b>");

        assertThat(parts).containsExactly(new TemplatePart.Literal(0, "\\<b>"));
    }

    @Test
    void characterClass_isNotScannedForPlaceholders() {
        var parts = TemplateLexer.tokenize("[<b>]");

        assertThat(parts).containsExactly(new TemplatePart.Literal(0, "[<b>]"));
    }

    @Test
    void backReference_isNotPlaceholder() {
        var parts = TemplateLexer.tokenize("\\k<name>");

        assertThat(parts).containsExactly(new TemplatePart.Literal(0, "\\k<name>"));
    }

    @Test
    void numberedBackReference_isSeparatePart() {
        var parts = TemplateLexer.tokenize("(a)\\12 \\0");

        assertThat(parts).containsExactly(new TemplatePart.UserGroup(0, "(", Optional.empty()),
                                          new TemplatePart.Literal(1, "a)"),
                                          new TemplatePart.BackReference(3, "12"),
                                          new TemplatePart.Literal(6, " \\0"));
    }

    // === Groups ===

    @Test
    void plainGroup_isUserGroup() {
        var parts = TemplateLexer.tokenize("(\\d+)");

        assertThat(parts).containsExactly(new TemplatePart.UserGroup(0, "(", Optional.empty()),
                                          new TemplatePart.Literal(1, "\\d+)"));
    }

    @Test
    void namedGroup_isUserGroupWithName() {
        var parts = TemplateLexer.tokenize("(?<word>\\w+)");

        assertThat(parts.get(0)).isEqualTo(new TemplatePart.UserGroup(0, "(?<word>", Optional.of("word")));
    }

    @Test
    void nonCapturingAndLookbehind_stayLiteral() {
        var parts = TemplateLexer.tokenize("(?:a)(?<=b)");

        assertThat(parts).containsExactly(new TemplatePart.Literal(0, "(?:a)(?<=b)"));
    }

    // === Errors ===

    @Test
    void placeholderAtEnd_isError() {
        var parts = TemplateLexer.tokenize("value <abc");

        assertThat(parts).last()
                         .isInstanceOf(TemplatePart.Error.class);
        assertThat(parts.get(parts.size() - 1)
                        .offset()).isEqualTo(6);
    }

    @Test
    void unterminatedAssignment_isError() {
        var parts = TemplateLexer.tokenize("<abc=x");

        assertThat(parts).hasSize(1);
        assertThat(parts.get(0)).isInstanceOf(TemplatePart.Error.class);
        assertThat(((TemplatePart.Error) parts.get(0)).message()).contains("Unterminated assignment");
    }

    @Test
    void unterminatedGroupName_isError() {
        var parts = TemplateLexer.tokenize("(?<name");

        assertThat(parts).containsExactly(new TemplatePart.Error(0, "Unterminated group name"));
    }

    // === Lookup helpers ===

    @Test
    void placeholderAt_placeholderOffset_returnsPart() {
        var part = TemplateLexer.placeholderAt("x <y>? z", 2);

        assertThat(part).contains(new TemplatePart.Reference(2, "y", "<y>", "?"));
        assertThat(TemplateLexer.length(part.get())).isEqualTo(4);
    }

    @Test
    void placeholderAt_plainText_returnsEmpty() {
        assertThat(TemplateLexer.placeholderAt("x <y z>", 2)).isEmpty();
        assertThat(TemplateLexer.placeholderAt("x", 0)).isEmpty();
    }
}
