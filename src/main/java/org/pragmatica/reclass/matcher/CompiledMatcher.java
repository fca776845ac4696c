package org.pragmatica.reclass.matcher;

import org.pragmatica.reclass.compiler.CompiledTemplate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;

/**
 * Compiled template ready for matching. Immutable and safe to share between threads.
 *
 * <p>A non-matching text is not an error: single-match operations return {@code null}.
 */
public final class CompiledMatcher {
    private final CompiledTemplate compiled;

    private CompiledMatcher(CompiledTemplate compiled) {
        this.compiled = compiled;
    }

    public static CompiledMatcher of(CompiledTemplate compiled) {
        return new CompiledMatcher(compiled);
    }

    /**
     * Match at the start of the text.
     */
    public TemplateMatch match(CharSequence text) {
        var matcher = compiled.pattern()
                              .matcher(text);
        return matcher.lookingAt()
               ? wrap(matcher, text)
               : null;
    }

    /**
     * Match the whole text.
     */
    public TemplateMatch fullMatch(CharSequence text) {
        var matcher = compiled.pattern()
                              .matcher(text);
        return matcher.matches()
               ? wrap(matcher, text)
               : null;
    }

    /**
     * First match anywhere in the text.
     */
    public TemplateMatch search(CharSequence text) {
        var matcher = compiled.pattern()
                              .matcher(text);
        return matcher.find()
               ? wrap(matcher, text)
               : null;
    }

    /**
     * All successive non-overlapping matches.
     */
    public List<TemplateMatch> findAll(CharSequence text) {
        var matcher = compiled.pattern()
                              .matcher(text);
        var result = new ArrayList<TemplateMatch>();
        while (matcher.find()) {
            result.add(wrap(matcher, text));
        }
        return result;
    }

    /**
     * First occurrence of the type from every successive match; matches where it did not take part are skipped.
     */
    public <T> List<T> findAll(Class<T> type, CharSequence text) {
        compiled.index()
                .occurrence(type, 1);
        var result = new ArrayList<T>();
        for (var match : findAll(text)) {
            match.reconstruct(type, 1)
                 .toOptional()
                 .ifPresent(result::add);
        }
        return result;
    }

    /**
     * {@link TemplateMatch#values()} of every successive match.
     */
    public List<List<Object>> findAllValues(CharSequence text) {
        var result = new ArrayList<List<Object>>();
        for (var match : findAll(text)) {
            result.add(match.values());
        }
        return result;
    }

    // === Replace and split ===

    /**
     * Replace every match. {@code $n} and {@code ${name}} in the replacement refer to template groups.
     */
    public String replaceAll(CharSequence text, String replacement) {
        return substitute(text, replacement, 0).text();
    }

    public String replaceAll(CharSequence text, Function<TemplateMatch, String> replacer) {
        return substitute(text, replacer, 0).text();
    }

    public String replaceFirst(CharSequence text, String replacement) {
        return substitute(text, replacement, 1).text();
    }

    /**
     * Replace at most {@code limit} matches from the left, all of them when the limit is zero or negative.
     */
    public Substitution substitute(CharSequence text, String replacement, int limit) {
        return substitute(text, Replacement.parse(replacement, groupCount()), limit);
    }

    /**
     * Replace matches with text computed from each match. The returned text is used as is.
     */
    public Substitution substitute(CharSequence text, Function<TemplateMatch, String> replacer, int limit) {
        var matcher = compiled.pattern()
                              .matcher(text);
        var out = new StringBuilder();
        int count = 0;
        while ((limit <= 0 || count < limit) && matcher.find()) {
            var replacement = replacer.apply(wrap(matcher, text));
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
            count++ ;
        }
        matcher.appendTail(out);
        return new Substitution(out.toString(), count);
    }

    /**
     * Split around matches, with the semantics of {@link java.util.regex.Pattern#split(CharSequence, int)}.
     * Group text is not included in the result.
     */
    public List<String> split(CharSequence text, int limit) {
        return Arrays.asList(compiled.pattern()
                                     .split(text, limit));
    }

    public List<String> split(CharSequence text) {
        return split(text, 0);
    }

    /**
     * Match at the start of the text and build the only token of the template.
     *
     * @return the instance, or {@code null} when the text does not match
     * @throws IllegalStateException if the template does not consist of exactly one token occurrence
     */
    public Object construct(CharSequence text) {
        if (compiled.roots()
                    .size() != 1) {
            throw new IllegalStateException("Template '" + compiled.template() + "' has " + compiled.roots()
                                                                                                  .size()
                                            + " top level tokens, expected one");
        }
        var match = match(text);
        if (match == null) {
            return null;
        }
        return match.reconstruct(compiled.roots()
                                         .get(0))
                    .orNull();
    }

    /**
     * Match at the start of the text and build the first occurrence of the type.
     *
     * @return the instance, or {@code null} when the text does not match
     */
    public <T> T construct(Class<T> type, CharSequence text) {
        compiled.index()
                .occurrence(type, 1);
        var match = match(text);
        return match == null
               ? null
               : match.get(type, 1);
    }

    /**
     * Expanded regex.
     */
    public String pattern() {
        return compiled.expanded();
    }

    public String template() {
        return compiled.template();
    }

    public int flags() {
        return compiled.flags();
    }

    /**
     * Number of groups written in the template.
     */
    public int groupCount() {
        return compiled.userGroups()
                       .size();
    }

    public CompiledTemplate compiled() {
        return compiled;
    }

    private TemplateMatch wrap(Matcher matcher, CharSequence text) {
        return new TemplateMatch(this, matcher.toMatchResult(), text);
    }

    @Override
    public String toString() {
        return "CompiledMatcher{template='" + compiled.template() + "', pattern='" + compiled.expanded() + "'}";
    }
}
