package org.pragmatica.reclass;

import org.pragmatica.reclass.matcher.CompiledMatcher;
import org.pragmatica.reclass.matcher.TemplateMatch;
import org.pragmatica.reclass.registry.TokenDefinition;
import org.pragmatica.reclass.registry.TokenRegistry;
import org.pragmatica.reclass.registry.TokenSpec;
import org.pragmatica.reclass.render.TemplateRenderer;

import java.util.List;

/**
 * Entry point for typed regex templates.
 *
 * <p>Example usage:
 * <pre>{@code
 * record Date(int year, int month, int day) {}
 *
 * Reclass.register(Date.class, "<year>-<month>-<day>");
 *
 * var date = Reclass.match("Due: <Date>", "Due: 2025-12-29").get(Date.class);
 * }</pre>
 *
 * <p>The static shortcuts work on a default registry created on first use. Independent namespaces are
 * created with {@link #createRegistry()}.
 */
public final class Reclass {
    private Reclass() {}

    /**
     * The shared default registry.
     */
    public static TokenRegistry defaultRegistry() {
        return DefaultRegistry.INSTANCE;
    }

    /**
     * A new registry, independent of the default one.
     */
    public static TokenRegistry createRegistry() {
        return TokenRegistry.create();
    }

    public static TokenDefinition register(Class<?> type, String template) {
        return defaultRegistry().register(type, template);
    }

    public static TokenDefinition register(TokenSpec<?> spec) {
        return defaultRegistry().register(spec);
    }

    public static CompiledMatcher compile(String template) {
        return defaultRegistry().compile(template);
    }

    public static CompiledMatcher compile(String template, int flags) {
        return defaultRegistry().compile(template, flags);
    }

    /**
     * Match at the start of the text, {@code null} when it does not match.
     */
    public static TemplateMatch match(String template, CharSequence text) {
        return defaultRegistry().match(template, text);
    }

    public static TemplateMatch search(String template, CharSequence text) {
        return defaultRegistry().search(template, text);
    }

    public static TemplateMatch fullMatch(String template, CharSequence text) {
        return defaultRegistry().fullMatch(template, text);
    }

    public static List<TemplateMatch> findAll(String template, CharSequence text) {
        return defaultRegistry().findAll(template, text);
    }

    public static <T> List<T> findAll(Class<T> type, String template, CharSequence text) {
        return defaultRegistry().findAll(type, template, text);
    }

    public static List<List<Object>> findAllValues(String template, CharSequence text) {
        return defaultRegistry().findAllValues(template, text);
    }

    public static String replaceAll(String template, CharSequence text, String replacement) {
        return defaultRegistry().replaceAll(template, text, replacement);
    }

    public static String replaceFirst(String template, CharSequence text, String replacement) {
        return defaultRegistry().replaceFirst(template, text, replacement);
    }

    public static List<String> split(String template, CharSequence text) {
        return defaultRegistry().split(template, text);
    }

    public static <T> T construct(Class<T> type, CharSequence text) {
        return defaultRegistry().construct(type, text);
    }

    public static String render(Object instance) {
        return TemplateRenderer.create(defaultRegistry())
                               .render(instance);
    }

    private static final class DefaultRegistry {
        private static final TokenRegistry INSTANCE = TokenRegistry.create();
    }
}
