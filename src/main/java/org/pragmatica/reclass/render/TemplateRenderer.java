package org.pragmatica.reclass.render;

import org.pragmatica.reclass.construct.FieldNames;
import org.pragmatica.reclass.error.ReclassError;
import org.pragmatica.reclass.error.ReclassException;
import org.pragmatica.reclass.registry.FieldDefinition;
import org.pragmatica.reclass.registry.FieldType;
import org.pragmatica.reclass.registry.ScalarType;
import org.pragmatica.reclass.registry.TokenDefinition;
import org.pragmatica.reclass.registry.TokenRegistry;
import org.pragmatica.reclass.template.TemplateLexer;
import org.pragmatica.reclass.template.TemplatePart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Writes instances back to text through their registered templates, so that matching the text rebuilds an
 * equal instance.
 *
 * <p>Only a regex subset is renderable: literal characters and escapes, {@code \s} (one space, nothing when
 * optional), anchors and lookarounds (nothing), groups, alternation (the first branch that renders) and
 * quantifiers. An optional part is written only when it holds fields and all of them have values.
 * Character classes, {@code .}, back-references and class escapes such as {@code \d} are rejected.
 */
public final class TemplateRenderer {
    private static final Logger log = LoggerFactory.getLogger(TemplateRenderer.class);

    private final TokenRegistry registry;

    private TemplateRenderer(TokenRegistry registry) {
        this.registry = registry;
    }

    public static TemplateRenderer create(TokenRegistry registry) {
        return new TemplateRenderer(registry);
    }

    /**
     * Render an instance through the token registered for its class.
     *
     * @throws ReclassException with {@code UnknownToken} when no token is registered for the class,
     *                          {@code TemplateSyntaxError} for a non-renderable template and
     *                          {@code ReconstructionError} when the values cannot satisfy the template
     */
    public String render(Object instance) {
        return render(tokenOf(instance), instance);
    }

    public String render(String tokenName, Object instance) {
        return render(registry.lookup(tokenName), instance);
    }

    private String render(TokenDefinition token, Object instance) {
        if (token.isAbstract()) {
            throw new IllegalArgumentException("Token '" + token.name() + "' has no template to render");
        }
        var text = renderToken(token, instance)
        .orElseThrow(() -> new ReclassError.ReconstructionError(token.name(),
                                                                token.name(),
                                                                "instance " + instance
                                                                + " does not satisfy the template")
                                           .exception());
        log.trace("Rendered {} as '{}'", token.name(), text);
        return text;
    }

    private TokenDefinition tokenOf(Object instance) {
        var type = instance.getClass();
        return registry.tokenFor(type)
                       .orElseThrow(() -> new ReclassError.UnknownToken(type.getName()).exception());
    }

    private Optional<String> renderToken(TokenDefinition token, Object instance) {
        var scope = Scope.token(token, token, readValues(token, instance));
        return new Scan(token.template()
                             .orElseThrow(),
                        scope).render();
    }

    // === Field values ===

    private static Map<String, Object> readValues(TokenDefinition token, Object instance) {
        var values = new HashMap<String, Object>();
        if (instance == null) {
            return values;
        }
        var type = instance.getClass();
        for (var field : token.fields()) {
            accessor(type, field.name()).ifPresent(method -> values.put(field.name(),
                                                                        unwrap(invoke(token, field, method, instance))));
        }
        return values;
    }

    private static Optional<Method> accessor(Class<?> type, String fieldName) {
        if (type.isRecord()) {
            for (var component : type.getRecordComponents()) {
                if (FieldNames.matches(fieldName, component.getName())) {
                    return Optional.of(component.getAccessor());
                }
            }
            return Optional.empty();
        }
        for (var method : type.getMethods()) {
            if (method.getParameterCount() != 0 || Modifier.isStatic(method.getModifiers())) {
                continue;
            }
            var name = method.getName();
            var property = name.startsWith("get") && name.length() > 3
                           ? Character.toLowerCase(name.charAt(3)) + name.substring(4)
                           : name;
            if (FieldNames.matches(fieldName, name) || FieldNames.matches(fieldName, property)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }

    private static Object invoke(TokenDefinition token, FieldDefinition field, Method method, Object instance) {
        try {
            method.setAccessible(true);
            return method.invoke(instance);
        } catch (IllegalAccessException | InvocationTargetException | RuntimeException e) {
            throw new ReclassException(new ReclassError.ReconstructionError(token.name(),
                                                                            field.name(),
                                                                            "cannot read value: " + e.getMessage()),
                                       e);
        }
    }

    private static Object unwrap(Object value) {
        return value instanceof Optional<?> optional
               ? optional.orElse(null)
               : value;
    }

    // === Scan ===

    /**
     * Names visible while rendering: fields of a token, or the one nested value of a field pattern.
     */
    private record Scope(TokenDefinition owner, TokenDefinition source, Map<String, Object> values, Object nested) {
        static Scope token(TokenDefinition owner, TokenDefinition source, Map<String, Object> values) {
            return new Scope(owner, source, values, null);
        }

        static Scope free(Object nested) {
            return new Scope(null, null, Map.of(), nested);
        }

        boolean isToken() {
            return owner != null;
        }
    }

    private record Fragment(String text, int fields) {
        static final Fragment EMPTY = new Fragment("", 0);

        Fragment append(Fragment other) {
            return new Fragment(text + other.text, fields + other.fields);
        }
    }

    private final class Scan {
        private final String template;
        private final Scope scope;
        private int pos;

        private Scan(String template, Scope scope) {
            this.template = template;
            this.scope = scope;
        }

        Optional<String> render() {
            var result = sequence();
            if (pos < template.length()) {
                throw unsupported("unbalanced ')'");
            }
            return result.map(Fragment::text);
        }

        private Optional<Fragment> sequence() {
            Optional<Fragment> chosen = Optional.empty();
            while (true) {
                var alternative = alternative();
                if (chosen.isEmpty()) {
                    chosen = alternative;
                }
                if (pos < template.length() && template.charAt(pos) == '|') {
                    pos++ ;
                    continue;
                }
                return chosen;
            }
        }

        private Optional<Fragment> alternative() {
            var result = Fragment.EMPTY;
            boolean failed = false;
            while (pos < template.length()) {
                char c = template.charAt(pos);
                if (c == '|' || c == ')') {
                    break;
                }
                var element = element();
                if (element.isEmpty()) {
                    failed = true;
                } else if (!failed) {
                    result = result.append(element.get());
                }
            }
            return failed
                   ? Optional.empty()
                   : Optional.of(result);
        }

        private Optional<Fragment> element() {
            boolean whitespace = template.startsWith("\\s", pos);
            var atom = atom();
            var quantifier = quantifier();
            if (quantifier == 0) {
                if (whitespace || atom.isEmpty() || atom.get()
                                                        .fields() == 0) {
                    return Optional.of(Fragment.EMPTY);
                }
                return atom;
            }
            return atom.map(fragment -> new Fragment(fragment.text()
                                                             .repeat(quantifier),
                                                     fragment.fields()));
        }

        /**
         * Minimum repetition count of the quantifier at the position, 1 when there is none.
         */
        private int quantifier() {
            if (pos >= template.length()) {
                return 1;
            }
            char c = template.charAt(pos);
            int min;
            if (c == '?' || c == '*') {
                pos++ ;
                min = 0;
            } else if (c == '+') {
                pos++ ;
                min = 1;
            } else if (c == '{' && template.indexOf('}', pos) > pos) {
                int close = template.indexOf('}', pos);
                var bounds = template.substring(pos + 1, close);
                var low = bounds.contains(",")
                          ? bounds.substring(0, bounds.indexOf(','))
                          : bounds;
                if (low.isEmpty() || !low.chars()
                                         .allMatch(Character::isDigit)) {
                    return 1;
                }
                pos = close + 1;
                min = Integer.parseInt(low);
            } else {
                return 1;
            }
            if (pos < template.length() && (template.charAt(pos) == '?' || template.charAt(pos) == '+')) {
                pos++ ;
            }
            return min;
        }

        private Optional<Fragment> atom() {
            char c = template.charAt(pos);
            if (c == '(') {
                return group();
            }
            if (c == '<') {
                var placeholder = TemplateLexer.placeholderAt(template, pos);
                if (placeholder.isPresent()) {
                    return placeholder(placeholder.get());
                }
            }
            if (c == '\\') {
                return Optional.of(escape());
            }
            if (c == '[' || c == '.') {
                throw unsupported("'" + c + "' cannot be rendered");
            }
            pos++ ;
            if (c == '^' || c == '$') {
                return Optional.of(Fragment.EMPTY);
            }
            return Optional.of(new Fragment(String.valueOf(c), 0));
        }

        private Optional<Fragment> group() {
            int start = pos;
            boolean discard = false;
            if (template.startsWith("(?", pos)) {
                if (template.startsWith("(?:", pos)) {
                    pos += 3;
                } else if (template.startsWith("(?=", pos) || template.startsWith("(?!", pos)) {
                    pos += 3;
                    discard = true;
                } else if (template.startsWith("(?<=", pos) || template.startsWith("(?<!", pos)) {
                    pos += 4;
                    discard = true;
                } else if (template.startsWith("(?<", pos)) {
                    pos = template.indexOf('>', pos) + 1;
                } else {
                    return flagGroup(start);
                }
            } else {
                pos++ ;
            }
            var inner = sequence();
            if (pos >= template.length() || template.charAt(pos) != ')') {
                pos = start;
                throw unsupported("unterminated group");
            }
            pos++ ;
            return discard
                   ? Optional.of(Fragment.EMPTY)
                   : inner;
        }

        /**
         * {@code (?i)} renders nothing, {@code (?i:...)} renders its body.
         */
        private Optional<Fragment> flagGroup(int start) {
            int i = pos + 2;
            while (i < template.length() && (Character.isLetter(template.charAt(i)) || template.charAt(i) == '-')) {
                i++ ;
            }
            if (i >= template.length()) {
                throw unsupported("unterminated group");
            }
            if (template.charAt(i) == ')') {
                pos = i + 1;
                return Optional.of(Fragment.EMPTY);
            }
            if (template.charAt(i) != ':') {
                throw unsupported("group '" + template.substring(start, i + 1) + "' cannot be rendered");
            }
            pos = i + 1;
            var inner = sequence();
            if (pos >= template.length()) {
                pos = start;
                throw unsupported("unterminated group");
            }
            pos++ ;
            return inner;
        }

        private Fragment escape() {
            if (pos + 1 >= template.length()) {
                throw unsupported("dangling escape");
            }
            char c = template.charAt(pos + 1);
            pos += 2;
            if (c == 'Q') {
                int end = template.indexOf("\\E", pos);
                var quoted = end < 0
                             ? template.substring(pos)
                             : template.substring(pos, end);
                pos = end < 0
                      ? template.length()
                      : end + 2;
                return new Fragment(quoted, 0);
            }
            return switch (c) {
                case 's' -> new Fragment(" ", 0);
                case 't' -> new Fragment("\t", 0);
                case 'n' -> new Fragment("\n", 0);
                case 'r' -> new Fragment("\r", 0);
                case 'f' -> new Fragment("\f", 0);
                case 'b', 'B', 'A', 'z', 'Z', 'G' -> Fragment.EMPTY;
                case 'u' -> new Fragment(String.valueOf((char) Integer.parseInt(hex(4), 16)), 0);
                case 'x' -> new Fragment(String.valueOf((char) Integer.parseInt(hex(2), 16)), 0);
                default -> {
                    if (Character.isLetterOrDigit(c)) {
                        pos -= 2;
                        throw unsupported("escape '\\" + c + "' cannot be rendered");
                    }
                    yield new Fragment(String.valueOf(c), 0);
                }
            };
        }

        private String hex(int digits) {
            if (pos + digits > template.length()) {
                throw unsupported("truncated escape");
            }
            var text = template.substring(pos, pos + digits);
            pos += digits;
            return text;
        }

        // === Placeholders ===

        private Optional<Fragment> placeholder(TemplatePart part) {
            if (part instanceof TemplatePart.Reference reference) {
                pos += reference.source()
                                .length();
                return reference(reference);
            }
            var assignment = (TemplatePart.Assignment) part;
            pos += assignment.source()
                             .length();
            return assignment(assignment);
        }

        private Optional<Fragment> reference(TemplatePart.Reference reference) {
            var name = reference.name();
            if (scope.isToken() && scope.source()
                                        .hasField(name)) {
                var field = scope.owner()
                                 .field(name)
                                 .or(() -> scope.source()
                                                .field(name))
                                 .orElseThrow();
                return fieldText(field, scope.values()
                                             .get(field.name())).map(text -> new Fragment(text, 1));
            }
            var token = registry.find(name);
            if (token.isEmpty()) {
                return Optional.of(new Fragment(reference.source(), 0));
            }
            if (!scope.isToken() && scope.nested() != null) {
                var nested = nestedText(token.get());
                if (nested.isPresent()) {
                    return nested;
                }
            }
            if (scope.isToken() && !token.get()
                                         .isAbstract() && registry.isSubtype(scope.owner(), token.get())) {
                var inlined = Scope.token(scope.owner(), token.get(), scope.values());
                return new Scan(token.get()
                                     .template()
                                     .orElseThrow(),
                                inlined).render()
                                        .map(text -> new Fragment(text, 1));
            }
            // token occurrence without a value, renderable when its template needs none
            if (token.get()
                     .isAbstract()) {
                return Optional.empty();
            }
            return renderToken(token.get(), null).map(text -> new Fragment(text, 0));
        }

        private Optional<Fragment> nestedText(TokenDefinition token) {
            var value = scope.nested();
            if (value == null) {
                return Optional.empty();
            }
            var runtime = tokenOf(value);
            if (!runtime.name()
                        .equals(token.name()) && !registry.isSubtype(runtime, token)) {
                return Optional.empty();
            }
            return renderToken(runtime, value).map(text -> new Fragment(text, 1));
        }

        private Optional<Fragment> assignment(TemplatePart.Assignment assignment) {
            if (!scope.isToken() || !scope.source()
                                          .hasField(assignment.name())) {
                return Optional.of(new Fragment(assignment.source(), 0));
            }
            var field = scope.owner()
                             .field(assignment.name())
                             .or(() -> scope.source()
                                            .field(assignment.name()))
                             .orElseThrow();
            var value = scope.values()
                             .get(field.name());
            return constantMatches(field, assignment.value(), value)
                   ? Optional.of(new Fragment("", 1))
                   : Optional.empty();
        }

        private Optional<String> fieldText(FieldDefinition field, Object value) {
            if (value == null) {
                return Optional.empty();
            }
            var type = field.type();
            if (type instanceof ScalarType scalar) {
                return Optional.of(scalar.format(value));
            }
            if (type instanceof FieldType.Nested) {
                return nested(field, value);
            }
            return listText(field, ((FieldType.ListOf) type).element(), value);
        }

        private Optional<String> nested(FieldDefinition field, Object value) {
            return new Scan(field.effectivePattern()
                                 .orElseThrow(),
                            Scope.free(value)).render();
        }

        private Optional<String> listText(FieldDefinition field, FieldType element, Object value) {
            if (!(value instanceof Collection<?> items)) {
                throw new ReclassError.ReconstructionError(scope.owner()
                                                                .name(),
                                                           field.name(),
                                                           "list field holds " + value.getClass()
                                                                                      .getName())
                                      .exception();
            }
            var repeat = field.repeat();
            if (items.isEmpty()) {
                if (repeat.required()) {
                    return Optional.empty();
                }
                return Optional.of(repeat.empty()
                                         .flatMap(empty -> new Scan(empty, Scope.free(null)).render())
                                         .orElse(""));
            }
            var texts = new ArrayList<String>(items.size());
            for (var item : items) {
                var text = element instanceof ScalarType scalar
                           ? Optional.ofNullable(item)
                                     .map(scalar::format)
                           : nested(field, item);
                if (text.isEmpty()) {
                    return Optional.empty();
                }
                texts.add(text.get());
            }
            return Optional.of(String.join(repeat.joiner(), texts));
        }

        private ReclassException unsupported(String reason) {
            return new ReclassError.TemplateSyntaxError(template, pos, "Cannot render: " + reason).exception();
        }
    }

    /**
     * A constant renders when the instance holds the value the constant produces on match.
     */
    private static boolean constantMatches(FieldDefinition field, String literal, Object value) {
        if (!(field.type() instanceof ScalarType scalar)) {
            return value != null;
        }
        Object expected;
        try {
            expected = scalar.parse(literal);
        } catch (RuntimeException e) {
            log.trace("Constant '{}' is not a valid {}, matches produce null", literal, scalar);
            expected = null;
        }
        if (expected == null || value == null) {
            return expected == value;
        }
        return scalar.format(expected)
                     .equals(scalar.format(value));
    }
}
