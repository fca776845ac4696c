package org.pragmatica.reclass.registry;

import org.pragmatica.reclass.compiler.TemplateCompiler;
import org.pragmatica.reclass.construct.FieldNames;
import org.pragmatica.reclass.construct.InstanceFactory;
import org.pragmatica.reclass.construct.RecordFactory;
import org.pragmatica.reclass.error.ReclassError;
import org.pragmatica.reclass.matcher.CompiledMatcher;
import org.pragmatica.reclass.matcher.MatcherConfig;
import org.pragmatica.reclass.matcher.PatternCache;
import org.pragmatica.reclass.matcher.Substitution;
import org.pragmatica.reclass.matcher.TemplateMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Namespace of tokens with its own pattern cache.
 *
 * <p>Registration is a write phase and must not run concurrently with compilation against the same
 * registry. Compiled matchers are immutable and can be shared between threads.
 */
public final class TokenRegistry {
    private static final Logger log = LoggerFactory.getLogger(TokenRegistry.class);

    private final Map<String, TokenDefinition> tokens = new LinkedHashMap<>();
    private final Map<String, List<String>> subtypes = new HashMap<>();
    private final PatternCache cache = new PatternCache();

    private TokenRegistry() {}

    public static TokenRegistry create() {
        return new TokenRegistry();
    }

    // === Registration ===

    /**
     * Register a record type whose fields all use default patterns.
     */
    public TokenDefinition register(Class<?> type, String template) {
        return register(TokenSpec.of(type, template));
    }

    public TokenDefinition register(TokenSpec<?> spec) {
        var name = spec.tokenName();
        if (tokens.containsKey(name)) {
            throw new ReclassError.DuplicateToken(name).exception();
        }
        var supertype = resolveSupertype(spec, name);
        var fields = resolveFields(spec, name, supertype);
        var template = resolveTemplate(spec, name, fields);
        var factory = resolveFactory(spec, name, template, fields);
        var definition = new TokenDefinition(name,
                                             spec.type(),
                                             template,
                                             List.copyOf(fields),
                                             supertype.map(TokenDefinition::name),
                                             factory);
        tokens.put(name, definition);
        subtypes.put(name, new ArrayList<>());
        supertype.ifPresent(sup -> subtypes.get(sup.name())
                                           .add(name));
        cache.clear();
        log.debug("Registered token '{}' for {}{}",
                  name,
                  spec.type()
                      .getName(),
                  supertype.map(sup -> " extending '" + sup.name() + "'")
                           .orElse(""));
        return definition;
    }

    private Optional<TokenDefinition> resolveSupertype(TokenSpec<?> spec, String name) {
        if (spec.supertype()
                .isEmpty()) {
            return inferSupertype(spec.type());
        }
        var supertypeName = spec.supertype()
                                .get();
        var supertype = tokens.get(supertypeName);
        if (supertype == null) {
            throw new ReclassError.InvalidSubtypeLink(name, supertypeName, "supertype is not registered").exception();
        }
        if (!supertype.type()
                      .isAssignableFrom(spec.type())) {
            throw new ReclassError.InvalidSubtypeLink(name,
                                                      supertypeName,
                                                      spec.type()
                                                          .getName() + " is not a subtype of " + supertype.type()
                                                                                                         .getName())
                                  .exception();
        }
        return Optional.of(supertype);
    }

    private Optional<TokenDefinition> inferSupertype(Class<?> type) {
        var queue = new ArrayDeque<Class<?>>();
        enqueueParents(type, queue);
        while (!queue.isEmpty()) {
            var candidate = queue.poll();
            var token = tokenFor(candidate);
            if (token.isPresent()) {
                return token;
            }
            enqueueParents(candidate, queue);
        }
        return Optional.empty();
    }

    private static void enqueueParents(Class<?> type, ArrayDeque<Class<?>> queue) {
        var superclass = type.getSuperclass();
        if (superclass != null && superclass != Object.class && superclass != Record.class) {
            queue.add(superclass);
        }
        queue.addAll(List.of(type.getInterfaces()));
    }

    private List<FieldDefinition> resolveFields(TokenSpec<?> spec, String name, Optional<TokenDefinition> supertype) {
        var declared = new LinkedHashMap<>(spec.fields());
        var fields = new ArrayList<FieldDefinition>();
        if (spec.type()
                .isRecord()) {
            for (var component : spec.type()
                                     .getRecordComponents()) {
                var explicit = FieldNames.find(declared.keySet(), component.getName());
                if (explicit.isPresent()) {
                    fields.add(declared.remove(explicit.get()));
                } else {
                    fields.add(inferField(spec, name, component.getName(), component.getGenericType()));
                }
            }
        }
        fields.addAll(declared.values());

        var fieldNames = fields.stream()
                               .map(FieldDefinition::name)
                               .toList();
        var unknown = spec.overriddenFields()
                          .stream()
                          .filter(field -> fieldNames.stream()
                                                     .noneMatch(fieldName -> FieldNames.matches(field, fieldName)))
                          .sorted()
                          .toList();
        if (!unknown.isEmpty()) {
            throw new ReclassError.InvalidTokenSpec(name, "unknown fields " + String.join(", ", unknown)).exception();
        }

        var resolved = new ArrayList<FieldDefinition>(fields.size());
        for (var field : fields) {
            var customized = inheritPattern(spec.customize(field), supertype);
            validatePattern(name, customized);
            resolved.add(customized);
        }
        return resolved;
    }

    private FieldDefinition inferField(TokenSpec<?> spec, String token, String fieldName, Type genericType) {
        var type = genericType;
        boolean optional = false;
        if (type instanceof ParameterizedType parameterized && parameterized.getRawType() == Optional.class) {
            type = parameterized.getActualTypeArguments()[0];
            optional = true;
        }
        var inferred = inferType(type);
        if (inferred.isEmpty() && spec.hasPattern(fieldName)) {
            inferred = Optional.of(ScalarType.TEXT);
        }
        if (inferred.isEmpty()) {
            throw new ReclassError.MissingFieldPattern(token,
                                                       fieldName,
                                                       "type " + type.getTypeName() + " has no default pattern")
                                  .exception();
        }
        var field = FieldDefinition.of(fieldName, inferred.get());
        return optional
               ? field.asOptional()
               : field;
    }

    private Optional<FieldType> inferType(Type type) {
        if (type instanceof ParameterizedType parameterized) {
            var raw = (Class<?>) parameterized.getRawType();
            if (Collection.class.isAssignableFrom(raw) && raw.isAssignableFrom(List.class)) {
                return inferType(parameterized.getActualTypeArguments()[0])
                .filter(element -> !(element instanceof FieldType.ListOf))
                .map(FieldType::listOf);
            }
            return inferType(raw);
        }
        if (type instanceof Class<?> cls) {
            return ScalarType.forJavaType(cls)
                             .map(FieldType.class::cast)
                             .or(() -> tokenFor(cls).map(token -> FieldType.nested(token.name())));
        }
        return Optional.empty();
    }

    private FieldDefinition inheritPattern(FieldDefinition field, Optional<TokenDefinition> supertype) {
        var current = supertype;
        while (field.pattern()
                    .isEmpty() && current.isPresent()) {
            var inherited = current.get()
                                   .field(field.name())
                                   .flatMap(FieldDefinition::pattern);
            if (inherited.isPresent()) {
                return field.withPattern(inherited.get());
            }
            current = current.get()
                             .supertype()
                             .map(tokens::get);
        }
        return field;
    }

    private void validatePattern(String token, FieldDefinition field) {
        if (field.effectivePattern()
                 .isEmpty()) {
            throw new ReclassError.MissingFieldPattern(token, field.name(), "nested lists are not supported").exception();
        }
        var type = field.type() instanceof FieldType.ListOf list
                   ? list.element()
                   : field.type();
        if (type instanceof FieldType.Nested nested && !tokens.containsKey(nested.token())) {
            throw new ReclassError.MissingFieldPattern(token,
                                                       field.name(),
                                                       "token '" + nested.token() + "' is not registered")
                                  .exception();
        }
    }

    private static Optional<String> resolveTemplate(TokenSpec<?> spec, String name, List<FieldDefinition> fields) {
        if (spec.template()
                .isPresent()) {
            return spec.template();
        }
        if (isAbstract(spec.type())) {
            return Optional.empty();
        }
        if (fields.size() == 1) {
            return Optional.of("<" + fields.get(0)
                                           .name() + ">");
        }
        throw new ReclassError.InvalidTokenSpec(name, "template is required for " + fields.size() + " fields")
                              .exception();
    }

    private static Optional<InstanceFactory<?>> resolveFactory(TokenSpec<?> spec,
                                                               String name,
                                                               Optional<String> template,
                                                               List<FieldDefinition> fields) {
        if (spec.factory()
                .isPresent()) {
            return Optional.of(spec.factory()
                                   .get());
        }
        if (template.isEmpty()) {
            return Optional.empty();
        }
        if (!spec.type()
                 .isRecord()) {
            throw new ReclassError.InvalidTokenSpec(name,
                                                    "non-record type " + spec.type()
                                                                             .getName() + " needs an InstanceFactory")
                                  .exception();
        }
        var fieldNames = fields.stream()
                               .map(FieldDefinition::name)
                               .toList();
        return Optional.of(RecordFactory.forRecord(name, spec.type(), fieldNames));
    }

    private static boolean isAbstract(Class<?> type) {
        return type.isInterface() || Modifier.isAbstract(type.getModifiers());
    }

    // === Lookup ===

    /**
     * Get token by name.
     *
     * @throws org.pragmatica.reclass.error.ReclassException with {@code UnknownToken} if not registered
     */
    public TokenDefinition lookup(String name) {
        return find(name).orElseThrow(() -> new ReclassError.UnknownToken(name).exception());
    }

    public Optional<TokenDefinition> find(String name) {
        return Optional.ofNullable(tokens.get(name));
    }

    /**
     * First token registered for exactly this type.
     */
    public Optional<TokenDefinition> tokenFor(Class<?> type) {
        return tokens.values()
                     .stream()
                     .filter(token -> token.type() == type)
                     .findFirst();
    }

    public List<TokenDefinition> tokens() {
        return List.copyOf(tokens.values());
    }

    /**
     * Direct subtypes in registration order.
     */
    public List<TokenDefinition> subtypes(TokenDefinition token) {
        return subtypes.getOrDefault(token.name(), List.of())
                       .stream()
                       .map(tokens::get)
                       .toList();
    }

    /**
     * Supertypes from the nearest to the root, excluding the token itself.
     */
    public List<TokenDefinition> supertypes(TokenDefinition token) {
        var chain = new ArrayList<TokenDefinition>();
        var current = token.supertype()
                           .map(tokens::get);
        while (current.isPresent()) {
            chain.add(current.get());
            current = current.get()
                             .supertype()
                             .map(tokens::get);
        }
        return chain;
    }

    public boolean isSubtype(TokenDefinition token, TokenDefinition supertype) {
        return supertypes(token).stream()
                                .anyMatch(sup -> sup.name()
                                                    .equals(supertype.name()));
    }

    /**
     * Concrete tokens a reference to the token may match, most specific first:
     * the subtypes in registration order, each preceded by its own subtypes, then the token itself.
     */
    public List<TokenDefinition> alternatives(TokenDefinition token) {
        var result = new ArrayList<TokenDefinition>();
        collectAlternatives(token, result);
        return result;
    }

    private void collectAlternatives(TokenDefinition token, List<TokenDefinition> result) {
        for (var subtype : subtypes(token)) {
            collectAlternatives(subtype, result);
        }
        if (!token.isAbstract()) {
            result.add(token);
        }
    }

    // === Compilation and matching ===

    public CompiledMatcher compile(String template) {
        return compile(template, MatcherConfig.DEFAULT);
    }

    public CompiledMatcher compile(String template, int flags) {
        return compile(template, MatcherConfig.DEFAULT.withFlags(flags));
    }

    public CompiledMatcher compile(String template, MatcherConfig config) {
        if (!config.cacheEnabled()) {
            return CompiledMatcher.of(TemplateCompiler.compile(this, template, config.flags()));
        }
        return cache.get(template,
                         config.flags(),
                         () -> CompiledMatcher.of(TemplateCompiler.compile(this, template, config.flags())));
    }

    public PatternCache cache() {
        return cache;
    }

    /**
     * Match at the start of the text.
     */
    public TemplateMatch match(String template, CharSequence text) {
        return compile(template).match(text);
    }

    /**
     * Find the first match anywhere in the text.
     */
    public TemplateMatch search(String template, CharSequence text) {
        return compile(template).search(text);
    }

    /**
     * Match the whole text.
     */
    public TemplateMatch fullMatch(String template, CharSequence text) {
        return compile(template).fullMatch(text);
    }

    public List<TemplateMatch> findAll(String template, CharSequence text) {
        return compile(template).findAll(text);
    }

    public <T> List<T> findAll(Class<T> type, String template, CharSequence text) {
        return compile(template).findAll(type, text);
    }

    public List<List<Object>> findAllValues(String template, CharSequence text) {
        return compile(template).findAllValues(text);
    }

    public String replaceAll(String template, CharSequence text, String replacement) {
        return compile(template).replaceAll(text, replacement);
    }

    public String replaceFirst(String template, CharSequence text, String replacement) {
        return compile(template).replaceFirst(text, replacement);
    }

    public Substitution substitute(String template, CharSequence text, String replacement, int limit) {
        return compile(template).substitute(text, replacement, limit);
    }

    public List<String> split(String template, CharSequence text) {
        return compile(template).split(text);
    }

    /**
     * Match the token registered for the type at the start of the text and build the instance.
     *
     * @return the instance, or {@code null} when the text does not match
     */
    public <T> T construct(Class<T> type, CharSequence text) {
        var token = tokenFor(type).orElseThrow(() -> new ReclassError.UnknownToken(type.getName()).exception());
        return compile("<" + token.name() + ">").construct(type, text);
    }
}
