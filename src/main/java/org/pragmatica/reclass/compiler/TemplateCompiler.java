package org.pragmatica.reclass.compiler;

import org.pragmatica.reclass.compiler.GroupMap.Constant;
import org.pragmatica.reclass.compiler.GroupMap.ListField;
import org.pragmatica.reclass.compiler.GroupMap.NestedField;
import org.pragmatica.reclass.compiler.GroupMap.PlainField;
import org.pragmatica.reclass.compiler.GroupMap.PolymorphicNode;
import org.pragmatica.reclass.compiler.GroupMap.RecordNode;
import org.pragmatica.reclass.error.ReclassError;
import org.pragmatica.reclass.error.ReclassException;
import org.pragmatica.reclass.matcher.TypedReconstructor;
import org.pragmatica.reclass.registry.FieldDefinition;
import org.pragmatica.reclass.registry.FieldType;
import org.pragmatica.reclass.registry.ScalarType;
import org.pragmatica.reclass.registry.TokenDefinition;
import org.pragmatica.reclass.registry.TokenRegistry;
import org.pragmatica.reclass.template.RegexGroups;
import org.pragmatica.reclass.template.TemplateLexer;
import org.pragmatica.reclass.template.TemplatePart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Expands a template against a registry into a plain {@code java.util.regex} pattern and the Group-Map tree
 * describing which engine groups hold which fields.
 *
 * <p>Groups are numbered by counting in emission order. Every capturing group the compiler emits is counted
 * when emitted, every group inside raw field patterns is counted with {@link RegexGroups#count(String)}.
 */
public final class TemplateCompiler {
    private static final Logger log = LoggerFactory.getLogger(TemplateCompiler.class);

    private final TokenRegistry registry;
    private final int flags;
    private final List<Frame> stack;
    private final List<Integer> userGroups = new ArrayList<>();
    private final Map<String, Integer> userNamedGroups = new LinkedHashMap<>();
    private int groups;

    private TemplateCompiler(TokenRegistry registry, int flags, List<Frame> stack) {
        this.registry = registry;
        this.flags = flags;
        this.stack = new ArrayList<>(stack);
    }

    /**
     * Compile a free template.
     *
     * @throws ReclassException with {@code TemplateSyntaxError} or {@code CompileCycleError}
     * @throws java.util.regex.PatternSyntaxException if the expanded pattern is not a valid regex
     */
    public static CompiledTemplate compile(TokenRegistry registry, String template, int flags) {
        var compiler = new TemplateCompiler(registry, flags, List.of());
        var roots = new ArrayList<GroupMap>();
        var expanded = compiler.expandTemplate(template, null, roots, true);
        var pattern = Pattern.compile(expanded, flags);
        var index = OccurrenceIndex.build(registry, roots);
        log.debug("Compiled template '{}' into {} groups, {} user groups",
                  template,
                  compiler.groups,
                  compiler.userGroups.size());
        return new CompiledTemplate(template,
                                    pattern,
                                    List.copyOf(roots),
                                    index,
                                    List.copyOf(compiler.userGroups),
                                    Map.copyOf(compiler.userNamedGroups));
    }

    // === Template scan ===

    private String expandTemplate(String template, Scope scope, List<GroupMap> sink, boolean userLevel) {
        var out = new StringBuilder();
        for (var part : TemplateLexer.tokenize(template)) {
            if (part instanceof TemplatePart.Literal literal) {
                out.append(literal.text());
            } else if (part instanceof TemplatePart.UserGroup group) {
                out.append(userGroup(template, group, userLevel));
            } else if (part instanceof TemplatePart.BackReference reference) {
                out.append(backReference(template, reference, userLevel));
            } else if (part instanceof TemplatePart.Reference reference) {
                var expansion = expandReference(template, reference, scope, sink);
                out.append(expansion.map(text -> quantified(text, reference.quantifier()))
                                    .orElse(reference.source() + reference.quantifier()));
            } else if (part instanceof TemplatePart.Assignment assignment) {
                var expansion = expandAssignment(template, assignment, scope);
                out.append(expansion.map(text -> quantified(text, assignment.quantifier()))
                                    .orElse(assignment.source() + assignment.quantifier()));
            } else if (part instanceof TemplatePart.Error error) {
                throw syntaxError(template, error.offset(), error.message());
            }
        }
        return out.toString();
    }

    private String userGroup(String template, TemplatePart.UserGroup group, boolean userLevel) {
        groups++ ;
        if (!userLevel) {
            // token bodies can be emitted many times, names would clash
            return "(";
        }
        userGroups.add(groups);
        if (group.name()
                 .isPresent()) {
            var name = group.name()
                            .get();
            if (userNamedGroups.containsKey(name)) {
                throw syntaxError(template, group.offset(), "Duplicate group name '" + name + "'");
            }
            userNamedGroups.put(name, groups);
        }
        return group.text();
    }

    /**
     * A template back-reference counts template groups only; it is rewritten to the engine group.
     * Digits are consumed while they still name an opened group, the rest stay literal.
     */
    private String backReference(String template, TemplatePart.BackReference reference, boolean userLevel) {
        var digits = reference.digits();
        if (!userLevel) {
            return "\\" + digits;
        }
        int group = digits.charAt(0) - '0';
        int length = 1;
        while (length < digits.length()) {
            int wider = group * 10 + (digits.charAt(length) - '0');
            if (wider > userGroups.size()) {
                break;
            }
            group = wider;
            length++ ;
        }
        if (group > userGroups.size()) {
            throw syntaxError(template, reference.offset(), "Back-reference to undefined group " + group);
        }
        return "(?:\\" + userGroups.get(group - 1) + ")" + digits.substring(length);
    }

    private static String quantified(String expansion, String quantifier) {
        return quantifier.isEmpty()
               ? expansion
               : "(?:" + expansion + ")" + quantifier;
    }

    private Optional<String> expandReference(String template,
                                             TemplatePart.Reference reference,
                                             Scope scope,
                                             List<GroupMap> sink) {
        var name = reference.name();
        if (scope != null) {
            var field = scope.field(name);
            if (field.isPresent()) {
                checkInherited(template, reference.offset(), scope, name);
                return Optional.of(expandField(template, reference.offset(), field.get(), scope));
            }
        }
        var token = registry.find(name);
        if (token.isEmpty()) {
            return Optional.empty();
        }
        if (scope != null && !token.get()
                                   .isAbstract() && registry.isSubtype(scope.owner, token.get())) {
            return Optional.of(inlineSupertype(token.get(), scope));
        }
        return Optional.of(expandToken(token.get(), sink).text());
    }

    private Optional<String> expandAssignment(String template, TemplatePart.Assignment assignment, Scope scope) {
        if (scope == null) {
            return Optional.empty();
        }
        var field = scope.field(assignment.name());
        if (field.isEmpty()) {
            return Optional.empty();
        }
        checkInherited(template, assignment.offset(), scope, assignment.name());
        var value = constantValue(template, assignment, field.get(), scope);
        int marker = ++groups;
        scope.bind(field.get(), new Constant(field.get(), assignment.value(), value, marker));
        return Optional.of("()");
    }

    private static void checkInherited(String template, int offset, Scope scope, String name) {
        if (!scope.owner.hasField(name)) {
            throw syntaxError(template,
                              offset,
                              "Field '" + name + "' of '" + scope.source.name() + "' is not a field of '"
                              + scope.owner.name() + "'");
        }
    }

    // === Tokens ===

    private Expansion expandToken(TokenDefinition token, List<GroupMap> sink) {
        checkCycle(token.name(), true);
        if (!token.isAbstract() && registry.subtypes(token)
                                           .isEmpty()) {
            var expansion = expandRecord(token);
            sink.add(expansion.node());
            return expansion;
        }
        var alternatives = registry.alternatives(token);
        if (alternatives.isEmpty()) {
            throw syntaxError("<" + token.name() + ">", 0, "Token '" + token.name() + "' has no concrete subtypes");
        }
        stack.add(new Frame(token.name(), true));
        var nodes = new ArrayList<RecordNode>(alternatives.size());
        var texts = new ArrayList<String>(alternatives.size());
        for (var alternative : alternatives) {
            var expansion = expandRecord(alternative);
            nodes.add((RecordNode) expansion.node());
            texts.add(expansion.text());
        }
        stack.remove(stack.size() - 1);
        var node = new PolymorphicNode(token, List.copyOf(nodes));
        sink.add(node);
        return new Expansion("(?:" + String.join("|", texts) + ")", node);
    }

    private Expansion expandRecord(TokenDefinition token) {
        checkCycle(token.name(), false);
        stack.add(new Frame(token.name(), false));
        int group = ++groups;
        var scope = new Scope(token);
        var template = token.template()
                            .orElseThrow();
        var body = expandTemplate(template, scope, scope.references, false);
        stack.remove(stack.size() - 1);
        var bindings = scope.bindings();
        for (var binding : bindings) {
            if (!binding.isBound() && !binding.field()
                                              .mayBeUnbound()) {
                throw syntaxError(template,
                                  0,
                                  "Field '" + binding.field()
                                                     .name() + "' of token '" + token.name()
                                  + "' is not bound by its template");
            }
        }
        var node = new RecordNode(token, group, bindings, List.copyOf(scope.references));
        return new Expansion("(" + body + ")", node);
    }

    private String inlineSupertype(TokenDefinition supertype, Scope scope) {
        checkCycle(supertype.name(), false);
        stack.add(new Frame(supertype.name(), false));
        var inlined = scope.inline(supertype);
        var body = expandTemplate(supertype.template()
                                           .orElseThrow(),
                                  inlined,
                                  inlined.references,
                                  false);
        stack.remove(stack.size() - 1);
        return "(?:" + body + ")";
    }

    /**
     * A record expansion only clashes with records in progress, a token reference with anything in progress.
     */
    private void checkCycle(String name, boolean anyFrame) {
        for (var frame : stack) {
            if (frame.token()
                     .equals(name) && (anyFrame || !frame.polymorphic())) {
                var path = new ArrayList<String>(stack.size() + 1);
                stack.forEach(entry -> path.add(entry.token()));
                path.add(name);
                throw new ReclassError.CompileCycleError(List.copyOf(path)).exception();
            }
        }
    }

    // === Fields ===

    private String expandField(String template, int offset, FieldDefinition field, Scope scope) {
        var type = field.type();
        if (type instanceof ScalarType scalar) {
            var expansion = expandScalar(field, scalar);
            scope.bind(field, expansion.node());
            return expansion.text();
        }
        if (type instanceof FieldType.Nested nested) {
            var expansion = expandNested(template, offset, field, nested.token(), scope.references);
            scope.bind(field, new NestedField(field, expansion.node()));
            return expansion.text();
        }
        var expansion = expandList(template, offset, field, ((FieldType.ListOf) type).element());
        scope.bind(field, expansion.node());
        return expansion.text();
    }

    private Expansion expandScalar(FieldDefinition field, ScalarType type) {
        var pattern = field.effectivePattern()
                           .orElseThrow();
        int group = ++groups;
        groups += RegexGroups.count(pattern);
        return new Expansion("(" + RegexGroups.unname(pattern) + ")", new PlainField(field, type, group));
    }

    /**
     * The field pattern is a free template; the node of the field's token is the field value, other token
     * occurrences in the pattern go to {@code others}.
     */
    private Expansion expandNested(String template,
                                   int offset,
                                   FieldDefinition field,
                                   String tokenName,
                                   List<GroupMap> others) {
        var target = registry.lookup(tokenName);
        var nodes = new ArrayList<GroupMap>();
        var text = expandTemplate(field.effectivePattern()
                                       .orElseThrow(),
                                  null,
                                  nodes,
                                  false);
        GroupMap value = null;
        for (var node : nodes) {
            if (value == null && produces(node, target)) {
                value = node;
            } else {
                others.add(node);
            }
        }
        if (value == null) {
            throw syntaxError(template,
                              offset,
                              "Pattern of field '" + field.name() + "' does not reference token '" + tokenName + "'");
        }
        return new Expansion(text, value);
    }

    private boolean produces(GroupMap node, TokenDefinition target) {
        return node.token()
                   .map(token -> token.name()
                                      .equals(target.name()) || registry.isSubtype(token, target))
                   .orElse(false);
    }

    private Expansion expandList(String template, int offset, FieldDefinition field, FieldType element) {
        var repeat = field.repeat();
        var itemCompiler = new TemplateCompiler(registry, flags, stack);
        var item = itemCompiler.expandItem(template, offset, field, element);
        var separator = RegexGroups.unname(repeat.separator());
        var sequence = item.text() + "(?:(?:" + separator + ")" + item.text() + ")*";

        var out = new StringBuilder();
        int segmentGroup = ++groups;
        int itemsGroup;
        out.append('(');
        if (repeat.required()) {
            itemsGroup = ++groups;
            out.append('(')
               .append(sequence)
               .append(')');
        } else {
            out.append("(?:");
            if (repeat.empty()
                      .isPresent()) {
                var empty = repeat.empty()
                                  .get();
                groups += RegexGroups.count(empty);
                out.append("(?:")
                   .append(RegexGroups.unname(empty))
                   .append(")|");
            }
            itemsGroup = ++groups;
            out.append('(')
               .append(sequence)
               .append("))?");
        }
        out.append(')');
        groups += 2 * itemCompiler.groups + RegexGroups.count(separator);

        var items = new ListItems(itemScanner(item.text(), separator),
                                  separatorScanner(item.text(), separator),
                                  item.node());
        return new Expansion(out.toString(), new ListField(field, segmentGroup, itemsGroup, items));
    }

    private Expansion expandItem(String template, int offset, FieldDefinition field, FieldType element) {
        if (element instanceof ScalarType scalar) {
            return expandScalar(field, scalar);
        }
        if (element instanceof FieldType.Nested nested) {
            return expandNested(template, offset, field, nested.token(), new ArrayList<>());
        }
        throw syntaxError(template, offset, "Field '" + field.name() + "' is a list of lists");
    }

    private Pattern itemScanner(String item, String separator) {
        return Pattern.compile("(?:" + item + ")(?=" + tail(item, separator) + "|\\z)", flags);
    }

    private Pattern separatorScanner(String item, String separator) {
        return Pattern.compile("(?:" + separator + ")(?=(?:" + item + ")(?:(?:" + separator + ")(?:" + item + "))*\\z)",
                               flags);
    }

    private static String tail(String item, String separator) {
        return "(?:" + separator + ")(?:" + item + ")(?:(?:" + separator + ")(?:" + item + "))*\\z";
    }

    /**
     * Value of a constant, or {@code null} when the literal does not fit the field.
     */
    private Object constantValue(String template, TemplatePart.Assignment assignment, FieldDefinition field, Scope scope) {
        var compiler = new TemplateCompiler(registry, flags, stack);
        var scratch = new Scope(scope.owner);
        var text = compiler.expandField(template, assignment.offset(), field, scratch);
        var matcher = Pattern.compile(text, flags)
                             .matcher(assignment.value());
        if (!matcher.matches()) {
            log.debug("Constant '{}' does not match field '{}' of '{}', using null",
                      assignment.value(),
                      field.name(),
                      scope.owner.name());
            return null;
        }
        var binding = new FieldBinding(field, List.copyOf(scratch.occurrences(field)));
        try {
            return TypedReconstructor.fieldValue(scope.owner, binding, matcher);
        } catch (ReclassException e) {
            if (e.error() instanceof ReclassError.ReconstructionError) {
                log.debug("Constant '{}' of field '{}' is not convertible, using null: {}",
                          assignment.value(),
                          field.name(),
                          e.getMessage());
                return null;
            }
            throw e;
        }
    }

    private static ReclassException syntaxError(String template, int offset, String reason) {
        return new ReclassError.TemplateSyntaxError(template, offset, reason).exception();
    }

    // === Support types ===

    private record Frame(String token, boolean polymorphic) {}

    private record Expansion(String text, GroupMap node) {}

    /**
     * Fields visible while expanding a token body. An inlined supertype template sees the supertype's field
     * names but binds into the record being built.
     */
    private static final class Scope {
        private final TokenDefinition owner;
        private final TokenDefinition source;
        private final Map<String, List<GroupMap>> bound;
        private final List<GroupMap> references;

        private Scope(TokenDefinition owner) {
            this(owner, owner, new HashMap<>(), new ArrayList<>());
        }

        private Scope(TokenDefinition owner,
                      TokenDefinition source,
                      Map<String, List<GroupMap>> bound,
                      List<GroupMap> references) {
            this.owner = owner;
            this.source = source;
            this.bound = bound;
            this.references = references;
        }

        Optional<FieldDefinition> field(String name) {
            if (!source.hasField(name)) {
                return Optional.empty();
            }
            return owner.field(name)
                        .or(() -> source.field(name));
        }

        void bind(FieldDefinition field, GroupMap node) {
            bound.computeIfAbsent(field.name(), key -> new ArrayList<>())
                 .add(node);
        }

        List<GroupMap> occurrences(FieldDefinition field) {
            return bound.getOrDefault(field.name(), List.of());
        }

        Scope inline(TokenDefinition supertype) {
            return new Scope(owner, supertype, bound, references);
        }

        List<FieldBinding> bindings() {
            return owner.fields()
                        .stream()
                        .map(field -> new FieldBinding(field, List.copyOf(occurrences(field))))
                        .toList();
        }
    }
}
