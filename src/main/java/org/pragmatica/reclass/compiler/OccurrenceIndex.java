package org.pragmatica.reclass.compiler;

import org.pragmatica.reclass.compiler.GroupMap.NestedField;
import org.pragmatica.reclass.compiler.GroupMap.PolymorphicNode;
import org.pragmatica.reclass.compiler.GroupMap.RecordNode;
import org.pragmatica.reclass.error.ReclassError;
import org.pragmatica.reclass.registry.TokenDefinition;
import org.pragmatica.reclass.registry.TokenRegistry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Token occurrences of a compiled pattern, in order of their opening group.
 *
 * <p>A record node counts for its own type and every supertype on its token chain. A polymorphic node counts
 * once for its root type and the root's supertypes, and once for every intermediate type as a view restricted
 * to the alternatives of that type. List items are not indexed.
 */
public final class OccurrenceIndex {
    private final Map<Class<?>, List<GroupMap>> byType;
    private final Map<String, List<GroupMap>> byName;

    private OccurrenceIndex(Map<Class<?>, List<GroupMap>> byType, Map<String, List<GroupMap>> byName) {
        this.byType = byType;
        this.byName = byName;
    }

    static OccurrenceIndex build(TokenRegistry registry, List<GroupMap> roots) {
        var builder = new Builder(registry);
        sorted(roots).forEach(builder::visit);
        return new OccurrenceIndex(freeze(builder.byType), freeze(builder.byName));
    }

    public List<GroupMap> occurrences(Class<?> type) {
        return byType.getOrDefault(type, List.of());
    }

    public List<GroupMap> occurrences(String tokenName) {
        return byName.getOrDefault(tokenName, List.of());
    }

    /**
     * Occurrence by 1-based index.
     *
     * @throws org.pragmatica.reclass.error.ReclassException with {@code UnknownOccurrence}
     */
    public GroupMap occurrence(Class<?> type, int index) {
        return pick(occurrences(type), type.getSimpleName(), index);
    }

    public GroupMap occurrence(String tokenName, int index) {
        return pick(occurrences(tokenName), tokenName, index);
    }

    public Set<Class<?>> types() {
        return byType.keySet();
    }

    private static GroupMap pick(List<GroupMap> nodes, String name, int index) {
        if (index < 1 || index > nodes.size()) {
            throw new ReclassError.UnknownOccurrence(name, index, nodes.size()).exception();
        }
        return nodes.get(index - 1);
    }

    private static <K> Map<K, List<GroupMap>> freeze(Map<K, List<GroupMap>> map) {
        var result = new LinkedHashMap<K, List<GroupMap>>();
        map.forEach((key, value) -> result.put(key, List.copyOf(value)));
        return Map.copyOf(result);
    }

    private static List<GroupMap> sorted(List<GroupMap> nodes) {
        return nodes.stream()
                    .sorted(Comparator.comparingInt(GroupMap::firstGroup))
                    .toList();
    }

    private static final class Builder {
        private final TokenRegistry registry;
        private final Map<Class<?>, List<GroupMap>> byType = new LinkedHashMap<>();
        private final Map<String, List<GroupMap>> byName = new LinkedHashMap<>();

        private Builder(TokenRegistry registry) {
            this.registry = registry;
        }

        void visit(GroupMap node) {
            if (node instanceof RecordNode record) {
                var site = new Site();
                site.add(record.definition(), record);
                registry.supertypes(record.definition())
                        .forEach(supertype -> site.add(supertype, record));
                visitChildren(record);
            } else if (node instanceof PolymorphicNode polymorphic) {
                visitPolymorphic(polymorphic);
            } else if (node instanceof NestedField nested) {
                visit(nested.node());
            }
        }

        private void visitPolymorphic(PolymorphicNode node) {
            var site = new Site();
            var root = node.definition();
            site.add(root, node);
            registry.supertypes(root)
                    .forEach(supertype -> site.add(supertype, node));
            for (var alternative : node.alternatives()) {
                var chain = new ArrayList<TokenDefinition>();
                chain.add(alternative.definition());
                chain.addAll(registry.supertypes(alternative.definition()));
                for (var type : chain) {
                    if (type.name()
                            .equals(root.name())) {
                        break;
                    }
                    if (!site.has(type)) {
                        site.add(type, view(node, type));
                    }
                }
            }
            node.alternatives()
                .forEach(this::visitChildren);
        }

        private GroupMap view(PolymorphicNode node, TokenDefinition type) {
            var alternatives = node.alternatives()
                                   .stream()
                                   .filter(alternative -> alternative.definition()
                                                                     .name()
                                                                     .equals(type.name())
                                                          || registry.isSubtype(alternative.definition(), type))
                                   .toList();
            return alternatives.size() == 1
                   ? alternatives.get(0)
                   : new PolymorphicNode(type, alternatives);
        }

        private void visitChildren(RecordNode record) {
            var children = new ArrayList<GroupMap>(record.references());
            for (var binding : record.bindings()) {
                for (var occurrence : binding.occurrences()) {
                    if (occurrence instanceof NestedField) {
                        children.add(occurrence);
                    }
                }
            }
            sorted(children).forEach(this::visit);
        }

        /**
         * Keys already registered for one node, so a type appearing twice on a chain counts once.
         */
        private final class Site {
            private final Set<Class<?>> types = new HashSet<>();
            private final Set<String> names = new HashSet<>();

            boolean has(TokenDefinition token) {
                return names.contains(token.name());
            }

            void add(TokenDefinition token, GroupMap node) {
                if (types.add(token.type())) {
                    byType.computeIfAbsent(token.type(), key -> new ArrayList<>())
                          .add(node);
                }
                if (names.add(token.name())) {
                    byName.computeIfAbsent(token.name(), key -> new ArrayList<>())
                          .add(node);
                }
            }
        }
    }
}
