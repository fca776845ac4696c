package org.pragmatica.reclass.compiler;

import org.pragmatica.reclass.registry.FieldDefinition;
import org.pragmatica.reclass.registry.ScalarType;
import org.pragmatica.reclass.registry.TokenDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Compile-time map from capturing groups of the expanded pattern to tokens and fields.
 * Group numbers are engine group ordinals of the expanded pattern.
 */
public sealed interface GroupMap {

    /**
     * Token this node reconstructs, for record and polymorphic nodes.
     */
    default Optional<TokenDefinition> token() {
        return Optional.empty();
    }

    /**
     * Ordinal of the first capturing group of the node.
     */
    int firstGroup();

    // === Field occurrences ===

    /**
     * Scalar field captured by one group.
     */
    record PlainField(FieldDefinition field, ScalarType type, int group) implements GroupMap {
        @Override
        public int firstGroup() {
            return group;
        }
    }

    /**
     * {@code <field=value>}: consumes no input. The empty marker group tells whether the branch holding the
     * assignment took part in the match. {@code value} is {@code null} when the literal did not fit the field.
     */
    record Constant(FieldDefinition field, String literal, Object value, int marker) implements GroupMap {
        @Override
        public int firstGroup() {
            return marker;
        }
    }

    /**
     * List field. The segment group is unset when the list did not take part in the match, the items group is
     * unset when it took part but holds no items.
     */
    record ListField(FieldDefinition field, int segmentGroup, int itemsGroup, ListItems items) implements GroupMap {
        @Override
        public int firstGroup() {
            return segmentGroup;
        }
    }

    /**
     * Field holding a record or polymorphic node of another token.
     */
    record NestedField(FieldDefinition field, GroupMap node) implements GroupMap {
        @Override
        public int firstGroup() {
            return node.firstGroup();
        }
    }

    // === Token occurrences ===

    /**
     * One occurrence of a concrete token. The whole expansion is the capturing group {@code group}.
     *
     * @param bindings   per field of the token, every occurrence of the field in emission order
     * @param references token occurrences in the template that are not bound to a field
     */
    record RecordNode(TokenDefinition definition, int group, List<FieldBinding> bindings, List<GroupMap> references)
    implements GroupMap {
        @Override
        public Optional<TokenDefinition> token() {
            return Optional.of(definition);
        }

        @Override
        public int firstGroup() {
            return group;
        }
    }

    /**
     * Occurrence of a token with subtypes: alternatives most specific first, exactly one of them matches.
     */
    record PolymorphicNode(TokenDefinition definition, List<RecordNode> alternatives) implements GroupMap {
        @Override
        public Optional<TokenDefinition> token() {
            return Optional.of(definition);
        }

        @Override
        public int firstGroup() {
            return alternatives.get(0)
                               .group();
        }
    }
}
