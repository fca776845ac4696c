package org.pragmatica.reclass.matcher;

import org.pragmatica.reclass.compiler.FieldBinding;
import org.pragmatica.reclass.compiler.GroupMap;
import org.pragmatica.reclass.compiler.GroupMap.Constant;
import org.pragmatica.reclass.compiler.GroupMap.ListField;
import org.pragmatica.reclass.compiler.GroupMap.NestedField;
import org.pragmatica.reclass.compiler.GroupMap.PlainField;
import org.pragmatica.reclass.compiler.GroupMap.PolymorphicNode;
import org.pragmatica.reclass.compiler.GroupMap.RecordNode;
import org.pragmatica.reclass.construct.FieldValues;
import org.pragmatica.reclass.error.ReclassError;
import org.pragmatica.reclass.error.ReclassException;
import org.pragmatica.reclass.registry.FieldType;
import org.pragmatica.reclass.registry.TokenDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.regex.MatchResult;

/**
 * Turns engine groups of a match into typed instances following the Group-Map tree.
 * Works on the raw engine match, group ordinals are those of the expanded pattern.
 */
public final class TypedReconstructor {
    private static final Object NOT_MATCHED = new Object();

    private TypedReconstructor() {}

    /**
     * Rebuild a token occurrence.
     *
     * @return absent when the occurrence did not take part in the match
     * @throws ReclassException with {@code ReconstructionError} when matched text cannot be converted
     */
    public static Reconstruction<Object> reconstruct(GroupMap node, MatchResult match) {
        if (node instanceof RecordNode record) {
            return participated(match, record.group())
                   ? Reconstruction.present(build(record, match))
                   : Reconstruction.absent();
        }
        if (node instanceof PolymorphicNode polymorphic) {
            for (var alternative : polymorphic.alternatives()) {
                if (participated(match, alternative.group())) {
                    return Reconstruction.present(build(alternative, match));
                }
            }
            return Reconstruction.absent();
        }
        if (node instanceof NestedField nested) {
            return reconstruct(nested.node(), match);
        }
        throw new IllegalArgumentException("Not a token occurrence: " + node);
    }

    /**
     * Value of a field from its first participating occurrence; when none took part, the default value,
     * {@code null} for optional and list fields.
     */
    public static Object fieldValue(TokenDefinition owner, FieldBinding binding, MatchResult match) {
        for (var occurrence : binding.occurrences()) {
            var value = occurrenceValue(owner, binding, occurrence, match);
            if (value != NOT_MATCHED) {
                return value;
            }
        }
        var field = binding.field();
        if (field.defaultValue()
                 .isPresent()) {
            return field.defaultValue()
                        .get();
        }
        if (field.optional() || field.type() instanceof FieldType.ListOf) {
            return null;
        }
        throw new ReclassError.ReconstructionError(owner.name(),
                                                   field.name(),
                                                   "required field did not take part in the match")
                             .exception();
    }

    private static Object build(RecordNode record, MatchResult match) {
        var token = record.definition();
        var values = new LinkedHashMap<String, Object>();
        for (var binding : record.bindings()) {
            values.put(binding.field()
                              .name(),
                       fieldValue(token, binding, match));
        }
        var factory = token.factory()
                           .orElseThrow(() -> new ReclassError.ReconstructionError(token.name(),
                                                                                   token.name(),
                                                                                   "token has no instance factory")
                                                              .exception());
        try {
            return factory.create(FieldValues.of(token.name(), match.group(record.group()), values));
        } catch (ReclassException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ReclassException(new ReclassError.ReconstructionError(token.name(),
                                                                            token.type()
                                                                                 .getSimpleName(),
                                                                            "factory failed: " + e.getMessage()),
                                       e);
        }
    }

    private static Object occurrenceValue(TokenDefinition owner,
                                          FieldBinding binding,
                                          GroupMap occurrence,
                                          MatchResult match) {
        if (occurrence instanceof PlainField plain) {
            if (!participated(match, plain.group())) {
                return NOT_MATCHED;
            }
            return parse(owner, plain, match.group(plain.group()));
        }
        if (occurrence instanceof Constant constant) {
            return participated(match, constant.marker())
                   ? constant.value()
                   : NOT_MATCHED;
        }
        if (occurrence instanceof ListField list) {
            if (!participated(match, list.segmentGroup())) {
                return NOT_MATCHED;
            }
            if (!participated(match, list.itemsGroup())) {
                return List.of();
            }
            return items(owner, binding, list, match.group(list.itemsGroup()));
        }
        var nested = reconstruct(occurrence, match);
        return nested.isPresent()
               ? nested.orNull()
               : NOT_MATCHED;
    }

    private static Object parse(TokenDefinition owner, PlainField plain, String text) {
        try {
            return plain.type()
                        .parse(text);
        } catch (RuntimeException e) {
            throw new ReclassException(new ReclassError.ReconstructionError(owner.name(),
                                                                            plain.field()
                                                                                 .name(),
                                                                            "cannot read '" + text + "' as "
                                                                            + plain.type() + ": " + e.getMessage()),
                                       e);
        }
    }

    /**
     * Split the list text by re-scanning it item by item. Scanners only accept a split that leaves a valid
     * list tail, so the items found are the ones the full pattern matched.
     */
    private static List<Object> items(TokenDefinition owner, FieldBinding binding, ListField list, String text) {
        var itemMatcher = list.items()
                              .itemScanner()
                              .matcher(text);
        var separatorMatcher = list.items()
                                   .separatorScanner()
                                   .matcher(text);
        var itemBinding = new FieldBinding(binding.field(),
                                           List.of(list.items()
                                                       .item()));
        var result = new ArrayList<Object>();
        int pos = 0;
        while (true) {
            itemMatcher.region(pos, text.length());
            if (!itemMatcher.lookingAt()) {
                throw listError(owner, binding, text, pos);
            }
            var value = occurrenceValue(owner, itemBinding, list.items()
                                                                .item(), itemMatcher.toMatchResult());
            if (value == NOT_MATCHED) {
                throw listError(owner, binding, text, pos);
            }
            result.add(value);
            int itemEnd = itemMatcher.end();
            if (itemEnd >= text.length()) {
                return result;
            }
            separatorMatcher.region(itemEnd, text.length());
            if (!separatorMatcher.lookingAt() || separatorMatcher.end() == pos) {
                throw listError(owner, binding, text, itemEnd);
            }
            pos = separatorMatcher.end();
        }
    }

    private static ReclassException listError(TokenDefinition owner, FieldBinding binding, String text, int offset) {
        return new ReclassError.ReconstructionError(owner.name(),
                                                    binding.field()
                                                           .name(),
                                                    "cannot split list '" + text + "' at offset " + offset)
                               .exception();
    }

    private static boolean participated(MatchResult match, int group) {
        return match.start(group) >= 0;
    }
}
