package org.pragmatica.reclass.matcher;

import org.pragmatica.reclass.compiler.CompiledTemplate;
import org.pragmatica.reclass.compiler.GroupMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.MatchResult;

/**
 * Result of a successful match.
 *
 * <p>Group accessors follow the numbering of the groups written in the template, as if the placeholders
 * were not there. Typed access goes through {@link #get(Class)} and friends.
 */
public final class TemplateMatch implements MatchResult {
    private final CompiledMatcher matcher;
    private final MatchResult result;
    private final String text;

    TemplateMatch(CompiledMatcher matcher, MatchResult result, CharSequence text) {
        this.matcher = matcher;
        this.result = result;
        this.text = text.toString();
    }

    // === Typed access ===

    /**
     * First occurrence of the type.
     *
     * @return the instance, or {@code null} when the occurrence did not take part in the match
     */
    public <T> T get(Class<T> type) {
        return get(type, 1);
    }

    /**
     * Occurrence of the type by its 1-based position in the template.
     *
     * @throws org.pragmatica.reclass.error.ReclassException with {@code UnknownOccurrence} if the type does not
     *                                                       occur that many times
     */
    public <T> T get(Class<T> type, int index) {
        return reconstruct(type, index).orNull();
    }

    public Object get(String tokenName, int index) {
        return reconstruct(tokenName, index).orNull();
    }

    public <T> Reconstruction<T> reconstruct(Class<T> type, int index) {
        var node = compiled().index()
                             .occurrence(type, index);
        return TypedReconstructor.reconstruct(node, result)
                                 .map(type::cast);
    }

    public Reconstruction<Object> reconstruct(String tokenName, int index) {
        var node = compiled().index()
                             .occurrence(tokenName, index);
        return TypedReconstructor.reconstruct(node, result);
    }

    /**
     * Top level tokens and template groups in template order: the built instance for a token, the group text
     * for a group, {@code null} for either when it did not take part. A template with neither yields the
     * matched text alone.
     */
    public List<Object> values() {
        var roots = compiled().roots();
        var groups = compiled().userGroups();
        if (roots.isEmpty() && groups.isEmpty()) {
            return List.of(group());
        }
        var values = new ArrayList<Object>(roots.size() + groups.size());
        int root = 0;
        int group = 0;
        while (root < roots.size() || group < groups.size()) {
            if (group == groups.size() || (root < roots.size() && roots.get(root)
                                                                       .firstGroup() < groups.get(group))) {
                values.add(reconstruct(roots.get(root++ )).orNull());
            } else {
                values.add(result.group(groups.get(group++ )));
            }
        }
        return Collections.unmodifiableList(values);
    }

    Reconstruction<Object> reconstruct(GroupMap node) {
        return TypedReconstructor.reconstruct(node, result);
    }

    // === User groups ===

    @Override
    public int start() {
        return result.start();
    }

    @Override
    public int start(int group) {
        return result.start(engineGroup(group));
    }

    public int start(String name) {
        return result.start(engineGroup(name));
    }

    @Override
    public int end() {
        return result.end();
    }

    @Override
    public int end(int group) {
        return result.end(engineGroup(group));
    }

    public int end(String name) {
        return result.end(engineGroup(name));
    }

    @Override
    public String group() {
        return result.group();
    }

    @Override
    public String group(int group) {
        return result.group(engineGroup(group));
    }

    public String group(String name) {
        return result.group(engineGroup(name));
    }

    /**
     * Number of groups written in the template.
     */
    @Override
    public int groupCount() {
        return compiled().userGroups()
                         .size();
    }

    /**
     * Text the match was found in.
     */
    public String string() {
        return text;
    }

    public CompiledMatcher matcher() {
        return matcher;
    }

    private CompiledTemplate compiled() {
        return matcher.compiled();
    }

    private int engineGroup(int group) {
        if (group == 0) {
            return 0;
        }
        var userGroups = compiled().userGroups();
        if (group < 0 || group > userGroups.size()) {
            throw new IndexOutOfBoundsException("No group " + group);
        }
        return userGroups.get(group - 1);
    }

    private int engineGroup(String name) {
        var group = compiled().userNamedGroups()
                              .get(name);
        if (group == null) {
            throw new IllegalArgumentException("No group with name <" + name + ">");
        }
        return group;
    }

    @Override
    public String toString() {
        return "TemplateMatch{template='" + matcher.template() + "', match='" + group() + "', range=[" + start() + ", "
               + end() + ")}";
    }
}
