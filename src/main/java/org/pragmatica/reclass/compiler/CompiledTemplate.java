package org.pragmatica.reclass.compiler;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Output of {@link TemplateCompiler}.
 *
 * @param template        source template
 * @param pattern         compiled expanded pattern
 * @param roots           token occurrences at the top level of the template, in emission order
 * @param index           occurrences by Java type and token name
 * @param userGroups      engine group ordinal of each user-written group, in template order
 * @param userNamedGroups engine group ordinal of each user-written named group
 */
public record CompiledTemplate(
 String template,
 Pattern pattern,
 List<GroupMap> roots,
 OccurrenceIndex index,
 List<Integer> userGroups,
 Map<String, Integer> userNamedGroups) {

    public String expanded() {
        return pattern.pattern();
    }

    public int flags() {
        return pattern.flags();
    }
}
