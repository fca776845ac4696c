package org.pragmatica.reclass.construct;

import java.util.Collection;
import java.util.Optional;

/**
 * Matching between template field names and Java member names.
 * A field {@code order_id} binds to a component named either {@code order_id} or {@code orderId}.
 */
public final class FieldNames {
    private FieldNames() {}

    public static boolean matches(String fieldName, String memberName) {
        return fieldName.equals(memberName) || camelCase(fieldName).equals(memberName);
    }

    public static Optional<String> find(Collection<String> fieldNames, String memberName) {
        return fieldNames.stream()
                         .filter(name -> name.equals(memberName))
                         .findFirst()
                         .or(() -> fieldNames.stream()
                                             .filter(name -> matches(name, memberName))
                                             .findFirst());
    }

    static String camelCase(String name) {
        if (name.indexOf('_') < 0) {
            return name;
        }
        var sb = new StringBuilder(name.length());
        boolean upper = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_') {
                upper = sb.length() > 0;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        return sb.toString();
    }
}
