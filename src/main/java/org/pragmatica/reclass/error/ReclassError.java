package org.pragmatica.reclass.error;

import java.util.List;

/**
 * Registration, compilation and reconstruction failures.
 */
public sealed interface ReclassError {
    String message();

    /**
     * Convert this error into an unchecked exception ready to be thrown.
     */
    default ReclassException exception() {
        return new ReclassException(this);
    }

    // === Registration ===

    /**
     * Token name already taken in the registry.
     */
    record DuplicateToken(String name) implements ReclassError {
        @Override
        public String message() {
            return "Token '" + name + "' is already registered";
        }
    }

    /**
     * Field type has no default pattern and none was given.
     */
    record MissingFieldPattern(String token, String field, String reason) implements ReclassError {
        @Override
        public String message() {
            return "Field '" + field + "' of token '" + token + "' has no pattern: " + reason;
        }
    }

    /**
     * Declared supertype is not registered in the same registry or is not a supertype.
     */
    record InvalidSubtypeLink(String token, String supertype, String reason) implements ReclassError {
        @Override
        public String message() {
            return "Token '" + token + "' cannot extend '" + supertype + "': " + reason;
        }
    }

    /**
     * Token spec that cannot be turned into a token: overrides of fields the token does not have,
     * a missing template or a missing factory.
     */
    record InvalidTokenSpec(String token, String reason) implements ReclassError {
        @Override
        public String message() {
            return "Invalid token '" + token + "': " + reason;
        }
    }

    /**
     * Lookup of a name the registry does not know.
     */
    record UnknownToken(String name) implements ReclassError {
        @Override
        public String message() {
            return "Unknown token '" + name + "'";
        }
    }

    // === Compilation ===

    /**
     * Malformed placeholder or template.
     */
    record TemplateSyntaxError(String template, int offset, String reason) implements ReclassError {
        @Override
        public String message() {
            return reason + " at offset " + offset + " in template '" + template + "'";
        }
    }

    /**
     * Token expansion that never terminates.
     */
    record CompileCycleError(List<String> path) implements ReclassError {
        @Override
        public String message() {
            return "Recursive token expansion: " + String.join(" -> ", path);
        }
    }

    // === Reconstruction ===

    /**
     * Matched text could not be turned into a typed value.
     */
    record ReconstructionError(String token, String field, String reason) implements ReclassError {
        @Override
        public String message() {
            return "Cannot reconstruct field '" + field + "' of '" + token + "': " + reason;
        }
    }

    /**
     * Requested occurrence does not exist in the compiled pattern.
     */
    record UnknownOccurrence(String type, int index, int available) implements ReclassError {
        @Override
        public String message() {
            return available == 0
                   ? "Type '" + type + "' does not occur in the pattern"
                   : "Occurrence " + index + " of '" + type + "' requested, pattern has " + available;
        }
    }
}
