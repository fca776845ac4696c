package org.pragmatica.reclass.matcher;

/**
 * Compilation options.
 *
 * @param flags        {@link java.util.regex.Pattern} flags of the expanded pattern
 * @param cacheEnabled reuse compiled matchers through the registry's pattern cache
 */
public record MatcherConfig(
 int flags,
 boolean cacheEnabled) {
    public static final MatcherConfig DEFAULT = new MatcherConfig(0, true);

    public MatcherConfig withFlags(int flags) {
        return new MatcherConfig(flags, cacheEnabled);
    }

    public MatcherConfig withCache(boolean enabled) {
        return new MatcherConfig(flags, enabled);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int flags;
        private boolean cacheEnabled = true;

        private Builder() {}

        /**
         * Add a flag to the ones already set.
         */
        public Builder flag(int flag) {
            this.flags |= flag;
            return this;
        }

        public Builder flags(int flags) {
            this.flags = flags;
            return this;
        }

        public Builder cache(boolean enabled) {
            this.cacheEnabled = enabled;
            return this;
        }

        public MatcherConfig build() {
            return new MatcherConfig(flags, cacheEnabled);
        }
    }
}
