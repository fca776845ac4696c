package org.pragmatica.reclass.matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Compiled matchers of one registry keyed by template and flags.
 * Failed compilations are not cached.
 */
public final class PatternCache {
    private static final Logger log = LoggerFactory.getLogger(PatternCache.class);

    private final ConcurrentMap<Key, CompiledMatcher> matchers = new ConcurrentHashMap<>();

    public CompiledMatcher get(String template, int flags, Supplier<CompiledMatcher> compiler) {
        var key = new Key(template, flags);
        var cached = matchers.get(key);
        if (cached != null) {
            log.trace("Pattern cache hit for '{}' (flags {})", template, flags);
            return cached;
        }
        return matchers.computeIfAbsent(key, unused -> compiler.get());
    }

    public void clear() {
        if (!matchers.isEmpty()) {
            log.debug("Clearing {} cached patterns", matchers.size());
        }
        matchers.clear();
    }

    public int size() {
        return matchers.size();
    }

    private record Key(String template, int flags) {}
}
