package com.gtree.engine.eval;

import java.util.Map;
import java.util.Optional;

/** Ambient environment that symbol tables resolve grammar symbols against. */
@FunctionalInterface
public interface Namespace {

    /** Value or {@link Operation} bound to {@code name}, if any. */
    Optional<Object> resolve(String name);

    static Namespace of(Map<String, ?> entries) {
        Map<String, Object> copy = Map.copyOf(entries);
        return name -> Optional.ofNullable(copy.get(name));
    }

    /** Looks names up here first and in {@code fallback} when missing. */
    default Namespace orElse(Namespace fallback) {
        return name -> {
            Optional<Object> found = resolve(name);
            return found.isPresent() ? found : fallback.resolve(name);
        };
    }
}
