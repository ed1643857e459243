package org.pragmatica.shape.kv;

import org.pragmatica.shape.lang.Option;

import java.util.Map;

/**
 * Two-step lookup of a source key in a keyed input: the key as given first, then, for a {@link Key},
 * its textual name. Presence is decided by {@link Map#containsKey(Object)}, so a present {@code null}
 * value is found as {@code some(null)}.
 */
public final class KeyLookup {
    private KeyLookup() {}

    public static Option<Object> lookup(Map<?, ?> input, Object source) {
        if (contains(input, source)) {
            return Option.some(input.get(source));
        }
        if (source instanceof Key key && contains(input, key.name())) {
            return Option.some(input.get(key.name()));
        }
        return Option.none();
    }

    // Sorted and null-hostile maps reject keys they cannot hold instead of answering false.
    private static boolean contains(Map<?, ?> input, Object key) {
        try {
            return input.containsKey(key);
        } catch (ClassCastException | NullPointerException e) {
            return false;
        }
    }
}
