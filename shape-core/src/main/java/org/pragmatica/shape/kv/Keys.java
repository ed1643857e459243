package org.pragmatica.shape.kv;

import org.pragmatica.shape.lang.Result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import static org.pragmatica.shape.error.DomainError.details;
import static org.pragmatica.shape.error.DomainError.domainError;
import static org.pragmatica.shape.error.Reason.KEY;
import static org.pragmatica.shape.error.Reason.NOT_A_STRING_KEY;
import static org.pragmatica.shape.error.Reason.UNKNOWN_KEY;

/**
 * Conversion of textually keyed maps, as produced by decoders, into {@link Key}-keyed maps.
 */
public final class Keys {
    private Keys() {}

    /**
     * Rewrite every {@link String} key as a {@link Key}. Any name is accepted.
     */
    public static Result<Map<Key, Object>> symbolize(Map<?, ?> input) {
        return symbolize(input, key -> true);
    }

    /**
     * Rewrite every {@link String} key as a {@link Key}, accepting only names among {@code knownKeys}.
     * The first other name fails with {@code unknown_key}.
     */
    public static Result<Map<Key, Object>> symbolize(Map<?, ?> input, Set<Key> knownKeys) {
        return symbolize(input, knownKeys::contains);
    }

    private static Result<Map<Key, Object>> symbolize(Map<?, ?> input, Predicate<Key> known) {
        var symbolized = new LinkedHashMap<Key, Object>();

        for (var entry : input.entrySet()) {
            if (!(entry.getKey() instanceof String name)) {
                return domainError(NOT_A_STRING_KEY, details(KEY, entry.getKey())).result();
            }

            var key = Key.key(name);

            if (!known.test(key)) {
                return domainError(UNKNOWN_KEY, details(KEY, name)).result();
            }
            symbolized.put(key, entry.getValue());
        }
        return Result.success(Collections.unmodifiableMap(symbolized));
    }
}
