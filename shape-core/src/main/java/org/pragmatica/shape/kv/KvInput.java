package org.pragmatica.shape.kv;

import org.pragmatica.shape.lang.Result;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.pragmatica.shape.error.DomainError.details;
import static org.pragmatica.shape.error.DomainError.domainError;
import static org.pragmatica.shape.error.Reason.INPUT;
import static org.pragmatica.shape.error.Reason.INVALID_INPUT;

/**
 * Accepted shapes of keyed input: a {@link Map}, or a {@link List} made entirely of {@link Map.Entry}
 * elements. In the latter case a later entry replaces an earlier one with the same key.
 */
public final class KvInput {
    private KvInput() {}

    public static Result<Map<?, ?>> normalize(Object input) {
        if (input instanceof Map<?, ?> map) {
            return Result.success(map);
        }
        if (input instanceof List<?> list && list.stream().allMatch(Map.Entry.class::isInstance)) {
            var entries = new LinkedHashMap<Object, Object>();
            for (var element : list) {
                var entry = (Map.Entry<?, ?>) element;
                entries.put(entry.getKey(), entry.getValue());
            }
            return Result.success(entries);
        }
        return domainError(INVALID_INPUT, details(INPUT, input)).result();
    }
}
