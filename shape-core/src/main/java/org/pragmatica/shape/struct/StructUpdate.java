package org.pragmatica.shape.struct;

import org.pragmatica.shape.kv.Key;
import org.pragmatica.shape.lang.Result;

import java.util.Map;

import static org.pragmatica.shape.error.DomainError.details;
import static org.pragmatica.shape.error.DomainError.domainError;
import static org.pragmatica.shape.error.Reason.EXPECTING;
import static org.pragmatica.shape.error.Reason.GOT;
import static org.pragmatica.shape.error.Reason.STRUCT_TYPE_MISMATCH;

/**
 * Validated set of changes to instances of one struct type.
 *
 * @param type    type of the instances to update
 * @param changes parsed field values to overlay, keyed by field name
 * @param <T>     updated type
 */
public record StructUpdate<T>(StructType<T> type, Map<Key, Object> changes) {
    static <T> StructUpdate<T> structUpdate(StructType<T> type, Map<Key, Object> changes) {
        return new StructUpdate<>(type, changes);
    }

    /**
     * Apply the changes to {@code instance}. The instance itself is left intact.
     *
     * @return updated copy, or {@code struct_type_mismatch} when {@code instance} is not exactly of the
     *         expected type
     */
    public Result<T> apply(Object instance) {
        if (!type.matches(instance)) {
            return domainError(STRUCT_TYPE_MISMATCH, details(EXPECTING, type.type(), GOT, instance)).result();
        }
        return type.update(type.type().cast(instance), changes);
    }
}
