package org.pragmatica.shape.struct;

import org.pragmatica.shape.kv.Key;
import org.pragmatica.shape.lang.Result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Descriptor of a structured type: how to build an instance from named fields and how to take an
 * instance apart into the same fields.
 *
 * @param <T> described type
 */
public interface StructType<T> {
    Class<T> type();

    /**
     * Build an instance from field values keyed by field name.
     */
    Result<T> construct(Map<Key, Object> fields);

    /**
     * Current field values of {@code instance}, keyed by field name.
     */
    Result<Map<Key, Object>> fields(T instance);

    /**
     * Whether {@code instance} is exactly of the described type. Subclasses do not match.
     */
    default boolean matches(Object instance) {
        return instance != null && instance.getClass() == type();
    }

    /**
     * New instance with the fields of {@code instance} overlaid with {@code changes}.
     */
    default Result<T> update(T instance, Map<Key, ?> changes) {
        return fields(instance).flatMap(current -> {
            var merged = new LinkedHashMap<Key, Object>(current);
            merged.putAll(changes);
            return construct(Collections.unmodifiableMap(merged));
        });
    }

    /**
     * Reflection-based descriptor of a record class. Descriptors are cached per class.
     */
    static <R extends Record> StructType<R> structType(Class<R> type) {
        return RecordStructType.recordStructType(type);
    }

    /**
     * Descriptor for an arbitrary class, backed by the given construction and deconstruction functions.
     */
    static <T> StructType<T> structType(Class<T> type,
                                        Function<Map<Key, Object>, Result<T>> constructor,
                                        Function<T, Map<Key, Object>> deconstructor) {
        record structType<S>(Class<S> type,
                             Function<Map<Key, Object>, Result<S>> constructor,
                             Function<S, Map<Key, Object>> deconstructor) implements StructType<S> {
            @Override
            public Result<S> construct(Map<Key, Object> fields) {
                return constructor.apply(fields);
            }

            @Override
            public Result<Map<Key, Object>> fields(S instance) {
                return Result.success(deconstructor.apply(instance));
            }

            @Override
            public String toString() {
                return "StructType(" + type.getName() + ")";
            }
        }
        return new structType<>(type, constructor, deconstructor);
    }
}
