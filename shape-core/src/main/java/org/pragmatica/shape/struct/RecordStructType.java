package org.pragmatica.shape.struct;

import org.pragmatica.shape.error.DomainError;
import org.pragmatica.shape.kv.Key;
import org.pragmatica.shape.lang.Cause;
import org.pragmatica.shape.lang.Causes;
import org.pragmatica.shape.lang.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.pragmatica.shape.error.DomainError.details;
import static org.pragmatica.shape.error.DomainError.domainError;
import static org.pragmatica.shape.error.Reason.FIELD;
import static org.pragmatica.shape.error.Reason.STRUCT_CONSTRUCTION_FAILED;
import static org.pragmatica.shape.error.Reason.TYPE;

/**
 * {@link StructType} of a Java record. Field names are the record component names; instances are built
 * through the canonical constructor, so compact-constructor checks still apply.
 */
final class RecordStructType<R extends Record> implements StructType<R> {
    private static final Logger log = LoggerFactory.getLogger(RecordStructType.class);
    private static final Map<Class<?>, RecordStructType<?>> REGISTRY = new ConcurrentHashMap<>();

    private final Class<R> type;
    private final RecordComponent[] components;
    private final Method[] accessors;
    private final Constructor<R> constructor;

    private RecordStructType(Class<R> type) {
        this.type = type;
        this.components = type.getRecordComponents();
        this.accessors = Arrays.stream(components)
                               .map(RecordComponent::getAccessor)
                               .toArray(Method[]::new);
        this.constructor = canonicalConstructor(type, components);

        constructor.setAccessible(true);
        for (var accessor : accessors) {
            accessor.setAccessible(true);
        }
    }

    @SuppressWarnings("unchecked")
    static <R extends Record> RecordStructType<R> recordStructType(Class<R> type) {
        return (RecordStructType<R>) REGISTRY.computeIfAbsent(type, RecordStructType::register);
    }

    private static RecordStructType<?> register(Class<?> type) {
        var structType = new RecordStructType<>(type.asSubclass(Record.class));
        log.debug("Registered record struct type {} with components {}", type.getName(), structType.names());
        return structType;
    }

    private static <R> Constructor<R> canonicalConstructor(Class<R> type, RecordComponent[] components) {
        var parameterTypes = Arrays.stream(components)
                                   .map(RecordComponent::getType)
                                   .toArray(Class<?>[]::new);
        try {
            return type.getDeclaredConstructor(parameterTypes);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("Record " + type.getName() + " has no canonical constructor", e);
        }
    }

    @Override
    public Class<R> type() {
        return type;
    }

    @Override
    public Result<R> construct(Map<Key, Object> fields) {
        var arguments = new Object[components.length];

        for (int i = 0; i < components.length; i++) {
            var key = Key.key(components[i].getName());

            if (fields.containsKey(key)) {
                arguments[i] = fields.get(key);
            } else if (components[i].getType().isPrimitive()) {
                return domainError(STRUCT_CONSTRUCTION_FAILED, details(TYPE, type, FIELD, key)).result();
            }
        }
        return Result.lift(this::constructionFailed, () -> constructor.newInstance(arguments));
    }

    @Override
    public Result<Map<Key, Object>> fields(R instance) {
        return Result.lift(this::constructionFailed, () -> readComponents(instance));
    }

    private Map<Key, Object> readComponents(R instance) throws ReflectiveOperationException {
        var values = new LinkedHashMap<Key, Object>();

        for (int i = 0; i < components.length; i++) {
            values.put(Key.key(components[i].getName()), accessors[i].invoke(instance));
        }
        return Collections.unmodifiableMap(values);
    }

    private Cause constructionFailed(Throwable throwable) {
        var cause = throwable instanceof InvocationTargetException invocation && invocation.getCause() != null
                    ? invocation.getCause()
                    : throwable;
        return DomainError.wrap(Causes.fromThrowable(cause), domainError(STRUCT_CONSTRUCTION_FAILED, details(TYPE, type)));
    }

    private String names() {
        return Arrays.stream(components)
                     .map(RecordComponent::getName)
                     .toList()
                     .toString();
    }

    @Override
    public String toString() {
        return "RecordStructType(" + type.getName() + ")";
    }
}
