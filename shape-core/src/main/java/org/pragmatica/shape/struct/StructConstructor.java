package org.pragmatica.shape.struct;

import org.pragmatica.shape.kv.FieldResolver;
import org.pragmatica.shape.kv.Key;
import org.pragmatica.shape.kv.KvInput;
import org.pragmatica.shape.lang.Result;
import org.pragmatica.shape.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.pragmatica.shape.error.DomainError.details;
import static org.pragmatica.shape.error.DomainError.domainError;
import static org.pragmatica.shape.error.Reason.INPUT;
import static org.pragmatica.shape.error.Reason.INVALID_PARAMETER;
import static org.pragmatica.shape.error.Reason.KEY;
import static org.pragmatica.shape.error.Reason.NOT_A_LIST;
import static org.pragmatica.shape.error.Reason.VALUE;

/**
 * Construction and update of structured values from keyed input.
 *
 * <p>{@link #constructor(List, StructType)} resolves all declared fields and builds a new instance.
 * {@link #update(List, StructType, Object)} parses a partial set of fields once and applies it to any
 * number of existing instances.
 */
public final class StructConstructor {
    private static final Logger log = LoggerFactory.getLogger(StructConstructor.class);

    private StructConstructor() {}

    /**
     * Compile field declarations into a parser producing instances of {@code type}.
     */
    public static <T> Result<Parser<T>> constructor(List<?> specs, StructType<T> type) {
        return FieldResolver.compile(specs)
                            .map(resolver -> resolver.flatMap(type::construct));
    }

    /**
     * One-shot form of {@link #constructor(List, StructType)}.
     */
    public static <T> Result<T> build(List<?> specs, StructType<T> type, Object input) {
        return constructor(specs, type).flatMap(parser -> parser.parse(input));
    }

    /**
     * Parse partial parameters into an update of {@code type} instances.
     *
     * <p>Every parameter is matched against each declared field on its own. A parameter no field accepts
     * fails with {@code invalid_parameter}; when several fields accept it, the first declared one wins.
     * Missing fields keep their current values, defaults are not applied.
     */
    public static <T> Result<StructUpdate<T>> update(List<?> specs, StructType<T> type, Object params) {
        if (specs == null) {
            return domainError(NOT_A_LIST, details(INPUT, null)).result();
        }
        return Result.allOf(specs.stream()
                                 .map(FieldResolver::compileOne)
                                 .toList())
                     .flatMap(resolvers -> KvInput.normalize(params)
                                                  .flatMap(pairs -> changes(resolvers, pairs)))
                     .map(changes -> StructUpdate.structUpdate(type, changes));
    }

    private static Result<Map<Key, Object>> changes(List<FieldResolver> resolvers, Map<?, ?> pairs) {
        return Result.foldLeft(pairs.entrySet(),
                               Map.<Key, Object>of(),
                               (changes, entry) -> match(resolvers, entry.getKey(), entry.getValue())
                                   .map(contribution -> merge(changes, contribution)));
    }

    private static Result<Map<Key, Object>> match(List<FieldResolver> resolvers, Object key, Object value) {
        var parameter = Collections.singletonMap(key, value);
        var matches = resolvers.stream()
                               .map(resolver -> resolver.parse(parameter))
                               .filter(Result::isSuccess)
                               .map(Result::unwrap)
                               .toList();

        if (matches.isEmpty()) {
            return domainError(INVALID_PARAMETER, details(KEY, key, VALUE, value)).result();
        }
        if (matches.size() > 1) {
            log.debug("Parameter {} is accepted by {} fields, using {}", key, matches.size(), matches.get(0).keySet());
        }
        return Result.success(matches.get(0));
    }

    private static Map<Key, Object> merge(Map<Key, Object> changes, Map<Key, Object> contribution) {
        var merged = new LinkedHashMap<Key, Object>(changes);
        merged.putAll(contribution);
        return Collections.unmodifiableMap(merged);
    }
}
