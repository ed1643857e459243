package org.pragmatica.shape.parser;

import org.pragmatica.shape.error.DomainError;
import org.pragmatica.shape.lang.Cause;
import org.pragmatica.shape.lang.Option;
import org.pragmatica.shape.lang.Result;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

import static org.pragmatica.shape.error.DomainError.details;
import static org.pragmatica.shape.error.DomainError.domainError;
import static org.pragmatica.shape.error.Reason.ELEMENTS;
import static org.pragmatica.shape.error.Reason.EMPTY_LIST;
import static org.pragmatica.shape.error.Reason.FAILED_ELEMENT;
import static org.pragmatica.shape.error.Reason.FAILED_KEY;
import static org.pragmatica.shape.error.Reason.FAILED_VALUE;
import static org.pragmatica.shape.error.Reason.INPUT;
import static org.pragmatica.shape.error.Reason.NOT_AN_OPTION;
import static org.pragmatica.shape.error.Reason.NOT_A_LIST;
import static org.pragmatica.shape.error.Reason.NOT_A_MAP;
import static org.pragmatica.shape.error.Reason.NOT_A_SET;
import static org.pragmatica.shape.error.Reason.NO_PARSER_APPLIES;
import static org.pragmatica.shape.error.Reason.PARSERS;
import static org.pragmatica.shape.error.Reason.PREDICATE;
import static org.pragmatica.shape.error.Reason.PREDICATE_NOT_SATISFIED;

/**
 * Generic parser combinators.
 *
 * <p>Every combinator fails fast: the first failure stops the remaining work and is returned either
 * as-is or with one extra detail describing where it happened.
 */
public final class Parsers {
    private Parsers() {}

    /**
     * Accept the input when {@code predicate} holds. Otherwise fail with
     * {@code predicate_not_satisfied}, carrying the predicate and the input.
     */
    public static Parser<Object> predicate(Predicate<Object> predicate) {
        return predicate(predicate, input -> domainError(PREDICATE_NOT_SATISFIED, details(PREDICATE, predicate, INPUT, input)));
    }

    /**
     * Accept the input when {@code predicate} holds, otherwise fail with {@code error}.
     */
    public static Parser<Object> predicate(Predicate<Object> predicate, Cause error) {
        return predicate(predicate, input -> error);
    }

    /**
     * Accept the input when {@code predicate} holds, otherwise fail with the cause computed from the input.
     */
    public static Parser<Object> predicate(Predicate<Object> predicate, Function<Object, ? extends Cause> error) {
        return input -> predicate.test(input)
                        ? Result.success(input)
                        : Result.failure(error.apply(input));
    }

    /**
     * Accept inputs equal to one of {@code elements}.
     */
    public static Parser<Object> oneOf(Collection<?> elements) {
        var allowed = Collections.unmodifiableList(new ArrayList<Object>(elements));
        return oneOf(allowed, input -> domainError(PREDICATE_NOT_SATISFIED, details(ELEMENTS, allowed, INPUT, input)));
    }

    public static Parser<Object> oneOf(Collection<?> elements, Cause error) {
        return oneOf(elements, input -> error);
    }

    public static Parser<Object> oneOf(Collection<?> elements, Function<Object, ? extends Cause> error) {
        var allowed = new ArrayList<Object>(elements);
        return predicate(input -> allowed.stream()
                                         .anyMatch(element -> Objects.equals(element, input)),
                         error);
    }

    /**
     * Accept exactly {@code value}, which may be {@code null}.
     */
    public static Parser<Object> equalTo(Object value) {
        return predicate(input -> Objects.equals(value, input),
                         input -> domainError(PREDICATE_NOT_SATISFIED, details(ELEMENTS, Collections.singletonList(value), INPUT, input)));
    }

    /**
     * Parse every element of a {@link List}. Failure details get the offending element under
     * {@code failed_element}.
     */
    public static <T> Parser<List<T>> list(Parser<T> parser) {
        return input -> {
            if (!(input instanceof List<?> elements)) {
                return notA(NOT_A_LIST, input);
            }
            return parseElements(elements, parser, new ArrayList<>(elements.size()))
                .map(Collections::unmodifiableList);
        };
    }

    /**
     * Same as {@link #list(Parser)}, but rejects an empty list with {@code empty_list}.
     */
    public static <T> Parser<List<T>> nonEmptyList(Parser<T> parser) {
        var elements = list(parser);
        return input -> input instanceof List<?> list && list.isEmpty()
                        ? domainError(EMPTY_LIST).result()
                        : elements.parse(input);
    }

    /**
     * Parse every element of a {@link Set}. Output keeps the iteration order of the input.
     */
    public static <T> Parser<Set<T>> set(Parser<T> parser) {
        return input -> {
            if (!(input instanceof Set<?> elements)) {
                return notA(NOT_A_SET, input);
            }
            return parseElements(elements, parser, new LinkedHashSet<>())
                .map(Collections::unmodifiableSet);
        };
    }

    /**
     * Parse the keys and values of a {@link Map} in two separate passes: all keys first, then all values.
     * A key failure is therefore reported before any value failure.
     */
    public static <K, V> Parser<Map<K, V>> map(Parser<K> keyParser, Parser<V> valueParser) {
        return input -> {
            if (!(input instanceof Map<?, ?> entries)) {
                return notA(NOT_A_MAP, input);
            }
            return parseKeys(entries, keyParser)
                .flatMap(rekeyed -> parseValues(rekeyed, valueParser));
        };
    }

    /**
     * Lift {@code parser} into {@link Option}: {@code some(x)} is parsed into {@code some(parsed)},
     * {@code none()} passes through without invoking {@code parser}. Errors are returned unchanged.
     */
    public static <T> Parser<Option<T>> maybe(Parser<T> parser) {
        return input -> {
            if (!(input instanceof Option<?> option)) {
                return notA(NOT_AN_OPTION, input);
            }
            return option.fold(() -> Result.success(Option.<T>none()),
                               value -> parser.parse(value)
                                              .map(Option::some));
        };
    }

    /**
     * Try each parser in order and return the first success. Fails with {@code no_parser_applies}
     * carrying the input and all parsers tried.
     */
    @SafeVarargs
    public static <T> Parser<T> union(Parser<? extends T>... parsers) {
        return union(List.of(parsers));
    }

    public static <T> Parser<T> union(List<? extends Parser<? extends T>> parsers) {
        List<Parser<? extends T>> alternatives = List.copyOf(parsers);
        return input -> {
            for (var parser : alternatives) {
                var result = parser.parse(input);
                if (result.isSuccess()) {
                    return Result.success(result.unwrap());
                }
            }
            return domainError(NO_PARSER_APPLIES, details(INPUT, input, PARSERS, alternatives)).result();
        };
    }

    private static <T, C extends Collection<T>> Result<C> parseElements(Collection<?> elements, Parser<T> parser, C output) {
        for (var element : elements) {
            var result = parser.parse(element);
            if (result instanceof Result.Failure<T> failure) {
                return DomainError.enrich(failure.cause(), FAILED_ELEMENT, element)
                                  .result();
            }
            output.add(result.unwrap());
        }
        return Result.success(output);
    }

    private static <K> Result<Map<K, Object>> parseKeys(Map<?, ?> entries, Parser<K> keyParser) {
        var rekeyed = new LinkedHashMap<K, Object>();
        for (var entry : entries.entrySet()) {
            var result = keyParser.parse(entry.getKey());
            if (result instanceof Result.Failure<K> failure) {
                return DomainError.enrich(failure.cause(), FAILED_KEY, entry.getKey())
                                  .result();
            }
            rekeyed.put(result.unwrap(), entry.getValue());
        }
        return Result.success(rekeyed);
    }

    private static <K, V> Result<Map<K, V>> parseValues(Map<K, Object> rekeyed, Parser<V> valueParser) {
        var parsed = new LinkedHashMap<K, V>();
        for (var entry : rekeyed.entrySet()) {
            var result = valueParser.parse(entry.getValue());
            if (result instanceof Result.Failure<V> failure) {
                return DomainError.enrich(failure.cause(), FAILED_VALUE, entry.getValue())
                                  .result();
            }
            parsed.put(entry.getKey(), result.unwrap());
        }
        return Result.success(Collections.unmodifiableMap(parsed));
    }

    private static <T> Result<T> notA(String reason, Object input) {
        return domainError(reason, details(INPUT, input)).result();
    }
}
