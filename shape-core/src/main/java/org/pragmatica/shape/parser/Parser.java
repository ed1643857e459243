package org.pragmatica.shape.parser;

import org.pragmatica.shape.lang.Cause;
import org.pragmatica.shape.lang.Result;

import java.util.function.Function;

/**
 * Function from an arbitrary input value to either a typed value or a {@link Cause} describing why the
 * input was rejected.
 *
 * <p>Parsers are pure and hold no mutable state, so a single instance can be built once and invoked
 * concurrently from any number of threads.
 *
 * @param <T> type of the parsed value
 */
@FunctionalInterface
public interface Parser<T> {
    Result<T> parse(Object input);

    /**
     * Transform the parsed value.
     */
    default <U> Parser<U> map(Function<? super T, ? extends U> mapper) {
        return input -> parse(input).map(mapper);
    }

    /**
     * Continue with a step which may fail.
     */
    default <U> Parser<U> flatMap(Function<? super T, Result<U>> next) {
        return input -> parse(input).flatMap(next);
    }

    /**
     * Feed the parsed value into another parser.
     */
    default <U> Parser<U> then(Parser<U> next) {
        return input -> parse(input).flatMap(next::parse);
    }

    /**
     * Replace the failure cause produced by this parser.
     */
    default Parser<T> mapError(Function<? super Cause, ? extends Cause> mapper) {
        return input -> parse(input).mapError(mapper);
    }
}
