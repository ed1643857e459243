package org.pragmatica.shape.lang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of an operation which may fail: either {@link Success} holding a value or {@link Failure}
 * holding a {@link Cause}.
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {
    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Cause cause) {
        return new Failure<>(Objects.requireNonNull(cause, "cause"));
    }

    /**
     * Collect all values from a list of results. The first failure, in list order, is returned.
     */
    static <T> Result<List<T>> allOf(List<Result<T>> results) {
        var values = new ArrayList<T>(results.size());
        for (var result : results) {
            if (result instanceof Failure<T> failure) {
                return failure.cause()
                              .result();
            }
            values.add(result.unwrap());
        }
        return success(Collections.unmodifiableList(values));
    }

    /**
     * Thread an accumulator through {@code step} for every item, stopping at the first failure.
     */
    static <A, E> Result<A> foldLeft(Iterable<? extends E> items,
                                     A initial,
                                     BiFunction<? super A, ? super E, Result<A>> step) {
        Result<A> accumulator = success(initial);
        for (var item : items) {
            if (accumulator instanceof Success<A> current) {
                accumulator = step.apply(current.value(), item);
            } else {
                return accumulator;
            }
        }
        return accumulator;
    }

    /**
     * Invoke code which may throw and convert exceptions into failures with {@code exceptionMapper}.
     * JVM errors are not caught; an interruption is converted as well, with the interrupt flag restored.
     */
    static <T> Result<T> lift(Function<? super Throwable, ? extends Cause> exceptionMapper, ThrowingSupplier<T> supplier) {
        try {
            return success(supplier.get());
        } catch (InterruptedException e) {
            Thread.currentThread()
                  .interrupt();
            return failure(exceptionMapper.apply(e));
        } catch (Exception e) {
            return failure(exceptionMapper.apply(e));
        }
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    <U> Result<U> map(Function<? super T, ? extends U> mapper);

    <U> Result<U> flatMap(Function<? super T, Result<U>> mapper);

    Result<T> mapError(Function<? super Cause, ? extends Cause> mapper);

    <R> R fold(Function<? super Cause, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    Result<T> onSuccess(Consumer<? super T> action);

    Result<T> onFailure(Consumer<? super Cause> action);

    default Result<T> onSuccessRun(Runnable action) {
        return onSuccess(value -> action.run());
    }

    default Result<T> onFailureRun(Runnable action) {
        return onFailure(cause -> action.run());
    }

    /**
     * Return this instance if successful, otherwise the replacement.
     */
    Result<T> or(Result<T> replacement);

    Option<T> toOption();

    /**
     * Extract the value of a successful result.
     *
     * @throws IllegalStateException if the result is a failure
     */
    T unwrap();

    @FunctionalInterface
    interface ThrowingSupplier<T> {
        T get() throws Exception;
    }

    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
            return mapper.apply(value);
        }

        @Override
        public Result<T> mapError(Function<? super Cause, ? extends Cause> mapper) {
            return this;
        }

        @Override
        public <R> R fold(Function<? super Cause, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }

        @Override
        public Result<T> onSuccess(Consumer<? super T> action) {
            action.accept(value);
            return this;
        }

        @Override
        public Result<T> onFailure(Consumer<? super Cause> action) {
            return this;
        }

        @Override
        public Result<T> or(Result<T> replacement) {
            return this;
        }

        @Override
        public Option<T> toOption() {
            return Option.option(value);
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public String toString() {
            return "Success(" + value + ")";
        }
    }

    record Failure<T>(Cause cause) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Failure<>(cause);
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
            return new Failure<>(cause);
        }

        @Override
        public Result<T> mapError(Function<? super Cause, ? extends Cause> mapper) {
            return new Failure<>(mapper.apply(cause));
        }

        @Override
        public <R> R fold(Function<? super Cause, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(cause);
        }

        @Override
        public Result<T> onSuccess(Consumer<? super T> action) {
            return this;
        }

        @Override
        public Result<T> onFailure(Consumer<? super Cause> action) {
            action.accept(cause);
            return this;
        }

        @Override
        public Result<T> or(Result<T> replacement) {
            return replacement;
        }

        @Override
        public Option<T> toOption() {
            return Option.none();
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException("Unwrap of failed result: " + cause.message());
        }

        @Override
        public String toString() {
            return "Failure(" + cause.message() + ")";
        }
    }
}
