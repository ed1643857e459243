package org.pragmatica.shape.lang;

import java.util.NoSuchElementException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Presence or absence of a value.
 *
 * <p>Unlike {@link java.util.Optional}, a present value may be {@code null}: {@code some(null)} is a
 * legitimate "present" value, distinct from {@link #none()}. Use {@link #option(Object)} to map
 * {@code null} to {@link #none()}.
 */
public sealed interface Option<T> permits Option.Some, Option.None {
    /**
     * Create {@link Some} for non-null values and {@link None} for {@code null}.
     */
    static <T> Option<T> option(T value) {
        return value == null
               ? none()
               : some(value);
    }

    static <T> Option<T> some(T value) {
        return new Some<>(value);
    }

    @SuppressWarnings("unchecked")
    static <T> Option<T> none() {
        return (Option<T>) None.NONE;
    }

    boolean isPresent();

    default boolean isEmpty() {
        return !isPresent();
    }

    <U> Option<U> map(Function<? super T, ? extends U> mapper);

    <U> Option<U> flatMap(Function<? super T, Option<U>> mapper);

    Option<T> filter(Predicate<? super T> predicate);

    /**
     * Return the present value or the replacement.
     */
    T or(T replacement);

    /**
     * Return this instance if present, otherwise the option produced by {@code supplier}.
     */
    Option<T> orElse(Supplier<Option<T>> supplier);

    <R> R fold(Supplier<? extends R> onEmpty, Function<? super T, ? extends R> onPresent);

    Option<T> onPresent(Consumer<? super T> action);

    Option<T> onEmpty(Runnable action);

    Result<T> toResult(Cause cause);

    Stream<T> stream();

    /**
     * Extract the present value.
     *
     * @throws NoSuchElementException if there is no value
     */
    T unwrap();

    record Some<T>(T value) implements Option<T> {
        @Override
        public boolean isPresent() {
            return true;
        }

        @Override
        public <U> Option<U> map(Function<? super T, ? extends U> mapper) {
            return new Some<>(mapper.apply(value));
        }

        @Override
        public <U> Option<U> flatMap(Function<? super T, Option<U>> mapper) {
            return mapper.apply(value);
        }

        @Override
        public Option<T> filter(Predicate<? super T> predicate) {
            return predicate.test(value)
                   ? this
                   : none();
        }

        @Override
        public T or(T replacement) {
            return value;
        }

        @Override
        public Option<T> orElse(Supplier<Option<T>> supplier) {
            return this;
        }

        @Override
        public <R> R fold(Supplier<? extends R> onEmpty, Function<? super T, ? extends R> onPresent) {
            return onPresent.apply(value);
        }

        @Override
        public Option<T> onPresent(Consumer<? super T> action) {
            action.accept(value);
            return this;
        }

        @Override
        public Option<T> onEmpty(Runnable action) {
            return this;
        }

        @Override
        public Result<T> toResult(Cause cause) {
            return Result.success(value);
        }

        @Override
        public Stream<T> stream() {
            return Stream.of(value);
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public String toString() {
            return "Some(" + value + ")";
        }
    }

    record None<T>() implements Option<T> {
        private static final None<?> NONE = new None<>();

        @Override
        public boolean isPresent() {
            return false;
        }

        @Override
        public <U> Option<U> map(Function<? super T, ? extends U> mapper) {
            return none();
        }

        @Override
        public <U> Option<U> flatMap(Function<? super T, Option<U>> mapper) {
            return none();
        }

        @Override
        public Option<T> filter(Predicate<? super T> predicate) {
            return this;
        }

        @Override
        public T or(T replacement) {
            return replacement;
        }

        @Override
        public Option<T> orElse(Supplier<Option<T>> supplier) {
            return supplier.get();
        }

        @Override
        public <R> R fold(Supplier<? extends R> onEmpty, Function<? super T, ? extends R> onPresent) {
            return onEmpty.get();
        }

        @Override
        public Option<T> onPresent(Consumer<? super T> action) {
            return this;
        }

        @Override
        public Option<T> onEmpty(Runnable action) {
            action.run();
            return this;
        }

        @Override
        public Result<T> toResult(Cause cause) {
            return cause.result();
        }

        @Override
        public Stream<T> stream() {
            return Stream.empty();
        }

        @Override
        public T unwrap() {
            throw new NoSuchElementException("Option is empty");
        }

        @Override
        public String toString() {
            return "None";
        }
    }
}
