package org.pragmatica.shape.lang;

import java.util.function.Function;

/**
 * Factories for simple, text-only causes.
 */
public final class Causes {
    private Causes() {}

    /**
     * Create a cause with the given message.
     */
    public static Cause cause(String message) {
        return new SimpleCause(message, Option.none());
    }

    /**
     * Create a cause with the given message, caused by {@code source}.
     */
    public static Cause cause(String message, Cause source) {
        return new SimpleCause(message, Option.some(source));
    }

    /**
     * Create a template-based cause factory. The template is formatted with {@link String#format}.
     */
    public static Function<Object, Cause> forOneValue(String template) {
        return value -> cause(String.format(template, value));
    }

    /**
     * Convert a {@link Throwable} (and its own cause chain) into a {@link Cause}.
     */
    public static Cause fromThrowable(Throwable throwable) {
        var source = Option.option(throwable.getCause())
                           .filter(nested -> nested != throwable)
                           .map(Causes::fromThrowable);
        return new SimpleCause(describe(throwable), source);
    }

    private static String describe(Throwable throwable) {
        var name = throwable.getClass()
                            .getSimpleName();
        return throwable.getMessage() == null
               ? name
               : name + ": " + throwable.getMessage();
    }

    record SimpleCause(String message, Option<Cause> source) implements Cause {
        @Override
        public String toString() {
            return source.fold(() -> message, nested -> message + " <- " + nested);
        }
    }
}
