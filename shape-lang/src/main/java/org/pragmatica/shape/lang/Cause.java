package org.pragmatica.shape.lang;

/**
 * Description of a failure carried by {@link Result}.
 *
 * <p>Causes may form a chain: {@link #source()} points at the cause which triggered this one,
 * so the chain can be walked from the outermost description down to the root cause.
 */
public interface Cause {
    /**
     * Human-readable description of the failure.
     */
    String message();

    /**
     * The cause which triggered this one, if any.
     */
    default Option<Cause> source() {
        return Option.none();
    }

    /**
     * Wrap this cause into a failed {@link Result}.
     */
    default <T> Result<T> result() {
        return Result.failure(this);
    }
}
