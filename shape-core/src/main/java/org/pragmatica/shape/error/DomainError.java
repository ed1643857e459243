package org.pragmatica.shape.error;

import org.pragmatica.shape.lang.Cause;
import org.pragmatica.shape.lang.Option;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Expected, recoverable failure: malformed input or misuse of the API.
 *
 * <p>An error has a symbolic {@code reason}, a {@code details} payload and, optionally, the error
 * which caused it. Wrapping an inner error into an outer one builds a causal chain which can be
 * walked from the outermost description to the root cause.
 *
 * <p>Details may contain {@code null} values, as the offending input is often {@code null} itself.
 *
 * @param reason  symbolic failure reason, see {@link Reason}
 * @param details immutable failure details
 * @param source  causal predecessor, if any
 */
public record DomainError(String reason, Map<String, Object> details, Option<Cause> source) implements Cause {
    public DomainError {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(source, "source");
        details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static DomainError domainError(String reason) {
        return new DomainError(reason, Map.of(), Option.none());
    }

    public static DomainError domainError(String reason, Map<String, ?> details) {
        return new DomainError(reason, Collections.unmodifiableMap(details), Option.none());
    }

    /**
     * Annotate {@code outer} with {@code inner} as its causal predecessor.
     */
    public static DomainError wrap(Cause inner, DomainError outer) {
        return new DomainError(outer.reason(), outer.details(), Option.some(inner));
    }

    /**
     * Add a detail to an arbitrary cause. A {@link DomainError} gets the detail merged into its own
     * details; any other cause becomes the source of a new {@link Reason#FOREIGN_CAUSE} error holding
     * the detail.
     */
    public static DomainError enrich(Cause cause, String key, Object value) {
        if (cause instanceof DomainError domainError) {
            return domainError.withDetail(key, value);
        }
        return wrap(cause, domainError(Reason.FOREIGN_CAUSE, details(key, value)));
    }

    /**
     * Build a details map which tolerates {@code null} values.
     */
    public static Map<String, Object> details(String key, Object value) {
        var details = new LinkedHashMap<String, Object>();
        details.put(key, value);
        return details;
    }

    public static Map<String, Object> details(String key1, Object value1, String key2, Object value2) {
        var details = details(key1, value1);
        details.put(key2, value2);
        return details;
    }

    /**
     * Return a copy of this error with details transformed by {@code mapper}.
     */
    public DomainError mapDetails(UnaryOperator<Map<String, Object>> mapper) {
        return new DomainError(reason, mapper.apply(new LinkedHashMap<>(details)), source);
    }

    public DomainError withDetail(String key, Object value) {
        return mapDetails(current -> {
            current.put(key, value);
            return current;
        });
    }

    public Object detail(String key) {
        return details.get(key);
    }

    public Option<Cause> causedBy() {
        return source;
    }

    /**
     * The innermost cause of the chain. Returns this error if it has no source.
     */
    public Cause rootCause() {
        Cause current = this;
        while (current.source()
                      .isPresent()) {
            current = current.source()
                             .unwrap();
        }
        return current;
    }

    @Override
    public String message() {
        var text = details.isEmpty()
                   ? reason
                   : reason + " " + details;
        return source.fold(() -> text, inner -> text + ", caused by: " + inner.message());
    }

    @Override
    public String toString() {
        return "DomainError(" + message() + ")";
    }
}
