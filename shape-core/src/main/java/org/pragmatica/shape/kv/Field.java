package org.pragmatica.shape.kv;

import org.pragmatica.shape.error.DomainError;
import org.pragmatica.shape.lang.Option;
import org.pragmatica.shape.lang.Result;
import org.pragmatica.shape.parser.BuiltIn;
import org.pragmatica.shape.parser.Parser;
import org.pragmatica.shape.parser.Parsers;

import java.util.Map;

import static org.pragmatica.shape.error.DomainError.details;
import static org.pragmatica.shape.error.DomainError.domainError;
import static org.pragmatica.shape.error.Reason.FAILED_TO_PARSE_FIELD;
import static org.pragmatica.shape.error.Reason.FIELD;
import static org.pragmatica.shape.error.Reason.FIELD_NOT_FOUND_IN_INPUT;
import static org.pragmatica.shape.error.Reason.INPUT;
import static org.pragmatica.shape.error.Reason.INVALID_FIELD_SPEC;
import static org.pragmatica.shape.error.Reason.SPEC;

/**
 * Validated {@link FieldSpec}. Instances are obtained only through {@link #field(Object)}, which
 * guarantees that the name, source and parser are set and that at most one of {@code optional},
 * default value and {@code nullable} is requested.
 */
public final class Field {
    private final FieldSpec spec;
    private final Parser<?> parser;

    private Field(FieldSpec spec) {
        this.spec = spec;
        this.parser = spec.nullable()
                      ? Parsers.union(spec.parser(), BuiltIn.nil())
                      : spec.parser();
    }

    /**
     * Validate a field declaration. Anything other than a well-formed {@link FieldSpec} fails with
     * {@code invalid_field_spec} carrying the rejected value.
     */
    public static Result<Field> field(Object spec) {
        if (spec instanceof FieldSpec fieldSpec && isWellFormed(fieldSpec)) {
            return Result.success(new Field(fieldSpec));
        }
        return domainError(INVALID_FIELD_SPEC, details(SPEC, spec)).result();
    }

    private static boolean isWellFormed(FieldSpec spec) {
        if (spec.name() == null || spec.source() == null || spec.parser() == null || spec.defaultValue() == null) {
            return false;
        }
        var relaxations = (spec.optional() ? 1 : 0)
                          + (spec.hasDefault() ? 1 : 0)
                          + (spec.nullable() ? 1 : 0);
        return relaxations <= 1;
    }

    public Key name() {
        return spec.name();
    }

    public FieldSpec spec() {
        return spec;
    }

    /**
     * Resolve this field against a normalized keyed input.
     */
    Result<Object> resolve(Map<?, ?> input) {
        if (spec.recurse()) {
            return parse(input, input);
        }
        return KeyLookup.lookup(input, spec.source())
                        .fold(() -> absent(input),
                              value -> parse(value, input));
    }

    /**
     * Same field restricted to values actually present in the input: {@code optional} and {@code recurse}
     * are dropped, a default value becomes one more accepted value.
     */
    Field asParameterField() {
        var stripped = spec.withOptional(false)
                           .withRecurse(false);

        if (spec.hasDefault()) {
            var widened = Parsers.union(spec.parser(), Parsers.equalTo(spec.defaultValue().unwrap()));
            stripped = stripped.withParser(widened)
                               .withoutDefault();
        }
        return new Field(stripped);
    }

    private Result<Object> parse(Object value, Map<?, ?> input) {
        return parser.parse(value)
                     .<Object>map(parsed -> spec.optional()
                                            ? Option.some(parsed)
                                            : parsed)
                     .mapError(cause -> DomainError.wrap(cause,
                                                         domainError(FAILED_TO_PARSE_FIELD,
                                                                     details(FIELD, spec.name(), INPUT, input))));
    }

    private Result<Object> absent(Map<?, ?> input) {
        if (spec.optional()) {
            return Result.success(Option.none());
        }
        if (spec.hasDefault()) {
            return Result.success(spec.defaultValue().unwrap());
        }
        return domainError(FIELD_NOT_FOUND_IN_INPUT, details(FIELD, spec.name(), INPUT, input)).result();
    }

    @Override
    public String toString() {
        return "Field(" + spec.name() + ")";
    }
}
