package org.pragmatica.shape.kv;

import org.pragmatica.shape.error.DomainError;
import org.pragmatica.shape.lang.Result;
import org.pragmatica.shape.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.pragmatica.shape.error.Reason.INPUT;
import static org.pragmatica.shape.error.Reason.NOT_A_LIST;

/**
 * Parser of keyed input (a {@link Map} or a list of {@link Map.Entry}) into a record keyed by field names.
 *
 * <p>Fields are resolved in declaration order and resolution stops at the first failing field.
 * Resolvers are immutable and may be shared between threads.
 */
public final class FieldResolver implements Parser<Map<Key, Object>> {
    private static final Logger log = LoggerFactory.getLogger(FieldResolver.class);

    private final List<Field> fields;

    private FieldResolver(List<Field> fields) {
        this.fields = fields;
    }

    /**
     * Validate all field declarations and build a resolver for them.
     *
     * @param specs field declarations, normally {@link FieldSpec} instances
     * @return resolver, or {@code not_a_list} for {@code null} specs, or {@code invalid_field_spec}
     *         for the first element which is not a well-formed {@link FieldSpec}
     */
    public static Result<FieldResolver> compile(List<?> specs) {
        if (specs == null) {
            return DomainError.domainError(NOT_A_LIST, DomainError.details(INPUT, null))
                              .result();
        }
        return Result.allOf(specs.stream()
                                 .map(Field::field)
                                 .toList())
                     .map(FieldResolver::fieldResolver);
    }

    public static Result<FieldResolver> compile(FieldSpec... specs) {
        return compile(Arrays.asList(specs));
    }

    /**
     * Build a resolver for a single field which only matches values present in the input.
     * {@code optional} and {@code recurse} are ignored; a default value is accepted as one more valid
     * value instead of being used for a missing key.
     */
    public static Result<FieldResolver> compileOne(Object spec) {
        return Field.field(spec)
                    .map(Field::asParameterField)
                    .map(field -> fieldResolver(List.of(field)));
    }

    private static FieldResolver fieldResolver(List<Field> fields) {
        log.debug("Compiled resolver with {} field(s): {}", fields.size(), fields);
        return new FieldResolver(List.copyOf(fields));
    }

    public List<Field> fields() {
        return fields;
    }

    @Override
    public Result<Map<Key, Object>> parse(Object input) {
        return KvInput.normalize(input)
                      .flatMap(this::resolve);
    }

    private Result<Map<Key, Object>> resolve(Map<?, ?> input) {
        var record = new LinkedHashMap<Key, Object>();

        for (var field : fields) {
            var resolved = field.resolve(input);

            if (resolved.isFailure()) {
                return resolved.map(value -> record);
            }
            record.put(field.name(), resolved.unwrap());
        }
        return Result.success(Collections.unmodifiableMap(record));
    }

    @Override
    public String toString() {
        return "FieldResolver" + fields;
    }
}
