package org.pragmatica.shape.kv;

import org.pragmatica.shape.lang.Option;
import org.pragmatica.shape.parser.Parser;

/**
 * Declaration of one field of a keyed record. Declarations are not checked when built; use
 * {@link Field#field(Object)} or {@link FieldResolver#compile(java.util.List)} to validate them.
 *
 * @param name         key of the field in the resolved record
 * @param source       key to read from the input, by default same as {@code name}
 * @param parser       parser applied to the located value
 * @param optional     wrap the parsed value into {@link Option}, absent key resolves to {@code none()}
 * @param defaultValue value used as-is when the source key is absent; {@code some(null)} is a legal default
 * @param nullable     accept {@code null} in addition to whatever {@code parser} accepts
 * @param recurse      feed the whole input to {@code parser} instead of a single value
 */
public record FieldSpec(Key name,
                        Object source,
                        Parser<?> parser,
                        boolean optional,
                        Option<Object> defaultValue,
                        boolean nullable,
                        boolean recurse) {
    public static FieldSpec field(Key name, Parser<?> parser) {
        return new FieldSpec(name, name, parser, false, Option.none(), false, false);
    }

    public static FieldSpec field(String name, Parser<?> parser) {
        return field(Key.key(name), parser);
    }

    public boolean hasDefault() {
        return defaultValue != null && defaultValue.isPresent();
    }

    public FieldSpec withSource(Object source) {
        return new FieldSpec(name,
                             source,
                             parser,
                             optional,
                             defaultValue,
                             nullable,
                             recurse);
    }

    public FieldSpec withOptional(boolean optional) {
        return new FieldSpec(name,
                             source,
                             parser,
                             optional,
                             defaultValue,
                             nullable,
                             recurse);
    }

    public FieldSpec withDefault(Object defaultValue) {
        return new FieldSpec(name,
                             source,
                             parser,
                             optional,
                             Option.some(defaultValue),
                             nullable,
                             recurse);
    }

    public FieldSpec withoutDefault() {
        return new FieldSpec(name,
                             source,
                             parser,
                             optional,
                             Option.none(),
                             nullable,
                             recurse);
    }

    public FieldSpec withNullable(boolean nullable) {
        return new FieldSpec(name,
                             source,
                             parser,
                             optional,
                             defaultValue,
                             nullable,
                             recurse);
    }

    public FieldSpec withRecurse(boolean recurse) {
        return new FieldSpec(name,
                             source,
                             parser,
                             optional,
                             defaultValue,
                             nullable,
                             recurse);
    }

    public FieldSpec withParser(Parser<?> parser) {
        return new FieldSpec(name,
                             source,
                             parser,
                             optional,
                             defaultValue,
                             nullable,
                             recurse);
    }
}
