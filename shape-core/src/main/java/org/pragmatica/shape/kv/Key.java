package org.pragmatica.shape.kv;

import java.util.Objects;

/**
 * Symbolic key of a keyed input or of a resolved record. Two keys are equal when their names are equal.
 *
 * @param name textual form of the key
 */
public record Key(String name) {
    public Key {
        Objects.requireNonNull(name, "name");
    }

    public static Key key(String name) {
        return new Key(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
