package org.pragmatica.shape.lang;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CausesTest {
    @Test
    void cause_hasNoSource_byDefault() {
        var cause = Causes.cause("plain");

        assertThat(cause.message()).isEqualTo("plain");
        assertThat(cause.source().isEmpty()).isTrue();
    }

    @Test
    void cause_canBeChained() {
        var root = Causes.cause("root");
        var outer = Causes.cause("outer", root);

        assertThat(outer.source()).isEqualTo(Option.some(root));
    }

    @Test
    void forOneValue_formatsTemplate() {
        var factory = Causes.forOneValue("Unknown value: %s");

        assertThat(factory.apply(42).message()).isEqualTo("Unknown value: 42");
    }

    @Test
    void fromThrowable_keepsExceptionChain() {
        var exception = new IllegalStateException("outer", new IllegalArgumentException("inner"));

        var cause = Causes.fromThrowable(exception);

        assertThat(cause.message()).isEqualTo("IllegalStateException: outer");
        assertThat(cause.source().unwrap().message()).isEqualTo("IllegalArgumentException: inner");
    }

    @Test
    void fromThrowable_usesClassName_whenMessageMissing() {
        assertThat(Causes.fromThrowable(new NullPointerException()).message()).isEqualTo("NullPointerException");
    }
}
