package org.pragmatica.shape.struct;

import org.pragmatica.shape.kv.Key;
import org.pragmatica.shape.lang.Result;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.shape.error.DomainErrors.errorOf;
import static org.pragmatica.shape.error.Reason.STRUCT_CONSTRUCTION_FAILED;
import static org.pragmatica.shape.kv.Key.key;

class RecordStructTypeTest {
    record Point(int x, int y) {}

    record Label(String text, String color) {
        Label {
            Objects.requireNonNull(text, "text");
        }
    }

    static final class Counter {
        private final int value;

        Counter(int value) {
            this.value = value;
        }

        int value() {
            return value;
        }
    }

    @Test
    void structType_isCachedPerClass() {
        assertThat(StructType.structType(Point.class)).isSameAs(StructType.structType(Point.class));
    }

    @Test
    void construct_mapsComponentNames() {
        StructType.structType(Point.class)
                  .construct(Map.of(key("x"), 1, key("y"), 2, key("z"), 3))
                  .onFailureRun(Assertions::fail)
                  .onSuccess(point -> assertThat(point).isEqualTo(new Point(1, 2)));
    }

    @Test
    void construct_usesNullForMissingReferenceComponent() {
        StructType.structType(Label.class)
                  .construct(Map.of(key("text"), "hello"))
                  .onFailureRun(Assertions::fail)
                  .onSuccess(label -> assertThat(label).isEqualTo(new Label("hello", null)));
    }

    @Test
    void construct_rejectsMissingPrimitiveComponent() {
        var error = errorOf(StructType.structType(Point.class).construct(Map.of(key("x"), 1)));

        assertThat(error.reason()).isEqualTo(STRUCT_CONSTRUCTION_FAILED);
        assertThat(error.details()).isEqualTo(Map.of("type", Point.class, "field", key("y")));
    }

    @Test
    void construct_reportsMismatchedArgument() {
        var error = errorOf(StructType.structType(Point.class).construct(Map.of(key("x"), "one", key("y"), 2)));

        assertThat(error.reason()).isEqualTo(STRUCT_CONSTRUCTION_FAILED);
        assertThat(error.causedBy().isPresent()).isTrue();
    }

    @Test
    void construct_reportsCompactConstructorRejection() {
        var fields = new HashMap<Key, Object>();
        fields.put(key("text"), null);

        var error = errorOf(StructType.structType(Label.class).construct(fields));

        assertThat(error.reason()).isEqualTo(STRUCT_CONSTRUCTION_FAILED);
        assertThat(error.causedBy().unwrap().message()).isEqualTo("NullPointerException: text");
    }

    @Test
    void fields_readsComponentsInOrder() {
        StructType.structType(Point.class)
                  .fields(new Point(3, 4))
                  .onFailureRun(Assertions::fail)
                  .onSuccess(fields -> assertThat(fields).containsExactly(Map.entry(key("x"), 3), Map.entry(key("y"), 4)));
    }

    @Test
    void matches_requiresExactClass() {
        var type = StructType.structType(Point.class);

        assertThat(type.matches(new Point(0, 0))).isTrue();
        assertThat(type.matches(new Label("a", "b"))).isFalse();
        assertThat(type.matches(null)).isFalse();
    }

    @Test
    void explicitStructType_delegatesToFunctions() {
        var type = StructType.structType(Counter.class,
                                         fields -> Result.success(new Counter((Integer) fields.get(key("value")))),
                                         counter -> Map.of(key("value"), counter.value()));

        type.update(new Counter(1), Map.of(key("value"), 2))
            .onFailureRun(Assertions::fail)
            .onSuccess(counter -> assertThat(counter.value()).isEqualTo(2));
        assertThat(type.type()).isEqualTo(Counter.class);
    }
}
