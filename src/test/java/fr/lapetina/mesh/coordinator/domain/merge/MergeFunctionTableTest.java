package fr.lapetina.mesh.coordinator.domain.merge;

import fr.lapetina.mesh.coordinator.domain.model.FieldState;
import fr.lapetina.mesh.coordinator.domain.model.FieldType;
import fr.lapetina.mesh.coordinator.domain.model.WriteStamp;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MergeFunctionTableTest {

    private static final WriteStamp A = new WriteStamp("node-a", 1, 5);
    private static final WriteStamp B = new WriteStamp("node-b", 1, 5);

    @Nested
    @DisplayName("Field types")
    class FieldTypes {

        @Test
        @DisplayName("should resolve entity-specific declarations before bare field names")
        void shouldPreferSpecificDeclaration() {
            MergeFunctionTable table = new MergeFunctionTable(Map.of(
                    "tags", "set",
                    "note.tags", "SCALAR",
                    "views", "COUNTER"
            ));

            assertThat(table.typeOf("note", "tags")).isEqualTo(FieldType.SCALAR);
            assertThat(table.typeOf("task", "tags")).isEqualTo(FieldType.SET);
            assertThat(table.typeOf("task", "views")).isEqualTo(FieldType.COUNTER);
            assertThat(table.typeOf("task", "title")).isEqualTo(FieldType.SCALAR);
        }

        @Test
        @DisplayName("should replace declarations on reload")
        void shouldReplaceOnReload() {
            MergeFunctionTable table = new MergeFunctionTable(Map.of("tags", "SET"));

            table.replaceTypes(Map.of("views", "COUNTER"));

            assertThat(table.typeOf("any", "tags")).isEqualTo(FieldType.SCALAR);
            assertThat(table.typeOf("any", "views")).isEqualTo(FieldType.COUNTER);
        }

        @Test
        @DisplayName("should reject unknown merge types")
        void shouldRejectUnknownType() {
            assertThatThrownBy(() -> new MergeFunctionTable(Map.of("tags", "bag")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("LastWriterWinsMerge")
    class LastWriterWins {

        private final LastWriterWinsMerge merge = new LastWriterWinsMerge();

        @Test
        @DisplayName("should keep the greater stamp for concurrent writes in either order")
        void shouldKeepGreaterStamp() {
            FieldState fromA = new FieldState("a", FieldType.SCALAR, A);
            FieldState fromB = new FieldState("b", FieldType.SCALAR, B);

            assertThat(merge.merge(fromA, fromB, false).value()).isEqualTo("b");
            assertThat(merge.merge(fromB, fromA, false).value()).isEqualTo("b");
        }

        @Test
        @DisplayName("should let a causally newer write replace the value")
        void shouldReplaceWhenSawCurrent() {
            FieldState current = new FieldState("old", FieldType.SCALAR, new WriteStamp("node-z", 1, 99));
            FieldState incoming = new FieldState("new", FieldType.SCALAR, new WriteStamp("node-a", 2, 1));

            assertThat(merge.merge(current, incoming, true).value()).isEqualTo("new");
        }
    }

    @Nested
    @DisplayName("SetUnionMerge")
    class SetUnion {

        private final SetUnionMerge merge = new SetUnionMerge();

        @Test
        @DisplayName("should union and sort independent of arrival order")
        void shouldUnionCommutatively() {
            FieldState left = new FieldState(List.of("urgent", "home"), FieldType.SET, A);
            FieldState right = new FieldState(List.of("work", "home"), FieldType.SET, B);

            FieldState ab = merge.merge(left, right, false);
            FieldState ba = merge.merge(right, left, false);

            assertThat(ab.value()).isEqualTo(List.of("home", "urgent", "work"));
            assertThat(ba).isEqualTo(ab);
        }

        @Test
        @DisplayName("should treat a scalar as a single element")
        void shouldWrapScalar() {
            FieldState merged = merge.merge(null, new FieldState("solo", FieldType.SET, A), false);

            assertThat(merged.value()).isEqualTo(List.of("solo"));
        }
    }

    @Nested
    @DisplayName("MaxCounterMerge")
    class MaxCounter {

        private final MaxCounterMerge merge = new MaxCounterMerge();

        @Test
        @DisplayName("should keep the maximum in either order")
        void shouldKeepMaximum() {
            FieldState five = new FieldState(5, FieldType.COUNTER, A);
            FieldState three = new FieldState(3L, FieldType.COUNTER, B);

            assertThat(merge.merge(five, three, false).value()).isEqualTo(5L);
            assertThat(merge.merge(three, five, true).value()).isEqualTo(5L);
        }

        @Test
        @DisplayName("should normalize integral doubles to longs")
        void shouldNormalizeIntegralDoubles() {
            assertThat(MaxCounterMerge.normalize(4.0)).isEqualTo(4L);
            assertThat(MaxCounterMerge.normalize(4.5)).isEqualTo(4.5);
            assertThat(MaxCounterMerge.normalize(null)).isEqualTo(0L);
        }

        @Test
        @DisplayName("should reject non-numeric counters")
        void shouldRejectNonNumeric() {
            assertThatThrownBy(() -> merge.merge(null, new FieldState("ten", FieldType.COUNTER, A), false))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should keep big integers that fit a long and reject the others")
        void shouldRejectOutOfRangeBigIntegers() {
            BigInteger tooBig = BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE);

            assertThat(MaxCounterMerge.normalize(BigInteger.valueOf(42))).isEqualTo(42L);
            assertThat(MaxCounterMerge.normalize(new BigDecimal("12.000"))).isEqualTo(12L);
            assertThat(MaxCounterMerge.normalize(new BigDecimal("2.5"))).isEqualTo(2.5);
            assertThatThrownBy(() -> merge.merge(null, new FieldState(tooBig, FieldType.COUNTER, A), false))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("out of range");
            assertThatThrownBy(() -> MaxCounterMerge.normalize(new BigDecimal(BigInteger.TWO.pow(70)).negate()))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> MaxCounterMerge.normalize(Double.NaN))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("finite");
        }

        @Test
        @DisplayName("should name the field of a delta that cannot be merged")
        void shouldValidateDelta() {
            MergeFunctionTable table = new MergeFunctionTable(Map.of("views", "COUNTER"));
            BigInteger tooBig = BigInteger.TWO.pow(70);

            table.validate("note", Map.of("views", 3, "title", "free text"));
            assertThatThrownBy(() -> table.validate("note", Map.of("views", tooBig)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Field 'views'");
        }
    }
}
