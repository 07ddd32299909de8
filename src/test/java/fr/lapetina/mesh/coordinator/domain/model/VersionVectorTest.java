package fr.lapetina.mesh.coordinator.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VersionVectorTest {

    @Test
    @DisplayName("should treat missing origins as zero")
    void shouldTreatMissingOriginsAsZero() {
        VersionVector vector = VersionVector.of(Map.of("a", 2, "b", 0));

        assertThat(vector.get("a")).isEqualTo(2);
        assertThat(vector.get("b")).isZero();
        assertThat(vector.get("c")).isZero();
        assertThat(vector).isEqualTo(VersionVector.of(Map.of("a", 2)));
    }

    @Test
    @DisplayName("should reject negative counters")
    void shouldRejectNegativeCounters() {
        assertThatThrownBy(() -> VersionVector.of(Map.of("a", -1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should compare causally")
    void shouldCompareCausally() {
        VersionVector a1 = VersionVector.of(Map.of("a", 1));
        VersionVector a2 = VersionVector.of(Map.of("a", 2));
        VersionVector b1 = VersionVector.of(Map.of("b", 1));

        assertThat(a1.compare(a2)).isEqualTo(VersionVector.Ordering.BEFORE);
        assertThat(a2.compare(a1)).isEqualTo(VersionVector.Ordering.AFTER);
        assertThat(a1.compare(a1)).isEqualTo(VersionVector.Ordering.EQUAL);
        assertThat(a1.compare(b1)).isEqualTo(VersionVector.Ordering.CONCURRENT);
        assertThat(VersionVector.empty().isCoveredBy(a1)).isTrue();
        assertThat(a1.isCoveredBy(b1)).isFalse();
    }

    @Test
    @DisplayName("should merge by pointwise maximum")
    void shouldMergeByMaximum() {
        VersionVector left = VersionVector.of(Map.of("a", 3, "b", 1));
        VersionVector right = VersionVector.of(Map.of("b", 4, "c", 2));

        VersionVector merged = left.merge(right);

        assertThat(merged.asMap()).containsOnly(Map.entry("a", 3L), Map.entry("b", 4L), Map.entry("c", 2L));
        assertThat(merged).isEqualTo(right.merge(left));
    }

    @Test
    @DisplayName("should only advance forward")
    void shouldOnlyAdvanceForward() {
        VersionVector vector = VersionVector.of(Map.of("a", 5));

        assertThat(vector.advance("a", 3)).isSameAs(vector);
        assertThat(vector.advance("a", 7).get("a")).isEqualTo(7);
        assertThat(vector.increment("b").get("b")).isEqualTo(1);
    }

    @Test
    @DisplayName("should serialize as a plain JSON object")
    void shouldSerializeAsPlainObject() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        VersionVector vector = VersionVector.of(Map.of("edge-1", 3, "cloud", 1));

        String json = mapper.writeValueAsString(vector);

        assertThat(json).isEqualTo("{\"cloud\":1,\"edge-1\":3}");
        assertThat(mapper.readValue(json, VersionVector.class)).isEqualTo(vector);
    }
}
