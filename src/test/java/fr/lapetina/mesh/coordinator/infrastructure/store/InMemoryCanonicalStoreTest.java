package fr.lapetina.mesh.coordinator.infrastructure.store;

import fr.lapetina.mesh.coordinator.domain.model.CanonicalEntity;
import fr.lapetina.mesh.coordinator.domain.model.VersionVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCanonicalStoreTest {

    private final InMemoryCanonicalStore store = new InMemoryCanonicalStore();

    private static CanonicalEntity entity(long revision) {
        return new CanonicalEntity("note-1", "note", Map.of(), VersionVector.of(Map.of("a", revision)),
                Map.of(), false, null, revision);
    }

    @Test
    @DisplayName("should store under the entity lock with the expected revision")
    void shouldStoreUnderLock() {
        try (CanonicalStore.EntityLock lock = store.lock("note-1", Duration.ofMillis(100)).orElseThrow()) {
            store.put(entity(1), 0);
            store.put(entity(2), 1);
        }

        assertThat(store.get("note-1")).map(CanonicalEntity::revision).contains(2L);
        assertThat(store.all()).hasSize(1);
    }

    @Test
    @DisplayName("should refuse a write without the lock")
    void shouldRefuseWithoutLock() {
        assertThatThrownBy(() -> store.put(entity(1), 0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("lock not held");
    }

    @Test
    @DisplayName("should refuse a write computed from a stale revision")
    void shouldRefuseStaleRevision() {
        try (CanonicalStore.EntityLock lock = store.lock("note-1", Duration.ofMillis(100)).orElseThrow()) {
            store.put(entity(1), 0);

            assertThatThrownBy(() -> store.put(entity(2), 0))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Revision moved");
        }
    }

    @Test
    @DisplayName("should time out when another thread holds the lock")
    void shouldTimeOutWhenContended() {
        try (CanonicalStore.EntityLock lock = store.lock("note-1", Duration.ofMillis(100)).orElseThrow()) {
            Optional<CanonicalStore.EntityLock> other = CompletableFuture
                    .supplyAsync(() -> store.lock("note-1", Duration.ofMillis(50)))
                    .join();

            assertThat(other).isEmpty();
            assertThat(CompletableFuture.supplyAsync(() -> store.lock("note-2", Duration.ofMillis(50)))
                    .join()).isPresent();
        }
    }
}
