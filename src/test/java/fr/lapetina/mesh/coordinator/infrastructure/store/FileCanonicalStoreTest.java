package fr.lapetina.mesh.coordinator.infrastructure.store;

import fr.lapetina.mesh.coordinator.domain.model.CanonicalEntity;
import fr.lapetina.mesh.coordinator.domain.model.FieldState;
import fr.lapetina.mesh.coordinator.domain.model.FieldType;
import fr.lapetina.mesh.coordinator.domain.model.VersionVector;
import fr.lapetina.mesh.coordinator.domain.model.WriteStamp;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileCanonicalStoreTest {

    @TempDir
    Path tempDir;

    private Path storePath;
    private FileCanonicalStore store;

    @BeforeEach
    void setUp() {
        storePath = tempDir.resolve("sync").resolve("canonical.jsonl");
        store = new FileCanonicalStore(storePath);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static CanonicalEntity note(String id, String title, long revision) {
        WriteStamp stamp = new WriteStamp("edge-1", revision, revision + 4);
        return new CanonicalEntity(id, "note",
                Map.of("title", new FieldState(title, FieldType.SCALAR, stamp),
                        "tags", new FieldState(List.of("a", "b"), FieldType.SET, stamp),
                        "views", new FieldState(7L, FieldType.COUNTER, stamp)),
                VersionVector.of(Map.of("edge-1", revision)),
                Map.of("edge-1", revision), false, null, revision);
    }

    private void put(FileCanonicalStore target, CanonicalEntity entity) {
        try (CanonicalStore.EntityLock lock = target.lock(entity.id(), Duration.ofMillis(100)).orElseThrow()) {
            target.put(entity, entity.revision() - 1);
        }
    }

    @Test
    @DisplayName("should start empty when the file does not exist")
    void shouldStartEmpty() {
        assertThat(store.all()).isEmpty();
        assertThat(Files.exists(storePath)).isFalse();
    }

    @Test
    @DisplayName("should read back the latest version of every entity after a reopen")
    void shouldReloadLatestVersions() {
        put(store, note("note-1", "draft", 1));
        put(store, note("note-1", "final", 2));
        put(store, note("note-2", "other", 1));
        store.close();

        FileCanonicalStore reopened = new FileCanonicalStore(storePath);
        try {
            assertThat(reopened.all()).hasSize(2);
            assertThat(reopened.get("note-1")).contains(note("note-1", "final", 2));
            assertThat(reopened.get("note-2").orElseThrow().values()).containsEntry("title", "other");
        } finally {
            reopened.close();
        }
    }

    @Test
    @DisplayName("should keep a tombstone and the write that made it")
    void shouldReloadTombstone() {
        WriteStamp deletedBy = new WriteStamp("edge-2", 3, 9);
        CanonicalEntity deleted = new CanonicalEntity("note-1", "note", Map.of(),
                VersionVector.of(Map.of("edge-2", 3L)), Map.of("edge-2", 3L), true, deletedBy, 1);
        put(store, deleted);
        store.close();

        FileCanonicalStore reopened = new FileCanonicalStore(storePath);
        try {
            assertThat(reopened.get("note-1")).contains(deleted);
        } finally {
            reopened.close();
        }
    }

    @Test
    @DisplayName("should compact the file to one line per entity when opened")
    void shouldCompactOnOpen() throws IOException {
        put(store, note("note-1", "a", 1));
        put(store, note("note-1", "b", 2));
        put(store, note("note-1", "c", 3));
        store.close();

        new FileCanonicalStore(storePath).close();

        assertThat(Files.readAllLines(storePath, StandardCharsets.UTF_8)).hasSize(1);
    }

    @Test
    @DisplayName("should keep appending after a reopen")
    void shouldAppendAfterReopen() {
        put(store, note("note-1", "a", 1));
        store.close();

        FileCanonicalStore reopened = new FileCanonicalStore(storePath);
        put(reopened, note("note-1", "b", 2));
        reopened.close();

        FileCanonicalStore third = new FileCanonicalStore(storePath);
        try {
            assertThat(third.get("note-1").orElseThrow().revision()).isEqualTo(2);
        } finally {
            third.close();
        }
    }

    @Test
    @DisplayName("should flag an unreadable line with its location")
    void shouldFlagUnreadableLine() throws IOException {
        put(store, note("note-1", "a", 1));
        store.close();
        Files.writeString(storePath, "{not json\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        assertThatThrownBy(() -> new FileCanonicalStore(storePath))
                .isInstanceOfSatisfying(StoreCorruptionException.class,
                        e -> assertThat(e.getLocation()).endsWith(":2"));
    }

    @Test
    @DisplayName("should still require the entity lock")
    void shouldRequireLock() {
        assertThatThrownBy(() -> store.put(note("note-1", "a", 1), 0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("lock not held");
    }
}
