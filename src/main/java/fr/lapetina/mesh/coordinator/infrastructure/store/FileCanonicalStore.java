package fr.lapetina.mesh.coordinator.infrastructure.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.mesh.coordinator.domain.model.CanonicalEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Canonical store that survives restarts.
 *
 * <p>Entities live in an {@link InMemoryCanonicalStore}; every stored version
 * is also appended as one JSON line and forced to disk before {@link #put}
 * returns. Opening the store reads the file back, keeping the highest
 * revision per entity, and compacts it to one line per entity. Integral
 * field values are read back as {@code Long}.
 */
public final class FileCanonicalStore implements CanonicalStore {

    private static final Logger log = LoggerFactory.getLogger(FileCanonicalStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;
    private final InMemoryCanonicalStore entities = new InMemoryCanonicalStore();
    private final ReentrantLock writeLock = new ReentrantLock();
    private FileChannel channel;
    private BufferedWriter writer;

    /**
     * Opens the store and loads every entity it holds.
     *
     * @throws StoreCorruptionException if a line cannot be read back as an entity
     */
    public FileCanonicalStore(Path path) {
        this.path = path;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .enable(DeserializationFeature.USE_LONG_FOR_INTS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
        load();
    }

    @Override
    public Optional<CanonicalEntity> get(String entityId) {
        return entities.get(entityId);
    }

    @Override
    public Optional<EntityLock> lock(String entityId, Duration timeout) {
        return entities.lock(entityId, timeout);
    }

    /**
     * @throws StoreCorruptionException if the new version cannot be written durably
     */
    @Override
    public void put(CanonicalEntity entity, long expectedRevision) {
        entities.put(entity, expectedRevision);
        String line = serialize(entity);
        writeLock.lock();
        try {
            ensureOpen();
            writer.write(line);
            writer.newLine();
            writer.flush();
            channel.force(false);
        } catch (IOException e) {
            throw new StoreCorruptionException(path.toString(),
                    "Failed to persist entity " + entity.id() + " at revision " + entity.revision(), e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<CanonicalEntity> all() {
        return entities.all();
    }

    public Path getPath() {
        return path;
    }

    private void load() {
        if (!Files.exists(path)) {
            return;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreCorruptionException(path.toString(), "Failed to read canonical store", e);
        }

        Map<String, CanonicalEntity> latest = new LinkedHashMap<>();
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            CanonicalEntity entity = parse(line, path + ":" + lineNumber);
            latest.merge(entity.id(), entity,
                    (kept, read) -> read.revision() >= kept.revision() ? read : kept);
        }
        latest.values().forEach(entities::restore);
        compact(new ArrayList<>(latest.values()), lines.size());
        log.info("Canonical store loaded: path={}, entities={}, lines={}", path, latest.size(), lines.size());
    }

    private void compact(List<CanonicalEntity> snapshot, int lineCount) {
        if (snapshot.size() == lineCount) {
            return;
        }
        snapshot.sort(Comparator.comparing(CanonicalEntity::id));
        List<String> lines = new ArrayList<>(snapshot.size());
        snapshot.forEach(entity -> lines.add(serialize(entity)));
        Path compacted = path.resolveSibling(path.getFileName() + ".compact");
        try {
            Files.write(compacted, lines, StandardCharsets.UTF_8);
            Files.move(compacted, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            // The uncompacted file is still complete
            log.warn("Canonical store compaction failed: path={}", path, e);
        }
    }

    private CanonicalEntity parse(String line, String location) {
        try {
            return objectMapper.readValue(line, CanonicalEntity.class);
        } catch (IOException | RuntimeException e) {
            throw new StoreCorruptionException(location, "Unreadable canonical entity", e);
        }
    }

    private String serialize(CanonicalEntity entity) {
        try {
            return objectMapper.writeValueAsString(entity);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize entity: " + entity.id(), e);
        }
    }

    private void ensureOpen() throws IOException {
        if (writer != null) {
            return;
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        writer = new BufferedWriter(new OutputStreamWriter(Channels.newOutputStream(channel), StandardCharsets.UTF_8));
    }

    @Override
    public void close() {
        writeLock.lock();
        try {
            if (writer != null) {
                writer.close();
                writer = null;
                channel = null;
            }
        } catch (IOException e) {
            log.warn("Error closing canonical store: path={}", path, e);
        } finally {
            writeLock.unlock();
        }
    }
}
