package fr.lapetina.mesh.coordinator.infrastructure.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.mesh.coordinator.domain.model.OfflineOperation;
import fr.lapetina.mesh.coordinator.domain.model.OperationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * JSON-lines implementation of the offline log. One entry per line, either
 * an operation or a state marker. Every append is flushed and forced to disk
 * before it returns.
 */
public final class FileOfflineLogStore implements OfflineLogStore {

    private static final Logger log = LoggerFactory.getLogger(FileOfflineLogStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();
    private FileChannel channel;
    private BufferedWriter writer;

    public FileOfflineLogStore(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public FileOfflineLogStore(Path path) {
        this(path, Clock.systemUTC());
    }

    @Override
    public void append(OfflineOperation operation) {
        write(LogEntry.operation(operation));
    }

    @Override
    public void appendState(String operationId, OperationState state) {
        write(LogEntry.marker(operationId, state, clock.instant()));
    }

    private void write(LogEntry entry) {
        String line;
        try {
            line = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize log entry: " + entry, e);
        }
        writeLock.lock();
        try {
            ensureOpen();
            writer.write(line);
            writer.newLine();
            writer.flush();
            channel.force(false);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to offline log: " + path, e);
        } finally {
            writeLock.unlock();
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
    public List<OfflineOperation> recover() {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read offline log: " + path, e);
        }

        Map<String, OfflineOperation> operations = new LinkedHashMap<>();
        Map<String, Long> lastSequence = new HashMap<>();
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            String location = path + ":" + lineNumber;
            LogEntry entry = parse(line, location);
            if (entry.operation() != null) {
                OfflineOperation operation = entry.operation();
                long expected = lastSequence.getOrDefault(operation.originNode(), 0L) + 1;
                if (operation.sequence() != expected) {
                    throw new StoreCorruptionException(location, "Sequence gap for origin " + operation.originNode()
                            + ": expected " + expected + " but found " + operation.sequence());
                }
                lastSequence.put(operation.originNode(), operation.sequence());
                operations.put(operation.id(), operation);
            } else if (entry.operationId() != null && entry.state() != null) {
                OfflineOperation operation = operations.get(entry.operationId());
                if (operation == null) {
                    throw new StoreCorruptionException(location, "State marker for unknown operation " + entry.operationId());
                }
                operations.put(operation.id(), operation.withState(entry.state()));
            } else {
                throw new StoreCorruptionException(location, "Entry is neither an operation nor a state marker");
            }
        }
        log.info("Offline log recovered: path={}, operations={}, origins={}", path, operations.size(), lastSequence.size());
        return new ArrayList<>(operations.values());
    }

    private LogEntry parse(String line, String location) {
        try {
            return objectMapper.readValue(line, LogEntry.class);
        } catch (IOException | RuntimeException e) {
            throw new StoreCorruptionException(location, "Unreadable log entry", e);
        }
    }

    public Path getPath() {
        return path;
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
            log.warn("Error closing offline log: path={}", path, e);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * One line of the log. Exactly one of {@code operation} or
     * ({@code operationId}, {@code state}) is set.
     */
    record LogEntry(OfflineOperation operation, String operationId, OperationState state, Instant at) {

        static LogEntry operation(OfflineOperation operation) {
            return new LogEntry(operation, null, null, null);
        }

        static LogEntry marker(String operationId, OperationState state, Instant at) {
            return new LogEntry(null, operationId, state, at);
        }
    }
}
