package fr.lapetina.mesh.coordinator.infrastructure.store;

import fr.lapetina.mesh.coordinator.domain.model.CanonicalEntity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Canonical store kept in memory, one {@link ReentrantLock} per entity.
 */
public final class InMemoryCanonicalStore implements CanonicalStore {

    private final Map<String, CanonicalEntity> entities = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public Optional<CanonicalEntity> get(String entityId) {
        return Optional.ofNullable(entities.get(entityId));
    }

    @Override
    public Optional<EntityLock> lock(String entityId, Duration timeout) {
        ReentrantLock lock = locks.computeIfAbsent(entityId, id -> new ReentrantLock());
        try {
            if (!lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return Optional.empty();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
        return Optional.of(new HeldLock(entityId, lock));
    }

    @Override
    public void put(CanonicalEntity entity, long expectedRevision) {
        ReentrantLock lock = locks.get(entity.id());
        if (lock == null || !lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Entity lock not held: " + entity.id());
        }
        CanonicalEntity current = entities.get(entity.id());
        long currentRevision = current != null ? current.revision() : 0L;
        if (currentRevision != expectedRevision) {
            throw new IllegalStateException("Revision moved for " + entity.id()
                    + ": expected " + expectedRevision + " but was " + currentRevision);
        }
        entities.put(entity.id(), entity);
    }

    @Override
    public List<CanonicalEntity> all() {
        return new ArrayList<>(entities.values());
    }

    /**
     * Seeds an entity read back from durable storage, without locking.
     */
    void restore(CanonicalEntity entity) {
        entities.put(entity.id(), entity);
    }

    private record HeldLock(String entityId, ReentrantLock lock) implements EntityLock {

        @Override
        public void close() {
            lock.unlock();
        }
    }
}
