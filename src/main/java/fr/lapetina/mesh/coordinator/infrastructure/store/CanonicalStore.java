package fr.lapetina.mesh.coordinator.infrastructure.store;

import fr.lapetina.mesh.coordinator.domain.model.CanonicalEntity;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative entity state with per-entity locking.
 *
 * A read-modify-write is: {@link #lock} the entity, {@link #get} it, then
 * {@link #put} the successor with the revision that was read. Different
 * entities never contend.
 */
public interface CanonicalStore extends AutoCloseable {

    Optional<CanonicalEntity> get(String entityId);

    /**
     * Acquires the lock of one entity.
     *
     * @return the held lock, or empty if it could not be acquired within the timeout
     */
    Optional<EntityLock> lock(String entityId, Duration timeout);

    /**
     * Stores a new version of an entity. The caller must hold the entity lock.
     *
     * @param expectedRevision revision the update was computed from
     * @throws IllegalStateException if the lock is not held or the revision moved
     */
    void put(CanonicalEntity entity, long expectedRevision);

    List<CanonicalEntity> all();

    /**
     * Releases files held by the store. Stores kept in memory hold none.
     */
    @Override
    default void close() {
    }

    /**
     * A held entity lock. Closing releases it.
     */
    interface EntityLock extends AutoCloseable {

        String entityId();

        @Override
        void close();
    }
}
