/**
 * Storage services consumed by the offline queue and the sync engine.
 *
 * <ul>
 *   <li>{@link fr.lapetina.mesh.coordinator.infrastructure.store.OfflineLogStore} - durable append-only log,
 *       implemented as JSON lines by {@link fr.lapetina.mesh.coordinator.infrastructure.store.FileOfflineLogStore}</li>
 *   <li>{@link fr.lapetina.mesh.coordinator.infrastructure.store.CanonicalStore} - versioned entity state with
 *       per-entity locks, implemented by {@link fr.lapetina.mesh.coordinator.infrastructure.store.InMemoryCanonicalStore}</li>
 * </ul>
 */
package fr.lapetina.mesh.coordinator.infrastructure.store;
