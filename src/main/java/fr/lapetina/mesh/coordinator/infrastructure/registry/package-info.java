/**
 * Worker registry and health monitoring.
 *
 * <h2>Status Transitions</h2>
 * <pre>
 * ONLINE --(missThresholdDegraded misses)--> DEGRADED --(missThresholdOffline misses)--> OFFLINE
 *   ^                                                                                      |
 *   +---------------------------- heartbeat / successful probe ---------------------------+
 * </pre>
 * <p>Only an explicit hard disconnect moves a node from ONLINE straight to OFFLINE.
 * OFFLINE back to ONLINE is published as {@code RECONNECTED}.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.mesh.coordinator.infrastructure.registry.WorkerRegistry} - Node map, health records, node event log</li>
 *   <li>{@link fr.lapetina.mesh.coordinator.infrastructure.registry.HealthMonitor} - Probe cycle, TTL expiry and event pruning</li>
 * </ul>
 */
package fr.lapetina.mesh.coordinator.infrastructure.registry;
