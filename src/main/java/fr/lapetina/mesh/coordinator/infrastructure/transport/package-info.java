/**
 * Messaging with remote nodes.
 *
 * <p>{@link fr.lapetina.mesh.coordinator.infrastructure.transport.Transport} is the only
 * outbound seam: probes, task dispatch, abort signals and routed service calls all go through
 * {@code send(node, message, timeout)}. Inbound traffic (heartbeats, forwarded offline
 * operations) arrives through the HTTP API instead.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.mesh.coordinator.infrastructure.transport.HttpTransport} - java.net.http implementation</li>
 *   <li>{@link fr.lapetina.mesh.coordinator.infrastructure.transport.CircuitBreaker} - Per-endpoint breaker used by the router</li>
 * </ul>
 */
package fr.lapetina.mesh.coordinator.infrastructure.transport;
