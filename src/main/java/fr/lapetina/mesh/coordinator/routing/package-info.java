/**
 * Health-aware routing with failover.
 *
 * <p>{@link fr.lapetina.mesh.coordinator.routing.ConnectionRouter} turns a route
 * template into an ordered candidate list using the policies of
 * {@link fr.lapetina.mesh.coordinator.domain.routing}, then walks that list for
 * each call: one attempt per candidate, bounded by the request window, with a
 * circuit breaker per endpoint.
 */
package fr.lapetina.mesh.coordinator.routing;
