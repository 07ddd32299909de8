/**
 * Routing policies used by the connection router to order route candidates.
 *
 * <h2>Available Policies</h2>
 * <table border="1">
 *   <tr><th>Policy</th><th>Order</th></tr>
 *   <tr><td>{@code local-first}</td><td>Healthy local/edge candidates, then template chain</td></tr>
 *   <tr><td>{@code performance-based}</td><td>Latency ascending, success rate descending</td></tr>
 *   <tr><td>{@code cost-optimized}</td><td>Cost ascending</td></tr>
 * </table>
 *
 * <h2>Custom Policies</h2>
 * <p>Implement {@link fr.lapetina.mesh.coordinator.domain.routing.RoutingPolicy} and register
 * with {@link fr.lapetina.mesh.coordinator.domain.routing.PolicyFactory}.
 */
package fr.lapetina.mesh.coordinator.domain.routing;
