/**
 * Mesh Coordinator - coordination layer for a fleet of cloud, edge and client nodes.
 *
 * <p>Tracks worker liveness, distributes tasks to capable nodes through an LMAX
 * Disruptor dispatch ring, routes service calls along local-first fallback
 * chains, and replays writes captured while disconnected into canonical state
 * with vector-clock conflict resolution.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.mesh.coordinator.CoordinatorFactory} - Wires every component
 *       from YAML configuration</li>
 *   <li>{@link fr.lapetina.mesh.coordinator.MeshCoordinatorApplication} - Standalone HTTP server</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (CoordinatorFactory factory = CoordinatorFactory.create("config.yaml").start()) {
 *     TaskDistributor distributor = factory.getTaskDistributor();
 *
 *     String taskId = distributor.submit(TaskSubmission.of("job-42", "image.resize", Set.of("gpu")));
 *     TaskView done = distributor.completion(taskId).orElseThrow().get();
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Heartbeat and probe based health with DEGRADED and OFFLINE thresholds</li>
 *   <li>Priority scheduling with aging, retries with backoff and a dead-letter list</li>
 *   <li>Local-first, performance-based and cost-optimized routing with circuit breakers</li>
 *   <li>Durable offline log with ordered replay after restart</li>
 *   <li>Field-level merge of concurrent writes, operator review for delete conflicts</li>
 *   <li>Hot-reload configuration and Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.mesh.coordinator.CoordinatorFactory
 * @see fr.lapetina.mesh.coordinator.scheduler.TaskDistributor
 */
package fr.lapetina.mesh.coordinator;
