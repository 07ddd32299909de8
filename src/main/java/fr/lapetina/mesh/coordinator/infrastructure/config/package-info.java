/**
 * Configuration loading and hot-reload support.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.mesh.coordinator.infrastructure.config.CoordinatorConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.mesh.coordinator.infrastructure.config.ConfigLoader} - YAML loading, validation and file watching</li>
 *   <li>{@link fr.lapetina.mesh.coordinator.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings</li>
 *   <li>{@code identity} - Local node id, role and transport credential</li>
 *   <li>{@code nodes} - Seed nodes registered at startup</li>
 *   <li>{@code routes} - Route templates per service</li>
 *   <li>{@code health} - Probe cycle, miss thresholds, TTL and circuit breakers</li>
 *   <li>{@code scheduler} - Task queue, assign loop and ring buffer</li>
 *   <li>{@code retry} - Retry and backoff policy</li>
 *   <li>{@code offline} - Offline log and drain settings</li>
 *   <li>{@code sync} - Field merge types</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * <p>Only route templates, merge types and the healthy threshold are applied on hot reload;
 * other sections take effect on restart.
 */
package fr.lapetina.mesh.coordinator.infrastructure.config;
