/**
 * Durable queue of writes captured while disconnected.
 *
 * <h2>Log Layout</h2>
 * <p>One JSON object per line: either a full operation or a state marker
 * referring to an operation id. A restart folds markers into their operations
 * and requeues everything not yet APPLIED, CONFLICTED or RESOLVED.
 *
 * <h2>Drain Triggers</h2>
 * <ul>
 *   <li>RECONNECTED of an authoritative node</li>
 *   <li>a new write while an authoritative node is reachable</li>
 *   <li>the periodic sync interval</li>
 *   <li>an operator request</li>
 * </ul>
 */
package fr.lapetina.mesh.coordinator.offline;
