/**
 * Reconciliation of offline operations with canonical state.
 *
 * <h2>Apply Path</h2>
 * <pre>
 * lock(entity) -> skip if sequence already applied
 *              -> covered by causal past?  yes: FAST_FORWARD
 *                                          no:  FIELD_MERGE through the merge table
 *              -> delete racing an update: pending review (CONFLICTED)
 * </pre>
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.mesh.coordinator.sync.SyncEngine} - Locking, idempotent replay, reviews and halt state</li>
 *   <li>{@link fr.lapetina.mesh.coordinator.sync.ConflictResolver} - Pure successor computation for one operation</li>
 * </ul>
 */
package fr.lapetina.mesh.coordinator.sync;
