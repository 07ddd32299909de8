/**
 * Field-level merge functions used by the conflict resolver.
 *
 * <ul>
 *   <li>{@code SCALAR} - {@link fr.lapetina.mesh.coordinator.domain.merge.LastWriterWinsMerge}</li>
 *   <li>{@code SET} - {@link fr.lapetina.mesh.coordinator.domain.merge.SetUnionMerge}</li>
 *   <li>{@code COUNTER} - {@link fr.lapetina.mesh.coordinator.domain.merge.MaxCounterMerge}</li>
 * </ul>
 */
package fr.lapetina.mesh.coordinator.domain.merge;
