/**
 * Task distribution: priority queue, assign loop and the dispatch ring.
 *
 * <h2>Task Lifecycle</h2>
 * <pre>
 * QUEUED → ASSIGNED → RUNNING → SUCCEEDED
 *    ^                    |
 *    +-- backoff ---------+ (transient failure, retries left)
 *                         |
 *                         +→ DEAD_LETTERED (retries exhausted)
 *                         +→ FAILED (permanent failure or deadline)
 * </pre>
 * <p>Any non-terminal task may be CANCELLED.
 *
 * <h2>Pipeline Stages</h2>
 * <p>Assignments go through an LMAX Disruptor ring:
 * <pre>
 * Dispatch → Metrics → Completion
 * </pre>
 * A full ring leaves the task queued; it is not counted as a retry.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.mesh.coordinator.scheduler.TaskDistributor} - Queue, assign loop, retries, cancellation</li>
 *   <li>{@link fr.lapetina.mesh.coordinator.scheduler.DispatchPipeline} - Bounded dispatch ring</li>
 *   <li>{@link fr.lapetina.mesh.coordinator.scheduler.exception.BackpressureException} - Queue, ring or offline log full</li>
 * </ul>
 *
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.mesh.coordinator.scheduler;
