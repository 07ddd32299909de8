package fr.lapetina.mesh.coordinator.scheduler;

/**
 * Receives the outcome of every dispatch attempt that left the ring.
 *
 * Called from transport callback threads; implementations must be thread-safe
 * and must release the node slot reserved for the attempt.
 */
@FunctionalInterface
public interface DispatchResultListener {

    void onDispatchResult(DispatchResult result);
}
