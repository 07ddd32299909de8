package fr.lapetina.mesh.coordinator.domain.event;

/**
 * Lifecycle state of a dispatch event in the Disruptor pipeline.
 */
public enum DispatchState {
    /** Published, waiting for the dispatch stage */
    CREATED,

    /** Message sent to the node; the reply is handled asynchronously */
    DISPATCHED,

    /** Task was cancelled or superseded before it could be sent */
    SKIPPED,

    /** The message could not be handed to the transport */
    FAILED
}
