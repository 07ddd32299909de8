package fr.lapetina.mesh.coordinator.offline;

/**
 * Why the drain loop woke up.
 */
public enum DrainSignal {
    RECOVERY,
    RECONNECTED,
    ENQUEUED,
    MANUAL
}
