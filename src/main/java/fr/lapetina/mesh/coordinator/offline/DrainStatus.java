package fr.lapetina.mesh.coordinator.offline;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of the offline queue.
 *
 * @param lastSequences highest logged sequence per origin
 * @param haltReason    why syncing stopped, null while running
 */
public record DrainStatus(
        int pending,
        long applied,
        long conflicted,
        int openReviews,
        Instant lastDrainAt,
        boolean draining,
        boolean halted,
        String haltReason,
        Map<String, Long> lastSequences
) {

    public DrainStatus {
        lastSequences = Map.copyOf(lastSequences);
    }
}
