package fr.lapetina.mesh.coordinator.domain.model;

/**
 * Load metrics reported by a node with its heartbeat.
 */
public record NodeMetrics(
        double cpuPercent,
        double memoryPercent,
        int reportedActiveTasks
) {
    public static NodeMetrics empty() {
        return new NodeMetrics(0.0, 0.0, 0);
    }
}
