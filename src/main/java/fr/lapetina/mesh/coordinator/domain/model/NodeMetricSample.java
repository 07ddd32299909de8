package fr.lapetina.mesh.coordinator.domain.model;

import java.time.Instant;

/**
 * Metrics a node reported at one point in time.
 */
public record NodeMetricSample(String nodeId, NodeMetrics metrics, Instant recordedAt) {
}
