package fr.lapetina.mesh.coordinator.domain.model;

import java.time.Instant;

/**
 * Rolling health observation for a node. Feeds both registry transitions and
 * router ordering. Immutable; each observation produces a new record.
 */
public record HealthRecord(
        String nodeId,
        double latencyMs,
        double successRate,
        Instant lastCheck,
        long samples
) {
    // Exponential moving average weight for the newest sample
    private static final double ALPHA = 0.3;

    public static HealthRecord initial(String nodeId) {
        return new HealthRecord(nodeId, 0.0, 1.0, null, 0);
    }

    public boolean hasSamples() {
        return samples > 0;
    }

    public HealthRecord withSuccess(long observedLatencyMs, Instant at) {
        double latency = samples == 0
                ? observedLatencyMs
                : ALPHA * observedLatencyMs + (1 - ALPHA) * latencyMs;
        double rate = samples == 0 ? 1.0 : ALPHA + (1 - ALPHA) * successRate;
        return new HealthRecord(nodeId, latency, rate, at, samples + 1);
    }

    public HealthRecord withFailure(Instant at) {
        double rate = samples == 0 ? 0.0 : (1 - ALPHA) * successRate;
        return new HealthRecord(nodeId, latencyMs, rate, at, samples + 1);
    }
}
