package fr.lapetina.mesh.coordinator.domain.model;

import java.util.Comparator;

/**
 * Identifies the write that produced a field value.
 *
 * Stamps are totally ordered by (lamport, origin, sequence), which is the
 * last-writer-wins order.
 */
public record WriteStamp(String origin, long sequence, long lamport) implements Comparable<WriteStamp> {

    private static final Comparator<WriteStamp> ORDER = Comparator
            .comparingLong(WriteStamp::lamport)
            .thenComparing(WriteStamp::origin)
            .thenComparingLong(WriteStamp::sequence);

    public static WriteStamp of(OfflineOperation operation) {
        return new WriteStamp(operation.originNode(), operation.sequence(), operation.lamport());
    }

    /**
     * True if this write is part of the causal history described by {@code vector}.
     */
    public boolean isCoveredBy(VersionVector vector) {
        return vector.get(origin) >= sequence;
    }

    public String operationId() {
        return OfflineOperation.idFor(origin, sequence);
    }

    public static WriteStamp max(WriteStamp a, WriteStamp b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.compareTo(b) >= 0 ? a : b;
    }

    @Override
    public int compareTo(WriteStamp other) {
        return ORDER.compare(this, other);
    }
}
