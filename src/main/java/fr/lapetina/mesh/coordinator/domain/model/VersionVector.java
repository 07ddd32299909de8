package fr.lapetina.mesh.coordinator.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable vector clock: origin node id to counter.
 *
 * Missing origins count as zero. Serialized as a plain JSON object.
 */
public final class VersionVector {

    private static final VersionVector EMPTY = new VersionVector(Map.of());

    /**
     * Causal relation of this vector to another.
     */
    public enum Ordering {
        BEFORE,
        AFTER,
        EQUAL,
        CONCURRENT
    }

    private final Map<String, Long> counters;

    private VersionVector(Map<String, Long> counters) {
        this.counters = Collections.unmodifiableMap(new TreeMap<>(counters));
    }

    @JsonCreator
    static VersionVector fromJson(Map<String, Long> counters) {
        return of(counters);
    }

    public static VersionVector of(Map<String, ? extends Number> counters) {
        if (counters == null || counters.isEmpty()) {
            return EMPTY;
        }
        Map<String, Long> copy = new TreeMap<>();
        counters.forEach((origin, value) -> {
            long counter = value != null ? value.longValue() : 0L;
            if (counter < 0) {
                throw new IllegalArgumentException("Negative counter for origin " + origin);
            }
            if (counter > 0) {
                copy.put(origin, counter);
            }
        });
        return new VersionVector(copy);
    }

    public static VersionVector empty() {
        return EMPTY;
    }

    @JsonValue
    public Map<String, Long> asMap() {
        return counters;
    }

    public long get(String origin) {
        return counters.getOrDefault(origin, 0L);
    }

    public boolean isEmpty() {
        return counters.isEmpty();
    }

    /**
     * Pointwise maximum.
     */
    public VersionVector merge(VersionVector other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        Map<String, Long> merged = new TreeMap<>(counters);
        other.counters.forEach((origin, value) -> merged.merge(origin, value, Math::max));
        return new VersionVector(merged);
    }

    public VersionVector increment(String origin) {
        Map<String, Long> next = new TreeMap<>(counters);
        next.merge(origin, 1L, Long::sum);
        return new VersionVector(next);
    }

    /**
     * Raises the counter of one origin to at least {@code value}.
     */
    public VersionVector advance(String origin, long value) {
        if (get(origin) >= value) {
            return this;
        }
        Map<String, Long> next = new TreeMap<>(counters);
        next.put(origin, value);
        return new VersionVector(next);
    }

    public Ordering compare(VersionVector other) {
        boolean less = false;
        boolean greater = false;
        Set<String> origins = new HashSet<>(counters.keySet());
        origins.addAll(other.counters.keySet());
        for (String origin : origins) {
            long mine = get(origin);
            long theirs = other.get(origin);
            if (mine < theirs) {
                less = true;
            } else if (mine > theirs) {
                greater = true;
            }
        }
        if (less && greater) {
            return Ordering.CONCURRENT;
        }
        if (less) {
            return Ordering.BEFORE;
        }
        if (greater) {
            return Ordering.AFTER;
        }
        return Ordering.EQUAL;
    }

    /**
     * True if every change in this vector is also contained in {@code other}.
     */
    public boolean isCoveredBy(VersionVector other) {
        Ordering ordering = compare(other);
        return ordering == Ordering.BEFORE || ordering == Ordering.EQUAL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return counters.equals(((VersionVector) o).counters);
    }

    @Override
    public int hashCode() {
        return counters.hashCode();
    }

    @Override
    public String toString() {
        return counters.toString();
    }
}
