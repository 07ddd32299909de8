package fr.lapetina.mesh.coordinator.domain.model;

import java.util.Locale;

public enum RoutingPolicyType {
    LOCAL_FIRST,
    PERFORMANCE_BASED,
    COST_OPTIMIZED;

    /**
     * Parses a policy tag, accepting both {@code local-first} and {@code LOCAL_FIRST}.
     */
    public static RoutingPolicyType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return LOCAL_FIRST;
        }
        return valueOf(tag.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
