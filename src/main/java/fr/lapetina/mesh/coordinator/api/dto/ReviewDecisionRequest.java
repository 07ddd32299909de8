package fr.lapetina.mesh.coordinator.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import fr.lapetina.mesh.coordinator.domain.model.ReviewDecision;

import java.util.Locale;

/**
 * Body of {@code POST /sync/reviews/{id}/resolve}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReviewDecisionRequest {

    private String decision;

    public String getDecision() { return decision; }
    public void setDecision(String decision) { this.decision = decision; }

    /**
     * @throws IllegalArgumentException if the decision is missing or unknown
     */
    public ReviewDecision toDecision() {
        if (decision == null || decision.isBlank()) {
            throw new IllegalArgumentException("Missing 'decision' field");
        }
        return ReviewDecision.valueOf(decision.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
