package fr.lapetina.mesh.coordinator.sync;

/**
 * A pending review could not be settled. The review stays open.
 */
public final class ConflictUnresolvedException extends RuntimeException {

    private final String reviewId;

    public ConflictUnresolvedException(String reviewId, String message) {
        super("Review " + reviewId + " unresolved: " + message);
        this.reviewId = reviewId;
    }

    public String getReviewId() {
        return reviewId;
    }
}
