package fr.lapetina.mesh.coordinator.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A unit of work tracked by the distributor.
 *
 * State transitions are synchronized on the task. Each assignment bumps the
 * attempt number; completions carry the attempt they belong to so a late
 * result from a superseded assignment is ignored. A task therefore has at most
 * one active assignment at a time.
 */
public final class Task {

    private final String id;
    private final String idempotencyKey;
    private final String type;
    private final Map<String, Object> payload;
    private final Set<String> requiredCapabilities;
    private final int priority;
    private final long sequence;
    private final Instant createdAt;
    private final Instant deadline;

    private volatile TaskStatus status = TaskStatus.QUEUED;
    private volatile String assignedNodeId;
    private volatile int attempt;
    private volatile int retryCount;
    private volatile Instant nextEligibleAt;
    private volatile Instant updatedAt;
    private volatile Map<String, Object> result = Map.of();
    private volatile ErrorType errorType;
    private volatile String errorMessage;
    private volatile String waitingReason;

    public Task(TaskSubmission submission, long sequence, Instant createdAt) {
        Objects.requireNonNull(submission, "Submission is required");
        this.id = UUID.randomUUID().toString();
        this.idempotencyKey = submission.idempotencyKey();
        this.type = submission.type();
        this.payload = submission.payload();
        this.requiredCapabilities = submission.requiredCapabilities();
        this.priority = submission.priority();
        this.sequence = sequence;
        this.createdAt = createdAt;
        this.deadline = submission.deadline();
        this.nextEligibleAt = createdAt;
        this.updatedAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public Set<String> getRequiredCapabilities() {
        return requiredCapabilities;
    }

    public int getPriority() {
        return priority;
    }

    public long getSequence() {
        return sequence;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public String getAssignedNodeId() {
        return assignedNodeId;
    }

    public int getAttempt() {
        return attempt;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public Instant getNextEligibleAt() {
        return nextEligibleAt;
    }

    public Map<String, Object> getResult() {
        return result;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getWaitingReason() {
        return waitingReason;
    }

    public void setWaitingReason(String waitingReason) {
        this.waitingReason = waitingReason;
    }

    /**
     * Priority used for ordering. Every full {@code maxWait} spent queued adds
     * {@code escalationStep} to the submitted priority.
     */
    public int effectivePriority(Instant now, Duration maxWait, int escalationStep) {
        if (maxWait == null || maxWait.isZero() || maxWait.isNegative() || escalationStep <= 0) {
            return priority;
        }
        long waitedMs = Duration.between(createdAt, now).toMillis();
        long steps = waitedMs / maxWait.toMillis();
        return (int) Math.min(Integer.MAX_VALUE, priority + steps * escalationStep);
    }

    public boolean isReady(Instant now) {
        return status == TaskStatus.QUEUED && !now.isBefore(nextEligibleAt);
    }

    public boolean isPastDeadline(Instant now) {
        return deadline != null && now.isAfter(deadline);
    }

    /**
     * QUEUED -> ASSIGNED.
     *
     * @return the new attempt number, or -1 if the task was not queued
     */
    public synchronized int assign(String nodeId, Instant now) {
        if (status != TaskStatus.QUEUED) {
            return -1;
        }
        status = TaskStatus.ASSIGNED;
        assignedNodeId = nodeId;
        waitingReason = null;
        updatedAt = now;
        return ++attempt;
    }

    /**
     * ASSIGNED -> RUNNING for the given attempt.
     */
    public synchronized boolean markRunning(int forAttempt, Instant now) {
        if (attempt != forAttempt || status != TaskStatus.ASSIGNED) {
            return false;
        }
        status = TaskStatus.RUNNING;
        updatedAt = now;
        return true;
    }

    /**
     * Returns an assigned task to the queue without counting a retry, used
     * when the dispatch ring is full.
     */
    public synchronized boolean unassign(int forAttempt, Instant now) {
        if (attempt != forAttempt || status != TaskStatus.ASSIGNED) {
            return false;
        }
        status = TaskStatus.QUEUED;
        assignedNodeId = null;
        updatedAt = now;
        return true;
    }

    /**
     * Active -> SUCCEEDED.
     */
    public synchronized boolean succeed(int forAttempt, Map<String, Object> output, Instant now) {
        if (attempt != forAttempt || !status.isActive()) {
            return false;
        }
        status = TaskStatus.SUCCEEDED;
        result = output != null ? Collections.unmodifiableMap(new LinkedHashMap<>(output)) : Map.of();
        errorType = null;
        errorMessage = null;
        updatedAt = now;
        return true;
    }

    /**
     * Active or queued -> FAILED. Terminal.
     */
    public synchronized boolean fail(int forAttempt, ErrorType type, String message, Instant now) {
        if (status.isTerminal() || (status.isActive() && attempt != forAttempt)) {
            return false;
        }
        status = TaskStatus.FAILED;
        errorType = type;
        errorMessage = message;
        updatedAt = now;
        return true;
    }

    /**
     * Active -> QUEUED after a transient failure, with the retry counted.
     */
    public synchronized boolean retryAt(int forAttempt, Instant eligibleAt, String message, Instant now) {
        if (attempt != forAttempt || !status.isActive()) {
            return false;
        }
        retryCount++;
        status = TaskStatus.QUEUED;
        assignedNodeId = null;
        nextEligibleAt = eligibleAt;
        errorType = ErrorType.TRANSIENT_NETWORK;
        errorMessage = message;
        updatedAt = now;
        return true;
    }

    /**
     * Active -> DEAD_LETTERED once retries are exhausted. The retry count is
     * left at the number of retries actually made.
     */
    public synchronized boolean deadLetter(int forAttempt, String message, Instant now) {
        if (attempt != forAttempt || !status.isActive()) {
            return false;
        }
        status = TaskStatus.DEAD_LETTERED;
        errorType = ErrorType.TRANSIENT_NETWORK;
        errorMessage = message;
        updatedAt = now;
        return true;
    }

    /**
     * Any non-terminal state -> CANCELLED.
     *
     * @return the status before cancellation, or null if already terminal
     */
    public synchronized TaskStatus cancel(Instant now) {
        if (status.isTerminal()) {
            return null;
        }
        TaskStatus previous = status;
        status = TaskStatus.CANCELLED;
        updatedAt = now;
        return previous;
    }

    public TaskView toView() {
        return new TaskView(
                id, idempotencyKey, type, status, priority, assignedNodeId,
                retryCount, createdAt, updatedAt, deadline, result,
                errorType, errorMessage, waitingReason
        );
    }

    @Override
    public String toString() {
        return "Task{" +
                "id=" + id +
                ", key=" + idempotencyKey +
                ", status=" + status +
                ", priority=" + priority +
                ", node=" + assignedNodeId +
                ", retries=" + retryCount +
                '}';
    }
}
