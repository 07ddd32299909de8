package fr.lapetina.mesh.coordinator.infrastructure.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Circuit breaker of one route endpoint.
 *
 * <p>CLOSED lets calls through and counts consecutive failures; reaching the
 * threshold opens it. OPEN skips the endpoint until the cool-down has
 * elapsed, after which the next check moves it to HALF_OPEN. In HALF_OPEN a
 * failure reopens it and enough successes close it.
 *
 * <p>The whole state is one immutable {@link Snapshot} swapped by compare-and-set.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    /**
     * Point-in-time view of a breaker, as shown in the health snapshot.
     *
     * @param openedAt      when the breaker last opened, null if it never did
     * @param lastFailureAt when the endpoint last failed a call, null if it never did
     */
    public record Snapshot(String nodeId, State state, int consecutiveFailures, int halfOpenSuccesses,
                           Instant openedAt, Instant lastFailureAt) {

        Snapshot closed() {
            return new Snapshot(nodeId, State.CLOSED, 0, 0, openedAt, lastFailureAt);
        }

        Snapshot opened(Instant at) {
            return new Snapshot(nodeId, State.OPEN, consecutiveFailures, 0, at, lastFailureAt);
        }

        Snapshot halfOpen() {
            return new Snapshot(nodeId, State.HALF_OPEN, consecutiveFailures, 0, openedAt, lastFailureAt);
        }

        Snapshot failedAt(Instant at) {
            return new Snapshot(nodeId, state, consecutiveFailures + 1, halfOpenSuccesses, openedAt, at);
        }

        Snapshot succeeded() {
            return new Snapshot(nodeId, state, 0, halfOpenSuccesses + 1, openedAt, lastFailureAt);
        }
    }

    private final int failureThreshold;
    private final Duration coolDown;
    private final int successesToClose;
    private final Clock clock;
    private final AtomicReference<Snapshot> current;

    public CircuitBreaker(String nodeId, int failureThreshold, Duration coolDown, int successesToClose, Clock clock) {
        this.failureThreshold = failureThreshold;
        this.coolDown = coolDown;
        this.successesToClose = successesToClose;
        this.clock = clock;
        this.current = new AtomicReference<>(new Snapshot(nodeId, State.CLOSED, 0, 0, null, null));
    }

    /**
     * True unless the breaker is OPEN. An OPEN breaker whose cool-down has
     * elapsed moves to HALF_OPEN here.
     */
    public boolean allowRequest() {
        return refresh().state() != State.OPEN;
    }

    public void recordSuccess() {
        transition(s -> switch (s.state()) {
            case CLOSED -> s.consecutiveFailures() == 0 ? s : s.closed();
            case HALF_OPEN -> s.halfOpenSuccesses() + 1 >= successesToClose ? s.closed() : s.succeeded();
            case OPEN -> s;
        });
    }

    public void recordFailure() {
        Instant now = clock.instant();
        transition(s -> {
            Snapshot failed = s.failedAt(now);
            return switch (s.state()) {
                case CLOSED -> failed.consecutiveFailures() >= failureThreshold ? failed.opened(now) : failed;
                case HALF_OPEN -> failed.opened(now);
                case OPEN -> failed;
            };
        });
    }

    /**
     * Operator override: closes the breaker and clears its failure count.
     */
    public void reset() {
        Snapshot before = current.getAndUpdate(Snapshot::closed);
        log.info("Circuit breaker reset by operator: nodeId={}, previousState={}", before.nodeId(), before.state());
    }

    public State getState() {
        return refresh().state();
    }

    public Snapshot snapshot() {
        return refresh();
    }

    public int getConsecutiveFailures() {
        return current.get().consecutiveFailures();
    }

    private Snapshot refresh() {
        Instant now = clock.instant();
        return transition(s -> s.state() == State.OPEN && !now.isBefore(s.openedAt().plus(coolDown))
                ? s.halfOpen()
                : s);
    }

    private Snapshot transition(UnaryOperator<Snapshot> step) {
        Snapshot before;
        Snapshot after;
        do {
            before = current.get();
            after = step.apply(before);
        } while (after != before && !current.compareAndSet(before, after));

        if (after.state() != before.state()) {
            if (after.state() == State.OPEN) {
                log.warn("Circuit breaker OPEN: nodeId={}, failures={}, from={}",
                        after.nodeId(), after.consecutiveFailures(), before.state());
            } else {
                log.info("Circuit breaker {}: nodeId={}", after.state(), after.nodeId());
            }
        }
        return after;
    }
}
