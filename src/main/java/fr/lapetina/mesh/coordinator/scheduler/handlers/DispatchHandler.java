package fr.lapetina.mesh.coordinator.scheduler.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.mesh.coordinator.domain.event.TaskDispatchEvent;
import fr.lapetina.mesh.coordinator.domain.model.Node;
import fr.lapetina.mesh.coordinator.domain.model.Task;
import fr.lapetina.mesh.coordinator.infrastructure.transport.Transport;
import fr.lapetina.mesh.coordinator.infrastructure.transport.TransportMessage;
import fr.lapetina.mesh.coordinator.infrastructure.transport.TransportReply;
import fr.lapetina.mesh.coordinator.scheduler.DispatchResult;
import fr.lapetina.mesh.coordinator.scheduler.DispatchResultListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * First stage handler: sends the task to the node it was assigned to.
 *
 * The transport call is asynchronous. The reply is handed to the
 * {@link DispatchResultListener} from the future callback, after the event has
 * been recycled, so everything the callback needs is copied out of the event
 * first.
 */
public final class DispatchHandler implements EventHandler<TaskDispatchEvent> {

    private static final Logger log = LoggerFactory.getLogger(DispatchHandler.class);

    private final Transport transport;
    private final DispatchResultListener resultListener;
    private final Duration dispatchTimeout;
    private final Clock clock;

    public DispatchHandler(
            Transport transport,
            DispatchResultListener resultListener,
            Duration dispatchTimeout,
            Clock clock
    ) {
        this.transport = transport;
        this.resultListener = resultListener;
        this.dispatchTimeout = dispatchTimeout;
        this.clock = clock;
    }

    @Override
    public void onEvent(TaskDispatchEvent event, long sequence, boolean endOfBatch) {
        Task task = event.getTask();
        Node node = event.getNode();
        int attempt = event.getAttempt();
        if (task == null || node == null) {
            return;
        }

        // Cancelled or requeued while waiting in the ring
        if (!task.markRunning(attempt, clock.instant())) {
            node.release();
            event.markSkipped("Task no longer assigned: status=" + task.getStatus());
            log.debug("Dispatch skipped: taskId={}, attempt={}, status={}", task.getId(), attempt, task.getStatus());
            return;
        }
        event.markDispatched(clock.instant());

        MDC.put("taskId", task.getId());
        MDC.put("nodeId", node.getId());
        try {
            dispatch(task, node, attempt);
        } finally {
            MDC.remove("taskId");
            MDC.remove("nodeId");
        }
    }

    private void dispatch(Task task, Node node, int attempt) {
        log.info("Dispatching task: taskId={}, type={}, nodeId={}, attempt={}, timeoutMs={}",
                task.getId(), task.getType(), node.getId(), attempt, dispatchTimeout.toMillis());

        long start = System.nanoTime();
        CompletableFuture<TransportReply> future;
        try {
            future = transport.send(node, TransportMessage.dispatch(task.getId(), body(task, attempt)), dispatchTimeout);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        future
                .orTimeout(dispatchTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((reply, throwable) -> {
                    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                    Throwable error = throwable != null ? Transport.unwrap(throwable) : null;
                    resultListener.onDispatchResult(new DispatchResult(task, node, attempt, reply, error, latencyMs));
                });
    }

    private static Map<String, Object> body(Task task, int attempt) {
        Map<String, Object> body = new HashMap<>();
        body.put("taskId", task.getId());
        body.put("idempotencyKey", task.getIdempotencyKey());
        body.put("type", task.getType());
        body.put("payload", task.getPayload());
        body.put("attempt", attempt);
        if (task.getDeadline() != null) {
            body.put("deadline", task.getDeadline().toString());
        }
        return body;
    }
}
