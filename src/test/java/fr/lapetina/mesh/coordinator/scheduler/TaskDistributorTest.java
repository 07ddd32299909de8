package fr.lapetina.mesh.coordinator.scheduler;

import fr.lapetina.mesh.coordinator.domain.model.ErrorType;
import fr.lapetina.mesh.coordinator.domain.model.Node;
import fr.lapetina.mesh.coordinator.domain.model.NodeRole;
import fr.lapetina.mesh.coordinator.domain.model.Task;
import fr.lapetina.mesh.coordinator.domain.model.TaskStatus;
import fr.lapetina.mesh.coordinator.domain.model.TaskSubmission;
import fr.lapetina.mesh.coordinator.domain.model.TaskView;
import fr.lapetina.mesh.coordinator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mesh.coordinator.infrastructure.registry.WorkerRegistry;
import fr.lapetina.mesh.coordinator.infrastructure.transport.TransientNetworkException;
import fr.lapetina.mesh.coordinator.infrastructure.transport.TransportMessage;
import fr.lapetina.mesh.coordinator.infrastructure.transport.TransportReply;
import fr.lapetina.mesh.coordinator.scheduler.exception.BackpressureException;
import fr.lapetina.mesh.coordinator.scheduler.exception.PermanentTaskFailureException;
import fr.lapetina.mesh.coordinator.support.Await;
import fr.lapetina.mesh.coordinator.support.StubTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class TaskDistributorTest {

    private MetricsRegistry metrics;
    private WorkerRegistry registry;
    private StubTransport transport;
    private TaskDistributor distributor;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry();
        registry = new WorkerRegistry(Clock.systemUTC(), 3, 5, 0.8);
        transport = new StubTransport();
        distributor = builder().build();
    }

    @AfterEach
    void tearDown() {
        distributor.close();
        metrics.close();
    }

    private TaskDistributor.Builder builder() {
        return TaskDistributor.builder()
                .registry(registry)
                .transport(transport)
                .metricsRegistry(metrics)
                .ringBufferSize(64)
                .assignInterval(Duration.ofMillis(10))
                .dispatchTimeout(Duration.ofMillis(500))
                .maxRetries(2)
                .backoff(1, 2.0, 5);
    }

    private Node worker(String id, int maxConcurrency, String... capabilities) {
        Node node = Node.builder()
                .id(id)
                .address("http://" + id + ":9000")
                .role(NodeRole.EDGE)
                .capabilities(List.of(capabilities))
                .maxConcurrency(maxConcurrency)
                .build();
        return registry.register(node);
    }

    private static TaskSubmission task(String key, String... capabilities) {
        return TaskSubmission.of(key, "inference", Set.of(capabilities));
    }

    private TaskView await(String taskId) throws Exception {
        return distributor.completion(taskId).orElseThrow().get(5, TimeUnit.SECONDS);
    }

    @Nested
    @DisplayName("Submission")
    class Submission {

        @Test
        @DisplayName("should return the existing task id for a repeated idempotency key")
        void shouldBeIdempotent() {
            String first = distributor.submit(task("order-1"));
            String second = distributor.submit(task("order-1").withPriority(9));

            assertThat(second).isEqualTo(first);
            assertThat(distributor.queueSize()).isEqualTo(1);
            assertThat(distributor.getStatus(first)).map(TaskView::priority).contains(0);
        }

        @Test
        @DisplayName("should push back when the queue is full")
        void shouldRejectWhenQueueFull() {
            distributor.close();
            distributor = builder().queueCapacity(2).build();
            distributor.submit(task("a"));
            distributor.submit(task("b"));

            assertThatThrownBy(() -> distributor.submit(task("c")))
                    .isInstanceOf(BackpressureException.class)
                    .extracting(e -> ((BackpressureException) e).getReason())
                    .isEqualTo(BackpressureException.BackpressureReason.QUEUE_FULL);
        }

        @Test
        @DisplayName("should keep a task queued with a reason while no node can take it")
        void shouldWaitForCapableNode() {
            distributor.start();
            String taskId = distributor.submit(task("gpu-job", "gpu"));

            distributor.assignPending();

            TaskView view = distributor.getStatus(taskId).orElseThrow();
            assertThat(view.status()).isEqualTo(TaskStatus.QUEUED);
            assertThat(view.waitingReason()).contains("No registered node has capabilities");
        }

        @Test
        @DisplayName("should not assign before the distributor is started")
        void shouldNotAssignBeforeStart() {
            worker("worker-1", 1);
            distributor.submit(task("a"));

            assertThat(distributor.assignPending()).isZero();
            assertThat(transport.sent()).isEmpty();
        }

        @Test
        @DisplayName("should return empty for unknown task ids")
        void shouldHandleUnknownIds() {
            assertThat(distributor.getStatus("missing")).isEmpty();
            assertThat(distributor.completion("missing")).isEmpty();
            assertThat(distributor.cancel("missing")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Dispatch")
    class Dispatch {

        @Test
        @DisplayName("should dispatch to a capable node and complete with its result")
        void shouldSucceed() throws Exception {
            worker("cpu-1", 2);
            worker("gpu-1", 2, "gpu");
            transport.replyOk("gpu-1", Map.of("result", Map.of("answer", 42)));
            distributor.start();

            String taskId = distributor.submit(task("job-1", "gpu").withPayload(Map.of("prompt", "hi")));
            TaskView view = await(taskId);

            assertThat(view.status()).isEqualTo(TaskStatus.SUCCEEDED);
            assertThat(view.assignedNode()).isEqualTo("gpu-1");
            assertThat(view.result()).containsEntry("answer", 42);
            TransportMessage message = transport.sent(TransportMessage.Type.DISPATCH).get(0).message();
            assertThat(message.target()).isEqualTo(taskId);
            assertThat(message.body())
                    .containsEntry("idempotencyKey", "job-1")
                    .containsEntry("attempt", 1)
                    .containsEntry("payload", Map.of("prompt", "hi"));
            Await.until(() -> registry.getNode("gpu-1").orElseThrow().getActiveTasks() == 0);
        }

        @Test
        @DisplayName("should take higher priority tasks first")
        void shouldHonorPriority() throws Exception {
            distributor.start();
            String low = distributor.submit(task("low").withPriority(5));
            String high = distributor.submit(task("high").withPriority(10));

            worker("worker-1", 1);
            await(low);
            await(high);

            assertThat(transport.sent(TransportMessage.Type.DISPATCH))
                    .extracting(sent -> sent.message().target())
                    .containsExactly(high, low);
        }

        @Test
        @DisplayName("should never run more tasks on a node than its capacity")
        void shouldRespectCapacity() throws Exception {
            List<CompletableFuture<TransportReply>> pending = new CopyOnWriteArrayList<>();
            transport.when("worker-1", message -> {
                CompletableFuture<TransportReply> reply = new CompletableFuture<>();
                pending.add(reply);
                return reply;
            });
            worker("worker-1", 2);
            distributor.start();

            String a = distributor.submit(task("a"));
            String b = distributor.submit(task("b"));
            String c = distributor.submit(task("c"));
            Await.until(() -> pending.size() == 2);
            distributor.assignPending();

            assertThat(pending).hasSize(2);
            assertThat(distributor.queueSize()).isEqualTo(1);
            assertThat(registry.getNode("worker-1").orElseThrow().getActiveTasks()).isEqualTo(2);

            pending.get(0).complete(TransportReply.ok(Map.of()));
            Await.until(() -> pending.size() == 3);
            pending.forEach(reply -> reply.complete(TransportReply.ok(Map.of())));

            assertThat(List.of(await(a), await(b), await(c)))
                    .extracting(TaskView::status)
                    .containsOnly(TaskStatus.SUCCEEDED);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should retry transient failures and dead-letter once retries are exhausted")
        void shouldDeadLetter() throws Exception {
            worker("worker-1", 1);
            transport.unreachable("worker-1");
            distributor.start();

            String taskId = distributor.submit(task("flaky"));
            TaskView view = await(taskId);

            assertThat(view.status()).isEqualTo(TaskStatus.DEAD_LETTERED);
            assertThat(view.retryCount()).isEqualTo(2);
            assertThat(view.errorType()).isEqualTo(ErrorType.TRANSIENT_NETWORK);
            assertThat(transport.sent(TransportMessage.Type.DISPATCH)).hasSize(3);
            assertThat(distributor.deadLetters()).extracting(TaskView::taskId).containsExactly(taskId);
        }

        @Test
        @DisplayName("should succeed on a retry after a transient failure")
        void shouldRecoverOnRetry() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            transport.when("worker-1", message -> calls.incrementAndGet() == 1
                    ? CompletableFuture.failedFuture(new TransientNetworkException("worker-1", "reset"))
                    : CompletableFuture.completedFuture(TransportReply.ok(Map.of())));
            worker("worker-1", 1);
            distributor.start();

            TaskView view = await(distributor.submit(task("retry-once")));

            assertThat(view.status()).isEqualTo(TaskStatus.SUCCEEDED);
            assertThat(view.retryCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should fail permanently on a 4xx reply without retrying")
        void shouldFailPermanentlyOnClientError() {
            worker("worker-1", 1);
            transport.replyStatus("worker-1", 400);
            distributor.start();

            String taskId = distributor.submit(task("bad-input"));
            Throwable thrown = catchThrowable(() -> distributor.completion(taskId).orElseThrow().join());

            assertThat(thrown).isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(PermanentTaskFailureException.class);
            PermanentTaskFailureException failure = (PermanentTaskFailureException) thrown.getCause();
            assertThat(failure.getTaskId()).isEqualTo(taskId);
            assertThat(failure.getErrorType()).isEqualTo(ErrorType.PERMANENT_TASK_FAILURE);
            assertThat(transport.sent(TransportMessage.Type.DISPATCH)).hasSize(1);
            assertThat(distributor.getStatus(taskId).orElseThrow().status()).isEqualTo(TaskStatus.FAILED);
        }

        @Test
        @DisplayName("should fail permanently when the worker reports an unrecoverable error")
        void shouldFailOnReportedPermanentFailure() {
            worker("worker-1", 1);
            transport.replyOk("worker-1", Map.of("outcome", "permanent_failure", "error", "model missing"));
            distributor.start();

            String taskId = distributor.submit(task("no-model"));

            assertThatThrownBy(() -> distributor.completion(taskId).orElseThrow().join())
                    .hasCauseInstanceOf(PermanentTaskFailureException.class)
                    .hasMessageContaining("model missing");
        }

        @Test
        @DisplayName("should fail a task whose deadline passes while it is queued")
        void shouldFailPastDeadline() {
            distributor.start();
            String taskId = distributor.submit(task("late").withDeadline(Instant.now().minusSeconds(1)));

            distributor.assignPending();

            TaskView view = distributor.getStatus(taskId).orElseThrow();
            assertThat(view.status()).isEqualTo(TaskStatus.FAILED);
            assertThat(view.errorType()).isEqualTo(ErrorType.DEADLINE_EXCEEDED);
        }

        @Test
        @DisplayName("should requeue running tasks of a node that goes offline")
        void shouldRequeueOnNodeLoss() throws Exception {
            transport.hang("worker-1");
            worker("worker-1", 1);
            distributor.start();
            String taskId = distributor.submit(task("stranded"));
            Await.until(() -> distributor.getStatus(taskId).orElseThrow().status() == TaskStatus.RUNNING);

            registry.hardDisconnect("worker-1");
            worker("worker-2", 1);

            TaskView view = await(taskId);
            assertThat(view.status()).isEqualTo(TaskStatus.SUCCEEDED);
            assertThat(view.assignedNode()).isEqualTo("worker-2");
            assertThat(view.retryCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("should remove a queued task from the queue")
        void shouldCancelQueued() throws Exception {
            String taskId = distributor.submit(task("queued"));

            TaskView view = distributor.cancel(taskId).orElseThrow();

            assertThat(view.status()).isEqualTo(TaskStatus.CANCELLED);
            assertThat(distributor.queueSize()).isZero();
            assertThat(await(taskId).status()).isEqualTo(TaskStatus.CANCELLED);
        }

        @Test
        @DisplayName("should send an abort to the node running the task")
        void shouldAbortRunning() {
            transport.when("worker-1", message -> message.type() == TransportMessage.Type.ABORT
                    ? CompletableFuture.completedFuture(TransportReply.ok(Map.of()))
                    : new CompletableFuture<>());
            worker("worker-1", 1);
            distributor.start();
            String taskId = distributor.submit(task("long"));
            Await.until(() -> distributor.getStatus(taskId).orElseThrow().status() == TaskStatus.RUNNING);

            distributor.cancel(taskId);

            assertThat(transport.sent(TransportMessage.Type.ABORT))
                    .extracting(sent -> sent.message().target())
                    .containsExactly(taskId);
            assertThat(distributor.getStatus(taskId).orElseThrow().status()).isEqualTo(TaskStatus.CANCELLED);
        }

        @Test
        @DisplayName("should leave a finished task untouched")
        void shouldIgnoreTerminal() throws Exception {
            worker("worker-1", 1);
            distributor.start();
            String taskId = distributor.submit(task("done"));
            await(taskId);

            assertThat(distributor.cancel(taskId).orElseThrow().status()).isEqualTo(TaskStatus.SUCCEEDED);
        }
    }

    @Nested
    @DisplayName("Catch-up and backoff")
    class CatchUpAndBackoff {

        @Test
        @DisplayName("should submit one catch-up task per origin and sequence")
        void shouldSubmitCatchUp() {
            String taskId = distributor.submitCatchUp("edge-2", 7, List.of("note-2", "note-1")).orElseThrow();

            assertThat(distributor.submitCatchUp("edge-2", 7, List.of("note-1"))).contains(taskId);
            TaskView view = distributor.getStatus(taskId).orElseThrow();
            assertThat(view.type()).isEqualTo(TaskDistributor.CATCH_UP_TASK_TYPE);
            assertThat(view.idempotencyKey()).isEqualTo("catch-up:edge-2:7");
        }

        @Test
        @DisplayName("should return empty when the queue refuses a catch-up task")
        void shouldSwallowBackpressureForCatchUp() {
            distributor.close();
            distributor = builder().queueCapacity(1).build();
            distributor.submit(task("filler"));

            assertThat(distributor.submitCatchUp("edge-2", 1, List.of("note-1"))).isEmpty();
        }

        @Test
        @DisplayName("should grow the backoff exponentially up to the cap")
        void shouldComputeBackoff() {
            assertThat(TaskDistributor.backoff(0, 100, 2.0, 5000)).isEqualTo(Duration.ofMillis(100));
            assertThat(TaskDistributor.backoff(3, 100, 2.0, 5000)).isEqualTo(Duration.ofMillis(800));
            assertThat(TaskDistributor.backoff(10, 100, 2.0, 5000)).isEqualTo(Duration.ofMillis(5000));
        }

        @Test
        @DisplayName("should raise effective priority for every full wait period")
        void shouldEscalatePriority() {
            Instant created = Instant.parse("2024-01-01T00:00:00Z");
            Task waiting = new Task(task("old").withPriority(1), 1, created);

            assertThat(waiting.effectivePriority(created.plusSeconds(59), Duration.ofMinutes(1), 2)).isEqualTo(1);
            assertThat(waiting.effectivePriority(created.plusSeconds(150), Duration.ofMinutes(1), 2)).isEqualTo(5);
            assertThat(waiting.effectivePriority(created.plusSeconds(150), Duration.ZERO, 2)).isEqualTo(1);
        }
    }
}
