package fr.lapetina.mesh.coordinator.scheduler;

import fr.lapetina.mesh.coordinator.domain.model.ErrorType;
import fr.lapetina.mesh.coordinator.domain.model.Node;
import fr.lapetina.mesh.coordinator.domain.model.NodeEvent;
import fr.lapetina.mesh.coordinator.domain.model.NodeStatus;
import fr.lapetina.mesh.coordinator.domain.model.Task;
import fr.lapetina.mesh.coordinator.domain.model.TaskOutcome;
import fr.lapetina.mesh.coordinator.domain.model.TaskStatus;
import fr.lapetina.mesh.coordinator.domain.model.TaskSubmission;
import fr.lapetina.mesh.coordinator.domain.model.TaskView;
import fr.lapetina.mesh.coordinator.infrastructure.config.CoordinatorConfig;
import fr.lapetina.mesh.coordinator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mesh.coordinator.infrastructure.registry.WorkerRegistry;
import fr.lapetina.mesh.coordinator.infrastructure.transport.Transport;
import fr.lapetina.mesh.coordinator.infrastructure.transport.TransportMessage;
import fr.lapetina.mesh.coordinator.scheduler.exception.BackpressureException;
import fr.lapetina.mesh.coordinator.scheduler.exception.PermanentTaskFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Accepts task submissions and places them on eligible nodes.
 *
 * <p>Tasks wait in a bounded priority queue. A single assign loop takes the
 * highest effective-priority ready task (ties by submission order), reserves a
 * slot on the least-loaded eligible node and publishes the assignment into the
 * {@link DispatchPipeline}. No eligible node is not a failure: the task stays
 * queued and its effective priority grows with every {@code maxWait} it spends
 * waiting.
 *
 * <p>Transient failures are retried with capped exponential backoff until
 * {@code maxRetries} is exhausted, then the task is dead-lettered. A
 * worker-reported permanent failure is terminal. A task is never executed twice
 * for the same idempotency key: re-submission returns the existing task id.
 *
 * <p>Thread-safe. The queue is guarded by one lock held only for queue
 * bookkeeping; task transitions synchronize on the task and node capacity is
 * re-validated under the node lock when a slot is reserved.
 */
public final class TaskDistributor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskDistributor.class);

    public static final String CATCH_UP_TASK_TYPE = "sync.catch-up";

    private final WorkerRegistry registry;
    private final Transport transport;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final DispatchPipeline pipeline;

    private final int queueCapacity;
    private final Duration maxWait;
    private final int escalationStep;
    private final int maxRetries;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final double backoffMultiplier;
    private final Duration assignInterval;
    private final Duration abortTimeout;
    private final String catchUpCapability;

    private final ReentrantLock queueLock = new ReentrantLock();
    private final ReentrantLock assignLock = new ReentrantLock();
    private final Map<String, Task> queued = new LinkedHashMap<>();
    private final Map<String, String> taskIdsByKey = new ConcurrentHashMap<>();
    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<TaskView>> completions = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    private final ScheduledExecutorService assigner;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean assignRequested = new AtomicBoolean(false);
    private final Consumer<WorkerRegistry.RegistryEvent> registryListener = this::onRegistryEvent;

    private TaskDistributor(Builder builder) {
        this.registry = builder.registry;
        this.transport = builder.transport;
        this.metricsRegistry = builder.metricsRegistry;
        this.clock = builder.clock;
        this.queueCapacity = builder.queueCapacity;
        this.maxWait = builder.maxWait;
        this.escalationStep = builder.escalationStep;
        this.maxRetries = builder.maxRetries;
        this.initialBackoffMs = builder.initialBackoffMs;
        this.maxBackoffMs = builder.maxBackoffMs;
        this.backoffMultiplier = builder.backoffMultiplier;
        this.assignInterval = builder.assignInterval;
        this.abortTimeout = builder.dispatchTimeout;
        this.catchUpCapability = builder.catchUpCapability;

        this.pipeline = builder.pipelineBuilder
                .transport(builder.transport)
                .metricsRegistry(builder.metricsRegistry)
                .dispatchTimeout(builder.dispatchTimeout)
                .clock(builder.clock)
                .resultListener(this::onDispatchResult)
                .build();

        this.assigner = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "task-assigner");
            t.setDaemon(true);
            return t;
        });

        log.info("TaskDistributor created: queueCapacity={}, maxRetries={}, maxWait={}, escalationStep={}",
                queueCapacity, maxRetries, maxWait, escalationStep);
    }

    /**
     * Starts the dispatch ring and the assign loop.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            pipeline.start();
            registry.addListener(registryListener);
            assigner.scheduleWithFixedDelay(
                    this::runAssignCycle,
                    assignInterval.toMillis(),
                    assignInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("TaskDistributor started: assignInterval={}", assignInterval);
        }
    }

    /**
     * Submits a task.
     *
     * @return the task id; the existing id if the idempotency key was seen before
     * @throws BackpressureException if the queue is full
     */
    public String submit(TaskSubmission submission) {
        Task task;
        queueLock.lock();
        try {
            String existing = taskIdsByKey.get(submission.idempotencyKey());
            if (existing != null) {
                log.debug("Duplicate submission: idempotencyKey={}, taskId={}", submission.idempotencyKey(), existing);
                return existing;
            }
            if (queued.size() >= queueCapacity) {
                metricsRegistry.incrementErrorCount("scheduler", ErrorType.CAPACITY_EXHAUSTED);
                throw new BackpressureException(
                        BackpressureException.BackpressureReason.QUEUE_FULL,
                        "queued=" + queued.size() + ", capacity=" + queueCapacity
                );
            }
            task = new Task(submission, sequence.incrementAndGet(), clock.instant());
            tasks.put(task.getId(), task);
            taskIdsByKey.put(task.getIdempotencyKey(), task.getId());
            queued.put(task.getId(), task);
            metricsRegistry.setQueueDepth(queued.size());
        } finally {
            queueLock.unlock();
        }

        metricsRegistry.incrementTaskCount(task.getType(), TaskStatus.QUEUED);
        log.info("Task submitted: taskId={}, idempotencyKey={}, type={}, priority={}, capabilities={}",
                task.getId(), task.getIdempotencyKey(), task.getType(), task.getPriority(),
                task.getRequiredCapabilities());
        if (!registry.hasCapableNode(task.getRequiredCapabilities())) {
            log.warn("No registered node has the required capabilities, task stays queued: taskId={}, capabilities={}",
                    task.getId(), task.getRequiredCapabilities());
        }
        requestAssign();
        return task.getId();
    }

    public Optional<TaskView> getStatus(String taskId) {
        return Optional.ofNullable(tasks.get(taskId)).map(Task::toView);
    }

    /**
     * Completes when the task reaches a terminal state.
     *
     * <p>Completes normally for SUCCEEDED, DEAD_LETTERED and CANCELLED, and
     * exceptionally with {@link PermanentTaskFailureException} for FAILED.
     *
     * @return empty if the task id is unknown
     */
    public Optional<CompletableFuture<TaskView>> completion(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            return Optional.empty();
        }
        CompletableFuture<TaskView> future = completions.computeIfAbsent(taskId, id -> new CompletableFuture<>());
        // The task may have settled before the future was registered
        if (task.getStatus().isTerminal()) {
            settle(task);
        }
        return Optional.of(future);
    }

    /**
     * Tasks whose retries are exhausted, oldest first.
     */
    public List<TaskView> deadLetters() {
        return tasks.values().stream()
                .filter(task -> task.getStatus() == TaskStatus.DEAD_LETTERED)
                .sorted(Comparator.comparing(Task::getSequence))
                .map(Task::toView)
                .toList();
    }

    /**
     * Cooperative cancellation. A queued task leaves the queue; a running task
     * is sent an ABORT and any result it still reports is ignored.
     *
     * @return the task after cancellation, empty if unknown
     */
    public Optional<TaskView> cancel(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            return Optional.empty();
        }
        TaskStatus previous = task.cancel(clock.instant());
        if (previous == null) {
            log.debug("Cancel ignored, task already terminal: taskId={}, status={}", taskId, task.getStatus());
            return Optional.of(task.toView());
        }

        if (previous == TaskStatus.QUEUED) {
            removeFromQueue(task);
        } else if (previous == TaskStatus.RUNNING) {
            sendAbort(task);
        }
        log.info("Task cancelled: taskId={}, previousStatus={}, node={}", taskId, previous, task.getAssignedNodeId());
        metricsRegistry.incrementTaskCount(task.getType(), TaskStatus.CANCELLED);
        settle(task);
        return Optional.of(task.toView());
    }

    /**
     * Queues catch-up work for entities drained from an origin's offline log.
     * Keyed by origin and last sequence so a repeated drain does not run it twice.
     *
     * @return the task id, empty if the queue refused it
     */
    public Optional<String> submitCatchUp(String originNode, long lastSequence, Collection<String> entityIds) {
        Map<String, Object> payload = Map.of(
                "origin", originNode,
                "lastSequence", lastSequence,
                "entityIds", List.copyOf(new TreeSet<>(entityIds))
        );
        TaskSubmission submission = new TaskSubmission(
                "catch-up:" + originNode + ":" + lastSequence,
                CATCH_UP_TASK_TYPE,
                payload,
                Set.of(catchUpCapability),
                0,
                null
        );
        try {
            return Optional.of(submit(submission));
        } catch (BackpressureException e) {
            log.warn("Catch-up task refused: origin={}, lastSequence={}, reason={}", originNode, lastSequence, e.getReason());
            return Optional.empty();
        }
    }

    /**
     * Runs one assignment pass.
     *
     * @return number of tasks published for dispatch
     */
    public int assignPending() {
        if (!pipeline.isRunning()) {
            return 0;
        }
        assignLock.lock();
        try {
            Instant now = clock.instant();
            List<Task> ready = new ArrayList<>();
            List<Task> expired = new ArrayList<>();

            queueLock.lock();
            try {
                for (Iterator<Task> it = queued.values().iterator(); it.hasNext(); ) {
                    Task task = it.next();
                    if (task.getStatus() != TaskStatus.QUEUED) {
                        it.remove();
                    } else if (task.isPastDeadline(now)) {
                        it.remove();
                        expired.add(task);
                    } else if (task.isReady(now)) {
                        ready.add(task);
                    }
                }
            } finally {
                queueLock.unlock();
            }

            for (Task task : expired) {
                failTask(task, task.getAttempt(), ErrorType.DEADLINE_EXCEEDED, "Deadline passed while queued");
            }

            ready.sort(Comparator
                    .comparingInt((Task task) -> task.effectivePriority(now, maxWait, escalationStep))
                    .reversed()
                    .thenComparingLong(Task::getSequence));

            int dispatched = 0;
            for (Task task : ready) {
                Node node = reserveNode(task);
                if (node == null) {
                    task.setWaitingReason(registry.hasCapableNode(task.getRequiredCapabilities())
                            ? "All capable nodes are busy or unavailable"
                            : "No registered node has capabilities " + task.getRequiredCapabilities());
                    continue;
                }

                int attempt = task.assign(node.getId(), now);
                if (attempt < 0) {
                    // Cancelled between the scan and the assignment
                    node.release();
                    continue;
                }
                removeFromQueue(task);

                try {
                    pipeline.publish(task, node, attempt);
                    dispatched++;
                } catch (BackpressureException e) {
                    task.unassign(attempt, now);
                    node.release();
                    requeue(task);
                    log.warn("Dispatch ring full, remaining tasks stay queued: taskId={}, remaining={}",
                            task.getId(), pipeline.getRemainingCapacity());
                    break;
                }
            }

            metricsRegistry.setQueueDepth(queueSize());
            if (dispatched > 0) {
                log.debug("Assign pass: ready={}, dispatched={}", ready.size(), dispatched);
            }
            return dispatched;
        } finally {
            assignLock.unlock();
        }
    }

    private Node reserveNode(Task task) {
        for (Node node : registry.getEligibleNodes(task.getRequiredCapabilities())) {
            if (node.tryReserve(task.getRequiredCapabilities())) {
                return node;
            }
        }
        return null;
    }

    void onDispatchResult(DispatchResult result) {
        Task task = result.task();
        Node node = result.node();
        int attempt = result.attempt();
        node.release();

        try {
            registry.recordCallOutcome(node.getId(), result.nodeResponded(), result.latencyMs());
            metricsRegistry.recordDispatchLatency(node.getId(), Duration.ofMillis(result.latencyMs()));

            TaskOutcome outcome = result.outcome();
            switch (outcome.kind()) {
                case SUCCESS -> succeed(task, attempt, outcome);
                case PERMANENT_FAILURE -> failTask(task, attempt, ErrorType.PERMANENT_TASK_FAILURE, outcome.errorMessage());
                case TRANSIENT_FAILURE -> retryOrDeadLetter(task, attempt, outcome.errorMessage());
            }
        } catch (Exception e) {
            log.error("Error handling dispatch result: taskId={}, nodeId={}, attempt={}",
                    task.getId(), node.getId(), attempt, e);
        } finally {
            requestAssign();
        }
    }

    private void succeed(Task task, int attempt, TaskOutcome outcome) {
        if (!task.succeed(attempt, outcome.result(), clock.instant())) {
            log.debug("Ignoring stale result: taskId={}, attempt={}, status={}", task.getId(), attempt, task.getStatus());
            return;
        }
        log.info("Task succeeded: taskId={}, node={}, attempt={}, retries={}",
                task.getId(), task.getAssignedNodeId(), attempt, task.getRetryCount());
        metricsRegistry.incrementTaskCount(task.getType(), TaskStatus.SUCCEEDED);
        settle(task);
    }

    private void failTask(Task task, int attempt, ErrorType type, String message) {
        if (!task.fail(attempt, type, message, clock.instant())) {
            log.debug("Ignoring stale failure: taskId={}, attempt={}, status={}", task.getId(), attempt, task.getStatus());
            return;
        }
        log.error("Task failed: taskId={}, errorType={}, error={}, attempt={}", task.getId(), type, message, attempt);
        metricsRegistry.incrementTaskCount(task.getType(), TaskStatus.FAILED);
        metricsRegistry.incrementErrorCount("scheduler", type);
        settle(task);
    }

    private void retryOrDeadLetter(Task task, int attempt, String message) {
        Instant now = clock.instant();
        if (task.isPastDeadline(now)) {
            failTask(task, attempt, ErrorType.DEADLINE_EXCEEDED, "Deadline passed after: " + message);
            return;
        }
        metricsRegistry.incrementErrorCount("scheduler", ErrorType.TRANSIENT_NETWORK);

        if (task.getRetryCount() >= maxRetries) {
            if (task.deadLetter(attempt, message, now)) {
                log.error("Task dead-lettered: taskId={}, retries={}, lastError={}", task.getId(), task.getRetryCount(), message);
                metricsRegistry.incrementTaskCount(task.getType(), TaskStatus.DEAD_LETTERED);
                settle(task);
            }
            return;
        }

        Duration backoff = backoff(task.getRetryCount(), initialBackoffMs, backoffMultiplier, maxBackoffMs);
        if (task.retryAt(attempt, now.plus(backoff), message, now)) {
            requeue(task);
            log.warn("Task dispatch failed, retrying: taskId={}, retry={}/{}, backoffMs={}, error={}",
                    task.getId(), task.getRetryCount(), maxRetries, backoff.toMillis(), message);
        } else {
            log.debug("Ignoring stale failure: taskId={}, attempt={}, status={}", task.getId(), attempt, task.getStatus());
        }
    }

    /**
     * Delay before retry number {@code retryCount + 1}:
     * {@code min(initial * multiplier^retryCount, max)}.
     */
    static Duration backoff(int retryCount, long initialMs, double multiplier, long maxMs) {
        double delay = initialMs * Math.pow(multiplier, retryCount);
        return Duration.ofMillis((long) Math.min(delay, maxMs));
    }

    private void onRegistryEvent(WorkerRegistry.RegistryEvent event) {
        String nodeId = event.node().getId();
        boolean removed = event.type() == NodeEvent.Type.DEREGISTERED || event.type() == NodeEvent.Type.EXPIRED;
        if (event.wentOffline() || removed) {
            List<Task> stranded = tasks.values().stream()
                    .filter(task -> task.getStatus().isActive() && nodeId.equals(task.getAssignedNodeId()))
                    .toList();
            if (!stranded.isEmpty()) {
                log.warn("Node lost, requeueing its tasks: nodeId={}, tasks={}", nodeId, stranded.size());
            }
            for (Task task : stranded) {
                retryOrDeadLetter(task, task.getAttempt(), "Node " + nodeId + " went " + (removed ? "away" : "offline"));
            }
        }
        if (event.to() == NodeStatus.ONLINE) {
            requestAssign();
        }
    }

    private void sendAbort(Task task) {
        String nodeId = task.getAssignedNodeId();
        Optional<Node> node = nodeId != null ? registry.getNode(nodeId) : Optional.empty();
        if (node.isEmpty()) {
            return;
        }
        try {
            transport.send(node.get(), TransportMessage.abort(task.getId()), abortTimeout)
                    .whenComplete((reply, ex) -> {
                        if (ex != null) {
                            log.warn("Abort not delivered: taskId={}, nodeId={}, error={}",
                                    task.getId(), nodeId, Transport.unwrap(ex).toString());
                        }
                    });
        } catch (RuntimeException e) {
            log.warn("Abort not delivered: taskId={}, nodeId={}, error={}", task.getId(), nodeId, e.toString());
        }
    }

    private void settle(Task task) {
        CompletableFuture<TaskView> future = completions.remove(task.getId());
        if (future == null) {
            return;
        }
        if (task.getStatus() == TaskStatus.FAILED) {
            future.completeExceptionally(
                    new PermanentTaskFailureException(task.getId(), task.getErrorType(), task.getErrorMessage()));
        } else {
            future.complete(task.toView());
        }
    }

    private void requeue(Task task) {
        queueLock.lock();
        try {
            // Requeues bypass the capacity check: the task was already accepted
            queued.put(task.getId(), task);
        } finally {
            queueLock.unlock();
        }
    }

    private void removeFromQueue(Task task) {
        queueLock.lock();
        try {
            queued.remove(task.getId());
        } finally {
            queueLock.unlock();
        }
    }

    public int queueSize() {
        queueLock.lock();
        try {
            return queued.size();
        } finally {
            queueLock.unlock();
        }
    }

    public long getRemainingDispatchCapacity() {
        return pipeline.getRemainingCapacity();
    }

    /**
     * Schedules an assignment pass on the assign thread. Collapses
     * concurrent requests into one pass.
     */
    public void requestAssign() {
        if (!running.get() || !assignRequested.compareAndSet(false, true)) {
            return;
        }
        try {
            assigner.execute(() -> {
                assignRequested.set(false);
                runAssignCycle();
            });
        } catch (RejectedExecutionException e) {
            assignRequested.set(false);
            log.debug("Assign request rejected, distributor shutting down");
        }
    }

    private void runAssignCycle() {
        try {
            assignPending();
        } catch (Exception e) {
            log.error("Assign cycle failed", e);
        }
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            registry.removeListener(registryListener);
            assigner.shutdown();
            try {
                if (!assigner.awaitTermination(5, TimeUnit.SECONDS)) {
                    assigner.shutdownNow();
                }
            } catch (InterruptedException e) {
                assigner.shutdownNow();
                Thread.currentThread().interrupt();
            }
            pipeline.close();
            log.info("TaskDistributor stopped: queued={}", queueSize());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for TaskDistributor.
     */
    public static final class Builder {
        private WorkerRegistry registry;
        private Transport transport;
        private MetricsRegistry metricsRegistry;
        private Clock clock = Clock.systemUTC();
        private final DispatchPipeline.Builder pipelineBuilder = DispatchPipeline.builder();
        private int queueCapacity = 10_000;
        private Duration maxWait = Duration.ofMinutes(1);
        private int escalationStep = 1;
        private int maxRetries = 3;
        private long initialBackoffMs = 100;
        private long maxBackoffMs = 5_000;
        private double backoffMultiplier = 2.0;
        private Duration assignInterval = Duration.ofMillis(50);
        private Duration dispatchTimeout = Duration.ofSeconds(30);
        private String catchUpCapability = "sync";

        public Builder registry(WorkerRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            if (queueCapacity < 1) {
                throw new IllegalArgumentException("Queue capacity must be positive");
            }
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder ringBufferSize(int size) {
            pipelineBuilder.ringBufferSize(size);
            return this;
        }

        public Builder waitStrategy(String strategy) {
            pipelineBuilder.waitStrategy(strategy);
            return this;
        }

        public Builder maxWait(Duration maxWait) {
            this.maxWait = maxWait;
            return this;
        }

        public Builder escalationStep(int escalationStep) {
            this.escalationStep = escalationStep;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder backoff(long initialMs, double multiplier, long maxMs) {
            this.initialBackoffMs = initialMs;
            this.backoffMultiplier = multiplier;
            this.maxBackoffMs = maxMs;
            return this;
        }

        public Builder assignInterval(Duration assignInterval) {
            this.assignInterval = assignInterval;
            return this;
        }

        public Builder dispatchTimeout(Duration dispatchTimeout) {
            this.dispatchTimeout = dispatchTimeout;
            return this;
        }

        public Builder catchUpCapability(String capability) {
            this.catchUpCapability = capability;
            return this;
        }

        public Builder fromConfig(CoordinatorConfig config) {
            CoordinatorConfig.SchedulerConfig scheduler = config.getScheduler();
            CoordinatorConfig.RetryConfig retry = config.getRetry();
            pipelineBuilder.fromConfig(config);
            queueCapacity(scheduler.getQueueCapacity());
            this.maxWait = Duration.ofMillis(scheduler.getMaxWaitMs());
            this.escalationStep = scheduler.getEscalationStep();
            this.assignInterval = Duration.ofMillis(scheduler.getAssignIntervalMs());
            this.dispatchTimeout = Duration.ofMillis(scheduler.getDispatchTimeoutMs());
            this.catchUpCapability = scheduler.getCatchUpCapability();
            this.maxRetries = retry.getMaxRetries();
            this.initialBackoffMs = retry.getInitialBackoffMs();
            this.maxBackoffMs = retry.getMaxBackoffMs();
            this.backoffMultiplier = retry.getBackoffMultiplier();
            return this;
        }

        public TaskDistributor build() {
            if (registry == null) {
                throw new IllegalStateException("WorkerRegistry is required");
            }
            if (transport == null) {
                throw new IllegalStateException("Transport is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new TaskDistributor(this);
        }
    }
}
