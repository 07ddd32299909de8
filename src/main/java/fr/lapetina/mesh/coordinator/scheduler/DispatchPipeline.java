package fr.lapetina.mesh.coordinator.scheduler;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.mesh.coordinator.domain.event.DispatchState;
import fr.lapetina.mesh.coordinator.domain.event.TaskDispatchEvent;
import fr.lapetina.mesh.coordinator.domain.event.TaskDispatchEventFactory;
import fr.lapetina.mesh.coordinator.domain.model.ErrorType;
import fr.lapetina.mesh.coordinator.domain.model.Node;
import fr.lapetina.mesh.coordinator.domain.model.Task;
import fr.lapetina.mesh.coordinator.infrastructure.config.CoordinatorConfig;
import fr.lapetina.mesh.coordinator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.mesh.coordinator.infrastructure.transport.Transport;
import fr.lapetina.mesh.coordinator.scheduler.exception.BackpressureException;
import fr.lapetina.mesh.coordinator.scheduler.handlers.CompletionHandler;
import fr.lapetina.mesh.coordinator.scheduler.handlers.DispatchHandler;
import fr.lapetina.mesh.coordinator.scheduler.handlers.MetricsHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded dispatch ring between the assign loop and the transport.
 *
 * The assign loop publishes (task, node, attempt) triples; the handlers run
 * in sequence: Dispatch -> Metrics -> Completion. Publishing never blocks:
 * a full ring raises {@link BackpressureException} and the caller keeps the
 * task queued.
 *
 * PRODUCER TYPE: MULTI. The assign loop is the usual producer, but tests and
 * the admin surface may publish from other threads.
 *
 * WAIT STRATEGY: configurable, default blocking. Dispatch is I/O bound so a
 * spinning consumer buys nothing on shared hosts.
 */
public final class DispatchPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DispatchPipeline.class);

    private final Disruptor<TaskDispatchEvent> disruptor;
    private final RingBuffer<TaskDispatchEvent> ringBuffer;
    private final MetricsRegistry metricsRegistry;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private DispatchPipeline(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;
        this.clock = builder.clock;

        ThreadFactory threadFactory = new DisruptorThreadFactory("dispatch-handler");
        WaitStrategy waitStrategy = createWaitStrategy(builder.waitStrategy);

        this.disruptor = new Disruptor<>(
                new TaskDispatchEventFactory(),
                builder.ringBufferSize,
                threadFactory,
                ProducerType.MULTI,
                waitStrategy
        );

        DispatchHandler dispatchHandler = new DispatchHandler(
                builder.transport,
                builder.resultListener,
                builder.dispatchTimeout,
                builder.clock
        );
        MetricsHandler metricsHandler = new MetricsHandler(builder.metricsRegistry);
        CompletionHandler completionHandler = new CompletionHandler();

        disruptor
                .handleEventsWith(dispatchHandler)
                .then(metricsHandler)
                .then(completionHandler);

        disruptor.setDefaultExceptionHandler(new DispatchExceptionHandler(builder.resultListener));

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("DispatchPipeline created: ringBufferSize={}, waitStrategy={}, dispatchTimeoutMs={}",
                builder.ringBufferSize, builder.waitStrategy, builder.dispatchTimeout.toMillis());
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("DispatchPipeline started");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Publishes an assigned task for dispatch.
     *
     * @throws BackpressureException if the ring buffer is full
     * @throws IllegalStateException if the pipeline is not running
     */
    public void publish(Task task, Node node, int attempt) {
        if (!running.get()) {
            throw new IllegalStateException("Pipeline not running");
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.DISPATCH_BUFFER_FULL,
                    "remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        try {
            TaskDispatchEvent event = ringBuffer.get(sequence);
            event.initialize(task, node, attempt, clock.instant());
        } finally {
            ringBuffer.publish(sequence);
        }
        metricsRegistry.setRingBufferRemaining((int) ringBuffer.remainingCapacity());

        log.debug("Task published: taskId={}, nodeId={}, attempt={}, sequence={}",
                task.getId(), node.getId(), attempt, sequence);
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down DispatchPipeline...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("DispatchPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("DispatchPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for Disruptor consumer threads.
     */
    private static class DisruptorThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        DisruptorThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(false);
            return t;
        }
    }

    /**
     * Routes a handler failure on an undispatched event into the normal
     * failure path so the reserved slot is released and the task retried.
     */
    private static class DispatchExceptionHandler implements ExceptionHandler<TaskDispatchEvent> {

        private static final Logger log = LoggerFactory.getLogger(DispatchExceptionHandler.class);

        private final DispatchResultListener resultListener;

        DispatchExceptionHandler(DispatchResultListener resultListener) {
            this.resultListener = resultListener;
        }

        @Override
        public void handleEventException(Throwable ex, long sequence, TaskDispatchEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);

            if (event.getTask() != null && event.getState() == DispatchState.CREATED) {
                event.markFailed(ErrorType.INTERNAL_ERROR, ex.getMessage());
                resultListener.onDispatchResult(new DispatchResult(
                        event.getTask(), event.getNode(), event.getAttempt(), null, ex, 0));
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for DispatchPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private Duration dispatchTimeout = Duration.ofSeconds(30);
        private Transport transport;
        private MetricsRegistry metricsRegistry;
        private DispatchResultListener resultListener;
        private Clock clock = Clock.systemUTC();

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder dispatchTimeout(Duration timeout) {
            this.dispatchTimeout = timeout;
            return this;
        }

        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder resultListener(DispatchResultListener listener) {
            this.resultListener = listener;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder fromConfig(CoordinatorConfig config) {
            ringBufferSize(config.getScheduler().getRingBufferSize());
            this.waitStrategy = config.getScheduler().getWaitStrategy();
            this.dispatchTimeout = Duration.ofMillis(config.getScheduler().getDispatchTimeoutMs());
            return this;
        }

        public DispatchPipeline build() {
            if (transport == null) {
                throw new IllegalStateException("Transport is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            if (resultListener == null) {
                throw new IllegalStateException("DispatchResultListener is required");
            }
            return new DispatchPipeline(this);
        }
    }
}
