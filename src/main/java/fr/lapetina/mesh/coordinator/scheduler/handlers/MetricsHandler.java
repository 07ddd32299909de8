package fr.lapetina.mesh.coordinator.scheduler.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.mesh.coordinator.domain.event.DispatchState;
import fr.lapetina.mesh.coordinator.domain.event.TaskDispatchEvent;
import fr.lapetina.mesh.coordinator.domain.model.ErrorType;
import fr.lapetina.mesh.coordinator.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Second stage handler: records how long events waited in the ring and
 * counts dispatches that never left it.
 */
public final class MetricsHandler implements EventHandler<TaskDispatchEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(TaskDispatchEvent event, long sequence, boolean endOfBatch) {
        if (event.getPublishedAt() != null && event.getDispatchedAt() != null) {
            Duration ringWait = Duration.between(event.getPublishedAt(), event.getDispatchedAt());
            metricsRegistry.recordStageLatency("ring_wait", ringWait);
        }

        if (event.getState() == DispatchState.FAILED) {
            ErrorType type = event.getErrorType() != null ? event.getErrorType() : ErrorType.INTERNAL_ERROR;
            metricsRegistry.incrementErrorCount("dispatch", type);
            log.warn("Dispatch error recorded: task={}, errorType={}, message={}",
                    event.getTask() != null ? event.getTask().getId() : "none", type, event.getErrorMessage());
        }
    }
}
