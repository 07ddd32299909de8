package fr.lapetina.mesh.coordinator.scheduler.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.mesh.coordinator.domain.event.DispatchState;
import fr.lapetina.mesh.coordinator.domain.event.TaskDispatchEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Final stage handler: logs the ring outcome and clears the event for reuse.
 */
public final class CompletionHandler implements EventHandler<TaskDispatchEvent> {

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    @Override
    public void onEvent(TaskDispatchEvent event, long sequence, boolean endOfBatch) {
        try {
            if (event.getTask() != null && event.getState() != DispatchState.DISPATCHED) {
                log.debug("Event left ring without dispatch: sequence={}, event={}, reason={}",
                        sequence, event, event.getErrorMessage());
            }
        } finally {
            event.clear();
        }
    }
}
