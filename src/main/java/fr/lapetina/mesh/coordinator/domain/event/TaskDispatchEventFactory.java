package fr.lapetina.mesh.coordinator.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates dispatch events for the ring buffer.
 */
public final class TaskDispatchEventFactory implements EventFactory<TaskDispatchEvent> {

    @Override
    public TaskDispatchEvent newInstance() {
        return new TaskDispatchEvent();
    }
}
