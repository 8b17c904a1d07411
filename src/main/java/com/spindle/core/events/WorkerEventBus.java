package com.spindle.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans worker lifecycle events out to listeners such as the console.
 * Listeners run on the publishing worker thread and must not block.
 */
@Service
public class WorkerEventBus {

    private static final Logger log = LoggerFactory.getLogger(WorkerEventBus.class);

    private final List<Consumer<WorkerEvent>> listeners = new CopyOnWriteArrayList<>();

    public void publish(WorkerEvent event) {
        log.debug("Worker {} {}", event.workerId(), event.type());
        for (Consumer<WorkerEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} of worker {}: {}", event.type(), event.workerId(), e.getMessage(), e);
            }
        }
    }

    /**
     * Registers a listener for the events of every worker.
     *
     * @return handle that removes the listener again
     */
    public Subscription subscribe(Consumer<WorkerEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
