package com.spindle.core.worker;

import com.spindle.core.events.WorkerEvent;
import com.spindle.core.events.WorkerEventBus;
import com.spindle.core.logging.MdcContext;
import com.spindle.core.metrics.SpindleMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Body of a worker thread: sleeps one tick, then increments its counter, until either
 * its own termination flag or the process-wide {@link ShutdownSignal} is seen.
 * <p>
 * Both signals are polled once per tick, so a worker exits at most one tick period
 * after being asked to.
 */
public class Worker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final WorkerId id;
    private final WorkerState state;
    private final ShutdownSignal shutdownSignal;
    private final Duration tickPeriod;
    private final WorkerEventBus eventBus;
    private final SpindleMetrics metrics;

    public Worker(WorkerId id, WorkerState state, ShutdownSignal shutdownSignal, Duration tickPeriod,
                  WorkerEventBus eventBus, SpindleMetrics metrics) {
        this.id = id;
        this.state = state;
        this.shutdownSignal = shutdownSignal;
        this.tickPeriod = tickPeriod;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public WorkerId id() {
        return id;
    }

    @Override
    public void run() {
        MdcContext.setWorker(id);
        try {
            state.markRunning();
            long initialValue = state.counter();
            log.info("Worker {} started with initial value {}", id, initialValue);
            eventBus.publish(WorkerEvent.started(id, initialValue));

            try {
                while (true) {
                    Thread.sleep(tickPeriod.toMillis());
                    if (!state.advance(shutdownSignal::isRequested)) {
                        break;
                    }
                    metrics.recordTick();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Worker {} interrupted, stopping", id);
            }

            state.markStopped();
            long finalValue = state.counter();
            log.info("Worker {} finished with value {}", id, finalValue);
            eventBus.publish(WorkerEvent.finished(id, finalValue));
        } finally {
            MdcContext.clear();
        }
    }
}
