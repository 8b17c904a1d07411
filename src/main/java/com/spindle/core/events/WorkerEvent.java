package com.spindle.core.events;

import com.spindle.core.worker.WorkerId;

import java.time.Instant;

/**
 * A worker lifecycle event, published from the worker's own thread.
 *
 * @param type      what happened
 * @param workerId  the worker the event belongs to
 * @param value     counter value at the time of the event (initial value for STARTED, final for FINISHED)
 * @param timestamp when the event occurred
 */
public record WorkerEvent(
    Type type,
    WorkerId workerId,
    long value,
    Instant timestamp
) {
    public enum Type { STARTED, FINISHED }

    public static WorkerEvent started(WorkerId workerId, long initialValue) {
        return new WorkerEvent(Type.STARTED, workerId, initialValue, Instant.now());
    }

    public static WorkerEvent finished(WorkerId workerId, long finalValue) {
        return new WorkerEvent(Type.FINISHED, workerId, finalValue, Instant.now());
    }
}
