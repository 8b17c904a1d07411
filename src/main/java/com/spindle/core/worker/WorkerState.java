package com.spindle.core.worker;

import java.util.function.BooleanSupplier;

/**
 * Mutable state shared between a worker thread and the registry.
 * <p>
 * The counter and the termination flag are guarded by this object's monitor. The
 * termination check and the increment of a tick happen in one critical section,
 * so a worker never increments after a kill was requested in the same tick.
 */
public final class WorkerState {

    private long counter;
    private boolean terminationRequested;
    private volatile WorkerStatus status = WorkerStatus.STARTING;

    public WorkerState(long initialValue) {
        this.counter = initialValue;
    }

    public synchronized long counter() {
        return counter;
    }

    public synchronized boolean isTerminationRequested() {
        return terminationRequested;
    }

    /**
     * Flags the worker for termination. The flag is never cleared.
     */
    public synchronized void requestTermination() {
        terminationRequested = true;
    }

    public synchronized void reset(long newValue) {
        counter = newValue;
    }

    /**
     * Runs one tick: stops if either signal is set, otherwise increments the counter.
     *
     * @param globalStop process-wide shutdown check, evaluated under the lock
     * @return true if the counter was incremented and the worker should keep running
     */
    public synchronized boolean advance(BooleanSupplier globalStop) {
        if (globalStop.getAsBoolean() || terminationRequested) {
            return false;
        }
        counter++;
        return true;
    }

    public WorkerStatus status() {
        return status;
    }

    void markRunning() {
        status = WorkerStatus.RUNNING;
    }

    void markStopped() {
        status = WorkerStatus.STOPPED;
    }

    public synchronized WorkerSnapshot snapshot(WorkerId id) {
        return new WorkerSnapshot(id, counter, status);
    }
}
