package com.spindle.core.worker;

/**
 * Lifecycle of a single worker.
 */
public enum WorkerStatus {
    /** Registered, thread not yet running its loop */
    STARTING,
    /** Ticking */
    RUNNING,
    /** Loop exited; the thread is ending or has ended */
    STOPPED
}
