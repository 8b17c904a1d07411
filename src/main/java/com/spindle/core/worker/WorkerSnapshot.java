package com.spindle.core.worker;

/**
 * Point-in-time view of one worker, as returned by {@link WorkerRegistry#info()}.
 *
 * @param id      the worker id
 * @param counter counter value read under the worker's lock
 * @param status  lifecycle status at the time of the read
 */
public record WorkerSnapshot(
    WorkerId id,
    long counter,
    WorkerStatus status
) {}
