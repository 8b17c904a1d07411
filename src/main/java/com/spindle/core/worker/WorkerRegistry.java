package com.spindle.core.worker;

import com.spindle.core.config.SpindleProperties;
import com.spindle.core.events.WorkerEventBus;
import com.spindle.core.metrics.SpindleMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns every worker of the process: the pool of thread handles and the map of shared states.
 *
 * <p>Locking:
 * <ul>
 *   <li>{@code poolLock} guards the handle pool and the shutdown check in {@link #spawn}</li>
 *   <li>each {@link WorkerState} guards its own counter and termination flag</li>
 *   <li>lock order is pool lock, then worker state; no lock is held while joining a thread</li>
 * </ul>
 *
 * <p>Because each worker has its own lock, {@link #info()} reads every counter at a
 * slightly different moment; it is not a consistent snapshot across workers.
 */
@Service
public class WorkerRegistry implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private final Object poolLock = new Object();

    /** Guarded by {@link #poolLock}. Insertion order is id order. */
    private final Map<WorkerId, WorkerHandle> handles = new LinkedHashMap<>();

    private final ConcurrentHashMap<WorkerId, WorkerState> states = new ConcurrentHashMap<>();
    private final AtomicLong lastId = new AtomicLong();

    private final ShutdownSignal shutdownSignal;
    private final InitialValueSource initialValues;
    private final Duration tickPeriod;
    private final WorkerEventBus eventBus;
    private final SpindleMetrics metrics;

    public WorkerRegistry(ShutdownSignal shutdownSignal, InitialValueSource initialValues,
                          SpindleProperties properties, WorkerEventBus eventBus, SpindleMetrics metrics) {
        this.shutdownSignal = shutdownSignal;
        this.initialValues = initialValues;
        this.tickPeriod = properties.getTickPeriod();
        this.eventBus = eventBus;
        this.metrics = metrics;
        metrics.bindActiveWorkers(this, WorkerRegistry::activeCount);
    }

    /**
     * Starts a new worker without waiting for it to reach {@link WorkerStatus#RUNNING}.
     * The returned id is known to the registry as soon as this method returns.
     *
     * @param initialValue starting counter value; a random one is used when absent
     * @return the new worker's id, or empty if shutdown has already been requested
     */
    public Optional<WorkerId> spawn(OptionalLong initialValue) {
        synchronized (poolLock) {
            if (shutdownSignal.isRequested()) {
                log.info("Spawn rejected: shutdown in progress");
                return Optional.empty();
            }
            WorkerId id = WorkerId.of(lastId.incrementAndGet());
            long value = initialValue.isPresent() ? initialValue.getAsLong() : initialValues.nextInitialValue();
            WorkerState state = new WorkerState(value);
            Worker worker = new Worker(id, state, shutdownSignal, tickPeriod, eventBus, metrics);
            Thread thread = new Thread(worker, "worker-" + id);

            states.put(id, state);
            handles.put(id, new WorkerHandle(id, thread));
            thread.start();

            metrics.recordSpawn();
            log.debug("Spawned worker {} with initial value {}", id, value);
            return Optional.of(id);
        }
    }

    /**
     * Lists every pooled worker in id order. Workers removed concurrently are skipped.
     */
    public List<WorkerSnapshot> info() {
        List<WorkerHandle> pooled;
        synchronized (poolLock) {
            pooled = List.copyOf(handles.values());
        }
        var snapshots = new ArrayList<WorkerSnapshot>(pooled.size());
        for (WorkerHandle handle : pooled) {
            WorkerState state = states.get(handle.id());
            if (state == null) {
                continue;
            }
            snapshots.add(state.snapshot(handle.id()));
        }
        return snapshots;
    }

    /**
     * Asks a worker to stop, waits for its thread to end, then forgets it.
     * Unknown ids are ignored.
     *
     * @param id the worker to kill
     * @return true if this call removed the worker; false if the id was unknown,
     *         already removed, or the wait was interrupted
     */
    public boolean kill(WorkerId id) {
        WorkerState state = states.get(id);
        if (state == null) {
            log.debug("Kill ignored: no worker {}", id);
            return false;
        }
        state.requestTermination();

        WorkerHandle handle;
        synchronized (poolLock) {
            handle = handles.get(id);
        }
        if (handle == null) {
            log.debug("Kill of worker {}: handle already removed", id);
            return false;
        }

        long startMs = System.currentTimeMillis();
        if (!handle.join()) {
            log.warn("Interrupted while waiting for worker {} to finish; leaving it registered", id);
            return false;
        }
        long joinMs = System.currentTimeMillis() - startMs;

        synchronized (poolLock) {
            if (handles.remove(id) == null) {
                return false;
            }
            states.remove(id);
        }
        metrics.recordKill(joinMs);
        log.info("Worker {} killed after {}ms", id, joinMs);
        return true;
    }

    /**
     * Overwrites a worker's counter. Unknown ids are ignored.
     *
     * @return true if the worker exists and its counter was overwritten
     */
    public boolean reset(WorkerId id, long newValue) {
        WorkerState state = states.get(id);
        if (state == null) {
            log.debug("Reset ignored: no worker {}", id);
            return false;
        }
        state.reset(newValue);
        metrics.recordReset();
        log.info("Worker {} reset to {}", id, newValue);
        return true;
    }

    /**
     * Requests process-wide shutdown and waits for every pooled worker to end.
     * Entries stay in the pool. Safe to call more than once.
     */
    public void shutdown() {
        List<WorkerHandle> pooled;
        synchronized (poolLock) {
            if (shutdownSignal.request()) {
                log.info("Shutdown requested");
            }
            pooled = List.copyOf(handles.values());
        }
        log.info("Waiting for {} worker(s) to finish", pooled.size());
        for (WorkerHandle handle : pooled) {
            if (!handle.join()) {
                log.warn("Interrupted while waiting for worker {} during shutdown", handle.id());
                return;
            }
        }
        log.info("All workers finished");
    }

    /**
     * Number of workers currently in the pool, including ones that have stopped
     * during shutdown but were not removed.
     */
    public int activeCount() {
        synchronized (poolLock) {
            return handles.size();
        }
    }

    @Override
    public void destroy() {
        shutdown();
    }
}
