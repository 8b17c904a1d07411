package com.spindle.core.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts the configured number of workers at a fixed cadence on its own thread.
 * <p>
 * Shutdown is checked before every spawn and cuts the wait between spawns short.
 */
@Service
public class WorkerInitializer {

    private static final Logger log = LoggerFactory.getLogger(WorkerInitializer.class);

    private final WorkerRegistry registry;
    private final ShutdownSignal shutdownSignal;
    private final AtomicInteger spawned = new AtomicInteger();
    private Thread thread;

    public WorkerInitializer(WorkerRegistry registry, ShutdownSignal shutdownSignal) {
        this.registry = registry;
        this.shutdownSignal = shutdownSignal;
    }

    /**
     * Starts the initializer thread. May be called once.
     *
     * @param count      number of workers to spawn
     * @param startDelay pause between two consecutive spawns
     */
    public synchronized void start(int count, Duration startDelay) {
        if (count < 0) {
            throw new IllegalArgumentException("Worker count must not be negative: " + count);
        }
        if (thread != null) {
            throw new IllegalStateException("Worker initializer already started");
        }
        thread = new Thread(() -> launch(count, startDelay), "worker-initializer");
        thread.start();
    }

    void launch(int count, Duration startDelay) {
        log.info("Worker initializer started: {} worker(s), {} between starts", count, startDelay);
        try {
            for (int i = 0; i < count && !shutdownSignal.isRequested(); i++) {
                if (registry.spawn(OptionalLong.empty()).isEmpty()) {
                    break;
                }
                spawned.incrementAndGet();
                if (i < count - 1 && shutdownSignal.await(startDelay)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker initializer interrupted");
        }
        log.info("Worker initializer finished: {} worker(s) spawned", spawned.get());
    }

    /**
     * Waits for the initializer thread to end. Returns immediately if it was never started.
     *
     * @return false if the calling thread was interrupted while waiting
     */
    public boolean awaitCompletion() {
        Thread current;
        synchronized (this) {
            current = thread;
        }
        if (current == null) {
            return true;
        }
        try {
            current.join();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public int spawnedCount() {
        return spawned.get();
    }
}
