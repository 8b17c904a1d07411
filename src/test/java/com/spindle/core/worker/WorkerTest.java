package com.spindle.core.worker;

import com.spindle.core.events.WorkerEvent;
import com.spindle.core.events.WorkerEventBus;
import com.spindle.core.metrics.SpindleMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class WorkerTest {

    private static final Duration TICK = Duration.ofMillis(10);

    private ShutdownSignal shutdownSignal;
    private WorkerEventBus eventBus;
    private SimpleMeterRegistry meterRegistry;
    private SpindleMetrics metrics;
    private List<WorkerEvent> events;

    @BeforeEach
    void setUp() {
        shutdownSignal = new ShutdownSignal();
        eventBus = new WorkerEventBus();
        meterRegistry = new SimpleMeterRegistry();
        metrics = new SpindleMetrics(meterRegistry);
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribe(events::add);
    }

    private Thread startWorker(long id, WorkerState state) {
        var worker = new Worker(WorkerId.of(id), state, shutdownSignal, TICK, eventBus, metrics);
        var thread = new Thread(worker, "test-worker-" + id);
        thread.start();
        return thread;
    }

    private static void awaitCounter(WorkerState state, long atLeast) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (state.counter() < atLeast) {
            assertTrue(System.currentTimeMillis() < deadline, "counter never reached " + atLeast);
            Thread.sleep(5);
        }
    }

    @Test
    @DisplayName("counter grows once per tick while running")
    void countsWhileRunning() throws InterruptedException {
        var state = new WorkerState(100);
        Thread thread = startWorker(1, state);

        awaitCounter(state, 103);
        assertEquals(WorkerStatus.RUNNING, state.status());

        state.requestTermination();
        thread.join(5_000);
        assertFalse(thread.isAlive());
    }

    @Test
    @DisplayName("termination request stops the worker and freezes the counter")
    void stopsOnTermination() throws InterruptedException {
        var state = new WorkerState(0);
        Thread thread = startWorker(2, state);
        awaitCounter(state, 1);

        state.requestTermination();
        thread.join(5_000);

        assertFalse(thread.isAlive());
        assertEquals(WorkerStatus.STOPPED, state.status());
        long frozen = state.counter();
        Thread.sleep(TICK.toMillis() * 3);
        assertEquals(frozen, state.counter());
    }

    @Test
    @DisplayName("global shutdown stops the worker")
    void stopsOnGlobalShutdown() throws InterruptedException {
        var state = new WorkerState(0);
        Thread thread = startWorker(3, state);

        shutdownSignal.request();
        thread.join(5_000);

        assertFalse(thread.isAlive());
        assertFalse(state.isTerminationRequested());
        assertEquals(WorkerStatus.STOPPED, state.status());
    }

    @Test
    @DisplayName("interrupt is treated as a stop request")
    void stopsOnInterrupt() throws InterruptedException {
        var state = new WorkerState(0);
        Thread thread = startWorker(4, state);

        thread.interrupt();
        thread.join(5_000);

        assertFalse(thread.isAlive());
        assertEquals(WorkerStatus.STOPPED, state.status());
    }

    @Test
    @DisplayName("publishes STARTED with the initial value and FINISHED with the final value")
    void publishesLifecycleEvents() throws InterruptedException {
        var state = new WorkerState(7);
        Thread thread = startWorker(5, state);
        awaitCounter(state, 9);

        state.requestTermination();
        thread.join(5_000);

        assertEquals(2, events.size());
        assertEquals(WorkerEvent.Type.STARTED, events.get(0).type());
        assertEquals(7, events.get(0).value());
        assertEquals(WorkerEvent.Type.FINISHED, events.get(1).type());
        assertEquals(state.counter(), events.get(1).value());
        assertEquals(WorkerId.of(5), events.get(1).workerId());
    }

    @Test
    @DisplayName("every increment is counted as a tick")
    void recordsTicks() throws InterruptedException {
        var state = new WorkerState(0);
        Thread thread = startWorker(6, state);
        awaitCounter(state, 3);

        state.requestTermination();
        thread.join(5_000);

        var ticks = meterRegistry.find("spindle.workers.ticks").counter();
        assertNotNull(ticks);
        assertEquals((double) state.counter(), ticks.count());
    }
}
