package com.spindle.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.ToDoubleFunction;

/**
 * Centralised Micrometer metrics for the worker lifecycle.
 */
@Service
public class SpindleMetrics {

    private final MeterRegistry registry;

    public SpindleMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSpawn() {
        Counter.builder("spindle.workers.spawned")
                .description("Workers started")
                .register(registry)
                .increment();
    }

    public void recordKill(long joinMs) {
        Counter.builder("spindle.workers.killed")
                .description("Workers removed by kill")
                .register(registry)
                .increment();
        Timer.builder("spindle.workers.kill.duration")
                .description("Time spent waiting for a killed worker to exit")
                .register(registry)
                .record(Duration.ofMillis(joinMs));
    }

    public void recordReset() {
        Counter.builder("spindle.workers.resets")
                .register(registry)
                .increment();
    }

    public void recordTick() {
        Counter.builder("spindle.workers.ticks")
                .register(registry)
                .increment();
    }

    /**
     * Registers the active-worker gauge against its owner.
     *
     * @param owner    object the gauge samples; held weakly by Micrometer
     * @param function how to read the current count from the owner
     */
    public <T> void bindActiveWorkers(T owner, ToDoubleFunction<T> function) {
        Gauge.builder("spindle.workers.active", owner, function)
                .description("Workers currently held by the registry")
                .register(registry);
    }
}
