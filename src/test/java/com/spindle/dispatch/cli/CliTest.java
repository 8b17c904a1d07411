package com.spindle.dispatch.cli;

import com.spindle.core.config.SpindleProperties;
import com.spindle.core.events.WorkerEvent;
import com.spindle.core.events.WorkerEventBus;
import com.spindle.core.worker.WorkerId;
import com.spindle.core.worker.WorkerInitializer;
import com.spindle.core.worker.WorkerRegistry;
import com.spindle.dispatch.console.CommandDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the spindle process command.
 * These tests exercise picocli directly without Spring context, feeding console
 * input from a string and capturing all output.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private WorkerRegistry registry;
    private WorkerInitializer initializer;
    private WorkerEventBus eventBus;
    private SpindleProperties properties;

    @BeforeEach
    void setUp() {
        registry = mock(WorkerRegistry.class);
        when(registry.info()).thenReturn(List.of());
        initializer = mock(WorkerInitializer.class);
        eventBus = new WorkerEventBus();
        properties = new SpindleProperties();
        properties.getWorkers().setCount(3);
    }

    private CliResult execute(String consoleInput, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            var input = new ByteArrayInputStream(consoleInput.getBytes(StandardCharsets.UTF_8));
            var command = new SpindleCommand(registry, initializer, new CommandDispatcher(registry),
                    eventBus, properties, input);
            int exitCode = new CommandLine(command).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists the startup options")
        void helpListsOptions() {
            CliResult result = execute("", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--threads"));
            assertTrue(result.output().contains("--delay"));
            assertTrue(result.output().contains("Interactive worker lifecycle manager"));
            verifyNoInteractions(initializer);
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            CliResult result = execute("", "--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Spindle 0.1.0"));
        }
    }

    @Nested
    @DisplayName("Startup options")
    class StartupTests {

        @Test
        @DisplayName("flags override configured count and delay")
        void flagsOverrideConfig() {
            CliResult result = execute("stop\n", "--threads", "2", "--delay", "0");

            assertEquals(0, result.exitCode());
            verify(initializer).start(2, Duration.ZERO);
        }

        @Test
        @DisplayName("configuration is used when no flags are given")
        void configDefaults() {
            execute("stop\n");
            verify(initializer).start(3, Duration.ofSeconds(1));
        }

        @Test
        @DisplayName("short flags are accepted")
        void shortFlags() {
            execute("stop\n", "-t", "0", "-d", "5");
            verify(initializer).start(0, Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("negative values are rejected before anything starts")
        void negativeRejected() {
            CliResult result = execute("stop\n", "--threads", "-1");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("non-negative"));
            verify(initializer, never()).start(anyInt(), any());
            verifyNoInteractions(registry);
        }

        @Test
        @DisplayName("non-numeric values are rejected")
        void nonNumericRejected() {
            CliResult result = execute("stop\n", "--delay", "soon");

            assertEquals(2, result.exitCode());
            verifyNoInteractions(initializer);
        }

        @Test
        @DisplayName("unknown flags are rejected")
        void unknownFlagRejected() {
            CliResult result = execute("stop\n", "--workers", "4");
            assertEquals(2, result.exitCode());
        }
    }

    @Nested
    @DisplayName("Console session")
    class SessionTests {

        @Test
        @DisplayName("stop shuts down, then the initializer is joined")
        void stopThenJoin() {
            CliResult result = execute("info\nstop\n", "-t", "1", "-d", "0");

            assertEquals(0, result.exitCode());
            InOrder order = inOrder(initializer, registry);
            order.verify(initializer).start(1, Duration.ZERO);
            order.verify(registry).info();
            order.verify(registry).shutdown();
            order.verify(initializer).awaitCompletion();
            assertTrue(result.output().contains("All workers stopped"));
        }

        @Test
        @DisplayName("end of input behaves like stop")
        void endOfInputStops() {
            CliResult result = execute("info\n", "-t", "1");

            assertEquals(0, result.exitCode());
            verify(registry).shutdown();
            verify(initializer).awaitCompletion();
            assertTrue(result.output().contains("Input closed"));
        }

        @Test
        @DisplayName("worker events are printed while the session runs")
        void printsWorkerEvents() {
            doAnswer(inv -> {
                eventBus.publish(WorkerEvent.started(WorkerId.of(1), 12));
                eventBus.publish(WorkerEvent.finished(WorkerId.of(1), 15));
                return null;
            }).when(initializer).start(anyInt(), any());

            CliResult result = execute("stop\n", "-t", "1");

            assertTrue(result.output().contains("Worker (id=1) was started, initial value = 12"));
            assertTrue(result.output().contains("Worker (id=1) was finished, value = 15"));
        }

        @Test
        @DisplayName("events after the session ends are not printed")
        void unsubscribesAfterSession() {
            CliResult result = execute("stop\n", "-t", "0");
            eventBus.publish(WorkerEvent.started(WorkerId.of(5), 1));

            assertFalse(result.output().contains("id=5"));
        }
    }
}
