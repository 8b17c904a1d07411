package com.spindle.dispatch.cli;

import com.spindle.core.config.SpindleProperties;
import com.spindle.core.events.WorkerEventBus;
import com.spindle.core.worker.WorkerInitializer;
import com.spindle.core.worker.WorkerRegistry;
import com.spindle.dispatch.console.CommandDispatcher;
import com.spindle.dispatch.console.ConsoleSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Top-level command: spindle [--threads N] [--delay SECONDS]
 * <p>
 * Starts the worker initializer, then reads console commands from standard input
 * until {@code stop} or end of input. Returns once every worker and the
 * initializer have finished.
 */
@Command(
        name = "spindle",
        mixinStandardHelpOptions = true,
        version = "Spindle 0.1.0",
        description = "Interactive worker lifecycle manager"
)
@Component
public class SpindleCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SpindleCommand.class);

    @Option(names = {"--threads", "-t"},
            description = "Number of workers to start (default: spindle.workers.count, else available processors)")
    private Integer threads;

    @Option(names = {"--delay", "-d"},
            description = "Seconds between two worker starts (default: spindle.workers.start-delay)")
    private Integer delaySeconds;

    @Spec
    private CommandSpec spec;

    private final WorkerRegistry registry;
    private final WorkerInitializer initializer;
    private final CommandDispatcher dispatcher;
    private final WorkerEventBus eventBus;
    private final SpindleProperties properties;
    private final InputStream input;

    @Autowired
    public SpindleCommand(WorkerRegistry registry, WorkerInitializer initializer, CommandDispatcher dispatcher,
                          WorkerEventBus eventBus, SpindleProperties properties) {
        this(registry, initializer, dispatcher, eventBus, properties, System.in);
    }

    SpindleCommand(WorkerRegistry registry, WorkerInitializer initializer, CommandDispatcher dispatcher,
                   WorkerEventBus eventBus, SpindleProperties properties, InputStream input) {
        this.registry = registry;
        this.initializer = initializer;
        this.dispatcher = dispatcher;
        this.eventBus = eventBus;
        this.properties = properties;
        this.input = input;
    }

    @Override
    public Integer call() {
        int count = threads != null ? requireNonNegative(threads, "--threads") : properties.resolveWorkerCount();
        Duration startDelay = delaySeconds != null
                ? Duration.ofSeconds(requireNonNegative(delaySeconds, "--delay"))
                : properties.getStartDelay();

        ConsoleOutput.printBanner();
        ConsoleOutput.info("Starting " + count + " worker(s), " + startDelay.toSeconds()
                + "s apart. Type 'help' for commands.");

        var subscription = eventBus.subscribe(ConsoleOutput::workerEvent);
        try {
            initializer.start(count, startDelay);

            var reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
            boolean stopped = new ConsoleSession(reader, dispatcher).run();
            if (!stopped) {
                ConsoleOutput.info("Input closed, stopping all workers...");
                registry.shutdown();
            }

            initializer.awaitCompletion();
            log.info("Spindle finished: {} worker(s) started by the initializer", initializer.spawnedCount());
            return 0;
        } finally {
            subscription.unsubscribe();
        }
    }

    private int requireNonNegative(int value, String option) {
        if (value < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Value of " + option + " must be a non-negative integer but was " + value);
        }
        return value;
    }
}
