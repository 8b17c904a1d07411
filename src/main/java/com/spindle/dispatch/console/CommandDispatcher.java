package com.spindle.dispatch.console;

import com.spindle.core.logging.MdcContext;
import com.spindle.core.worker.WorkerId;
import com.spindle.core.worker.WorkerRegistry;
import com.spindle.core.worker.WorkerSnapshot;
import com.spindle.dispatch.cli.ConsoleOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Translates console commands into {@link WorkerRegistry} calls and prints the outcome.
 * <p>
 * Malformed optional numbers are treated as absent; a missing or malformed worker id
 * aborts only the command at hand. Unknown ids are silently ignored.
 */
@Component
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final WorkerRegistry registry;

    public CommandDispatcher(WorkerRegistry registry) {
        this.registry = registry;
    }

    public DispatchResult dispatch(ConsoleCommand command) {
        if (command.isBlank()) {
            ConsoleOutput.error("Unknown command. Type 'help' for the list");
            return DispatchResult.CONTINUE;
        }
        Optional<ConsoleVerb> verb = ConsoleVerb.fromKeyword(command.name());
        if (verb.isEmpty()) {
            ConsoleOutput.error("Unknown command: " + command.name() + " (type 'help' for the list)");
            return DispatchResult.CONTINUE;
        }

        MdcContext.setCommand(command.name());
        try {
            log.debug("Dispatching {} {}", command.name(), command.arguments());
            switch (verb.get()) {
                case INFO -> info();
                case NEW -> spawn(command);
                case KILL -> kill(command);
                case RESET -> reset(command);
                case HELP -> ConsoleOutput.help(List.of(ConsoleVerb.values()));
                case STOP -> {
                    stop();
                    return DispatchResult.STOP;
                }
            }
            return DispatchResult.CONTINUE;
        } finally {
            MdcContext.clearCommand();
        }
    }

    private void info() {
        List<WorkerSnapshot> workers = registry.info();
        if (workers.isEmpty()) {
            ConsoleOutput.info("No workers running");
            return;
        }
        workers.forEach(ConsoleOutput::worker);
    }

    private void spawn(ConsoleCommand command) {
        OptionalLong initialValue = command.optionalLong(0);
        registry.spawn(initialValue).ifPresentOrElse(
                id -> ConsoleOutput.success("Worker (id=" + id + ") spawned"),
                () -> ConsoleOutput.error("Cannot start a worker: shutdown in progress"));
    }

    private void kill(ConsoleCommand command) {
        Optional<WorkerId> id = command.workerId(0);
        if (id.isEmpty()) {
            ConsoleOutput.error("Please provide worker id. Usage: " + ConsoleVerb.KILL.usage());
            return;
        }
        if (registry.kill(id.get())) {
            ConsoleOutput.success("Worker (id=" + id.get() + ") killed");
        }
    }

    private void reset(ConsoleCommand command) {
        Optional<WorkerId> id = command.workerId(0);
        if (id.isEmpty()) {
            ConsoleOutput.error("Please provide worker id. Usage: " + ConsoleVerb.RESET.usage());
            return;
        }
        long newValue = command.optionalLong(1).orElse(0L);
        if (registry.reset(id.get(), newValue)) {
            ConsoleOutput.info("Worker (id=" + id.get() + "), new value is " + newValue);
        }
    }

    private void stop() {
        ConsoleOutput.info("Stopping all workers...");
        registry.shutdown();
        ConsoleOutput.success("All workers stopped");
    }
}
