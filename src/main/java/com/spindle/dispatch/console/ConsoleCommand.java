package com.spindle.dispatch.console;

import com.spindle.core.worker.WorkerId;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * One console line split into a command name and its arguments.
 *
 * @param name      first whitespace-separated token, empty for a blank line
 * @param arguments remaining tokens
 */
public record ConsoleCommand(String name, List<String> arguments) {

    public ConsoleCommand {
        arguments = List.copyOf(arguments);
    }

    public static ConsoleCommand parse(String line) {
        String trimmed = line == null ? "" : line.strip();
        if (trimmed.isEmpty()) {
            return new ConsoleCommand("", List.of());
        }
        String[] tokens = trimmed.split("\\s+");
        return new ConsoleCommand(tokens[0], Arrays.asList(tokens).subList(1, tokens.length));
    }

    public boolean isBlank() {
        return name.isEmpty();
    }

    public Optional<String> argument(int index) {
        return index < arguments.size() ? Optional.of(arguments.get(index)) : Optional.empty();
    }

    /**
     * Reads an optional integer argument. A missing or malformed value is treated as absent.
     */
    public OptionalLong optionalLong(int index) {
        Optional<String> raw = argument(index);
        if (raw.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(raw.get()));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    /**
     * Reads a worker id argument.
     *
     * @return empty when the argument is missing or not a positive integer
     */
    public Optional<WorkerId> workerId(int index) {
        return argument(index).flatMap(WorkerId::parse);
    }
}
