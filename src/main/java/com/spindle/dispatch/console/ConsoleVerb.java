package com.spindle.dispatch.console;

import java.util.Arrays;
import java.util.Optional;

/**
 * Commands understood by the interactive console.
 */
public enum ConsoleVerb {
    INFO("info", "info", "List all workers with their counter"),
    NEW("new", "new [initialValue]", "Start a worker"),
    KILL("kill", "kill <id>", "Stop a worker and wait for it to finish"),
    RESET("reset", "reset <id> [newValue]", "Overwrite a worker's counter (default 0)"),
    STOP("stop", "stop", "Stop all workers and exit"),
    HELP("help", "help", "Show this list");

    private final String keyword;
    private final String usage;
    private final String description;

    ConsoleVerb(String keyword, String usage, String description) {
        this.keyword = keyword;
        this.usage = usage;
        this.description = description;
    }

    public String usage() { return usage; }
    public String description() { return description; }

    public static Optional<ConsoleVerb> fromKeyword(String keyword) {
        return Arrays.stream(values())
                .filter(v -> v.keyword.equals(keyword))
                .findFirst();
    }
}
