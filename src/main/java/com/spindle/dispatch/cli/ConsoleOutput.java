package com.spindle.dispatch.cli;

import com.spindle.core.events.WorkerEvent;
import com.spindle.core.worker.WorkerSnapshot;
import com.spindle.dispatch.console.ConsoleVerb;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the Spindle console.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SPINDLE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SPINDLE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void worker(WorkerSnapshot snapshot) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) Worker (id=" + snapshot.id() + ")|@, value = " + snapshot.counter()
                + " @|faint [" + snapshot.status() + "]|@"));
    }

    public static void workerEvent(WorkerEvent event) {
        String text = switch (event.type()) {
            case STARTED -> "@|fg(magenta) [WORKER]|@ Worker (id=" + event.workerId()
                    + ") was started, initial value = " + event.value();
            case FINISHED -> "@|fg(magenta) [WORKER]|@ Worker (id=" + event.workerId()
                    + ") was finished, value = " + event.value();
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(text));
    }

    public static void help(List<ConsoleVerb> verbs) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Commands|@"));
        for (ConsoleVerb verb : verbs) {
            System.out.printf("  %-24s %s%n", verb.usage(), verb.description());
        }
    }
}
