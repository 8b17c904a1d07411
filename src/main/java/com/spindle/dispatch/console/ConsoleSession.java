package com.spindle.dispatch.console;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;

/**
 * Reads console lines and hands each one to the {@link CommandDispatcher}
 * until {@code stop} is entered or input ends.
 */
public class ConsoleSession {

    private static final Logger log = LoggerFactory.getLogger(ConsoleSession.class);

    private final BufferedReader reader;
    private final CommandDispatcher dispatcher;

    public ConsoleSession(BufferedReader reader, CommandDispatcher dispatcher) {
        this.reader = reader;
        this.dispatcher = dispatcher;
    }

    /**
     * Runs the read loop on the calling thread.
     *
     * @return true if the session ended with {@code stop}, false if input ended first
     */
    public boolean run() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (dispatcher.dispatch(ConsoleCommand.parse(line)) == DispatchResult.STOP) {
                    return true;
                }
            }
            log.info("Console input closed");
        } catch (IOException e) {
            log.error("Failed to read console input: {}", e.getMessage(), e);
        }
        return false;
    }
}
