package com.spindle.core.logging;

import com.spindle.core.worker.WorkerId;
import org.slf4j.MDC;

/**
 * Utility for managing Spindle-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setWorker(WorkerId workerId) {
        MDC.put("workerId", workerId.toString());
    }

    public static void setCommand(String command) {
        MDC.put("command", command);
    }

    public static void clearCommand() {
        MDC.remove("command");
    }

    public static void clear() {
        MDC.remove("workerId");
        MDC.remove("command");
    }
}
