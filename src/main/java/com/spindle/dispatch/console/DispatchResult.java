package com.spindle.dispatch.console;

/**
 * Whether the console session keeps reading after a command.
 */
public enum DispatchResult {
    CONTINUE,
    STOP
}
