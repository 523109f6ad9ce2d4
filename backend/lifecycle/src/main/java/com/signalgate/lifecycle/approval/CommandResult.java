package com.signalgate.lifecycle.approval;

import com.signalgate.core.model.Signal;
import com.signalgate.lifecycle.dispatch.DispatchSummary;

/**
 * Outcome of a lifecycle operation, returned to the command layer instead of being thrown.
 */
public record CommandResult(
        boolean success,
        CommandError error,
        String message,
        Signal signal,
        DispatchSummary dispatch
) {
    public static CommandResult ok(String message, Signal signal, DispatchSummary dispatch) {
        return new CommandResult(true, null, message, signal, dispatch);
    }

    public static CommandResult failure(CommandError error, String message, Signal signal) {
        return new CommandResult(false, error, message, signal, null);
    }
}
