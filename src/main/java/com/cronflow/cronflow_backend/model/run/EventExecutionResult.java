package com.cronflow.cronflow_backend.model.run;

/**
 * What an {@link com.cronflow.cronflow_backend.engine.runner.EventRunner} reports back for one event.
 *
 * @param duration     milliseconds measured by the runner itself, null to let the caller time it
 * @param scriptOutput payload the event passed to {@code flow.output(...)}, or a parsed JSON response body
 * @param condition    value passed to {@code flow.setCondition(...)}, null when never called
 */
public record EventExecutionResult(boolean success,
                                   String output,
                                   Long duration,
                                   Object scriptOutput,
                                   Boolean condition) {

    public static EventExecutionResult ok(String output) {
        return new EventExecutionResult(true, output, null, null, null);
    }

    public static EventExecutionResult error(String message) {
        return new EventExecutionResult(false, message, null, null, null);
    }

    public EventExecutionResult withDuration(long durationMs) {
        return new EventExecutionResult(success, output, durationMs, scriptOutput, condition);
    }
}
