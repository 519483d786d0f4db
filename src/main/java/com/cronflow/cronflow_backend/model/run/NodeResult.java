package com.cronflow.cronflow_backend.model.run;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one node within one run. Held only in the run's result map, never persisted as-is.
 *
 * @param scriptOutput structured payload the event explicitly returned for downstream nodes, may be null
 * @param condition    flag consulted by ON_CONDITION connections, may be null when the event never set it
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeResult(boolean success, String output, Object scriptOutput, Boolean condition) {

    public static NodeResult of(EventExecutionResult result) {
        return new NodeResult(
                result.success(),
                result.output() != null ? result.output() : "",
                result.scriptOutput(),
                result.condition());
    }

    public static NodeResult failure(String message) {
        return new NodeResult(false, message, null, false);
    }
}
