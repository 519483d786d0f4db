package com.cronflow.cronflow_backend.engine.runner;

import com.cronflow.cronflow_backend.model.run.EventExecutionResult;

import java.util.Map;

/**
 * Executes one event (script or HTTP action) on behalf of a workflow node.
 * Implementations report failures through {@link EventExecutionResult#success()}; a thrown
 * exception is treated by the engine as a failed node.
 */
public interface EventRunner {

    EventExecutionResult executeEvent(Long eventId,
                                      Long executionId,
                                      Integer sequenceOrder,
                                      Map<String, Object> inputData,
                                      Long workflowId);
}
