package com.cronflow.cronflow_backend.model.run;

import com.cronflow.cronflow_backend.model.domain.Workflow;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Working state of one execution. Owned by a single background task and discarded when the
 * run is finalized; two executions of the same workflow never share one.
 */
@Getter
public class WorkflowRun {

    private final Workflow workflow;
    private final Long executionId;
    private final String userId;
    private final Map<String, Object> initialInput;
    private final WorkflowGraph graph;

    // Insertion order = execution order
    private final Map<Long, NodeResult> results = new LinkedHashMap<>();
    private int sequence = 0;

    public WorkflowRun(Workflow workflow, Long executionId, String userId,
                       Map<String, Object> initialInput, WorkflowGraph graph) {
        this.workflow = workflow;
        this.executionId = executionId;
        this.userId = userId;
        this.initialInput = initialInput != null ? initialInput : Map.of();
        this.graph = graph;
    }

    public Long getWorkflowId() {
        return workflow.getId();
    }

    public boolean hasResult(Long nodeId) {
        return results.containsKey(nodeId);
    }

    public NodeResult result(Long nodeId) {
        return results.get(nodeId);
    }

    public void record(Long nodeId, NodeResult result) {
        results.put(nodeId, result);
    }

    public Map<Long, NodeResult> getResults() {
        return Collections.unmodifiableMap(results);
    }

    /** Run-wide counter, 1-based, one value per node handed to the event runner. */
    public int nextSequence() {
        return ++sequence;
    }

    public int totalEvents() {
        return results.size();
    }

    public int successfulEvents() {
        return (int) results.values().stream().filter(NodeResult::success).count();
    }

    public int failedEvents() {
        return totalEvents() - successfulEvents();
    }

    /** An execution succeeds only if every node that ran succeeded; nodes never reached do not count. */
    public boolean allSucceeded() {
        return results.values().stream().allMatch(NodeResult::success);
    }
}
