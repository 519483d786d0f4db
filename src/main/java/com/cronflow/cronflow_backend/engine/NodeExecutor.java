package com.cronflow.cronflow_backend.engine;

import com.cronflow.cronflow_backend.ConnectionType;
import com.cronflow.cronflow_backend.engine.runner.EventRunner;
import com.cronflow.cronflow_backend.model.domain.Event;
import com.cronflow.cronflow_backend.model.domain.LogStatus;
import com.cronflow.cronflow_backend.model.domain.WorkflowConnection;
import com.cronflow.cronflow_backend.model.domain.WorkflowExecutionEvent;
import com.cronflow.cronflow_backend.model.domain.WorkflowLogLevel;
import com.cronflow.cronflow_backend.model.domain.WorkflowNode;
import com.cronflow.cronflow_backend.model.run.EventExecutionResult;
import com.cronflow.cronflow_backend.model.run.NodeResult;
import com.cronflow.cronflow_backend.model.run.WorkflowGraph;
import com.cronflow.cronflow_backend.model.run.WorkflowRun;
import com.cronflow.cronflow_backend.repository.WorkflowStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Runs the nodes of one workflow run, depth-first from an entry node.
 *
 * A node fires only when every incoming connection is satisfied by its source node's result
 * (AND of all incoming edges). A node reached while some predecessor has not run yet is left
 * alone; it runs later if another predecessor reaches it once everything is satisfied, and
 * otherwise stays unexecuted for this run. Each node runs at most once per run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NodeExecutor {

    private final WorkflowStorage   storage;
    private final EventRunner       eventRunner;
    private final WorkflowLogWriter runLog;
    private final Clock             clock;

    // A node waiting on the frontier, with the connection that fired it (null for an entry node)
    private record Activation(WorkflowNode node, WorkflowConnection firedBy) {}

    public void executeFrom(WorkflowRun run, WorkflowNode entryNode) {
        WorkflowGraph graph = run.getGraph();
        Deque<Activation> frontier = new ArrayDeque<>();
        frontier.push(new Activation(entryNode, null));

        while (!frontier.isEmpty()) {
            Activation current = frontier.pop();
            WorkflowNode node = current.node();

            if (run.hasResult(node.getId())) continue;

            if (!prerequisitesSatisfied(run, node)) {
                logWaiting(run, node);
                continue;
            }

            NodeResult result = execute(run, node, current.firedBy());

            // Pushed in reverse so the first outgoing connection is explored first
            List<WorkflowConnection> outgoing = graph.outgoing(node.getId());
            for (int i = outgoing.size() - 1; i >= 0; i--) {
                WorkflowConnection connection = outgoing.get(i);
                WorkflowNode target = graph.node(connection.getTargetNodeId());
                if (target != null && connection.getConnectionType().isSatisfiedBy(result)) {
                    frontier.push(new Activation(target, connection));
                }
            }
        }
    }

    boolean prerequisitesSatisfied(WorkflowRun run, WorkflowNode node) {
        return run.getGraph().incoming(node.getId()).stream()
                .allMatch(c -> c.getConnectionType().isSatisfiedBy(run.result(c.getSourceNodeId())));
    }

    private NodeResult execute(WorkflowRun run, WorkflowNode node, WorkflowConnection firedBy) {
        Long workflowId = run.getWorkflowId();
        try {
            Event event = storage.getEvent(node.getEventId())
                    .orElseThrow(() -> new IllegalStateException(
                            "Event " + node.getEventId() + " not found for node " + node.getId()));

            Map<String, Object> input = InputResolver.resolve(
                    run.getGraph().incoming(node.getId()), run.getResults(), run.getInitialInput());
            int sequenceOrder = run.nextSequence();
            log.info("Workflow {}: node {} runs event {} as step {}", workflowId, node.getId(), event.getId(), sequenceOrder);
            log.debug("Workflow {}: node {} resolved input {}", workflowId, node.getId(), input);

            Instant startedAt = clock.instant();
            EventExecutionResult executed = eventRunner.executeEvent(
                    event.getId(), run.getExecutionId(), sequenceOrder, input, workflowId);
            Instant completedAt = clock.instant();
            long duration = executed.duration() != null
                    ? executed.duration()
                    : Duration.between(startedAt, completedAt).toMillis();

            NodeResult result = NodeResult.of(executed);
            // The step row is the record of this result; it is only kept once the row exists
            storage.createWorkflowExecutionEvent(toExecutionEvent(
                    run, node, event, sequenceOrder, result, startedAt, completedAt, duration, firedBy));
            run.record(node.getId(), result);

            logNodeOutcome(run, node, event, result);
            return result;

        } catch (Exception ex) {
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Workflow {}: node {} failed: {}", workflowId, node.getId(), msg, ex);
            NodeResult failed = NodeResult.failure(msg);
            run.record(node.getId(), failed);
            try {
                runLog.error(workflowId, run.getUserId(), "Node " + node.getId() + " execution failed: " + msg, msg);
            } catch (Exception logEx) {
                log.error("Workflow {}: could not write failure log for node {}", workflowId, node.getId(), logEx);
            }
            return failed;
        }
    }

    private WorkflowExecutionEvent toExecutionEvent(WorkflowRun run, WorkflowNode node, Event event, int sequenceOrder,
                                                    NodeResult result, Instant startedAt, Instant completedAt,
                                                    long duration, WorkflowConnection firedBy) {
        WorkflowExecutionEvent row = new WorkflowExecutionEvent();
        row.setWorkflowExecutionId(run.getExecutionId());
        row.setEventId(event.getId());
        row.setNodeId(node.getId());
        row.setSequenceOrder(sequenceOrder);
        row.setStatus(result.success() ? LogStatus.SUCCESS : LogStatus.FAILURE);
        row.setStartedAt(startedAt);
        row.setCompletedAt(completedAt);
        row.setDuration(duration);
        row.setOutput(result.output());
        row.setErrorMessage(result.success() ? null : (result.output().isEmpty() ? "Unknown error" : result.output()));
        ConnectionType connectionType = firedBy != null ? firedBy.getConnectionType() : null;
        row.setConnectionType(connectionType);
        return row;
    }

    private void logNodeOutcome(WorkflowRun run, WorkflowNode node, Event event, NodeResult result) {
        try {
            runLog.append(run.getWorkflowId(), run.getUserId(),
                    result.success() ? WorkflowLogLevel.INFO : WorkflowLogLevel.ERROR, null,
                    "Node " + node.getId() + " (Event " + event.getName() + "): " + (result.success() ? "SUCCESS" : "FAILURE"),
                    null);
        } catch (Exception ex) {
            log.error("Workflow {}: could not write outcome log for node {}", run.getWorkflowId(), node.getId(), ex);
        }
    }

    private void logWaiting(WorkflowRun run, WorkflowNode node) {
        try {
            runLog.info(run.getWorkflowId(), run.getUserId(),
                    "Node " + node.getId() + " waiting for prerequisite nodes to complete");
        } catch (Exception ex) {
            log.error("Workflow {}: could not write waiting log for node {}", run.getWorkflowId(), node.getId(), ex);
        }
    }
}
