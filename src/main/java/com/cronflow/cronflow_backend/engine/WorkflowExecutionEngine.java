package com.cronflow.cronflow_backend.engine;

import com.cronflow.cronflow_backend.WorkflowTriggerType;
import com.cronflow.cronflow_backend.model.domain.LogStatus;
import com.cronflow.cronflow_backend.model.domain.Workflow;
import com.cronflow.cronflow_backend.model.domain.WorkflowConnection;
import com.cronflow.cronflow_backend.model.domain.WorkflowExecution;
import com.cronflow.cronflow_backend.model.domain.WorkflowLog;
import com.cronflow.cronflow_backend.model.domain.WorkflowLogLevel;
import com.cronflow.cronflow_backend.model.domain.WorkflowNode;
import com.cronflow.cronflow_backend.model.run.ExecutionAck;
import com.cronflow.cronflow_backend.model.run.ExecutionOutcome;
import com.cronflow.cronflow_backend.model.run.NodeResult;
import com.cronflow.cronflow_backend.model.run.WorkflowGraph;
import com.cronflow.cronflow_backend.model.run.WorkflowLogUpdate;
import com.cronflow.cronflow_backend.model.run.WorkflowRun;
import com.cronflow.cronflow_backend.repository.WorkflowStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Drives a whole workflow run. {@link #executeWorkflow} records the execution and returns at
 * once; the graph walk happens on the workflow task executor and ends by writing the terminal
 * status, counts and duration onto the execution row. Callers poll that row for the outcome.
 */
@Slf4j
@Service
public class WorkflowExecutionEngine {

    private final WorkflowStorage   storage;
    private final NodeExecutor      nodeExecutor;
    private final WorkflowLogWriter runLog;
    private final TaskExecutor      taskExecutor;
    private final Clock             clock;

    public WorkflowExecutionEngine(WorkflowStorage storage,
                                   NodeExecutor nodeExecutor,
                                   WorkflowLogWriter runLog,
                                   @Qualifier("workflowTaskExecutor") TaskExecutor taskExecutor,
                                   Clock clock) {
        this.storage = storage;
        this.nodeExecutor = nodeExecutor;
        this.runLog = runLog;
        this.taskExecutor = taskExecutor;
        this.clock = clock;
    }

    public ExecutionAck executeWorkflow(Long workflowId, String userId, Map<String, Object> inputData) {
        return executeWorkflow(workflowId, userId, inputData, WorkflowTriggerType.MANUAL);
    }

    /**
     * Starts a run and acknowledges it immediately.
     *
     * @throws IllegalArgumentException when the workflow does not exist; nothing else escapes
     */
    public ExecutionAck executeWorkflow(Long workflowId, String userId, Map<String, Object> inputData,
                                        WorkflowTriggerType triggerType) {
        Map<String, Object> input = inputData != null ? new LinkedHashMap<>(inputData) : new LinkedHashMap<>();
        log.info("Executing workflow {} ({}) with input: {}", workflowId, triggerType, input);

        Workflow workflow = storage.getWorkflow(workflowId)
                .orElseThrow(() -> new IllegalArgumentException("Workflow not found: " + workflowId));
        String executionUserId = userId != null ? userId : workflow.getUserId();
        Instant startedAt = now();

        Map<String, Object> executionData = new LinkedHashMap<>();
        executionData.put("triggerType", triggerType.name());
        executionData.put("triggeredAt", startedAt.toString());
        executionData.put("inputData", input);

        WorkflowExecution execution = new WorkflowExecution();
        execution.setWorkflowId(workflow.getId());
        execution.setUserId(executionUserId);
        execution.setStatus(LogStatus.RUNNING);
        execution.setTriggerType(triggerType);
        execution.setStartedAt(startedAt);
        execution.setExecutionData(executionData);
        execution = storage.createWorkflowExecution(execution);

        final Long executionId = execution.getId();
        log.info("Created workflow execution {} for workflow {}", executionId, workflowId);

        try {
            taskExecutor.execute(() -> runInBackground(workflow, executionId, executionUserId, startedAt, input));
        } catch (RejectedExecutionException ex) {
            String msg = "Workflow execution could not be started: " + ex.getMessage();
            log.error("Workflow {}: execution {} rejected by the task executor", workflowId, executionId, ex);
            finalizeAsFailure(workflow, executionId, executionUserId, startedAt, null, msg);
            return new ExecutionAck(false, executionId, LogStatus.FAILURE);
        }
        return ExecutionAck.running(executionId);
    }

    /** Manual, on-demand run without input. */
    public ExecutionAck runWorkflowImmediately(Long workflowId) {
        return executeWorkflow(workflowId, null, Map.of(), WorkflowTriggerType.MANUAL);
    }

    void runInBackground(Workflow workflow, Long executionId, String userId,
                         Instant startedAt, Map<String, Object> input) {
        WorkflowRun run = null;
        boolean finalized = false;
        try {
            WorkflowLog runEntry = runLog.runStarted(workflow.getId(), userId, workflow.getName());

            List<WorkflowNode> nodes = storage.getWorkflowNodes(workflow.getId());
            List<WorkflowConnection> connections = storage.getWorkflowConnections(workflow.getId());
            WorkflowGraph graph = GraphResolver.resolve(nodes, connections);

            if (graph.isEmpty()) {
                ExecutionOutcome outcome = outcome(startedAt, LogStatus.FAILURE, 0, 0, 0);
                closeRunEntry(workflow, runEntry, WorkflowLogUpdate.builder()
                        .status(LogStatus.FAILURE)
                        .level(WorkflowLogLevel.WARNING)
                        .message("Workflow has no nodes to execute")
                        .output("Workflow has no nodes to execute")
                        .error("No nodes found in workflow")
                        .endTime(outcome.completedAt())
                        .build());
                storage.updateWorkflowExecution(executionId, outcome);
                finalized = true;
                log.warn("Workflow {}: execution {} failed, workflow has no nodes", workflow.getId(), executionId);
                return;
            }

            if (!graph.hasEntryNodes()) {
                ExecutionOutcome outcome = outcome(startedAt, LogStatus.FAILURE, graph.size(), 0, graph.size());
                closeRunEntry(workflow, runEntry, WorkflowLogUpdate.builder()
                        .status(LogStatus.FAILURE)
                        .level(WorkflowLogLevel.WARNING)
                        .message("Workflow has circular dependency - no starting nodes")
                        .output("Workflow has no valid starting nodes")
                        .error("No starting nodes found in workflow")
                        .endTime(outcome.completedAt())
                        .build());
                storage.updateWorkflowExecution(executionId, outcome);
                finalized = true;
                log.warn("Workflow {}: execution {} failed, no node without incoming connections", workflow.getId(), executionId);
                return;
            }

            runLog.info(workflow.getId(), userId, "Found " + graph.entryNodes().size() + " starting nodes in workflow");

            run = new WorkflowRun(workflow, executionId, userId, input, graph);
            for (WorkflowNode entryNode : graph.entryNodes()) {
                nodeExecutor.executeFrom(run, entryNode);
            }

            boolean allSucceeded = run.allSucceeded();
            ExecutionOutcome outcome = outcome(startedAt,
                    allSucceeded ? LogStatus.SUCCESS : LogStatus.FAILURE,
                    run.totalEvents(), run.successfulEvents(), run.failedEvents());

            // Narrative first; the execution row is written once, last, from the outcome already decided
            closeRunEntry(workflow, runEntry, WorkflowLogUpdate.builder()
                    .status(outcome.status())
                    .level(allSucceeded ? WorkflowLogLevel.INFO : WorkflowLogLevel.ERROR)
                    .message(allSucceeded
                            ? "Workflow completed successfully in " + outcome.totalDuration() + "ms"
                            : "Workflow completed with failures in " + outcome.totalDuration() + "ms")
                    .output(aggregateOutput(run))
                    .endTime(outcome.completedAt())
                    .build());
            reportUnreachedNodes(run);
            writeCompletionLog(workflow, userId, outcome);

            storage.updateWorkflowExecution(executionId, outcome);
            finalized = true;

            log.info("Workflow {}: execution {} finished {} ({} of {} nodes succeeded) in {}ms",
                    workflow.getId(), executionId, outcome.status(),
                    outcome.successfulEvents(), outcome.totalEvents(), outcome.totalDuration());

        } catch (Exception ex) {
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Error executing workflow {} in background (execution {}): {}", workflow.getId(), executionId, msg, ex);
            if (!finalized) {
                finalizeAsFailure(workflow, executionId, userId, startedAt, run, msg);
            }
        }
    }

    // Best effort: whatever results exist are counted, and neither write may escape the background task
    private void finalizeAsFailure(Workflow workflow, Long executionId, String userId,
                                   Instant startedAt, WorkflowRun run, String msg) {
        int total      = run != null ? run.totalEvents() : 0;
        int successful = run != null ? run.successfulEvents() : 0;
        try {
            storage.updateWorkflowExecution(executionId,
                    outcome(startedAt, LogStatus.FAILURE, total, successful, total - successful));
        } catch (Exception ex) {
            log.error("Workflow {}: could not finalize execution {}", workflow.getId(), executionId, ex);
        }
        try {
            runLog.error(workflow.getId(), userId, "Workflow execution error: " + msg, msg);
        } catch (Exception ex) {
            log.error("Workflow {}: could not write error log for execution {}", workflow.getId(), executionId, ex);
        }
    }

    private ExecutionOutcome outcome(Instant startedAt, LogStatus status,
                                     int totalEvents, int successfulEvents, int failedEvents) {
        Instant completedAt = now();
        if (completedAt.isBefore(startedAt)) {
            // wall clock stepped back during the run
            completedAt = startedAt;
        }
        long totalDuration = Duration.between(startedAt, completedAt).toMillis();
        return new ExecutionOutcome(status, completedAt, totalDuration,
                totalEvents, successfulEvents, failedEvents);
    }

    private void closeRunEntry(Workflow workflow, WorkflowLog runEntry, WorkflowLogUpdate update) {
        try {
            storage.updateWorkflowLog(runEntry.getId(), update);
        } catch (Exception ex) {
            log.error("Workflow {}: could not close run log {}", workflow.getId(), runEntry.getId(), ex);
        }
    }

    private void writeCompletionLog(Workflow workflow, String userId, ExecutionOutcome outcome) {
        boolean succeeded = outcome.status() == LogStatus.SUCCESS;
        try {
            runLog.append(workflow.getId(), userId,
                    succeeded ? WorkflowLogLevel.INFO : WorkflowLogLevel.ERROR, outcome.status(),
                    "Completed workflow execution: " + workflow.getName() + " (" + (succeeded ? "Success" : "Failure") + ")",
                    null);
        } catch (Exception ex) {
            log.error("Workflow {}: could not write completion log", workflow.getId(), ex);
        }
    }

    private String aggregateOutput(WorkflowRun run) {
        return run.getResults().entrySet().stream()
                .map(entry -> {
                    WorkflowNode node = run.getGraph().node(entry.getKey());
                    NodeResult result = entry.getValue();
                    return "Node " + entry.getKey() + " (Event " + (node != null ? node.getEventId() : null) + "): "
                            + (result.success() ? "SUCCESS" : "FAILURE") + "\n" + result.output() + "\n";
                })
                .collect(Collectors.joining("\n---\n"));
    }

    private void reportUnreachedNodes(WorkflowRun run) {
        List<Long> unreached = run.getGraph().allNodes().stream()
                .map(WorkflowNode::getId)
                .filter(id -> !run.hasResult(id))
                .toList();
        if (unreached.isEmpty()) return;
        try {
            runLog.warning(run.getWorkflowId(), run.getUserId(),
                    unreached.size() + " node(s) were not executed in this run: " + unreached);
        } catch (Exception ex) {
            log.error("Workflow {}: could not write unreached-nodes log", run.getWorkflowId(), ex);
        }
    }

    // Millisecond precision so totalDuration always equals completedAt - startedAt once stored
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
