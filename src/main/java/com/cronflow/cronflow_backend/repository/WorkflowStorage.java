package com.cronflow.cronflow_backend.repository;

import com.cronflow.cronflow_backend.WorkflowStatus;
import com.cronflow.cronflow_backend.WorkflowTriggerType;
import com.cronflow.cronflow_backend.model.domain.Event;
import com.cronflow.cronflow_backend.model.domain.Workflow;
import com.cronflow.cronflow_backend.model.domain.WorkflowConnection;
import com.cronflow.cronflow_backend.model.domain.WorkflowExecution;
import com.cronflow.cronflow_backend.model.domain.WorkflowExecutionEvent;
import com.cronflow.cronflow_backend.model.domain.WorkflowLog;
import com.cronflow.cronflow_backend.model.domain.WorkflowNode;
import com.cronflow.cronflow_backend.model.run.ExecutionOutcome;
import com.cronflow.cronflow_backend.model.run.WorkflowLogUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Durable store the engine and the job registry read from and write to. Everything the engine
 * persists goes through here, so the engine never touches a repository directly.
 */
public interface WorkflowStorage {

    Optional<Workflow> getWorkflow(Long workflowId);

    List<Workflow> getAllWorkflows(WorkflowStatus status, WorkflowTriggerType triggerType);

    Optional<Workflow> getWorkflowByWebhookKey(String webhookKey);

    Workflow saveWorkflow(Workflow workflow);

    /** Removes the workflow together with its nodes and connections. */
    void deleteWorkflow(Long workflowId);

    List<WorkflowNode> getWorkflowNodes(Long workflowId);

    List<WorkflowConnection> getWorkflowConnections(Long workflowId);

    Optional<Event> getEvent(Long eventId);

    WorkflowExecution createWorkflowExecution(WorkflowExecution execution);

    WorkflowExecution updateWorkflowExecution(Long executionId, ExecutionOutcome outcome);

    Optional<WorkflowExecution> getWorkflowExecution(Long executionId);

    List<WorkflowExecution> getWorkflowExecutions(Long workflowId);

    WorkflowExecutionEvent createWorkflowExecutionEvent(WorkflowExecutionEvent executionEvent);

    List<WorkflowExecutionEvent> getWorkflowExecutionEvents(Long executionId);

    WorkflowLog createWorkflowLog(WorkflowLog workflowLog);

    WorkflowLog updateWorkflowLog(Long logId, WorkflowLogUpdate update);

    List<WorkflowLog> getWorkflowLogs(Long workflowId);
}
