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
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaWorkflowStorage implements WorkflowStorage {

    private final WorkflowRepository               workflowRepository;
    private final WorkflowNodeRepository           nodeRepository;
    private final WorkflowConnectionRepository     connectionRepository;
    private final EventRepository                  eventRepository;
    private final WorkflowExecutionRepository      executionRepository;
    private final WorkflowExecutionEventRepository executionEventRepository;
    private final WorkflowLogRepository            logRepository;

    @Override
    public Optional<Workflow> getWorkflow(Long workflowId) {
        return workflowRepository.findById(workflowId);
    }

    @Override
    public List<Workflow> getAllWorkflows(WorkflowStatus status, WorkflowTriggerType triggerType) {
        return workflowRepository.findByStatusAndTriggerType(status, triggerType);
    }

    @Override
    public Optional<Workflow> getWorkflowByWebhookKey(String webhookKey) {
        return workflowRepository.findByWebhookKey(webhookKey);
    }

    @Override
    public Workflow saveWorkflow(Workflow workflow) {
        return workflowRepository.save(workflow);
    }

    @Override
    @Transactional
    public void deleteWorkflow(Long workflowId) {
        connectionRepository.deleteAll(connectionRepository.findByWorkflowIdOrderByIdAsc(workflowId));
        nodeRepository.deleteAll(nodeRepository.findByWorkflowIdOrderByIdAsc(workflowId));
        workflowRepository.deleteById(workflowId);
    }

    @Override
    public List<WorkflowNode> getWorkflowNodes(Long workflowId) {
        return nodeRepository.findByWorkflowIdOrderByIdAsc(workflowId);
    }

    @Override
    public List<WorkflowConnection> getWorkflowConnections(Long workflowId) {
        return connectionRepository.findByWorkflowIdOrderByIdAsc(workflowId);
    }

    @Override
    public Optional<Event> getEvent(Long eventId) {
        return eventRepository.findById(eventId);
    }

    @Override
    public WorkflowExecution createWorkflowExecution(WorkflowExecution execution) {
        return executionRepository.save(execution);
    }

    @Override
    @Transactional
    public WorkflowExecution updateWorkflowExecution(Long executionId, ExecutionOutcome outcome) {
        WorkflowExecution execution = executionRepository.findById(executionId)
                .orElseThrow(() -> new IllegalStateException("Workflow execution not found: " + executionId));
        execution.setStatus(outcome.status());
        execution.setCompletedAt(outcome.completedAt());
        execution.setTotalDuration(outcome.totalDuration());
        execution.setTotalEvents(outcome.totalEvents());
        execution.setSuccessfulEvents(outcome.successfulEvents());
        execution.setFailedEvents(outcome.failedEvents());
        return executionRepository.save(execution);
    }

    @Override
    public Optional<WorkflowExecution> getWorkflowExecution(Long executionId) {
        return executionRepository.findById(executionId);
    }

    @Override
    public List<WorkflowExecution> getWorkflowExecutions(Long workflowId) {
        return executionRepository.findByWorkflowIdOrderByStartedAtDesc(workflowId);
    }

    @Override
    public WorkflowExecutionEvent createWorkflowExecutionEvent(WorkflowExecutionEvent executionEvent) {
        return executionEventRepository.save(executionEvent);
    }

    @Override
    public List<WorkflowExecutionEvent> getWorkflowExecutionEvents(Long executionId) {
        return executionEventRepository.findByWorkflowExecutionIdOrderBySequenceOrderAsc(executionId);
    }

    @Override
    public WorkflowLog createWorkflowLog(WorkflowLog workflowLog) {
        return logRepository.save(workflowLog);
    }

    @Override
    @Transactional
    public WorkflowLog updateWorkflowLog(Long logId, WorkflowLogUpdate update) {
        WorkflowLog entry = logRepository.findById(logId)
                .orElseThrow(() -> new IllegalStateException("Workflow log not found: " + logId));
        if (update.status() != null)  entry.setStatus(update.status());
        if (update.level() != null)   entry.setLevel(update.level());
        if (update.message() != null) entry.setMessage(update.message());
        if (update.output() != null)  entry.setOutput(update.output());
        if (update.error() != null)   entry.setError(update.error());
        if (update.endTime() != null) entry.setEndTime(update.endTime());
        return logRepository.save(entry);
    }

    @Override
    public List<WorkflowLog> getWorkflowLogs(Long workflowId) {
        return logRepository.findByWorkflowIdOrderByTimestampDesc(workflowId);
    }
}
