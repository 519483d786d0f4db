package com.cronflow.cronflow_backend.service;

import com.cronflow.cronflow_backend.ScheduleUnit;
import com.cronflow.cronflow_backend.WorkflowStatus;
import com.cronflow.cronflow_backend.WorkflowTriggerType;
import com.cronflow.cronflow_backend.engine.WorkflowExecutionEngine;
import com.cronflow.cronflow_backend.model.domain.Workflow;
import com.cronflow.cronflow_backend.model.domain.WorkflowExecution;
import com.cronflow.cronflow_backend.model.domain.WorkflowExecutionEvent;
import com.cronflow.cronflow_backend.model.domain.WorkflowLog;
import com.cronflow.cronflow_backend.model.run.ExecutionAck;
import com.cronflow.cronflow_backend.repository.WorkflowStorage;
import com.cronflow.cronflow_backend.scheduler.WorkflowJobRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Workflow lifecycle around the engine: every status or schedule change goes back through the
 * job registry so the live job always matches what is stored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowService {

    private final WorkflowStorage         storage;
    private final WorkflowExecutionEngine engine;
    private final WorkflowJobRegistry     jobRegistry;

    public Workflow getWorkflow(Long workflowId) {
        return storage.getWorkflow(workflowId)
                .orElseThrow(() -> new IllegalArgumentException("Workflow not found: " + workflowId));
    }

    public Workflow updateStatus(Long workflowId, WorkflowStatus status) {
        Workflow workflow = getWorkflow(workflowId);
        workflow.setStatus(status);
        Workflow saved = storage.saveWorkflow(workflow);
        boolean scheduled = jobRegistry.updateWorkflow(workflowId);
        log.info("Workflow {} status set to {} (scheduled: {})", workflowId, status, scheduled);
        return saved;
    }

    /**
     * Replaces the trigger and schedule fields. A custom cron, when given, takes precedence over
     * number + unit at scheduling time; an unparseable one leaves the workflow unscheduled.
     */
    public Workflow updateSchedule(Long workflowId, WorkflowTriggerType triggerType,
                                   Integer scheduleNumber, ScheduleUnit scheduleUnit, String customSchedule) {
        Workflow workflow = getWorkflow(workflowId);
        if (triggerType != null) {
            workflow.setTriggerType(triggerType);
        }
        workflow.setScheduleNumber(scheduleNumber);
        workflow.setScheduleUnit(scheduleUnit);
        workflow.setCustomSchedule(customSchedule != null && !customSchedule.isBlank() ? customSchedule : null);
        Workflow saved = storage.saveWorkflow(workflow);
        boolean scheduled = jobRegistry.updateWorkflow(workflowId);
        log.info("Workflow {} schedule updated (scheduled: {})", workflowId, scheduled);
        return saved;
    }

    public void deleteWorkflow(Long workflowId) {
        getWorkflow(workflowId);
        jobRegistry.deleteWorkflow(workflowId);
        storage.deleteWorkflow(workflowId);
        log.info("Deleted workflow {}", workflowId);
    }

    public ExecutionAck run(Long workflowId, String userId, Map<String, Object> inputData) {
        return engine.executeWorkflow(workflowId, userId, inputData, WorkflowTriggerType.MANUAL);
    }

    /**
     * Runs the workflow registered under a webhook key with the request payload as initial input.
     *
     * @throws IllegalArgumentException no workflow has this key
     * @throws IllegalStateException    the workflow is not webhook-triggered or not ACTIVE
     */
    public ExecutionAck triggerWebhook(String webhookKey, Map<String, Object> payload) {
        Workflow workflow = storage.getWorkflowByWebhookKey(webhookKey)
                .orElseThrow(() -> new IllegalArgumentException("No workflow registered for webhook key: " + webhookKey));
        if (workflow.getTriggerType() != WorkflowTriggerType.WEBHOOK) {
            throw new IllegalStateException("Workflow " + workflow.getId() + " is not triggered by webhook");
        }
        if (workflow.getStatus() != WorkflowStatus.ACTIVE) {
            throw new IllegalStateException("Workflow " + workflow.getId() + " is not active");
        }
        log.info("Webhook {} triggered workflow {}", webhookKey, workflow.getId());
        return engine.executeWorkflow(workflow.getId(), null, payload, WorkflowTriggerType.WEBHOOK);
    }

    public List<WorkflowExecution> getExecutions(Long workflowId) {
        return storage.getWorkflowExecutions(workflowId);
    }

    public WorkflowExecution getExecution(Long executionId) {
        return storage.getWorkflowExecution(executionId)
                .orElseThrow(() -> new IllegalArgumentException("Execution not found: " + executionId));
    }

    public List<WorkflowExecutionEvent> getExecutionEvents(Long executionId) {
        return storage.getWorkflowExecutionEvents(executionId);
    }

    public List<WorkflowLog> getLogs(Long workflowId) {
        return storage.getWorkflowLogs(workflowId);
    }
}
