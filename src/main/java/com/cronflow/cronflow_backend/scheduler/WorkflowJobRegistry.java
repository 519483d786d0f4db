package com.cronflow.cronflow_backend.scheduler;

import com.cronflow.cronflow_backend.WorkflowStatus;
import com.cronflow.cronflow_backend.WorkflowTriggerType;
import com.cronflow.cronflow_backend.engine.WorkflowExecutionEngine;
import com.cronflow.cronflow_backend.model.domain.Workflow;
import com.cronflow.cronflow_backend.repository.WorkflowStorage;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

/**
 * Keeps at most one live recurring job per ACTIVE, SCHEDULE-triggered workflow.
 * All mutations of the id → job map happen under this registry's monitor.
 */
@Slf4j
@Service
public class WorkflowJobRegistry {

    private final WorkflowStorage         storage;
    private final WorkflowExecutionEngine engine;
    private final TaskScheduler           taskScheduler;
    private final ZoneId                  zone;

    private final Map<Long, ScheduledFuture<?>> jobs = new HashMap<>();
    private boolean initialized = false;

    public WorkflowJobRegistry(WorkflowStorage storage,
                               WorkflowExecutionEngine engine,
                               @Qualifier("workflowTaskScheduler") TaskScheduler taskScheduler,
                               @Value("${cronflow.scheduler.zone:}") String zoneId) {
        this.storage = storage;
        this.engine = engine;
        this.taskScheduler = taskScheduler;
        this.zone = zoneId == null || zoneId.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zoneId);
    }

    /**
     * Schedules every ACTIVE + SCHEDULE workflow. Safe to call twice; a workflow that cannot be
     * scheduled is logged and skipped.
     *
     * @return number of workflows scheduled by this call
     */
    public synchronized int initialize() {
        if (initialized) {
            log.debug("Workflow job registry already initialized with {} jobs", jobs.size());
            return 0;
        }
        List<Workflow> candidates = storage.getAllWorkflows(WorkflowStatus.ACTIVE, WorkflowTriggerType.SCHEDULE);
        int scheduled = 0;
        for (Workflow workflow : candidates) {
            try {
                if (scheduleWorkflow(workflow.getId())) scheduled++;
            } catch (Exception ex) {
                log.error("Failed to schedule workflow {} during initialization: {}", workflow.getId(), ex.getMessage(), ex);
            }
        }
        initialized = true;
        log.info("Workflow job registry initialized with {} of {} active scheduled workflows", scheduled, candidates.size());
        return scheduled;
    }

    /**
     * Replaces any job of this workflow with a fresh one built from its current schedule.
     *
     * @return true when a job is now registered; false when the workflow is missing, not active,
     *         not schedule-triggered, or its schedule is absent or invalid
     */
    public synchronized boolean scheduleWorkflow(Long workflowId) {
        cancel(workflowId);

        Optional<Workflow> found = storage.getWorkflow(workflowId);
        if (found.isEmpty()) {
            log.info("Workflow with ID {} not found, skipping scheduling", workflowId);
            return false;
        }
        Workflow workflow = found.get();
        if (workflow.getStatus() != WorkflowStatus.ACTIVE || workflow.getTriggerType() != WorkflowTriggerType.SCHEDULE) {
            log.info("Workflow {} is not an active scheduled workflow, skipping scheduling", workflowId);
            return false;
        }

        ScheduleRule rule;
        try {
            rule = ScheduleTranslator.translate(workflow).orElse(null);
        } catch (IllegalArgumentException ex) {
            log.warn("Workflow {} has an invalid schedule, not scheduled: {}", workflowId, ex.getMessage());
            return false;
        }
        if (rule == null) {
            log.warn("Workflow {} has no valid schedule configuration", workflowId);
            return false;
        }

        String name = workflow.getName();
        ScheduledFuture<?> job = taskScheduler.schedule(() -> fire(workflowId, name), rule.toTrigger(zone));
        if (job == null) {
            log.warn("Workflow {} schedule '{}' never fires, not scheduled", workflowId, rule.expression());
            return false;
        }
        jobs.put(workflowId, job);
        log.info("Scheduled workflow {}: {} ({})", workflowId, name, rule.expression());
        return true;
    }

    /** Called after a workflow is edited: drop its job and schedule it again if it still qualifies. */
    public synchronized boolean updateWorkflow(Long workflowId) {
        cancel(workflowId);
        return scheduleWorkflow(workflowId);
    }

    public synchronized void deleteWorkflow(Long workflowId) {
        if (cancel(workflowId)) {
            log.info("Cancelled scheduled job for deleted workflow {}", workflowId);
        }
    }

    @PreDestroy
    public synchronized void shutdown() {
        log.info("Shutting down workflow job registry...");
        jobs.forEach((workflowId, job) -> {
            log.info("Cancelling scheduled job for workflow {}", workflowId);
            job.cancel(false);
        });
        jobs.clear();
        initialized = false;
    }

    public synchronized boolean isScheduled(Long workflowId) {
        return jobs.containsKey(workflowId);
    }

    public synchronized Set<Long> scheduledWorkflowIds() {
        return Set.copyOf(jobs.keySet());
    }

    // Runs on a scheduler thread; nothing may escape into the scheduler
    void fire(Long workflowId, String workflowName) {
        log.info("Executing scheduled workflow {}: {}", workflowId, workflowName);
        try {
            engine.executeWorkflow(workflowId, null, Map.of(), WorkflowTriggerType.SCHEDULE);
        } catch (Exception ex) {
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.error("Scheduled run of workflow {} could not start: {}", workflowId, msg, ex);
        }
    }

    private boolean cancel(Long workflowId) {
        ScheduledFuture<?> job = jobs.remove(workflowId);
        if (job == null) return false;
        job.cancel(false);
        return true;
    }
}
