package com.cronflow.cronflow_backend.engine;

import com.cronflow.cronflow_backend.model.domain.LogStatus;
import com.cronflow.cronflow_backend.model.domain.WorkflowLog;
import com.cronflow.cronflow_backend.model.domain.WorkflowLogLevel;
import com.cronflow.cronflow_backend.repository.WorkflowStorage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/** Appends the human-readable WorkflowLog lines a run leaves behind. */
@Component
@RequiredArgsConstructor
public class WorkflowLogWriter {

    private final WorkflowStorage storage;
    private final Clock clock;

    public WorkflowLog info(Long workflowId, String userId, String message) {
        return append(workflowId, userId, WorkflowLogLevel.INFO, null, message, null);
    }

    public WorkflowLog warning(Long workflowId, String userId, String message) {
        return append(workflowId, userId, WorkflowLogLevel.WARNING, null, message, null);
    }

    public WorkflowLog error(Long workflowId, String userId, String message, String error) {
        return append(workflowId, userId, WorkflowLogLevel.ERROR, LogStatus.FAILURE, message, error);
    }

    /** Opens the run-level entry that is patched once when the run completes. */
    public WorkflowLog runStarted(Long workflowId, String userId, String workflowName) {
        Instant now = clock.instant();
        WorkflowLog entry = new WorkflowLog();
        entry.setWorkflowId(workflowId);
        entry.setUserId(userId);
        entry.setStatus(LogStatus.RUNNING);
        entry.setLevel(WorkflowLogLevel.INFO);
        entry.setMessage("Starting workflow execution: " + workflowName);
        entry.setOutput("Workflow execution started...");
        entry.setStartTime(now);
        entry.setTimestamp(now);
        return storage.createWorkflowLog(entry);
    }

    public WorkflowLog append(Long workflowId, String userId, WorkflowLogLevel level,
                              LogStatus status, String message, String error) {
        WorkflowLog entry = new WorkflowLog();
        entry.setWorkflowId(workflowId);
        entry.setUserId(userId);
        entry.setLevel(level);
        entry.setStatus(status);
        entry.setMessage(message);
        if (error != null) {
            entry.setOutput(error);
            entry.setError(error);
        }
        entry.setTimestamp(clock.instant());
        return storage.createWorkflowLog(entry);
    }
}
