package com.cronflow.cronflow_backend.model.run;

import com.cronflow.cronflow_backend.model.domain.LogStatus;

import java.time.Instant;

/** The single terminal write applied to a WorkflowExecution row. */
public record ExecutionOutcome(LogStatus status,
                               Instant completedAt,
                               long totalDuration,
                               int totalEvents,
                               int successfulEvents,
                               int failedEvents) {
}
