package com.cronflow.cronflow_backend.model.run;

import com.cronflow.cronflow_backend.model.domain.LogStatus;
import com.cronflow.cronflow_backend.model.domain.WorkflowLogLevel;
import lombok.Builder;

import java.time.Instant;

/** Patch for the run-level WorkflowLog entry; null fields are left untouched. */
@Builder
public record WorkflowLogUpdate(LogStatus status,
                                WorkflowLogLevel level,
                                String message,
                                String output,
                                String error,
                                Instant endTime) {
}
