package com.cronflow.cronflow_backend.model.run;

import com.cronflow.cronflow_backend.model.domain.LogStatus;

/** Synchronous answer to a trigger. The run itself finishes later; poll the execution record. */
public record ExecutionAck(boolean success, Long executionId, LogStatus status) {

    public static ExecutionAck running(Long executionId) {
        return new ExecutionAck(true, executionId, LogStatus.RUNNING);
    }
}
