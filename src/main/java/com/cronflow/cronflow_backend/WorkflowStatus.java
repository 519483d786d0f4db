package com.cronflow.cronflow_backend;

public enum WorkflowStatus {
    DRAFT,
    ACTIVE,
    PAUSED
}
