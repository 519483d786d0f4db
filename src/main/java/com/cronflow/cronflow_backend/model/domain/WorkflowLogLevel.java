package com.cronflow.cronflow_backend.model.domain;

public enum WorkflowLogLevel {
    INFO,
    WARNING,
    ERROR,
    DEBUG
}
