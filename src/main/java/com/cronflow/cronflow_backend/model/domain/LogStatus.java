package com.cronflow.cronflow_backend.model.domain;

public enum LogStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILURE
}
