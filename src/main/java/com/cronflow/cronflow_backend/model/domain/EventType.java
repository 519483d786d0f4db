package com.cronflow.cronflow_backend.model.domain;

public enum EventType {
    NODEJS,
    PYTHON,
    BASH,
    HTTP_REQUEST
}
