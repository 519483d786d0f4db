package com.cronflow.cronflow_backend;

public enum WorkflowTriggerType {
    MANUAL,    // run on demand from the API
    SCHEDULE,  // run by the job registry on a recurring rule
    WEBHOOK    // run when its webhook key is called
}
