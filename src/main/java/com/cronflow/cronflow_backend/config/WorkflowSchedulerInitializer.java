package com.cronflow.cronflow_backend.config;

import com.cronflow.cronflow_backend.scheduler.WorkflowJobRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Loads every active scheduled workflow into the job registry once the application is up.
 * Set cronflow.scheduler.enabled=false to start without recurring jobs.
 */
@Slf4j
@Component
public class WorkflowSchedulerInitializer implements ApplicationRunner {

    private final Environment         env;
    private final WorkflowJobRegistry jobRegistry;

    public WorkflowSchedulerInitializer(Environment env, WorkflowJobRegistry jobRegistry) {
        this.env = env;
        this.jobRegistry = jobRegistry;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!env.getProperty("cronflow.scheduler.enabled", Boolean.class, true)) {
            log.warn("Workflow scheduler disabled (cronflow.scheduler.enabled=false); scheduled workflows will not fire");
            return;
        }
        int scheduled = jobRegistry.initialize();
        log.info("Workflow scheduler started, {} workflow(s) scheduled", scheduled);
    }
}
