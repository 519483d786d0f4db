package com.cronflow.cronflow_backend.engine.runner;

import com.cronflow.cronflow_backend.model.domain.Event;
import com.cronflow.cronflow_backend.model.domain.EventType;
import com.cronflow.cronflow_backend.model.run.EventExecutionResult;
import com.cronflow.cronflow_backend.repository.WorkflowStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;

/** Runs events on this host: scripts through {@link ScriptRunner}, HTTP actions through {@link HttpEventClient}. */
@Slf4j
@Service
public class LocalEventRunner implements EventRunner {

    private final WorkflowStorage storage;
    private final ScriptRunner    scriptRunner;
    private final HttpEventClient httpEventClient;
    private final int             defaultTimeoutSeconds;

    public LocalEventRunner(WorkflowStorage storage,
                            ScriptRunner scriptRunner,
                            HttpEventClient httpEventClient,
                            @Value("${cronflow.runner.default-timeout-seconds:30}") int defaultTimeoutSeconds) {
        this.storage = storage;
        this.scriptRunner = scriptRunner;
        this.httpEventClient = httpEventClient;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    @Override
    public EventExecutionResult executeEvent(Long eventId, Long executionId, Integer sequenceOrder,
                                             Map<String, Object> inputData, Long workflowId) {
        Event event = storage.getEvent(eventId)
                .orElseThrow(() -> new IllegalArgumentException("Event with ID " + eventId + " not found"));
        log.info("Executing event {} for workflow execution {} (step {})",
                eventId, executionId != null ? executionId : "standalone", sequenceOrder);

        int timeout = event.getTimeoutSeconds() != null && event.getTimeoutSeconds() > 0
                ? event.getTimeoutSeconds()
                : defaultTimeoutSeconds;

        long start = System.currentTimeMillis();
        EventExecutionResult result = event.getType() == EventType.HTTP_REQUEST
                ? httpEventClient.send(event, inputData, timeout)
                : scriptRunner.run(event.getType(), event.getContent(), inputData, timeout);
        return result.withDuration(System.currentTimeMillis() - start);
    }
}
