package com.cronflow.cronflow_backend.engine.runner;

import com.cronflow.cronflow_backend.model.domain.Event;
import com.cronflow.cronflow_backend.model.domain.EventType;
import com.cronflow.cronflow_backend.model.run.EventExecutionResult;
import com.cronflow.cronflow_backend.support.InMemoryWorkflowStorage;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LocalEventRunnerTest {

    @Mock
    private ScriptRunner scriptRunner;

    @Mock
    private HttpEventClient httpEventClient;

    private InMemoryWorkflowStorage storage;
    private LocalEventRunner runner;

    @BeforeEach
    void setUp() {
        storage = new InMemoryWorkflowStorage();
        runner = new LocalEventRunner(storage, scriptRunner, httpEventClient, 30);
    }

    @Test
    void executeEvent_shouldRunScriptWithEventTimeout() {
        Event event = storage.addEvent("cleanup");
        event.setTimeoutSeconds(12);
        when(scriptRunner.run(EventType.BASH, "echo cleanup", Map.of("a", 1), 12))
                .thenReturn(EventExecutionResult.ok("cleanup"));

        EventExecutionResult result = runner.executeEvent(event.getId(), 1L, 1, Map.of("a", 1), 2L);

        Assertions.assertTrue(result.success());
        Assertions.assertEquals("cleanup", result.output());
        Assertions.assertNotNull(result.duration());
        verifyNoInteractions(httpEventClient);
    }

    @Test
    void executeEvent_shouldFallBackToDefaultTimeout() {
        Event event = storage.addEvent("cleanup");
        event.setTimeoutSeconds(null);
        when(scriptRunner.run(any(), any(), any(), anyInt())).thenReturn(EventExecutionResult.ok(""));

        runner.executeEvent(event.getId(), 1L, 1, Map.of(), 2L);

        verify(scriptRunner).run(EventType.BASH, "echo cleanup", Map.of(), 30);
    }

    @Test
    void executeEvent_shouldDispatchHttpEventsToHttpClient() {
        Event event = storage.addEvent("notify");
        event.setType(EventType.HTTP_REQUEST);
        event.setHttpUrl("https://hooks.example.com/notify");
        when(httpEventClient.send(event, Map.of(), 30)).thenReturn(EventExecutionResult.error("HTTP 500: oops"));

        EventExecutionResult result = runner.executeEvent(event.getId(), 1L, 2, Map.of(), 2L);

        Assertions.assertFalse(result.success());
        Assertions.assertEquals("HTTP 500: oops", result.output());
        verifyNoInteractions(scriptRunner);
    }

    @Test
    void executeEvent_shouldThrowForUnknownEvent() {
        IllegalArgumentException ex = Assertions.assertThrows(IllegalArgumentException.class,
                () -> runner.executeEvent(77L, 1L, 1, Map.of(), 2L));

        Assertions.assertEquals("Event with ID 77 not found", ex.getMessage());
    }
}
