package com.cronflow.cronflow_backend.engine;

import com.cronflow.cronflow_backend.ConnectionType;
import com.cronflow.cronflow_backend.WorkflowTriggerType;
import com.cronflow.cronflow_backend.model.domain.LogStatus;
import com.cronflow.cronflow_backend.model.domain.Workflow;
import com.cronflow.cronflow_backend.model.domain.WorkflowExecution;
import com.cronflow.cronflow_backend.model.domain.WorkflowExecutionEvent;
import com.cronflow.cronflow_backend.model.domain.WorkflowLog;
import com.cronflow.cronflow_backend.model.domain.WorkflowLogLevel;
import com.cronflow.cronflow_backend.model.domain.WorkflowNode;
import com.cronflow.cronflow_backend.model.run.EventExecutionResult;
import com.cronflow.cronflow_backend.model.run.ExecutionAck;
import com.cronflow.cronflow_backend.model.run.ExecutionOutcome;
import com.cronflow.cronflow_backend.model.run.WorkflowLogUpdate;
import com.cronflow.cronflow_backend.support.InMemoryWorkflowStorage;
import com.cronflow.cronflow_backend.support.ScriptedEventRunner;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

class WorkflowExecutionEngineTest {

    private InMemoryWorkflowStorage storage;
    private ScriptedEventRunner runner;
    private Workflow workflow;

    @BeforeEach
    void setUp() {
        storage = new InMemoryWorkflowStorage();
        runner = new ScriptedEventRunner();
        workflow = storage.addWorkflow("nightly-report");
    }

    private WorkflowExecutionEngine engine(TaskExecutor taskExecutor) {
        Clock clock = Clock.systemUTC();
        WorkflowLogWriter logWriter = new WorkflowLogWriter(storage, clock);
        NodeExecutor nodeExecutor = new NodeExecutor(storage, runner, logWriter, clock);
        return new WorkflowExecutionEngine(storage, nodeExecutor, logWriter, taskExecutor, clock);
    }

    private WorkflowExecution runSync(Map<String, Object> input) {
        ExecutionAck ack = engine(new SyncTaskExecutor()).executeWorkflow(workflow.getId(), null, input);
        return storage.getWorkflowExecution(ack.executionId()).orElseThrow();
    }

    private static void assertTotals(WorkflowExecution execution, LogStatus status, int total, int successful, int failed) {
        Assertions.assertEquals(status, execution.getStatus());
        Assertions.assertEquals(total, execution.getTotalEvents());
        Assertions.assertEquals(successful, execution.getSuccessfulEvents());
        Assertions.assertEquals(failed, execution.getFailedEvents());
    }

    @Test
    void executeWorkflow_shouldChainScriptOutputIntoNextNodeInput() {
        WorkflowNode a = storage.addNode(workflow, "extract");
        WorkflowNode b = storage.addNode(workflow, "load");
        storage.connect(a, b, ConnectionType.ALWAYS);
        runner.returns(a.getEventId(), new EventExecutionResult(true, "extracted", null, Map.of("x", 1), null));

        WorkflowExecution execution = runSync(Map.of("date", "2024-01-01"));

        assertTotals(execution, LogStatus.SUCCESS, 2, 2, 0);
        List<ScriptedEventRunner.Call> calls = runner.calls();
        Assertions.assertEquals(Map.of("date", "2024-01-01"), calls.get(0).input());
        Assertions.assertEquals(Map.of("x", 1), calls.get(1).input());

        List<WorkflowExecutionEvent> events = storage.getWorkflowExecutionEvents(execution.getId());
        Assertions.assertEquals(2, events.size());
        Assertions.assertEquals(a.getId(), events.get(0).getNodeId());
        Assertions.assertEquals(1, events.get(0).getSequenceOrder());
        Assertions.assertNull(events.get(0).getConnectionType());
        Assertions.assertEquals(b.getId(), events.get(1).getNodeId());
        Assertions.assertEquals(2, events.get(1).getSequenceOrder());
        Assertions.assertEquals(ConnectionType.ALWAYS, events.get(1).getConnectionType());
        Assertions.assertEquals("extracted", events.get(0).getOutput());
    }

    @Test
    void executeWorkflow_shouldFallBackToInitialInputWhenPredecessorHasNoScriptOutput() {
        WorkflowNode a = storage.addNode(workflow, "a");
        WorkflowNode b = storage.addNode(workflow, "b");
        storage.connect(a, b, ConnectionType.ON_SUCCESS);

        runSync(Map.of("seed", 7));

        Assertions.assertEquals(Map.of("seed", 7), runner.calls().get(1).input());
    }

    @Test
    void executeWorkflow_shouldNotFollowOnSuccessConnectionFromFailedNode() {
        WorkflowNode a = storage.addNode(workflow, "a");
        WorkflowNode b = storage.addNode(workflow, "b");
        storage.connect(a, b, ConnectionType.ON_SUCCESS);
        runner.returns(a.getEventId(), EventExecutionResult.error("boom"));

        WorkflowExecution execution = runSync(Map.of());

        assertTotals(execution, LogStatus.FAILURE, 1, 0, 1);
        Assertions.assertEquals(List.of(a.getEventId()), runner.calledEventIds());
        WorkflowExecutionEvent only = storage.getWorkflowExecutionEvents(execution.getId()).get(0);
        Assertions.assertEquals(LogStatus.FAILURE, only.getStatus());
        Assertions.assertEquals("boom", only.getErrorMessage());
        Assertions.assertTrue(storage.allLogs().stream()
                .anyMatch(l -> l.getLevel() == WorkflowLogLevel.WARNING
                        && ("1 node(s) were not executed in this run: [" + b.getId() + "]").equals(l.getMessage())));
    }

    @Test
    void executeWorkflow_shouldRunFailureBranchWhenRunnerThrows() {
        WorkflowNode a = storage.addNode(workflow, "a");
        WorkflowNode happy = storage.addNode(workflow, "happy");
        WorkflowNode alert = storage.addNode(workflow, "alert");
        storage.connect(a, happy, ConnectionType.ON_SUCCESS);
        storage.connect(a, alert, ConnectionType.ON_FAILURE);
        runner.throwsFor(a.getEventId(), new IllegalStateException("runner exploded"));

        WorkflowExecution execution = runSync(Map.of());

        assertTotals(execution, LogStatus.FAILURE, 2, 1, 1);
        Assertions.assertEquals(List.of(a.getEventId(), alert.getEventId()), runner.calledEventIds());
        List<WorkflowExecutionEvent> events = storage.getWorkflowExecutionEvents(execution.getId());
        Assertions.assertEquals(1, events.size());
        Assertions.assertEquals(alert.getId(), events.get(0).getNodeId());
        Assertions.assertEquals(ConnectionType.ON_FAILURE, events.get(0).getConnectionType());
        Assertions.assertTrue(storage.allLogs().stream()
                .anyMatch(l -> ("Node " + a.getId() + " execution failed: runner exploded").equals(l.getMessage())));
    }

    @Test
    void executeWorkflow_shouldTakeSuccessBranchAndSkipFailureBranch() {
        WorkflowNode a = storage.addNode(workflow, "a");
        WorkflowNode b = storage.addNode(workflow, "b");
        WorkflowNode c = storage.addNode(workflow, "c");
        storage.connect(a, b, ConnectionType.ON_SUCCESS);
        storage.connect(a, c, ConnectionType.ON_FAILURE);

        assertTotals(runSync(Map.of()), LogStatus.SUCCESS, 2, 2, 0);
        Assertions.assertFalse(runner.calledEventIds().contains(c.getEventId()));

        runner.returns(b.getEventId(), EventExecutionResult.error("b failed"));
        assertTotals(runSync(Map.of()), LogStatus.FAILURE, 2, 1, 1);
    }

    @Test
    void executeWorkflow_shouldFollowOnConditionOnlyWhenConditionIsTrue() {
        WorkflowNode check = storage.addNode(workflow, "check");
        WorkflowNode yes = storage.addNode(workflow, "yes");
        storage.connect(check, yes, ConnectionType.ON_CONDITION);

        runner.returns(check.getEventId(), new EventExecutionResult(true, "", null, null, true));
        assertTotals(runSync(Map.of()), LogStatus.SUCCESS, 2, 2, 0);

        runner.returns(check.getEventId(), new EventExecutionResult(true, "", null, null, false));
        assertTotals(runSync(Map.of()), LogStatus.SUCCESS, 1, 1, 0);

        runner.returns(check.getEventId(), new EventExecutionResult(true, "", null, null, null));
        assertTotals(runSync(Map.of()), LogStatus.SUCCESS, 1, 1, 0);
    }

    @Test
    void executeWorkflow_shouldRunBothBranchesDepthFirst() {
        WorkflowNode a = storage.addNode(workflow, "a");
        WorkflowNode b = storage.addNode(workflow, "b");
        WorkflowNode c = storage.addNode(workflow, "c");
        WorkflowNode d = storage.addNode(workflow, "d");
        storage.connect(a, b, ConnectionType.ALWAYS);
        storage.connect(a, c, ConnectionType.ALWAYS);
        storage.connect(b, d, ConnectionType.ALWAYS);

        WorkflowExecution execution = runSync(Map.of());

        assertTotals(execution, LogStatus.SUCCESS, 4, 4, 0);
        Assertions.assertEquals(List.of(a.getEventId(), b.getEventId(), d.getEventId(), c.getEventId()),
                runner.calledEventIds());
    }

    @Test
    void executeWorkflow_shouldRunJoinNodeOnceAfterAllPredecessors() {
        WorkflowNode a = storage.addNode(workflow, "a");
        WorkflowNode b = storage.addNode(workflow, "b");
        WorkflowNode c = storage.addNode(workflow, "c");
        WorkflowNode join = storage.addNode(workflow, "join");
        storage.connect(a, b, ConnectionType.ALWAYS);
        storage.connect(a, c, ConnectionType.ALWAYS);
        storage.connect(b, join, ConnectionType.ALWAYS);
        storage.connect(c, join, ConnectionType.ALWAYS);

        WorkflowExecution execution = runSync(Map.of());

        assertTotals(execution, LogStatus.SUCCESS, 4, 4, 0);
        Assertions.assertEquals(List.of(a.getEventId(), b.getEventId(), c.getEventId(), join.getEventId()),
                runner.calledEventIds());
        List<Integer> sequence = storage.getWorkflowExecutionEvents(execution.getId()).stream()
                .map(WorkflowExecutionEvent::getSequenceOrder)
                .toList();
        Assertions.assertEquals(List.of(1, 2, 3, 4), sequence);
    }

    @Test
    void executeWorkflow_shouldLeaveJoinNodeUnexecutedWhenOnePredecessorIsGated() {
        WorkflowNode a = storage.addNode(workflow, "a");
        WorkflowNode b = storage.addNode(workflow, "b");
        WorkflowNode join = storage.addNode(workflow, "join");
        storage.connect(a, join, ConnectionType.ALWAYS);
        storage.connect(b, join, ConnectionType.ON_SUCCESS);
        runner.returns(b.getEventId(), EventExecutionResult.error("b failed"));

        WorkflowExecution execution = runSync(Map.of());

        assertTotals(execution, LogStatus.FAILURE, 2, 1, 1);
        Assertions.assertFalse(runner.calledEventIds().contains(join.getEventId()));
    }

    @Test
    void executeWorkflow_shouldFailEmptyWorkflowWithZeroTotals() {
        WorkflowExecution execution = runSync(Map.of());

        assertTotals(execution, LogStatus.FAILURE, 0, 0, 0);
        Assertions.assertNotNull(execution.getCompletedAt());
        Assertions.assertTrue(runner.calls().isEmpty());
        Assertions.assertTrue(storage.getWorkflowLogs(workflow.getId()).stream()
                .anyMatch(l -> "Workflow has no nodes to execute".equals(l.getMessage())));
    }

    @Test
    void executeWorkflow_shouldFailCycleWithoutEntryNodesCountingEveryNodeAsFailed() {
        WorkflowNode a = storage.addNode(workflow, "a");
        WorkflowNode b = storage.addNode(workflow, "b");
        storage.connect(a, b, ConnectionType.ALWAYS);
        storage.connect(b, a, ConnectionType.ALWAYS);

        WorkflowExecution execution = runSync(Map.of());

        assertTotals(execution, LogStatus.FAILURE, 2, 0, 2);
        Assertions.assertTrue(runner.calls().isEmpty());
    }

    @Test
    void executeWorkflow_shouldRecordConsistentTimestampsAndDuration() {
        storage.addNode(workflow, "a");

        WorkflowExecution execution = runSync(Map.of());

        Assertions.assertFalse(execution.getCompletedAt().isBefore(execution.getStartedAt()));
        Assertions.assertEquals(Duration.between(execution.getStartedAt(), execution.getCompletedAt()).toMillis(),
                execution.getTotalDuration());
        Assertions.assertTrue(execution.getTotalDuration() >= 0);
    }

    @Test
    void executeWorkflow_shouldStoreTriggerMetadataAndDefaultToOwner() {
        storage.addNode(workflow, "a");

        ExecutionAck ack = engine(new SyncTaskExecutor())
                .executeWorkflow(workflow.getId(), null, Map.of("k", "v"), WorkflowTriggerType.WEBHOOK);

        WorkflowExecution execution = storage.getWorkflowExecution(ack.executionId()).orElseThrow();
        Assertions.assertEquals("owner-1", execution.getUserId());
        Assertions.assertEquals(WorkflowTriggerType.WEBHOOK, execution.getTriggerType());
        Assertions.assertEquals("WEBHOOK", execution.getExecutionData().get("triggerType"));
        Assertions.assertEquals(Map.of("k", "v"), execution.getExecutionData().get("inputData"));
        Assertions.assertNotNull(execution.getExecutionData().get("triggeredAt"));
    }

    @Test
    void runWorkflowImmediately_shouldRunManuallyWithEmptyInput() {
        storage.addNode(workflow, "a");

        ExecutionAck ack = engine(new SyncTaskExecutor()).runWorkflowImmediately(workflow.getId());

        WorkflowExecution execution = storage.getWorkflowExecution(ack.executionId()).orElseThrow();
        Assertions.assertEquals(WorkflowTriggerType.MANUAL, execution.getTriggerType());
        Assertions.assertEquals(Map.of(), runner.calls().get(0).input());
        assertTotals(execution, LogStatus.SUCCESS, 1, 1, 0);
    }

    @Test
    void executeWorkflow_shouldProduceIndependentExecutionsForRepeatedRuns() {
        WorkflowNode a = storage.addNode(workflow, "a");
        WorkflowNode b = storage.addNode(workflow, "b");
        storage.connect(a, b, ConnectionType.ALWAYS);

        WorkflowExecution first = runSync(Map.of());
        WorkflowExecution second = runSync(Map.of());

        Assertions.assertNotEquals(first.getId(), second.getId());
        assertTotals(first, LogStatus.SUCCESS, 2, 2, 0);
        assertTotals(second, LogStatus.SUCCESS, 2, 2, 0);
        Assertions.assertEquals(2, storage.getWorkflowExecutionEvents(second.getId()).size());
        Assertions.assertEquals(4, runner.calls().size());
    }

    @Test
    void executeWorkflow_shouldFailNodeWhoseEventIsMissing() {
        WorkflowNode orphan = storage.addNode(workflow, 9999L);

        WorkflowExecution execution = runSync(Map.of());

        assertTotals(execution, LogStatus.FAILURE, 1, 0, 1);
        Assertions.assertTrue(runner.calls().isEmpty());
        Assertions.assertTrue(storage.allLogs().stream()
                .anyMatch(l -> l.getMessage().startsWith("Node " + orphan.getId() + " execution failed: Event 9999 not found")));
    }

    @Test
    void executeWorkflow_shouldThrowForUnknownWorkflowWithoutCreatingExecution() {
        WorkflowExecutionEngine engine = engine(new SyncTaskExecutor());

        IllegalArgumentException ex = Assertions.assertThrows(IllegalArgumentException.class,
                () -> engine.executeWorkflow(404L, "u", Map.of()));

        Assertions.assertEquals("Workflow not found: 404", ex.getMessage());
        Assertions.assertTrue(storage.getWorkflowExecutions(404L).isEmpty());
    }

    @Test
    void executeWorkflow_shouldFinalizeAsFailureWhenExecutorRejects() {
        storage.addNode(workflow, "a");
        TaskExecutor rejecting = task -> {
            throw new RejectedExecutionException("queue full");
        };

        ExecutionAck ack = engine(rejecting).executeWorkflow(workflow.getId(), null, Map.of());

        Assertions.assertFalse(ack.success());
        Assertions.assertEquals(LogStatus.FAILURE, ack.status());
        WorkflowExecution execution = storage.getWorkflowExecution(ack.executionId()).orElseThrow();
        assertTotals(execution, LogStatus.FAILURE, 0, 0, 0);
        Assertions.assertTrue(runner.calls().isEmpty());
    }

    @Test
    void executeWorkflow_shouldFinalizeAsFailureWhenRunLevelErrorOccurs() {
        InMemoryWorkflowStorage broken = new InMemoryWorkflowStorage() {
            @Override
            public synchronized List<WorkflowNode> getWorkflowNodes(Long workflowId) {
                throw new IllegalStateException("database unavailable");
            }
        };
        storage = broken;
        workflow = broken.addWorkflow("broken");

        WorkflowExecution execution = runSync(Map.of());

        assertTotals(execution, LogStatus.FAILURE, 0, 0, 0);
        Assertions.assertNotNull(execution.getCompletedAt());
        Assertions.assertTrue(broken.allLogs().stream()
                .anyMatch(l -> "Workflow execution error: database unavailable".equals(l.getMessage())
                        && l.getLevel() == WorkflowLogLevel.ERROR));
    }

    @Test
    void executeWorkflow_shouldWriteExecutionOnceWhenRunLogCannotBeClosed() {
        List<LogStatus> terminalWrites = new ArrayList<>();
        InMemoryWorkflowStorage flaky = new InMemoryWorkflowStorage() {
            @Override
            public synchronized WorkflowLog updateWorkflowLog(Long logId, WorkflowLogUpdate update) {
                throw new IllegalStateException("log table locked");
            }

            @Override
            public synchronized WorkflowExecution updateWorkflowExecution(Long executionId, ExecutionOutcome outcome) {
                terminalWrites.add(outcome.status());
                return super.updateWorkflowExecution(executionId, outcome);
            }
        };
        storage = flaky;
        workflow = flaky.addWorkflow("flaky-log");
        flaky.addNode(workflow, "a");

        WorkflowExecution execution = runSync(Map.of());

        Assertions.assertEquals(List.of(LogStatus.SUCCESS), terminalWrites);
        assertTotals(execution, LogStatus.SUCCESS, 1, 1, 0);
    }

    @Test
    void executeWorkflow_shouldKeepNodeSuccessWhenItsLogLineCannotBeWritten() {
        InMemoryWorkflowStorage flaky = new InMemoryWorkflowStorage() {
            @Override
            public synchronized WorkflowLog createWorkflowLog(WorkflowLog workflowLog) {
                if (workflowLog.getMessage() != null && workflowLog.getMessage().endsWith("): SUCCESS")) {
                    throw new IllegalStateException("log table locked");
                }
                return super.createWorkflowLog(workflowLog);
            }
        };
        storage = flaky;
        workflow = flaky.addWorkflow("flaky-node-log");
        WorkflowNode a = flaky.addNode(workflow, "a");
        WorkflowNode b = flaky.addNode(workflow, "b");
        flaky.connect(a, b, ConnectionType.ON_SUCCESS);

        WorkflowExecution execution = runSync(Map.of());

        assertTotals(execution, LogStatus.SUCCESS, 2, 2, 0);
        List<LogStatus> rows = flaky.getWorkflowExecutionEvents(execution.getId()).stream()
                .map(WorkflowExecutionEvent::getStatus)
                .toList();
        Assertions.assertEquals(List.of(LogStatus.SUCCESS, LogStatus.SUCCESS), rows);
    }

    @Test
    void executeWorkflow_shouldIsolateNodeWhoseStepRowCannotBeStored() {
        AtomicLong failingNode = new AtomicLong(-1);
        InMemoryWorkflowStorage flaky = new InMemoryWorkflowStorage() {
            @Override
            public synchronized WorkflowExecutionEvent createWorkflowExecutionEvent(WorkflowExecutionEvent executionEvent) {
                if (failingNode.get() == executionEvent.getNodeId()) {
                    throw new IllegalStateException("row store down");
                }
                return super.createWorkflowExecutionEvent(executionEvent);
            }
        };
        storage = flaky;
        workflow = flaky.addWorkflow("flaky-rows");
        WorkflowNode a = flaky.addNode(workflow, "a");
        WorkflowNode happy = flaky.addNode(workflow, "happy");
        WorkflowNode alert = flaky.addNode(workflow, "alert");
        flaky.connect(a, happy, ConnectionType.ON_SUCCESS);
        flaky.connect(a, alert, ConnectionType.ON_FAILURE);
        failingNode.set(a.getId());

        WorkflowExecution execution = runSync(Map.of());

        assertTotals(execution, LogStatus.FAILURE, 2, 1, 1);
        Assertions.assertFalse(runner.calledEventIds().contains(happy.getEventId()));
        List<WorkflowExecutionEvent> rows = flaky.getWorkflowExecutionEvents(execution.getId());
        Assertions.assertEquals(1, rows.size());
        Assertions.assertEquals(alert.getId(), rows.get(0).getNodeId());
        Assertions.assertEquals(LogStatus.SUCCESS, rows.get(0).getStatus());
    }

    @Test
    void executeWorkflow_shouldAcknowledgeBeforeBackgroundRunCompletes() throws Exception {
        WorkflowNode a = storage.addNode(workflow, "slow");
        CountDownLatch release = new CountDownLatch(1);
        runner.answers(a.getEventId(), input -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return EventExecutionResult.ok("done");
        });

        ExecutionAck ack = engine(new SimpleAsyncTaskExecutor("test-run-"))
                .executeWorkflow(workflow.getId(), null, Map.of());

        Assertions.assertTrue(ack.success());
        Assertions.assertEquals(LogStatus.RUNNING, ack.status());
        Assertions.assertEquals(LogStatus.RUNNING, storage.getWorkflowExecution(ack.executionId()).orElseThrow().getStatus());

        release.countDown();
        long deadline = System.currentTimeMillis() + 5000;
        while (storage.getWorkflowExecution(ack.executionId()).orElseThrow().getStatus() == LogStatus.RUNNING
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertTotals(storage.getWorkflowExecution(ack.executionId()).orElseThrow(), LogStatus.SUCCESS, 1, 1, 0);
    }

    @Test
    void executeWorkflow_shouldCloseRunLogWithAggregatedOutput() {
        WorkflowNode a = storage.addNode(workflow, "a");
        runner.returns(a.getEventId(), EventExecutionResult.ok("hello"));

        runSync(Map.of());

        WorkflowLog runEntry = storage.getWorkflowLogs(workflow.getId()).stream()
                .filter(l -> "Starting workflow execution: nightly-report".equals(l.getMessage())
                        || (l.getMessage() != null && l.getMessage().startsWith("Workflow completed successfully")))
                .findFirst()
                .orElseThrow();
        Assertions.assertEquals(LogStatus.SUCCESS, runEntry.getStatus());
        Assertions.assertNotNull(runEntry.getEndTime());
        Assertions.assertEquals("Node " + a.getId() + " (Event " + a.getEventId() + "): SUCCESS\nhello\n", runEntry.getOutput());
    }
}
