package com.cronflow.cronflow_backend.controller;

import com.cronflow.cronflow_backend.ScheduleUnit;
import com.cronflow.cronflow_backend.WorkflowStatus;
import com.cronflow.cronflow_backend.WorkflowTriggerType;
import com.cronflow.cronflow_backend.model.domain.Workflow;
import com.cronflow.cronflow_backend.model.domain.WorkflowConnection;
import com.cronflow.cronflow_backend.model.domain.WorkflowExecution;
import com.cronflow.cronflow_backend.model.domain.WorkflowLog;
import com.cronflow.cronflow_backend.model.domain.WorkflowNode;
import com.cronflow.cronflow_backend.model.run.ExecutionAck;
import com.cronflow.cronflow_backend.repository.WorkflowRepository;
import com.cronflow.cronflow_backend.repository.WorkflowStorage;
import com.cronflow.cronflow_backend.scheduler.WorkflowJobRegistry;
import com.cronflow.cronflow_backend.service.WorkflowService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/workflows")
@RequiredArgsConstructor
public class WorkflowController {

    private final WorkflowService     workflowService;
    private final WorkflowRepository  workflowRepository;
    private final WorkflowStorage     storage;
    private final WorkflowJobRegistry jobRegistry;

    @GetMapping
    public List<Workflow> getAllWorkflows() {
        return workflowRepository.findAll();
    }

    @GetMapping("/{workflowId}")
    public Workflow getWorkflow(@PathVariable Long workflowId) {
        return found(() -> workflowService.getWorkflow(workflowId));
    }

    // Nodes and connections as stored; the graph the engine walks
    @GetMapping("/{workflowId}/graph")
    public WorkflowGraphResponse getGraph(@PathVariable Long workflowId) {
        found(() -> workflowService.getWorkflow(workflowId));
        return new WorkflowGraphResponse(storage.getWorkflowNodes(workflowId), storage.getWorkflowConnections(workflowId));
    }

    @PutMapping("/{workflowId}/status")
    public Workflow updateStatus(@PathVariable Long workflowId, @RequestBody StatusRequest body) {
        if (body == null || body.status() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "status is required");
        }
        return found(() -> workflowService.updateStatus(workflowId, body.status()));
    }

    @PutMapping("/{workflowId}/schedule")
    public Workflow updateSchedule(@PathVariable Long workflowId, @RequestBody ScheduleRequest body) {
        if (body == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "schedule body is required");
        }
        return found(() -> workflowService.updateSchedule(workflowId, body.triggerType(),
                body.scheduleNumber(), body.scheduleUnit(), body.customSchedule()));
    }

    @GetMapping("/{workflowId}/schedule")
    public ScheduleState getScheduleState(@PathVariable Long workflowId) {
        found(() -> workflowService.getWorkflow(workflowId));
        return new ScheduleState(workflowId, jobRegistry.isScheduled(workflowId));
    }

    @DeleteMapping("/{workflowId}")
    public ResponseEntity<Void> deleteWorkflow(@PathVariable Long workflowId) {
        found(() -> {
            workflowService.deleteWorkflow(workflowId);
            return null;
        });
        return ResponseEntity.noContent().build();
    }

    // POST /api/workflows/{id}/run: body is optional and becomes the run's initial input
    @PostMapping("/{workflowId}/run")
    public ResponseEntity<ExecutionAck> run(@PathVariable Long workflowId,
                                            @RequestBody(required = false) Map<String, Object> input,
                                            @RequestHeader(value = "X-User-Id", required = false) String userId) {
        ExecutionAck ack = found(() -> workflowService.run(workflowId, userId, input != null ? input : Map.of()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ack);
    }

    @GetMapping("/{workflowId}/executions")
    public List<WorkflowExecution> getExecutions(@PathVariable Long workflowId) {
        return workflowService.getExecutions(workflowId);
    }

    @GetMapping("/{workflowId}/logs")
    public List<WorkflowLog> getLogs(@PathVariable Long workflowId) {
        return workflowService.getLogs(workflowId);
    }

    static <T> T found(Supplier<T> call) {
        try {
            return call.get();
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, ex.getMessage(), ex);
        }
    }

    public record StatusRequest(WorkflowStatus status) {}

    public record ScheduleRequest(
            WorkflowTriggerType triggerType,
            Integer             scheduleNumber,
            ScheduleUnit        scheduleUnit,
            String              customSchedule
    ) {}

    public record ScheduleState(Long workflowId, boolean scheduled) {}

    public record WorkflowGraphResponse(List<WorkflowNode> nodes, List<WorkflowConnection> connections) {}
}
