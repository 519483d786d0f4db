package com.cronflow.cronflow_backend.controller;

import com.cronflow.cronflow_backend.model.domain.WorkflowExecution;
import com.cronflow.cronflow_backend.model.domain.WorkflowExecutionEvent;
import com.cronflow.cronflow_backend.service.WorkflowService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
public class ExecutionController {

    private final WorkflowService workflowService;

    // GET /api/executions/{id}: the execution row plus every node it ran, in run order
    @GetMapping("/{executionId}")
    public ExecutionDetail getById(@PathVariable Long executionId) {
        WorkflowExecution execution = WorkflowController.found(() -> workflowService.getExecution(executionId));
        return new ExecutionDetail(execution, workflowService.getExecutionEvents(executionId));
    }

    @GetMapping("/{executionId}/events")
    public List<WorkflowExecutionEvent> getEvents(@PathVariable Long executionId) {
        WorkflowController.found(() -> workflowService.getExecution(executionId));
        return workflowService.getExecutionEvents(executionId);
    }

    public record ExecutionDetail(WorkflowExecution execution, List<WorkflowExecutionEvent> events) {}
}
