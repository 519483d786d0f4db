package com.cronflow.cronflow_backend.controller;

import com.cronflow.cronflow_backend.model.run.ExecutionAck;
import com.cronflow.cronflow_backend.service.WorkflowService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/** Public entry point for WEBHOOK-triggered workflows: POST /api/webhooks/workflows/{webhookKey}. */
@RestController
@RequestMapping("/api/webhooks/workflows")
@RequiredArgsConstructor
public class WebhookController {

    private final WorkflowService workflowService;

    @PostMapping("/{webhookKey}")
    public ResponseEntity<ExecutionAck> trigger(@PathVariable String webhookKey,
                                                @RequestBody(required = false) Map<String, Object> payload) {
        ExecutionAck ack = WorkflowController.found(
                () -> workflowService.triggerWebhook(webhookKey, payload != null ? payload : Map.of()));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ack);
    }
}
