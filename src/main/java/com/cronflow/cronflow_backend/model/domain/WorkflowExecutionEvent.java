package com.cronflow.cronflow_backend.model.domain;

import com.cronflow.cronflow_backend.ConnectionType;
import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/** One row per node executed within a workflow execution. Written once, never updated. */
@Entity
@Table(name = "workflow_execution_events")
@Data
public class WorkflowExecutionEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workflow_execution_id", nullable = false)
    private Long workflowExecutionId;

    @Column(name = "event_id", nullable = false)
    private Long eventId;

    @Column(name = "node_id", nullable = false)
    private Long nodeId;

    @Column(name = "sequence_order", nullable = false)
    private Integer sequenceOrder;

    @Enumerated(EnumType.STRING)
    private LogStatus status = LogStatus.PENDING;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    private Long duration;

    @Column(columnDefinition = "text")
    private String output;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    // Type of the connection that fired this node; null for entry nodes
    @Enumerated(EnumType.STRING)
    @Column(name = "connection_type")
    private ConnectionType connectionType;
}
