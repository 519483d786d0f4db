package com.cronflow.cronflow_backend.model.domain;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "workflow_logs")
@Data
public class WorkflowLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workflow_id", nullable = false)
    private Long workflowId;

    @Column(name = "user_id")
    private String userId;

    @Enumerated(EnumType.STRING)
    private LogStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkflowLogLevel level = WorkflowLogLevel.INFO;

    @Column(columnDefinition = "text")
    private String message;

    @Column(columnDefinition = "text")
    private String output;

    @Column(columnDefinition = "text")
    private String error;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(nullable = false)
    private Instant timestamp = Instant.now();
}
