package com.cronflow.cronflow_backend.model.domain;

import com.cronflow.cronflow_backend.WorkflowTriggerType;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "workflow_executions")
@Data
public class WorkflowExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workflow_id", nullable = false)
    private Long workflowId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private LogStatus status = LogStatus.RUNNING;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false)
    private WorkflowTriggerType triggerType = WorkflowTriggerType.MANUAL;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // Milliseconds between startedAt and completedAt
    @Column(name = "total_duration")
    private Long totalDuration;

    @Column(name = "total_events")
    private Integer totalEvents = 0;

    @Column(name = "successful_events")
    private Integer successfulEvents = 0;

    @Column(name = "failed_events")
    private Integer failedEvents = 0;

    // Trigger metadata and the initial input: { triggerType, triggeredAt, inputData }
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "execution_data")
    private Map<String, Object> executionData;
}
