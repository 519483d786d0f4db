package com.cronflow.cronflow_backend.model.domain;

import com.cronflow.cronflow_backend.ScheduleUnit;
import com.cronflow.cronflow_backend.WorkflowStatus;
import com.cronflow.cronflow_backend.WorkflowTriggerType;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "workflows")
@Data
public class Workflow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private String description;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkflowStatus status = WorkflowStatus.DRAFT;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false)
    private WorkflowTriggerType triggerType = WorkflowTriggerType.MANUAL;

    // "Every N units" schedule; ignored when customSchedule is set
    @Column(name = "schedule_number")
    private Integer scheduleNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "schedule_unit")
    private ScheduleUnit scheduleUnit;

    /** Cron expression, e.g. "0 2 * * *". Takes precedence over scheduleNumber/scheduleUnit. */
    @Column(name = "custom_schedule")
    private String customSchedule;

    // Execution-target override for remote runners; stored as configured, LocalEventRunner runs everything on this host
    @Column(name = "override_event_servers", nullable = false)
    private boolean overrideEventServers = false;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "override_server_ids")
    private List<Long> overrideServerIds = new ArrayList<>();

    @Column(nullable = false)
    private boolean shared = false;

    /** Public trigger key. Used for POST /api/webhooks/workflows/{key}. */
    @Column(name = "webhook_key", unique = true)
    private String webhookKey;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }
}
