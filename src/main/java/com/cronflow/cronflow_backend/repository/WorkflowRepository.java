package com.cronflow.cronflow_backend.repository;

import com.cronflow.cronflow_backend.WorkflowStatus;
import com.cronflow.cronflow_backend.WorkflowTriggerType;
import com.cronflow.cronflow_backend.model.domain.Workflow;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface WorkflowRepository extends JpaRepository<Workflow, Long> {
    // Used at startup to load every workflow the job registry must schedule
    List<Workflow> findByStatusAndTriggerType(WorkflowStatus status, WorkflowTriggerType triggerType);

    Optional<Workflow> findByWebhookKey(String webhookKey);
}
