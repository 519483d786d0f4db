package com.cronflow.cronflow_backend.repository;

import com.cronflow.cronflow_backend.model.domain.WorkflowExecution;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WorkflowExecutionRepository extends JpaRepository<WorkflowExecution, Long> {
    List<WorkflowExecution> findByWorkflowIdOrderByStartedAtDesc(Long workflowId);
}
