package com.cronflow.cronflow_backend.repository;

import com.cronflow.cronflow_backend.model.domain.WorkflowConnection;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WorkflowConnectionRepository extends JpaRepository<WorkflowConnection, Long> {
    List<WorkflowConnection> findByWorkflowIdOrderByIdAsc(Long workflowId);
}
