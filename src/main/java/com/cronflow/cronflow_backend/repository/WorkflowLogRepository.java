package com.cronflow.cronflow_backend.repository;

import com.cronflow.cronflow_backend.model.domain.WorkflowLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WorkflowLogRepository extends JpaRepository<WorkflowLog, Long> {
    List<WorkflowLog> findByWorkflowIdOrderByTimestampDesc(Long workflowId);
}
