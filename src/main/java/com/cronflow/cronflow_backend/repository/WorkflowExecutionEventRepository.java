package com.cronflow.cronflow_backend.repository;

import com.cronflow.cronflow_backend.model.domain.WorkflowExecutionEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WorkflowExecutionEventRepository extends JpaRepository<WorkflowExecutionEvent, Long> {
    List<WorkflowExecutionEvent> findByWorkflowExecutionIdOrderBySequenceOrderAsc(Long workflowExecutionId);
}
