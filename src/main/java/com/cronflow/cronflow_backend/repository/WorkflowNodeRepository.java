package com.cronflow.cronflow_backend.repository;

import com.cronflow.cronflow_backend.model.domain.WorkflowNode;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WorkflowNodeRepository extends JpaRepository<WorkflowNode, Long> {
    List<WorkflowNode> findByWorkflowIdOrderByIdAsc(Long workflowId);
}
