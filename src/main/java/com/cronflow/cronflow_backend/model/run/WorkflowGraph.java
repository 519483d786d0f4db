package com.cronflow.cronflow_backend.model.run;

import com.cronflow.cronflow_backend.model.domain.WorkflowConnection;
import com.cronflow.cronflow_backend.model.domain.WorkflowNode;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Structural view of a workflow: nodes by id (stored order), connections grouped by target and by
 * source (connection order kept), and the entry nodes that have no incoming connection.
 */
public record WorkflowGraph(Map<Long, WorkflowNode> nodes,
                            Map<Long, List<WorkflowConnection>> incoming,
                            Map<Long, List<WorkflowConnection>> outgoing,
                            List<WorkflowNode> entryNodes) {

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /** False on a non-empty graph means every node sits on a cycle or behind one. */
    public boolean hasEntryNodes() {
        return !entryNodes.isEmpty();
    }

    public int size() {
        return nodes.size();
    }

    public WorkflowNode node(Long nodeId) {
        return nodes.get(nodeId);
    }

    public Collection<WorkflowNode> allNodes() {
        return nodes.values();
    }

    public List<WorkflowConnection> incoming(Long nodeId) {
        return incoming.getOrDefault(nodeId, List.of());
    }

    public List<WorkflowConnection> outgoing(Long nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }
}
