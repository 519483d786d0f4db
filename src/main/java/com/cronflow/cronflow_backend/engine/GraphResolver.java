package com.cronflow.cronflow_backend.engine;

import com.cronflow.cronflow_backend.model.domain.WorkflowConnection;
import com.cronflow.cronflow_backend.model.domain.WorkflowNode;
import com.cronflow.cronflow_backend.model.run.WorkflowGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the structural facts the engine walks: adjacency per node and the entry nodes.
 * Pure: no storage access, no logging.
 */
public final class GraphResolver {

    private GraphResolver() {}

    public static WorkflowGraph resolve(List<WorkflowNode> nodes, List<WorkflowConnection> connections) {
        Map<Long, WorkflowNode> nodeMap = new LinkedHashMap<>();
        nodes.forEach(n -> nodeMap.put(n.getId(), n));

        Map<Long, List<WorkflowConnection>> incoming = new LinkedHashMap<>();
        Map<Long, List<WorkflowConnection>> outgoing = new LinkedHashMap<>();
        for (WorkflowConnection connection : connections) {
            incoming.computeIfAbsent(connection.getTargetNodeId(), k -> new ArrayList<>()).add(connection);
            outgoing.computeIfAbsent(connection.getSourceNodeId(), k -> new ArrayList<>()).add(connection);
        }

        // A node is an entry point only when nothing points at it, dangling sources included
        List<WorkflowNode> entryNodes = nodes.stream()
                .filter(n -> !incoming.containsKey(n.getId()))
                .toList();

        return new WorkflowGraph(
                Collections.unmodifiableMap(nodeMap),
                freeze(incoming),
                freeze(outgoing),
                entryNodes);
    }

    private static Map<Long, List<WorkflowConnection>> freeze(Map<Long, List<WorkflowConnection>> byNode) {
        Map<Long, List<WorkflowConnection>> frozen = new LinkedHashMap<>();
        byNode.forEach((nodeId, list) -> frozen.put(nodeId, List.copyOf(list)));
        return Collections.unmodifiableMap(frozen);
    }
}
