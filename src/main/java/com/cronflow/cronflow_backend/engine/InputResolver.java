package com.cronflow.cronflow_backend.engine;

import com.cronflow.cronflow_backend.model.domain.WorkflowConnection;
import com.cronflow.cronflow_backend.model.run.NodeResult;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the input handed to a node's event, so that what one event passes to
 * {@code flow.output(...)} becomes what the next one reads from {@code flow.input()}.
 *
 * <ul>
 *   <li>Entry node: the workflow's initial trigger input.</li>
 *   <li>Otherwise: the scriptOutput of the last successful predecessor (connection order) that produced one.</li>
 *   <li>No such predecessor: the initial trigger input again.</li>
 * </ul>
 * A winning scriptOutput that is not a JSON object collapses to an empty object.
 */
@Slf4j
public final class InputResolver {

    private InputResolver() {}

    public static Map<String, Object> resolve(List<WorkflowConnection> incoming,
                                              Map<Long, NodeResult> results,
                                              Map<String, Object> initialInput) {
        if (incoming.isEmpty()) {
            return copyOf(initialInput);
        }

        Object latestOutput = null;
        boolean hasValidOutput = false;

        for (WorkflowConnection connection : incoming) {
            NodeResult source = results.get(connection.getSourceNodeId());
            if (source == null || !source.success()) {
                log.debug("Input resolution: node {} failed or has no result", connection.getSourceNodeId());
                continue;
            }
            if (source.scriptOutput() == null) {
                log.debug("Input resolution: node {} produced no scriptOutput", connection.getSourceNodeId());
                continue;
            }
            latestOutput = source.scriptOutput();
            hasValidOutput = true;
        }

        if (!hasValidOutput) {
            return copyOf(initialInput);
        }
        return asObject(latestOutput);
    }

    private static Map<String, Object> asObject(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> object = new LinkedHashMap<>();
            map.forEach((k, v) -> object.put(String.valueOf(k), v));
            return object;
        }
        return new HashMap<>();
    }

    private static Map<String, Object> copyOf(Map<String, Object> input) {
        return input != null ? new LinkedHashMap<>(input) : new LinkedHashMap<>();
    }
}
