package com.cronflow.cronflow_backend;

import com.cronflow.cronflow_backend.model.run.NodeResult;

public enum ConnectionType {
    ALWAYS,        // follow whenever the source node has run
    ON_SUCCESS,    // follow when the source node succeeded
    ON_FAILURE,    // follow when the source node failed
    ON_CONDITION;  // follow when the source node set its condition flag to true

    /**
     * Evaluates this connection's firing predicate against the source node's result.
     * A source that has not run yet (null result) never satisfies a connection.
     */
    public boolean isSatisfiedBy(NodeResult sourceResult) {
        if (sourceResult == null) return false;
        return switch (this) {
            case ALWAYS       -> true;
            case ON_SUCCESS   -> sourceResult.success();
            case ON_FAILURE   -> !sourceResult.success();
            case ON_CONDITION -> Boolean.TRUE.equals(sourceResult.condition());
        };
    }
}
