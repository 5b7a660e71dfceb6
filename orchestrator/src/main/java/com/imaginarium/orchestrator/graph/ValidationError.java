package com.imaginarium.orchestrator.graph;

import java.util.List;

/**
 * Why a pipeline definition cannot be compiled.
 *
 * @param offendingNodes Node ids involved, in declaration order (may be empty).
 */
public record ValidationError(Kind kind, String message, List<String> offendingNodes) {

    public enum Kind {
        EMPTY_PIPELINE,
        MALFORMED_NODE,
        DUPLICATE_NODE,
        UNKNOWN_NODE_TYPE,
        MALFORMED_CONNECTION,
        CYCLIC_GRAPH
    }

    public ValidationError {
        offendingNodes = offendingNodes == null ? List.of() : List.copyOf(offendingNodes);
    }
}
