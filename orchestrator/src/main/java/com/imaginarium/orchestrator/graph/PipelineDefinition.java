package com.imaginarium.orchestrator.graph;

import java.util.List;

/**
 * Immutable pipeline graph as drawn in the editor.
 *
 * Node order is significant: it is the declaration order the compiler uses
 * to break ties between nodes of equal topological rank.
 */
public record PipelineDefinition(List<PipelineNode> nodes, List<Connection> connections) {

    public PipelineDefinition {
        nodes       = nodes == null ? List.of() : List.copyOf(nodes);
        connections = connections == null ? List.of() : List.copyOf(connections);
    }
}
