package com.imaginarium.orchestrator.support;

import com.imaginarium.orchestrator.graph.Connection;
import com.imaginarium.orchestrator.graph.NodeTypeCatalog;
import com.imaginarium.orchestrator.graph.PipelineDefinition;
import com.imaginarium.orchestrator.graph.PipelineNode;
import com.imaginarium.orchestrator.node.NodeTypeManifest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pipeline fixtures.
 *
 * Node types known to {@link #CATALOG}:
 *   source    no inputs,  output "out"
 *   step      any input,  output "out"
 *   optional  any input,  output "out", failure does not fail the run
 */
public final class Pipelines {

    private Pipelines() {}

    public static final NodeTypeManifest SOURCE = new NodeTypeManifest(
            "source", "1.0", "test source", List.of(), List.of("out"), false, true, null);
    public static final NodeTypeManifest STEP = new NodeTypeManifest(
            "step", "1.0", "test step", List.of(NodeTypeManifest.ANY_HANDLE), List.of("out"), false, true, null);
    public static final NodeTypeManifest OPTIONAL = new NodeTypeManifest(
            "optional", "1.0", "optional step", List.of(NodeTypeManifest.ANY_HANDLE), List.of("out"), true, true, null);

    public static final NodeTypeCatalog CATALOG = type -> type == null ? Optional.empty() : switch (type) {
        case "source"   -> Optional.of(SOURCE);
        case "step"     -> Optional.of(STEP);
        case "optional" -> Optional.of(OPTIONAL);
        default         -> Optional.empty();
    };

    public static Builder pipeline() {
        return new Builder();
    }

    public static final class Builder {
        private final List<PipelineNode> nodes       = new ArrayList<>();
        private final List<Connection>   connections = new ArrayList<>();

        public Builder node(String id, String type) {
            nodes.add(new PipelineNode(id, type, Map.of()));
            return this;
        }

        public Builder node(String id, String type, Map<String, Object> config) {
            nodes.add(new PipelineNode(id, type, config));
            return this;
        }

        /** Connects {@code from.out} to the input handle named after the source node. */
        public Builder edge(String from, String to) {
            connections.add(new Connection(from, "out", to, from));
            return this;
        }

        public Builder connection(String from, String fromHandle, String to, String toHandle) {
            connections.add(new Connection(from, fromHandle, to, toHandle));
            return this;
        }

        public PipelineDefinition build() {
            return new PipelineDefinition(nodes, connections);
        }
    }
}
