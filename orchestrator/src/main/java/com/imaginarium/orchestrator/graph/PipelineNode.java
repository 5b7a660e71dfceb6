package com.imaginarium.orchestrator.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One node of a pipeline definition.
 *
 * @param id     Unique within the pipeline.
 * @param type   Node type name, resolved against the node executor registry (e.g. "text-input").
 * @param config Type-specific configuration passed verbatim to the executor.
 */
public record PipelineNode(String id, String type, Map<String, Object> config) {

    public PipelineNode {
        config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }
}
