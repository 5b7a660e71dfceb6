package com.imaginarium.orchestrator.node.impl;

import com.imaginarium.orchestrator.node.*;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Terminal node: collects whatever arrives on its inputs as the pipeline result. */
@Component
public class OutputNode implements NodeExecutor {

    private static final NodeTypeManifest MANIFEST = new NodeTypeManifest(
            "output", "1.0",
            "Collects its inputs as the pipeline result.",
            List.of(NodeTypeManifest.ANY_HANDLE),
            List.of("result"),
            false, true, null);

    @Override
    public NodeTypeManifest manifest() { return MANIFEST; }

    @Override
    public NodeResult execute(Map<String, Object> config, Map<String, Object> inputs,
                              NodeExecutionContext ctx) {
        Map<String, Object> result = new LinkedHashMap<>(inputs);
        Object label = config.get("label");
        if (label != null) {
            result.put("label", label.toString());
        }
        return NodeResult.of(Map.of("result", result));
    }
}
