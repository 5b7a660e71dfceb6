package com.imaginarium.orchestrator.node.impl;

import com.imaginarium.orchestrator.node.*;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/** Emits the text configured in the editor. Entry point of most pipelines. */
@Component
public class TextInputNode implements NodeExecutor {

    private static final NodeTypeManifest MANIFEST = new NodeTypeManifest(
            "text-input", "1.0",
            "Static text entered by the user.",
            List.of(),
            List.of("text"),
            false, true, null);

    @Override
    public NodeTypeManifest manifest() { return MANIFEST; }

    @Override
    public NodeResult execute(Map<String, Object> config, Map<String, Object> inputs,
                              NodeExecutionContext ctx) {
        Object text = config.get("text");
        if (text == null || text.toString().isBlank()) {
            throw NodeExecutionException.permanentError("INVALID_CONFIG", "Text input is required");
        }
        return NodeResult.of(Map.of("text", text.toString()));
    }
}
