package com.imaginarium.orchestrator.node.impl;

import com.imaginarium.orchestrator.node.*;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a text template, substituting {@code {{handle}}} with the value
 * arriving on that input handle. Typically builds the prompt for an AI node.
 */
@Component
public class TemplateNode implements NodeExecutor {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");

    private static final NodeTypeManifest MANIFEST = new NodeTypeManifest(
            "template", "1.0",
            "Fills {{placeholders}} in a template from its inputs.",
            List.of(NodeTypeManifest.ANY_HANDLE),
            List.of("text"),
            false, true, null);

    @Override
    public NodeTypeManifest manifest() { return MANIFEST; }

    @Override
    public NodeResult execute(Map<String, Object> config, Map<String, Object> inputs,
                              NodeExecutionContext ctx) {
        Object template = config.get("template");
        if (template == null) {
            throw NodeExecutionException.permanentError("INVALID_CONFIG", "template is required");
        }
        boolean strict = Boolean.parseBoolean(String.valueOf(config.getOrDefault("strict", "true")));

        Matcher m = PLACEHOLDER.matcher(template.toString());
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String handle = m.group(1);
            if (!inputs.containsKey(handle) && strict) {
                throw NodeExecutionException.permanentError("MISSING_INPUT",
                        "No input bound to placeholder '" + handle + "'");
            }
            Object value = inputs.get(handle);
            m.appendReplacement(sb, Matcher.quoteReplacement(value == null ? "" : value.toString()));
        }
        m.appendTail(sb);
        return NodeResult.of(Map.of("text", sb.toString()));
    }
}
