package com.imaginarium.orchestrator.support;

import com.imaginarium.orchestrator.node.NodeExecutionContext;
import com.imaginarium.orchestrator.node.NodeExecutor;
import com.imaginarium.orchestrator.node.NodeResult;
import com.imaginarium.orchestrator.node.NodeTypeManifest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A node executor whose behaviour is supplied by the test.
 * Every invocation is recorded, in call order.
 */
public class ScriptedNode implements NodeExecutor {

    @FunctionalInterface
    public interface Script {
        NodeResult run(Map<String, Object> config, Map<String, Object> inputs, NodeExecutionContext ctx);
    }

    private final NodeTypeManifest manifest;
    private final Script script;
    private final List<NodeExecutionContext> calls = new CopyOnWriteArrayList<>();

    public ScriptedNode(NodeTypeManifest manifest, Script script) {
        this.manifest = manifest;
        this.script   = script;
    }

    /** Emits {@code out = "<nodeId>(<inputs>)"}. */
    public static ScriptedNode echo(NodeTypeManifest manifest) {
        return new ScriptedNode(manifest, (config, inputs, ctx) -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("out", ctx.nodeId() + inputs.values());
            return NodeResult.of(out);
        });
    }

    @Override
    public NodeTypeManifest manifest() {
        return manifest;
    }

    @Override
    public NodeResult execute(Map<String, Object> config, Map<String, Object> inputs, NodeExecutionContext ctx) {
        calls.add(ctx);
        return script.run(config, inputs, ctx);
    }

    public List<NodeExecutionContext> calls() {
        return calls;
    }
}
