package com.imaginarium.orchestrator.node;

import java.util.Map;

/**
 * Every node type a pipeline can use is backed by a NodeExecutor.
 *
 * The orchestrator never knows how a node type does its work (calling an AI
 * provider, transforming text, hitting an HTTP endpoint). It only relies on
 * this contract and on the error classification carried by
 * {@link NodeExecutionException}.
 *
 * <p>Implementations are Spring {@code @Component}s; the
 * {@link NodeExecutorRegistry} collects them at startup and routes by
 * {@link NodeTypeManifest#type()}.
 */
public interface NodeExecutor {

    /** Identity, handles and failure policy of the node type. */
    NodeTypeManifest manifest();

    /**
     * Execute one node.
     *
     * @param config Node configuration from the pipeline definition.
     * @param inputs Values for the node's input handles, taken from upstream outputs.
     * @param ctx    Run/task identity and the cooperative cancellation token.
     * @return outputs keyed by output handle, plus usage
     * @throws NodeExecutionException classified TRANSIENT or PERMANENT
     */
    NodeResult execute(Map<String, Object> config,
                       Map<String, Object> inputs,
                       NodeExecutionContext ctx) throws NodeExecutionException;
}
