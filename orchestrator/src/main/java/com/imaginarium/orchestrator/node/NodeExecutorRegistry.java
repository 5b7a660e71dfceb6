package com.imaginarium.orchestrator.node;

import com.imaginarium.orchestrator.graph.NodeTypeCatalog;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process node type registry.
 *
 * All {@link NodeExecutor} beans declared as Spring {@code @Component}s are
 * collected at startup via constructor injection. The orchestrator only ever
 * holds this registry, never a concrete executor.
 *
 * <p>Key responsibilities:
 * <ol>
 *   <li>Lookup by type ({@link #get}, {@link #find}). Also serves the graph
 *       compiler as its {@link NodeTypeCatalog}.</li>
 *   <li>Metrics-instrumented execution ({@link #execute}). Every call is
 *       timed and counted, with no per-executor boilerplate.</li>
 * </ol>
 */
@Component
public class NodeExecutorRegistry implements NodeTypeCatalog {

    private static final Logger log = LoggerFactory.getLogger(NodeExecutorRegistry.class);

    private final Map<String, NodeExecutor> executors = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    /**
     * Spring collects every {@code NodeExecutor} bean and passes the list here.
     * Adding a node type only requires declaring it as {@code @Component}.
     */
    public NodeExecutorRegistry(List<NodeExecutor> allExecutors, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (NodeExecutor executor : allExecutors) {
            NodeTypeManifest m = executor.manifest();
            NodeExecutor previous = executors.putIfAbsent(m.type(), executor);
            if (previous != null) {
                throw new IllegalStateException("Node type '" + m.type() + "' registered twice: "
                        + previous.getClass().getName() + " and " + executor.getClass().getName());
            }
            log.info("Registered node type '{}' v{} (optional={}, retryable={})",
                    m.type(), m.version(), m.optional(), m.retryable());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public NodeExecutor get(String type) {
        NodeExecutor executor = type == null ? null : executors.get(type);
        if (executor == null) {
            throw new NodeTypeNotFoundException(type);
        }
        return executor;
    }

    @Override
    public Optional<NodeTypeManifest> find(String type) {
        if (type == null) return Optional.empty();
        return Optional.ofNullable(executors.get(type)).map(NodeExecutor::manifest);
    }

    /** Returns all registered node type names (sorted). */
    public List<String> nodeTypes() {
        return executors.keySet().stream().sorted().toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Execute a node of the given type with full observability.
     *
     * Every call is timed and counted:
     * <pre>
     *   orchestrator.node.calls{type, outcome="success|transient|permanent"}
     *   orchestrator.node.duration{type}
     * </pre>
     *
     * Anything other than a {@link NodeExecutionException} escaping the
     * executor is wrapped as a PERMANENT failure.
     *
     * @throws NodeExecutionException    classified failure
     * @throws NodeTypeNotFoundException unknown type
     */
    public NodeResult execute(String type,
                              Map<String, Object> config,
                              Map<String, Object> inputs,
                              NodeExecutionContext ctx) {
        NodeExecutor executor = get(type);

        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            NodeResult result = executor.execute(config, inputs, ctx);
            return result == null ? NodeResult.of(Map.of()) : result;
        } catch (NodeExecutionException e) {
            outcome = e.getClassification().name().toLowerCase();
            throw e;
        } catch (Exception e) {
            outcome = "permanent";
            throw new NodeExecutionException(ErrorClassification.PERMANENT, "EXECUTOR_ERROR",
                    "Unexpected error in node type '" + type + "': " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("orchestrator.node.duration", "type", type));
            meterRegistry.counter("orchestrator.node.calls",
                    "type", type, "outcome", outcome).increment();
        }
    }
}
