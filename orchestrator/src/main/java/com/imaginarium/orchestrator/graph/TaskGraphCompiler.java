package com.imaginarium.orchestrator.graph;

import com.imaginarium.orchestrator.node.NodeTypeManifest;
import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a {@link PipelineDefinition} into a validated, topologically ordered
 * {@link ExecutionPlan}.
 *
 * <p>Pure: no I/O and no shared state, so the same definition always compiles
 * to the same plan. Invalid definitions come back as
 * {@link CompileResult#error}; nothing is thrown for them.
 *
 * <p>Ordering is Kahn's algorithm over a JGraphT directed graph. The set of
 * zero in-degree nodes is a priority queue keyed on declaration index, which
 * breaks ties between nodes of equal rank by the order they were declared.
 */
public class TaskGraphCompiler {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphCompiler.class);

    private final NodeTypeCatalog catalog;
    private final Duration        defaultTimeout;

    public TaskGraphCompiler(NodeTypeCatalog catalog, Duration defaultTimeout) {
        this.catalog        = catalog;
        this.defaultTimeout = defaultTimeout;
    }

    public CompileResult compile(PipelineDefinition definition) {
        List<PipelineNode> nodes = definition.nodes();
        if (nodes.isEmpty()) {
            return fail(ValidationError.Kind.EMPTY_PIPELINE, "Pipeline has no nodes", List.of());
        }

        // ── Nodes: unique ids, known types ───────────────────────────────
        Map<String, Integer>          declarationIndex = new HashMap<>();
        Map<String, PipelineNode>     nodesById        = new LinkedHashMap<>();
        Map<String, NodeTypeManifest> manifests        = new HashMap<>();
        List<String> unknownTypes = new ArrayList<>();

        for (int i = 0; i < nodes.size(); i++) {
            PipelineNode node = nodes.get(i);
            if (node.id() == null || node.id().isBlank()) {
                return fail(ValidationError.Kind.MALFORMED_NODE,
                        "Node at position " + i + " has no id", List.of());
            }
            if (nodesById.putIfAbsent(node.id(), node) != null) {
                return fail(ValidationError.Kind.DUPLICATE_NODE,
                        "Duplicate node id '" + node.id() + "'", List.of(node.id()));
            }
            declarationIndex.put(node.id(), i);
            catalog.find(node.type()).ifPresentOrElse(
                    m -> manifests.put(node.id(), m),
                    () -> unknownTypes.add(node.id()));
        }
        if (!unknownTypes.isEmpty()) {
            return fail(ValidationError.Kind.UNKNOWN_NODE_TYPE,
                    "Unknown node type for nodes " + unknownTypes, unknownTypes);
        }

        // ── Connections: endpoints exist, handles valid, inputs bound once ─
        Graph<String, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
        nodesById.keySet().forEach(graph::addVertex);

        Map<String, List<InputBinding>> bindings = new HashMap<>();
        Set<String> boundInputs = new HashSet<>();

        for (Connection c : definition.connections()) {
            ValidationError malformed = checkConnection(c, nodesById, manifests);
            if (malformed != null) {
                return CompileResult.error(malformed);
            }
            if (!boundInputs.add(c.targetNodeId() + "\u0000" + c.targetHandle())) {
                return fail(ValidationError.Kind.MALFORMED_CONNECTION,
                        "Input '" + c.targetHandle() + "' of node '" + c.targetNodeId()
                                + "' is bound more than once",
                        List.of(c.targetNodeId()));
            }
            if (c.sourceNodeId().equals(c.targetNodeId())) {
                return fail(ValidationError.Kind.CYCLIC_GRAPH,
                        "Node '" + c.sourceNodeId() + "' is connected to itself",
                        List.of(c.sourceNodeId()));
            }
            graph.addEdge(c.sourceNodeId(), c.targetNodeId());   // parallel edges collapse
            bindings.computeIfAbsent(c.targetNodeId(), k -> new ArrayList<>())
                    .add(new InputBinding(c.sourceNodeId(), c.sourceHandle(), c.targetHandle()));
        }

        Comparator<String> byDeclaration = Comparator.comparingInt(declarationIndex::get);

        // ── Cycles ────────────────────────────────────────────────────────
        Set<String> onCycle = new CycleDetector<>(graph).findCycles();
        if (!onCycle.isEmpty()) {
            List<String> offending = onCycle.stream().sorted(byDeclaration).toList();
            log.debug("Rejected cyclic pipeline, nodes on cycles: {}", offending);
            return fail(ValidationError.Kind.CYCLIC_GRAPH,
                    "Pipeline contains a cycle through nodes " + offending, offending);
        }

        // ── Kahn ordering with declaration-order tie break ───────────────
        List<TaskSpec> tasks = new ArrayList<>(nodes.size());
        TopologicalOrderIterator<String, DefaultEdge> order =
                new TopologicalOrderIterator<>(graph, byDeclaration);

        while (order.hasNext()) {
            String nodeId = order.next();
            PipelineNode     node     = nodesById.get(nodeId);
            NodeTypeManifest manifest = manifests.get(nodeId);

            List<String> dependsOn = graph.incomingEdgesOf(nodeId).stream()
                    .map(graph::getEdgeSource)
                    .distinct()
                    .sorted(byDeclaration)
                    .toList();

            tasks.add(new TaskSpec(
                    nodeId,
                    nodeId,
                    node.type(),
                    node.config(),
                    dependsOn,
                    bindings.getOrDefault(nodeId, List.of()),
                    tasks.size(),
                    manifest.optional(),
                    manifest.retryable(),
                    manifest.timeout() != null ? manifest.timeout() : defaultTimeout));
        }

        log.debug("Compiled pipeline: {} tasks, {} connections",
                tasks.size(), definition.connections().size());
        return CompileResult.ok(new ExecutionPlan(tasks));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ValidationError checkConnection(Connection c,
                                                   Map<String, PipelineNode> nodesById,
                                                   Map<String, NodeTypeManifest> manifests) {
        List<String> missing = new ArrayList<>();
        if (c.sourceNodeId() == null || !nodesById.containsKey(c.sourceNodeId())) {
            missing.add(String.valueOf(c.sourceNodeId()));
        }
        if (c.targetNodeId() == null || !nodesById.containsKey(c.targetNodeId())) {
            missing.add(String.valueOf(c.targetNodeId()));
        }
        if (!missing.isEmpty()) {
            return new ValidationError(ValidationError.Kind.MALFORMED_CONNECTION,
                    "Connection references unknown node(s) " + missing, missing);
        }

        NodeTypeManifest source = manifests.get(c.sourceNodeId());
        if (!source.producesOutput(c.sourceHandle())) {
            return new ValidationError(ValidationError.Kind.MALFORMED_CONNECTION,
                    "Node '" + c.sourceNodeId() + "' (" + source.type()
                            + ") has no output handle '" + c.sourceHandle() + "'",
                    List.of(c.sourceNodeId()));
        }
        NodeTypeManifest target = manifests.get(c.targetNodeId());
        if (!target.acceptsInput(c.targetHandle())) {
            return new ValidationError(ValidationError.Kind.MALFORMED_CONNECTION,
                    "Node '" + c.targetNodeId() + "' (" + target.type()
                            + ") has no input handle '" + c.targetHandle() + "'",
                    List.of(c.targetNodeId()));
        }
        return null;
    }

    private static CompileResult fail(ValidationError.Kind kind, String message, List<String> nodes) {
        return CompileResult.error(new ValidationError(kind, message, nodes));
    }
}
