package com.imaginarium.orchestrator.graph;

/**
 * Directed edge from an output handle of one node to an input handle of another.
 * The target node depends on the source node.
 */
public record Connection(
        String sourceNodeId,
        String sourceHandle,
        String targetNodeId,
        String targetHandle) {}
