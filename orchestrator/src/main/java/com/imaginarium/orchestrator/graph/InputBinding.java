package com.imaginarium.orchestrator.graph;

/**
 * Where one input handle of a task gets its value: the named output
 * handle of an upstream node.
 */
public record InputBinding(String sourceNodeId, String sourceHandle, String targetHandle) {}
