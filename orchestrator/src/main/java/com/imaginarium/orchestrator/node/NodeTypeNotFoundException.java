package com.imaginarium.orchestrator.node;

public class NodeTypeNotFoundException extends RuntimeException {
    public NodeTypeNotFoundException(String type) {
        super("No executor registered for node type: '" + type + "'");
    }
}
