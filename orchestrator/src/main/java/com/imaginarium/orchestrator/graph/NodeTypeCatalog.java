package com.imaginarium.orchestrator.graph;

import com.imaginarium.orchestrator.node.NodeTypeManifest;

import java.util.Optional;

/** Read-only view of the known node types, used to validate handles at compile time. */
@FunctionalInterface
public interface NodeTypeCatalog {

    Optional<NodeTypeManifest> find(String nodeType);
}
