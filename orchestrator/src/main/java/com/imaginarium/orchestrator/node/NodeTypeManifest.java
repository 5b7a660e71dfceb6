package com.imaginarium.orchestrator.node;

import java.time.Duration;
import java.util.List;

/**
 * Identity and contract of a node type.
 *
 * @param type        Unique name referenced by pipeline nodes (e.g. "http-request").
 * @param version     Semantic version of the executor implementation.
 * @param description One-line summary shown in the node palette.
 * @param inputs      Accepted input handles; {@link #ANY_HANDLE} accepts any name.
 * @param outputs     Produced output handles.
 * @param optional    Failure of this node type does not fail the run.
 * @param retryable   Timeouts are retried; when false a timeout is a permanent failure.
 * @param timeout     Per-attempt wall-clock limit, or null for the orchestrator default.
 */
public record NodeTypeManifest(
        String       type,
        String       version,
        String       description,
        List<String> inputs,
        List<String> outputs,
        boolean      optional,
        boolean      retryable,
        Duration     timeout) {

    public static final String ANY_HANDLE = "*";

    public NodeTypeManifest {
        inputs  = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }

    public boolean acceptsInput(String handle) {
        return handle != null && (inputs.contains(ANY_HANDLE) || inputs.contains(handle));
    }

    public boolean producesOutput(String handle) {
        return handle != null && (outputs.contains(ANY_HANDLE) || outputs.contains(handle));
    }
}
