package com.imaginarium.orchestrator.graph;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One entry of an {@link ExecutionPlan}.
 *
 * @param taskKey        Plan-local identifier; one task per node, so this equals the node id.
 * @param dependsOn      Task keys that must SUCCEED first, all earlier in the plan.
 * @param inputBindings  How each input handle is fed from upstream outputs.
 * @param executionOrder Zero-based position in the plan.
 * @param optional       Failure does not fail the run.
 * @param retryable      Timeouts count as transient failures.
 * @param timeout        Per-attempt wall-clock limit.
 */
public record TaskSpec(
        String              taskKey,
        String              nodeId,
        String              nodeType,
        Map<String, Object> config,
        List<String>        dependsOn,
        List<InputBinding>  inputBindings,
        int                 executionOrder,
        boolean             optional,
        boolean             retryable,
        Duration            timeout) {

    public TaskSpec {
        config        = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
        dependsOn     = List.copyOf(dependsOn);
        inputBindings = List.copyOf(inputBindings);
    }
}
