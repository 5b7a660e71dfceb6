package com.imaginarium.orchestrator.store;

import com.imaginarium.orchestrator.graph.TaskSpec;
import com.imaginarium.orchestrator.model.TaskExecution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.UUID;

/** Materializes plan entries as task rows. Shared by both store implementations. */
final class TaskFactory {

    private TaskFactory() {}

    static TaskExecution fromSpec(UUID runId, TaskSpec spec, int maxRetries) {
        TaskExecution task = new TaskExecution(runId, spec.nodeId(), spec.nodeType(), spec.executionOrder());
        task.setConfig(new LinkedHashMap<>(spec.config()));
        task.setDependsOn(new ArrayList<>(spec.dependsOn()));
        task.setInputBindings(new ArrayList<>(spec.inputBindings()));
        task.setMaxRetries(maxRetries);
        task.setOptional(spec.optional());
        task.setRetryable(spec.retryable());
        task.setTimeoutMs(spec.timeout().toMillis());
        return task;
    }
}
