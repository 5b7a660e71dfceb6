package com.imaginarium.orchestrator.store;

import com.imaginarium.orchestrator.graph.InputBinding;
import com.imaginarium.orchestrator.model.TaskExecution;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/** Wires dependency outputs to a task's input handles. */
final class InputResolver {

    private InputResolver() {}

    static Map<String, Object> resolve(TaskExecution task, Collection<TaskExecution> runTasks) {
        Map<String, TaskExecution> byNode = new HashMap<>();
        for (TaskExecution t : runTasks) {
            byNode.put(t.getNodeId(), t);
        }
        Map<String, Object> inputs = new LinkedHashMap<>();
        for (InputBinding b : task.getInputBindings()) {
            TaskExecution source = byNode.get(b.sourceNodeId());
            Map<String, Object> output = source == null ? null : source.getOutput();
            inputs.put(b.targetHandle(), output == null ? null : output.get(b.sourceHandle()));
        }
        return inputs;
    }
}
