package com.imaginarium.orchestrator.graph;

import java.util.List;
import java.util.Optional;

/**
 * Compiled, topologically ordered task list for one run.
 * Read-only; produced only by {@link TaskGraphCompiler}.
 */
public record ExecutionPlan(List<TaskSpec> tasks) {

    public ExecutionPlan {
        tasks = List.copyOf(tasks);
    }

    public int size() {
        return tasks.size();
    }

    public Optional<TaskSpec> task(String taskKey) {
        return tasks.stream().filter(t -> t.taskKey().equals(taskKey)).findFirst();
    }
}
