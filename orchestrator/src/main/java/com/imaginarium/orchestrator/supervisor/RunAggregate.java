package com.imaginarium.orchestrator.supervisor;

import com.imaginarium.orchestrator.model.Run;
import com.imaginarium.orchestrator.model.TaskExecution;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A run together with all of its tasks, in plan order.
 * Only ever handed to {@link RunSupervisor} while the store holds the run lock.
 */
public record RunAggregate(Run run, List<TaskExecution> tasks) {

    public Optional<TaskExecution> task(UUID taskId) {
        return tasks.stream().filter(t -> t.getId().equals(taskId)).findFirst();
    }

    public Optional<TaskExecution> taskForNode(String nodeId) {
        return tasks.stream().filter(t -> t.getNodeId().equals(nodeId)).findFirst();
    }
}
