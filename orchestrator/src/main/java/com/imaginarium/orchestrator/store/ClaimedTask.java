package com.imaginarium.orchestrator.store;

import com.imaginarium.orchestrator.model.TaskExecution;

import java.util.Map;

/**
 * A task the caller now owns, together with its resolved inputs.
 *
 * @param task   snapshot taken right after the claim (status RUNNING, attempt incremented)
 * @param inputs input handle → value, read from the outputs of the task's dependencies
 */
public record ClaimedTask(TaskExecution task, Map<String, Object> inputs) {}
