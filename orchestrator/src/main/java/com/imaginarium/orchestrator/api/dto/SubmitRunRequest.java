package com.imaginarium.orchestrator.api.dto;

import com.imaginarium.orchestrator.graph.PipelineDefinition;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Duration;

/**
 * Request body for POST /runs.
 *
 * Required: pipelineId, userId, definition
 * Optional: priority (default 0, higher runs first), maxRetries (per task,
 *   defaults to orchestrator.retry.max-retries), timeoutMs (run deadline
 *   from submission; the run is failed once it passes)
 */
public record SubmitRunRequest(
        @NotBlank String             pipelineId,
        @NotBlank String             userId,
        Integer                      priority,
        Integer                      maxRetries,
        @Positive Long               timeoutMs,
        @NotNull  PipelineDefinition definition) {

    public SubmitRunRequest {
        if (priority == null) priority = 0;
    }

    public Duration timeout() {
        return timeoutMs == null ? null : Duration.ofMillis(timeoutMs);
    }
}
