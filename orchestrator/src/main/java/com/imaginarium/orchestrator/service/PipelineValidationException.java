package com.imaginarium.orchestrator.service;

import com.imaginarium.orchestrator.graph.ValidationError;

/** The submitted pipeline does not compile. No run was created. */
public class PipelineValidationException extends RuntimeException {

    private final ValidationError error;

    public PipelineValidationException(ValidationError error) {
        super(error.kind() + ": " + error.message());
        this.error = error;
    }

    public ValidationError getError() { return error; }
}
