package com.imaginarium.orchestrator.api.dto;

import com.imaginarium.orchestrator.graph.ValidationError;

import java.util.List;

/** 400 body for a pipeline that does not compile. */
public record ValidationErrorResponse(String error, String message, List<String> offendingNodes) {

    public static ValidationErrorResponse from(ValidationError e) {
        return new ValidationErrorResponse(e.kind().name(), e.message(), e.offendingNodes());
    }
}
