package com.imaginarium.orchestrator.graph;

import java.util.Objects;

/**
 * Outcome of {@link TaskGraphCompiler#compile}: exactly one of plan or error is set.
 * Compilation never throws for an invalid definition.
 */
public record CompileResult(ExecutionPlan plan, ValidationError error) {

    public CompileResult {
        if ((plan == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of plan or error must be set");
        }
    }

    public static CompileResult ok(ExecutionPlan plan) {
        return new CompileResult(Objects.requireNonNull(plan), null);
    }

    public static CompileResult error(ValidationError error) {
        return new CompileResult(null, Objects.requireNonNull(error));
    }

    public boolean isOk() {
        return plan != null;
    }
}
