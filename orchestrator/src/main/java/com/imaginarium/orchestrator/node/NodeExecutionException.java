package com.imaginarium.orchestrator.node;

/**
 * Thrown by a {@link NodeExecutor} when a node cannot produce its outputs.
 *
 * Unchecked so executors can throw it from deep inside client code; the
 * worker is the only place that catches it and routes it by classification.
 */
public class NodeExecutionException extends RuntimeException {

    private final ErrorClassification classification;
    private final String              code;

    public NodeExecutionException(ErrorClassification classification, String code, String message) {
        super(message);
        this.classification = classification;
        this.code           = code;
    }

    public NodeExecutionException(ErrorClassification classification, String code,
                                  String message, Throwable cause) {
        super(message, cause);
        this.classification = classification;
        this.code           = code;
    }

    public static NodeExecutionException transientError(String code, String message) {
        return new NodeExecutionException(ErrorClassification.TRANSIENT, code, message);
    }

    public static NodeExecutionException permanentError(String code, String message) {
        return new NodeExecutionException(ErrorClassification.PERMANENT, code, message);
    }

    public ErrorClassification getClassification() { return classification; }
    public String              getCode()           { return code; }
    public boolean             isTransient()       { return classification == ErrorClassification.TRANSIENT; }
}
