package com.imaginarium.orchestrator.store;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * An outcome reported for one attempt of a RUNNING task.
 *
 * The {@code attempt} identifies which claim produced the outcome. A
 * transition whose attempt no longer matches the task (it was recovered,
 * retried or discarded in the meantime) is ignored.
 */
public record TaskTransition(
        Kind                kind,
        int                 attempt,
        Map<String, Object> outputs,
        BigDecimal          cost,
        long                tokensUsed,
        String              errorCode,
        String              error,
        Instant             retryAt) {

    public enum Kind {
        /** Node produced its outputs. */
        SUCCEEDED,
        /** Failed, another attempt is scheduled at {@code retryAt}. */
        RETRY,
        /** Failed for good; dependents are skipped. */
        FAILED,
        /** The run was cancelled while the node was running; the result is dropped. */
        DISCARD
    }

    public static TaskTransition succeeded(int attempt, Map<String, Object> outputs,
                                           BigDecimal cost, long tokensUsed) {
        return new TaskTransition(Kind.SUCCEEDED, attempt, outputs, cost, tokensUsed, null, null, null);
    }

    public static TaskTransition retry(int attempt, String errorCode, String error, Instant retryAt) {
        return new TaskTransition(Kind.RETRY, attempt, null, null, 0, errorCode, error, retryAt);
    }

    public static TaskTransition failed(int attempt, String errorCode, String error) {
        return new TaskTransition(Kind.FAILED, attempt, null, null, 0, errorCode, error, null);
    }

    public static TaskTransition discard(int attempt) {
        return new TaskTransition(Kind.DISCARD, attempt, null, null, 0, null, null, null);
    }
}
