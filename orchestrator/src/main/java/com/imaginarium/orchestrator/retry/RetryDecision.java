package com.imaginarium.orchestrator.retry;

import java.time.Duration;

/** Outcome of {@link RetryPolicy#decide}. */
public sealed interface RetryDecision permits RetryDecision.RetryAfter, RetryDecision.GiveUp {

    record RetryAfter(Duration delay) implements RetryDecision {}

    record GiveUp(String reason) implements RetryDecision {}

    static RetryDecision retryAfter(Duration delay) { return new RetryAfter(delay); }

    static RetryDecision giveUp(String reason)      { return new GiveUp(reason); }
}
