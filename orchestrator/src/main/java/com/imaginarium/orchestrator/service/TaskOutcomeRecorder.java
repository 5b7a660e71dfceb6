package com.imaginarium.orchestrator.service;

import com.imaginarium.orchestrator.model.TaskExecution;
import com.imaginarium.orchestrator.node.ErrorClassification;
import com.imaginarium.orchestrator.node.NodeResult;
import com.imaginarium.orchestrator.retry.RetryDecision;
import com.imaginarium.orchestrator.retry.RetryPolicy;
import com.imaginarium.orchestrator.store.ExecutionStore;
import com.imaginarium.orchestrator.store.StoreRetryTemplate;
import com.imaginarium.orchestrator.store.TaskTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Turns the outcome of one task attempt into a store transition.
 *
 * Failures are routed through the {@link RetryPolicy}: a transient failure
 * within budget becomes RETRY, anything else FAILED. Outcomes are held and
 * re-submitted while the store is unavailable; they are only dropped when the
 * calling thread is interrupted (shutdown), in which case stalled-task
 * recovery picks the task up again.
 */
@Component
public class TaskOutcomeRecorder {

    private static final Logger log = LoggerFactory.getLogger(TaskOutcomeRecorder.class);

    private final ExecutionStore     store;
    private final StoreRetryTemplate retryTemplate;
    private final RetryPolicy        retryPolicy;
    private final Clock              clock;

    public TaskOutcomeRecorder(ExecutionStore store,
                               StoreRetryTemplate retryTemplate,
                               RetryPolicy retryPolicy,
                               Clock clock) {
        this.store         = store;
        this.retryTemplate = retryTemplate;
        this.retryPolicy   = retryPolicy;
        this.clock         = clock;
    }

    public boolean succeeded(TaskExecution task, NodeResult result) {
        return apply(task, TaskTransition.succeeded(task.getAttempt(), result.outputs(),
                result.cost(), result.tokensUsed()));
    }

    public boolean failed(TaskExecution task, ErrorClassification classification, String code, String message) {
        RetryDecision decision = retryPolicy.decide(task.getAttempt(), task.getMaxRetries(), classification);
        if (decision instanceof RetryDecision.RetryAfter retry) {
            log.warn("Task {} ({}) attempt {} failed [{}]: {}; retrying in {} ms",
                    task.getId(), task.getNodeId(), task.getAttempt(), code, message, retry.delay().toMillis());
            return apply(task, TaskTransition.retry(task.getAttempt(), code, message,
                    clock.instant().plus(retry.delay())));
        }
        String reason = ((RetryDecision.GiveUp) decision).reason();
        log.error("Task {} ({}) failed [{}]: {} ({})", task.getId(), task.getNodeId(), code, message, reason);
        return apply(task, TaskTransition.failed(task.getAttempt(), code, message));
    }

    public boolean discarded(TaskExecution task) {
        log.info("Discarding result of task {} ({}): run {} was cancelled or has finished",
                task.getId(), task.getNodeId(), task.getRunId());
        return apply(task, TaskTransition.discard(task.getAttempt()));
    }

    private boolean apply(TaskExecution task, TaskTransition transition) {
        boolean applied = retryTemplate.executeUntilAvailable(
                "record " + transition.kind() + " for task " + task.getId(),
                () -> store.updateTaskStatus(task.getId(), transition),
                () -> !Thread.currentThread().isInterrupted());
        if (!applied) {
            log.debug("{} for task {} attempt {} was stale and ignored",
                    transition.kind(), task.getId(), transition.attempt());
        }
        return applied;
    }
}
