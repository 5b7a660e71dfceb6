package com.imaginarium.orchestrator.service;

import com.imaginarium.orchestrator.config.OrchestratorProperties;
import com.imaginarium.orchestrator.model.TaskExecution;
import com.imaginarium.orchestrator.node.CancellationToken;
import com.imaginarium.orchestrator.node.ErrorClassification;
import com.imaginarium.orchestrator.node.NodeExecutionContext;
import com.imaginarium.orchestrator.node.NodeExecutionException;
import com.imaginarium.orchestrator.node.NodeExecutorRegistry;
import com.imaginarium.orchestrator.node.NodeResult;
import com.imaginarium.orchestrator.store.ClaimedTask;
import com.imaginarium.orchestrator.store.ExecutionStore;
import com.imaginarium.orchestrator.store.StoreRetryTemplate;
import com.imaginarium.orchestrator.store.StoreUnavailableException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes one task attempt end to end.
 *
 * For a given task id, this class:
 *   1. Claims it (READY → RUNNING); a lost claim ends here
 *   2. Invokes the node executor on a separate call thread
 *   3. Waits for the call, heartbeating every heartbeat-interval,
 *      until the node type's timeout elapses
 *   4. Drops the result if the run was cancelled or timed out meanwhile
 *   5. Hands the outcome to {@link TaskOutcomeRecorder}
 *
 * Runs on a worker thread of {@link TaskExecutorPool}.
 */
@Component
public class TaskWorker {

    private static final Logger log = LoggerFactory.getLogger(TaskWorker.class);

    private final ExecutionStore         store;
    private final NodeExecutorRegistry   registry;
    private final TaskOutcomeRecorder    recorder;
    private final StoreRetryTemplate     retryTemplate;
    private final OrchestratorProperties props;
    private final String                 workerId;

    private final AtomicInteger      callThreads = new AtomicInteger();
    // Two call threads per worker slot: a node that ignores interrupts after a
    // timeout can hold a thread only until the pool is full; later calls queue.
    private final ThreadPoolExecutor calls;

    public TaskWorker(ExecutionStore store,
                      NodeExecutorRegistry registry,
                      TaskOutcomeRecorder recorder,
                      StoreRetryTemplate retryTemplate,
                      OrchestratorProperties props) {
        this.store         = store;
        this.registry      = registry;
        this.recorder      = recorder;
        this.retryTemplate = retryTemplate;
        this.props         = props;
        this.workerId      = "worker-" + UUID.randomUUID().toString().substring(0, 8);

        int callLimit = Math.max(2, props.getMaxConcurrentTasks() * 2);
        this.calls = new ThreadPoolExecutor(callLimit, callLimit, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), r -> {
                    Thread t = new Thread(r, "node-call-" + callThreads.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    // ------------------------------------------------------------------
    // Called by TaskExecutorPool for each admitted task
    // ------------------------------------------------------------------

    public void run(UUID taskId) {
        Optional<ClaimedTask> claimed = retryTemplate.execute("claim task " + taskId,
                () -> store.claimTask(taskId, workerId));
        if (claimed.isEmpty()) {
            log.debug("Task {} was not claimable, skipping", taskId);
            return;
        }

        TaskExecution task = claimed.get().task();
        MDC.put("runId",    task.getRunId().toString());
        MDC.put("taskId",   task.getId().toString());
        MDC.put("nodeType", task.getNodeType());
        MDC.put("attempt",  String.valueOf(task.getAttempt()));
        try {
            log.info("Running task '{}' ({}) attempt {}", task.getNodeId(), task.getNodeType(), task.getAttempt());
            execute(task, claimed.get().inputs());
        } finally {
            // Worker threads are pooled; context must not leak to the next task.
            MDC.clear();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void execute(TaskExecution task, Map<String, Object> inputs) {
        CancellationToken cancellation = new CancellationToken();
        NodeExecutionContext ctx = new NodeExecutionContext(
                task.getRunId(), task.getId(), task.getNodeId(), task.getAttempt(), cancellation);

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<NodeResult> call = calls.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return registry.execute(task.getNodeType(), task.getConfig(), inputs, ctx);
            } finally {
                MDC.clear();
            }
        });

        Duration timeout = task.getTimeoutMs() > 0
                ? Duration.ofMillis(task.getTimeoutMs())
                : props.getDefaultTaskTimeout();
        long heartbeatNanos = Math.max(1, props.getHeartbeatInterval().toNanos());
        long deadline = System.nanoTime() + timeout.toNanos();

        NodeResult result = null;
        NodeExecutionException failure = null;
        while (result == null && failure == null) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                cancellation.cancel();
                call.cancel(true);
                ErrorClassification classification = task.isRetryable()
                        ? ErrorClassification.TRANSIENT
                        : ErrorClassification.PERMANENT;
                failure = new NodeExecutionException(classification, "TIMEOUT",
                        "Node did not finish within " + timeout.toMillis() + " ms");
                break;
            }
            try {
                result = call.get(Math.min(remaining, heartbeatNanos), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                if (!beat(task, cancellation)) {
                    // Someone else owns this task now (recovered as stalled).
                    cancellation.cancel();
                    call.cancel(true);
                    log.warn("Task {} attempt {} no longer owned by this worker, abandoning",
                            task.getId(), task.getAttempt());
                    return;
                }
            } catch (ExecutionException e) {
                failure = e.getCause() instanceof NodeExecutionException nee
                        ? nee
                        : new NodeExecutionException(ErrorClassification.PERMANENT, "EXECUTOR_ERROR",
                                String.valueOf(e.getCause()), e.getCause());
            } catch (InterruptedException e) {
                // Pool shutdown: leave the task RUNNING, stall recovery will retry it.
                cancellation.cancel();
                call.cancel(true);
                Thread.currentThread().interrupt();
                log.warn("Interrupted while running task {}, leaving it for recovery", task.getId());
                return;
            }
        }

        if (isRunAbandoned(task.getRunId())) {
            recorder.discarded(task);
            return;
        }
        if (failure == null) {
            log.info("Task '{}' succeeded", task.getNodeId());
            recorder.succeeded(task, result);
        } else {
            recorder.failed(task, failure.getClassification(), failure.getCode(), failure.getMessage());
        }
    }

    /**
     * Heartbeats and propagates a cancel request to the running node.
     *
     * @return false when the store says the attempt is no longer ours
     */
    private boolean beat(TaskExecution task, CancellationToken cancellation) {
        try {
            boolean owned = retryTemplate.execute("heartbeat task " + task.getId(),
                    () -> store.heartbeat(task.getId(), task.getAttempt()));
            if (owned && !cancellation.isCancelled() && isRunAbandoned(task.getRunId())) {
                log.info("Run {} cancelled or finished, signalling task {}", task.getRunId(), task.getId());
                cancellation.cancel();
            }
            return owned;
        } catch (StoreUnavailableException e) {
            // Keep the node running; the outcome is buffered until the store is back.
            log.warn("Heartbeat for task {} failed: {}", task.getId(), e.getMessage());
            return true;
        }
    }

    // Cancel requested, or the run ended without this task (deadline passed).
    private boolean isRunAbandoned(UUID runId) {
        try {
            return retryTemplate.execute("load run " + runId, () -> store.loadRun(runId))
                    .map(run -> run.isCancelRequested() || run.getStatus().isTerminal())
                    .orElse(true);
        } catch (StoreUnavailableException e) {
            // The store discards results for cancelled runs on its own.
            log.warn("Could not check cancellation of run {}: {}", runId, e.getMessage());
            return false;
        }
    }

    String workerId() {
        return workerId;
    }

    /** Node-call threads currently alive, including ones stuck past their timeout. */
    int callThreadCount() {
        return calls.getPoolSize();
    }

    int callThreadLimit() {
        return calls.getMaximumPoolSize();
    }

    @PreDestroy
    void shutdown() {
        calls.shutdownNow();
    }
}
