package com.imaginarium.orchestrator.service;

import com.imaginarium.orchestrator.config.OrchestratorProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker threads; at most {@code max-concurrent-tasks} node
 * executions are in flight in this process.
 *
 * The in-flight set is the pool's own bookkeeping only; the store stays the
 * authority on what is RUNNING.
 */
@Component
public class TaskExecutorPool {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutorPool.class);

    private final TaskWorker worker;
    private final Executor   workers;
    private final int        capacity;
    private final Set<UUID>  inFlight = ConcurrentHashMap.newKeySet();

    @Autowired
    public TaskExecutorPool(TaskWorker worker, OrchestratorProperties props) {
        this(worker, props.getMaxConcurrentTasks(), newWorkerThreads(props.getMaxConcurrentTasks()));
    }

    TaskExecutorPool(TaskWorker worker, int capacity, Executor workers) {
        if (capacity < 1) {
            throw new IllegalArgumentException("max-concurrent-tasks must be >= 1");
        }
        this.worker   = worker;
        this.capacity = capacity;
        this.workers  = workers;
    }

    public int freeCapacity() {
        return Math.max(0, capacity - inFlight.size());
    }

    public boolean isInFlight(UUID taskId) {
        return inFlight.contains(taskId);
    }

    /**
     * Admit a task. Returns false when the pool is full or the task is
     * already in flight here.
     */
    public boolean submit(UUID taskId) {
        if (inFlight.size() >= capacity || !inFlight.add(taskId)) {
            return false;
        }
        try {
            workers.execute(() -> {
                try {
                    worker.run(taskId);
                } catch (RuntimeException e) {
                    // The task stays RUNNING in the store; stall recovery will pick it up.
                    log.error("Unhandled error running task {}: {}", taskId, e.getMessage(), e);
                } finally {
                    inFlight.remove(taskId);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(taskId);
            log.warn("Worker pool rejected task {}: {}", taskId, e.getMessage());
            return false;
        }
    }

    @PreDestroy
    void shutdown() throws InterruptedException {
        if (workers instanceof ExecutorService es) {
            es.shutdownNow();
            if (!es.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate; {} task(s) left for recovery", inFlight.size());
            }
        }
    }

    private static ExecutorService newWorkerThreads(int n) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, n), r -> new Thread(r, "task-worker-" + seq.incrementAndGet()));
    }
}
