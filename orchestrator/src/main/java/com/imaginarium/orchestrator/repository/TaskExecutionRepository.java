package com.imaginarium.orchestrator.repository;

import com.imaginarium.orchestrator.model.TaskExecution;
import com.imaginarium.orchestrator.model.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + worker queries for the task_executions table.
 */
public interface TaskExecutionRepository extends JpaRepository<TaskExecution, UUID> {

    /** All tasks of a run in plan order. Uses idx_tasks_run_order. */
    List<TaskExecution> findByRunIdOrderByExecutionOrderAsc(UUID runId);

    /**
     * Owning run of a task, without loading the task into the persistence
     * context (callers lock the run before reading any task state).
     */
    @Query("SELECT t.runId FROM TaskExecution t WHERE t.id = :id")
    Optional<UUID> findRunIdById(@Param("id") UUID id);

    /**
     * The claim: compare-and-swap READY → RUNNING.
     *
     * Returns 1 for exactly one caller; every concurrent claimer of the same
     * task sees 0. Clears the persistence context so the caller re-reads the
     * task with its new status.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE TaskExecution t
            SET t.status = :running, t.workerId = :workerId, t.heartbeatAt = :now
            WHERE t.id = :id AND t.status = :ready
            """)
    int compareAndSetRunning(@Param("id")       UUID id,
                             @Param("workerId") String workerId,
                             @Param("now")      Instant now,
                             @Param("ready")    TaskStatus ready,
                             @Param("running")  TaskStatus running);

    /** Liveness signal; only the current attempt of a RUNNING task may beat. */
    @Modifying
    @Query("""
            UPDATE TaskExecution t
            SET t.heartbeatAt = :now
            WHERE t.id = :id AND t.status = :running AND t.attempt = :attempt
            """)
    int heartbeat(@Param("id")      UUID id,
                  @Param("attempt") int attempt,
                  @Param("now")     Instant now,
                  @Param("running") TaskStatus running);

    /**
     * Find RUNNING tasks whose heartbeat is older than 'cutoff'.
     * The dispatcher uses this to recover tasks of crashed workers.
     */
    List<TaskExecution> findByStatusAndHeartbeatAtBefore(TaskStatus status, Instant cutoff);
}
