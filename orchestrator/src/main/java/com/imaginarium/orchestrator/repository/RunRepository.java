package com.imaginarium.orchestrator.repository;

import com.imaginarium.orchestrator.model.Run;
import com.imaginarium.orchestrator.model.RunStatus;
import com.imaginarium.orchestrator.model.TaskStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + dispatch queries for the pipeline_runs table.
 */
public interface RunRepository extends JpaRepository<Run, UUID> {

    /**
     * Lock a run row for the rest of the transaction (SELECT ... FOR UPDATE).
     *
     * Every transition of a run or its tasks takes this lock first, so
     * transitions of one run are serialized. Waiting is bounded; a timeout
     * surfaces as a PessimisticLockingFailureException and is retried by
     * the caller.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT r FROM Run r WHERE r.id = :id")
    Optional<Run> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Runs that have something to start right now, in dispatch order.
     * Uses idx_runs_dispatch (status, priority, queued_at).
     */
    @Query("""
            SELECT r FROM Run r
            WHERE r.status IN :active
              AND r.cancelRequested = false
              AND EXISTS (
                  SELECT 1 FROM TaskExecution t
                  WHERE t.runId = r.id
                    AND (t.status = :ready
                         OR (t.status = :retrying AND t.nextAttemptAt <= :now)))
            ORDER BY r.priority DESC, r.queuedAt ASC, r.queueSequence ASC
            """)
    List<Run> findEligible(@Param("active")   Collection<RunStatus> active,
                           @Param("ready")    TaskStatus ready,
                           @Param("retrying") TaskStatus retrying,
                           @Param("now")      Instant now,
                           Pageable page);

    /** Active runs past their deadline. Uses idx_runs_timeout (status, timeout_at). */
    List<Run> findByStatusInAndTimeoutAtLessThanEqual(Collection<RunStatus> active, Instant now);

    /** Submission order across all orchestrator instances. */
    @Query(value = "SELECT nextval('run_queue_seq')", nativeQuery = true)
    long nextQueueSequence();
}
