package com.imaginarium.orchestrator.repository;

import com.imaginarium.orchestrator.model.ExecutionLogEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/** Append-only access to the execution_logs table. */
public interface ExecutionLogRepository extends JpaRepository<ExecutionLogEntry, Long> {

    List<ExecutionLogEntry> findByRunIdAndIdGreaterThanOrderByIdAsc(UUID runId, Long afterId, Pageable page);
}
