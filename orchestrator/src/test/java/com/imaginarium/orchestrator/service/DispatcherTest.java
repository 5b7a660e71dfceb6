package com.imaginarium.orchestrator.service;

import com.imaginarium.orchestrator.config.OrchestratorProperties;
import com.imaginarium.orchestrator.model.Run;
import com.imaginarium.orchestrator.model.TaskExecution;
import com.imaginarium.orchestrator.node.ErrorClassification;
import com.imaginarium.orchestrator.node.NodeExecutionContext;
import com.imaginarium.orchestrator.store.ExecutionStore;
import com.imaginarium.orchestrator.store.StoreRetryTemplate;
import com.imaginarium.orchestrator.support.MutableClock;
import com.imaginarium.orchestrator.support.Pipelines;
import com.imaginarium.orchestrator.support.ScriptedNode;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DispatcherTest {

    // ------------------------------------------------------------------
    // Admission order, against the in-memory store
    // ------------------------------------------------------------------

    @Test
    void singleSlot_startsRunsByPriorityThenSubmissionOrder() {
        ScriptedNode source = ScriptedNode.echo(Pipelines.SOURCE);
        try (OrchestratorFixture f = OrchestratorFixture.sameThread(1, source)) {
            List<UUID> submitted = new ArrayList<>();
            for (int priority : new int[] {10, 5, 10, 1, 5}) {
                submitted.add(f.runService.submit("p", "u", priority, 0, null,
                        Pipelines.pipeline().node("only", "source").build()).getId());
            }

            for (int i = 0; i < 5; i++) {
                assertThat(f.dispatcher.dispatchOnce()).isEqualTo(1);
            }
            assertThat(f.dispatcher.dispatchOnce()).isZero();

            assertThat(source.calls()).extracting(NodeExecutionContext::runId).containsExactly(
                    submitted.get(0), submitted.get(2), submitted.get(1), submitted.get(4), submitted.get(3));
        }
    }

    @Test
    void freeSlots_areFilledFromTheNextRunWhenTheBestRunRunsDry() {
        ScriptedNode source = ScriptedNode.echo(Pipelines.SOURCE);
        try (OrchestratorFixture f = OrchestratorFixture.sameThread(3, source)) {
            UUID high = f.runService.submit("p", "u", 10, 0, null,
                    Pipelines.pipeline().node("a", "source").build()).getId();
            UUID low = f.runService.submit("p", "u", 1, 0, null,
                    Pipelines.pipeline().node("b", "source").node("c", "source").build()).getId();

            int admitted = f.dispatcher.dispatchOnce();

            assertThat(admitted).isEqualTo(3);
            assertThat(source.calls()).extracting(NodeExecutionContext::runId).containsExactly(high, low, low);
        }
    }

    // ------------------------------------------------------------------
    // Store outages and stall recovery, against mocks
    // ------------------------------------------------------------------

    @Nested
    @ExtendWith(MockitoExtension.class)
    class WithMocks {

        @Mock ExecutionStore      store;
        @Mock TaskExecutorPool    pool;
        @Mock TaskOutcomeRecorder recorder;

        final MutableClock           clock  = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        final OrchestratorProperties props  = new OrchestratorProperties();
        final StoreHealthIndicator   health = new StoreHealthIndicator(clock);

        Dispatcher dispatcher() {
            return new Dispatcher(store, pool, recorder, new StoreRetryTemplate(2, Duration.ofMillis(1)),
                    health, props, clock);
        }

        @Test
        void storeOutage_suspendsAdmissionAndReportsDegraded() {
            when(pool.freeCapacity()).thenReturn(2);
            when(store.listEligibleRuns(anyInt()))
                    .thenThrow(new DataAccessResourceFailureException("connection refused"))
                    .thenReturn(List.of());
            Dispatcher dispatcher = dispatcher();

            assertThat(dispatcher.dispatchOnce()).isZero();
            assertThat(health.health().getStatus()).isEqualTo(StoreHealthIndicator.DEGRADED);
            assertThat(health.health().getDetails()).containsKey("reason");
            verify(pool, never()).submit(any());

            dispatcher.dispatchOnce();

            assertThat(health.health().getStatus()).isEqualTo(Status.UP);
        }

        @Test
        void fullPool_doesNotTouchTheStore() {
            when(pool.freeCapacity()).thenReturn(0);

            assertThat(dispatcher().dispatchOnce()).isZero();
            verify(store, never()).listEligibleRuns(anyInt());
        }

        @Test
        void stalledTasks_areRetriedUnlessStillInFlightHere() {
            TaskExecution ours   = new TaskExecution(UUID.randomUUID(), "ours", "step", 0);
            TaskExecution orphan = new TaskExecution(UUID.randomUUID(), "orphan", "step", 1);
            when(store.findStalledTasks(clock.instant().minus(props.getStallTimeout())))
                    .thenReturn(List.of(ours, orphan));
            when(pool.isInFlight(ours.getId())).thenReturn(true);
            when(pool.isInFlight(orphan.getId())).thenReturn(false);
            when(recorder.failed(eq(orphan), eq(ErrorClassification.TRANSIENT), eq("STALLED"), anyString()))
                    .thenReturn(true);

            int recovered = dispatcher().recoverStalledTasks();

            assertThat(recovered).isEqualTo(1);
            verify(recorder, never()).failed(eq(ours), any(), any(), any());
        }

        @Test
        void recoveryTick_failsOverdueRunsAndRecoversTasks() {
            Run overdue = new Run("p1", "u1", 0);
            Run raced   = new Run("p1", "u1", 0);
            when(store.findTimedOutRuns(clock.instant())).thenReturn(List.of(overdue, raced));
            when(store.timeOutRun(overdue.getId())).thenReturn(true);
            when(store.timeOutRun(raced.getId())).thenReturn(false);    // finished meanwhile
            when(store.findStalledTasks(any())).thenReturn(List.of());
            Dispatcher dispatcher = dispatcher();

            assertThat(dispatcher.failTimedOutRuns()).isEqualTo(1);

            dispatcher.recoveryTick();

            verify(store, times(2)).timeOutRun(overdue.getId());
            verify(store).findStalledTasks(any());
        }

        @Test
        void recoveryTick_storeOutage_isSkippedUntilNextCycle() {
            when(store.findTimedOutRuns(any()))
                    .thenThrow(new DataAccessResourceFailureException("connection refused"));

            dispatcher().recoveryTick();

            verify(store, never()).timeOutRun(any());
            verify(store, never()).findStalledTasks(any());
        }
    }
}
