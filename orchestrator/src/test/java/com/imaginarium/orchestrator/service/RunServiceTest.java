package com.imaginarium.orchestrator.service;

import com.imaginarium.orchestrator.graph.ExecutionPlan;
import com.imaginarium.orchestrator.graph.InputBinding;
import com.imaginarium.orchestrator.graph.TaskGraphCompiler;
import com.imaginarium.orchestrator.graph.TaskSpec;
import com.imaginarium.orchestrator.graph.ValidationError;
import com.imaginarium.orchestrator.model.Run;
import com.imaginarium.orchestrator.model.RunStatus;
import com.imaginarium.orchestrator.model.TaskExecution;
import com.imaginarium.orchestrator.model.TaskStatus;
import com.imaginarium.orchestrator.retry.RetryPolicy;
import com.imaginarium.orchestrator.store.ExecutionStore;
import com.imaginarium.orchestrator.store.RunNotFoundException;
import com.imaginarium.orchestrator.store.RunRequest;
import com.imaginarium.orchestrator.store.StoreRetryTemplate;
import com.imaginarium.orchestrator.support.Pipelines;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for RunService.
 *
 * The store is mocked; the compiler is real, over the test node catalog.
 */
@ExtendWith(MockitoExtension.class)
class RunServiceTest {

    @Mock ExecutionStore store;

    RunService service;

    @BeforeEach
    void setUp() {
        service = new RunService(
                new TaskGraphCompiler(Pipelines.CATALOG, Duration.ofSeconds(30)),
                store,
                new StoreRetryTemplate(2, Duration.ofMillis(1)),
                new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(60)));
    }

    // ------------------------------------------------------------------
    // submit()
    // ------------------------------------------------------------------

    @Test
    void submit_validPipeline_createsRunWithDefaultRetryBudget() {
        Run created = new Run("p1", "u1", 7);
        when(store.createRun(any(), any())).thenReturn(created);

        Run result = service.submit("p1", "u1", 7, null, null,
                Pipelines.pipeline().node("a", "source").node("b", "step").edge("a", "b").build());

        ArgumentCaptor<ExecutionPlan> plan    = ArgumentCaptor.forClass(ExecutionPlan.class);
        ArgumentCaptor<RunRequest>    request = ArgumentCaptor.forClass(RunRequest.class);
        verify(store).createRun(plan.capture(), request.capture());
        assertThat(plan.getValue().tasks()).extracting(TaskSpec::nodeId).containsExactly("a", "b");
        assertThat(request.getValue()).isEqualTo(new RunRequest("p1", "u1", 7, 3, null, null));
        assertThat(result).isSameAs(created);
    }

    @Test
    void submit_explicitRetryBudget_isUsed() {
        when(store.createRun(any(), any())).thenReturn(new Run("p1", "u1", 0));

        service.submit("p1", "u1", 0, 0, null, Pipelines.pipeline().node("a", "source").build());

        ArgumentCaptor<RunRequest> request = ArgumentCaptor.forClass(RunRequest.class);
        verify(store).createRun(any(), request.capture());
        assertThat(request.getValue().maxRetries()).isZero();
    }

    @Test
    void submit_timeout_onlyPositiveValuesAreKept() {
        when(store.createRun(any(), any())).thenReturn(new Run("p1", "u1", 0));

        service.submit("p1", "u1", 0, null, Duration.ofMinutes(2), Pipelines.pipeline().node("a", "source").build());
        service.submit("p1", "u1", 0, null, Duration.ZERO, Pipelines.pipeline().node("a", "source").build());

        ArgumentCaptor<RunRequest> request = ArgumentCaptor.forClass(RunRequest.class);
        verify(store, times(2)).createRun(any(), request.capture());
        assertThat(request.getAllValues()).extracting(RunRequest::timeout)
                .containsExactly(Duration.ofMinutes(2), null);
    }

    @Test
    void submit_invalidPipeline_throwsAndPersistsNothing() {
        assertThatThrownBy(() -> service.submit("p1", "u1", 0, null, null,
                Pipelines.pipeline().node("a", "step").node("b", "step")
                        .edge("a", "b").edge("b", "a").build()))
                .isInstanceOf(PipelineValidationException.class)
                .satisfies(e -> assertThat(((PipelineValidationException) e).getError().kind())
                        .isEqualTo(ValidationError.Kind.CYCLIC_GRAPH));

        verify(store, never()).createRun(any(), any());
    }

    // ------------------------------------------------------------------
    // retry()
    // ------------------------------------------------------------------

    @Test
    void retry_failedRun_resubmitsSameTasksLinkedToParent() {
        Run original = new Run("p1", "u1", 4);
        original.setStatus(RunStatus.FAILED);
        TaskExecution a = task(original, "a", 0);
        TaskExecution b = task(original, "b", 1);
        b.setDependsOn(new ArrayList<>(List.of("a")));
        b.setInputBindings(new ArrayList<>(List.of(new InputBinding("a", "out", "a"))));
        b.setStatus(TaskStatus.FAILED);
        when(store.loadRun(original.getId())).thenReturn(Optional.of(original));
        when(store.listTasks(original.getId())).thenReturn(List.of(b, a));
        when(store.createRun(any(), any())).thenReturn(new Run("p1", "u1", 4));

        service.retry(original.getId());

        ArgumentCaptor<ExecutionPlan> plan    = ArgumentCaptor.forClass(ExecutionPlan.class);
        ArgumentCaptor<RunRequest>    request = ArgumentCaptor.forClass(RunRequest.class);
        verify(store).createRun(plan.capture(), request.capture());
        assertThat(plan.getValue().tasks()).extracting(TaskSpec::nodeId).containsExactly("a", "b");
        assertThat(plan.getValue().task("b").orElseThrow().dependsOn()).containsExactly("a");
        assertThat(request.getValue().parentRunId()).isEqualTo(original.getId());
        assertThat(request.getValue().priority()).isEqualTo(4);
        assertThat(request.getValue().maxRetries()).isEqualTo(2);
        assertThat(request.getValue().timeout()).isNull();
    }

    @Test
    void retry_timedRun_keepsTheSameTimeout() {
        Run original = new Run("p1", "u1", 0);
        original.setQueuedAt(Instant.parse("2026-01-01T00:00:00Z"));
        original.setTimeoutAt(Instant.parse("2026-01-01T00:10:00Z"));
        original.setStatus(RunStatus.FAILED);
        when(store.loadRun(original.getId())).thenReturn(Optional.of(original));
        when(store.listTasks(original.getId())).thenReturn(List.of(task(original, "a", 0)));
        when(store.createRun(any(), any())).thenReturn(new Run("p1", "u1", 0));

        service.retry(original.getId());

        ArgumentCaptor<RunRequest> request = ArgumentCaptor.forClass(RunRequest.class);
        verify(store).createRun(any(), request.capture());
        assertThat(request.getValue().timeout()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void retry_runningRun_isRejected() {
        Run running = new Run("p1", "u1", 0);
        running.setStatus(RunStatus.RUNNING);
        when(store.loadRun(running.getId())).thenReturn(Optional.of(running));

        assertThatThrownBy(() -> service.retry(running.getId()))
                .isInstanceOf(RunNotRetryableException.class)
                .hasMessageContaining("RUNNING");
        verify(store, never()).createRun(any(), any());
    }

    @Test
    void retry_unknownRun_throwsNotFound() {
        UUID unknown = UUID.randomUUID();
        when(store.loadRun(unknown)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.retry(unknown)).isInstanceOf(RunNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Test
    void taskCounts_coversEveryStatus() {
        Run run = new Run("p1", "u1", 0);
        TaskExecution done = task(run, "a", 0);
        done.setStatus(TaskStatus.SUCCEEDED);
        when(store.loadRun(run.getId())).thenReturn(Optional.of(run));
        when(store.listTasks(run.getId())).thenReturn(List.of(done, task(run, "b", 1), task(run, "c", 2)));

        Map<TaskStatus, Long> counts = service.taskCounts(run.getId());

        assertThat(counts).hasSize(TaskStatus.values().length)
                .containsEntry(TaskStatus.SUCCEEDED, 1L)
                .containsEntry(TaskStatus.PENDING, 2L)
                .containsEntry(TaskStatus.FAILED, 0L);
    }

    @Test
    void getLogs_clampsPageSize() {
        Run run = new Run("p1", "u1", 0);
        when(store.loadRun(run.getId())).thenReturn(Optional.of(run));
        when(store.listLogs(eq(run.getId()), anyLong(), anyInt())).thenReturn(List.of());

        service.getLogs(run.getId(), -5, 50_000);
        service.getLogs(run.getId(), 10, 0);

        verify(store).listLogs(run.getId(), 0, RunService.MAX_LOG_PAGE);
        verify(store).listLogs(run.getId(), 10, 1);
    }

    @Test
    void cancel_delegatesToStore() {
        UUID id = UUID.randomUUID();
        when(store.cancelRun(id, "why")).thenReturn(true);

        assertThat(service.cancel(id, "why")).isTrue();
    }

    private static TaskExecution task(Run run, String nodeId, int order) {
        TaskExecution t = new TaskExecution(run.getId(), nodeId, order == 0 ? "source" : "step", order);
        t.setMaxRetries(2);
        t.setTimeoutMs(30_000);
        return t;
    }
}
