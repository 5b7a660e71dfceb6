package com.imaginarium.orchestrator.store;

import com.imaginarium.orchestrator.event.RunEvent;
import com.imaginarium.orchestrator.event.RunEventType;
import com.imaginarium.orchestrator.graph.ExecutionPlan;
import com.imaginarium.orchestrator.graph.InputBinding;
import com.imaginarium.orchestrator.graph.PipelineDefinition;
import com.imaginarium.orchestrator.graph.TaskGraphCompiler;
import com.imaginarium.orchestrator.model.ExecutionLogEntry;
import com.imaginarium.orchestrator.model.Run;
import com.imaginarium.orchestrator.model.RunStatus;
import com.imaginarium.orchestrator.model.TaskExecution;
import com.imaginarium.orchestrator.model.TaskStatus;
import com.imaginarium.orchestrator.repository.ExecutionLogRepository;
import com.imaginarium.orchestrator.repository.RunRepository;
import com.imaginarium.orchestrator.repository.TaskExecutionRepository;
import com.imaginarium.orchestrator.supervisor.RunSupervisor;
import com.imaginarium.orchestrator.support.Pipelines;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Integration tests for JpaExecutionStore against PostgreSQL, with the
 * Flyway schema. Each store call runs in its own transaction, as in
 * production; nothing is rolled back between tests.
 */
@DataJpaTest
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import(JpaExecutionStoreTest.StoreConfig.class)
class JpaExecutionStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("orchestrator_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @TestConfiguration
    static class StoreConfig {

        @Bean
        Clock clock() {
            return Clock.systemUTC();
        }

        @Bean
        ExecutionStore jpaExecutionStore(RunRepository runRepo, TaskExecutionRepository taskRepo,
                                         ExecutionLogRepository logRepo, ApplicationEventPublisher events,
                                         Clock clock) {
            return new JpaExecutionStore(runRepo, taskRepo, logRepo, new RunSupervisor(clock), events, clock);
        }

        @Bean
        CommittedEvents committedEvents() {
            return new CommittedEvents();
        }
    }

    static class CommittedEvents {
        final List<RunEvent> events = new CopyOnWriteArrayList<>();

        @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
        public void onRunEvent(RunEvent event) {
            events.add(event);
        }

        List<RunEvent> forRun(UUID runId) {
            return events.stream().filter(e -> e.runId().equals(runId)).toList();
        }
    }

    @Autowired ExecutionStore  store;
    @Autowired CommittedEvents committed;

    private final TaskGraphCompiler compiler = new TaskGraphCompiler(Pipelines.CATALOG, Duration.ofSeconds(30));

    @BeforeEach
    void clearEvents() {
        committed.events.clear();
    }

    // ------------------------------------------------------------------
    // Create and read back
    // ------------------------------------------------------------------

    @Test
    void createRun_persistsPlanWithJsonColumns() {
        Run run = create(Pipelines.pipeline()
                .node("a", "source", Map.of("text", "hi", "n", 3))
                .node("b", "step")
                .edge("a", "b").build(), 0, 2);

        Run loaded = store.loadRun(run.getId()).orElseThrow();
        List<TaskExecution> tasks = store.listTasks(run.getId());

        assertThat(loaded.getStatus()).isEqualTo(RunStatus.QUEUED);
        assertThat(loaded.getTotalTasks()).isEqualTo(2);
        assertThat(loaded.getQueueSequence()).isPositive();
        assertThat(tasks).extracting(TaskExecution::getNodeId).containsExactly("a", "b");
        assertThat(tasks.get(0).getStatus()).isEqualTo(TaskStatus.READY);
        assertThat(tasks.get(0).getConfig()).containsEntry("text", "hi").containsEntry("n", 3);
        assertThat(tasks.get(1).getDependsOn()).containsExactly("a");
        assertThat(tasks.get(1).getInputBindings()).containsExactly(new InputBinding("a", "out", "a"));
        assertThat(tasks.get(1).getMaxRetries()).isEqualTo(2);
        assertThat(committed.forRun(run.getId())).extracting(RunEvent::type)
                .containsExactly(RunEventType.RUN_QUEUED);
    }

    // ------------------------------------------------------------------
    // Claim and transitions
    // ------------------------------------------------------------------

    @Test
    void claimAndSucceed_promotesDependentAndFeedsItsInputs() {
        Run run = create(chain(), 0, 0);
        TaskExecution a = task(run, "a");

        ClaimedTask claimedA = store.claimTask(a.getId(), "w1").orElseThrow();
        assertThat(claimedA.task().getAttempt()).isEqualTo(1);
        assertThat(store.heartbeat(a.getId(), 1)).isTrue();
        assertThat(store.heartbeat(a.getId(), 2)).isFalse();

        boolean applied = store.updateTaskStatus(a.getId(),
                TaskTransition.succeeded(1, Map.of("out", "payload"), new BigDecimal("0.5"), 7));
        assertThat(applied).isTrue();
        assertThat(store.updateTaskStatus(a.getId(),
                TaskTransition.succeeded(1, Map.of("out", "again"), BigDecimal.ONE, 1))).isFalse();

        ClaimedTask claimedB = store.claimTask(task(run, "b").getId(), "w2").orElseThrow();
        assertThat(claimedB.inputs()).containsEntry("a", "payload");

        store.updateTaskStatus(claimedB.task().getId(), TaskTransition.succeeded(1, Map.of(), BigDecimal.ZERO, 0));

        Run done = store.loadRun(run.getId()).orElseThrow();
        assertThat(done.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(done.getTotalCost()).isEqualByComparingTo("0.5");
        assertThat(done.getTokensUsed()).isEqualTo(7);
        assertThat(committed.forRun(run.getId())).extracting(RunEvent::sequence).isSorted().doesNotHaveDuplicates();
        assertThat(committed.forRun(run.getId())).extracting(RunEvent::type).endsWith(RunEventType.RUN_COMPLETED);
        assertThat(done.getPipelineOutputs()).containsOnlyKeys("a", "b");
        assertThat(done.getPipelineOutputs().get("a")).isEqualTo(Map.of("out", "payload"));
    }

    @Test
    void runPastItsDeadline_isFoundAndFailed() {
        ExecutionPlan plan = compiler.compile(chain()).plan();
        Run run = store.createRun(plan, new RunRequest("p", "u", 0, 0, Duration.ofMillis(1), null));
        Run patient = store.createRun(plan, new RunRequest("p", "u", 0, 0, Duration.ofHours(1), null));
        assertThat(store.loadRun(run.getId()).orElseThrow().getTimeoutAt()).isNotNull();

        await().atMost(Duration.ofSeconds(5)).until(() -> store.timeOutRun(run.getId()));

        Run failed = store.loadRun(run.getId()).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(failed.getLastError()).contains("timeout");
        assertThat(task(run, "a").getStatus()).isEqualTo(TaskStatus.SKIPPED);
        assertThat(store.findTimedOutRuns(Instant.now())).extracting(Run::getId)
                .doesNotContain(run.getId(), patient.getId());
        assertThat(store.findTimedOutRuns(Instant.now().plus(Duration.ofHours(2)))).extracting(Run::getId)
                .contains(patient.getId());
        assertThat(committed.forRun(run.getId())).extracting(RunEvent::type).endsWith(RunEventType.RUN_FAILED);
    }

    @Test
    void concurrentClaims_exactlyOneWinner() throws Exception {
        Run run = create(Pipelines.pipeline().node("only", "source").build(), 0, 0);
        UUID taskId = task(run, "only").getId();
        StoreRetryTemplate retryTemplate = new StoreRetryTemplate(10, Duration.ofMillis(5));

        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Optional<ClaimedTask>>> results = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                String worker = "w" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    return retryTemplate.execute("claim", () -> store.claimTask(taskId, worker));
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Optional<ClaimedTask>> f : results) {
                if (f.get(30, TimeUnit.SECONDS).isPresent()) winners++;
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        TaskExecution claimed = store.loadTask(taskId).orElseThrow();
        assertThat(claimed.getAttempt()).isEqualTo(1);
        assertThat(claimed.getStatus()).isEqualTo(TaskStatus.RUNNING);
    }

    @Test
    void retryingTask_becomesReadyWhenDue() {
        Run run = create(Pipelines.pipeline().node("only", "source").build(), 0, 3);
        UUID taskId = task(run, "only").getId();
        store.claimTask(taskId, "w1");
        store.updateTaskStatus(taskId, TaskTransition.retry(1, "HTTP_503", "busy",
                Instant.now().minusSeconds(1)));

        assertThat(store.listEligibleRuns(1000)).extracting(Run::getId).contains(run.getId());
        assertThat(store.findReadyTasks(run.getId(), 10)).extracting(TaskExecution::getId).containsExactly(taskId);
        assertThat(store.loadRun(run.getId()).orElseThrow().getRetryCount()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Queue order, cancel, logs
    // ------------------------------------------------------------------

    @Test
    void listEligibleRuns_ordersByPriorityThenSubmission() {
        Run low   = create(Pipelines.pipeline().node("only", "source").build(), 1_000_001, 0);
        Run high1 = create(Pipelines.pipeline().node("only", "source").build(), 1_000_010, 0);
        Run high2 = create(Pipelines.pipeline().node("only", "source").build(), 1_000_010, 0);
        List<UUID> mine = List.of(low.getId(), high1.getId(), high2.getId());

        List<UUID> order = store.listEligibleRuns(1000).stream()
                .map(Run::getId).filter(mine::contains).toList();

        assertThat(order).containsExactly(high1.getId(), high2.getId(), low.getId());
    }

    @Test
    void cancelRun_isIdempotentAndStopsClaims() {
        Run run = create(chain(), 0, 0);

        assertThat(store.cancelRun(run.getId(), "stop")).isTrue();
        assertThat(store.cancelRun(run.getId(), "again")).isFalse();
        assertThat(store.claimTask(task(run, "a").getId(), "w1")).isEmpty();
        assertThat(store.listTasks(run.getId())).extracting(TaskExecution::getStatus)
                .containsOnly(TaskStatus.SKIPPED);
        assertThat(committed.forRun(run.getId())).extracting(RunEvent::type)
                .containsOnlyOnce(RunEventType.RUN_CANCELLED);
    }

    @Test
    void logs_followEventsAndPage() {
        Run run = create(chain(), 0, 0);
        store.claimTask(task(run, "a").getId(), "w1");

        List<ExecutionLogEntry> all = store.listLogs(run.getId(), 0, 100);
        assertThat(all).hasSize(3);
        assertThat(all.get(0).getMessage()).startsWith("RUN_QUEUED");

        List<ExecutionLogEntry> rest = store.listLogs(run.getId(), all.get(0).getSequence(), 100);
        assertThat(rest).extracting(ExecutionLogEntry::getSequence)
                .containsExactly(all.get(1).getSequence(), all.get(2).getSequence());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static PipelineDefinition chain() {
        return Pipelines.pipeline().node("a", "source").node("b", "step").edge("a", "b").build();
    }

    private Run create(PipelineDefinition definition, int priority, int maxRetries) {
        ExecutionPlan plan = compiler.compile(definition).plan();
        return store.createRun(plan, new RunRequest("p", "u", priority, maxRetries, null, null));
    }

    private TaskExecution task(Run run, String nodeId) {
        return store.listTasks(run.getId()).stream()
                .filter(t -> t.getNodeId().equals(nodeId))
                .findFirst().orElseThrow();
    }
}
