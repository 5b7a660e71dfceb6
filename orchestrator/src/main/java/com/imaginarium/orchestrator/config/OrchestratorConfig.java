package com.imaginarium.orchestrator.config;

import com.imaginarium.orchestrator.graph.TaskGraphCompiler;
import com.imaginarium.orchestrator.node.NodeExecutorRegistry;
import com.imaginarium.orchestrator.repository.ExecutionLogRepository;
import com.imaginarium.orchestrator.repository.RunRepository;
import com.imaginarium.orchestrator.repository.TaskExecutionRepository;
import com.imaginarium.orchestrator.retry.RetryPolicy;
import com.imaginarium.orchestrator.store.ExecutionStore;
import com.imaginarium.orchestrator.store.InMemoryExecutionStore;
import com.imaginarium.orchestrator.store.JpaExecutionStore;
import com.imaginarium.orchestrator.store.StoreRetryTemplate;
import com.imaginarium.orchestrator.supervisor.RunSupervisor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the framework-free orchestration core (compiler, supervisor, retry
 * policy, store) from {@link OrchestratorProperties}.
 */
@Configuration
public class OrchestratorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TaskGraphCompiler taskGraphCompiler(NodeExecutorRegistry registry, OrchestratorProperties props) {
        return new TaskGraphCompiler(registry, props.getDefaultTaskTimeout());
    }

    @Bean
    public RunSupervisor runSupervisor(Clock clock) {
        return new RunSupervisor(clock);
    }

    @Bean
    public RetryPolicy retryPolicy(OrchestratorProperties props) {
        OrchestratorProperties.Retry retry = props.getRetry();
        return new RetryPolicy(retry.getMaxRetries(), retry.getBaseDelay(), retry.getMaxDelay());
    }

    @Bean
    public StoreRetryTemplate storeRetryTemplate(OrchestratorProperties props) {
        return new StoreRetryTemplate(props.getStore().getConflictRetries(), props.getStore().getBackoffBase());
    }

    @Bean
    @ConditionalOnProperty(name = "orchestrator.store.type", havingValue = "jpa", matchIfMissing = true)
    public ExecutionStore jpaExecutionStore(RunRepository runRepo,
                                            TaskExecutionRepository taskRepo,
                                            ExecutionLogRepository logRepo,
                                            RunSupervisor supervisor,
                                            ApplicationEventPublisher events,
                                            Clock clock) {
        return new JpaExecutionStore(runRepo, taskRepo, logRepo, supervisor, events, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "orchestrator.store.type", havingValue = "in-memory")
    public ExecutionStore inMemoryExecutionStore(RunSupervisor supervisor,
                                                 ApplicationEventPublisher events,
                                                 Clock clock) {
        return new InMemoryExecutionStore(supervisor, events, clock);
    }
}
