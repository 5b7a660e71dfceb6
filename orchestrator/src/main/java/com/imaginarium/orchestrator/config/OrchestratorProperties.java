package com.imaginarium.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tuning knobs under the {@code orchestrator.*} prefix.
 *
 * <pre>
 * orchestrator:
 *   max-concurrent-tasks: 4
 *   store:
 *     type: jpa            # or in-memory
 *   retry:
 *     max-retries: 3
 * </pre>
 */
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

    /** Upper bound on node executions in flight in this process. */
    private int maxConcurrentTasks = 4;

    /** How many eligible runs one dispatch cycle looks at. */
    private int eligibleRunScanLimit = 20;

    private long dispatchIntervalMs = 500;

    private long recoveryIntervalMs = 60_000;

    /** Per-attempt limit for node types that do not declare their own. */
    private Duration defaultTaskTimeout = Duration.ofSeconds(120);

    private Duration heartbeatInterval = Duration.ofSeconds(10);

    /** A RUNNING task without a heartbeat for this long is considered abandoned. */
    private Duration stallTimeout = Duration.ofMinutes(5);

    /** How long an out-of-order run event waits for its predecessor before being released anyway. */
    private Duration eventGapTimeout = Duration.ofSeconds(1);

    private final Store store = new Store();
    private final Retry retry = new Retry();

    public static class Store {

        /** {@code jpa} or {@code in-memory}. */
        private String type = "jpa";

        private int conflictRetries = 5;

        private Duration backoffBase = Duration.ofMillis(50);

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public int getConflictRetries() { return conflictRetries; }
        public void setConflictRetries(int conflictRetries) { this.conflictRetries = conflictRetries; }

        public Duration getBackoffBase() { return backoffBase; }
        public void setBackoffBase(Duration backoffBase) { this.backoffBase = backoffBase; }
    }

    public static class Retry {

        private int maxRetries = 3;

        private Duration baseDelay = Duration.ofSeconds(1);

        private Duration maxDelay = Duration.ofSeconds(60);

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public Duration getBaseDelay() { return baseDelay; }
        public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }

        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
    }

    public int getMaxConcurrentTasks() { return maxConcurrentTasks; }
    public void setMaxConcurrentTasks(int maxConcurrentTasks) { this.maxConcurrentTasks = maxConcurrentTasks; }

    public int getEligibleRunScanLimit() { return eligibleRunScanLimit; }
    public void setEligibleRunScanLimit(int eligibleRunScanLimit) { this.eligibleRunScanLimit = eligibleRunScanLimit; }

    public long getDispatchIntervalMs() { return dispatchIntervalMs; }
    public void setDispatchIntervalMs(long dispatchIntervalMs) { this.dispatchIntervalMs = dispatchIntervalMs; }

    public long getRecoveryIntervalMs() { return recoveryIntervalMs; }
    public void setRecoveryIntervalMs(long recoveryIntervalMs) { this.recoveryIntervalMs = recoveryIntervalMs; }

    public Duration getDefaultTaskTimeout() { return defaultTaskTimeout; }
    public void setDefaultTaskTimeout(Duration defaultTaskTimeout) { this.defaultTaskTimeout = defaultTaskTimeout; }

    public Duration getHeartbeatInterval() { return heartbeatInterval; }
    public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }

    public Duration getStallTimeout() { return stallTimeout; }
    public void setStallTimeout(Duration stallTimeout) { this.stallTimeout = stallTimeout; }

    public Duration getEventGapTimeout() { return eventGapTimeout; }
    public void setEventGapTimeout(Duration eventGapTimeout) { this.eventGapTimeout = eventGapTimeout; }

    public Store getStore() { return store; }
    public Retry getRetry() { return retry; }
}
