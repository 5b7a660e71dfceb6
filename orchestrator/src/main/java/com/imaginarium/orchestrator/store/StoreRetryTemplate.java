package com.imaginarium.orchestrator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Duration;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Runs store operations with the orchestrator's failure policy:
 * <ul>
 *   <li>lock and version conflicts are retried with exponential backoff;</li>
 *   <li>connectivity failures surface as {@link StoreUnavailableException}.</li>
 * </ul>
 * Must be called outside any transaction so that each attempt gets a fresh one.
 */
public class StoreRetryTemplate {

    private static final Logger log = LoggerFactory.getLogger(StoreRetryTemplate.class);

    private static final Duration MAX_UNAVAILABLE_BACKOFF = Duration.ofSeconds(30);

    private final int      conflictRetries;
    private final Duration backoffBase;

    public StoreRetryTemplate(int conflictRetries, Duration backoffBase) {
        this.conflictRetries = conflictRetries;
        this.backoffBase     = backoffBase;
    }

    /**
     * @throws ClaimConflictException     conflicts persisted past the retry budget
     * @throws StoreUnavailableException  the store cannot be reached
     */
    public <T> T execute(String operation, Supplier<T> action) {
        int attempt = 0;
        while (true) {
            try {
                return action.get();
            } catch (ClaimConflictException | ConcurrencyFailureException e) {
                attempt++;
                if (attempt > conflictRetries) {
                    throw e instanceof ClaimConflictException cce ? cce
                            : new ClaimConflictException(operation + " kept conflicting after "
                                    + conflictRetries + " retries", e);
                }
                log.debug("{} conflicted (attempt {}), retrying: {}", operation, attempt, e.getMessage());
                sleep(backoff(attempt, Duration.ofSeconds(1)), operation);
            } catch (DataAccessResourceFailureException
                     | TransientDataAccessResourceException
                     | CannotCreateTransactionException e) {
                throw new StoreUnavailableException(operation + " failed: store unavailable", e);
            }
        }
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Like {@link #execute} but keeps retrying while the store is unavailable,
     * with capped backoff, for as long as {@code keepTrying} holds.
     * Used by workers that must not lose an outcome they already computed.
     *
     * @throws StoreUnavailableException when {@code keepTrying} turned false first
     */
    public <T> T executeUntilAvailable(String operation, Supplier<T> action, BooleanSupplier keepTrying) {
        int outage = 0;
        while (true) {
            try {
                return execute(operation, action);
            } catch (StoreUnavailableException e) {
                outage++;
                if (!keepTrying.getAsBoolean()) {
                    throw e;
                }
                Duration wait = backoff(outage, MAX_UNAVAILABLE_BACKOFF);
                log.warn("{}: store unavailable (try {}), retrying in {} ms",
                        operation, outage, wait.toMillis());
                sleep(wait, operation);
            }
        }
    }

    private Duration backoff(int attempt, Duration cap) {
        long base = Math.max(1, backoffBase.toMillis());
        int shift = Math.min(attempt - 1, 20);
        return Duration.ofMillis(Math.min(cap.toMillis(), base << shift));
    }

    private static void sleep(Duration d, String operation) {
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException(operation + " interrupted while backing off", e);
        }
    }
}
