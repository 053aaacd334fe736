package com.dbmaster.pool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;

import java.sql.SQLException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;

/**
 * Exponential backoff with jitter around connect attempts:
 * {@code delay(n) = min(initial * 2^(n-1) + jitter * 1000, max)}.
 */
@Slf4j
public class Retrier {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_INITIAL_DELAY_MS = 1_000L;
    public static final long DEFAULT_MAX_DELAY_MS = 10_000L;

    @FunctionalInterface
    public interface SqlCallable<T> {
        T call() throws SQLException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long initialDelayMs;
    private final long maxDelayMs;
    private final DoubleSupplier jitter;
    private final Sleeper sleeper;

    public Retrier(int maxAttempts, long initialDelayMs, long maxDelayMs, DoubleSupplier jitter, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialDelayMs = Math.max(0L, initialDelayMs);
        this.maxDelayMs = Math.max(0L, maxDelayMs);
        this.jitter = jitter;
        this.sleeper = sleeper;
    }

    public static Retrier defaults() {
        return new Retrier(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY_MS, DEFAULT_MAX_DELAY_MS,
                () -> ThreadLocalRandom.current().nextDouble(), Thread::sleep);
    }

    static Retrier fromEnvironment(Environment environment) {
        return new Retrier(
                environment.getProperty("dbmaster.pool.retry.max-attempts", Integer.class, DEFAULT_MAX_ATTEMPTS),
                environment.getProperty("dbmaster.pool.retry.initial-delay-ms", Long.class, DEFAULT_INITIAL_DELAY_MS),
                environment.getProperty("dbmaster.pool.retry.max-delay-ms", Long.class, DEFAULT_MAX_DELAY_MS),
                () -> ThreadLocalRandom.current().nextDouble(),
                Thread::sleep);
    }

    /**
     * Runs the action, retrying failures accepted by {@code retryable} until attempts run out.
     * The last failure is rethrown unchanged.
     */
    public <T> T call(SqlCallable<T> action, Predicate<SQLException> retryable) throws SQLException {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return action.call();
            } catch (SQLException e) {
                if (attempt >= maxAttempts || !retryable.test(e)) {
                    throw e;
                }
                long delay = delayFor(attempt);
                log.info("Retry {}/{} after {}ms: sql_state={}, error={}", attempt, maxAttempts, delay, e.getSQLState(), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    throw e;
                }
            }
        }
    }

    long delayFor(int attempt) {
        double exponential = initialDelayMs * Math.pow(2, attempt - 1);
        double withJitter = exponential + jitter.getAsDouble() * 1000d;
        return (long) Math.min(withJitter, (double) maxDelayMs);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
