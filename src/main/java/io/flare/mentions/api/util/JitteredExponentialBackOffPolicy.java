package io.flare.mentions.api.util;

import io.flare.mentions.config.BackoffConfig;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with symmetric jitter: attempt {@code n} waits
 * {@code initial * multiplier^n}, scaled by a random factor in {@code [1 - jitter, 1 + jitter]},
 * and never longer than {@code maxInterval}.
 */
public class JitteredExponentialBackOffPolicy implements BackOffPolicy {

    private final long initialIntervalMs;
    private final long maxIntervalMs;
    private final double multiplier;
    private final double jitter;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public JitteredExponentialBackOffPolicy(long initialIntervalMs, long maxIntervalMs, double multiplier,
                                            double jitter, Sleeper sleeper, DoubleSupplier random) {
        if (initialIntervalMs <= 0 || maxIntervalMs < initialIntervalMs) {
            throw new IllegalArgumentException("Backoff intervals must satisfy 0 < initial <= max");
        }
        if (multiplier < 1.0 || jitter < 0.0 || jitter >= 1.0) {
            throw new IllegalArgumentException("Backoff requires multiplier >= 1 and 0 <= jitter < 1");
        }
        this.initialIntervalMs = initialIntervalMs;
        this.maxIntervalMs = maxIntervalMs;
        this.multiplier = multiplier;
        this.jitter = jitter;
        this.sleeper = sleeper;
        this.random = random;
    }

    public static JitteredExponentialBackOffPolicy from(BackoffConfig config) {
        return new JitteredExponentialBackOffPolicy(
                config.initialInterval().toMillis(),
                config.maxInterval().toMillis(),
                config.multiplier(),
                config.jitter(),
                new ThreadWaitSleeper(),
                () -> ThreadLocalRandom.current().nextDouble()
        );
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new AttemptContext();
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        AttemptContext context = (AttemptContext) backOffContext;
        long delay = delayForAttempt(context.attempt++);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Thread interrupted while backing off", e);
        }
    }

    public long delayForAttempt(int attempt) {
        double base = Math.min(initialIntervalMs * Math.pow(multiplier, attempt), maxIntervalMs);
        double factor = 1.0 + (random.getAsDouble() * 2.0 - 1.0) * jitter;
        return Math.min(Math.round(base * factor), maxIntervalMs);
    }

    private static final class AttemptContext implements BackOffContext {
        private int attempt;
    }
}
