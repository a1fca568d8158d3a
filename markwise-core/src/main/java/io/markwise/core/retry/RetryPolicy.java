package io.markwise.core.retry;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

public record RetryPolicy(int maxAttempts, Duration baseDelay, Predicate<Throwable> retryable) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        retryable = retryable == null ? error -> false : retryable;
    }

    public static RetryPolicy completionDefaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), error -> error instanceof IOException);
    }

    public static RetryPolicy of(int maxAttempts, Duration baseDelay, Predicate<Throwable> retryable) {
        return new RetryPolicy(maxAttempts, baseDelay, retryable);
    }

    public Duration backoff(int attempt) {
        return scaled(baseDelay, attempt);
    }

    public boolean isRetryable(Throwable error) {
        return error != null && retryable.test(error);
    }

    public boolean isFinalAttempt(int attempt) {
        return attempt >= maxAttempts - 1;
    }

    public static Duration scaled(Duration base, int attempt) {
        return base.multipliedBy(1L << Math.max(0, Math.min(attempt, 20)));
    }
}
