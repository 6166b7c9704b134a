package io.toolhub.server.connection;

import java.time.Duration;
import java.util.Objects;

/// Exponential reconnect delay: `baseDelay * 2^attempt`, capped at `maxDelay`.
///
/// @param baseDelay delay before the first retry, positive
/// @param maxDelay upper bound on any delay, not shorter than `baseDelay`
public record BackoffPolicy(Duration baseDelay, Duration maxDelay) {

    private static final int MAX_SHIFT = 30;

    public BackoffPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than baseDelay");
        }
    }

    /// Returns the delay before retry number `attempt` (zero-based).
    ///
    /// @param attempt failed attempts before this one, not negative
    /// @return the delay, never longer than `maxDelay`
    public Duration delayFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative: " + attempt);
        }
        long factor = 1L << Math.min(attempt, MAX_SHIFT);
        if (baseDelay.compareTo(maxDelay.dividedBy(factor)) > 0) {
            return maxDelay;
        }
        Duration delay = baseDelay.multipliedBy(factor);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
