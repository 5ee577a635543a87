package ai.catalog.translator.translate;

import java.time.Duration;
import java.util.Objects;

/**
 * Attempt budget and exponential backoff settings of the verification loop.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double jitterFactor) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(1, Duration.ofSeconds(1), Duration.ofSeconds(10), 0.0);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be at least initialBackoff");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
    }

    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, Duration.ZERO, 0.0);
    }

    /**
     * Delay before the attempt following {@code failedAttempt} (1-based): initial * 2^(n-1), capped,
     * then spread by the jitter factor.
     */
    public Duration backoffAfter(int failedAttempt) {
        if (initialBackoff.isZero()) {
            return Duration.ZERO;
        }
        int exponent = Math.min(Math.max(failedAttempt - 1, 0), 20);
        long baseMillis = initialBackoff.toMillis() * (1L << exponent);
        long cappedMillis = Math.min(baseMillis, maxBackoff.toMillis());
        double jitterMultiplier = 1.0 + (Math.random() * 2.0 - 1.0) * jitterFactor;
        return Duration.ofMillis(Math.max(0, (long) (cappedMillis * jitterMultiplier)));
    }
}
