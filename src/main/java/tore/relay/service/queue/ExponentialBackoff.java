package tore.relay.service.queue;

import java.time.Duration;

/**
 * Exponential backoff without jitter: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}.
 */
public final class ExponentialBackoff {

    private final long baseDelayMs;
    private final long maxDelayMs;

    /**
     * @param baseDelay delay after the first failed attempt
     * @param maxDelay  upper bound for any single delay
     */
    public ExponentialBackoff(Duration baseDelay, Duration maxDelay) {
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be > 0, got: " + baseDelay);
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay, got: " + maxDelay);
        }
        this.baseDelayMs = baseDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
    }

    /**
     * Backoff capped at one hour, or at {@code baseDelay} when that is longer.
     */
    public static ExponentialBackoff of(Duration baseDelay) {
        if (baseDelay == null) {
            throw new IllegalArgumentException("baseDelay must be > 0, got: null");
        }
        return new ExponentialBackoff(baseDelay, Duration.ofHours(1).compareTo(baseDelay) < 0 ? baseDelay : Duration.ofHours(1));
    }

    /**
     * Delay to wait after {@code failedAttempts} failures (1-based).
     */
    public Duration delayFor(int failedAttempts) {
        int exponent = Math.max(0, failedAttempts - 1);
        if (exponent >= 62 || baseDelayMs > (maxDelayMs >> exponent)) {
            return Duration.ofMillis(maxDelayMs);
        }
        return Duration.ofMillis(Math.min(maxDelayMs, baseDelayMs << exponent));
    }
}
