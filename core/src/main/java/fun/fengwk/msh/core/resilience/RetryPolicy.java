package fun.fengwk.msh.core.resilience;

import fun.fengwk.msh.core.configuration.ConfigurationException;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Exponential backoff retry policy shared by all search providers.
 *
 * @param maxAttempts total attempts including the first call
 * @param baseDelay delay before the second attempt
 * @param maxDelay upper bound of any single delay
 * @author fengwk
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {

    public RetryPolicy {
        ConfigurationException.check(maxAttempts >= 1, "retry.max-attempts must be >= 1, actual=%s", maxAttempts);
        ConfigurationException.check(baseDelay != null && !baseDelay.isNegative(),
            "retry.base-delay-ms must be >= 0, actual=%s", baseDelay);
        ConfigurationException.check(maxDelay != null && maxDelay.compareTo(baseDelay) >= 0,
            "retry.max-delay-ms must be >= retry.base-delay-ms, actual=%s", maxDelay);
    }

    public static RetryPolicy ofMillis(int maxAttempts, long baseDelayMs, long maxDelayMs) {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(baseDelayMs), Duration.ofMillis(maxDelayMs));
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     */
    public Duration backoff(int attempt) {
        long max = maxDelay.toMillis();
        long delay = baseDelay.toMillis();
        for (int i = 1; i < attempt && delay < max; i++) {
            delay <<= 1;
        }
        return Duration.ofMillis(Math.min(delay, max));
    }

    public RetryConfig toRetryConfig(Predicate<Throwable> retryable) {
        return RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(attempt -> backoff(attempt).toMillis())
            .retryOnException(retryable)
            .build();
    }

}
