package podcluster.cloud.client;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;

import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Retry policy for rate limited (429) provider calls.
 * <p>
 * The first delay is the initial backoff; every following one grows by {@value #MULTIPLIER}
 * and is randomized by up to {@value #JITTER} of itself. No delay exceeds
 * {@code initial * maxBackoffFactor}, jitter included. Only a 429 response is retried;
 * exceptions and other statuses pass straight through.
 */
public final class RateLimitRetry {

    static final int TOO_MANY_REQUESTS = 429;
    static final double MULTIPLIER = 1.6;
    static final double JITTER = 0.4;

    private RateLimitRetry() {
    }

    public static RetryConfig config(int maxAttempts, Duration initialBackoff, int maxBackoffFactor) {
        return config(maxAttempts, backoff(initialBackoff, maxBackoffFactor));
    }

    public static RetryConfig config(int maxAttempts, IntervalFunction backoff) {
        return RetryConfig.<HttpResponse<String>>custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(backoff)
                .retryOnResult(response -> response.statusCode() == TOO_MANY_REQUESTS)
                .retryOnException(e -> false)
                .build();
    }

    /** Jittered exponential backoff, clamped to the ceiling after randomization. */
    public static IntervalFunction backoff(Duration initialBackoff, int maxBackoffFactor) {
        if (maxBackoffFactor < 1) {
            throw new IllegalArgumentException("maxBackoffFactor must be >= 1: " + maxBackoffFactor);
        }
        long initialMillis = initialBackoff.toMillis();
        long ceilingMillis = initialMillis * maxBackoffFactor;
        return capped(IntervalFunction.ofExponentialRandomBackoff(initialMillis, MULTIPLIER, JITTER, ceilingMillis),
                Duration.ofMillis(ceilingMillis));
    }

    public static IntervalFunction capped(IntervalFunction backoff, Duration ceiling) {
        long ceilingMillis = ceiling.toMillis();
        return attempt -> Math.min(backoff.apply(attempt), ceilingMillis);
    }
}
