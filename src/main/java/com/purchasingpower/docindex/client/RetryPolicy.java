package com.purchasingpower.docindex.client;

import com.purchasingpower.docindex.model.CallContext;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Bounded exponential backoff for remote calls.
 *
 * <p>The delay before retry N (starting at 0) is {@code min(initialBackoff * 2^N, maxBackoff)}.
 * {@code maxAttempts} counts the first attempt, so 5 means one call plus at most four retries.
 * Transport errors, non-2xx responses and timeouts are retried; once the attempts are used up
 * the last failure is propagated unchanged.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("initialBackoff must be positive");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(8));
    }

    /**
     * Reactor retry spec for a single call site, logging each retry on the call's context.
     */
    public RetryBackoffSpec toRetrySpec(CallContext call) {
        return Retry.backoff(maxAttempts - 1L, initialBackoff)
                .maxBackoff(maxBackoff)
                .jitter(0d)
                .filter(RetryPolicy::isTransient)
                .doBeforeRetry(signal -> call.logRetry(signal.totalRetries() + 1, signal.failure()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    static boolean isTransient(Throwable ex) {
        return ex instanceof WebClientException || ex instanceof TimeoutException;
    }
}
