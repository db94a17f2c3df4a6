package com.purchasingpower.docindex.config;

import com.purchasingpower.docindex.client.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Retry configuration for calls to the extraction service and the index service.
 *
 * <p>Properties are loaded from the {@code app.retry} namespace in application.yml:
 * <pre>
 * app:
 *   retry:
 *     max-attempts: 5
 *     initial-backoff: 1s
 *     max-backoff: 8s
 * </pre>
 *
 * <p>The delay before retry N (starting at 0) is
 * {@code min(initial-backoff * 2^N, max-backoff)}: 1s, 2s, 4s, 8s with the defaults.
 * {@code max-attempts} counts the first attempt.
 */
@ConfigurationProperties(prefix = "app.retry")
@Data
public class GlobalRetryConfig {

    private int maxAttempts = 5;

    private Duration initialBackoff = Duration.ofSeconds(1);

    private Duration maxBackoff = Duration.ofSeconds(8);

    public RetryPolicy toPolicy() {
        return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff);
    }
}
