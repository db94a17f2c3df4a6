package com.purchasingpower.docindex.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Context for tracking an external service call with logging support.
 *
 * Provides request/response logging with timing and a short call id, formatted the
 * same way for every external service.
 *
 * @see com.purchasingpower.docindex.util.ExternalCallLogger
 * @see ServiceType
 */
public class CallContext {
    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final Instant startTime;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(String summary) {
        logger.debug("{} {} → {} [{}] {}",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                summary == null ? "" : summary);
    }

    public void logResponse(String summary) {
        logger.debug("{} {} ← {} [{}] ({}ms) {}",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                getElapsedMs(),
                summary == null ? "" : summary);
    }

    public void logRetry(long attempt, Throwable failure) {
        logger.warn("{} {} ↻ {} [{}] attempt {} failed, retrying: {}",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                attempt,
                failure.toString());
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {} [{}] ({}ms) - {}",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                getElapsedMs(),
                errorMessage);

        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }
}
