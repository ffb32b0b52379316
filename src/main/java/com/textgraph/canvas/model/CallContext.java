package com.textgraph.canvas.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Tracks one call to an external semantic backend: short call id, timing and
 * consistent request/response/error lines.
 *
 * @see com.textgraph.canvas.util.ExternalCallLogger
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
        logger.debug("{} {} → {} [{}] {}", service.getEmoji(), service.getName(), operation, callId,
                summary == null ? "" : summary);
    }

    public void logResponse(String summary) {
        logger.info("{} {} ← {} [{}] ({}ms) {}", service.getEmoji(), service.getName(), operation, callId,
                getElapsedMs(), summary == null ? "" : summary);
    }

    /**
     * Source failures are recoverable, so they are logged at WARN without the stack trace;
     * the cause is available at DEBUG.
     */
    public void logFailure(String errorMessage, Throwable ex) {
        logger.warn("{} {} ✖ {} [{}] ({}ms) - {}", service.getEmoji(), service.getName(), operation, callId,
                getElapsedMs(), errorMessage);
        if (ex != null) {
            logger.debug("  Failure details:", ex);
        }
    }

    public String getCallId() {
        return callId;
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }
}
