package com.knowledge.curation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRound(sessionId, 3)) {
 *     log.info("round.started communities={}", communities.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one convergence round.
     */
    public static LogContext forRound(String sessionId, int round) {
        LogContext ctx = new LogContext();
        ctx.put("sessionId", sessionId);
        ctx.put("round", Integer.toString(round));
        ctx.put("operation", "converge");
        return ctx;
    }

    /**
     * Creates a log context for an interactive review session.
     */
    public static LogContext forReview(String sessionId, String bucket) {
        LogContext ctx = new LogContext();
        ctx.put("sessionId", sessionId);
        ctx.put("bucket", bucket);
        ctx.put("operation", "review");
        return ctx;
    }

    /**
     * Creates a log context for merge operations.
     */
    public static LogContext forMerge(String correlationId, String canonicalId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("canonicalId", canonicalId);
        ctx.put("operation", "merge");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
