package com.record.dedup.logging;

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries for a detection run and its passes.
 *
 * <p>A run context carries {@code runId}, {@code keyStrategy} and
 * {@code operation=detect}; a pass context nested inside it adds {@code pass}.
 * Closing a context removes only the keys it put, so closing a pass leaves the
 * run keys in place.</p>
 *
 * <pre>
 * try (LogContext run = LogContext.forDetection(runId, "EXACT_KEY")) {
 *     for (MatchingPass pass : passes) {
 *         try (LogContext p = LogContext.forPass(pass.method().tag())) {
 *             pass.apply(ledger, cache);
 *         }
 *     }
 *     log.info("detection.completed unique={} duplicates={}", unique, duplicates);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Deque<String> ownedKeys = new ArrayDeque<>();

    private LogContext() {
    }

    public static LogContext forDetection(String runId, String keyStrategy) {
        return new LogContext()
                .with("runId", runId)
                .with("keyStrategy", keyStrategy)
                .with("operation", "detect");
    }

    public static LogContext forPass(String method) {
        return new LogContext().with("pass", method);
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Puts one more key, removed again when this context closes.
     */
    public LogContext with(String key, String value) {
        MDC.put(key, value);
        ownedKeys.push(key);
        return this;
    }

    @Override
    public void close() {
        while (!ownedKeys.isEmpty()) {
            MDC.remove(ownedKeys.pop());
        }
    }
}
