package com.growfolio.common.logging;

/*
 * 09/17/2026 - 12:51 PM
 * @author Growfolio Engineering
 */

import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Scoped MDC values for repository calls.
 * <p>
 * Usage:
 * <pre>
 * Transfer transfer = LogContext.forOperation("funding", "initiateDeposit")
 *         .and(LogContext.RESOURCE_ID, portfolioId)
 *         .supply(() -> remote.initiateDeposit(request));
 *
 * // hand the caller's context to a worker thread
 * LogContext.Snapshot snapshot = LogContext.capture();
 * executor.execute(() -> LogContext.restore(snapshot).run(task));
 * </pre>
 */
public final class LogContext {

    public static final String DOMAIN = "domain";
    public static final String OPERATION = "operation";
    public static final String CACHE_KEY = "cacheKey";
    public static final String RESOURCE_ID = "resourceId";
    public static final String CORRELATION_ID = "correlationId";

    private LogContext() {}

    public static Builder with(String key, Object value) {
        return new Builder().and(key, value);
    }

    /**
     * Context for one repository operation, tagged with a fresh correlation id.
     */
    public static Builder forOperation(String domain, String operation) {
        return new Builder()
                .and(DOMAIN, domain)
                .and(OPERATION, operation)
                .and(CORRELATION_ID, UUID.randomUUID().toString().substring(0, 8));
    }

    public static Snapshot capture() {
        return new Snapshot(MDC.getCopyOfContextMap());
    }

    public static Builder restore(Snapshot snapshot) {
        Builder builder = new Builder();
        if (snapshot.context() != null) {
            builder.context.putAll(snapshot.context());
        }
        return builder;
    }

    public static class Builder {
        private final Map<String, String> context = new HashMap<>();

        public Builder and(String key, Object value) {
            if (key != null && value != null) {
                context.put(key, value.toString());
            }
            return this;
        }

        public void run(Runnable task) {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            try {
                context.forEach(MDC::put);
                task.run();
            } finally {
                restorePrevious(previous);
            }
        }

        public <T> T supply(Supplier<T> supplier) {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            try {
                context.forEach(MDC::put);
                return supplier.get();
            } finally {
                restorePrevious(previous);
            }
        }

        private void restorePrevious(Map<String, String> previous) {
            context.keySet().forEach(MDC::remove);
            if (previous != null) {
                MDC.setContextMap(previous);
            }
        }
    }

    /**
     * Captured MDC context for thread propagation.
     */
    public record Snapshot(Map<String, String> context) {}
}
