package com.customer.identity.logging;

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * AutoCloseable scope over the SLF4J MDC. Closing a context puts back whatever the keys it
 * set held before, so a resolution nested inside a sync run hands {@code operation} back to
 * the sync when it ends.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forResolution(correlationId, "storefront")) {
 *     log.info("customer.resolved customerId={} action={}", customerId, action);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String OPERATION = "operation";
    public static final String PROVIDER = "provider";
    public static final String PRIMARY_CUSTOMER_ID = "primaryCustomerId";
    public static final String SYNC_RUN_ID = "syncRunId";
    public static final String SOURCE_TYPE = "sourceType";

    private final Deque<PreviousValue> previous = new ArrayDeque<>();

    private LogContext() {
    }

    public static LogContext forResolution(String correlationId, String provider) {
        return new LogContext()
                .with(CORRELATION_ID, correlationId)
                .with(PROVIDER, provider)
                .with(OPERATION, "resolve");
    }

    public static LogContext forSearch(String correlationId) {
        return new LogContext()
                .with(CORRELATION_ID, correlationId)
                .with(OPERATION, "search");
    }

    public static LogContext forMerge(String correlationId, long primaryId) {
        return new LogContext()
                .with(CORRELATION_ID, correlationId)
                .with(PRIMARY_CUSTOMER_ID, Long.toString(primaryId))
                .with(OPERATION, "merge");
    }

    /**
     * Context for one run of a sync job; {@code runId} groups the log lines of every page.
     */
    public static LogContext forSync(String runId, String sourceType) {
        return new LogContext()
                .with(SYNC_RUN_ID, runId)
                .with(SOURCE_TYPE, sourceType)
                .with(OPERATION, "sync");
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        previous.push(new PreviousValue(key, MDC.get(key)));
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        while (!previous.isEmpty()) {
            PreviousValue entry = previous.pop();
            if (entry.value() == null) {
                MDC.remove(entry.key());
            } else {
                MDC.put(entry.key(), entry.value());
            }
        }
    }

    private record PreviousValue(String key, String value) {}
}
