package com.customer.identity.tracing;

/**
 * A unit of work in a distributed trace. Ends when closed, so spans are used in
 * try-with-resources blocks:
 *
 * <pre>
 * try (Span span = tracingService.startSpan("customer.resolve")) {
 *     span.setAttribute("provider", "storefront");
 *     ...
 *     span.setStatus(SpanStatus.OK);
 * } catch (StoreException e) {
 *     span.fail(e);
 *     throw e;
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Records {@code t} and marks the span as failed.
     */
    default void fail(Throwable t) {
        recordException(t);
        setStatus(SpanStatus.ERROR);
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
