package com.customer.identity.tracing;

import java.util.Map;

/**
 * Tracing seam of the library. {@link NoOpTracingService} is used unless an
 * {@link OpenTelemetryTracingService} is configured.
 */
public interface TracingService {

    /**
     * Starts a span; {@code attributes} with {@code null} values are left off the span.
     */
    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }
}
