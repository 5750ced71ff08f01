package dev.storyeval.trace;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * Span names and attributes shared by the batch pipeline.
 *
 * <p>Nothing is exported unless the process registers an OpenTelemetry SDK globally. By default
 * every span is a no-op.
 */
public final class BatchTracing {
    public static final String INSTRUMENTATION_NAME = "dev.storyeval";

    public static final String PASS_SPAN = "pass";
    public static final String REMOTE_CALL_SPAN = "remote_call";

    public static final AttributeKey<String> JOB = AttributeKey.stringKey("storyeval.job");
    public static final AttributeKey<Long> PASS = AttributeKey.longKey("storyeval.pass");
    public static final AttributeKey<Long> PENDING = AttributeKey.longKey("storyeval.pending");
    public static final AttributeKey<Long> FAILED_CALLS =
            AttributeKey.longKey("storyeval.failed_calls");
    public static final AttributeKey<Long> ITEM_ID = AttributeKey.longKey("storyeval.item_id");
    public static final AttributeKey<String> RESULT_KEY =
            AttributeKey.stringKey("storyeval.result_key");

    private BatchTracing() {}

    /** Tracer from the globally registered OpenTelemetry instance. */
    public static Tracer getTracer() {
        return getTracer(GlobalOpenTelemetry.get());
    }

    public static Tracer getTracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_NAME);
    }

    /** Mark a span as failed by {@code t}. */
    public static void recordFailure(Span span, Throwable t) {
        span.setStatus(StatusCode.ERROR, String.valueOf(t.getMessage()));
        span.recordException(t);
    }
}
