package com.falkordb.cyphersat.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.semconv.ServiceAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.Function;

/**
 * Tracing for the solver pipeline and the fact-store backends.
 *
 * <p>Tracers come from one lazily built OpenTelemetry SDK exporting over
 * OTLP/gRPC. Configuration is read from the environment on first use:</p>
 * <ul>
 *   <li>{@code OTEL_TRACING_ENABLED} - {@code false} turns every tracer into
 *       a no-op (default: true)</li>
 *   <li>{@code OTEL_SERVICE_NAME} - service name (default: cypher-sat)</li>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT} - collector endpoint
 *       (default: http://localhost:4317)</li>
 * </ul>
 *
 * <p>{@link #inSpan(SpanBuilder, Function)} runs one solver or store step
 * inside a span and records its outcome.</p>
 */
public final class TracingUtil {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        TracingUtil.class);

    /** Instrumentation scope name for query solver operations. */
    public static final String SCOPE_QUERY_SOLVER =
        "com.falkordb.cyphersat.CypherQuerySolver";

    /** Instrumentation scope name for fact-store operations. */
    public static final String SCOPE_FACT_STORE =
        "com.falkordb.cyphersat.facts";

    /** Instrumentation scope name for Redis/driver operations. */
    public static final String SCOPE_REDIS_DRIVER = "com.falkordb.redis";

    /** Environment variable to enable/disable tracing. */
    static final String ENV_TRACING_ENABLED = "OTEL_TRACING_ENABLED";

    /** Environment variable for service name. */
    static final String ENV_SERVICE_NAME = "OTEL_SERVICE_NAME";

    /** Environment variable for OTLP endpoint. */
    static final String ENV_OTLP_ENDPOINT = "OTEL_EXPORTER_OTLP_ENDPOINT";

    /** Default service name. */
    static final String DEFAULT_SERVICE_NAME = "cypher-sat";

    /** Default OTLP endpoint. */
    static final String DEFAULT_OTLP_ENDPOINT = "http://localhost:4317";

    /** Lazily built OpenTelemetry instance. */
    private static volatile OpenTelemetry openTelemetry;

    /** Whether the environment enabled tracing. */
    private static volatile boolean tracingEnabled;

    /** Lock for initialization. */
    private static final Object INIT_LOCK = new Object();

    private TracingUtil() {
        throw new AssertionError("No instances");
    }

    /**
     * The process-wide OpenTelemetry instance, built on first call.
     *
     * @return the SDK, or a no-op instance when tracing is disabled
     */
    public static OpenTelemetry getOpenTelemetry() {
        if (openTelemetry == null) {
            synchronized (INIT_LOCK) {
                if (openTelemetry == null) {
                    Map<String, String> env = System.getenv();
                    tracingEnabled = isEnabled(env);
                    openTelemetry = create(env);
                }
            }
        }
        return openTelemetry;
    }

    /**
     * @param scopeName one of the {@code SCOPE_*} constants
     * @return the tracer for that scope
     */
    public static Tracer getTracer(final String scopeName) {
        return getOpenTelemetry().getTracer(scopeName);
    }

    /**
     * @return whether spans are exported
     */
    public static boolean isTracingEnabled() {
        getOpenTelemetry();
        return tracingEnabled;
    }

    /**
     * Start the span, make it current while {@code body} runs, and end it.
     * The span is marked OK when {@code body} returns; a runtime exception is
     * recorded on it, marks it ERROR, and is rethrown.
     *
     * @param builder the configured span builder
     * @param body the traced step; receives the span to add result attributes
     * @param <T> result type
     * @return what {@code body} returned
     */
    public static <T> T inSpan(final SpanBuilder builder,
                               final Function<Span, T> body) {
        Span span = builder.startSpan();
        try (Scope scope = span.makeCurrent()) {
            T result = body.apply(span);
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Flush and stop the exporter, if one was started.
     */
    public static void shutdown() {
        if (openTelemetry instanceof OpenTelemetrySdk sdk) {
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("Shutting down OpenTelemetry SDK");
            }
            sdk.getSdkTracerProvider().shutdown();
        }
    }

    static boolean isEnabled(final Map<String, String> env) {
        String enabled = env.get(ENV_TRACING_ENABLED);
        return enabled == null || enabled.isEmpty()
            || Boolean.parseBoolean(enabled);
    }

    static String serviceName(final Map<String, String> env) {
        return valueOrDefault(env, ENV_SERVICE_NAME, DEFAULT_SERVICE_NAME);
    }

    static String otlpEndpoint(final Map<String, String> env) {
        return valueOrDefault(env, ENV_OTLP_ENDPOINT, DEFAULT_OTLP_ENDPOINT);
    }

    private static OpenTelemetry create(final Map<String, String> env) {
        if (!isEnabled(env)) {
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("OpenTelemetry tracing is disabled");
            }
            return OpenTelemetry.noop();
        }

        String serviceName = serviceName(env);
        String endpoint = otlpEndpoint(env);
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Tracing cypher-sat as {} to {}", serviceName, endpoint);
        }

        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
            .addSpanProcessor(BatchSpanProcessor.builder(
                OtlpGrpcSpanExporter.builder().setEndpoint(endpoint).build())
                .build())
            .setResource(Resource.getDefault().merge(Resource.create(
                Attributes.of(ServiceAttributes.SERVICE_NAME, serviceName))))
            .build();

        // flush pending spans on exit
        Runtime.getRuntime().addShutdownHook(new Thread(
            tracerProvider::shutdown, "cypher-sat-tracing-shutdown"));

        return OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setPropagators(ContextPropagators.create(
                W3CTraceContextPropagator.getInstance()))
            .build();
    }

    private static String valueOrDefault(final Map<String, String> env,
                                         final String name,
                                         final String defaultValue) {
        String value = env.get(name);
        return value != null && !value.isEmpty() ? value : defaultValue;
    }
}
