package com.falkordb.cyphersat.falkordb;

import com.falkordb.Graph;
import com.falkordb.ResultSet;
import com.falkordb.cyphersat.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;
import java.util.Objects;

/**
 * Wraps a FalkorDB {@link Graph} so that every driver call runs inside a
 * CLIENT span carrying the Cypher statement and its parameters.
 */
public final class TracedGraph {
    /** The wrapped graph instance. */
    private final Graph delegate;

    /** The graph name for tracing attributes. */
    private final String graphName;

    /** Tracer for creating spans. */
    private final Tracer tracer;

    /** Whether spans are recorded at all. */
    private final boolean tracingEnabled;

    /** Attribute key for Cypher query. */
    private static final AttributeKey<String> ATTR_DB_STATEMENT =
        AttributeKey.stringKey("db.statement");

    /** Attribute key for database system. */
    private static final AttributeKey<String> ATTR_DB_SYSTEM =
        AttributeKey.stringKey("db.system");

    /** Attribute key for database name. */
    private static final AttributeKey<String> ATTR_DB_NAME =
        AttributeKey.stringKey("db.name");

    /** Attribute key for query parameters. */
    private static final AttributeKey<String> ATTR_DB_PARAMS =
        AttributeKey.stringKey("db.falkordb.params");

    /**
     * Create a traced graph wrapper using the global tracing setup.
     * Spans are recorded only when tracing is enabled.
     *
     * @param delegate the underlying Graph to wrap
     * @param graphName the graph name for attributes
     */
    public TracedGraph(final Graph delegate, final String graphName) {
        this(delegate, graphName,
            TracingUtil.getTracer(TracingUtil.SCOPE_REDIS_DRIVER),
            TracingUtil.isTracingEnabled());
    }

    /**
     * Create a traced graph wrapper that always records spans on the given
     * tracer.
     *
     * @param delegate the underlying Graph to wrap
     * @param graphName the graph name for attributes
     * @param tracer tracer for driver spans
     */
    public TracedGraph(final Graph delegate, final String graphName,
                       final Tracer tracer) {
        this(delegate, graphName, tracer, true);
    }

    private TracedGraph(final Graph delegate, final String graphName,
                        final Tracer tracer, final boolean tracingEnabled) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.graphName = graphName;
        this.tracer = tracer;
        this.tracingEnabled = tracingEnabled;
    }

    /**
     * Execute a parameterized Cypher query with tracing.
     *
     * @param cypher the Cypher query
     * @param params the query parameters
     * @return the result set
     */
    public ResultSet query(final String cypher,
                           final Map<String, Object> params) {
        if (!tracingEnabled) {
            return delegate.query(cypher, params);
        }

        return TracingUtil.inSpan(tracer.spanBuilder("FalkorDB.query")
            .setSpanKind(SpanKind.CLIENT)
            .setAttribute(ATTR_DB_SYSTEM, "falkordb")
            .setAttribute(ATTR_DB_NAME, graphName)
            .setAttribute(ATTR_DB_STATEMENT, cypher)
            .setAttribute(ATTR_DB_PARAMS, paramsToString(params)),
            span -> delegate.query(cypher, params));
    }

    /**
     * @return the underlying Graph
     */
    public Graph getDelegate() {
        return delegate;
    }

    /**
     * @return the graph name
     */
    public String getGraphName() {
        return graphName;
    }

    private static String paramsToString(final Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(entry.getKey()).append('=');
            Object value = entry.getValue();
            if (value instanceof String) {
                sb.append('"').append(value).append('"');
            } else {
                sb.append(value);
            }
        }
        return sb.append('}').toString();
    }
}
