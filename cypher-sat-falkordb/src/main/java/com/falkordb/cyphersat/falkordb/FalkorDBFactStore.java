package com.falkordb.cyphersat.falkordb;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import com.falkordb.cyphersat.facts.FactStore;
import com.falkordb.cyphersat.facts.FactStoreException;
import com.falkordb.cyphersat.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link FactStore} backed by a FalkorDB graph via the JFalkorDB driver.
 *
 * <p>Node and relationship ids are FalkorDB's internal entity ids rendered
 * as strings. Labels are spliced into backtick-quoted identifiers after
 * escaping; ids travel as query parameters.</p>
 *
 * <h2>Queries issued:</h2>
 * <pre>{@code
 * MATCH (n:`Person`) RETURN id(n) AS id ORDER BY id
 * MATCH ()-[r:`KNOWS`]->() RETURN id(r) AS id ORDER BY id
 * MATCH (s)-[r]->() WHERE id(r) = $id RETURN id(s) AS id
 * MATCH ()-[r]->(t) WHERE id(r) = $id RETURN id(t) AS id
 * }</pre>
 *
 * <p>Driver failures surface as {@link FactStoreException}.</p>
 */
public final class FalkorDBFactStore implements FactStore, AutoCloseable {
    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        FalkorDBFactStore.class);

    /** Default FalkorDB port. */
    public static final int DEFAULT_PORT = 6379;

    /** Default FalkorDB host. */
    public static final String DEFAULT_HOST = "localhost";

    /** Default graph name. */
    public static final String DEFAULT_GRAPH_NAME = "cypher_sat";

    /** Result column carrying entity ids. */
    private static final String ID_COLUMN = "id";

    /** Attribute key for operation type. */
    private static final AttributeKey<String> ATTR_OPERATION =
        AttributeKey.stringKey("falkordb.operation");

    /** Attribute key for graph name. */
    private static final AttributeKey<String> ATTR_GRAPH_NAME =
        AttributeKey.stringKey("falkordb.graph_name");

    /** Attribute key for the label or id looked up. */
    private static final AttributeKey<String> ATTR_ARGUMENT =
        AttributeKey.stringKey("cypher_sat.fact_store.argument");

    /** Attribute key for result count. */
    private static final AttributeKey<Long> ATTR_RESULT_COUNT =
        AttributeKey.longKey("cypher_sat.fact_store.result_count");

    /** FalkorDB driver (JFalkorDB). */
    private final Driver driver;

    /** Underlying FalkorDB graph instance (with tracing). */
    private final TracedGraph graph;

    /** Name of the FalkorDB graph in use. */
    private final String graphName;

    /** Tracer for fact-store operations. */
    private final Tracer tracer;

    /**
     * Create a store over a graph reached through the given driver.
     *
     * @param suppliedDriver FalkorDB driver instance to use
     * @param name name of the FalkorDB graph to use
     */
    public FalkorDBFactStore(final Driver suppliedDriver, final String name) {
        this(suppliedDriver, new TracedGraph(suppliedDriver.graph(name), name),
            TracingUtil.getTracer(TracingUtil.SCOPE_FACT_STORE));
    }

    /**
     * Create a store over an already wrapped graph, tracing lookups on the
     * given tracer.
     *
     * @param suppliedDriver FalkorDB driver, closed by {@link #close()}
     * @param tracedGraph the graph to query
     * @param storeTracer tracer for lookup spans
     */
    public FalkorDBFactStore(final Driver suppliedDriver,
                             final TracedGraph tracedGraph,
                             final Tracer storeTracer) {
        this.driver = suppliedDriver;
        this.graph = tracedGraph;
        this.graphName = tracedGraph.getGraphName();
        this.tracer = storeTracer;
    }

    /**
     * Obtain a {@link Builder} to configure and create a store.
     *
     * @return a new {@link Builder}
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the FalkorDB graph name
     */
    public String getGraphName() {
        return graphName;
    }

    @Override
    public List<String> entitiesWithLabel(final String label) {
        String cypher = "MATCH (n:`%s`) RETURN id(n) AS %s ORDER BY %s"
            .formatted(sanitizeCypherIdentifier(requireLabel(label)),
                ID_COLUMN, ID_COLUMN);
        return traced("entitiesWithLabel", label,
            () -> idsOf(run(cypher, Map.of())));
    }

    @Override
    public List<String> relationshipsWithLabel(final String label) {
        String cypher = "MATCH ()-[r:`%s`]->() RETURN id(r) AS %s ORDER BY %s"
            .formatted(sanitizeCypherIdentifier(requireLabel(label)),
                ID_COLUMN, ID_COLUMN);
        return traced("relationshipsWithLabel", label,
            () -> idsOf(run(cypher, Map.of())));
    }

    @Override
    public Optional<String> sourceOf(final String relationshipId) {
        return endpointOf("sourceOf", relationshipId, """
            MATCH (s)-[r]->() WHERE id(r) = $id
            RETURN id(s) AS id""");
    }

    @Override
    public Optional<String> targetOf(final String relationshipId) {
        return endpointOf("targetOf", relationshipId, """
            MATCH ()-[r]->(t) WHERE id(r) = $id
            RETURN id(t) AS id""");
    }

    /**
     * Create a node with a single label.
     *
     * @param label the node label
     * @return the id of the new node
     */
    public String createNode(final String label) {
        String cypher = "CREATE (n:`%s`) RETURN id(n) AS %s"
            .formatted(sanitizeCypherIdentifier(requireLabel(label)), ID_COLUMN);
        return single(idsOf(run(cypher, Map.of())), "CREATE node " + label);
    }

    /**
     * Create a relationship between two existing nodes.
     *
     * @param label the relationship label
     * @param sourceId id of the source node
     * @param targetId id of the target node
     * @return the id of the new relationship
     * @throws FactStoreException if either node does not exist
     */
    public String createRelationship(final String label,
                                     final String sourceId,
                                     final String targetId) {
        String cypher = """
            MATCH (s), (t) WHERE id(s) = $source AND id(t) = $target
            CREATE (s)-[r:`%s`]->(t)
            RETURN id(r) AS id""".formatted(
                sanitizeCypherIdentifier(requireLabel(label)));
        Optional<Long> source = parseId(sourceId);
        Optional<Long> target = parseId(targetId);
        if (source.isEmpty() || target.isEmpty()) {
            throw new FactStoreException("Not a FalkorDB node id: "
                + (source.isEmpty() ? sourceId : targetId));
        }
        return single(
            idsOf(run(cypher, Map.of("source", source.get(),
                "target", target.get()))),
            "CREATE relationship " + label + " " + sourceId + "->" + targetId);
    }

    /** Remove all nodes and relationships from the graph. */
    public void clear() {
        run("MATCH (n) DETACH DELETE n", Map.of());
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            if (LOGGER.isErrorEnabled()) {
                LOGGER.error("Error closing FalkorDB driver: {}",
                    e.getMessage());
            }
        }
    }

    private Optional<String> endpointOf(final String operation,
                                        final String relationshipId,
                                        final String cypher) {
        Optional<Long> id = parseId(relationshipId);
        if (id.isEmpty()) {
            LOGGER.debug("{} is not a FalkorDB relationship id", relationshipId);
            return Optional.empty();
        }
        List<String> ids = traced(operation, relationshipId,
            () -> idsOf(run(cypher, Map.of("id", id.get()))));
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    private ResultSet run(final String cypher,
                          final Map<String, Object> params) {
        try {
            return graph.query(cypher, params);
        } catch (RuntimeException e) {
            throw new FactStoreException("FalkorDB query failed on graph "
                + graphName + ": " + e.getMessage(), e);
        }
    }

    private List<String> traced(final String operation, final String argument,
                                final Supplier<List<String>> lookup) {
        return TracingUtil.inSpan(tracer.spanBuilder("FalkorDBFactStore." + operation)
            .setSpanKind(SpanKind.INTERNAL)
            .setAttribute(ATTR_OPERATION, operation)
            .setAttribute(ATTR_GRAPH_NAME, graphName)
            .setAttribute(ATTR_ARGUMENT, argument), span -> {
                List<String> ids = lookup.get();
                span.setAttribute(ATTR_RESULT_COUNT, (long) ids.size());
                LOGGER.debug("{}({}) on {} returned {} ids", operation, argument,
                    graphName, ids.size());
                return ids;
            });
    }

    private static List<String> idsOf(final ResultSet result) {
        List<String> ids = new ArrayList<>();
        for (Record record : result) {
            Object value = record.getValue(ID_COLUMN);
            if (value == null) {
                throw new FactStoreException(
                    "FalkorDB returned a row without an id");
            }
            ids.add(String.valueOf(value));
        }
        return ids;
    }

    private static String single(final List<String> ids,
                                 final String statement) {
        if (ids.isEmpty()) {
            throw new FactStoreException("No entity created by " + statement);
        }
        return ids.get(0);
    }

    private static Optional<Long> parseId(final String id) {
        if (id == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(id));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String requireLabel(final String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Label cannot be blank");
        }
        return label;
    }

    /**
     * Escape a value for use inside a backtick-quoted Cypher identifier:
     * backticks are doubled and NUL characters dropped.
     *
     * @param value the value to sanitize
     * @return the sanitized value
     */
    static String sanitizeCypherIdentifier(final String value) {
        if (value == null) {
            return "";
        }
        return value.replace("`", "``").replace("\0", "");
    }

    /**
     * Builder for {@link FalkorDBFactStore} instances.
     */
    public static class Builder {
        /** FalkorDB host to connect to. */
        private String host = DEFAULT_HOST;
        /** FalkorDB port to connect to. */
        private int port = DEFAULT_PORT;
        /** Name of the FalkorDB graph holding the facts. */
        private String graphName = DEFAULT_GRAPH_NAME;
        /** Custom FalkorDB driver instance (optional). */
        private Driver driver = null;

        /**
         * Creates a new Builder with default settings.
         */
        public Builder() {
            // Default constructor
        }

        /**
         * Set the FalkorDB host to connect to.
         *
         * @param value the FalkorDB host
         * @return this builder
         */
        public Builder host(final String value) {
            this.host = value;
            return this;
        }

        /**
         * Set the FalkorDB port to connect to.
         *
         * @param value the FalkorDB port
         * @return this builder
         */
        public Builder port(final int value) {
            this.port = value;
            return this;
        }

        /**
         * Set the FalkorDB graph name.
         *
         * @param name the graph name
         * @return this builder
         */
        public Builder graphName(final String name) {
            this.graphName = name;
            return this;
        }

        /**
         * Set a custom FalkorDB driver instance to use.
         * If set, host and port settings will be ignored.
         *
         * @param value the FalkorDB driver instance
         * @return this builder
         */
        public Builder driver(final Driver value) {
            this.driver = value;
            return this;
        }

        /**
         * Read {@code FALKORDB_HOST}, {@code FALKORDB_PORT} and
         * {@code FALKORDB_GRAPH}; unset variables keep the current values.
         *
         * @return this builder
         */
        public Builder fromEnvironment() {
            return fromEnvironment(System.getenv());
        }

        Builder fromEnvironment(final Map<String, String> env) {
            String envHost = env.get("FALKORDB_HOST");
            if (envHost != null && !envHost.isEmpty()) {
                host = envHost;
            }
            String envPort = env.get("FALKORDB_PORT");
            if (envPort != null && !envPort.isEmpty()) {
                port = Integer.parseInt(envPort);
            }
            String envGraph = env.get("FALKORDB_GRAPH");
            if (envGraph != null && !envGraph.isEmpty()) {
                graphName = envGraph;
            }
            return this;
        }

        /**
         * Build the store.
         *
         * @return a FalkorDB-backed fact store
         */
        public FalkorDBFactStore build() {
            if (graphName == null || graphName.isBlank()) {
                throw new IllegalArgumentException("Graph name cannot be blank");
            }
            Driver effective = driver != null
                ? driver
                : FalkorDB.driver(host, port);
            return new FalkorDBFactStore(effective, graphName);
        }
    }
}
