package com.falkordb.cyphersat.solver;

import com.falkordb.cyphersat.cnf.ClauseExporter;
import com.falkordb.cyphersat.cnf.ClauseSet;
import com.falkordb.cyphersat.cnf.CnfNormalizer;
import com.falkordb.cyphersat.compiler.EndpointConstraintBuilder;
import com.falkordb.cyphersat.compiler.NodeConstraintBuilder;
import com.falkordb.cyphersat.compiler.RelationshipConstraintBuilder;
import com.falkordb.cyphersat.constraint.AtomicProposition;
import com.falkordb.cyphersat.constraint.ConstraintSet;
import com.falkordb.cyphersat.facts.FactStore;
import com.falkordb.cyphersat.pattern.PatternElement;
import com.falkordb.cyphersat.pattern.QueryElementExtractor;
import com.falkordb.cyphersat.pattern.QueryElements;
import com.falkordb.cyphersat.tracing.TracingUtil;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Compiles a graph pattern into a SAT problem over the facts of a store and
 * reads query results back out of SAT models.
 *
 * <p>Pipeline for one query:</p>
 * <ol>
 *   <li>{@link QueryElementExtractor} collects node patterns and chains</li>
 *   <li>{@link NodeConstraintBuilder}, {@link RelationshipConstraintBuilder}
 *       and {@link EndpointConstraintBuilder} fill a fresh
 *       {@link ConstraintSet} from the store</li>
 *   <li>{@link CnfNormalizer} rewrites the set into clauses</li>
 *   <li>{@link ClauseExporter} numbers the atoms and emits integer clauses</li>
 *   <li>a {@link SatSolver} finds a model; {@link SolutionInterpreter}
 *       maps it to a {@link Binding}</li>
 * </ol>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * CypherQuerySolver solver = new CypherQuerySolver(factStore);
 * Optional<Binding> binding = solver.solve(pattern, new Sat4jSolver());
 * binding.ifPresent(b -> System.out.println(b.get("n")));
 * }</pre>
 *
 * <p>Each call works on its own constraint set, so one solver may serve
 * many queries. Calls are synchronous; store lookups block the caller.
 * Enumerating further solutions (blocking clauses) is left to the
 * caller.</p>
 */
public final class CypherQuerySolver {

    /** Logger instance. */
    private static final Logger LOGGER =
        LoggerFactory.getLogger(CypherQuerySolver.class);

    /** Attribute key for the number of labeled node patterns. */
    private static final AttributeKey<Long> ATTR_NODE_PATTERNS =
        AttributeKey.longKey("cypher_sat.node_patterns");

    /** Attribute key for the number of relationship chains. */
    private static final AttributeKey<Long> ATTR_CHAINS =
        AttributeKey.longKey("cypher_sat.relationship_chains");

    /** Attribute key for the number of top-level constraints. */
    private static final AttributeKey<Long> ATTR_CONSTRAINTS =
        AttributeKey.longKey("cypher_sat.constraints");

    /** Attribute key for the number of SAT variables. */
    private static final AttributeKey<Long> ATTR_VARIABLES =
        AttributeKey.longKey("cypher_sat.variables");

    /** Attribute key for the number of clauses. */
    private static final AttributeKey<Long> ATTR_CLAUSES =
        AttributeKey.longKey("cypher_sat.clauses");

    /** Attribute key for the SAT verdict. */
    private static final AttributeKey<Boolean> ATTR_SATISFIABLE =
        AttributeKey.booleanKey("cypher_sat.satisfiable");

    /** Store the builders read candidates and endpoints from. */
    private final FactStore factStore;

    /** Tracer for solver operations. */
    private final Tracer tracer;

    /**
     * Create a solver traced through {@link TracingUtil}.
     *
     * @param factStore the store to match patterns against
     */
    public CypherQuerySolver(final FactStore factStore) {
        this(factStore, TracingUtil.getTracer(TracingUtil.SCOPE_QUERY_SOLVER));
    }

    /**
     * Create a solver with an explicit tracer.
     *
     * @param factStore the store to match patterns against
     * @param tracer tracer for solver spans
     */
    public CypherQuerySolver(final FactStore factStore, final Tracer tracer) {
        this.factStore = Objects.requireNonNull(factStore, "factStore");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    /**
     * Build the constraint set of a pattern: node, relationship, then
     * endpoint constraints. The result is not normalized.
     *
     * @param root root of the pattern tree
     * @return a fresh constraint set
     * @throws com.falkordb.cyphersat.compiler.MalformedQueryException if a
     *         chain references an undeclared node variable
     */
    public ConstraintSet compile(final PatternElement root) {
        return TracingUtil.inSpan(tracer.spanBuilder("CypherQuerySolver.compile")
            .setSpanKind(SpanKind.INTERNAL), span -> {
                QueryElements elements = QueryElementExtractor.extract(root);
                span.setAttribute(ATTR_NODE_PATTERNS, (long) elements.nodes().size());
                span.setAttribute(ATTR_CHAINS, (long) elements.chains().size());

                ConstraintSet constraints = new ConstraintSet();
                new NodeConstraintBuilder(factStore)
                    .build(elements.nodes(), constraints);
                new RelationshipConstraintBuilder(factStore)
                    .build(elements.chains(), constraints);
                new EndpointConstraintBuilder(factStore)
                    .build(elements.chains(), elements.nodes(), constraints);

                span.setAttribute(ATTR_CONSTRAINTS, (long) constraints.size());
                LOGGER.debug("Compiled pattern into {} constraints", constraints.size());
                return constraints;
            });
    }

    /**
     * Compile and normalize a pattern.
     *
     * @param root root of the pattern tree
     * @return the normalized constraint set
     */
    public ConstraintSet toCnf(final PatternElement root) {
        return CnfNormalizer.normalize(compile(root));
    }

    /**
     * Compile, normalize and export a pattern as integer clauses.
     *
     * @param root root of the pattern tree
     * @return clauses and id maps
     */
    public ClauseSet clauses(final PatternElement root) {
        return ClauseExporter.clauses(toCnf(root));
    }

    /**
     * Compile, normalize and export a pattern as DIMACS text, for external
     * solvers such as MiniSat or Glucose.
     *
     * @param root root of the pattern tree
     * @return the DIMACS document
     */
    public String toDimacs(final PatternElement root) {
        ClauseSet clauses = clauses(root);
        return clauses.toDimacs("cypher pattern over variables "
            + String.join(", ", variablesOf(clauses)));
    }

    /**
     * Find one binding of the pattern, calling the SAT routine once.
     *
     * @param root root of the pattern tree
     * @param satSolver the SAT routine
     * @return the binding, or empty if the pattern matches no data
     */
    public Optional<Binding> solve(final PatternElement root,
                                   final SatSolver satSolver) {
        Objects.requireNonNull(satSolver, "satSolver");
        return TracingUtil.inSpan(tracer.spanBuilder("CypherQuerySolver.solve")
            .setSpanKind(SpanKind.INTERNAL), span -> {
                ClauseSet clauses = clauses(root);
                span.setAttribute(ATTR_VARIABLES, (long) clauses.variableCount());
                span.setAttribute(ATTR_CLAUSES, (long) clauses.clauseCount());

                SatResult result = satSolver.solve(clauses);
                span.setAttribute(ATTR_SATISFIABLE, result.satisfiable());
                if (!result.satisfiable()) {
                    LOGGER.debug("Pattern is unsatisfiable over {} clauses",
                        clauses.clauseCount());
                    return Optional.<Binding>empty();
                }

                Binding binding = SolutionInterpreter.interpret(
                    clauses.trueAtoms(result.model()));
                LOGGER.debug("Pattern solved: {}", binding.asMap());
                return Optional.of(binding);
            });
    }

    private static Set<String> variablesOf(final ClauseSet clauses) {
        Set<String> variables = new LinkedHashSet<>();
        for (AtomicProposition atom : clauses.forward().keySet()) {
            variables.add(atom.variable());
        }
        return variables;
    }
}
