package com.falkordb.cyphersat;

import com.falkordb.cyphersat.cnf.ClauseSet;
import com.falkordb.cyphersat.facts.InMemoryFactStore;
import com.falkordb.cyphersat.pattern.EntityPattern;
import com.falkordb.cyphersat.pattern.PatternElement;
import com.falkordb.cyphersat.pattern.PatternGroup;
import com.falkordb.cyphersat.pattern.RelationshipChain;
import com.falkordb.cyphersat.pattern.RelationshipPattern;
import com.falkordb.cyphersat.solver.Binding;
import com.falkordb.cyphersat.solver.CypherQuerySolver;
import com.falkordb.cyphersat.solver.Sat4jSolver;
import com.falkordb.cyphersat.tracing.TracingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Demo application that compiles
 * {@code MATCH (n:Person)-[r:KNOWS]->(m:Person)} against a small in-memory
 * graph, prints the DIMACS encoding and solves it with Sat4j.
 */
public final class Main {
    /** Logger instance for this class. */
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    /** Prevent instantiation of this utility/demo class. */
    private Main() {
        throw new AssertionError("No instances");
    }

    /**
     * Demo entry point.
     *
     * @param args command line arguments (ignored)
     */
    public static void main(final String[] args) {
        try {
            runDemo();
        } finally {
            TracingUtil.shutdown();
        }
    }

    /**
     * Run the demo. Package-private to allow testing.
     *
     * @return the binding found, empty if none
     */
    static Optional<Binding> runDemo() {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Cypher SAT Compiler Demo");
            LOGGER.info("===============================================");
        }

        InMemoryFactStore facts = new InMemoryFactStore()
            .node("alice", "Person")
            .node("bob", "Person")
            .node("acme", "Company")
            .relationship("k1", "KNOWS", "alice", "bob")
            .relationship("w1", "WORKS_AT", "bob", "acme");
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("✓ Loaded {} facts", facts.size());
        }

        PatternElement query = PatternGroup.of("MATCH",
            RelationshipChain.outgoing(
                new EntityPattern("n", "Person"),
                new RelationshipPattern("r", "KNOWS"),
                new EntityPattern("m", "Person")));

        CypherQuerySolver solver = new CypherQuerySolver(facts);

        ClauseSet clauses = solver.clauses(query);
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("\n=== Variables ===");
            clauses.reverse().forEach((id, atom) ->
                LOGGER.info("  {} = {}", id, atom));
            LOGGER.info("\n=== DIMACS ===\n{}", solver.toDimacs(query));
        }

        Optional<Binding> binding = solver.solve(query, new Sat4jSolver());
        if (LOGGER.isInfoEnabled()) {
            if (binding.isPresent()) {
                LOGGER.info("\n=== Binding ===");
                binding.get().asMap().forEach((variable, id) ->
                    LOGGER.info("  {} -> {}", variable, id));
            } else {
                LOGGER.info("\n✗ No match");
            }
        }
        return binding;
    }
}
