package com.falkordb.cyphersat.falkordb;

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
 * Demo that seeds a FalkorDB graph with a few people and solves
 * {@code MATCH (n:Person)-[r:KNOWS]->(m:Person)} against it.
 * <p>
 * Connection settings can be configured via environment variables:
 * <ul>
 *   <li>FALKORDB_HOST - FalkorDB host (default: localhost)</li>
 *   <li>FALKORDB_PORT - FalkorDB port (default: 6379)</li>
 *   <li>FALKORDB_GRAPH - graph name (default: cypher_sat)</li>
 * </ul>
 * The graph is cleared before seeding.
 */
public final class FalkorDBDemo {
    /** Logger instance for this class. */
    private static final Logger LOGGER =
        LoggerFactory.getLogger(FalkorDBDemo.class);

    /** Prevent instantiation of this utility/demo class. */
    private FalkorDBDemo() {
        throw new AssertionError("No instances");
    }

    /**
     * Demo entry point.
     *
     * @param args command line arguments (ignored)
     */
    public static void main(final String[] args) {
        try (FalkorDBFactStore store = FalkorDBFactStore.builder()
                .fromEnvironment()
                .build()) {
            runDemo(store);
        } catch (RuntimeException e) {
            if (LOGGER.isErrorEnabled()) {
                LOGGER.error("✗ Error: {}", e.getMessage());
                LOGGER.error("Make sure FalkorDB is running on {}:{}",
                    FalkorDBFactStore.DEFAULT_HOST,
                    FalkorDBFactStore.DEFAULT_PORT);
            }
            LOGGER.error("Stack trace:", e);
        } finally {
            TracingUtil.shutdown();
        }
    }

    /**
     * Seed the store and solve the demo pattern.
     * Package-private to allow testing.
     *
     * @param store the store to seed and query
     * @return the binding found, empty if none
     */
    static Optional<Binding> runDemo(final FalkorDBFactStore store) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Cypher SAT over FalkorDB Demo");
            LOGGER.info("===============================================");
        }

        store.clear();
        String alice = store.createNode("Person");
        String bob = store.createNode("Person");
        String acme = store.createNode("Company");
        store.createRelationship("KNOWS", alice, bob);
        store.createRelationship("WORKS_AT", bob, acme);
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("✓ Seeded graph {} (alice={}, bob={})",
                store.getGraphName(), alice, bob);
        }

        PatternElement query = PatternGroup.of("MATCH",
            RelationshipChain.outgoing(
                new EntityPattern("n", "Person"),
                new RelationshipPattern("r", "KNOWS"),
                new EntityPattern("m", "Person")));

        CypherQuerySolver solver = new CypherQuerySolver(store);
        if (LOGGER.isInfoEnabled()) {
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
