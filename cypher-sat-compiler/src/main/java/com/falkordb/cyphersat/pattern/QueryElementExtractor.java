package com.falkordb.cyphersat.pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the entity-variable patterns and relationship chains of a pattern
 * tree in a single pre-order pass.
 *
 * <h2>Classification:</h2>
 * <ul>
 *   <li><strong>Labeled entity pattern</strong> {@code (n:Person)}: becomes a
 *       {@link NodeElement}</li>
 *   <li><strong>Bare entity pattern</strong> {@code (n)}: a reference only,
 *       contributes nothing by itself</li>
 *   <li><strong>Relationship chain</strong>: becomes a {@link ChainElement}
 *       naming its endpoints by variable; the endpoint patterns are visited
 *       as ordinary children of the chain</li>
 *   <li><strong>Anything else</strong>: traversed, not recorded</li>
 * </ul>
 *
 * <h2>Example:</h2>
 * <pre>{@code
 * // MATCH (n:Person)-[r:KNOWS]->(m:Person)
 * // nodes:  [n:Person, m:Person]
 * // chains: [r:KNOWS  n -> m]
 * }</pre>
 */
public final class QueryElementExtractor {

    /** Logger instance. */
    private static final Logger LOGGER =
        LoggerFactory.getLogger(QueryElementExtractor.class);

    /** Private constructor to prevent instantiation. */
    private QueryElementExtractor() {
        // Utility class
    }

    /**
     * Extract node and chain elements from a pattern tree.
     *
     * @param root the root of the pattern tree
     * @return the extracted elements, both lists empty if nothing matched
     * @throws IllegalArgumentException if root is null
     */
    public static QueryElements extract(final PatternElement root) {
        if (root == null) {
            throw new IllegalArgumentException("Pattern root cannot be null");
        }

        List<NodeElement> nodes = new ArrayList<>();
        List<ChainElement> chains = new ArrayList<>();

        PatternVisitor<Void> collector = new PatternVisitor<>() {
            @Override
            public Void visitEntity(final EntityPattern entity) {
                if (entity.hasLabel()) {
                    nodes.add(new NodeElement(entity.variable(), entity.label()));
                    LOGGER.trace("Entity pattern {}:{}", entity.variable(),
                        entity.label());
                }
                return null;
            }

            @Override
            public Void visitChain(final RelationshipChain chain) {
                RelationshipPattern relationship = chain.relationship();
                chains.add(new ChainElement(
                    relationship.hasVariable() ? relationship.variable() : null,
                    relationship.hasLabel() ? relationship.label() : null,
                    chain.source().variable(),
                    chain.target().variable()));
                LOGGER.trace("Relationship chain ({})-[{}:{}]->({})",
                    chain.source().variable(), relationship.variable(),
                    relationship.label(), chain.target().variable());
                return null;
            }

            @Override
            public Void visitGroup(final PatternGroup group) {
                return null;
            }
        };

        root.walk().forEach(element -> element.accept(collector));

        LOGGER.debug("Extracted {} entity patterns and {} relationship chains",
            nodes.size(), chains.size());

        return new QueryElements(nodes, chains);
    }
}
