package com.falkordb.cyphersat.compiler;

import com.falkordb.cyphersat.constraint.ConstraintSet;
import com.falkordb.cyphersat.constraint.Disjunction;
import com.falkordb.cyphersat.constraint.ExactlyOne;
import com.falkordb.cyphersat.constraint.NodeAssignment;
import com.falkordb.cyphersat.constraint.Proposition;
import com.falkordb.cyphersat.facts.FactStore;
import com.falkordb.cyphersat.pattern.NodeElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * First pass: every labeled node variable is bound to exactly one stored
 * node carrying that label.
 *
 * <p>For {@code (n:Person)} over Person nodes {@code p1, p2} this adds
 * {@code ExactlyOne(Disjunction([n -> p1, n -> p2]))}. When no node carries
 * the label the disjunction is empty, which makes the whole problem
 * unsatisfiable; the SAT stage reports that as "no match".</p>
 */
public final class NodeConstraintBuilder {

    /** Logger instance. */
    private static final Logger LOGGER =
        LoggerFactory.getLogger(NodeConstraintBuilder.class);

    /** Source of candidate node ids. */
    private final FactStore factStore;

    /**
     * @param factStore store queried for candidates
     */
    public NodeConstraintBuilder(final FactStore factStore) {
        this.factStore = Objects.requireNonNull(factStore, "factStore");
    }

    /**
     * Add one {@link ExactlyOne} per node pattern.
     *
     * @param nodes extracted node patterns
     * @param constraints the set to populate
     */
    public void build(final List<NodeElement> nodes,
                      final ConstraintSet constraints) {
        for (NodeElement node : nodes) {
            List<Proposition> candidates = new ArrayList<>();
            for (String nodeId : factStore.entitiesWithLabel(node.label())) {
                LOGGER.trace("Variable {} can map to node {} with label {}",
                    node.variable(), nodeId, node.label());
                candidates.add(new NodeAssignment(node.variable(), nodeId));
            }
            if (candidates.isEmpty()) {
                LOGGER.debug("No node carries label {}; variable {} cannot be bound",
                    node.label(), node.variable());
            }
            constraints.add(new ExactlyOne(new Disjunction(candidates)));
            LOGGER.debug("Variable {}:{} has {} candidate nodes",
                node.variable(), node.label(), candidates.size());
        }
    }
}
