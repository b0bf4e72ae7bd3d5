package com.falkordb.cyphersat.compiler;

import com.falkordb.cyphersat.constraint.ConstraintSet;
import com.falkordb.cyphersat.constraint.Disjunction;
import com.falkordb.cyphersat.constraint.ExactlyOne;
import com.falkordb.cyphersat.constraint.Proposition;
import com.falkordb.cyphersat.constraint.RelationshipAssignment;
import com.falkordb.cyphersat.facts.FactStore;
import com.falkordb.cyphersat.pattern.ChainElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Second pass: every labeled relationship variable is bound to exactly one
 * stored relationship carrying that label. Anonymous or unlabeled edges are
 * skipped.
 */
public final class RelationshipConstraintBuilder {

    /** Logger instance. */
    private static final Logger LOGGER =
        LoggerFactory.getLogger(RelationshipConstraintBuilder.class);

    /** Source of candidate relationship ids. */
    private final FactStore factStore;

    /**
     * @param factStore store queried for candidates
     */
    public RelationshipConstraintBuilder(final FactStore factStore) {
        this.factStore = Objects.requireNonNull(factStore, "factStore");
    }

    /**
     * Add one {@link ExactlyOne} per constrained chain.
     *
     * @param chains extracted relationship chains
     * @param constraints the set to populate
     */
    public void build(final List<ChainElement> chains,
                      final ConstraintSet constraints) {
        for (ChainElement chain : chains) {
            if (!chain.isConstrained()) {
                LOGGER.debug("Skipping unconstrained relationship between {} and {}",
                    chain.sourceVariable(), chain.targetVariable());
                continue;
            }
            String variable = chain.relationshipVariable();
            List<Proposition> candidates = new ArrayList<>();
            for (String relationshipId
                    : factStore.relationshipsWithLabel(chain.relationshipLabel())) {
                LOGGER.trace("Variable {} can map to relationship {} with label {}",
                    variable, relationshipId, chain.relationshipLabel());
                candidates.add(new RelationshipAssignment(variable, relationshipId));
            }
            constraints.add(new ExactlyOne(new Disjunction(candidates)));
            LOGGER.debug("Variable {}:{} has {} candidate relationships",
                variable, chain.relationshipLabel(), candidates.size());
        }
    }
}
