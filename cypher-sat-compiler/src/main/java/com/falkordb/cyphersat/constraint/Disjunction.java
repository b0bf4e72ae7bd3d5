package com.falkordb.cyphersat.constraint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Logical OR over an ordered list of propositions. The empty disjunction is
 * {@code false}; the node and relationship builders rely on that to encode
 * "no stored entity carries this label".
 *
 * @param children the disjuncts, copied into an immutable list
 */
public record Disjunction(List<Proposition> children) implements Proposition {

    /** Takes an immutable copy; null lists or null members are rejected. */
    public Disjunction {
        Objects.requireNonNull(children, "Disjunction requires a child list");
        children = List.copyOf(children);
    }

    /**
     * Convenience factory.
     *
     * @param children the disjuncts
     * @return a new disjunction
     */
    public static Disjunction of(final Proposition... children) {
        return new Disjunction(List.of(children));
    }

    /**
     * Pairwise mutual-exclusion clauses {@code (!a_i | !a_j)} for every
     * {@code i < j}.
     *
     * @return {@code n * (n - 1) / 2} two-literal disjunctions
     */
    public List<Proposition> pairwiseExclusions() {
        List<Proposition> exclusions = new ArrayList<>();
        for (int i = 0; i < children.size(); i++) {
            for (int j = i + 1; j < children.size(); j++) {
                exclusions.add(Disjunction.of(
                    new Negation(children.get(i)),
                    new Negation(children.get(j))));
            }
        }
        return exclusions;
    }
}
