package com.falkordb.cyphersat.constraint;

/**
 * Structural checks for the shapes produced by CNF normalization.
 *
 * <ul>
 *   <li><strong>Literal</strong>: an atom or the negation of an atom</li>
 *   <li><strong>Clause</strong>: a literal, or a disjunction of literals</li>
 *   <li><strong>CNF</strong>: a clause, or a conjunction of clauses</li>
 * </ul>
 */
public final class NormalForms {

    /** Prevent instantiation. */
    private NormalForms() {
        throw new AssertionError("No instances");
    }

    /**
     * @param proposition the proposition to inspect
     * @return true for an atom or a negated atom
     */
    public static boolean isLiteral(final Proposition proposition) {
        if (proposition instanceof AtomicProposition) {
            return true;
        }
        return proposition instanceof Negation negation
            && negation.child() instanceof AtomicProposition;
    }

    /**
     * @param proposition the proposition to inspect
     * @return true for a literal or a disjunction of literals
     */
    public static boolean isClause(final Proposition proposition) {
        if (isLiteral(proposition)) {
            return true;
        }
        return proposition instanceof Disjunction disjunction
            && disjunction.children().stream().allMatch(NormalForms::isLiteral);
    }

    /**
     * @param proposition the proposition to inspect
     * @return true for a clause or a conjunction of clauses
     */
    public static boolean isCnf(final Proposition proposition) {
        if (isClause(proposition)) {
            return true;
        }
        return proposition instanceof Conjunction conjunction
            && conjunction.children().stream().allMatch(NormalForms::isClause);
    }
}
