package com.falkordb.cyphersat.cnf;

import com.falkordb.cyphersat.constraint.AtMostOne;
import com.falkordb.cyphersat.constraint.AtomicProposition;
import com.falkordb.cyphersat.constraint.Conjunction;
import com.falkordb.cyphersat.constraint.ConstraintSet;
import com.falkordb.cyphersat.constraint.Disjunction;
import com.falkordb.cyphersat.constraint.ExactlyOne;
import com.falkordb.cyphersat.constraint.Implies;
import com.falkordb.cyphersat.constraint.Negation;
import com.falkordb.cyphersat.constraint.Proposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites propositions into conjunctive normal form.
 *
 * <h2>Rewrite rules:</h2>
 * <ul>
 *   <li>{@code !!x} becomes {@code x}</li>
 *   <li>{@code !(a & b)} becomes {@code !a | !b}, {@code !(a | b)} becomes
 *       {@code !a & !b}</li>
 *   <li>{@code P -> Q} becomes {@code !P | Q}</li>
 *   <li>{@code ExactlyOne(a1 | ... | an)} becomes the clause
 *       {@code a1 | ... | an} plus {@code !ai | !aj} for every {@code i < j}</li>
 *   <li>{@code AtMostOne(a1 | ... | an)} becomes the {@code !ai | !aj}
 *       clauses only</li>
 *   <li>Nested conjunctions flatten; a disjunction over conjunctions is
 *       distributed, {@code (A & B) | C} becoming {@code (A | C) & (B | C)}</li>
 * </ul>
 *
 * <h2>Output shape:</h2>
 * <p>A single literal is returned as is ({@code a} or {@code !a}). A single
 * clause with zero or several literals is a {@link Disjunction}; the empty
 * disjunction is {@code false}. Anything else is a {@link Conjunction} of
 * such clauses; the empty conjunction is {@code true}. Normalizing an
 * output again returns it unchanged.</p>
 *
 * <p>Distribution is exponential in formula depth in the worst case. The
 * builders only produce shallow formulas, so no Tseitin encoding is
 * applied.</p>
 */
public final class CnfNormalizer {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(CnfNormalizer.class);

    /** Private constructor to prevent instantiation. */
    private CnfNormalizer() {
        // Utility class
    }

    /**
     * Normalize a single proposition.
     *
     * @param proposition any proposition
     * @return an equivalent proposition in conjunctive normal form
     */
    public static Proposition normalize(final Proposition proposition) {
        List<List<Proposition>> clauses = clausesOf(proposition);
        if (clauses.size() == 1) {
            return toClause(clauses.get(0));
        }
        List<Proposition> conjuncts = new ArrayList<>(clauses.size());
        for (List<Proposition> clause : clauses) {
            conjuncts.add(toClause(clause));
        }
        return new Conjunction(conjuncts);
    }

    /**
     * Normalize a whole constraint set, read as the conjunction of its
     * members. Each clause of the result becomes one member of a fresh set;
     * duplicate clauses collapse.
     *
     * @param constraints the set to normalize, left unchanged
     * @return a new, normalized constraint set
     */
    public static ConstraintSet normalize(final ConstraintSet constraints) {
        ConstraintSet normalized = new ConstraintSet();
        int clauseCount = 0;
        for (Proposition constraint : constraints) {
            for (List<Proposition> clause : clausesOf(constraint)) {
                normalized.add(toClause(clause));
                clauseCount++;
            }
        }
        LOGGER.debug("Normalized {} constraints into {} clauses ({} distinct)",
            constraints.size(), clauseCount, normalized.size());
        return normalized;
    }

    /**
     * Clause list of a proposition. Each inner list is one disjunction of
     * literals; a literal is an atom or a negated atom.
     */
    private static List<List<Proposition>> clausesOf(final Proposition proposition) {
        if (proposition instanceof AtomicProposition) {
            return singleton(proposition);
        }
        if (proposition instanceof Negation negation) {
            return clausesOfNegation(negation.child());
        }
        if (proposition instanceof Conjunction conjunction) {
            List<List<Proposition>> clauses = new ArrayList<>();
            for (Proposition child : conjunction.children()) {
                clauses.addAll(clausesOf(child));
            }
            return clauses;
        }
        if (proposition instanceof Disjunction disjunction) {
            List<List<List<Proposition>>> parts = new ArrayList<>();
            for (Proposition child : disjunction.children()) {
                parts.add(clausesOf(child));
            }
            return distribute(parts);
        }
        if (proposition instanceof Implies implies) {
            return clausesOf(Disjunction.of(
                new Negation(implies.antecedent()), implies.consequent()));
        }
        if (proposition instanceof ExactlyOne exactlyOne) {
            return clausesOf(expand(exactlyOne));
        }
        if (proposition instanceof AtMostOne atMostOne) {
            return clausesOf(expand(atMostOne));
        }
        throw new IllegalStateException("Unknown proposition: " + proposition);
    }

    /**
     * Clause list of {@code !child}, pushing the negation down syntactically
     * so that {@code !!x} normalizes exactly like {@code x}.
     */
    private static List<List<Proposition>> clausesOfNegation(final Proposition child) {
        if (child instanceof AtomicProposition) {
            return singleton(new Negation(child));
        }
        if (child instanceof Negation negation) {
            return clausesOf(negation.child());
        }
        if (child instanceof Conjunction conjunction) {
            return clausesOf(new Disjunction(negateAll(conjunction.children())));
        }
        if (child instanceof Disjunction disjunction) {
            return clausesOf(new Conjunction(negateAll(disjunction.children())));
        }
        if (child instanceof Implies implies) {
            return clausesOf(Conjunction.of(
                implies.antecedent(), new Negation(implies.consequent())));
        }
        if (child instanceof ExactlyOne exactlyOne) {
            return clausesOfNegation(expand(exactlyOne));
        }
        if (child instanceof AtMostOne atMostOne) {
            return clausesOfNegation(expand(atMostOne));
        }
        throw new IllegalStateException("Unknown proposition: " + child);
    }

    private static Conjunction expand(final ExactlyOne exactlyOne) {
        Disjunction candidates = exactlyOne.disjunction();
        List<Proposition> parts = new ArrayList<>();
        parts.add(candidates);
        parts.addAll(candidates.pairwiseExclusions());
        return new Conjunction(parts);
    }

    private static Conjunction expand(final AtMostOne atMostOne) {
        return new Conjunction(atMostOne.disjunction().pairwiseExclusions());
    }

    /**
     * OR of several clause lists: the cross product of their clauses. A part
     * with no clauses is {@code true} and absorbs the whole disjunction; no
     * parts at all yield the single empty clause.
     */
    private static List<List<Proposition>> distribute(
            final List<List<List<Proposition>>> parts) {
        List<List<Proposition>> result = new ArrayList<>();
        result.add(new ArrayList<>());
        for (List<List<Proposition>> part : parts) {
            List<List<Proposition>> next = new ArrayList<>(result.size() * part.size());
            for (List<Proposition> prefix : result) {
                for (List<Proposition> clause : part) {
                    List<Proposition> combined = new ArrayList<>(prefix);
                    combined.addAll(clause);
                    next.add(combined);
                }
            }
            result = next;
        }
        return result;
    }

    private static List<Proposition> negateAll(final List<Proposition> children) {
        List<Proposition> negated = new ArrayList<>(children.size());
        for (Proposition child : children) {
            negated.add(new Negation(child));
        }
        return negated;
    }

    private static List<List<Proposition>> singleton(final Proposition literal) {
        List<List<Proposition>> clauses = new ArrayList<>();
        clauses.add(List.of(literal));
        return clauses;
    }

    private static Proposition toClause(final List<Proposition> literals) {
        if (literals.size() == 1) {
            return literals.get(0);
        }
        return new Disjunction(literals);
    }
}
