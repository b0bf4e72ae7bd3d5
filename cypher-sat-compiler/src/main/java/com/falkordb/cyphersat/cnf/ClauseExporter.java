package com.falkordb.cyphersat.cnf;

import com.falkordb.cyphersat.constraint.AtomicProposition;
import com.falkordb.cyphersat.constraint.Conjunction;
import com.falkordb.cyphersat.constraint.ConstraintSet;
import com.falkordb.cyphersat.constraint.Disjunction;
import com.falkordb.cyphersat.constraint.Negation;
import com.falkordb.cyphersat.constraint.Proposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exports a normalized {@link ConstraintSet} as integer clauses or DIMACS
 * text.
 *
 * <p>Ids come from {@link ConstraintSet#idMapping()}: a bare atom becomes
 * {@code +id}, a negated atom {@code -id}. The exporter never normalizes on
 * its own; passing a set that is not in CNF is a programming error.</p>
 */
public final class ClauseExporter {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(ClauseExporter.class);

    /** Private constructor to prevent instantiation. */
    private ClauseExporter() {
        // Utility class
    }

    /**
     * Flatten a normalized set into integer clauses.
     *
     * @param normalized a set whose members are all in CNF
     * @return clauses with forward and reverse id maps
     * @throws IllegalStateException if the set is not normalized
     */
    public static ClauseSet clauses(final ConstraintSet normalized) {
        requireNormalized(normalized);

        Map<AtomicProposition, Integer> forward = normalized.idMapping();
        Map<Integer, AtomicProposition> reverse = new LinkedHashMap<>();
        for (Map.Entry<AtomicProposition, Integer> entry : forward.entrySet()) {
            reverse.put(entry.getValue(), entry.getKey());
        }

        List<List<Integer>> clauses = new ArrayList<>();
        for (Proposition member : normalized) {
            if (member instanceof Conjunction conjunction) {
                for (Proposition clause : conjunction.children()) {
                    clauses.add(encodeClause(clause, forward));
                }
            } else {
                clauses.add(encodeClause(member, forward));
            }
        }

        LOGGER.debug("Exported {} clauses over {} variables",
            clauses.size(), forward.size());
        return new ClauseSet(clauses, forward, reverse);
    }

    /**
     * Render a normalized set as DIMACS CNF text.
     *
     * @param normalized a set whose members are all in CNF
     * @param comment text of the leading comment line
     * @return the DIMACS document
     * @throws IllegalStateException if the set is not normalized
     */
    public static String toDimacs(final ConstraintSet normalized,
                                  final String comment) {
        return clauses(normalized).toDimacs(comment);
    }

    private static void requireNormalized(final ConstraintSet constraints) {
        if (!constraints.isNormalized()) {
            throw new IllegalStateException(
                "Constraint set must be normalized before export");
        }
    }

    private static List<Integer> encodeClause(final Proposition clause,
            final Map<AtomicProposition, Integer> ids) {
        List<Integer> literals = new ArrayList<>();
        if (clause instanceof Disjunction disjunction) {
            for (Proposition literal : disjunction.children()) {
                literals.add(encodeLiteral(literal, ids));
            }
        } else {
            literals.add(encodeLiteral(clause, ids));
        }
        return literals;
    }

    private static int encodeLiteral(final Proposition literal,
            final Map<AtomicProposition, Integer> ids) {
        if (literal instanceof AtomicProposition atom) {
            return ids.get(atom);
        }
        if (literal instanceof Negation negation
                && negation.child() instanceof AtomicProposition atom) {
            return -ids.get(atom);
        }
        throw new IllegalStateException("Not a literal: " + literal);
    }
}
