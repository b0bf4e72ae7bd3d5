package com.falkordb.cyphersat.solver;

import com.falkordb.cyphersat.constraint.AtomicProposition;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns the atoms a SAT model sets to true into a {@link Binding}.
 *
 * <p>The exactly-one constraints guarantee a single true assignment per
 * variable. If the input still holds several, the last one wins; this is not
 * re-validated.</p>
 */
public final class SolutionInterpreter {

    /** Private constructor to prevent instantiation. */
    private SolutionInterpreter() {
        // Utility class
    }

    /**
     * @param trueAtoms node and relationship assignments judged true
     * @return variable to entity id
     */
    public static Binding interpret(
            final Collection<? extends AtomicProposition> trueAtoms) {
        Map<String, String> assignments = new LinkedHashMap<>();
        for (AtomicProposition atom : trueAtoms) {
            assignments.put(atom.variable(), atom.entityId());
        }
        return new Binding(assignments);
    }
}
