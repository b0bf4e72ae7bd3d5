package com.falkordb.cyphersat.solver;

import java.util.List;

/**
 * Outcome of one SAT call.
 *
 * @param satisfiable whether a model was found
 * @param model signed literals of the model, empty when unsatisfiable
 */
public record SatResult(boolean satisfiable, List<Integer> model) {

    /** Takes an immutable copy of the model. */
    public SatResult {
        model = List.copyOf(model);
    }

    /**
     * @param model the literals of the model
     * @return a satisfiable result
     */
    public static SatResult sat(final List<Integer> model) {
        return new SatResult(true, model);
    }

    /**
     * @return an unsatisfiable result
     */
    public static SatResult unsat() {
        return new SatResult(false, List.of());
    }
}
