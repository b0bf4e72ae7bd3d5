package com.falkordb.cyphersat.solver;

import com.falkordb.cyphersat.cnf.ClauseSet;

/**
 * A SAT routine: clauses in, model or UNSAT out. Treated as an opaque,
 * possibly long-running call.
 */
@FunctionalInterface
public interface SatSolver {

    /**
     * @param clauses the problem
     * @return a model, or {@link SatResult#unsat()}
     * @throws SatSolverException if the routine fails without a verdict
     */
    SatResult solve(ClauseSet clauses);
}
