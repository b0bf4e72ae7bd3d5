package com.falkordb.cyphersat.solver;

import com.falkordb.cyphersat.cnf.ClauseSet;
import org.sat4j.core.VecInt;
import org.sat4j.minisat.SolverFactory;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.ISolver;
import org.sat4j.specs.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link SatSolver} backed by the Sat4j MiniSat-style solver. A fresh Sat4j
 * instance is created per call.
 */
public final class Sat4jSolver implements SatSolver {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(Sat4jSolver.class);

    /** Default time budget per call, in seconds. */
    public static final int DEFAULT_TIMEOUT_SECONDS = 60;

    /** Time budget per call, in seconds. */
    private final int timeoutSeconds;

    /** Solver with the default time budget. */
    public Sat4jSolver() {
        this(DEFAULT_TIMEOUT_SECONDS);
    }

    /**
     * @param timeoutSeconds time budget per call, in seconds
     */
    public Sat4jSolver(final int timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public SatResult solve(final ClauseSet clauses) {
        ISolver solver = SolverFactory.newDefault();
        solver.setTimeout(timeoutSeconds);
        solver.newVar(clauses.variableCount());
        solver.setExpectedNumberOfClauses(clauses.clauseCount());

        try {
            for (List<Integer> clause : clauses.clauses()) {
                if (clause.isEmpty()) {
                    LOGGER.debug("Empty clause present; problem is unsatisfiable");
                    return SatResult.unsat();
                }
                solver.addClause(new VecInt(
                    clause.stream().mapToInt(Integer::intValue).toArray()));
            }
            if (!solver.isSatisfiable()) {
                return SatResult.unsat();
            }
            List<Integer> model = new ArrayList<>();
            for (int literal : solver.model()) {
                model.add(literal);
            }
            return SatResult.sat(model);
        } catch (ContradictionException e) {
            LOGGER.debug("Contradiction while loading clauses: {}", e.getMessage());
            return SatResult.unsat();
        } catch (TimeoutException e) {
            throw new SatSolverException("SAT solver timed out after "
                + timeoutSeconds + "s on " + clauses.clauseCount() + " clauses", e);
        } finally {
            solver.reset();
        }
    }
}
