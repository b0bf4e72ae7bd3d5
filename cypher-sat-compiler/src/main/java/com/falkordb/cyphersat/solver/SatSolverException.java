package com.falkordb.cyphersat.solver;

/**
 * The SAT routine failed to reach a verdict (timeout, backend error).
 */
public class SatSolverException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message description of the failure
     * @param cause the backend error
     */
    public SatSolverException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
