/**
 * SAT solving and the query-level facade.
 *
 * <p>{@link com.falkordb.cyphersat.solver.CypherQuerySolver} drives the whole
 * pipeline. {@link com.falkordb.cyphersat.solver.SatSolver} is the seam for
 * plugging in a SAT routine; {@link com.falkordb.cyphersat.solver.Sat4jSolver}
 * is the bundled one.</p>
 */
package com.falkordb.cyphersat.solver;
