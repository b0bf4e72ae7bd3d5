/**
 * CNF normalization and integer clause / DIMACS export.
 */
package com.falkordb.cyphersat.cnf;
