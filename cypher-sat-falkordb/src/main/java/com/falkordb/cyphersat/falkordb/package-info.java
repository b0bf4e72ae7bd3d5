/**
 * FalkorDB backend for the pattern compiler.
 *
 * <p>{@link com.falkordb.cyphersat.falkordb.FalkorDBFactStore} answers
 * fact-store lookups with Cypher over the JFalkorDB driver;
 * {@link com.falkordb.cyphersat.falkordb.TracedGraph} wraps each driver call
 * in a CLIENT span.</p>
 */
package com.falkordb.cyphersat.falkordb;
