/**
 * Constraint builders, run in order: node candidates, relationship
 * candidates, then endpoint implications.
 *
 * <p>Each builder queries a {@link com.falkordb.cyphersat.facts.FactStore}
 * and adds to a shared {@link com.falkordb.cyphersat.constraint.ConstraintSet}.
 * The endpoint pass reads back the candidates of the relationship pass, so
 * the order is fixed.</p>
 */
package com.falkordb.cyphersat.compiler;
