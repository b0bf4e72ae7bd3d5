/**
 * Propositional constraint model.
 *
 * <p>Atoms assign a query variable to a graph entity id
 * ({@link com.falkordb.cyphersat.constraint.NodeAssignment},
 * {@link com.falkordb.cyphersat.constraint.RelationshipAssignment}).
 * Compound propositions are immutable records with structural equality, so
 * equal formulas collapse inside a
 * {@link com.falkordb.cyphersat.constraint.ConstraintSet}.</p>
 *
 * <p>A constraint set is read as the conjunction of its members. Once its
 * id mapping has been computed it rejects further additions.</p>
 */
package com.falkordb.cyphersat.constraint;
