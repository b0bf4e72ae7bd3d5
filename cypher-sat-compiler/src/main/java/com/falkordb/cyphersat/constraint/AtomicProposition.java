package com.falkordb.cyphersat.constraint;

import java.util.List;

/**
 * Leaf proposition: "query variable {@code variable} is bound to stored
 * entity {@code entityId}".
 */
public sealed interface AtomicProposition extends Proposition
        permits NodeAssignment, RelationshipAssignment {

    /**
     * @return the query variable name
     */
    String variable();

    /**
     * @return the id of the stored node or relationship
     */
    String entityId();

    @Override
    default List<Proposition> children() {
        return List.of();
    }
}
