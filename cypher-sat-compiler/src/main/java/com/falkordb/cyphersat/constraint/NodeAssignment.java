package com.falkordb.cyphersat.constraint;

/**
 * Node variable {@code variable} is bound to the stored node
 * {@code entityId}.
 *
 * @param variable the node variable of the pattern
 * @param entityId id of a stored node
 */
public record NodeAssignment(String variable, String entityId)
        implements AtomicProposition {

    /**
     * Validates both identifiers.
     *
     * @throws IllegalArgumentException if either identifier is null or blank
     */
    public NodeAssignment {
        if (variable == null || variable.isBlank()) {
            throw new IllegalArgumentException(
                "Node assignment requires a variable name");
        }
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException(
                "Node assignment requires a node id for variable " + variable);
        }
    }

    @Override
    public String toString() {
        return "NodeAssignment(" + variable + " -> " + entityId + ")";
    }
}
