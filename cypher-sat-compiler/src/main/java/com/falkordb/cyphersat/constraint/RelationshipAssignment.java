package com.falkordb.cyphersat.constraint;

/**
 * Relationship variable {@code variable} is bound to the stored relationship
 * {@code entityId}.
 *
 * @param variable the relationship variable of the pattern
 * @param entityId id of a stored relationship
 */
public record RelationshipAssignment(String variable, String entityId)
        implements AtomicProposition {

    /**
     * Validates both identifiers.
     *
     * @throws IllegalArgumentException if either identifier is null or blank
     */
    public RelationshipAssignment {
        if (variable == null || variable.isBlank()) {
            throw new IllegalArgumentException(
                "Relationship assignment requires a variable name");
        }
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException(
                "Relationship assignment requires a relationship id for variable "
                    + variable);
        }
    }

    @Override
    public String toString() {
        return "RelationshipAssignment(" + variable + " -> " + entityId + ")";
    }
}
