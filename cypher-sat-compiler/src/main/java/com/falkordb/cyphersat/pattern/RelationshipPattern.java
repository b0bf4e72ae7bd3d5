package com.falkordb.cyphersat.pattern;

/**
 * The bracketed part of a chain, {@code [variable:label]}. Both parts are
 * optional; {@code -->} has neither.
 *
 * @param variable the relationship variable, or null if anonymous
 * @param label the relationship label, or null
 */
public record RelationshipPattern(String variable, String label) {

    /**
     * Anonymous, unconstrained edge.
     *
     * @return a pattern with neither variable nor label
     */
    public static RelationshipPattern anonymous() {
        return new RelationshipPattern(null, null);
    }

    /**
     * @return true if a variable name is present
     */
    public boolean hasVariable() {
        return variable != null && !variable.isBlank();
    }

    /**
     * @return true if a label is present
     */
    public boolean hasLabel() {
        return label != null && !label.isBlank();
    }
}
