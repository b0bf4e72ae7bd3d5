package com.falkordb.cyphersat.pattern;

/**
 * Extracted relationship chain, with direction already resolved into source
 * and target. Endpoints are referenced by variable name.
 *
 * @param relationshipVariable the relationship variable, or null if anonymous
 * @param relationshipLabel the relationship label, or null
 * @param sourceVariable variable of the source node pattern
 * @param targetVariable variable of the target node pattern
 */
public record ChainElement(String relationshipVariable,
                           String relationshipLabel,
                           String sourceVariable,
                           String targetVariable) {

    /**
     * A chain is constrained when it names a relationship variable and a
     * label to draw candidates from. Other chains add no propositions.
     *
     * @return true if the builders should encode this chain
     */
    public boolean isConstrained() {
        return relationshipVariable != null && !relationshipVariable.isBlank()
            && relationshipLabel != null && !relationshipLabel.isBlank();
    }
}
