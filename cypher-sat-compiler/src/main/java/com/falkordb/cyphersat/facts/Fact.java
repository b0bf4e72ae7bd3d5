package com.falkordb.cyphersat.facts;

/**
 * One atomic statement about the stored graph.
 */
public sealed interface Fact {

    /**
     * Node {@code nodeId} carries {@code label}.
     *
     * @param nodeId the node id
     * @param label the label
     */
    record NodeHasLabel(String nodeId, String label) implements Fact {
        /** Validates both fields. */
        public NodeHasLabel {
            requireText(nodeId, "nodeId");
            requireText(label, "label");
        }
    }

    /**
     * Relationship {@code relationshipId} carries {@code label}.
     *
     * @param relationshipId the relationship id
     * @param label the label
     */
    record RelationshipHasLabel(String relationshipId, String label)
            implements Fact {
        /** Validates both fields. */
        public RelationshipHasLabel {
            requireText(relationshipId, "relationshipId");
            requireText(label, "label");
        }
    }

    /**
     * Relationship {@code relationshipId} starts at {@code nodeId}.
     *
     * @param relationshipId the relationship id
     * @param nodeId the source node id
     */
    record RelationshipHasSourceNode(String relationshipId, String nodeId)
            implements Fact {
        /** Validates both fields. */
        public RelationshipHasSourceNode {
            requireText(relationshipId, "relationshipId");
            requireText(nodeId, "nodeId");
        }
    }

    /**
     * Relationship {@code relationshipId} ends at {@code nodeId}.
     *
     * @param relationshipId the relationship id
     * @param nodeId the target node id
     */
    record RelationshipHasTargetNode(String relationshipId, String nodeId)
            implements Fact {
        /** Validates both fields. */
        public RelationshipHasTargetNode {
            requireText(relationshipId, "relationshipId");
            requireText(nodeId, "nodeId");
        }
    }

    /**
     * @param value the value to check
     * @param name field name for the error message
     * @throws IllegalArgumentException if the value is null or blank
     */
    private static void requireText(final String value, final String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
