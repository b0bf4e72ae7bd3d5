package com.falkordb.cyphersat.pattern;

import java.util.List;

/**
 * Node pattern {@code (variable:label)}. The label is optional: a bare
 * {@code (m)} refers back to a variable labeled elsewhere in the query.
 *
 * @param variable the node variable, never blank
 * @param label the required label, or null for a bare reference
 */
public record EntityPattern(String variable, String label)
        implements PatternElement {

    /**
     * @throws IllegalArgumentException if the variable is missing
     */
    public EntityPattern {
        if (variable == null || variable.isBlank()) {
            throw new IllegalArgumentException(
                "Entity pattern requires a variable name");
        }
    }

    /**
     * Bare reference to a node variable.
     *
     * @param variable the node variable
     * @return an unlabeled pattern
     */
    public static EntityPattern reference(final String variable) {
        return new EntityPattern(variable, null);
    }

    /**
     * @return true if the pattern constrains the node's label
     */
    public boolean hasLabel() {
        return label != null && !label.isBlank();
    }

    @Override
    public List<PatternElement> children() {
        return List.of();
    }

    @Override
    public <R> R accept(final PatternVisitor<R> visitor) {
        return visitor.visitEntity(this);
    }
}
