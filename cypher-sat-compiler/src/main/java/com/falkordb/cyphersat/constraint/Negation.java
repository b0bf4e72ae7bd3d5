package com.falkordb.cyphersat.constraint;

import java.util.List;
import java.util.Objects;

/**
 * Logical NOT of a single proposition.
 *
 * @param child the negated proposition
 */
public record Negation(Proposition child) implements Proposition {

    /** Rejects a missing child. */
    public Negation {
        Objects.requireNonNull(child, "Negation requires a child proposition");
    }

    @Override
    public List<Proposition> children() {
        return List.of(child);
    }
}
