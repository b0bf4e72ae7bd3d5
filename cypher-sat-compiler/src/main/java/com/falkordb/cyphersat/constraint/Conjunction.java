package com.falkordb.cyphersat.constraint;

import java.util.List;
import java.util.Objects;

/**
 * Logical AND over an ordered list of propositions. The empty conjunction is
 * {@code true}.
 *
 * @param children the conjuncts, copied into an immutable list
 */
public record Conjunction(List<Proposition> children) implements Proposition {

    /** Takes an immutable copy; null lists or null members are rejected. */
    public Conjunction {
        Objects.requireNonNull(children, "Conjunction requires a child list");
        children = List.copyOf(children);
    }

    /**
     * Convenience factory.
     *
     * @param children the conjuncts
     * @return a new conjunction
     */
    public static Conjunction of(final Proposition... children) {
        return new Conjunction(List.of(children));
    }
}
