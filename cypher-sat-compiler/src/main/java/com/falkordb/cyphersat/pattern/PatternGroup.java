package com.falkordb.cyphersat.pattern;

import java.util.List;
import java.util.Objects;

/**
 * Any construct of the pattern tree that is neither a node pattern nor a
 * relationship chain: the query root, a MATCH clause, a comma-separated
 * pattern list and so on.
 *
 * @param kind free-form name of the construct, used in logs
 * @param children nested elements
 */
public record PatternGroup(String kind, List<PatternElement> children)
        implements PatternElement {

    /** Takes an immutable copy of the children. */
    public PatternGroup {
        Objects.requireNonNull(kind, "kind");
        children = List.copyOf(children);
    }

    /**
     * Convenience factory.
     *
     * @param kind the construct name
     * @param children nested elements
     * @return the group
     */
    public static PatternGroup of(final String kind,
            final PatternElement... children) {
        return new PatternGroup(kind, List.of(children));
    }

    @Override
    public <R> R accept(final PatternVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }
}
