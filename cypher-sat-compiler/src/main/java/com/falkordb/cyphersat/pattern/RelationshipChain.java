package com.falkordb.cyphersat.pattern;

import java.util.List;
import java.util.Objects;

/**
 * One hop of a path pattern: {@code (left)-[relationship]->(right)} or
 * {@code (left)<-[relationship]-(right)}.
 *
 * @param left the node pattern written first
 * @param relationship the relationship pattern
 * @param direction how the arrow points
 * @param right the node pattern written second
 */
public record RelationshipChain(EntityPattern left,
                                RelationshipPattern relationship,
                                Direction direction,
                                EntityPattern right)
        implements PatternElement {

    /** Rejects missing parts. */
    public RelationshipChain {
        Objects.requireNonNull(left, "Chain requires a left node pattern");
        Objects.requireNonNull(relationship,
            "Chain requires a relationship pattern");
        Objects.requireNonNull(direction, "Chain requires a direction");
        Objects.requireNonNull(right, "Chain requires a right node pattern");
    }

    /**
     * Outgoing chain {@code (source)-[relationship]->(target)}.
     *
     * @param source source node pattern
     * @param relationship relationship pattern
     * @param target target node pattern
     * @return the chain
     */
    public static RelationshipChain outgoing(final EntityPattern source,
            final RelationshipPattern relationship,
            final EntityPattern target) {
        return new RelationshipChain(source, relationship,
            Direction.OUTGOING, target);
    }

    /**
     * @return the node pattern at the tail of the arrow
     */
    public EntityPattern source() {
        return direction == Direction.OUTGOING ? left : right;
    }

    /**
     * @return the node pattern at the head of the arrow
     */
    public EntityPattern target() {
        return direction == Direction.OUTGOING ? right : left;
    }

    @Override
    public List<PatternElement> children() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(final PatternVisitor<R> visitor) {
        return visitor.visitChain(this);
    }
}
