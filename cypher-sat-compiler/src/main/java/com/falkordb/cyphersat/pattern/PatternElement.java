package com.falkordb.cyphersat.pattern;

import java.util.List;
import java.util.stream.Stream;

/**
 * A node of the pattern tree handed over by the query parser.
 *
 * <p>The shapes are closed: {@link EntityPattern}, {@link RelationshipChain}
 * and {@link PatternGroup} for every other construct (clauses, paths, the
 * query root). Consumers dispatch through {@link PatternVisitor}, so adding
 * a shape breaks every visitor at compile time instead of silently falling
 * through.</p>
 */
public sealed interface PatternElement
        permits EntityPattern, RelationshipChain, PatternGroup {

    /**
     * @return direct children in source order
     */
    List<PatternElement> children();

    /**
     * Dispatch to the visitor method for this shape.
     *
     * @param visitor the visitor
     * @param <R> visitor result type
     * @return the visitor's result
     */
    <R> R accept(PatternVisitor<R> visitor);

    /**
     * Pre-order, self-inclusive traversal.
     *
     * @return stream starting with this element
     */
    default Stream<PatternElement> walk() {
        return Stream.concat(Stream.of(this),
            children().stream().flatMap(PatternElement::walk));
    }
}
