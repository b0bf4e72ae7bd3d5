package com.falkordb.cyphersat.constraint;

import java.util.List;
import java.util.stream.Stream;

/**
 * A boolean statement about how query variables are bound to stored entities.
 *
 * <p>The hierarchy is closed: atoms ({@link NodeAssignment},
 * {@link RelationshipAssignment}) and the composite connectives
 * {@link Negation}, {@link Conjunction}, {@link Disjunction},
 * {@link ExactlyOne}, {@link AtMostOne} and {@link Implies}. Every
 * implementation is an immutable record, so two propositions are equal when
 * their trees are structurally equal and they can be used as set or map
 * keys.</p>
 */
public sealed interface Proposition
        permits AtomicProposition, Negation, Conjunction, Disjunction,
                ExactlyOne, AtMostOne, Implies {

    /**
     * Direct sub-propositions, in declaration order.
     *
     * @return immutable list of children, empty for atoms
     */
    List<Proposition> children();

    /**
     * Pre-order traversal of this proposition and all of its descendants.
     *
     * @return stream starting with this proposition
     */
    default Stream<Proposition> walk() {
        return Stream.concat(Stream.of(this),
            children().stream().flatMap(Proposition::walk));
    }
}
