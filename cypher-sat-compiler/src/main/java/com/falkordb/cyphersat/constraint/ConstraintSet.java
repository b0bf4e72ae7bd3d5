package com.falkordb.cyphersat.constraint;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The top-level propositions of one query solve, implicitly AND'd together.
 *
 * <p>Duplicates collapse. Members keep their insertion order so that the
 * integer ids handed to the SAT stage are deterministic.</p>
 *
 * <p>The set owns the bijection between its atomic propositions and the
 * positive integers 1..n. The mapping is computed on first request and
 * cached; from then on the set is frozen and {@link #add(Proposition)}
 * fails, so ids stay stable for the lifetime of the instance. A constraint
 * set belongs to a single solve and must not be reused across queries.</p>
 */
public final class ConstraintSet implements Iterable<Proposition> {

    /** Top-level members in insertion order. */
    private final Set<Proposition> constraints = new LinkedHashSet<>();

    /** Cached atom-to-id mapping, null until first requested. */
    private Map<AtomicProposition, Integer> idMapping;

    /** Create an empty constraint set. */
    public ConstraintSet() {
        // Empty
    }

    /**
     * Create a constraint set holding the given propositions.
     *
     * @param initial the initial members
     */
    public ConstraintSet(final Collection<? extends Proposition> initial) {
        initial.forEach(this::add);
    }

    /**
     * Add a top-level proposition.
     *
     * @param constraint the proposition to add
     * @return true if the set did not already contain it
     * @throws IllegalStateException if the id mapping was already computed
     */
    public boolean add(final Proposition constraint) {
        Objects.requireNonNull(constraint, "constraint");
        if (idMapping != null) {
            throw new IllegalStateException(
                "Constraint set is frozen once its id mapping has been computed");
        }
        return constraints.add(constraint);
    }

    /**
     * @param constraint the proposition to look for
     * @return true if it is a top-level member
     */
    public boolean contains(final Proposition constraint) {
        return constraints.contains(constraint);
    }

    /**
     * @return the number of top-level members
     */
    public int size() {
        return constraints.size();
    }

    /**
     * @return true if the set has no members
     */
    public boolean isEmpty() {
        return constraints.isEmpty();
    }

    @Override
    public Iterator<Proposition> iterator() {
        return Collections.unmodifiableSet(constraints).iterator();
    }

    /**
     * @return the top-level members in insertion order
     */
    public Stream<Proposition> stream() {
        return constraints.stream();
    }

    /**
     * Pre-order traversal of every member and its descendants.
     *
     * @return stream of all reachable propositions
     */
    public Stream<Proposition> walk() {
        return constraints.stream().flatMap(Proposition::walk);
    }

    /**
     * The set viewed as a single proposition.
     *
     * @return a conjunction of the members in insertion order
     */
    public Conjunction asConjunction() {
        return new Conjunction(new ArrayList<>(constraints));
    }

    /**
     * Distinct atomic assignments of a variable reachable from the members,
     * in first-encountered order.
     *
     * @param variable the query variable
     * @return the node or relationship assignments of that variable
     */
    public List<AtomicProposition> assignmentsOf(final String variable) {
        return walk()
            .filter(AtomicProposition.class::isInstance)
            .map(AtomicProposition.class::cast)
            .filter(atom -> atom.variable().equals(variable))
            .distinct()
            .collect(Collectors.toList());
    }

    /**
     * Whether every member is in conjunctive normal form.
     *
     * @return true if the set can be exported as clauses
     */
    public boolean isNormalized() {
        return constraints.stream().allMatch(NormalForms::isCnf);
    }

    /**
     * Stable bijection from atomic propositions to 1-based integers. Atoms
     * are numbered in first-encountered pre-order over the members. Computing
     * the mapping freezes the set.
     *
     * @return unmodifiable mapping from atom to id
     * @throws IllegalStateException if the set is not normalized
     */
    public Map<AtomicProposition, Integer> idMapping() {
        if (idMapping == null) {
            if (!isNormalized()) {
                throw new IllegalStateException(
                    "Id mapping requires a normalized constraint set");
            }
            Map<AtomicProposition, Integer> mapping = new LinkedHashMap<>();
            walk().filter(AtomicProposition.class::isInstance)
                .map(AtomicProposition.class::cast)
                .forEach(atom -> mapping.putIfAbsent(atom, mapping.size() + 1));
            idMapping = Collections.unmodifiableMap(mapping);
        }
        return idMapping;
    }

    @Override
    public String toString() {
        return "ConstraintSet(" + constraints.size() + ")";
    }
}
