package com.falkordb.cyphersat.facts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fact store held entirely in memory.
 *
 * <p>Facts are indexed on insertion, so every query answers from a map
 * lookup and returns ids in the order their facts were added. Useful for
 * tests, demos and small embedded graphs.</p>
 *
 * <pre>{@code
 * InMemoryFactStore store = new InMemoryFactStore()
 *     .node("p1", "Person")
 *     .node("p2", "Person")
 *     .relationship("rel1", "KNOWS", "p1", "p2");
 * }</pre>
 *
 * <p>Not thread-safe for concurrent writes; concurrent reads after loading
 * are fine.</p>
 */
public final class InMemoryFactStore implements FactStore {

    /** Logger instance. */
    private static final Logger LOGGER =
        LoggerFactory.getLogger(InMemoryFactStore.class);

    /** Every fact, deduplicated, in insertion order. */
    private final Set<Fact> facts = new LinkedHashSet<>();

    /** Node label to node ids. */
    private final Map<String, Set<String>> nodesByLabel = new LinkedHashMap<>();

    /** Relationship label to relationship ids. */
    private final Map<String, Set<String>> relationshipsByLabel =
        new LinkedHashMap<>();

    /** Relationship id to source node id. */
    private final Map<String, String> sourceByRelationship = new LinkedHashMap<>();

    /** Relationship id to target node id. */
    private final Map<String, String> targetByRelationship = new LinkedHashMap<>();

    /**
     * Add one fact.
     *
     * @param fact the fact
     * @return true if the fact was new
     */
    public boolean add(final Fact fact) {
        if (fact == null) {
            throw new IllegalArgumentException("Fact cannot be null");
        }
        if (!facts.add(fact)) {
            return false;
        }
        if (fact instanceof Fact.NodeHasLabel f) {
            nodesByLabel.computeIfAbsent(f.label(), k -> new LinkedHashSet<>())
                .add(f.nodeId());
        } else if (fact instanceof Fact.RelationshipHasLabel f) {
            relationshipsByLabel.computeIfAbsent(f.label(),
                k -> new LinkedHashSet<>()).add(f.relationshipId());
        } else if (fact instanceof Fact.RelationshipHasSourceNode f) {
            String previous = replaceEndpoint(sourceByRelationship,
                f.relationshipId(), f.nodeId(), "source");
            if (previous != null) {
                facts.remove(new Fact.RelationshipHasSourceNode(
                    f.relationshipId(), previous));
            }
        } else if (fact instanceof Fact.RelationshipHasTargetNode f) {
            String previous = replaceEndpoint(targetByRelationship,
                f.relationshipId(), f.nodeId(), "target");
            if (previous != null) {
                facts.remove(new Fact.RelationshipHasTargetNode(
                    f.relationshipId(), previous));
            }
        }
        return true;
    }

    /**
     * Add several facts.
     *
     * @param toAdd the facts
     * @return this store
     */
    public InMemoryFactStore addAll(final Collection<? extends Fact> toAdd) {
        toAdd.forEach(this::add);
        return this;
    }

    /**
     * Record a labeled node.
     *
     * @param nodeId the node id
     * @param label the label
     * @return this store
     */
    public InMemoryFactStore node(final String nodeId, final String label) {
        add(new Fact.NodeHasLabel(nodeId, label));
        return this;
    }

    /**
     * Record a labeled relationship with its endpoints.
     *
     * @param relationshipId the relationship id
     * @param label the label
     * @param sourceId the source node id
     * @param targetId the target node id
     * @return this store
     */
    public InMemoryFactStore relationship(final String relationshipId,
            final String label, final String sourceId, final String targetId) {
        add(new Fact.RelationshipHasLabel(relationshipId, label));
        add(new Fact.RelationshipHasSourceNode(relationshipId, sourceId));
        add(new Fact.RelationshipHasTargetNode(relationshipId, targetId));
        return this;
    }

    /**
     * @param fact the fact to look for
     * @return true if the store holds it
     */
    public boolean contains(final Fact fact) {
        return facts.contains(fact);
    }

    /**
     * @return number of distinct facts
     */
    public int size() {
        return facts.size();
    }

    /**
     * @return true if no fact was added
     */
    public boolean isEmpty() {
        return facts.isEmpty();
    }

    @Override
    public List<String> entitiesWithLabel(final String label) {
        return new ArrayList<>(nodesByLabel.getOrDefault(label, Set.of()));
    }

    @Override
    public List<String> relationshipsWithLabel(final String label) {
        return new ArrayList<>(relationshipsByLabel.getOrDefault(label, Set.of()));
    }

    @Override
    public Optional<String> sourceOf(final String relationshipId) {
        return Optional.ofNullable(sourceByRelationship.get(relationshipId));
    }

    @Override
    public Optional<String> targetOf(final String relationshipId) {
        return Optional.ofNullable(targetByRelationship.get(relationshipId));
    }

    @Override
    public String toString() {
        return "InMemoryFactStore(" + facts.size() + ")";
    }

    /**
     * A relationship has exactly one endpoint per side; the latest fact wins.
     *
     * @return the replaced node id, or null if there was none
     */
    private String replaceEndpoint(final Map<String, String> endpoints,
            final String relationshipId, final String nodeId,
            final String role) {
        String previous = endpoints.put(relationshipId, nodeId);
        if (previous == null || previous.equals(nodeId)) {
            return null;
        }
        LOGGER.warn("Relationship {} {} changed from {} to {}",
            relationshipId, role, previous, nodeId);
        return previous;
    }
}
