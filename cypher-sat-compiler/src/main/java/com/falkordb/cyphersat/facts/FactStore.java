package com.falkordb.cyphersat.facts;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the stored graph, as needed by the constraint builders.
 *
 * <p>Implementations may block (for example on network I/O); the compiler
 * calls them synchronously on the caller's thread and never writes through
 * this interface. A store is injected into each solver so backends can be
 * swapped without touching the compiler.</p>
 */
public interface FactStore {

    /**
     * Ids of all nodes carrying the label.
     *
     * @param label the node label
     * @return node ids, empty if none match
     * @throws FactStoreException if the backend fails
     */
    List<String> entitiesWithLabel(String label);

    /**
     * Ids of all relationships carrying the label.
     *
     * @param label the relationship label
     * @return relationship ids, empty if none match
     * @throws FactStoreException if the backend fails
     */
    List<String> relationshipsWithLabel(String label);

    /**
     * Source node of a stored relationship.
     *
     * @param relationshipId the relationship id
     * @return the source node id, or empty if the store does not know it
     * @throws FactStoreException if the backend fails
     */
    Optional<String> sourceOf(String relationshipId);

    /**
     * Target node of a stored relationship.
     *
     * @param relationshipId the relationship id
     * @return the target node id, or empty if the store does not know it
     * @throws FactStoreException if the backend fails
     */
    Optional<String> targetOf(String relationshipId);
}
