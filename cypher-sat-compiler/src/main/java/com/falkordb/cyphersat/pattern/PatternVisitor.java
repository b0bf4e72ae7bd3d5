package com.falkordb.cyphersat.pattern;

/**
 * Exhaustive dispatch over the pattern shapes.
 *
 * @param <R> result type
 */
public interface PatternVisitor<R> {

    /**
     * @param entity a node pattern such as {@code (n:Person)}
     * @return visitor result
     */
    R visitEntity(EntityPattern entity);

    /**
     * @param chain a pattern such as {@code (n)-[r:KNOWS]->(m)}
     * @return visitor result
     */
    R visitChain(RelationshipChain chain);

    /**
     * @param group any other construct
     * @return visitor result
     */
    R visitGroup(PatternGroup group);
}
