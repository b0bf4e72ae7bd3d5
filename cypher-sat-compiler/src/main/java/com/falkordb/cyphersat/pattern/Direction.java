package com.falkordb.cyphersat.pattern;

/**
 * Direction of a relationship as written in the pattern.
 */
public enum Direction {
    /** {@code (left)-[r]->(right)}: left is the source. */
    OUTGOING,

    /** {@code (left)<-[r]-(right)}: right is the source. */
    INCOMING
}
