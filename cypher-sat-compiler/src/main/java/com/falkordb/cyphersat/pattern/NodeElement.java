package com.falkordb.cyphersat.pattern;

/**
 * Extracted entity-variable pattern: variable {@code variable} must be bound
 * to a node carrying {@code label}.
 *
 * @param variable the node variable
 * @param label the required label
 */
public record NodeElement(String variable, String label) {
}
