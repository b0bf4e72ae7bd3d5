package com.falkordb.cyphersat.solver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One query result: each pattern variable mapped to the id of the stored
 * node or relationship it is bound to.
 *
 * @param assignments variable name to entity id
 */
public record Binding(Map<String, String> assignments) {

    /** Takes an immutable, order-preserving copy. */
    public Binding {
        assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
    }

    /**
     * @param variable a pattern variable
     * @return the bound entity id, if the variable is bound
     */
    public Optional<String> get(final String variable) {
        return Optional.ofNullable(assignments.get(variable));
    }

    /**
     * @return the bound variable names
     */
    public Set<String> variables() {
        return assignments.keySet();
    }

    /**
     * @return the binding as a map
     */
    public Map<String, String> asMap() {
        return assignments;
    }
}
