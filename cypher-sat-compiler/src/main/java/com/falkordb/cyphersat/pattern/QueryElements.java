package com.falkordb.cyphersat.pattern;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Result of one extraction pass over a pattern tree.
 *
 * @param nodes entity-variable patterns in traversal order
 * @param chains relationship chains in traversal order
 */
public record QueryElements(List<NodeElement> nodes, List<ChainElement> chains) {

    /** Takes immutable copies. */
    public QueryElements {
        nodes = List.copyOf(nodes);
        chains = List.copyOf(chains);
    }

    /**
     * @return the distinct node variable names
     */
    public Set<String> nodeVariables() {
        return nodes.stream()
            .map(NodeElement::variable)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * @return true if no shape of interest was found
     */
    public boolean isEmpty() {
        return nodes.isEmpty() && chains.isEmpty();
    }
}
