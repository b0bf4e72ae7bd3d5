package com.falkordb.cyphersat.compiler;

import com.falkordb.cyphersat.constraint.AtomicProposition;
import com.falkordb.cyphersat.constraint.ConstraintSet;
import com.falkordb.cyphersat.constraint.Implies;
import com.falkordb.cyphersat.constraint.Negation;
import com.falkordb.cyphersat.constraint.NodeAssignment;
import com.falkordb.cyphersat.constraint.RelationshipAssignment;
import com.falkordb.cyphersat.facts.FactStore;
import com.falkordb.cyphersat.pattern.ChainElement;
import com.falkordb.cyphersat.pattern.NodeElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Third pass: choosing a relationship forces its endpoint variables onto the
 * relationship's stored endpoints.
 *
 * <p>For chain {@code (n)-[r:KNOWS]->(m)} and every candidate {@code r -> rel}
 * added by the relationship pass, with {@code rel} stored as
 * {@code s -[rel]-> t}, this adds:</p>
 * <pre>{@code
 * Implies(r -> rel, n -> s)
 * Implies(r -> rel, m -> t)
 * }</pre>
 *
 * <p>Without these implications node and relationship choices would be
 * independent and the solver could return bindings that are not a path in
 * the graph. A candidate can never be part of a match, and is negated
 * instead, when the store does not know its endpoints or when a stored
 * endpoint is not among the node candidates of the endpoint variable (for
 * example a {@code KNOWS} edge leaving a {@code Company} queried as
 * {@code (n:Person)-[r:KNOWS]->(m:Person)}).</p>
 */
public final class EndpointConstraintBuilder {

    /** Logger instance. */
    private static final Logger LOGGER =
        LoggerFactory.getLogger(EndpointConstraintBuilder.class);

    /** Source of relationship endpoints. */
    private final FactStore factStore;

    /**
     * @param factStore store queried for endpoints
     */
    public EndpointConstraintBuilder(final FactStore factStore) {
        this.factStore = Objects.requireNonNull(factStore, "factStore");
    }

    /**
     * Add the endpoint implications of every constrained chain.
     *
     * @param chains extracted relationship chains
     * @param nodes extracted node patterns, used to resolve endpoint names
     * @param constraints the set populated by the node and relationship passes
     * @throws MalformedQueryException if a chain names an endpoint variable
     *         that no node pattern declares
     */
    public void build(final List<ChainElement> chains,
                      final List<NodeElement> nodes,
                      final ConstraintSet constraints) {
        Set<String> nodeVariables = nodes.stream()
            .map(NodeElement::variable)
            .collect(Collectors.toSet());
        Map<String, Set<String>> nodeCandidates = new HashMap<>();
        for (String variable : nodeVariables) {
            nodeCandidates.put(variable, candidatesOf(variable, constraints));
        }

        for (ChainElement chain : chains) {
            if (!chain.isConstrained()) {
                continue;
            }
            requireDeclared(chain, chain.sourceVariable(), nodeVariables);
            requireDeclared(chain, chain.targetVariable(), nodeVariables);

            int implications = 0;
            for (AtomicProposition candidate
                    : constraints.assignmentsOf(chain.relationshipVariable())) {
                if (!(candidate instanceof RelationshipAssignment assignment)) {
                    continue;
                }
                String relationshipId = assignment.entityId();
                Optional<String> source = factStore.sourceOf(relationshipId);
                Optional<String> target = factStore.targetOf(relationshipId);
                if (source.isEmpty() || target.isEmpty()) {
                    LOGGER.warn("Relationship {} has no stored {}; excluding it from {}",
                        relationshipId, source.isEmpty() ? "source" : "target",
                        chain.relationshipVariable());
                    constraints.add(new Negation(assignment));
                    continue;
                }
                if (!nodeCandidates.get(chain.sourceVariable()).contains(source.get())
                        || !nodeCandidates.get(chain.targetVariable()).contains(target.get())) {
                    LOGGER.debug("Relationship {} joins {} and {} outside the candidates of"
                        + " ({})->({}); excluding it", relationshipId, source.get(),
                        target.get(), chain.sourceVariable(), chain.targetVariable());
                    constraints.add(new Negation(assignment));
                    continue;
                }
                constraints.add(new Implies(assignment,
                    new NodeAssignment(chain.sourceVariable(), source.get())));
                constraints.add(new Implies(assignment,
                    new NodeAssignment(chain.targetVariable(), target.get())));
                implications += 2;
            }
            LOGGER.debug("Coupled {} to ({})->({}) with {} implications",
                chain.relationshipVariable(), chain.sourceVariable(),
                chain.targetVariable(), implications);
        }
    }

    private static Set<String> candidatesOf(final String variable,
                                            final ConstraintSet constraints) {
        return constraints.assignmentsOf(variable).stream()
            .filter(NodeAssignment.class::isInstance)
            .map(AtomicProposition::entityId)
            .collect(Collectors.toSet());
    }

    private static void requireDeclared(final ChainElement chain,
                                        final String endpoint,
                                        final Set<String> nodeVariables) {
        if (!nodeVariables.contains(endpoint)) {
            throw new MalformedQueryException("Relationship "
                + chain.relationshipVariable() + " references node variable "
                + endpoint + " which has no labeled node pattern");
        }
    }
}
