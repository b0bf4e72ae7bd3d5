package com.falkordb.cyphersat.pattern;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for QueryElementExtractor.
 */
public class QueryElementExtractorTest {

    private static RelationshipChain knows(final EntityPattern left,
                                           final EntityPattern right) {
        return RelationshipChain.outgoing(left,
            new RelationshipPattern("r", "KNOWS"), right);
    }

    @Test
    @DisplayName("Test single labeled entity pattern becomes a node element")
    public void testSingleEntity() {
        QueryElements elements = QueryElementExtractor.extract(
            PatternGroup.of("MATCH", new EntityPattern("n", "Person")));

        assertEquals(List.of(new NodeElement("n", "Person")), elements.nodes());
        assertTrue(elements.chains().isEmpty());
        assertFalse(elements.isEmpty());
    }

    @Test
    @DisplayName("Test outgoing chain yields both endpoints and one chain")
    public void testOutgoingChain() {
        QueryElements elements = QueryElementExtractor.extract(
            PatternGroup.of("MATCH", knows(
                new EntityPattern("n", "Person"),
                new EntityPattern("m", "Person"))));

        assertEquals(List.of(new NodeElement("n", "Person"),
            new NodeElement("m", "Person")), elements.nodes());
        assertEquals(List.of(new ChainElement("r", "KNOWS", "n", "m")),
            elements.chains());
        assertEquals(Set.of("n", "m"), elements.nodeVariables());
    }

    @Test
    @DisplayName("Test incoming chain swaps source and target")
    public void testIncomingChain() {
        RelationshipChain chain = new RelationshipChain(
            new EntityPattern("a", "Person"),
            new RelationshipPattern("r", "KNOWS"),
            Direction.INCOMING,
            new EntityPattern("b", "Person"));

        QueryElements elements = QueryElementExtractor.extract(chain);

        assertEquals(List.of(new ChainElement("r", "KNOWS", "b", "a")),
            elements.chains());
    }

    @Test
    @DisplayName("Test bare entity references add no node element")
    public void testBareReference() {
        PatternElement root = PatternGroup.of("QUERY",
            PatternGroup.of("MATCH", new EntityPattern("n", "Person")),
            PatternGroup.of("MATCH", knows(
                EntityPattern.reference("n"), new EntityPattern("m", "City"))));

        QueryElements elements = QueryElementExtractor.extract(root);

        assertEquals(List.of(new NodeElement("n", "Person"),
            new NodeElement("m", "City")), elements.nodes());
        assertEquals(List.of(new ChainElement("r", "KNOWS", "n", "m")),
            elements.chains());
    }

    @Test
    @DisplayName("Test anonymous relationship yields an unconstrained chain")
    public void testAnonymousRelationship() {
        RelationshipChain chain = RelationshipChain.outgoing(
            new EntityPattern("n", "Person"),
            RelationshipPattern.anonymous(),
            new EntityPattern("m", "Person"));

        QueryElements elements = QueryElementExtractor.extract(chain);

        ChainElement extracted = elements.chains().get(0);
        assertNull(extracted.relationshipVariable());
        assertNull(extracted.relationshipLabel());
        assertFalse(extracted.isConstrained());
    }

    @Test
    @DisplayName("Test named but unlabeled relationship is not constrained")
    public void testUnlabeledRelationship() {
        ChainElement chain = new ChainElement("r", null, "n", "m");
        assertFalse(chain.isConstrained());
        assertTrue(new ChainElement("r", "KNOWS", "n", "m").isConstrained());
    }

    @Test
    @DisplayName("Test groups without entities yield empty lists")
    public void testEmptyTree() {
        QueryElements elements = QueryElementExtractor.extract(
            PatternGroup.of("RETURN"));

        assertTrue(elements.isEmpty());
        assertTrue(elements.nodes().isEmpty());
        assertTrue(elements.chains().isEmpty());
    }

    @Test
    @DisplayName("Test null root is rejected")
    public void testNullRoot() {
        assertThrows(IllegalArgumentException.class,
            () -> QueryElementExtractor.extract(null));
    }

    @Test
    @DisplayName("Test entity pattern requires a variable")
    public void testEntityRequiresVariable() {
        assertThrows(IllegalArgumentException.class,
            () -> new EntityPattern(" ", "Person"));
        assertFalse(EntityPattern.reference("n").hasLabel());
    }

    @Test
    @DisplayName("Test walk visits the tree in pre-order")
    public void testWalk() {
        EntityPattern n = new EntityPattern("n", "Person");
        EntityPattern m = new EntityPattern("m", "Person");
        RelationshipChain chain = knows(n, m);
        PatternGroup root = PatternGroup.of("MATCH", chain);

        assertEquals(List.of(root, chain, n, m),
            root.walk().collect(Collectors.toList()));
    }
}
