package com.falkordb.cyphersat.constraint;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the proposition records and their structural checks.
 */
public class PropositionTest {

    private static final NodeAssignment N_P1 = new NodeAssignment("n", "p1");
    private static final NodeAssignment N_P2 = new NodeAssignment("n", "p2");
    private static final NodeAssignment N_P3 = new NodeAssignment("n", "p3");
    private static final RelationshipAssignment R_REL1 =
        new RelationshipAssignment("r", "rel1");

    @Test
    @DisplayName("Test structurally equal trees are equal and hash alike")
    public void testStructuralEquality() {
        Proposition first = new Implies(R_REL1,
            Disjunction.of(N_P1, new Negation(N_P2)));
        Proposition second = new Implies(new RelationshipAssignment("r", "rel1"),
            Disjunction.of(new NodeAssignment("n", "p1"),
                new Negation(new NodeAssignment("n", "p2"))));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        Set<Proposition> set = new HashSet<>(List.of(first, second));
        assertEquals(1, set.size());
    }

    @Test
    @DisplayName("Test node and relationship assignments with same ids differ")
    public void testAtomKindsDiffer() {
        assertNotEquals(new NodeAssignment("x", "1"),
            new RelationshipAssignment("x", "1"));
    }

    @Test
    @DisplayName("Test atom toString names variable and entity")
    public void testAtomToString() {
        assertEquals("NodeAssignment(n -> p1)", N_P1.toString());
        assertEquals("RelationshipAssignment(r -> rel1)", R_REL1.toString());
    }

    @Test
    @DisplayName("Test blank identifiers are rejected")
    public void testBlankIdentifiers() {
        assertThrows(IllegalArgumentException.class,
            () -> new NodeAssignment("", "p1"));
        assertThrows(IllegalArgumentException.class,
            () -> new NodeAssignment("n", null));
        assertThrows(IllegalArgumentException.class,
            () -> new RelationshipAssignment(" ", "rel1"));
    }

    @Test
    @DisplayName("Test compound children are copied and immutable")
    public void testChildrenImmutable() {
        List<Proposition> source = new ArrayList<>(List.of(N_P1, N_P2));
        Disjunction disjunction = new Disjunction(source);
        source.add(N_P3);

        assertEquals(2, disjunction.children().size());
        assertThrows(UnsupportedOperationException.class,
            () -> disjunction.children().add(N_P3));
    }

    @Test
    @DisplayName("Test walk visits the tree in pre-order")
    public void testWalkPreOrder() {
        Negation negated = new Negation(N_P2);
        Conjunction root = Conjunction.of(N_P1, negated);

        List<Proposition> visited = root.walk().collect(Collectors.toList());

        assertEquals(List.of(root, N_P1, negated, N_P2), visited);
    }

    @Test
    @DisplayName("Test pairwise exclusions cover every unordered pair once")
    public void testPairwiseExclusions() {
        Disjunction candidates = Disjunction.of(N_P1, N_P2, N_P3);

        List<Proposition> exclusions = candidates.pairwiseExclusions();

        assertEquals(List.of(
            Disjunction.of(new Negation(N_P1), new Negation(N_P2)),
            Disjunction.of(new Negation(N_P1), new Negation(N_P3)),
            Disjunction.of(new Negation(N_P2), new Negation(N_P3))),
            exclusions);
        assertTrue(Disjunction.of(N_P1).pairwiseExclusions().isEmpty());
    }

    @Test
    @DisplayName("Test ExactlyOne and AtMostOne expose their disjunction")
    public void testCardinalityChildren() {
        Disjunction candidates = Disjunction.of(N_P1, N_P2);
        assertEquals(List.of(candidates), new ExactlyOne(candidates).children());
        assertEquals(List.of(candidates), new AtMostOne(candidates).children());
        assertThrows(NullPointerException.class, () -> new ExactlyOne(null));
    }

    @Test
    @DisplayName("Test literal, clause and CNF shape checks")
    public void testNormalForms() {
        Negation notP1 = new Negation(N_P1);
        Disjunction clause = Disjunction.of(notP1, N_P2);
        Conjunction cnf = Conjunction.of(clause, N_P3);

        assertTrue(NormalForms.isLiteral(N_P1));
        assertTrue(NormalForms.isLiteral(notP1));
        assertFalse(NormalForms.isLiteral(new Negation(notP1)));

        assertTrue(NormalForms.isClause(clause));
        assertTrue(NormalForms.isClause(new Disjunction(List.of())));
        assertFalse(NormalForms.isClause(Disjunction.of(N_P1, cnf)));

        assertTrue(NormalForms.isCnf(cnf));
        assertTrue(NormalForms.isCnf(new Conjunction(List.of())));
        assertFalse(NormalForms.isCnf(new Implies(N_P1, N_P2)));
        assertFalse(NormalForms.isCnf(Conjunction.of(Conjunction.of(N_P1))));
        assertFalse(NormalForms.isCnf(new ExactlyOne(clause)));
    }
}
