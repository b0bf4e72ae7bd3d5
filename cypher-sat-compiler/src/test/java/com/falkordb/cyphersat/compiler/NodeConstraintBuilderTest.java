package com.falkordb.cyphersat.compiler;

import com.falkordb.cyphersat.constraint.ConstraintSet;
import com.falkordb.cyphersat.constraint.Disjunction;
import com.falkordb.cyphersat.constraint.ExactlyOne;
import com.falkordb.cyphersat.constraint.NodeAssignment;
import com.falkordb.cyphersat.facts.InMemoryFactStore;
import com.falkordb.cyphersat.pattern.NodeElement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for NodeConstraintBuilder.
 */
public class NodeConstraintBuilderTest {

    private InMemoryFactStore store;
    private ConstraintSet constraints;

    @BeforeEach
    public void setUp() {
        store = new InMemoryFactStore()
            .node("p1", "Person")
            .node("p2", "Person")
            .node("c1", "City");
        constraints = new ConstraintSet();
    }

    @Test
    @DisplayName("Test one ExactlyOne over every node carrying the label")
    public void testExactlyOnePerNode() {
        new NodeConstraintBuilder(store).build(
            List.of(new NodeElement("n", "Person")), constraints);

        assertEquals(1, constraints.size());
        assertTrue(constraints.contains(new ExactlyOne(Disjunction.of(
            new NodeAssignment("n", "p1"), new NodeAssignment("n", "p2")))));
    }

    @Test
    @DisplayName("Test unmatched label still yields an empty ExactlyOne")
    public void testNoCandidates() {
        new NodeConstraintBuilder(store).build(
            List.of(new NodeElement("x", "Robot")), constraints);

        assertTrue(constraints.contains(
            new ExactlyOne(new Disjunction(List.of()))));
    }

    @Test
    @DisplayName("Test each node pattern gets its own constraint")
    public void testSeveralNodes() {
        new NodeConstraintBuilder(store).build(List.of(
            new NodeElement("n", "Person"),
            new NodeElement("c", "City")), constraints);

        assertEquals(2, constraints.size());
        assertTrue(constraints.contains(new ExactlyOne(Disjunction.of(
            new NodeAssignment("c", "c1")))));
    }

    @Test
    @DisplayName("Test repeated node pattern collapses to one constraint")
    public void testRepeatedPattern() {
        NodeElement person = new NodeElement("n", "Person");
        new NodeConstraintBuilder(store).build(List.of(person, person), constraints);

        assertEquals(1, constraints.size());
    }

    @Test
    @DisplayName("Test no node patterns add nothing")
    public void testEmptyInput() {
        new NodeConstraintBuilder(store).build(List.of(), constraints);
        assertTrue(constraints.isEmpty());
    }
}
