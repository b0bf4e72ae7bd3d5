package com.falkordb.cyphersat.falkordb;

import com.falkordb.Driver;
import com.falkordb.GraphContextGenerator;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import com.falkordb.cyphersat.facts.FactStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FalkorDBFactStore against a mocked driver.
 */
public class FalkorDBFactStoreTest {

    private static final String GRAPH_NAME = "test_graph";

    private Driver mockDriver;
    private GraphContextGenerator mockGraph;
    private FalkorDBFactStore store;

    @BeforeEach
    public void setUp() {
        mockDriver = mock(Driver.class);
        mockGraph = mock(GraphContextGenerator.class);
        when(mockDriver.graph(GRAPH_NAME)).thenReturn(mockGraph);
        store = FalkorDBFactStore.builder()
            .driver(mockDriver)
            .graphName(GRAPH_NAME)
            .build();
    }

    private static ResultSet resultOf(final Object... ids) {
        List<Record> records = new ArrayList<>();
        for (Object id : ids) {
            Record record = mock(Record.class);
            when(record.getValue("id")).thenReturn(id);
            records.add(record);
        }
        ResultSet resultSet = mock(ResultSet.class);
        when(resultSet.iterator()).thenReturn(records.iterator());
        return resultSet;
    }

    @SuppressWarnings("unchecked")
    private ArgumentCaptor<Map<String, Object>> paramsCaptor() {
        return ArgumentCaptor.forClass(Map.class);
    }

    @Test
    @DisplayName("Test entitiesWithLabel renders ids as strings in result order")
    public void testEntitiesWithLabel() {
        ResultSet result = resultOf(1L, 2L);
        when(mockGraph.query(anyString(), anyMap())).thenReturn(result);

        List<String> ids = store.entitiesWithLabel("Person");

        assertEquals(List.of("1", "2"), ids);
        ArgumentCaptor<String> cypher = ArgumentCaptor.forClass(String.class);
        verify(mockGraph).query(cypher.capture(), anyMap());
        assertTrue(cypher.getValue().startsWith("MATCH (n:`Person`)"));
    }

    @Test
    @DisplayName("Test relationshipsWithLabel queries relationship type")
    public void testRelationshipsWithLabel() {
        ResultSet result = resultOf(7L);
        when(mockGraph.query(anyString(), anyMap())).thenReturn(result);

        assertEquals(List.of("7"), store.relationshipsWithLabel("KNOWS"));

        ArgumentCaptor<String> cypher = ArgumentCaptor.forClass(String.class);
        verify(mockGraph).query(cypher.capture(), anyMap());
        assertTrue(cypher.getValue().contains("[r:`KNOWS`]"));
    }

    @Test
    @DisplayName("Test labels are escaped for backtick-quoted identifiers")
    public void testLabelSanitized() {
        ResultSet result = resultOf();
        when(mockGraph.query(anyString(), anyMap())).thenReturn(result);

        assertTrue(store.entitiesWithLabel("Bad`Label").isEmpty());

        ArgumentCaptor<String> cypher = ArgumentCaptor.forClass(String.class);
        verify(mockGraph).query(cypher.capture(), anyMap());
        assertTrue(cypher.getValue().contains("(n:`Bad``Label`)"));
    }

    @Test
    @DisplayName("Test sanitizeCypherIdentifier doubles backticks and drops NUL")
    public void testSanitizeCypherIdentifier() {
        assertEquals("a``b", FalkorDBFactStore.sanitizeCypherIdentifier("a`b"));
        assertEquals("ab", FalkorDBFactStore.sanitizeCypherIdentifier("a\0b"));
        assertEquals("", FalkorDBFactStore.sanitizeCypherIdentifier(null));
    }

    @Test
    @DisplayName("Test blank label is rejected")
    public void testBlankLabel() {
        assertThrows(IllegalArgumentException.class,
            () -> store.entitiesWithLabel(" "));
        assertThrows(IllegalArgumentException.class,
            () -> store.relationshipsWithLabel(null));
        verify(mockGraph, never()).query(anyString(), anyMap());
    }

    @Test
    @DisplayName("Test sourceOf passes the relationship id as a Long parameter")
    public void testSourceOf() {
        ResultSet result = resultOf(3L);
        when(mockGraph.query(anyString(), anyMap())).thenReturn(result);

        assertEquals(Optional.of("3"), store.sourceOf("5"));

        ArgumentCaptor<Map<String, Object>> params = paramsCaptor();
        verify(mockGraph).query(anyString(), params.capture());
        assertEquals(Map.of("id", 5L), params.getValue());
    }

    @Test
    @DisplayName("Test targetOf returns empty when the relationship is unknown")
    public void testTargetOfUnknown() {
        ResultSet result = resultOf();
        when(mockGraph.query(anyString(), anyMap())).thenReturn(result);

        assertEquals(Optional.empty(), store.targetOf("42"));
    }

    @Test
    @DisplayName("Test non-numeric relationship id is not sent to FalkorDB")
    public void testNonNumericId() {
        assertEquals(Optional.empty(), store.sourceOf("r1"));
        assertEquals(Optional.empty(), store.targetOf(null));
        verify(mockGraph, never()).query(anyString(), anyMap());
    }

    @Test
    @DisplayName("Test driver failures surface as FactStoreException")
    public void testDriverFailureWrapped() {
        RuntimeException failure = new RuntimeException("connection refused");
        when(mockGraph.query(anyString(), anyMap())).thenThrow(failure);

        FactStoreException thrown = assertThrows(FactStoreException.class,
            () -> store.entitiesWithLabel("Person"));

        assertSame(failure, thrown.getCause());
        assertTrue(thrown.getMessage().contains(GRAPH_NAME));
    }

    @Test
    @DisplayName("Test row without id is rejected")
    public void testMissingIdValue() {
        ResultSet result = resultOf((Object) null);
        when(mockGraph.query(anyString(), anyMap())).thenReturn(result);

        assertThrows(FactStoreException.class,
            () -> store.entitiesWithLabel("Person"));
    }

    @Test
    @DisplayName("Test createNode returns the new node id")
    public void testCreateNode() {
        ResultSet result = resultOf(11L);
        when(mockGraph.query(anyString(), anyMap())).thenReturn(result);

        assertEquals("11", store.createNode("Person"));
    }

    @Test
    @DisplayName("Test createRelationship fails when endpoints are missing")
    public void testCreateRelationshipMissingEndpoints() {
        ResultSet result = resultOf();
        when(mockGraph.query(anyString(), anyMap())).thenReturn(result);

        assertThrows(FactStoreException.class,
            () -> store.createRelationship("KNOWS", "1", "2"));
        assertThrows(FactStoreException.class,
            () -> store.createRelationship("KNOWS", "alice", "2"));
    }

    @Test
    @DisplayName("Test createRelationship passes endpoint ids as parameters")
    public void testCreateRelationship() {
        ResultSet result = resultOf(9L);
        when(mockGraph.query(anyString(), anyMap())).thenReturn(result);

        assertEquals("9", store.createRelationship("KNOWS", "1", "2"));

        ArgumentCaptor<Map<String, Object>> params = paramsCaptor();
        verify(mockGraph).query(anyString(), params.capture());
        assertEquals(Map.of("source", 1L, "target", 2L), params.getValue());
    }

    @Test
    @DisplayName("Test builder uses the configured graph name")
    public void testBuilderGraphName() {
        assertEquals(GRAPH_NAME, store.getGraphName());
        verify(mockDriver).graph(GRAPH_NAME);
    }

    @Test
    @DisplayName("Test builder rejects a blank graph name")
    public void testBuilderBlankGraphName() {
        FalkorDBFactStore.Builder builder = FalkorDBFactStore.builder()
            .driver(mockDriver)
            .graphName("");
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    @DisplayName("Test builder reads the graph name from the environment")
    public void testBuilderFromEnvironment() {
        GraphContextGenerator envGraph = mock(GraphContextGenerator.class);
        when(mockDriver.graph("env_graph")).thenReturn(envGraph);

        FalkorDBFactStore fromEnv = FalkorDBFactStore.builder()
            .driver(mockDriver)
            .fromEnvironment(Map.of("FALKORDB_GRAPH", "env_graph"))
            .build();

        assertEquals("env_graph", fromEnv.getGraphName());
    }

    @Test
    @DisplayName("Test close closes the driver")
    public void testClose() throws Exception {
        store.close();
        verify(mockDriver).close();
    }

    @Test
    @DisplayName("Test close does not propagate driver errors")
    public void testCloseError() throws Exception {
        doThrow(new RuntimeException("boom")).when(mockDriver).close();
        assertDoesNotThrow(() -> store.close());
    }
}
