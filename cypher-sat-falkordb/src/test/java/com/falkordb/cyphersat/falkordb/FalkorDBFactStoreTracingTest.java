package com.falkordb.cyphersat.falkordb;

import com.falkordb.Driver;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Verifies the span hierarchy of fact-store lookups: an INTERNAL store span
 * with a CLIENT driver span nested inside it.
 */
public class FalkorDBFactStoreTracingTest {

    private InMemorySpanExporter spanExporter;
    private OpenTelemetrySdk openTelemetry;
    private Graph mockGraph;
    private FalkorDBFactStore store;

    @BeforeEach
    public void setUp() {
        spanExporter = InMemorySpanExporter.create();
        openTelemetry = OpenTelemetrySdk.builder()
            .setTracerProvider(SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build())
            .build();
        mockGraph = mock(Graph.class);
        store = new FalkorDBFactStore(mock(Driver.class),
            new TracedGraph(mockGraph, "traced",
                openTelemetry.getTracer("driver")),
            openTelemetry.getTracer("store"));
    }

    @AfterEach
    public void tearDown() {
        openTelemetry.close();
    }

    @Test
    @DisplayName("Test lookup span carries label and result count")
    public void testLookupSpan() {
        Record record = mock(Record.class);
        when(record.getValue("id")).thenReturn(4L);
        ResultSet result = mock(ResultSet.class);
        when(result.iterator()).thenReturn(List.of(record).iterator());
        when(mockGraph.query(anyString(), anyMap())).thenReturn(result);

        assertEquals(List.of("4"), store.entitiesWithLabel("Person"));

        List<SpanData> spans = spanExporter.getFinishedSpanItems();
        assertEquals(2, spans.size());
        SpanData driverSpan = spans.get(0);
        SpanData storeSpan = spans.get(1);

        assertEquals("FalkorDB.query", driverSpan.getName());
        assertEquals(SpanKind.CLIENT, driverSpan.getKind());
        assertEquals(storeSpan.getSpanId(), driverSpan.getParentSpanId());

        assertEquals("FalkorDBFactStore.entitiesWithLabel", storeSpan.getName());
        assertEquals(SpanKind.INTERNAL, storeSpan.getKind());
        assertEquals(StatusCode.OK, storeSpan.getStatus().getStatusCode());
        assertEquals("Person", storeSpan.getAttributes().get(
            AttributeKey.stringKey("cypher_sat.fact_store.argument")));
        assertEquals(1L, storeSpan.getAttributes().get(
            AttributeKey.longKey("cypher_sat.fact_store.result_count")));
        assertEquals("traced", storeSpan.getAttributes().get(
            AttributeKey.stringKey("falkordb.graph_name")));
    }

    @Test
    @DisplayName("Test failing lookup marks the store span as error")
    public void testFailingLookupSpan() {
        when(mockGraph.query(anyString(), anyMap()))
            .thenThrow(new RuntimeException("down"));

        assertThrows(RuntimeException.class,
            () -> store.relationshipsWithLabel("KNOWS"));

        List<SpanData> spans = spanExporter.getFinishedSpanItems();
        assertEquals(2, spans.size());
        for (SpanData span : spans) {
            assertEquals(StatusCode.ERROR, span.getStatus().getStatusCode());
        }
    }
}
