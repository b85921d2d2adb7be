package me.golemcore.memory.adapter.outbound.llm;

import me.golemcore.memory.domain.exception.ExtractionException;
import me.golemcore.memory.domain.model.CandidateEvent;
import me.golemcore.memory.infrastructure.config.MemoryEngineConfiguration;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class Langchain4jExtractionAdapterTest {

    private MemoryProperties properties;
    private Langchain4jExtractionAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new MemoryProperties();
        adapter = new Langchain4jExtractionAdapter(properties, MemoryEngineConfiguration.createObjectMapper(),
                Clock.fixed(Instant.parse("2026-03-15T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void unavailableWithoutApiKey() {
        assertFalse(adapter.isAvailable());

        properties.getExtraction().setApiKey("sk-test");
        assertTrue(adapter.isAvailable());

        properties.getExtraction().setEnabled(false);
        assertFalse(adapter.isAvailable());
    }

    @Test
    void extractFailsWithExtractionExceptionWhenUnavailable() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.extract("我吃了苹果", null).join());
        assertInstanceOf(ExtractionException.class, ex.getCause());
    }

    @Test
    void parsesEventsObject() {
        List<CandidateEvent> candidates = adapter.parseCandidates("""
                {"events":[{"actor":"self","action":"吃","target":"苹果","quantity":3,"unit":"个",
                "confidence":0.9,"timestamp_hint":"2026-03-15T08:00:00+08:00"}]}
                """);

        assertEquals(1, candidates.size());
        CandidateEvent candidate = candidates.get(0);
        assertEquals("self", candidate.getActor());
        assertEquals("吃", candidate.getAction());
        assertEquals("苹果", candidate.getTarget());
        assertEquals(3.0, candidate.getQuantity());
        assertEquals("个", candidate.getUnit());
        assertEquals(0.9, candidate.getConfidence());
        assertEquals(Instant.parse("2026-03-15T00:00:00Z"), candidate.getTimestampHint());
    }

    @Test
    void acceptsCodeFencedArrayAndLenientNumbers() {
        List<CandidateEvent> candidates = adapter.parseCandidates("""
                ```json
                [{"action":"喝","target":"咖啡","quantity":"2","confidence":"1.7","timestamp_hint":"yesterday"},
                 "noise"]
                ```
                """);

        assertEquals(1, candidates.size());
        assertEquals(2.0, candidates.get(0).getQuantity());
        // clamping happens at ingestion, the adapter passes the raw value on
        assertEquals(1.7, candidates.get(0).getConfidence());
        assertNull(candidates.get(0).getTimestampHint());
    }

    @Test
    void emptyEventsArrayIsNotAnError() {
        assertTrue(adapter.parseCandidates("{\"events\":[]}").isEmpty());
    }

    @Test
    void rejectsUnparseableOutput() {
        assertThrows(ExtractionException.class, () -> adapter.parseCandidates("I think you ate an apple"));
        assertThrows(ExtractionException.class, () -> adapter.parseCandidates("{\"result\":\"ok\"}"));
        assertThrows(ExtractionException.class, () -> adapter.parseCandidates("  "));
    }
}
