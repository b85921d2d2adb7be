package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.exception.ExtractionException;
import me.golemcore.memory.domain.exception.ValidationException;
import me.golemcore.memory.domain.model.CandidateEvent;
import me.golemcore.memory.domain.model.DerivedView;
import me.golemcore.memory.domain.model.Event;
import me.golemcore.memory.domain.model.EventsIngestedEvent;
import me.golemcore.memory.domain.model.ExtractionMethod;
import me.golemcore.memory.domain.model.IngestionResult;
import me.golemcore.memory.domain.model.RawInput;
import me.golemcore.memory.domain.model.ViewStatus;
import me.golemcore.memory.domain.model.ViewType;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.ExtractionPort;
import me.golemcore.memory.testsupport.MemoryTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EventIngestionServiceTest {

    private static final String USER = "alice";
    private static final Instant NOW = Instant.parse("2026-03-15T10:00:00Z");

    @TempDir
    Path tempDir;

    private ExtractionPort extractionPort;
    private MemoryTestFixture fixture;
    private EventIngestionService ingestion;

    @BeforeEach
    void setUp() {
        extractionPort = mock(ExtractionPort.class);
        fixture = new MemoryTestFixture(tempDir, NOW, new MemoryProperties(), extractionPort, ZoneOffset.UTC);
        ingestion = fixture.getIngestion();
    }

    // ==================== rule fallback ====================

    @Test
    void shouldExtractWithRulesWhenModelUnavailable() {
        when(extractionPort.isAvailable()).thenReturn(false);

        IngestionResult result = ingestion.ingest(USER, "我今天早上吃了一个苹果", null);

        assertTrue(result.isStructured());
        assertEquals(1, result.events().size());
        Event event = result.events().get(0);
        assertEquals("吃", event.getAction());
        assertEquals("苹果", event.getTarget());
        assertEquals(1.0, event.getQuantity());
        assertEquals("个", event.getUnit());
        assertEquals(Instant.parse("2026-03-15T08:00:00Z"), event.getTimestamp());
        assertEquals("rule", event.getExtractorVersion());
        assertEquals(result.rawInput().getInputId(), event.getSourceReference());
        verify(extractionPort, never()).extract(anyString(), any());
    }

    @Test
    void shouldStoreRawInputAsStructured() {
        IngestionResult result = ingestion.ingest(USER, "我今天早上吃了一个苹果", "早餐");

        List<RawInput> inputs = fixture.getRawInputStore().list(USER);
        assertEquals(1, inputs.size());
        RawInput stored = inputs.get(0);
        assertEquals(result.rawInput().getInputId(), stored.getInputId());
        assertEquals(RawInput.Status.STRUCTURED, stored.getStatus());
        assertEquals(ExtractionMethod.RULE, stored.getExtractionMethod());
        assertEquals("早餐", stored.getContext());
    }

    @Test
    void shouldKeepUnstructuredInput() {
        IngestionResult result = ingestion.ingest(USER, "今天天气不错", null);

        assertFalse(result.isStructured());
        assertEquals(0, fixture.getEventStore().count(USER));
        List<RawInput> inputs = fixture.getRawInputStore().list(USER);
        assertEquals(1, inputs.size());
        assertEquals(RawInput.Status.UNSTRUCTURED, inputs.get(0).getStatus());
        assertEquals("今天天气不错", inputs.get(0).getText());
        assertTrue(fixture.getPublishedEvents().isEmpty());
    }

    @Test
    void shouldRejectBlankInput() {
        assertThrows(ValidationException.class, () -> ingestion.ingest(USER, "  ", null));
        assertThrows(ValidationException.class, () -> ingestion.ingest("../etc", "吃了苹果", null));
    }

    // ==================== model extraction ====================

    @Test
    void shouldSanitizeModelCandidates() {
        Instant hint = Instant.parse("2026-03-14T19:30:00Z");
        when(extractionPort.isAvailable()).thenReturn(true);
        when(extractionPort.extract(anyString(), any())).thenReturn(CompletableFuture.completedFuture(List.of(
                CandidateEvent.builder().action(" 吃 ").target("苹果").quantity(-2.0).unit("个").confidence(1.7)
                        .build(),
                CandidateEvent.builder().action(" ").target("咖啡").confidence(0.9).build(),
                CandidateEvent.builder().action("喝").target("咖啡").timestampHint(hint).build())));

        IngestionResult result = ingestion.ingest(USER, "吃了苹果，昨晚喝了咖啡", null);

        assertEquals(2, result.events().size());
        Event apple = result.events().get(0);
        assertEquals("吃", apple.getAction());
        assertEquals(1.0, apple.getConfidence());
        assertNull(apple.getQuantity());
        assertNull(apple.getUnit());
        assertEquals(NOW, apple.getTimestamp());
        assertEquals("llm", apple.getExtractorVersion());

        Event coffee = result.events().get(1);
        assertEquals(0.5, coffee.getConfidence());
        assertEquals(hint, coffee.getTimestamp());
        assertEquals(ExtractionMethod.LLM, fixture.getRawInputStore().list(USER).get(0).getExtractionMethod());
    }

    @Test
    void shouldFallBackToRulesWhenModelFails() {
        when(extractionPort.isAvailable()).thenReturn(true);
        when(extractionPort.extract(anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new ExtractionException("model unreachable")));

        IngestionResult result = ingestion.ingest(USER, "我今天早上吃了一个苹果", null);

        assertEquals(1, result.events().size());
        assertEquals("rule", result.events().get(0).getExtractorVersion());
        verify(extractionPort, times(3)).extract(anyString(), any());
    }

    @Test
    void shouldFallBackToRulesWhenModelFindsNothing() {
        when(extractionPort.isAvailable()).thenReturn(true);
        when(extractionPort.extract(anyString(), any())).thenReturn(CompletableFuture.completedFuture(List.of()));

        IngestionResult result = ingestion.ingest(USER, "我今天早上吃了一个苹果", null);

        assertEquals(1, result.events().size());
        assertEquals("rule", result.events().get(0).getExtractorVersion());
    }

    // ==================== downstream effects ====================

    @Test
    void shouldResolveEntitiesAndPublishEvent() {
        IngestionResult result = ingestion.ingest(USER, "我今天早上吃了一个苹果", null);

        assertEquals(1, result.entityIds().size());
        assertEquals("苹果", fixture.getEntityResolver()
                .findById(USER, result.entityIds().get(0)).orElseThrow().getCanonicalName());
        assertEquals(List.of(new EventsIngestedEvent(USER, 1)), fixture.getPublishedEvents());
    }

    @Test
    void shouldRecordCoOccurrenceBetweenEntitiesOfOneInput() {
        IngestionResult result = ingestion.ingest(USER, "早上喝了咖啡，然后中午吃了面条", null);

        assertEquals(2, result.entityIds().size());
        assertEquals(1, fixture.getRelationService().getRelations(USER, NOW).size());
    }

    @Test
    void shouldApplyCounterEvidenceToActiveViews() {
        DerivedView view = fixture.getViewStore().insert(DerivedView.create(DerivedView.builder()
                .userId(USER)
                .hypothesis("用户喜欢喝咖啡")
                .viewType(ViewType.PREFERENCE)
                .subject("咖啡")
                .action("喝")
                .derivedFrom(List.of("e1", "e2", "e3"))
                .priorConfidence(0.6)
                .confidence(0.6)
                .createdAt(NOW)
                .expiresAt(NOW.plus(Duration.ofDays(30)))));

        IngestionResult result = ingestion.ingest(USER, "我不喝咖啡", null);

        assertEquals(List.of(view.getViewId()), result.counterEvidenceViewIds());
        DerivedView updated = fixture.getViewStore().get(USER, view.getViewId()).orElseThrow();
        assertEquals(List.of(result.events().get(0).getEventId()), updated.getCounterEvidence());
        assertEquals(ViewStatus.REJECTED, updated.getStatus());
    }

    // ==================== manual events ====================

    @Test
    void shouldRecordManualEvent() {
        IngestionResult result = ingestion.recordManual(USER, CandidateEvent.builder()
                .action("跑步")
                .target("公园")
                .quantity(5.0)
                .unit("公里")
                .confidence(0.95)
                .build(), null);

        Event event = result.events().get(0);
        assertEquals("manual", event.getExtractorVersion());
        assertEquals(5.0, event.getQuantity());
        assertEquals(0.95, event.getConfidence());
        assertEquals(ExtractionMethod.MANUAL, fixture.getRawInputStore().list(USER).get(0).getExtractionMethod());
    }

    @Test
    void shouldRejectManualEventWithoutTarget() {
        assertThrows(ValidationException.class, () -> ingestion.recordManual(USER,
                CandidateEvent.builder().action("跑步").build(), null));
        assertEquals(0, fixture.getEventStore().count(USER));
    }

    // ==================== implausible input ====================

    @Test
    void shouldReplaceFutureTimestampHintWithReceiveTime() {
        when(extractionPort.isAvailable()).thenReturn(true);
        when(extractionPort.extract(anyString(), any())).thenReturn(CompletableFuture.completedFuture(List.of(
                CandidateEvent.builder().action("喝").target("咖啡").confidence(0.9)
                        .timestampHint(Instant.parse("2999-01-01T00:00:00Z")).build())));

        IngestionResult result = ingestion.ingest(USER, "喝了咖啡", null);

        assertEquals(1, result.events().size());
        assertEquals(NOW, result.events().get(0).getTimestamp());
        List<Event> stored = fixture.getEventStore().findByIds(USER, List.of(result.events().get(0).getEventId()));
        assertEquals(NOW, stored.get(0).getTimestamp());
    }

    @Test
    void shouldIgnoreHugeDaysAgoCount() {
        when(extractionPort.isAvailable()).thenReturn(false);

        IngestionResult result = assertDoesNotThrow(() -> ingestion.ingest(USER, "我99999999999天前吃了苹果", null));

        assertEquals(1, fixture.getRawInputStore().list(USER).size());
        result.events().forEach(event -> assertEquals(NOW, event.getTimestamp()));
    }

    @Test
    void shouldRejectManualEventInTheFuture() {
        assertThrows(ValidationException.class, () -> ingestion.recordManual(USER, CandidateEvent.builder()
                .action("跑步")
                .target("公园")
                .timestampHint(NOW.plus(Duration.ofDays(3)))
                .build(), null));
        assertEquals(0, fixture.getEventStore().count(USER));
        assertTrue(fixture.getRawInputStore().list(USER).isEmpty());
    }
}
