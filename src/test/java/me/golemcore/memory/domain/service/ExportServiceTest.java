package me.golemcore.memory.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.memory.domain.model.DerivedView;
import me.golemcore.memory.domain.model.Event;
import me.golemcore.memory.domain.model.UserDataExport;
import me.golemcore.memory.domain.model.ViewStatus;
import me.golemcore.memory.testsupport.MemoryTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExportServiceTest {

    private static final String USER = "alice";
    private static final Instant NOW = Instant.parse("2026-03-15T10:00:00Z");

    @TempDir
    Path tempDir;

    private MemoryTestFixture fixture;
    private ExportService exportService;

    @BeforeEach
    void setUp() {
        fixture = new MemoryTestFixture(tempDir, NOW);
        exportService = fixture.getExportService();
    }

    private Event event(String target, Instant timestamp) {
        return Event.builder()
                .userId(USER)
                .timestamp(timestamp)
                .action("吃")
                .target(target)
                .confidence(0.8)
                .build();
    }

    @Test
    void shouldExportEverythingOfUser() {
        fixture.getIngestion().ingest(USER, "我今天早上吃了一个苹果", null);
        fixture.getIngestion().ingest(USER, "今天天气不错", null);
        DerivedView view = fixture.getViewStore().insert(DerivedView.create(DerivedView.builder()
                .userId(USER)
                .hypothesis("用户喜欢吃苹果")
                .derivedFrom(List.of("e1"))
                .createdAt(NOW)));
        String conceptId = fixture.getConceptRegistry().promote(view, NOW);
        fixture.getAuditService().record(USER, "insights", "getActiveViews", USER, true, 1, null);

        UserDataExport export = exportService.exportUser(USER);

        assertEquals(USER, export.getUserId());
        assertEquals(NOW, export.getExportedAt());
        assertEquals(UserDataExport.FORMAT_VERSION, export.getFormatVersion());
        assertEquals(2, export.getRawInputs().size());
        assertEquals(1, export.getEvents().size());
        assertEquals(1, export.getEntities().size());
        assertEquals(1, export.getViews().size());
        assertEquals(conceptId, export.getConcepts().get(0).getConceptId());
        assertEquals(1, export.getAuditLog().size());
    }

    @Test
    void shouldIncludeArchivedEventsInTimeOrder() {
        fixture.getEventStore().appendAll(List.of(
                event("香蕉", NOW.minus(Duration.ofDays(1))),
                event("苹果", NOW.minus(Duration.ofDays(200)))));
        fixture.getEventStore().archive(USER, NOW.minus(Duration.ofDays(100)));

        List<Event> events = exportService.exportUser(USER).getEvents();

        assertEquals(List.of("苹果", "香蕉"), events.stream().map(Event::getTarget).toList());
    }

    @Test
    void shouldIncludeArchivedViews() {
        DerivedView view = fixture.getViewStore().insert(DerivedView.create(DerivedView.builder()
                .userId(USER)
                .hypothesis("用户喜欢吃苹果")
                .derivedFrom(List.of("e1"))
                .createdAt(NOW)));
        fixture.getViewStore().modify(USER, view.getViewId(),
                working -> working.transitionTo(ViewStatus.EXPIRED,
                        NOW.minus(Duration.ofDays(200))));
        fixture.getViewLifecycle().archiveClosedViews(USER, NOW);

        List<DerivedView> views = exportService.exportUser(USER).getViews();

        assertEquals(1, views.size());
        assertEquals(view.getViewId(), views.get(0).getViewId());
    }

    @Test
    void shouldNotLeakOtherUsers() {
        fixture.getIngestion().ingest("bob", "我今天早上吃了一个苹果", null);

        UserDataExport export = exportService.exportUser(USER);

        assertTrue(export.getEvents().isEmpty());
        assertTrue(export.getRawInputs().isEmpty());
        assertTrue(export.getEntities().isEmpty());
    }

    @Test
    void shouldSerializeExportAsJson() throws Exception {
        fixture.getIngestion().ingest(USER, "我今天早上吃了一个苹果", null);

        JsonNode json = fixture.getObjectMapper().readTree(exportService.exportUserJson(USER));

        assertEquals(USER, json.get("userId").asText());
        assertEquals("苹果", json.get("events").get(0).get("target").asText());
        assertEquals("2026-03-15T08:00:00Z", json.get("events").get(0).get("timestamp").asText());
    }
}
