package me.golemcore.memory.plugin;

import me.golemcore.memory.domain.exception.PermissionDeniedException;
import me.golemcore.memory.domain.exception.ValidationException;
import me.golemcore.memory.domain.model.AuditEntry;
import me.golemcore.memory.domain.model.DerivedView;
import me.golemcore.memory.domain.model.Event;
import me.golemcore.memory.domain.model.MemoryPermission;
import me.golemcore.memory.domain.model.MemoryStatistics;
import me.golemcore.memory.domain.model.ViewProposal;
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
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class PluginGatewayServiceTest {

    private static final String USER = "alice";
    private static final String READER = "insights";
    private static final String WRITER = "coach";
    private static final Instant NOW = Instant.parse("2026-03-15T10:00:00Z");

    @TempDir
    Path tempDir;

    private MemoryTestFixture fixture;
    private PluginGatewayService gateway;

    @BeforeEach
    void setUp() {
        MemoryProperties properties = new MemoryProperties();
        MemoryProperties.ConsumerProperties reader = new MemoryProperties.ConsumerProperties();
        reader.setName("Insights plugin");
        properties.getConsumers().put(READER, reader);
        fixture = new MemoryTestFixture(tempDir, NOW, properties,
                mock(ExtractionPort.class), ZoneOffset.UTC);
        gateway = new PluginGatewayService(fixture.getStatisticsService(), fixture.getViewStore(),
                fixture.getViewLifecycle(), fixture.getConceptRegistry(), fixture.getEntityResolver(),
                fixture.getEventStore(), fixture.getValidator(), fixture.getAuditService(), properties,
                fixture.getClock());
        gateway.registerConsumer(WRITER, "Coach", MemoryPermission.READ_WRITE_DERIVED);
    }

    private List<String> storedEvents(int count) {
        List<Event> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(Event.builder()
                    .userId(USER)
                    .timestamp(NOW.minus(Duration.ofDays(i)))
                    .action("喝")
                    .target("茶")
                    .confidence(0.8)
                    .build());
        }
        return fixture.getEventStore().appendAll(events).stream().map(Event::getEventId).toList();
    }

    private static ViewProposal proposal(List<String> derivedFrom, double confidence) {
        return new ViewProposal("用户喜欢喝茶", null, "茶", "喝", null, null, derivedFrom, confidence);
    }

    // ==================== registration ====================

    @Test
    void shouldRegisterConfiguredConsumersAsReadOnly() {
        PluginGatewayService.RegisteredConsumer consumer = gateway.getConsumer(READER).orElseThrow();

        assertEquals("Insights plugin", consumer.name());
        assertEquals(MemoryPermission.READ_ONLY, consumer.permission());
        assertTrue(gateway.getConsumer("nobody").isEmpty());
        assertTrue(gateway.getConsumer(null).isEmpty());
    }

    @Test
    void shouldRejectBlankConsumerId() {
        assertThrows(ValidationException.class,
                () -> gateway.registerConsumer(" ", "x", MemoryPermission.READ_ONLY));
    }

    // ==================== reads ====================

    @Test
    void shouldServeReadsAndAuditThem() {
        storedEvents(3);

        MemoryStatistics statistics = gateway.getStatistics(READER, USER);
        List<DerivedView> views = gateway.getActiveViews(READER, USER);

        assertEquals(3, statistics.getEventCount());
        assertTrue(views.isEmpty());
        List<AuditEntry> audit = fixture.getAuditService().list(USER);
        assertEquals(2, audit.size());
        assertEquals("getStatistics", audit.get(0).getOperation());
        assertTrue(audit.get(0).isSuccess());
        assertEquals(READER, audit.get(1).getConsumerId());
        assertEquals(0, audit.get(1).getResultSize());
    }

    @Test
    void shouldDenyUnknownConsumer() {
        PermissionDeniedException denied = assertThrows(PermissionDeniedException.class,
                () -> gateway.getEntities("stranger", USER));

        assertEquals("stranger", denied.getConsumerId());
        AuditEntry entry = fixture.getAuditService().list(USER).get(0);
        assertFalse(entry.isSuccess());
        assertEquals("unknown consumer", entry.getErrorMessage());
    }

    @Test
    void shouldAuditInvalidUserIdSeparately() {
        assertThrows(ValidationException.class, () -> gateway.getActiveConcepts(READER, "../bob"));

        List<AuditEntry> entries = fixture.getAuditService().list("_system");
        assertEquals(1, entries.size());
        assertEquals("../bob", entries.get(0).getUserId());
        assertFalse(entries.get(0).isSuccess());
    }

    // ==================== proposals ====================

    @Test
    void shouldDenyProposalFromReadOnlyConsumer() {
        List<String> events = storedEvents(3);

        assertThrows(PermissionDeniedException.class,
                () -> gateway.proposeView(READER, USER, proposal(events, 0.9)));

        assertTrue(fixture.getViewStore().list(USER).isEmpty());
        AuditEntry entry = fixture.getAuditService().list(USER).get(0);
        assertEquals("proposeView", entry.getOperation());
        assertFalse(entry.isSuccess());
    }

    @Test
    void shouldStoreDiscountedProposal() {
        List<String> events = storedEvents(3);

        DerivedView view = gateway.proposeView(WRITER, USER, proposal(events, 0.9));

        assertNotNull(view.getViewId());
        assertEquals(ViewStatus.ACTIVE, view.getStatus());
        assertEquals(ViewType.BELIEF, view.getViewType());
        assertEquals(0.9 * 0.7, view.getConfidence(), 1e-9);
        assertEquals(view.getConfidence(), view.getPriorConfidence(), 1e-12);
        assertEquals(events, view.getDerivedFrom());
        assertEquals("plugin:coach", view.getSource());
        assertEquals(NOW.plus(Duration.ofDays(30)), view.getExpiresAt());
        assertEquals(1, gateway.getActiveViews(READER, USER).size());
    }

    @Test
    void shouldClampProposedConfidence() {
        DerivedView view = gateway.proposeView(WRITER, USER, proposal(storedEvents(1), 3.0));

        assertEquals(0.7, view.getConfidence(), 1e-9);
    }

    @Test
    void shouldRejectProposalCitingUnknownEvents() {
        List<String> events = storedEvents(1);

        ValidationException error = assertThrows(ValidationException.class,
                () -> gateway.proposeView(WRITER, USER, proposal(List.of(events.get(0), "ghost"), 0.9)));

        assertTrue(error.getMessage().contains("ghost"));
        assertTrue(fixture.getViewStore().list(USER).isEmpty());
        AuditEntry entry = fixture.getAuditService().list(USER).get(0);
        assertFalse(entry.isSuccess());
        assertTrue(entry.getErrorMessage().contains("ghost"));
    }

    @Test
    void shouldRejectProposalWithoutEvidence() {
        assertThrows(ValidationException.class, () -> gateway.proposeView(WRITER, USER, proposal(List.of(), 0.9)));
        assertThrows(ValidationException.class, () -> gateway.proposeView(WRITER, USER, null));
    }

    @Test
    void shouldNotCiteOtherUsersEvents() {
        List<String> events = storedEvents(2);

        assertThrows(ValidationException.class, () -> gateway.proposeView(WRITER, "bob", proposal(events, 0.9)));
    }
}
