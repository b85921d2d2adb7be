package me.golemcore.memory.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.domain.exception.IllegalViewTransitionException;
import me.golemcore.memory.domain.exception.ValidationException;
import me.golemcore.memory.infrastructure.config.MemoryEngineConfiguration;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DerivedViewTest {

    private static final Instant NOW = Instant.parse("2026-03-15T10:00:00Z");

    private static DerivedView.DerivedViewBuilder draft() {
        return DerivedView.builder()
                .userId("alice")
                .hypothesis("用户喜欢喝咖啡")
                .viewType(ViewType.PREFERENCE)
                .derivedFrom(List.of("e1", "e2", "e2", "e3"))
                .createdAt(NOW);
    }

    // ==================== create ====================

    @Test
    void shouldCreateActiveViewWithDistinctEvidence() {
        DerivedView view = DerivedView.create(draft());

        assertEquals(ViewStatus.ACTIVE, view.getStatus());
        assertEquals(List.of("e1", "e2", "e3"), view.getDerivedFrom());
        assertEquals(3, view.getValidationCount());
        assertTrue(view.getCounterEvidence().isEmpty());
    }

    @Test
    void shouldRefuseViewWithoutEvidence() {
        assertThrows(ValidationException.class, () -> DerivedView.create(draft().derivedFrom(List.of())));
        assertThrows(ValidationException.class, () -> DerivedView.create(draft().derivedFrom(null)));
    }

    @Test
    void shouldRefuseViewWithoutHypothesisOrUser() {
        assertThrows(ValidationException.class, () -> DerivedView.create(draft().hypothesis(" ")));
        assertThrows(ValidationException.class, () -> DerivedView.create(draft().userId(null)));
    }

    @Test
    void shouldIgnoreStatusOfDraft() {
        DerivedView view = DerivedView.create(draft().status(ViewStatus.PROMOTED));

        assertEquals(ViewStatus.ACTIVE, view.getStatus());
    }

    // ==================== transitions ====================

    @Test
    void shouldMoveFromActiveToTerminalState() {
        DerivedView view = DerivedView.create(draft());

        view.transitionTo(ViewStatus.EXPIRED, NOW);

        assertEquals(ViewStatus.EXPIRED, view.getStatus());
        assertEquals(NOW, view.getClosedAt());
        assertFalse(view.isActive());
    }

    @Test
    void shouldRefuseLeavingTerminalState() {
        DerivedView view = DerivedView.create(draft());
        view.transitionTo(ViewStatus.REJECTED, NOW);

        assertThrows(IllegalViewTransitionException.class, () -> view.transitionTo(ViewStatus.ACTIVE, NOW));
        assertThrows(IllegalViewTransitionException.class, () -> view.transitionTo(ViewStatus.PROMOTED, NOW));
        assertEquals(ViewStatus.REJECTED, view.getStatus());
    }

    @Test
    void shouldRefuseTransitionToActive() {
        DerivedView view = DerivedView.create(draft());

        assertThrows(IllegalViewTransitionException.class, () -> view.transitionTo(ViewStatus.ACTIVE, NOW));
    }

    // ==================== evidence ====================

    @Test
    void shouldNotCountEventTwice() {
        DerivedView view = DerivedView.create(draft());

        assertEquals(1, view.addSupportingEvents(List.of("e3", "e4")));
        assertFalse(view.addCounterEvidence("e1"));
        assertTrue(view.addCounterEvidence("e9"));
        assertFalse(view.addCounterEvidence("e9"));
        assertEquals(0, view.addSupportingEvents(List.of("e9")));

        assertEquals(4, view.getValidationCount());
        assertEquals(0.25, view.getCounterEvidenceRatio(), 1e-9);
    }

    @Test
    void shouldFreezeEvidenceOfClosedView() {
        DerivedView view = DerivedView.create(draft());
        view.transitionTo(ViewStatus.PROMOTED, NOW);

        assertThrows(IllegalViewTransitionException.class, () -> view.addCounterEvidence("e9"));
        assertThrows(IllegalViewTransitionException.class, () -> view.addSupportingEvents(List.of("e9")));
    }

    @Test
    void shouldKeepCopiesIndependent() {
        DerivedView view = DerivedView.create(draft());
        DerivedView copy = view.copy();

        copy.addCounterEvidence("e9");

        assertTrue(view.getCounterEvidence().isEmpty());
        assertEquals(List.of("e9"), copy.getCounterEvidence());
    }

    @Test
    void shouldRoundTripStatusThroughJson() throws Exception {
        ObjectMapper mapper = MemoryEngineConfiguration.createObjectMapper();
        DerivedView view = DerivedView.create(draft());
        view.transitionTo(ViewStatus.PROMOTED, NOW);

        DerivedView restored = mapper.readValue(mapper.writeValueAsString(view), DerivedView.class);

        assertEquals(ViewStatus.PROMOTED, restored.getStatus());
        assertEquals(NOW, restored.getClosedAt());
        assertEquals(view.getDerivedFrom(), restored.getDerivedFrom());
    }
}
