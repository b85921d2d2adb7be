package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.ConflictKind;
import me.golemcore.memory.domain.model.DerivedView;
import me.golemcore.memory.domain.model.ViewConflict;
import me.golemcore.memory.domain.model.ViewStatus;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ConflictDetectorServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-15T10:00:00Z");

    private ConflictDetectorService detector;

    @BeforeEach
    void setUp() {
        detector = new ConflictDetectorService(new MemoryProperties());
    }

    private static DerivedView view(String id, String hypothesis) {
        return DerivedView.builder()
                .viewId(id)
                .userId("alice")
                .hypothesis(hypothesis)
                .derivedFrom(List.of("e-" + id))
                .validationCount(1)
                .build();
    }

    // ==================== antonyms ====================

    @Test
    void shouldDetectLikeVersusDislike() {
        List<ViewConflict> conflicts = detector.findConflicts(List.of(
                view("v1", "用户喜欢咖啡"), view("v2", "用户不喜欢咖啡")));

        assertEquals(1, conflicts.size());
        ViewConflict conflict = conflicts.get(0);
        assertEquals(ConflictKind.ANTONYM, conflict.kind());
        assertEquals("咖啡", conflict.subject());
        assertTrue(conflict.involves("v1"));
        assertEquals("v1", conflict.otherView("v2"));
    }

    @Test
    void shouldDetectAlwaysVersusNever() {
        List<ViewConflict> conflicts = detector.findConflicts(List.of(
                view("v1", "用户总是喝咖啡"), view("v2", "用户从不喝咖啡")));

        assertEquals(1, conflicts.size());
        assertEquals("咖啡", conflicts.get(0).subject());
    }

    @Test
    void shouldDetectEnglishAntonyms() {
        List<ViewConflict> conflicts = detector.findConflicts(List.of(
                view("v1", "User likes coffee"), view("v2", "User dislikes coffee")));

        assertEquals(1, conflicts.size());
        assertEquals("coffee", conflicts.get(0).subject());
    }

    @Test
    void shouldIgnoreAntonymsAboutDifferentSubjects() {
        assertTrue(detector.findConflicts(List.of(
                view("v1", "用户喜欢咖啡"), view("v2", "用户不喜欢茶"))).isEmpty());
    }

    @Test
    void shouldNotConfuseNegativeFormWithPositive() {
        assertTrue(detector.antonymConflict(view("v1", "用户不喜欢咖啡"), view("v2", "用户不喜欢咖啡")).isEmpty());
    }

    @Test
    void shouldNotFlagHabitAndPreferenceOnSameSubject() {
        DerivedView habit = view("v1", "用户经常在8点左右喝咖啡").toBuilder().subject("咖啡").action("喝").build();
        DerivedView preference = view("v2", "用户喜欢喝咖啡").toBuilder().subject("咖啡").action("喝").build();

        assertTrue(detector.findConflicts(List.of(habit, preference)).isEmpty());
    }

    // ==================== categories ====================

    @Test
    void shouldDetectVegetarianEatingBeef() {
        List<ViewConflict> conflicts = detector.findConflicts(List.of(
                view("v1", "用户是素食主义者"), view("v2", "用户喜欢吃牛肉")));

        assertEquals(1, conflicts.size());
        assertEquals(ConflictKind.CATEGORICAL, conflicts.get(0).kind());
        assertEquals("牛肉", conflicts.get(0).subject());
    }

    @Test
    void shouldUseExplicitCategoryAndSubject() {
        DerivedView vegetarian = view("v1", "User follows a plant-based diet").toBuilder()
                .category("vegetarian").build();
        DerivedView beef = view("v2", "User orders steak").toBuilder().subject("beef").build();

        List<ViewConflict> conflicts = detector.findConflicts(List.of(beef, vegetarian));

        assertEquals(1, conflicts.size());
        assertEquals("beef", conflicts.get(0).subject());
    }

    @Test
    void shouldDetectMutuallyExclusiveCategories() {
        List<ViewConflict> conflicts = detector.findConflicts(List.of(
                view("v1", "用户是早起的人"), view("v2", "用户是夜猫子")));

        assertEquals(1, conflicts.size());
        assertEquals(ConflictKind.CATEGORICAL, conflicts.get(0).kind());
        assertEquals("早起的人/夜猫子", conflicts.get(0).subject());
    }

    @Test
    void shouldNotFlagNegatedExcludedSubject() {
        assertTrue(detector.findConflicts(List.of(
                view("v1", "用户是素食主义者"), view("v2", "用户不吃牛肉"))).isEmpty());
    }

    @Test
    void shouldSuppressCategoricalConflictAcrossContexts() {
        DerivedView vegetarian = view("v1", "用户是素食主义者").toBuilder().contextTag("工作日").build();
        DerivedView beef = view("v2", "用户喜欢吃牛肉").toBuilder().contextTag("旅行").build();

        assertTrue(detector.findConflicts(List.of(vegetarian, beef)).isEmpty());

        DerivedView sameContext = beef.toBuilder().contextTag("工作日").build();
        assertEquals(1, detector.findConflicts(List.of(vegetarian, sameContext)).size());
    }

    @Test
    void shouldReadCategoryFromHypothesis() {
        assertEquals(Optional.of("素食主义者"), detector.categoryOf(view("v1", "用户是一个素食主义者")));
        assertEquals(Optional.of("night owl"), detector.categoryOf(view("v1", "User is a night owl")));
        assertTrue(detector.categoryOf(view("v1", "用户不是素食主义者")).isEmpty());
        assertTrue(detector.categoryOf(view("v1", "用户总是喝咖啡")).isEmpty());
    }

    @Test
    void shouldStripNoiseFromSubject() {
        assertEquals("咖啡", detector.subjectOf(view("v1", "用户经常在8点左右喝咖啡")));
        assertEquals("咖啡", detector.subjectOf(view("v1", "用户不喜欢咖啡。")));
        assertEquals("咖啡", detector.subjectOf(view("v1", "无关").toBuilder().subject("咖啡").build()));
    }

    // ==================== pairs ====================

    @Test
    void shouldReportEachPairOnce() {
        List<ViewConflict> conflicts = detector.findConflicts(List.of(
                view("v1", "用户喜欢咖啡"), view("v2", "用户不喜欢咖啡"), view("v3", "用户是早起的人")));

        assertEquals(1, conflicts.size());
    }

    @Test
    void shouldSkipClosedViews() {
        DerivedView rejected = view("v2", "用户不喜欢咖啡");
        rejected.transitionTo(ViewStatus.REJECTED, NOW);

        assertTrue(detector.findConflicts(List.of(view("v1", "用户喜欢咖啡"), rejected)).isEmpty());
    }

    @Test
    void shouldIgnoreMalformedAntonymPairs() {
        MemoryProperties properties = new MemoryProperties();
        properties.getConflicts().setAntonymPairs(List.of("broken", ":x", "喜欢:不喜欢"));
        ConflictDetectorService configured = new ConflictDetectorService(properties);

        assertEquals(1, configured.findConflicts(List.of(
                view("v1", "用户喜欢咖啡"), view("v2", "用户不喜欢咖啡"))).size());
    }
}
