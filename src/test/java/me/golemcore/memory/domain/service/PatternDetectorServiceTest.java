package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.DerivedView;
import me.golemcore.memory.domain.model.Event;
import me.golemcore.memory.domain.model.ViewStatus;
import me.golemcore.memory.domain.model.ViewType;
import me.golemcore.memory.testsupport.MemoryTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatternDetectorServiceTest {

    private static final String USER = "alice";
    private static final Instant NOW = Instant.parse("2026-03-15T10:00:00Z");
    private static final Duration LOOKBACK = Duration.ofDays(30);

    @TempDir
    Path tempDir;

    private MemoryTestFixture fixture;
    private PatternDetectorService detector;

    @BeforeEach
    void setUp() {
        fixture = new MemoryTestFixture(tempDir, NOW);
        detector = fixture.getPatternDetector();
    }

    private Instant daysAgoAt(int days, int hour) {
        return NOW.truncatedTo(ChronoUnit.DAYS).minus(Duration.ofDays(days)).plus(Duration.ofHours(hour));
    }

    private List<Event> record(String action, String target, List<Instant> timestamps) {
        List<Event> events = new ArrayList<>();
        for (Instant timestamp : timestamps) {
            events.add(Event.builder()
                    .userId(USER)
                    .timestamp(timestamp)
                    .action(action)
                    .target(target)
                    .confidence(0.8)
                    .build());
        }
        return fixture.getEventStore().appendAll(events);
    }

    private List<Instant> dailyAt(int fromDaysAgo, int toDaysAgo, int hour) {
        List<Instant> timestamps = new ArrayList<>();
        for (int day = fromDaysAgo; day >= toDaysAgo; day--) {
            timestamps.add(daysAgoAt(day, hour));
        }
        return timestamps;
    }

    private List<DerivedView> ofType(List<DerivedView> views, ViewType type) {
        return views.stream().filter(view -> view.getViewType() == type).toList();
    }

    // ==================== frequency ====================

    @Test
    void shouldDetectDailyCoffeeHabit() {
        List<Event> stored = record("喝", "咖啡", dailyAt(24, 0, 8));

        List<DerivedView> views = detector.detectPatterns(USER, LOOKBACK, NOW);

        List<DerivedView> habits = ofType(views, ViewType.HABIT);
        assertEquals(1, habits.size());
        DerivedView habit = habits.get(0);
        assertEquals("frequency:喝:咖啡:8", habit.getPatternKey());
        assertEquals("用户经常在8点左右喝咖啡", habit.getHypothesis());
        assertEquals(25, habit.getDerivedFrom().size());
        assertTrue(habit.getDerivedFrom().containsAll(stored.stream().map(Event::getEventId).toList()));
        assertEquals(0.8 * 0.7, habit.getPriorConfidence(), 1e-9);
        assertEquals(0.56, habit.getConfidence(), 1e-9);
        assertEquals(ViewStatus.ACTIVE, habit.getStatus());
        assertEquals(NOW.plus(Duration.ofDays(30)), habit.getExpiresAt());
        assertEquals("detector:frequency", habit.getSource());
        assertNull(habit.getViewId());
    }

    @Test
    void shouldNotProposeHabitBelowThreshold() {
        record("喝", "咖啡", dailyAt(18, 0, 8));

        List<DerivedView> views = detector.detectPatterns(USER, LOOKBACK, NOW);

        assertTrue(ofType(views, ViewType.HABIT).isEmpty());
    }

    @Test
    void shouldBucketHoursInConfiguredZone() {
        record("喝", "咖啡", dailyAt(24, 0, 0));
        PatternDetectorService shanghai = new PatternDetectorService(fixture.getEventStore(),
                fixture.getProperties(), ZoneId.of("Asia/Shanghai"));

        List<DerivedView> habits = ofType(shanghai.detectPatterns(USER, LOOKBACK, NOW), ViewType.HABIT);

        assertEquals(1, habits.size());
        assertEquals("frequency:喝:咖啡:8", habits.get(0).getPatternKey());
    }

    @Test
    void shouldSplitSameActionAtDifferentHours() {
        record("喝", "咖啡", dailyAt(24, 0, 8));
        record("喝", "咖啡", dailyAt(24, 0, 15));

        List<DerivedView> habits = ofType(detector.detectPatterns(USER, LOOKBACK, NOW), ViewType.HABIT);

        assertEquals(2, habits.size());
        assertTrue(habits.stream().allMatch(view -> view.getDerivedFrom().size() == 25));
    }

    // ==================== preference ====================

    @Test
    void shouldDetectDominantChoice() {
        record("喝", "咖啡", dailyAt(24, 0, 8));

        List<DerivedView> preferences = ofType(detector.detectPatterns(USER, LOOKBACK, NOW), ViewType.PREFERENCE);

        assertEquals(1, preferences.size());
        DerivedView preference = preferences.get(0);
        assertEquals("preference:喝:咖啡", preference.getPatternKey());
        assertEquals("用户喜欢喝咖啡", preference.getHypothesis());
        assertEquals("咖啡", preference.getSubject());
        assertEquals("喝", preference.getAction());
        assertEquals(1.0, preference.getPriorConfidence(), 1e-9);
        assertEquals(25, preference.getValidationCount());
    }

    @Test
    void shouldStartPreferenceAtObservedRatio() {
        record("买", "咖啡", dailyAt(19, 0, 9));
        record("买", "茶", dailyAt(24, 20, 15));

        List<DerivedView> preferences = ofType(detector.detectPatterns(USER, LOOKBACK, NOW), ViewType.PREFERENCE);

        assertEquals(1, preferences.size());
        DerivedView preference = preferences.get(0);
        assertEquals("preference:买:咖啡", preference.getPatternKey());
        assertEquals(20, preference.getValidationCount());
        assertEquals(0.8, preference.getPriorConfidence(), 1e-9);
        assertEquals(0.8, preference.getConfidence(), 1e-9);
    }

    @Test
    void shouldNotProposePreferenceWithoutClearMajority() {
        record("喝", "咖啡", dailyAt(6, 1, 8));
        record("喝", "茶", dailyAt(4, 1, 15));

        List<DerivedView> preferences = ofType(detector.detectPatterns(USER, LOOKBACK, NOW), ViewType.PREFERENCE);

        assertTrue(preferences.isEmpty());
    }

    @Test
    void shouldRequireMinimumOccurrencesForPreference() {
        record("喝", "咖啡", dailyAt(4, 1, 8));

        assertTrue(ofType(detector.detectPatterns(USER, LOOKBACK, NOW), ViewType.PREFERENCE).isEmpty());
    }

    // ==================== trend ====================

    @Test
    void shouldDetectRisingTrend() {
        List<Instant> timestamps = new ArrayList<>(List.of(daysAgoAt(20, 8), daysAgoAt(19, 8)));
        timestamps.addAll(dailyAt(5, 2, 8));
        timestamps.addAll(dailyAt(5, 2, 15));
        record("喝", "咖啡", timestamps);

        List<DerivedView> trends = ofType(detector.detectPatterns(USER, LOOKBACK, NOW), ViewType.TREND);

        assertEquals(1, trends.size());
        DerivedView trend = trends.get(0);
        assertEquals("trend:喝:咖啡:up", trend.getPatternKey());
        assertEquals("用户喝咖啡的频率在增加", trend.getHypothesis());
        assertEquals(10, trend.getDerivedFrom().size());
        assertEquals(0.7, trend.getPriorConfidence(), 1e-9);
    }

    @Test
    void shouldDetectFallingTrend() {
        List<Instant> timestamps = new ArrayList<>(dailyAt(20, 17, 8));
        timestamps.addAll(dailyAt(20, 17, 15));
        timestamps.add(daysAgoAt(3, 8));
        timestamps.add(daysAgoAt(2, 8));
        record("喝", "咖啡", timestamps);

        List<DerivedView> trends = ofType(detector.detectPatterns(USER, LOOKBACK, NOW), ViewType.TREND);

        assertEquals(1, trends.size());
        assertEquals("trend:喝:咖啡:down", trends.get(0).getPatternKey());
        assertEquals(0.75 * 0.7, trends.get(0).getPriorConfidence(), 1e-9);
    }

    @Test
    void shouldNotReportSteadyRateAsTrend() {
        record("喝", "咖啡", dailyAt(24, 0, 8));

        assertTrue(ofType(detector.detectPatterns(USER, LOOKBACK, NOW), ViewType.TREND).isEmpty());
    }

    @Test
    void shouldSkipTrendsWhenDisabled() {
        fixture.getProperties().getPatterns().setTrendEnabled(false);
        List<Instant> timestamps = new ArrayList<>(List.of(daysAgoAt(20, 8), daysAgoAt(19, 8)));
        timestamps.addAll(dailyAt(5, 2, 8));
        timestamps.addAll(dailyAt(5, 2, 15));
        record("喝", "咖啡", timestamps);

        assertTrue(ofType(detector.detectPatterns(USER, LOOKBACK, NOW), ViewType.TREND).isEmpty());
    }

    // ==================== window ====================

    @Test
    void shouldIgnoreEventsOutsideWindow() {
        record("喝", "咖啡", dailyAt(60, 36, 8));
        record("喝", "咖啡", List.of(NOW.plus(Duration.ofDays(1))));

        assertTrue(detector.detectPatterns(USER, LOOKBACK, NOW).isEmpty());
    }

    @Test
    void shouldReturnNothingForUnknownUser() {
        assertTrue(detector.detectPatterns("nobody", LOOKBACK, NOW).isEmpty());
    }

    @Test
    void shouldReportMinimumSupportPerType() {
        assertEquals(20, detector.minimumSupport(ViewType.HABIT));
        assertEquals(5, detector.minimumSupport(ViewType.PREFERENCE));
        assertEquals(6, detector.minimumSupport(ViewType.TREND));
        assertEquals(1, detector.minimumSupport(ViewType.BELIEF));
    }
}
