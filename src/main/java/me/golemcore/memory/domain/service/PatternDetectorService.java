package me.golemcore.memory.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.DerivedView;
import me.golemcore.memory.domain.model.Event;
import me.golemcore.memory.domain.model.EventQuery;
import me.golemcore.memory.domain.model.ViewType;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scans a user's recent events and proposes derived views.
 *
 * <p>
 * Three families:
 * <ul>
 * <li>frequency: same (action, target, local hour) at least
 * {@code frequency-threshold} times in the window; prior is the mean raw
 * extraction confidence discounted by {@code llm-confidence-discount}</li>
 * <li>preference: within one action, a target chosen in at least
 * {@code preference-ratio} of the instances and at least
 * {@code preference-min-occurrences} times; prior is the observed ratio</li>
 * <li>trend: the per-day rate of an (action, target) pair changed by more than
 * {@code trend-min-change} between the two halves of its observed span</li>
 * </ul>
 * Candidates are returned, not stored; every candidate cites exactly the events
 * supporting it and starts with its prior as confidence. The validation reward
 * is only added when later evidence is merged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatternDetectorService {

    static final String FREQUENCY_KEY = "frequency";
    static final String PREFERENCE_KEY = "preference";
    static final String TREND_KEY = "trend";
    private static final double MIN_TREND_SPAN_DAYS = 2.0;

    private final EventStoreService eventStoreService;
    private final MemoryProperties properties;
    private final ZoneId memoryZoneId;

    public List<DerivedView> detectPatterns(String userId, Duration lookback, Instant now) {
        Instant from = now.minus(lookback);
        List<Event> events;
        try (Stream<Event> stream = eventStoreService.query(EventQuery.builder()
                .userId(userId)
                .from(from)
                .build())) {
            events = stream.filter(event -> !event.getTimestamp().isAfter(now)).toList();
        }
        if (events.isEmpty()) {
            return List.of();
        }

        List<DerivedView> candidates = new ArrayList<>();
        candidates.addAll(detectFrequencyPatterns(userId, events, now));
        candidates.addAll(detectPreferencePatterns(userId, events, now));
        if (properties.getPatterns().isTrendEnabled()) {
            candidates.addAll(detectTrendPatterns(userId, events, now));
        }
        log.debug("[PatternDetector] {} event(s) of user {} in window produced {} candidate view(s)",
                events.size(), userId, candidates.size());
        return candidates;
    }

    /**
     * Smallest evidence set a re-proposed view of this type must carry.
     */
    public int minimumSupport(ViewType viewType) {
        MemoryProperties.PatternProperties config = properties.getPatterns();
        return switch (viewType) {
            case HABIT, PATTERN -> config.getFrequencyThreshold();
            case PREFERENCE -> config.getPreferenceMinOccurrences();
            case TREND -> config.getTrendMinEvents();
            default -> 1;
        };
    }

    List<DerivedView> detectFrequencyPatterns(String userId, List<Event> events, Instant now) {
        MemoryProperties.PatternProperties config = properties.getPatterns();
        Map<String, List<Event>> groups = events.stream().collect(Collectors.groupingBy(
                event -> event.getAction() + "\u0000" + event.getTarget() + "\u0000" + hourOf(event),
                LinkedHashMap::new, Collectors.toList()));

        List<DerivedView> views = new ArrayList<>();
        for (List<Event> group : groups.values()) {
            if (group.size() < config.getFrequencyThreshold()) {
                continue;
            }
            Event first = group.get(0);
            int hour = hourOf(first);
            double meanRaw = group.stream().mapToDouble(Event::getConfidence).average().orElse(0.0);
            double prior = meanRaw * config.getLlmConfidenceDiscount();
            views.add(candidate(userId, ViewType.HABIT, first.getAction(), first.getTarget(),
                    FREQUENCY_KEY + ":" + first.getAction() + ":" + first.getTarget() + ":" + hour,
                    "用户经常在" + hour + "点左右" + first.getAction() + first.getTarget(),
                    group, prior, now));
        }
        return views;
    }

    List<DerivedView> detectPreferencePatterns(String userId, List<Event> events, Instant now) {
        MemoryProperties.PatternProperties config = properties.getPatterns();
        Map<String, List<Event>> byAction = events.stream().collect(Collectors.groupingBy(
                Event::getAction, LinkedHashMap::new, Collectors.toList()));

        List<DerivedView> views = new ArrayList<>();
        for (Map.Entry<String, List<Event>> entry : byAction.entrySet()) {
            List<Event> actionEvents = entry.getValue();
            Map<String, List<Event>> byTarget = actionEvents.stream().collect(Collectors.groupingBy(
                    Event::getTarget, LinkedHashMap::new, Collectors.toList()));
            for (List<Event> chosen : byTarget.values()) {
                double ratio = (double) chosen.size() / actionEvents.size();
                if (chosen.size() < config.getPreferenceMinOccurrences() || ratio < config.getPreferenceRatio()) {
                    continue;
                }
                Event first = chosen.get(0);
                views.add(candidate(userId, ViewType.PREFERENCE, entry.getKey(), first.getTarget(),
                        PREFERENCE_KEY + ":" + entry.getKey() + ":" + first.getTarget(),
                        "用户喜欢" + entry.getKey() + first.getTarget(),
                        chosen, ratio, now));
            }
        }
        return views;
    }

    List<DerivedView> detectTrendPatterns(String userId, List<Event> events, Instant now) {
        MemoryProperties.PatternProperties config = properties.getPatterns();
        Map<String, List<Event>> groups = events.stream().collect(Collectors.groupingBy(
                event -> event.getAction() + "\u0000" + event.getTarget(), LinkedHashMap::new, Collectors.toList()));

        List<DerivedView> views = new ArrayList<>();
        for (List<Event> group : groups.values()) {
            if (group.size() < config.getTrendMinEvents()) {
                continue;
            }
            Instant start = group.stream().map(Event::getTimestamp).min(Comparator.naturalOrder()).orElse(now);
            double spanDays = Duration.between(start, now).toMillis() / (double) Duration.ofDays(1).toMillis();
            if (spanDays < MIN_TREND_SPAN_DAYS) {
                continue;
            }
            Instant middle = start.plus(Duration.between(start, now).dividedBy(2));
            long firstHalf = group.stream().filter(event -> event.getTimestamp().isBefore(middle)).count();
            long secondHalf = group.size() - firstHalf;
            double change = (double) (secondHalf - firstHalf) / Math.max(firstHalf, 1);
            if (Math.abs(change) <= config.getTrendMinChange()) {
                continue;
            }
            Event first = group.get(0);
            boolean rising = change > 0;
            double prior = Math.min(Math.abs(change), 1.0) * config.getLlmConfidenceDiscount();
            views.add(candidate(userId, ViewType.TREND, first.getAction(), first.getTarget(),
                    TREND_KEY + ":" + first.getAction() + ":" + first.getTarget() + ":" + (rising ? "up" : "down"),
                    "用户" + first.getAction() + first.getTarget() + "的频率在" + (rising ? "增加" : "减少"),
                    group, prior, now));
        }
        return views;
    }

    private DerivedView candidate(String userId, ViewType viewType, String action, String subject,
            String patternKey, String hypothesis, List<Event> support, double prior, Instant now) {
        List<String> eventIds = support.stream().map(Event::getEventId).distinct().toList();
        int ttlDays = properties.getViews().getDefaultTtlDays();
        return DerivedView.create(DerivedView.builder()
                .userId(userId)
                .viewType(viewType)
                .action(action)
                .subject(subject)
                .patternKey(patternKey)
                .hypothesis(hypothesis)
                .derivedFrom(new ArrayList<>(eventIds))
                .priorConfidence(prior)
                .confidence(ConfidenceModel.clamp(prior))
                .createdAt(now)
                .updatedAt(now)
                .expiresAt(now.plus(Duration.ofDays(ttlDays)))
                .source("detector:" + patternKey.substring(0, patternKey.indexOf(':'))));
    }

    private int hourOf(Event event) {
        return event.getTimestamp().atZone(memoryZoneId).getHour();
    }
}
