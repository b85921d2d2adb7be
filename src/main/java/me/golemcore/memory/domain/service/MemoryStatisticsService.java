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
import me.golemcore.memory.domain.exception.StorageUnavailableException;
import me.golemcore.memory.domain.model.DerivedView;
import me.golemcore.memory.domain.model.Event;
import me.golemcore.memory.domain.model.EventQuery;
import me.golemcore.memory.domain.model.MemoryStatistics;
import me.golemcore.memory.domain.model.StableConcept;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Aggregated counts about a user's memory. The last successful aggregate is
 * cached and served, marked stale, when storage cannot be read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryStatisticsService {

    private final EventStoreService eventStore;
    private final RawInputStore rawInputStore;
    private final EntityResolverService entityResolver;
    private final EntityRelationService relationService;
    private final ViewStoreService viewStore;
    private final StableConceptRegistry conceptRegistry;
    private final Clock clock;

    private final Map<String, MemoryStatistics> lastKnown = new ConcurrentHashMap<>();

    public MemoryStatistics getStatistics(String userId) {
        try {
            MemoryStatistics statistics = compute(userId);
            lastKnown.put(userId, statistics);
            return statistics;
        } catch (StorageUnavailableException e) {
            MemoryStatistics cached = lastKnown.get(userId);
            if (cached == null) {
                throw e;
            }
            log.warn("[Statistics] Storage unavailable for user {}, serving aggregate from {}", userId,
                    cached.getComputedAt());
            return cached.toBuilder()
                    .eventsByAction(new LinkedHashMap<>(cached.getEventsByAction()))
                    .stale(true)
                    .build();
        }
    }

    private MemoryStatistics compute(String userId) {
        Instant now = clock.instant();
        Map<String, Long> byAction = new TreeMap<>();
        long eventCount = 0;
        Instant first = null;
        Instant last = null;
        try (Stream<Event> events = eventStore.query(EventQuery.forUser(userId).toBuilder()
                .includeArchived(true)
                .build())) {
            for (Event event : (Iterable<Event>) events::iterator) {
                eventCount++;
                byAction.merge(event.getAction(), 1L, Long::sum);
                if (first == null || event.getTimestamp().isBefore(first)) {
                    first = event.getTimestamp();
                }
                if (last == null || event.getTimestamp().isAfter(last)) {
                    last = event.getTimestamp();
                }
            }
        }

        List<DerivedView> views = viewStore.list(userId);
        List<StableConcept> concepts = conceptRegistry.listAll(userId);
        long activeViews = views.stream().filter(DerivedView::isActive).count();
        return MemoryStatistics.builder()
                .userId(userId)
                .eventCount(eventCount)
                .rawInputCount(rawInputStore.list(userId).size())
                .entityCount(entityResolver.getEntities(userId).size())
                .relationCount(relationService.getRelations(userId, now).size())
                .activeViewCount(activeViews)
                .closedViewCount(views.size() - activeViews + viewStore.listArchived(userId).size())
                .activeConceptCount(concepts.stream().filter(StableConcept::isActive).count())
                .conceptVersionCount(concepts.size())
                .eventsByAction(new LinkedHashMap<>(byAction))
                .firstEventAt(first)
                .lastEventAt(last)
                .computedAt(now)
                .stale(false)
                .build();
    }
}
