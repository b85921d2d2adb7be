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
import me.golemcore.memory.domain.model.UserDataExport;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Full per-user dump for backup and portability: raw inputs, events of both
 * tiers, entities, relationships, live and archived views, every concept
 * version and the audit log.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExportService {

    private final RawInputStore rawInputStore;
    private final EventStoreService eventStore;
    private final EntityResolverService entityResolver;
    private final EntityRelationService relationService;
    private final ViewStoreService viewStore;
    private final StableConceptRegistry conceptRegistry;
    private final AuditService auditService;
    private final JsonlCodec jsonlCodec;
    private final Clock clock;

    public UserDataExport exportUser(String userId) {
        Instant now = clock.instant();
        List<Event> events;
        try (Stream<Event> stream = eventStore.query(EventQuery.forUser(userId).toBuilder()
                .includeArchived(true)
                .build())) {
            events = stream.sorted(Comparator.comparing(Event::getTimestamp)).toList();
        }

        List<DerivedView> views = new ArrayList<>(viewStore.listArchived(userId));
        views.addAll(viewStore.list(userId));

        UserDataExport export = UserDataExport.builder()
                .userId(userId)
                .exportedAt(now)
                .rawInputs(new ArrayList<>(rawInputStore.list(userId)))
                .events(new ArrayList<>(events))
                .entities(new ArrayList<>(entityResolver.getEntities(userId)))
                .relationships(new ArrayList<>(relationService.getRelations(userId, now)))
                .views(views)
                .concepts(new ArrayList<>(conceptRegistry.listAll(userId)))
                .auditLog(new ArrayList<>(auditService.list(userId)))
                .build();
        log.info("[Export] Exported user {}: {} event(s), {} view(s), {} concept version(s)", userId,
                events.size(), views.size(), export.getConcepts().size());
        return export;
    }

    public String exportUserJson(String userId) {
        return jsonlCodec.toJson(exportUser(userId));
    }
}
