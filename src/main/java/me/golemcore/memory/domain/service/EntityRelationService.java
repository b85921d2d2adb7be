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

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.EntityRelationship;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Co-occurrence edges between entities seen in the same input, stored as a
 * plain edge list per user in {@code relations/<user>.json}.
 *
 * <p>
 * Strength is {@code (1 - exp(-count / saturation)) * exp(-daysSinceLast / decay)}
 * and is recomputed whenever an edge is read or strengthened.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityRelationService {

    private static final String RELATIONS_DIR = "relations";

    private final StoragePort storagePort;
    private final StorageRetrySupport storageRetry;
    private final JsonlCodec jsonlCodec;
    private final MemoryProperties properties;

    private final Map<String, List<EntityRelationship>> relationCache = new ConcurrentHashMap<>();

    /**
     * Strengthens one edge per unordered pair of distinct entities.
     *
     * @return number of edges touched
     */
    public int recordCoOccurrence(String userId, Collection<String> entityIds, Instant timestamp) {
        List<String> ids = entityIds.stream().distinct().sorted().toList();
        if (ids.size() < 2) {
            return 0;
        }
        List<EntityRelationship> relations = loadRelations(userId);
        int touched = 0;
        synchronized (relations) {
            List<EntityRelationship> snapshot = relations.stream().map(relation -> relation.toBuilder().build())
                    .toList();
            for (int i = 0; i < ids.size(); i++) {
                for (int j = i + 1; j < ids.size(); j++) {
                    strengthen(userId, relations, ids.get(i), ids.get(j), timestamp);
                    touched++;
                }
            }
            try {
                persist(userId, relations);
            } catch (RuntimeException e) {
                relations.clear();
                relations.addAll(snapshot);
                throw e;
            }
        }
        log.debug("[Relations] Recorded {} co-occurrence edge(s) for user {}", touched, userId);
        return touched;
    }

    public List<EntityRelationship> findRelated(String userId, String entityId, double minStrength, Instant now) {
        return getRelations(userId, now).stream()
                .filter(relation -> relation.involves(entityId))
                .filter(relation -> relation.getStrength() >= minStrength)
                .sorted(Comparator.comparingDouble(EntityRelationship::getStrength).reversed())
                .toList();
    }

    public List<EntityRelationship> getRelations(String userId, Instant now) {
        List<EntityRelationship> relations = loadRelations(userId);
        synchronized (relations) {
            List<EntityRelationship> snapshot = new ArrayList<>();
            for (EntityRelationship relation : relations) {
                EntityRelationship copy = relation.toBuilder().build();
                copy.setStrength(strength(copy.getCoOccurrenceCount(), copy.getLastSeen(), now));
                snapshot.add(copy);
            }
            return snapshot;
        }
    }

    double strength(long count, Instant lastSeen, Instant now) {
        MemoryProperties.RelationProperties config = properties.getRelations();
        double frequency = 1.0 - Math.exp(-count / config.getCountSaturation());
        double days = lastSeen == null || !now.isAfter(lastSeen)
                ? 0.0
                : Duration.between(lastSeen, now).toMillis() / (double) Duration.ofDays(1).toMillis();
        return frequency * Math.exp(-days / config.getRecencyDecayDays());
    }

    private void strengthen(String userId, List<EntityRelationship> relations, String source, String target,
            Instant timestamp) {
        Optional<EntityRelationship> existing = relations.stream()
                .filter(relation -> relation.getSourceEntityId().equals(source)
                        && relation.getTargetEntityId().equals(target))
                .findFirst();
        EntityRelationship relation = existing.orElseGet(() -> {
            EntityRelationship created = EntityRelationship.builder()
                    .relationId(UUID.randomUUID().toString())
                    .userId(userId)
                    .sourceEntityId(source)
                    .targetEntityId(target)
                    .firstSeen(timestamp)
                    .lastSeen(timestamp)
                    .build();
            relations.add(created);
            return created;
        });
        relation.setCoOccurrenceCount(relation.getCoOccurrenceCount() + 1);
        if (relation.getLastSeen() == null || timestamp.isAfter(relation.getLastSeen())) {
            relation.setLastSeen(timestamp);
        }
        relation.setStrength(strength(relation.getCoOccurrenceCount(), relation.getLastSeen(), timestamp));
    }

    private List<EntityRelationship> loadRelations(String userId) {
        return relationCache.computeIfAbsent(userId, id -> {
            String json = storageRetry.read("read relations of " + id,
                    () -> storagePort.getText(RELATIONS_DIR, id + ".json"));
            if (json == null || json.isBlank()) {
                return new ArrayList<>();
            }
            return new ArrayList<>(jsonlCodec.fromJson(json, new TypeReference<List<EntityRelationship>>() {
            }));
        });
    }

    private void persist(String userId, List<EntityRelationship> relations) {
        String json = jsonlCodec.toJson(relations);
        storageRetry.write("write relations of " + userId,
                () -> storagePort.putTextAtomic(RELATIONS_DIR, userId + ".json", json, false));
    }
}
