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
import me.golemcore.memory.domain.exception.ValidationException;
import me.golemcore.memory.domain.model.Entity;
import me.golemcore.memory.domain.model.EntityAttribute;
import me.golemcore.memory.domain.model.EntityTypes;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Turns raw mentions into canonical entities.
 *
 * <p>
 * Resolution looks up exact then fuzzy (Jaro-Winkler) name matches for the
 * user. With no candidate a new entity is created, typed by context keywords.
 * With several candidates, or one whose known type disagrees with the context,
 * each is scored by type agreement and context keyword overlap and reused only
 * above the configured threshold; otherwise a new disjoint entity is created
 * rather than guessing. Every resolution counts as a mention.
 *
 * <p>
 * Entities are kept per user in {@code entities/<user>.json}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityResolverService {

    private static final String ENTITIES_DIR = "entities";
    private static final double TYPE_MATCH = 1.0;
    private static final double TYPE_UNKNOWN = 0.5;
    private static final double TYPE_REINFORCEMENT = 0.05;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NAME_SUFFIX = Pattern.compile("\\s*(\\([^)]*\\))?\\s*(#\\d+)?$");

    private final StoragePort storagePort;
    private final StorageRetrySupport storageRetry;
    private final JsonlCodec jsonlCodec;
    private final EventValidator eventValidator;
    private final ContextClassifier contextClassifier;
    private final EntityAttributeExtractor attributeExtractor;
    private final MemoryProperties properties;

    private final Map<String, List<Entity>> entityCache = new ConcurrentHashMap<>();

    public Entity resolve(String userId, String mention, String context, Instant timestamp) {
        eventValidator.validateUserId(userId);
        String name = normalizeName(mention);
        if (name.isEmpty()) {
            throw new ValidationException("Entity mention must not be empty");
        }
        if (timestamp == null) {
            throw new ValidationException("Resolution timestamp is required");
        }

        List<Entity> entities = loadEntities(userId);
        synchronized (entities) {
            ContextClassifier.Classification classification = contextClassifier.classify(context);
            Set<String> contextTokens = contextClassifier.keywords(context, name);

            Entity entity = commit(userId, entities, () -> {
                Entity resolved = selectCandidate(findCandidates(entities, name), classification, contextTokens)
                        .orElseGet(() -> createEntity(userId, name, entities, classification, timestamp));
                recordMention(resolved, classification, contextTokens, timestamp);
                mergeAttributes(resolved, context, timestamp);
                return resolved;
            });
            log.debug("[EntityResolver] '{}' -> {} ({}, mentions={})", mention, entity.getCanonicalName(),
                    entity.getEntityType(), entity.getMentionCount());
            return entity;
        }
    }

    public List<Entity> getEntities(String userId) {
        List<Entity> entities = loadEntities(userId);
        synchronized (entities) {
            return new ArrayList<>(entities);
        }
    }

    public Optional<Entity> findById(String userId, String entityId) {
        return getEntities(userId).stream()
                .filter(entity -> entity.getEntityId().equals(entityId))
                .findFirst();
    }

    public Optional<Entity> findByCanonicalName(String userId, String canonicalName) {
        return getEntities(userId).stream()
                .filter(entity -> entity.getCanonicalName().equals(canonicalName))
                .findFirst();
    }

    /**
     * Lowers type confidence of entities not seen for a while. Entities are
     * never removed. Applying decay twice at the same instant changes nothing.
     *
     * @return number of entities whose confidence changed
     */
    public int decay(String userId, Instant now) {
        List<Entity> entities = loadEntities(userId);
        MemoryProperties.EntityProperties config = properties.getEntities();
        Duration idleThreshold = Duration.ofDays(config.getDecayAfterDays());
        synchronized (entities) {
            List<Entity> idle = new ArrayList<>();
            for (Entity entity : entities) {
                if (entity.getLastSeen() == null || entity.getLastSeen().plus(idleThreshold).isAfter(now)) {
                    continue;
                }
                if (daysBetween(decayReference(entity), now) > 0) {
                    idle.add(entity);
                }
            }
            if (idle.isEmpty()) {
                return 0;
            }
            commit(userId, entities, () -> {
                for (Entity entity : idle) {
                    double elapsedDays = daysBetween(decayReference(entity), now);
                    entity.setTypeConfidence(entity.getTypeConfidence()
                            * Math.exp(-elapsedDays / config.getRecencyDecayDays()));
                    entity.setLastDecayedAt(now);
                }
                return idle.size();
            });
            log.debug("[EntityResolver] Decayed {} idle entities of user {}", idle.size(), userId);
            return idle.size();
        }
    }

    private static Instant decayReference(Entity entity) {
        return entity.getLastDecayedAt() != null && entity.getLastDecayedAt().isAfter(entity.getLastSeen())
                ? entity.getLastDecayedAt()
                : entity.getLastSeen();
    }

    /**
     * Confidence of an attribute value at {@code now}: base confidence weighted
     * by mention frequency, consistency across observations and recency.
     */
    public double attributeConfidence(EntityAttribute attribute, double baseConfidence, Instant now) {
        double frequency = Math.min(1.0, 0.5 + 0.1 * attribute.getSupportCount());
        double consistency = attribute.getObservationCount() == 0
                ? 1.0
                : (double) attribute.getSupportCount() / attribute.getObservationCount();
        double recency = Math.exp(-daysBetween(attribute.getLastConfirmed(), now)
                / properties.getEntities().getRecencyDecayDays());
        return baseConfidence * frequency * consistency * recency;
    }

    private List<Entity> findCandidates(List<Entity> entities, String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        List<Entity> exact = entities.stream()
                .filter(entity -> baseName(entity.getCanonicalName()).toLowerCase(Locale.ROOT).equals(lower))
                .toList();
        if (!exact.isEmpty()) {
            return exact;
        }
        double threshold = properties.getEntities().getFuzzyThreshold();
        return entities.stream()
                .filter(entity -> NameSimilarity.jaroWinkler(
                        baseName(entity.getCanonicalName()).toLowerCase(Locale.ROOT), lower) >= threshold)
                .toList();
    }

    private Optional<Entity> selectCandidate(List<Entity> candidates, ContextClassifier.Classification classification,
            Set<String> contextTokens) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        if (candidates.size() == 1) {
            Entity only = candidates.get(0);
            boolean typeConflict = classification.isKnown() && !EntityTypes.isUnknown(only.getEntityType())
                    && !classification.entityType().equals(only.getEntityType());
            if (!typeConflict) {
                return Optional.of(only);
            }
        }
        double threshold = properties.getEntities().getContextMatchThreshold();
        return candidates.stream()
                .map(candidate -> Map.entry(candidate, contextScore(candidate, classification, contextTokens)))
                .filter(scored -> scored.getValue() > threshold)
                .max(Comparator.comparingDouble(Map.Entry<Entity, Double>::getValue)
                        .thenComparingLong(scored -> scored.getKey().getMentionCount()))
                .map(Map.Entry::getKey);
    }

    double contextScore(Entity candidate, ContextClassifier.Classification classification,
            Set<String> contextTokens) {
        double typeScore;
        if (!classification.isKnown() || EntityTypes.isUnknown(candidate.getEntityType())) {
            typeScore = TYPE_UNKNOWN;
        } else {
            typeScore = classification.entityType().equals(candidate.getEntityType()) ? TYPE_MATCH : 0.0;
        }
        double overlap = 0.0;
        if (!contextTokens.isEmpty()) {
            Set<String> history = new LinkedHashSet<>(candidate.getContextKeywords());
            long shared = contextTokens.stream().filter(history::contains).count();
            overlap = (double) shared / contextTokens.size();
        }
        return 0.5 * typeScore + 0.5 * overlap;
    }

    private Entity createEntity(String userId, String name, List<Entity> entities,
            ContextClassifier.Classification classification, Instant timestamp) {
        String canonicalName = uniqueName(name, classification.entityType(), entities);
        Entity entity = Entity.builder()
                .entityId(UUID.randomUUID().toString())
                .userId(userId)
                .canonicalName(canonicalName)
                .entityType(classification.entityType())
                .typeConfidence(classification.confidence())
                .firstSeen(timestamp)
                .lastSeen(timestamp)
                .build();
        entities.add(entity);
        log.info("[EntityResolver] New entity '{}' ({}) for user {}", canonicalName, entity.getEntityType(), userId);
        return entity;
    }

    private String uniqueName(String name, String entityType, List<Entity> entities) {
        Set<String> taken = new LinkedHashSet<>();
        entities.forEach(entity -> taken.add(entity.getCanonicalName()));
        if (!taken.contains(name)) {
            return name;
        }
        String typed = name + " (" + entityType + ")";
        String candidate = typed;
        for (int n = 2; taken.contains(candidate); n++) {
            candidate = typed + " #" + n;
        }
        return candidate;
    }

    private void recordMention(Entity entity, ContextClassifier.Classification classification,
            Set<String> contextTokens, Instant timestamp) {
        entity.setMentionCount(entity.getMentionCount() + 1);
        if (entity.getLastSeen() == null || timestamp.isAfter(entity.getLastSeen())) {
            entity.setLastSeen(timestamp);
        }
        if (entity.getFirstSeen() == null || timestamp.isBefore(entity.getFirstSeen())) {
            entity.setFirstSeen(timestamp);
        }

        if (EntityTypes.isUnknown(entity.getEntityType()) && classification.isKnown()) {
            entity.setEntityType(classification.entityType());
            entity.setTypeConfidence(classification.confidence());
        } else if (classification.isKnown() && classification.entityType().equals(entity.getEntityType())) {
            entity.setTypeConfidence(Math.min(1.0, entity.getTypeConfidence() + TYPE_REINFORCEMENT));
        }

        LinkedHashSet<String> keywords = new LinkedHashSet<>(entity.getContextKeywords());
        keywords.addAll(contextTokens);
        List<String> bounded = new ArrayList<>(keywords);
        int max = properties.getEntities().getMaxContextKeywords();
        if (bounded.size() > max) {
            bounded = new ArrayList<>(bounded.subList(bounded.size() - max, bounded.size()));
        }
        entity.setContextKeywords(bounded);
    }

    private void mergeAttributes(Entity entity, String context, Instant timestamp) {
        attributeExtractor.extract(context).forEach((key, extracted) -> {
            EntityAttribute existing = entity.getAttributes().get(key);
            if (existing == null) {
                EntityAttribute created = EntityAttribute.builder()
                        .value(extracted.value())
                        .supportCount(1)
                        .observationCount(1)
                        .firstSeen(timestamp)
                        .lastConfirmed(timestamp)
                        .build();
                created.setConfidence(attributeConfidence(created, extracted.baseConfidence(), timestamp));
                entity.getAttributes().put(key, created);
                return;
            }

            existing.setObservationCount(existing.getObservationCount() + 1);
            if (existing.getValue().equals(extracted.value())) {
                existing.setSupportCount(existing.getSupportCount() + 1);
                if (existing.getLastConfirmed() == null || timestamp.isAfter(existing.getLastConfirmed())) {
                    existing.setLastConfirmed(timestamp);
                }
                existing.setConfidence(attributeConfidence(existing, extracted.baseConfidence(), timestamp));
                return;
            }

            EntityAttribute challenger = EntityAttribute.builder()
                    .value(extracted.value())
                    .supportCount(1)
                    .observationCount(existing.getObservationCount())
                    .firstSeen(timestamp)
                    .lastConfirmed(timestamp)
                    .build();
            double challengerConfidence = attributeConfidence(challenger, extracted.baseConfidence(), timestamp);
            double currentConfidence = attributeConfidence(existing, extracted.baseConfidence(), timestamp);
            if (challengerConfidence > currentConfidence) {
                challenger.setConfidence(challengerConfidence);
                entity.getAttributes().put(key, challenger);
                log.debug("[EntityResolver] {}.{}: '{}' replaced '{}'", entity.getCanonicalName(), key,
                        challenger.getValue(), existing.getValue());
            } else {
                existing.setConfidence(currentConfidence);
            }
        });
    }

    private List<Entity> loadEntities(String userId) {
        return entityCache.computeIfAbsent(userId, id -> {
            String json = storageRetry.read("read entities of " + id,
                    () -> storagePort.getText(ENTITIES_DIR, id + ".json"));
            if (json == null || json.isBlank()) {
                return new ArrayList<>();
            }
            return new ArrayList<>(jsonlCodec.fromJson(json, new TypeReference<List<Entity>>() {
            }));
        });
    }

    // Applies the change and writes the list; a failed write restores the cached state.
    private <T> T commit(String userId, List<Entity> entities, Supplier<T> change) {
        List<Entity> snapshot = entities.stream().map(EntityResolverService::copy).toList();
        T result = change.get();
        try {
            String json = jsonlCodec.toJson(entities);
            storageRetry.write("write entities of " + userId,
                    () -> storagePort.putTextAtomic(ENTITIES_DIR, userId + ".json", json, true));
        } catch (RuntimeException e) {
            entities.clear();
            entities.addAll(snapshot);
            throw e;
        }
        return result;
    }

    private static Entity copy(Entity entity) {
        Map<String, EntityAttribute> attributes = new LinkedHashMap<>();
        entity.getAttributes().forEach((key, attribute) -> attributes.put(key, attribute.toBuilder().build()));
        return entity.toBuilder()
                .attributes(attributes)
                .contextKeywords(new ArrayList<>(entity.getContextKeywords()))
                .build();
    }

    static String normalizeName(String mention) {
        if (mention == null) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(mention.trim()).replaceAll(" ");
        if (!collapsed.isEmpty() && collapsed.chars().allMatch(c -> c < 128)) {
            String[] words = collapsed.split(" ");
            StringBuilder sb = new StringBuilder();
            for (String word : words) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
            }
            return sb.toString();
        }
        return collapsed;
    }

    static String baseName(String canonicalName) {
        return NAME_SUFFIX.matcher(canonicalName).replaceFirst("");
    }

    private static double daysBetween(Instant from, Instant to) {
        if (from == null || !to.isAfter(from)) {
            return 0.0;
        }
        return Duration.between(from, to).toMillis() / (double) Duration.ofDays(1).toMillis();
    }
}
