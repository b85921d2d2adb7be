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
import me.golemcore.memory.domain.model.DerivedView;
import me.golemcore.memory.domain.model.StableConcept;
import me.golemcore.memory.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Versioned registry of promoted concepts.
 *
 * <p>
 * A concept is never edited in place and never deleted: a newer promotion of
 * the same canonical name creates version n+1 pointing at its parent, and the
 * parent is deprecated with {@code supersededBy}. Promoting the same view twice
 * returns the concept created the first time. All versions of a user live in
 * {@code concepts/<user>.json}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StableConceptRegistry {

    private static final String CONCEPTS_DIR = "concepts";
    private static final String JSON_EXTENSION = ".json";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final StoragePort storagePort;
    private final StorageRetrySupport storageRetry;
    private final JsonlCodec jsonlCodec;

    private final Map<String, List<StableConcept>> conceptCache = new ConcurrentHashMap<>();

    /**
     * Promotes a view into the registry.
     *
     * @return id of the concept version carrying the view
     */
    public String promote(DerivedView view, Instant now) {
        List<StableConcept> concepts = loadConcepts(view.getUserId());
        synchronized (concepts) {
            Optional<StableConcept> existing = concepts.stream()
                    .filter(concept -> concept.getDerivedFromViews().contains(view.getViewId()))
                    .findFirst();
            if (existing.isPresent()) {
                log.debug("[Concepts] View {} already promoted as {}", view.getViewId(),
                        existing.get().getConceptId());
                return existing.get().getConceptId();
            }

            String canonicalName = canonicalName(view);
            Optional<StableConcept> current = currentVersion(concepts, canonicalName);
            StableConcept concept = StableConcept.builder()
                    .conceptId(UUID.randomUUID().toString())
                    .userId(view.getUserId())
                    .canonicalName(canonicalName)
                    .displayName(view.getHypothesis())
                    .conceptType(view.getViewType())
                    .version(nextVersion(concepts, canonicalName))
                    .parentConceptId(current.map(StableConcept::getConceptId).orElse(null))
                    .derivedFromViews(new ArrayList<>(List.of(view.getViewId())))
                    .promotionConfidence(view.getConfidence())
                    .promotedAt(now)
                    .createdAt(now)
                    .build();

            commit(view.getUserId(), concepts, () -> {
                current.ifPresent(previous -> markDeprecated(previous, concept.getConceptId(), now));
                concepts.add(concept);
            });
            log.info("[Concepts] Promoted '{}' v{} for user {} from view {}", canonicalName, concept.getVersion(),
                    view.getUserId(), view.getViewId());
            return concept.getConceptId();
        }
    }

    public StableConcept deprecate(String userId, String conceptId, String supersededBy, Instant now) {
        List<StableConcept> concepts = loadConcepts(userId);
        synchronized (concepts) {
            StableConcept concept = concepts.stream()
                    .filter(candidate -> candidate.getConceptId().equals(conceptId))
                    .findFirst()
                    .orElseThrow(() -> new ValidationException("Unknown concept: " + conceptId));
            if (concept.isDeprecated()) {
                return copy(concept);
            }
            commit(userId, concepts, () -> markDeprecated(concept, supersededBy, now));
            log.info("[Concepts] Deprecated concept {} of user {}", conceptId, userId);
            return copy(concept);
        }
    }

    /**
     * Restores the content of the version preceding the current one as a new
     * version. The current version is deprecated, history is untouched.
     */
    public StableConcept rollback(String userId, String canonicalName, Instant now) {
        List<StableConcept> concepts = loadConcepts(userId);
        synchronized (concepts) {
            StableConcept current = currentVersion(concepts, canonicalName)
                    .orElseThrow(() -> new ValidationException("No active concept named " + canonicalName));
            StableConcept previous = concepts.stream()
                    .filter(concept -> concept.getConceptId().equals(current.getParentConceptId()))
                    .findFirst()
                    .orElseThrow(() -> new ValidationException(
                            "Concept " + canonicalName + " has no earlier version to roll back to"));

            StableConcept restored = previous.toBuilder()
                    .conceptId(UUID.randomUUID().toString())
                    .version(nextVersion(concepts, canonicalName))
                    .parentConceptId(current.getConceptId())
                    .derivedFromViews(new ArrayList<>(previous.getDerivedFromViews()))
                    .deprecated(false)
                    .deprecatedAt(null)
                    .supersededBy(null)
                    .promotedAt(now)
                    .createdAt(now)
                    .build();
            commit(userId, concepts, () -> {
                markDeprecated(current, restored.getConceptId(), now);
                concepts.add(restored);
            });
            log.info("[Concepts] Rolled back '{}' of user {} to the content of v{} as v{}", canonicalName, userId,
                    previous.getVersion(), restored.getVersion());
            return copy(restored);
        }
    }

    public List<StableConcept> getActiveConcepts(String userId) {
        return listAll(userId).stream().filter(StableConcept::isActive).toList();
    }

    public List<StableConcept> getVersionHistory(String userId, String canonicalName) {
        return listAll(userId).stream()
                .filter(concept -> concept.getCanonicalName().equals(canonicalName))
                .sorted(Comparator.comparingInt(StableConcept::getVersion))
                .toList();
    }

    public List<StableConcept> listAll(String userId) {
        List<StableConcept> concepts = loadConcepts(userId);
        synchronized (concepts) {
            return concepts.stream().map(this::copy).toList();
        }
    }

    public Optional<StableConcept> findById(String userId, String conceptId) {
        return listAll(userId).stream().filter(concept -> concept.getConceptId().equals(conceptId)).findFirst();
    }

    public boolean isActive(String userId, String conceptId) {
        return findById(userId, conceptId).map(StableConcept::isActive).orElse(false);
    }

    public static String canonicalName(DerivedView view) {
        if (view.getPatternKey() != null && !view.getPatternKey().isBlank()) {
            return view.getPatternKey();
        }
        return WHITESPACE.matcher(view.getHypothesis().trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    private Optional<StableConcept> currentVersion(List<StableConcept> concepts, String canonicalName) {
        return concepts.stream()
                .filter(concept -> concept.getCanonicalName().equals(canonicalName))
                .filter(StableConcept::isActive)
                .max(Comparator.comparingInt(StableConcept::getVersion));
    }

    private int nextVersion(List<StableConcept> concepts, String canonicalName) {
        return concepts.stream()
                .filter(concept -> concept.getCanonicalName().equals(canonicalName))
                .mapToInt(StableConcept::getVersion)
                .max()
                .orElse(0) + 1;
    }

    private void markDeprecated(StableConcept concept, String supersededBy, Instant now) {
        concept.setDeprecated(true);
        concept.setDeprecatedAt(now);
        concept.setSupersededBy(supersededBy);
    }

    // Applies the change, persists, and restores the previous in-memory state if the write fails.
    private void commit(String userId, List<StableConcept> concepts, Runnable change) {
        List<StableConcept> snapshot = concepts.stream().map(this::copy).toList();
        change.run();
        try {
            String json = jsonlCodec.toJson(concepts);
            storageRetry.write("write concepts of " + userId,
                    () -> storagePort.putTextAtomic(CONCEPTS_DIR, userId + JSON_EXTENSION, json, true));
        } catch (RuntimeException e) {
            concepts.clear();
            concepts.addAll(snapshot);
            throw e;
        }
    }

    private StableConcept copy(StableConcept concept) {
        return concept.toBuilder().derivedFromViews(new ArrayList<>(concept.getDerivedFromViews())).build();
    }

    private List<StableConcept> loadConcepts(String userId) {
        return conceptCache.computeIfAbsent(userId, id -> {
            String json = storageRetry.read("read concepts of " + id,
                    () -> storagePort.getText(CONCEPTS_DIR, id + JSON_EXTENSION));
            List<StableConcept> concepts = new ArrayList<>();
            if (json != null && !json.isBlank()) {
                concepts.addAll(jsonlCodec.fromJson(json, new TypeReference<List<StableConcept>>() {
                }));
            }
            return concepts;
        });
    }
}
