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
import me.golemcore.memory.domain.exception.ValidationException;
import me.golemcore.memory.domain.model.CandidateEvent;
import me.golemcore.memory.domain.model.Entity;
import me.golemcore.memory.domain.model.Event;
import me.golemcore.memory.domain.model.EventsIngestedEvent;
import me.golemcore.memory.domain.model.ExtractionMethod;
import me.golemcore.memory.domain.model.IngestionResult;
import me.golemcore.memory.domain.model.RawInput;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.infrastructure.event.SpringEventBus;
import me.golemcore.memory.port.outbound.ExtractionPort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Write path from free text to stored events.
 *
 * <p>
 * The raw input is stored before anything else so no statement is ever lost.
 * Extraction goes through the {@link ExtractionPort} with a timeout and
 * retries; on failure or an empty answer the rule-based extractor takes over.
 * Candidates are sanitized (confidence clamped, blanks dropped) before an
 * {@link Event} is built. Stored events resolve their entities, feed
 * counter-evidence into active views and notify the sweep scheduler.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventIngestionService {

    private static final double DEFAULT_CONFIDENCE = 0.5;

    private final RawInputStore rawInputStore;
    private final EventStoreService eventStore;
    private final ExtractionPort extractionPort;
    private final RuleBasedEventExtractor ruleExtractor;
    private final EntityResolverService entityResolver;
    private final EntityRelationService relationService;
    private final CounterEvidenceService counterEvidence;
    private final EventValidator eventValidator;
    private final SpringEventBus eventBus;
    private final MemoryProperties properties;
    private final Clock clock;

    public IngestionResult ingest(String userId, String text, String context) {
        eventValidator.validateUserId(userId);
        if (text == null || text.isBlank()) {
            throw new ValidationException("Input text must not be blank");
        }

        RawInput rawInput = RawInput.builder()
                .inputId(UUID.randomUUID().toString())
                .userId(userId)
                .receivedAt(clock.instant())
                .text(text)
                .context(context)
                .build();
        rawInputStore.save(rawInput);

        ExtractionMethod method = ExtractionMethod.LLM;
        List<CandidateEvent> candidates = extractWithModel(text, context);
        if (candidates.isEmpty()) {
            method = ExtractionMethod.RULE;
            candidates = ruleExtractor.extract(text);
        }

        List<Event> events = toEvents(userId, candidates, rawInput, method);
        if (events.isEmpty()) {
            log.info("[Ingestion] No events extracted from input {} of user {}; kept as unstructured",
                    rawInput.getInputId(), userId);
            return new IngestionResult(rawInput, List.of(), List.of(), List.of());
        }

        rawInput.setStatus(RawInput.Status.STRUCTURED);
        rawInput.setExtractionMethod(method);
        rawInputStore.save(rawInput);
        IngestionResult result = storeEvents(userId, events, rawInput, text + (context == null ? "" : " " + context));
        log.info("[Ingestion] Input {} of user {} produced {} event(s) via {}", rawInput.getInputId(), userId,
                events.size(), method.getVersion());
        return result;
    }

    /**
     * Records an event stated explicitly rather than extracted, going through
     * the same sanitizing and validation as extracted candidates.
     */
    public IngestionResult recordManual(String userId, CandidateEvent candidate, String context) {
        eventValidator.validateUserId(userId);
        if (candidate != null && candidate.getTimestampHint() != null
                && !eventValidator.isPlausibleTimestamp(candidate.getTimestampHint())) {
            throw new ValidationException("Manual event timestamp is in the future: " + candidate.getTimestampHint());
        }
        RawInput rawInput = RawInput.builder()
                .inputId(UUID.randomUUID().toString())
                .userId(userId)
                .receivedAt(clock.instant())
                .text(describe(candidate))
                .context(context)
                .status(RawInput.Status.STRUCTURED)
                .extractionMethod(ExtractionMethod.MANUAL)
                .build();
        List<Event> events = toEvents(userId, List.of(candidate), rawInput, ExtractionMethod.MANUAL);
        if (events.isEmpty()) {
            throw new ValidationException("Event needs a non-blank action and target: " + describe(candidate));
        }
        rawInputStore.save(rawInput);
        return storeEvents(userId, events, rawInput, context == null ? describe(candidate) : context);
    }

    List<CandidateEvent> extractWithModel(String text, String context) {
        if (!extractionPort.isAvailable()) {
            return List.of();
        }
        MemoryProperties.ExtractionProperties config = properties.getExtraction();
        try {
            List<CandidateEvent> candidates = Mono.defer(() -> Mono.fromFuture(extractionPort.extract(text, context)))
                    .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                    .retryWhen(Retry.backoff(config.getMaxRetries(), Duration.ofMillis(config.getFirstBackoffMs()))
                            .doBeforeRetry(signal -> log.warn("[Ingestion] Extraction attempt {} failed: {}",
                                    signal.totalRetries() + 1, signal.failure().getMessage())))
                    .block();
            return candidates == null ? List.of() : candidates;
        } catch (RuntimeException e) {
            log.warn("[Ingestion] Model extraction unavailable, falling back to rules: {}", e.getMessage());
            return List.of();
        }
    }

    List<Event> toEvents(String userId, List<CandidateEvent> candidates, RawInput rawInput, ExtractionMethod method) {
        List<Event> events = new ArrayList<>();
        for (CandidateEvent candidate : candidates) {
            String action = trimToNull(candidate.getAction());
            String target = trimToNull(candidate.getTarget());
            if (action == null || target == null) {
                log.debug("[Ingestion] Dropping candidate without action or target: {}", candidate);
                continue;
            }
            Double quantity = candidate.getQuantity();
            String unit = trimToNull(candidate.getUnit());
            if (quantity != null && (quantity.isNaN() || quantity.isInfinite() || quantity <= 0)) {
                quantity = null;
            }
            if (quantity == null) {
                unit = null;
            }
            String actor = trimToNull(candidate.getActor());
            double confidence = candidate.getConfidence() == null ? DEFAULT_CONFIDENCE
                    : ConfidenceModel.clamp(candidate.getConfidence());
            Instant timestamp = rawInput.getReceivedAt();
            Instant hint = candidate.getTimestampHint();
            if (hint != null && eventValidator.isPlausibleTimestamp(hint)) {
                timestamp = hint;
            } else if (hint != null) {
                log.debug("[Ingestion] Ignoring future timestamp hint {} for {} {}", hint, action, target);
            }
            events.add(Event.builder()
                    .userId(userId)
                    .timestamp(timestamp)
                    .actor(actor == null ? Event.SELF_ACTOR : actor)
                    .action(action)
                    .target(target)
                    .quantity(quantity)
                    .unit(unit)
                    .confidence(confidence)
                    .sourceReference(rawInput.getInputId())
                    .extractorVersion(method.getVersion())
                    .build());
        }
        return events;
    }

    private IngestionResult storeEvents(String userId, List<Event> events, RawInput rawInput, String context) {
        List<Event> stored = eventStore.appendAll(events);

        Set<String> entityIds = new LinkedHashSet<>();
        for (Event event : stored) {
            Entity target = entityResolver.resolve(userId, event.getTarget(), context, event.getTimestamp());
            entityIds.add(target.getEntityId());
            if (!event.isSelfActor()) {
                Entity actor = entityResolver.resolve(userId, event.getActor(), context, event.getTimestamp());
                entityIds.add(actor.getEntityId());
            }
        }
        relationService.recordCoOccurrence(userId, entityIds, rawInput.getReceivedAt());

        List<String> contradicted = stored.stream()
                .flatMap(event -> counterEvidence.onNewEvent(event).stream())
                .distinct()
                .toList();

        eventBus.publish(new EventsIngestedEvent(userId, stored.size()));
        return new IngestionResult(rawInput, stored, List.copyOf(entityIds), contradicted);
    }

    private static String describe(CandidateEvent candidate) {
        StringBuilder text = new StringBuilder();
        text.append(Objects.toString(candidate.getAction(), "")).append(Objects.toString(candidate.getTarget(), ""));
        if (candidate.getQuantity() != null) {
            text.append(' ').append(candidate.getQuantity());
            if (candidate.getUnit() != null) {
                text.append(candidate.getUnit());
            }
        }
        return text.toString();
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
