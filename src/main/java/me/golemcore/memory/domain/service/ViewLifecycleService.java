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
import me.golemcore.memory.domain.exception.ConcurrentViewModificationException;
import me.golemcore.memory.domain.exception.ValidationException;
import me.golemcore.memory.domain.model.DerivedView;
import me.golemcore.memory.domain.model.Event;
import me.golemcore.memory.domain.model.GateDecision;
import me.golemcore.memory.domain.model.GateVerdict;
import me.golemcore.memory.domain.model.ViewStatus;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Moves derived views through their lifecycle: merging freshly detected
 * candidates into the store, applying gate verdicts and archiving closed views.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ViewLifecycleService {

    private static final int MAX_GATE_ATTEMPTS = 5;

    private final ViewStoreService viewStore;
    private final EventStoreService eventStore;
    private final PromotionGate promotionGate;
    private final StableConceptRegistry conceptRegistry;
    private final ConfidenceModel confidenceModel;
    private final PatternDetectorService patternDetector;
    private final MemoryProperties properties;

    /**
     * Outcome of merging one batch of detector candidates.
     */
    public record MergeResult(List<String> proposedViewIds, List<String> revalidatedViewIds) {

        public static MergeResult empty() {
            return new MergeResult(List.of(), List.of());
        }
    }

    public MergeResult mergeDetected(String userId, List<DerivedView> candidates, Instant now) {
        List<String> proposed = new ArrayList<>();
        List<String> revalidated = new ArrayList<>();
        for (DerivedView candidate : candidates) {
            List<DerivedView> existing = viewStore.listByPatternKey(userId, candidate.getPatternKey());
            Optional<DerivedView> active = existing.stream().filter(DerivedView::isActive).findFirst();
            if (active.isPresent()) {
                if (revalidate(active.get(), candidate, now)) {
                    revalidated.add(active.get().getViewId());
                }
                continue;
            }
            if (hasLivePromotion(userId, existing)) {
                log.debug("[Views] Skipping '{}': already promoted to an active concept", candidate.getPatternKey());
                continue;
            }
            reproposal(userId, candidate, existing).ifPresent(view -> {
                DerivedView stored = viewStore.insert(view);
                proposed.add(stored.getViewId());
                log.info("[Views] Proposed view {} '{}' for user {} ({} supporting events)", stored.getViewId(),
                        stored.getHypothesis(), userId, stored.getDerivedFrom().size());
            });
        }
        return new MergeResult(proposed, revalidated);
    }

    /**
     * Stores a view proposed from outside the detector, for example by a
     * plugin. The view enters as active with a fresh id.
     */
    public DerivedView propose(DerivedView view) {
        return viewStore.insert(view);
    }

    /**
     * Evaluates the gate for one view and applies the verdict. A concurrent
     * change to the view (new counter-evidence) causes a re-read and a fresh
     * evaluation.
     */
    public GateDecision evaluateAndApply(String userId, String viewId, Instant now,
            Collection<String> conflictingViewIds) {
        String createdConceptId = null;
        for (int attempt = 1; attempt <= MAX_GATE_ATTEMPTS; attempt++) {
            DerivedView view = viewStore.get(userId, viewId)
                    .orElseThrow(() -> new ValidationException("Unknown view: " + viewId));
            GateDecision decision = promotionGate.evaluate(view, now, conflictingViewIds);
            if (createdConceptId != null && decision.verdict() != GateVerdict.PROMOTE) {
                conceptRegistry.deprecate(userId, createdConceptId, null, now);
                createdConceptId = null;
            }
            if (!view.isActive()) {
                return decision;
            }
            try {
                return apply(view, decision, now, createdConceptId);
            } catch (ConcurrentViewModificationException e) {
                if (decision.verdict() == GateVerdict.PROMOTE) {
                    createdConceptId = conceptRegistry.promote(view, now);
                }
                log.debug("[Gate] View {} changed during evaluation, re-evaluating (attempt {})", viewId, attempt);
            }
        }
        throw new ConcurrentViewModificationException(viewId, -1, -1);
    }

    /**
     * Archives closed views past {@code archive-after-days}.
     */
    public int archiveClosedViews(String userId, Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(properties.getViews().getArchiveAfterDays()));
        return viewStore.archiveClosed(userId, cutoff);
    }

    private GateDecision apply(DerivedView view, GateDecision decision, Instant now, String knownConceptId) {
        String userId = view.getUserId();
        switch (decision.verdict()) {
            case KEEP_ACTIVE -> {
                if (!sameOutcome(view.getLastDecision(), decision)) {
                    viewStore.update(userId, view.getViewId(), view.getRevision(),
                            working -> working.setLastDecision(decision));
                }
            }
            case PROMOTE -> {
                String conceptId = knownConceptId != null ? knownConceptId : conceptRegistry.promote(view, now);
                viewStore.update(userId, view.getViewId(), view.getRevision(), working -> {
                    working.setPromotedTo(conceptId);
                    working.setLastDecision(decision);
                    working.transitionTo(ViewStatus.PROMOTED, now);
                });
                log.info("[Gate] Promoted view {} '{}' to concept {}", view.getViewId(), view.getHypothesis(),
                        conceptId);
            }
            case REJECT, EXPIRE -> {
                viewStore.update(userId, view.getViewId(), view.getRevision(), working -> {
                    working.setLastDecision(decision);
                    working.transitionTo(decision.verdict().getResultingStatus(), now);
                });
                if (decision.verdict() == GateVerdict.REJECT) {
                    log.debug("[Gate] Rejected view {}: {}", view.getViewId(), decision.reason());
                } else {
                    log.info("[Gate] Expired view {} '{}'", view.getViewId(), view.getHypothesis());
                }
            }
            default -> throw new IllegalStateException("Unhandled verdict " + decision.verdict());
        }
        return decision;
    }

    private boolean revalidate(DerivedView active, DerivedView candidate, Instant now) {
        Set<String> known = new HashSet<>(active.getDerivedFrom());
        known.addAll(active.getCounterEvidence());
        List<String> fresh = candidate.getDerivedFrom().stream().filter(id -> !known.contains(id)).toList();
        if (fresh.isEmpty()) {
            return false;
        }
        Instant extended = now.plus(Duration.ofDays(properties.getViews().getDefaultTtlDays()));
        viewStore.modify(active.getUserId(), active.getViewId(), working -> {
            if (!working.isActive()) {
                return;
            }
            working.addSupportingEvents(fresh);
            working.setPriorConfidence(candidate.getPriorConfidence());
            working.setConfidence(confidenceModel.recalculate(working));
            working.setUpdatedAt(now);
            if (working.getExpiresAt() == null || working.getExpiresAt().isBefore(extended)) {
                working.setExpiresAt(extended);
            }
        });
        log.debug("[Views] Revalidated view {} with {} new event(s)", active.getViewId(), fresh.size());
        return true;
    }

    private boolean hasLivePromotion(String userId, List<DerivedView> existing) {
        return existing.stream()
                .filter(view -> view.getStatus() == ViewStatus.PROMOTED)
                .map(DerivedView::getPromotedTo)
                .filter(Objects::nonNull)
                .anyMatch(conceptId -> conceptRegistry.isActive(userId, conceptId));
    }

    // After a view with the same key closed, only evidence newer than the closure counts.
    private Optional<DerivedView> reproposal(String userId, DerivedView candidate, List<DerivedView> existing) {
        Optional<Instant> lastClosed = existing.stream()
                .map(DerivedView::getClosedAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder());
        if (lastClosed.isEmpty()) {
            return Optional.of(candidate);
        }
        Instant closedAt = lastClosed.get();
        Set<String> newer = eventStore.findByIds(userId, candidate.getDerivedFrom()).stream()
                .filter(event -> event.getTimestamp().isAfter(closedAt))
                .map(Event::getEventId)
                .collect(Collectors.toSet());
        List<String> support = candidate.getDerivedFrom().stream().filter(newer::contains).toList();
        if (support.size() < patternDetector.minimumSupport(candidate.getViewType())) {
            log.debug("[Views] Not re-proposing '{}': {} event(s) newer than the last closure",
                    candidate.getPatternKey(), support.size());
            return Optional.empty();
        }
        DerivedView fresh = DerivedView.create(candidate.toBuilder()
                .viewId(null)
                .derivedFrom(new ArrayList<>(support))
                .counterEvidence(new ArrayList<>()));
        return Optional.of(fresh);
    }

    private static boolean sameOutcome(GateDecision previous, GateDecision current) {
        return previous != null
                && previous.verdict() == current.verdict()
                && Objects.equals(previous.reason(), current.reason())
                && previous.conflictingViewIds().equals(current.conflictingViewIds());
    }
}
