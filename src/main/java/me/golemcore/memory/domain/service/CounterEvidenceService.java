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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.ConcurrentViewModificationException;
import me.golemcore.memory.domain.model.DerivedView;
import me.golemcore.memory.domain.model.Event;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Feeds newly stored events back into active views.
 *
 * <p>
 * An event is counter-evidence for a view when it is about the view's subject
 * and its action opposes the view's action: the negated form of the same verb
 * (不喝 against 喝, "not eat" against "eat") or a configured opposite (买/退,
 * 开始/停止). The view's confidence is recalculated and the gate re-evaluated
 * for it right away, so a contradicted hypothesis can be rejected without
 * waiting for the next sweep.
 */
@Service
@Slf4j
public class CounterEvidenceService {

    private final ViewStoreService viewStore;
    private final ViewLifecycleService viewLifecycle;
    private final ConflictDetectorService conflictDetector;
    private final ConfidenceModel confidenceModel;
    private final Clock clock;
    private final List<String> negationPrefixes;
    private final Set<String> oppositePairs;

    public CounterEvidenceService(ViewStoreService viewStore, ViewLifecycleService viewLifecycle,
            ConflictDetectorService conflictDetector, ConfidenceModel confidenceModel, Clock clock,
            MemoryProperties properties) {
        this.viewStore = viewStore;
        this.viewLifecycle = viewLifecycle;
        this.conflictDetector = conflictDetector;
        this.confidenceModel = confidenceModel;
        this.clock = clock;
        MemoryProperties.ConflictProperties config = properties.getConflicts();
        this.negationPrefixes = config.getNegationPrefixes().stream()
                .map(prefix -> prefix.toLowerCase(Locale.ROOT))
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
        this.oppositePairs = new HashSet<>();
        for (String pair : config.getOppositeActions()) {
            String[] parts = pair.toLowerCase(Locale.ROOT).split(":", 2);
            if (parts.length == 2 && !parts[0].isBlank() && !parts[1].isBlank()) {
                oppositePairs.add(parts[0].trim() + ":" + parts[1].trim());
                oppositePairs.add(parts[1].trim() + ":" + parts[0].trim());
            }
        }
    }

    /**
     * Records the event against every active view it contradicts.
     *
     * @return ids of the views that received counter-evidence
     */
    public List<String> onNewEvent(Event event) {
        String userId = event.getUserId();
        List<String> contradicted = new ArrayList<>();
        for (DerivedView view : viewStore.listActive(userId)) {
            if (!aboutSameSubject(view, event) || !opposes(view.getAction(), event.getAction())) {
                continue;
            }
            Instant now = clock.instant();
            AtomicBoolean added = new AtomicBoolean();
            DerivedView updated = viewStore.modify(userId, view.getViewId(), working -> {
                if (!working.isActive()) {
                    return;
                }
                added.set(working.addCounterEvidence(event.getEventId()));
                if (added.get()) {
                    working.setConfidence(confidenceModel.recalculate(working));
                    working.setUpdatedAt(now);
                }
            });
            if (!added.get()) {
                continue;
            }
            contradicted.add(view.getViewId());
            log.debug("[CounterEvidence] Event {} contradicts view {} (ratio now {})", event.getEventId(),
                    view.getViewId(), String.format(Locale.ROOT, "%.2f", updated.getCounterEvidenceRatio()));
            reevaluate(userId, view.getViewId(), now);
        }
        return contradicted;
    }

    boolean opposes(String viewAction, String eventAction) {
        if (viewAction == null || eventAction == null) {
            return false;
        }
        String viewVerb = viewAction.trim().toLowerCase(Locale.ROOT);
        String eventVerb = eventAction.trim().toLowerCase(Locale.ROOT);
        String viewBase = stripNegation(viewVerb);
        String eventBase = stripNegation(eventVerb);
        boolean viewNegated = !viewBase.equals(viewVerb);
        boolean eventNegated = !eventBase.equals(eventVerb);
        if (viewNegated != eventNegated && viewBase.equals(eventBase)) {
            return true;
        }
        return viewNegated == eventNegated && oppositePairs.contains(viewBase + ":" + eventBase);
    }

    private void reevaluate(String userId, String viewId, Instant now) {
        List<String> conflicting = conflictDetector.findConflicts(viewStore.listActive(userId)).stream()
                .filter(conflict -> conflict.involves(viewId))
                .map(conflict -> conflict.otherView(viewId))
                .toList();
        try {
            viewLifecycle.evaluateAndApply(userId, viewId, now, conflicting);
        } catch (ConcurrentViewModificationException e) {
            // the sweep owns the view right now and will evaluate it with this evidence
            log.warn("[CounterEvidence] Gate re-evaluation of view {} deferred to the next sweep: {}", viewId,
                    e.getMessage());
        }
    }

    private String stripNegation(String action) {
        for (String prefix : negationPrefixes) {
            if (action.startsWith(prefix) && action.length() > prefix.length()) {
                return action.substring(prefix.length()).trim();
            }
        }
        return action;
    }

    private static boolean aboutSameSubject(DerivedView view, Event event) {
        if (view.getSubject() == null || view.getSubject().isBlank() || event.getTarget() == null) {
            return false;
        }
        String subject = view.getSubject().trim().toLowerCase(Locale.ROOT);
        String target = event.getTarget().trim().toLowerCase(Locale.ROOT);
        return subject.equals(target) || subject.contains(target) || target.contains(subject);
    }
}
