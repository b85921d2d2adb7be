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
import me.golemcore.memory.domain.model.GateDecision;
import me.golemcore.memory.domain.model.SweepReport;
import me.golemcore.memory.domain.model.ViewConflict;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.TreeSet;
import java.util.function.BooleanSupplier;

/**
 * One background pass over a user's memory: detect patterns, merge them into
 * the view store, find conflicts, run the promotion gate for every active
 * view, archive old closed views and decay stale entities.
 *
 * <p>
 * A sweep holds the user's partition lock for its whole run, so two sweeps of
 * the same user never interleave. It may be cancelled between views; each
 * view's evaluation is atomic, so an aborted sweep leaves no half-applied
 * state and the next sweep simply continues.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CognitiveSweepService {

    private final PatternDetectorService patternDetector;
    private final ViewLifecycleService viewLifecycle;
    private final ViewStoreService viewStore;
    private final ConflictDetectorService conflictDetector;
    private final EntityResolverService entityResolver;
    private final EventStoreService eventStore;
    private final UserPartitionLocks userLocks;
    private final MemoryProperties properties;
    private final Clock clock;

    public SweepReport sweep(String userId, Instant now) {
        return sweep(userId, now, () -> Thread.currentThread().isInterrupted());
    }

    public SweepReport sweep(String userId, Instant now, BooleanSupplier cancelled) {
        return userLocks.withUserLock(userId, () -> runSweep(userId, now, cancelled));
    }

    /**
     * Users with events or views on disk.
     */
    public List<String> knownUsers() {
        TreeSet<String> users = new TreeSet<>(eventStore.knownUsers());
        users.addAll(viewStore.knownUsers());
        return List.copyOf(users);
    }

    private SweepReport runSweep(String userId, Instant now, BooleanSupplier cancelled) {
        SweepReport report = SweepReport.builder()
                .userId(userId)
                .startedAt(clock.instant())
                .build();

        List<DerivedView> candidates = patternDetector.detectPatterns(userId,
                Duration.ofDays(properties.getPatterns().getLookbackDays()), now);
        ViewLifecycleService.MergeResult merge = viewLifecycle.mergeDetected(userId, candidates, now);
        report.setViewsProposed(merge.proposedViewIds().size());
        report.setViewsRevalidated(merge.revalidatedViewIds().size());

        List<DerivedView> active = viewStore.listActive(userId);
        List<ViewConflict> conflicts = conflictDetector.findConflicts(active);
        report.setConflictsFound(conflicts.size());

        for (DerivedView view : active) {
            if (cancelled.getAsBoolean()) {
                report.setAborted(true);
                log.info("[Sweep] Sweep of user {} cancelled after {} of {} view(s)", userId,
                        report.getDecisions().size(), active.size());
                break;
            }
            List<String> conflicting = conflicts.stream()
                    .filter(conflict -> conflict.involves(view.getViewId()))
                    .map(conflict -> conflict.otherView(view.getViewId()))
                    .toList();
            GateDecision decision = viewLifecycle.evaluateAndApply(userId, view.getViewId(), now, conflicting);
            report.getDecisions().add(decision);
            count(report, userId, decision);
        }

        if (!report.isAborted()) {
            report.setArchived(viewLifecycle.archiveClosedViews(userId, now));
            entityResolver.decay(userId, now);
        }
        report.setFinishedAt(clock.instant());

        if (report.changedAnything()) {
            log.info("[Sweep] User {}: {} proposed, {} revalidated, {} promoted, {} rejected, {} expired, "
                    + "{} conflict(s)", userId, report.getViewsProposed(), report.getViewsRevalidated(),
                    report.getPromoted(), report.getRejected(), report.getExpired(), report.getConflictsFound());
        } else {
            log.debug("[Sweep] User {}: nothing changed", userId);
        }
        return report;
    }

    private void count(SweepReport report, String userId, GateDecision decision) {
        switch (decision.verdict()) {
            case PROMOTE -> {
                report.setPromoted(report.getPromoted() + 1);
                viewStore.get(userId, decision.viewId())
                        .map(DerivedView::getPromotedTo)
                        .ifPresent(conceptId -> report.getPromotedConceptIds().add(conceptId));
            }
            case REJECT -> report.setRejected(report.getRejected() + 1);
            case EXPIRE -> report.setExpired(report.getExpired() + 1);
            case KEEP_ACTIVE -> report.setKeptActive(report.getKeptActive() + 1);
            default -> throw new IllegalStateException("Unhandled verdict " + decision.verdict());
        }
    }
}
