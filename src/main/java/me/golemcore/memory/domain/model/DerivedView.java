package me.golemcore.memory.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;
import me.golemcore.memory.domain.exception.IllegalViewTransitionException;
import me.golemcore.memory.domain.exception.ValidationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A hypothesis about the user, explicitly not a fact.
 *
 * <p>
 * A view always cites the exact events supporting it; {@link #create} refuses
 * to build one without evidence. Its {@link #status} has no setter: the only
 * way to change it is {@link #transitionTo}, which allows
 * {@code ACTIVE -> EXPIRED | PROMOTED | REJECTED} and nothing else. Every
 * persisted change bumps {@link #revision}, which the view store uses for
 * optimistic concurrency.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DerivedView {

    private String viewId;
    private String userId;
    private String hypothesis;
    private ViewType viewType;
    private String subject;
    private String action;
    private String patternKey;
    private String category;
    private String contextTag;

    @Builder.Default
    private List<String> derivedFrom = new ArrayList<>();

    @Builder.Default
    private List<String> counterEvidence = new ArrayList<>();

    private double confidence;
    private double priorConfidence;
    private int validationCount;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant expiresAt;
    private Instant closedAt;

    @Setter(AccessLevel.NONE)
    @JsonProperty
    @Builder.Default
    private ViewStatus status = ViewStatus.ACTIVE;

    private String source;
    private String promotedTo;
    private GateDecision lastDecision;
    private long revision;

    /**
     * Builds a new active view from a draft, rejecting drafts without supporting
     * evidence or without a hypothesis.
     */
    public static DerivedView create(DerivedViewBuilder draft) {
        DerivedView view = draft.build();
        if (view.getDerivedFrom() == null || view.getDerivedFrom().isEmpty()) {
            throw new ValidationException("A derived view must cite at least one supporting event");
        }
        if (view.getHypothesis() == null || view.getHypothesis().isBlank()) {
            throw new ValidationException("A derived view must state a hypothesis");
        }
        if (view.getUserId() == null || view.getUserId().isBlank()) {
            throw new ValidationException("A derived view must belong to a user");
        }
        view.derivedFrom = new ArrayList<>(new LinkedHashSet<>(view.getDerivedFrom()));
        view.counterEvidence = view.getCounterEvidence() == null ? new ArrayList<>()
                : new ArrayList<>(view.getCounterEvidence());
        view.status = ViewStatus.ACTIVE;
        view.validationCount = view.derivedFrom.size();
        return view;
    }

    public void transitionTo(ViewStatus next, Instant at) {
        if (status == null || !status.canTransitionTo(next)) {
            throw new IllegalViewTransitionException(
                    "View " + viewId + " cannot move from " + status + " to " + next);
        }
        this.status = next;
        this.closedAt = at;
        this.updatedAt = at;
    }

    /**
     * Adds supporting events not already cited.
     *
     * @return number of events actually added
     */
    public int addSupportingEvents(Collection<String> eventIds) {
        requireActive();
        int added = 0;
        for (String eventId : eventIds) {
            if (!derivedFrom.contains(eventId) && !counterEvidence.contains(eventId)) {
                derivedFrom.add(eventId);
                added++;
            }
        }
        validationCount = derivedFrom.size();
        return added;
    }

    public boolean addCounterEvidence(String eventId) {
        requireActive();
        if (counterEvidence.contains(eventId) || derivedFrom.contains(eventId)) {
            return false;
        }
        counterEvidence.add(eventId);
        return true;
    }

    @JsonIgnore
    public boolean isActive() {
        return status == ViewStatus.ACTIVE;
    }

    @JsonIgnore
    public double getCounterEvidenceRatio() {
        if (derivedFrom == null || derivedFrom.isEmpty()) {
            return counterEvidence == null || counterEvidence.isEmpty() ? 0.0 : Double.POSITIVE_INFINITY;
        }
        int counter = counterEvidence == null ? 0 : counterEvidence.size();
        return (double) counter / derivedFrom.size();
    }

    /**
     * Deep copy, used to mutate a private working set before it is committed.
     */
    public DerivedView copy() {
        return toBuilder()
                .derivedFrom(new ArrayList<>(derivedFrom))
                .counterEvidence(new ArrayList<>(counterEvidence))
                .build();
    }

    private void requireActive() {
        if (status != ViewStatus.ACTIVE) {
            throw new IllegalViewTransitionException(
                    "View " + viewId + " is " + status + "; evidence can only change while ACTIVE");
        }
    }
}
