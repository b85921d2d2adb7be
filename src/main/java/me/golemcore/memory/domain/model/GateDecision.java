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

import java.time.Instant;
import java.util.List;

/**
 * Deterministic decision of the promotion gate. Conflicts that block promotion
 * are carried in {@code conflictingViewIds}, they are never thrown.
 */
public record GateDecision(String viewId, GateVerdict verdict, String reason, List<String> conflictingViewIds,
        double counterEvidenceRatio, Instant evaluatedAt) {

    public GateDecision {
        conflictingViewIds = conflictingViewIds == null ? List.of() : List.copyOf(conflictingViewIds);
    }

    @JsonIgnore
    public boolean isBlockedByConflict() {
        return verdict == GateVerdict.KEEP_ACTIVE && !conflictingViewIds.isEmpty();
    }
}
