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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one background sweep over a user's views.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SweepReport {

    private String userId;
    private Instant startedAt;
    private Instant finishedAt;
    private int viewsProposed;
    private int viewsRevalidated;
    private int conflictsFound;
    private int promoted;
    private int rejected;
    private int expired;
    private int keptActive;
    private int archived;
    private boolean aborted;

    @Builder.Default
    private List<GateDecision> decisions = new ArrayList<>();

    @Builder.Default
    private List<String> promotedConceptIds = new ArrayList<>();

    public boolean changedAnything() {
        return viewsProposed > 0 || viewsRevalidated > 0 || promoted > 0 || rejected > 0 || expired > 0
                || archived > 0;
    }
}
