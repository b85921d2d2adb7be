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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated per-user counts exposed to read-only consumers.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MemoryStatistics {

    private String userId;
    private long eventCount;
    private long rawInputCount;
    private long entityCount;
    private long relationCount;
    private long activeViewCount;
    private long closedViewCount;
    private long activeConceptCount;
    private long conceptVersionCount;

    @Builder.Default
    private Map<String, Long> eventsByAction = new LinkedHashMap<>();

    private Instant firstEventAt;
    private Instant lastEventAt;
    private Instant computedAt;
    private boolean stale;
}
