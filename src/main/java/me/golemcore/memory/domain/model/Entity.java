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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A discovered thing (object, person, place, concept) with incrementally grown
 * attributes. {@code (userId, canonicalName)} is unique; entities are never
 * deleted, only decayed.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Entity {

    private String entityId;
    private String userId;
    private String canonicalName;

    @Builder.Default
    private String entityType = EntityTypes.UNKNOWN;

    private double typeConfidence;

    @Builder.Default
    private Map<String, EntityAttribute> attributes = new LinkedHashMap<>();

    @Builder.Default
    private List<String> contextKeywords = new ArrayList<>();

    private Instant firstSeen;
    private Instant lastSeen;
    private Instant lastDecayedAt;
    private long mentionCount;
}
