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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable, versioned knowledge that survived the promotion gate. Versions of
 * the same canonical name form a chain through {@code parentConceptId}; older
 * versions are deprecated, never removed.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StableConcept {

    private String conceptId;
    private String userId;
    private String canonicalName;
    private String displayName;
    private ViewType conceptType;
    private int version;
    private boolean deprecated;
    private Instant deprecatedAt;
    private String supersededBy;
    private String parentConceptId;

    @Builder.Default
    private List<String> derivedFromViews = new ArrayList<>();

    private double promotionConfidence;
    private Instant promotedAt;
    private Instant createdAt;

    @JsonIgnore
    public boolean isActive() {
        return !deprecated;
    }
}
