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

/**
 * Co-occurrence edge between two entities of the same user. Auxiliary only,
 * queried directly rather than traversed.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EntityRelationship {

    public static final String CO_OCCURS_WITH = "co_occurs_with";

    private String relationId;
    private String userId;
    private String sourceEntityId;
    private String targetEntityId;

    @Builder.Default
    private String relationType = CO_OCCURS_WITH;

    private double strength;
    private long coOccurrenceCount;
    private Instant firstSeen;
    private Instant lastSeen;

    public boolean involves(String entityId) {
        return entityId.equals(sourceEntityId) || entityId.equals(targetEntityId);
    }

    public String otherEnd(String entityId) {
        return entityId.equals(sourceEntityId) ? targetEntityId : sourceEntityId;
    }
}
