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
 * Full dump of one user's data for backup and portability.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserDataExport {

    public static final int FORMAT_VERSION = 1;

    private String userId;
    private Instant exportedAt;

    @Builder.Default
    private int formatVersion = FORMAT_VERSION;

    @Builder.Default
    private List<RawInput> rawInputs = new ArrayList<>();

    @Builder.Default
    private List<Event> events = new ArrayList<>();

    @Builder.Default
    private List<Entity> entities = new ArrayList<>();

    @Builder.Default
    private List<EntityRelationship> relationships = new ArrayList<>();

    @Builder.Default
    private List<DerivedView> views = new ArrayList<>();

    @Builder.Default
    private List<StableConcept> concepts = new ArrayList<>();

    @Builder.Default
    private List<AuditEntry> auditLog = new ArrayList<>();
}
