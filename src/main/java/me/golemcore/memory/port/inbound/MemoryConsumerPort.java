package me.golemcore.memory.port.inbound;

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

import me.golemcore.memory.domain.model.DerivedView;
import me.golemcore.memory.domain.model.Entity;
import me.golemcore.memory.domain.model.MemoryStatistics;
import me.golemcore.memory.domain.model.StableConcept;
import me.golemcore.memory.domain.model.ViewProposal;

import java.util.List;

/**
 * Boundary through which plugins and other consumers read a user's memory.
 * Every call names the calling consumer; access is checked against its
 * registered {@link me.golemcore.memory.domain.model.MemoryPermission} before
 * any storage is touched, and every call is audited. No method writes events
 * or concepts.
 */
public interface MemoryConsumerPort {

    /**
     * Aggregated counts; may be a stale cached aggregate when storage is
     * unavailable. Requires read-only access.
     */
    MemoryStatistics getStatistics(String consumerId, String userId);

    /**
     * Active derived views. Requires read-only access.
     */
    List<DerivedView> getActiveViews(String consumerId, String userId);

    /**
     * Active (non-deprecated) concept versions. Requires read-only access.
     */
    List<StableConcept> getActiveConcepts(String consumerId, String userId);

    /**
     * Resolved entities. Requires read-only access.
     */
    List<Entity> getEntities(String consumerId, String userId);

    /**
     * Adds a new active view citing existing events. Requires read-write-derived
     * access.
     */
    DerivedView proposeView(String consumerId, String userId, ViewProposal proposal);
}
