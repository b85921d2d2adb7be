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

import java.util.List;

/**
 * Outcome of ingesting one raw input.
 *
 * @param rawInput
 *            the stored raw input
 * @param events
 *            events appended for it, possibly empty
 * @param entityIds
 *            entities resolved while ingesting
 * @param counterEvidenceViewIds
 *            active views that received counter-evidence
 */
public record IngestionResult(RawInput rawInput, List<Event> events, List<String> entityIds,
        List<String> counterEvidenceViewIds) {

    public boolean isStructured() {
        return !events.isEmpty();
    }
}
