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
 * A hypothesis offered by a consumer with read-write-derived access. It must
 * cite existing events of the user; the engine decides its final confidence.
 *
 * @param hypothesis
 *            statement about the user
 * @param viewType
 *            kind of view, {@code null} for {@link ViewType#BELIEF}
 * @param subject
 *            what the hypothesis is about, optional
 * @param action
 *            related action, optional; enables counter-evidence
 * @param category
 *            category the hypothesis places the user in, optional
 * @param contextTag
 *            context that scopes the hypothesis, optional
 * @param derivedFrom
 *            ids of supporting events
 * @param confidence
 *            the consumer's own confidence
 */
public record ViewProposal(String hypothesis, ViewType viewType, String subject, String action, String category,
        String contextTag, List<String> derivedFrom, double confidence) {

    public ViewProposal {
        derivedFrom = derivedFrom == null ? List.of() : List.copyOf(derivedFrom);
    }
}
