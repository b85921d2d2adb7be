package me.golemcore.memory.port.outbound;

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

import me.golemcore.memory.domain.model.CandidateEvent;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the inference boundary that turns free text into candidate events.
 * Output is untrusted: callers validate and clamp every field before building
 * an event, and fall back to rule-based extraction when this port fails.
 */
public interface ExtractionPort {

    /**
     * Extract zero or more candidate events from a statement.
     *
     * @param text
     *            the user's statement
     * @param context
     *            surrounding text, may be {@code null}
     * @return candidates, possibly empty; completes exceptionally with
     *         {@link me.golemcore.memory.domain.exception.ExtractionException}
     *         when the model is unreachable or its output cannot be parsed
     */
    CompletableFuture<List<CandidateEvent>> extract(String text, String context);

    boolean isAvailable();
}
