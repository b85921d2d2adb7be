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
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Atomic, immutable fact extracted from user input.
 *
 * <p>
 * Events never reference entities or views; once appended they are only ever
 * read. {@code action} and {@code target} are open-vocabulary strings so new
 * verbs and nouns need no schema change.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Event {

    public static final String SELF_ACTOR = "self";

    String eventId;
    String userId;
    Instant timestamp;

    @Builder.Default
    String actor = SELF_ACTOR;

    String action;
    String target;
    Double quantity;
    String unit;
    double confidence;
    String sourceReference;
    String extractorVersion;

    @JsonIgnore
    public boolean isSelfActor() {
        return actor == null || SELF_ACTOR.equals(actor);
    }
}
