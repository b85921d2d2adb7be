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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Filter for {@code EventStoreService.query}. Every criterion except the user
 * is optional; time bounds are inclusive-from, exclusive-to.
 */
@Value
@Builder(toBuilder = true)
public class EventQuery {

    String userId;
    Instant from;
    Instant to;
    String action;
    String target;
    Double minConfidence;
    Integer limit;
    boolean includeArchived;

    public static EventQuery forUser(String userId) {
        return EventQuery.builder().userId(userId).build();
    }

    public boolean matches(Event event) {
        if (!userId.equals(event.getUserId())) {
            return false;
        }
        if (from != null && event.getTimestamp().isBefore(from)) {
            return false;
        }
        if (to != null && !event.getTimestamp().isBefore(to)) {
            return false;
        }
        if (action != null && !action.equals(event.getAction())) {
            return false;
        }
        if (target != null && !target.equals(event.getTarget())) {
            return false;
        }
        return minConfidence == null || event.getConfidence() >= minConfidence;
    }
}
