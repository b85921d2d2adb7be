package me.golemcore.memory.domain.service;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.memory.domain.exception.ValidationException;
import me.golemcore.memory.domain.model.Event;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Field checks every event passes before it is written. Violations are caller
 * bugs and are never retried.
 */
@Component
@RequiredArgsConstructor
public class EventValidator {

    private static final Pattern USER_ID_PATTERN = Pattern.compile("[\\p{L}\\p{N}_.@-]{1,128}");
    private static final Duration MAX_FUTURE_SKEW = Duration.ofDays(1);

    private final Clock clock;

    public void validate(Event event) {
        if (event == null) {
            throw new ValidationException("Event is required");
        }
        validateUserId(event.getUserId());
        if (event.getTimestamp() == null) {
            throw new ValidationException("Event timestamp is required");
        }
        if (!isPlausibleTimestamp(event.getTimestamp())) {
            throw new ValidationException("Event timestamp " + event.getTimestamp() + " is more than "
                    + MAX_FUTURE_SKEW.toHours() + "h in the future");
        }
        if (isBlank(event.getAction())) {
            throw new ValidationException("Event action must not be empty");
        }
        if (isBlank(event.getTarget())) {
            throw new ValidationException("Event target must not be empty");
        }
        double confidence = event.getConfidence();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new ValidationException("Event confidence must be within [0, 1], got " + confidence);
        }
        Double quantity = event.getQuantity();
        if (quantity != null && (quantity.isNaN() || quantity.isInfinite() || quantity <= 0.0)) {
            throw new ValidationException("Event quantity must be positive, got " + quantity);
        }
        if (quantity == null && !isBlank(event.getUnit())) {
            throw new ValidationException("Event unit '" + event.getUnit() + "' requires a quantity");
        }
    }

    public void validateUserId(String userId) {
        if (userId == null || !USER_ID_PATTERN.matcher(userId).matches() || userId.startsWith(".")) {
            throw new ValidationException("Invalid user id: " + userId);
        }
    }

    /**
     * Whether the instant is not further in the future than the allowed clock
     * skew of one day.
     */
    public boolean isPlausibleTimestamp(Instant timestamp) {
        return timestamp != null && !timestamp.isAfter(clock.instant().plus(MAX_FUTURE_SKEW));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
