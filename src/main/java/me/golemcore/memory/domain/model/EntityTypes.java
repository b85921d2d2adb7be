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
 * Well-known entity type names. Entity types are soft strings, so any other
 * value is valid too; these are the ones the context classifier can produce.
 */
public final class EntityTypes {

    public static final String UNKNOWN = "unknown";
    public static final String FOOD = "food";
    public static final String ORGANIZATION = "organization";
    public static final String PERSON = "person";
    public static final String PLACE = "place";
    public static final String CONCEPT = "concept";

    public static final List<String> KNOWN = List.of(FOOD, ORGANIZATION, PERSON, PLACE, CONCEPT);

    private EntityTypes() {
    }

    public static boolean isUnknown(String type) {
        return type == null || type.isBlank() || UNKNOWN.equals(type);
    }
}
