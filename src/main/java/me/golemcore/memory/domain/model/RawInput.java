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
 * Original text received from the user. Kept even when no event could be
 * extracted from it so that no input is ever lost.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawInput {

    private String inputId;
    private String userId;
    private Instant receivedAt;
    private String text;
    private String context;

    @Builder.Default
    private Status status = Status.UNSTRUCTURED;

    @Builder.Default
    private ExtractionMethod extractionMethod = ExtractionMethod.NONE;

    public enum Status {
        STRUCTURED, UNSTRUCTURED
    }
}
