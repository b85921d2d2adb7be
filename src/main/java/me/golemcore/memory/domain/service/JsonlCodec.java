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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.MemoryEngineException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * JSON and JSON-lines serialization shared by the stores.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonlCodec {

    private final ObjectMapper objectMapper;

    public String toLine(Object value) {
        return toJson(value) + "\n";
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new MemoryEngineException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new MemoryEngineException("Failed to parse " + type.getType().getTypeName(), e);
        }
    }

    /**
     * Parses every line of a JSONL document. Corrupt lines are skipped and
     * logged, they never fail the whole read.
     */
    public <T> List<T> parseLines(String content, Class<T> type, String source) {
        List<T> values = new ArrayList<>();
        lines(content).forEach(line -> {
            T value = parseLine(line, type, source);
            if (value != null) {
                values.add(value);
            }
        });
        return values;
    }

    public <T> T parseLine(String line, Class<T> type, String source) {
        try {
            return objectMapper.readValue(line, type);
        } catch (JsonProcessingException e) {
            log.warn("[Storage] Skipping corrupt line in {}: {}", source, e.getOriginalMessage());
            return null;
        }
    }

    public static Stream<String> lines(String content) {
        if (content == null || content.isEmpty()) {
            return Stream.empty();
        }
        return content.lines().filter(line -> !line.isBlank());
    }
}
