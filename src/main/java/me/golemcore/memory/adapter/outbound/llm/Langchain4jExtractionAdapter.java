package me.golemcore.memory.adapter.outbound.llm;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.ExtractionException;
import me.golemcore.memory.domain.model.CandidateEvent;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.ExtractionPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Event extraction through an OpenAI-compatible chat model via langchain4j.
 *
 * <p>
 * The model is asked for a JSON document of the form
 * {@code {"events":[{"actor","action","target","quantity","unit","confidence","timestamp_hint"}]}}.
 * The adapter only parses; validation, clamping and fallback belong to the
 * ingestion service.
 *
 * <p>
 * Configuration via {@code memory.extraction.*}. Without an API key the
 * adapter reports itself unavailable and the rule extractor is used instead.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jExtractionAdapter implements ExtractionPort {

    static final String SYSTEM_PROMPT = """
            You extract structured life events from a user's statement.
            Reply with JSON only, no prose, using this shape:
            {"events":[{"actor":"self","action":"<verb>","target":"<noun>","quantity":<number or null>,
            "unit":"<unit or null>","confidence":<0..1>,"timestamp_hint":"<ISO-8601 or null>"}]}
            Use the user's language for action and target. The actor is "self" unless another
            person performs the action. Return {"events":[]} when the statement describes no event.
            """;

    private final MemoryProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private volatile ChatModel chatModel;

    @Override
    public boolean isAvailable() {
        MemoryProperties.ExtractionProperties config = properties.getExtraction();
        return config.isEnabled() && config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    @Override
    public CompletableFuture<List<CandidateEvent>> extract(String text, String context) {
        return CompletableFuture.supplyAsync(() -> {
            if (!isAvailable()) {
                throw new ExtractionException("Extraction model is not configured");
            }
            String prompt = buildUserPrompt(text, context);
            ChatResponse response;
            try {
                response = getChatModel().chat(List.of(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(prompt)));
            } catch (RuntimeException e) {
                throw new ExtractionException("Extraction model call failed: " + e.getMessage(), e);
            }
            String content = response.aiMessage() != null ? response.aiMessage().text() : null;
            List<CandidateEvent> candidates = parseCandidates(content);
            log.debug("[Extraction] Model returned {} candidate(s)", candidates.size());
            return candidates;
        });
    }

    List<CandidateEvent> parseCandidates(String content) {
        if (content == null || content.isBlank()) {
            throw new ExtractionException("Extraction model returned empty output");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(content));
        } catch (IOException e) {
            throw new ExtractionException("Extraction output is not valid JSON", e);
        }
        JsonNode events = root.isArray() ? root : root.path("events");
        if (!events.isArray()) {
            throw new ExtractionException("Extraction output has no events array");
        }
        List<CandidateEvent> candidates = new ArrayList<>();
        for (JsonNode node : events) {
            if (!node.isObject()) {
                continue;
            }
            candidates.add(CandidateEvent.builder()
                    .actor(textOrNull(node, "actor"))
                    .action(textOrNull(node, "action"))
                    .target(textOrNull(node, "target"))
                    .quantity(numberOrNull(node, "quantity"))
                    .unit(textOrNull(node, "unit"))
                    .confidence(numberOrNull(node, "confidence"))
                    .timestampHint(parseTimestamp(textOrNull(node, "timestamp_hint")))
                    .build());
        }
        return candidates;
    }

    private String buildUserPrompt(String text, String context) {
        StringBuilder sb = new StringBuilder();
        sb.append("Current time: ").append(clock.instant()).append('\n');
        if (context != null && !context.isBlank()) {
            sb.append("Context: ").append(context).append('\n');
        }
        sb.append("Statement: ").append(text);
        return sb.toString();
    }

    private ChatModel getChatModel() {
        ChatModel model = chatModel;
        if (model == null) {
            synchronized (this) {
                if (chatModel == null) {
                    chatModel = createModel();
                }
                model = chatModel;
            }
        }
        return model;
    }

    private ChatModel createModel() {
        MemoryProperties.ExtractionProperties config = properties.getExtraction();
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .temperature(config.getTemperature())
                .maxRetries(0) // retried by the ingestion service
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()));
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        log.info("[Extraction] Using model {} via {}", config.getModel(), config.getProvider());
        return builder.build();
    }

    private static String stripCodeFence(String content) {
        String trimmed = content.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static Double numberOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        try {
            return Double.parseDouble(value.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Instant parseTimestamp(String hint) {
        if (hint == null || hint.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(hint).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(hint);
            } catch (DateTimeParseException ignored) {
                log.debug("[Extraction] Ignoring unparseable timestamp hint: {}", hint);
                return null;
            }
        }
    }
}
