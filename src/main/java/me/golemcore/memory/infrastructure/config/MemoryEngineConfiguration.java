package me.golemcore.memory.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Spring configuration for shared infrastructure beans of the memory engine.
 *
 * <p>
 * Provides the {@link Clock} every time-dependent decision reads from (so
 * tests can simulate elapsed days), the {@link ObjectMapper} used for all
 * persisted records, and the {@link ZoneId} used for hour buckets and relative
 * time hints.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class MemoryEngineConfiguration {

    private final MemoryProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        return createObjectMapper();
    }

    @Bean
    public ZoneId memoryZoneId() {
        return resolveZone(properties.getTimeZone());
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public static ZoneId resolveZone(String timeZone) {
        if (timeZone == null || timeZone.isBlank() || "system".equalsIgnoreCase(timeZone)) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(timeZone);
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore memory engine starting...");
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        log.info("Extraction Provider: {} (enabled={})", properties.getExtraction().getProvider(),
                properties.getExtraction().isEnabled());
        log.info("Sweep interval: {} min, batch trigger: {} events", properties.getSweep().getIntervalMinutes(),
                properties.getSweep().getEventBatchSize());
    }
}
