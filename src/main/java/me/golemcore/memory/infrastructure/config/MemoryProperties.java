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

import lombok.Data;
import me.golemcore.memory.domain.model.MemoryPermission;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the memory engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code memory.*} prefix. Every
 * threshold used by the pipeline lives here so it can be tuned against real
 * usage data:
 * <ul>
 * <li>{@link StorageProperties} - local workspace location</li>
 * <li>{@link ExtractionProperties} - inference boundary (langchain4j)</li>
 * <li>{@link EntityProperties} - entity resolution and attribute decay</li>
 * <li>{@link PatternProperties} - derived view generation</li>
 * <li>{@link GateProperties} - promotion gate thresholds</li>
 * <li>{@link ConflictProperties} - antonym and category rules</li>
 * <li>{@link SweepProperties} - background sweep scheduling</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "memory")
@Data
public class MemoryProperties {

    private String timeZone = "system";
    private StorageProperties storage = new StorageProperties();
    private ExtractionProperties extraction = new ExtractionProperties();
    private EntityProperties entities = new EntityProperties();
    private RelationProperties relations = new RelationProperties();
    private PatternProperties patterns = new PatternProperties();
    private ViewProperties views = new ViewProperties();
    private GateProperties gate = new GateProperties();
    private ConflictProperties conflicts = new ConflictProperties();
    private SweepProperties sweep = new SweepProperties();
    private RetryProperties retry = new RetryProperties();
    private Map<String, ConsumerProperties> consumers = new LinkedHashMap<>();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/memory";
    }

    @Data
    public static class ExtractionProperties {
        private boolean enabled = true;
        private String provider = "openai";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private double temperature = 0.0;
        private int timeoutSeconds = 30;
        private int maxRetries = 2;
        private long firstBackoffMs = 500;
    }

    @Data
    public static class EntityProperties {
        private double fuzzyThreshold = 0.85;
        private double contextMatchThreshold = 0.6;
        private double recencyDecayDays = 90;
        private int decayAfterDays = 30;
        private int maxContextKeywords = 64;
    }

    @Data
    public static class RelationProperties {
        private double countSaturation = 5.0;
        private double recencyDecayDays = 90;
    }

    @Data
    public static class PatternProperties {
        private int lookbackDays = 30;
        private int frequencyThreshold = 20;
        private double llmConfidenceDiscount = 0.7;
        private double preferenceRatio = 0.7;
        private int preferenceMinOccurrences = 5;
        private boolean trendEnabled = true;
        private int trendMinEvents = 6;
        private double trendMinChange = 0.3;
    }

    @Data
    public static class ViewProperties {
        private int defaultTtlDays = 30;
        private int archiveAfterDays = 180;
        private double neutralPrior = 0.5;
        private double validationWeight = 0.05;
        private double counterEvidencePenalty = 0.1;
        private double proposedViewDiscount = 0.7;
    }

    @Data
    public static class GateProperties {
        private double minConfidence = 0.85;
        private int minAgeDays = 30;
        private int minValidations = 3;
        private double maxCounterRatioForPromotion = 0.15;
        private double rejectCounterRatio = 0.30;
    }

    @Data
    public static class ConflictProperties {
        private List<String> antonymPairs = new ArrayList<>(List.of(
                "喜欢:不喜欢", "喜欢:讨厌", "爱:恨", "经常:很少", "总是:从不", "每天:从不",
                "是:不是", "习惯:讨厌", "like:dislike", "always:never", "often:rarely"));
        private Map<String, List<String>> categoryExclusions = new LinkedHashMap<>(Map.of(
                "素食主义者", List.of("肉", "猪肉", "牛肉", "羊肉", "鸡肉", "鱼", "海鲜"),
                "纯素食者", List.of("肉", "蛋", "奶", "鱼", "海鲜", "蜂蜜"),
                "vegetarian", List.of("meat", "beef", "pork", "chicken", "fish")));
        private List<String> exclusiveCategoryGroups = new ArrayList<>(List.of(
                "早起的人:夜猫子", "morning person:night owl"));
        private List<String> negationPrefixes = new ArrayList<>(List.of("不再", "没有", "不", "没", "别", "not "));
        private List<String> oppositeActions = new ArrayList<>(List.of(
                "买:退", "吃:戒", "开始:停止", "喜欢:讨厌", "like:dislike", "buy:return", "start:stop"));
    }

    @Data
    public static class SweepProperties {
        private boolean enabled = true;
        private int intervalMinutes = 15;
        private int eventBatchSize = 50;
        private int workerThreads = 4;
    }

    @Data
    public static class RetryProperties {
        private int storageMaxAttempts = 3;
        private long storageFirstBackoffMs = 100;
    }

    @Data
    public static class ConsumerProperties {
        private String name;
        private MemoryPermission permission = MemoryPermission.READ_ONLY;
    }
}
