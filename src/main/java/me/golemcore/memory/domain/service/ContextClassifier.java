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

import me.golemcore.memory.domain.model.EntityTypes;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword heuristics that bias an entity mention toward a type from the words
 * around it ("eat/drink" toward food, "stock/invest" toward organization).
 * Deliberately bounded: no hit means {@code unknown} with low confidence.
 */
@Component
public class ContextClassifier {

    static final double UNKNOWN_CONFIDENCE = 0.2;
    private static final double BASE_CONFIDENCE = 0.5;
    private static final double PER_HIT = 0.15;
    private static final double MAX_CONFIDENCE = 0.9;

    private static final Pattern ASCII_WORD = Pattern.compile("[a-z0-9]{2,}");
    private static final Pattern CJK_RUN = Pattern.compile("[\\p{IsHan}]+");

    private static final Map<String, List<String>> TYPE_KEYWORDS = new LinkedHashMap<>();

    static {
        TYPE_KEYWORDS.put(EntityTypes.CONCEPT, List.of("想法", "概念", "理论", "主义", "idea", "concept", "theory"));
        TYPE_KEYWORDS.put(EntityTypes.PERSON, List.of("朋友", "同事", "先生", "女士", "医生", "老师", "妈妈", "爸爸",
                "见了", "聊天", "friend", "colleague", "doctor", "teacher", "met"));
        TYPE_KEYWORDS.put(EntityTypes.ORGANIZATION, List.of("公司", "股票", "企业", "机构", "投资", "股价", "上市",
                "stock", "invest", "company", "shares"));
        TYPE_KEYWORDS.put(EntityTypes.FOOD, List.of("吃", "喝", "水果", "食物", "饭", "菜", "甜", "饮料", "eat", "ate",
                "drink", "drank", "fruit", "food", "delicious"));
        TYPE_KEYWORDS.put(EntityTypes.PLACE, List.of("去", "到", "地方", "城市", "国家", "旅行", "visit", "travel",
                "city", "went"));
    }

    public record Classification(String entityType, double confidence) {

        public boolean isKnown() {
            return !EntityTypes.isUnknown(entityType);
        }
    }

    public Classification classify(String context) {
        if (context == null || context.isBlank()) {
            return new Classification(EntityTypes.UNKNOWN, UNKNOWN_CONFIDENCE);
        }
        String lower = context.toLowerCase(Locale.ROOT);
        String bestType = EntityTypes.UNKNOWN;
        int bestHits = 0;
        for (Map.Entry<String, List<String>> entry : TYPE_KEYWORDS.entrySet()) {
            int hits = 0;
            for (String keyword : entry.getValue()) {
                if (lower.contains(keyword)) {
                    hits++;
                }
            }
            if (hits > bestHits) {
                bestHits = hits;
                bestType = entry.getKey();
            }
        }
        if (bestHits == 0) {
            return new Classification(EntityTypes.UNKNOWN, UNKNOWN_CONFIDENCE);
        }
        return new Classification(bestType, Math.min(MAX_CONFIDENCE, BASE_CONFIDENCE + PER_HIT * bestHits));
    }

    /**
     * Tokens used for context overlap: lower-case ASCII words and character
     * bigrams of Han runs. The mention itself is excluded.
     */
    public Set<String> keywords(String context, String mention) {
        Set<String> tokens = new LinkedHashSet<>();
        if (context == null || context.isBlank()) {
            return tokens;
        }
        String lower = context.toLowerCase(Locale.ROOT);
        if (mention != null && !mention.isBlank()) {
            lower = lower.replace(mention.toLowerCase(Locale.ROOT), " ");
        }
        Matcher words = ASCII_WORD.matcher(lower);
        while (words.find()) {
            tokens.add(words.group());
        }
        Matcher runs = CJK_RUN.matcher(lower);
        while (runs.find()) {
            int[] chars = runs.group().codePoints().toArray();
            if (chars.length == 1) {
                tokens.add(new String(chars, 0, 1));
            }
            for (int i = 0; i + 1 < chars.length; i++) {
                tokens.add(new String(chars, i, 2));
            }
        }
        return tokens;
    }
}
