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

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pulls descriptive attributes (color, taste, texture, size, category, price)
 * out of the text around a mention by keyword lookup.
 */
@Component
public class EntityAttributeExtractor {

    static final double DESCRIPTIVE_BASE_CONFIDENCE = 0.7;
    static final double CLASSIFYING_BASE_CONFIDENCE = 0.6;

    private static final Map<String, List<String>> DESCRIPTIVE = new LinkedHashMap<>();
    private static final Map<String, Map<String, List<String>>> CLASSIFYING = new LinkedHashMap<>();

    static {
        DESCRIPTIVE.put("color", List.of("金黄色", "粉红色", "紫红色", "橙黄色", "红色", "绿色", "蓝色", "黄色", "黑色",
                "白色", "紫色", "橙色", "粉色", "棕色", "灰色", "银色", "red", "green", "blue", "yellow", "black",
                "white", "golden"));
        DESCRIPTIVE.put("taste", List.of("甜甜的", "鲜美", "浓郁", "清淡", "美味", "好吃", "难吃", "甜", "酸", "苦", "辣",
                "咸", "sweet", "sour", "bitter", "spicy", "salty"));
        DESCRIPTIVE.put("texture", List.of("酥脆", "柔软", "坚硬", "光滑", "粘稠", "多汁", "松软", "粗糙", "crispy",
                "soft", "juicy"));
        DESCRIPTIVE.put("size", List.of("巨大", "超大", "特大", "微小", "迷你", "大号", "小号", "中等", "huge", "tiny",
                "large", "small"));

        Map<String, List<String>> category = new LinkedHashMap<>();
        category.put("水果", List.of("水果", "苹果", "香蕉", "橙子", "fruit"));
        category.put("蔬菜", List.of("蔬菜", "白菜", "萝卜", "西红柿", "vegetable"));
        category.put("电子产品", List.of("手机", "电脑", "平板", "电子产品", "phone", "laptop"));
        category.put("饮料", List.of("饮料", "茶", "咖啡", "果汁", "coffee", "tea", "juice"));
        category.put("食物", List.of("食物", "米饭", "面条", "面包", "蛋糕", "bread", "cake"));
        category.put("交通工具", List.of("汽车", "自行车", "飞机", "car", "bike"));
        CLASSIFYING.put("category", category);

        Map<String, List<String>> price = new LinkedHashMap<>();
        price.put("便宜", List.of("便宜", "实惠", "不贵", "cheap"));
        price.put("昂贵", List.of("昂贵", "价格高", "贵", "expensive"));
        price.put("中等", List.of("适中", "还行", "affordable"));
        CLASSIFYING.put("price", price);
    }

    public record ExtractedAttribute(String value, double baseConfidence) {
    }

    /**
     * @return attribute key to extracted value, first match per key
     */
    public Map<String, ExtractedAttribute> extract(String context) {
        Map<String, ExtractedAttribute> attributes = new LinkedHashMap<>();
        if (context == null || context.isBlank()) {
            return attributes;
        }
        String lower = context.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : DESCRIPTIVE.entrySet()) {
            entry.getValue().stream()
                    .filter(lower::contains)
                    .findFirst()
                    .ifPresent(value -> attributes.put(entry.getKey(),
                            new ExtractedAttribute(value, DESCRIPTIVE_BASE_CONFIDENCE)));
        }
        for (Map.Entry<String, Map<String, List<String>>> entry : CLASSIFYING.entrySet()) {
            for (Map.Entry<String, List<String>> option : entry.getValue().entrySet()) {
                if (option.getValue().stream().anyMatch(lower::contains)) {
                    attributes.put(entry.getKey(), new ExtractedAttribute(option.getKey(), CLASSIFYING_BASE_CONFIDENCE));
                    break;
                }
            }
        }
        return attributes;
    }
}
