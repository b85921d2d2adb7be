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
import me.golemcore.memory.domain.model.CandidateEvent;
import me.golemcore.memory.domain.model.Event;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Deterministic fallback extraction for short Chinese and simple English
 * statements.
 *
 * <p>
 * Recognizes {@code verb [了|过] quantity unit target} (confidence 0.8) and
 * {@code verb [了|过] target} (confidence 0.5), each optionally negated
 * (不/没/没有/不再/别). Relative time words (今天, 昨天, 前天, N天前, 早上,
 * 下午, 晚上, ...) set the timestamp hint in the configured zone.
 */
@Component
@RequiredArgsConstructor
public class RuleBasedEventExtractor {

    static final double QUANTIFIED_CONFIDENCE = 0.8;
    static final double PLAIN_CONFIDENCE = 0.5;

    private static final List<String> VERBS = List.of(
            "运动", "跑步", "睡觉", "起床", "工作", "学习", "消费", "支付", "开始", "停止", "完成", "喜欢", "讨厌",
            "去", "来", "吃", "喝", "买", "退", "戒", "做", "看", "读", "写", "听", "说", "玩", "跑", "睡", "学");

    private static final List<String> UNITS = List.of(
            "分钟", "小时", "公斤", "毫升", "公里", "杯", "瓶", "碗", "份", "盒", "片", "顿", "个", "只", "件", "台",
            "本", "张", "次", "天", "周", "月", "年", "克", "斤", "两", "升", "米", "元", "块");

    private static final String NEGATION = "(不再|没有|没|不|别)?";
    private static final String ASPECT = "(?:了|过)?";
    private static final String CHINESE_NUMBER = "[零一二两三四五六七八九十百千万]+";

    private static final Pattern QUANTIFIED_PATTERN = Pattern.compile(
            NEGATION + "(" + alternation(VERBS) + ")" + ASPECT
                    + "(\\d+(?:\\.\\d+)?|" + CHINESE_NUMBER + ")(" + alternation(UNITS) + ")(.+)");

    private static final Pattern PLAIN_PATTERN = Pattern.compile(
            NEGATION + "(" + alternation(VERBS) + ")" + ASPECT + "(.+)");

    private static final Map<String, String> ENGLISH_VERBS = englishVerbs();

    private static final Pattern ENGLISH_PATTERN = Pattern.compile(
            "^(?:i\\s+)?(?:(didn't|did not|don't|do not|never|no longer)\\s+)?(" + String.join("|",
                    ENGLISH_VERBS.keySet()) + ")\\s+(?:(\\d+(?:\\.\\d+)?)\\s+(?:(cups?|glasses?|bottles?|pieces?|"
                    + "slices?|bowls?|kg|km|hours?|minutes?)\\s+(?:of\\s+)?)?)?(.+)$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CLAUSE_SEPARATOR = Pattern.compile("[，,。；;！!？?\\n]+|然后|并且");
    private static final int MAX_DAYS_AGO = 36_500;
    private static final Pattern DAYS_AGO_PATTERN = Pattern.compile("(\\d+)天前");
    private static final Pattern ENGLISH_DAYS_AGO_PATTERN = Pattern.compile("(\\d+) days? ago",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TARGET_TRAILER = Pattern.compile("[\\s。，,.!！?？~～]+$");

    private static final Map<String, Integer> DAY_WORDS = new LinkedHashMap<>();
    private static final Map<String, Integer> PART_OF_DAY_WORDS = new LinkedHashMap<>();
    private static final List<String> FILLER_WORDS = List.of(
            "每天", "经常", "总是", "一直", "今天", "昨天", "前天", "今早", "今晚", "昨晚", "早上", "上午", "中午",
            "下午", "晚上", "夜里", "都", "又", "也", "还", "刚才", "刚刚", "刚");

    static {
        DAY_WORDS.put("前天", 2);
        DAY_WORDS.put("昨天", 1);
        DAY_WORDS.put("昨晚", 1);
        DAY_WORDS.put("今天", 0);
        DAY_WORDS.put("今早", 0);
        DAY_WORDS.put("今晚", 0);
        DAY_WORDS.put("yesterday", 1);
        DAY_WORDS.put("today", 0);

        PART_OF_DAY_WORDS.put("早上", 8);
        PART_OF_DAY_WORDS.put("今早", 8);
        PART_OF_DAY_WORDS.put("上午", 9);
        PART_OF_DAY_WORDS.put("中午", 12);
        PART_OF_DAY_WORDS.put("下午", 14);
        PART_OF_DAY_WORDS.put("晚上", 20);
        PART_OF_DAY_WORDS.put("今晚", 20);
        PART_OF_DAY_WORDS.put("昨晚", 20);
        PART_OF_DAY_WORDS.put("夜里", 22);
        PART_OF_DAY_WORDS.put("this morning", 8);
        PART_OF_DAY_WORDS.put("this afternoon", 14);
        PART_OF_DAY_WORDS.put("this evening", 20);
        PART_OF_DAY_WORDS.put("tonight", 20);
    }

    private final Clock clock;
    private final ZoneId memoryZoneId;

    public List<CandidateEvent> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        ZonedDateTime statementTime = resolveTime(text, null);
        List<CandidateEvent> candidates = new ArrayList<>();
        for (String clause : CLAUSE_SEPARATOR.split(text)) {
            if (clause.isBlank()) {
                continue;
            }
            ZonedDateTime clauseTime = resolveTime(clause, statementTime);
            CandidateEvent candidate = extractClause(clause.trim());
            if (candidate != null) {
                candidate.setTimestampHint(clauseTime.toInstant());
                candidates.add(candidate);
            }
        }
        return candidates;
    }

    private CandidateEvent extractClause(String clause) {
        String stripped = stripFillers(clause);
        if (stripped.isEmpty()) {
            return null;
        }

        Matcher quantified = QUANTIFIED_PATTERN.matcher(stripped);
        if (quantified.find()) {
            Double quantity = parseQuantity(quantified.group(3));
            String target = cleanTarget(quantified.group(5));
            if (quantity != null && target != null) {
                return candidate(action(quantified.group(1), quantified.group(2)), target, quantity,
                        quantified.group(4), QUANTIFIED_CONFIDENCE);
            }
        }

        Matcher plain = PLAIN_PATTERN.matcher(stripped);
        if (plain.find()) {
            String target = cleanTarget(plain.group(3));
            if (target != null) {
                return candidate(action(plain.group(1), plain.group(2)), target, null, null, PLAIN_CONFIDENCE);
            }
        }

        return extractEnglish(clause);
    }

    private CandidateEvent extractEnglish(String clause) {
        String normalized = clause.trim();
        for (String word : DAY_WORDS.keySet()) {
            normalized = normalized.replaceAll("(?i)\\b" + Pattern.quote(word) + "\\b", " ");
        }
        for (String word : PART_OF_DAY_WORDS.keySet()) {
            normalized = normalized.replaceAll("(?i)\\b" + Pattern.quote(word) + "\\b", " ");
        }
        normalized = ENGLISH_DAYS_AGO_PATTERN.matcher(normalized).replaceAll(" ").trim().replaceAll("\\s+", " ");
        Matcher matcher = ENGLISH_PATTERN.matcher(normalized);
        if (!matcher.matches()) {
            return null;
        }
        String verb = ENGLISH_VERBS.get(matcher.group(2).toLowerCase(Locale.ROOT));
        String action = matcher.group(1) != null ? "not " + verb : verb;
        String target = cleanTarget(matcher.group(5));
        if (target == null) {
            return null;
        }
        target = target.replaceFirst("(?i)^(a|an|the|some)\\s+", "");
        Double quantity = matcher.group(3) != null ? Double.parseDouble(matcher.group(3)) : null;
        double confidence = quantity != null ? QUANTIFIED_CONFIDENCE : PLAIN_CONFIDENCE;
        return candidate(action, target, quantity, quantity != null ? matcher.group(4) : null, confidence);
    }

    private ZonedDateTime resolveTime(String text, ZonedDateTime fallback) {
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(memoryZoneId);
        Integer daysAgo = null;
        Integer hour = null;
        String lower = text.toLowerCase(Locale.ROOT);

        Matcher daysAgoMatcher = DAYS_AGO_PATTERN.matcher(text);
        Matcher englishDaysAgo = ENGLISH_DAYS_AGO_PATTERN.matcher(text);
        if (daysAgoMatcher.find()) {
            daysAgo = parseDaysAgo(daysAgoMatcher.group(1));
        } else if (englishDaysAgo.find()) {
            daysAgo = parseDaysAgo(englishDaysAgo.group(1));
        } else {
            for (Map.Entry<String, Integer> entry : DAY_WORDS.entrySet()) {
                if (lower.contains(entry.getKey())) {
                    daysAgo = entry.getValue();
                    break;
                }
            }
        }
        for (Map.Entry<String, Integer> entry : PART_OF_DAY_WORDS.entrySet()) {
            if (lower.contains(entry.getKey())) {
                hour = entry.getValue();
                break;
            }
        }

        if (daysAgo == null && hour == null) {
            return fallback != null ? fallback : now;
        }
        ZonedDateTime base = fallback != null && daysAgo == null ? fallback : now;
        LocalDate date = daysAgo != null ? now.toLocalDate().minusDays(daysAgo) : base.toLocalDate();
        LocalTime time = hour != null ? LocalTime.of(hour, 0) : base.toLocalTime();
        return ZonedDateTime.of(date, time, memoryZoneId);
    }

    // Out-of-range counts are not a usable time hint.
    private static Integer parseDaysAgo(String digits) {
        if (digits.length() > 5) {
            return null;
        }
        int days = Integer.parseInt(digits);
        return days <= MAX_DAYS_AGO ? days : null;
    }

    private static String stripFillers(String clause) {
        String stripped = DAYS_AGO_PATTERN.matcher(clause).replaceAll("");
        for (String filler : FILLER_WORDS) {
            stripped = stripped.replace(filler, "");
        }
        stripped = stripped.trim();
        if (stripped.startsWith("我")) {
            stripped = stripped.substring(1);
        }
        return stripped.trim();
    }

    private static String action(String negation, String verb) {
        return negation != null ? negation + verb : verb;
    }

    private static String cleanTarget(String raw) {
        if (raw == null) {
            return null;
        }
        String target = TARGET_TRAILER.matcher(raw.trim()).replaceAll("");
        if (target.startsWith("的")) {
            target = target.substring(1);
        }
        return target.isBlank() ? null : target.trim();
    }

    private static CandidateEvent candidate(String action, String target, Double quantity, String unit,
            double confidence) {
        return CandidateEvent.builder()
                .actor(Event.SELF_ACTOR)
                .action(action)
                .target(target)
                .quantity(quantity)
                .unit(unit)
                .confidence(confidence)
                .build();
    }

    static Double parseQuantity(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        if (Character.isDigit(text.charAt(0))) {
            return Double.parseDouble(text);
        }
        return parseChineseNumber(text);
    }

    private static Double parseChineseNumber(String text) {
        long total = 0;
        long section = 0;
        long digit = 0;
        for (char c : text.toCharArray()) {
            int value = "零一二三四五六七八九".indexOf(c);
            if (c == '两') {
                value = 2;
            }
            if (value >= 0) {
                digit = value;
                continue;
            }
            switch (c) {
                case '十' -> {
                    section += (digit == 0 ? 1 : digit) * 10;
                    digit = 0;
                }
                case '百' -> {
                    section += (digit == 0 ? 1 : digit) * 100;
                    digit = 0;
                }
                case '千' -> {
                    section += (digit == 0 ? 1 : digit) * 1000;
                    digit = 0;
                }
                case '万' -> {
                    total += (section + digit) * 10_000;
                    section = 0;
                    digit = 0;
                }
                default -> {
                    return null;
                }
            }
        }
        long result = total + section + digit;
        return result > 0 ? (double) result : null;
    }

    private static String alternation(List<String> words) {
        return words.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
    }

    private static Map<String, String> englishVerbs() {
        Map<String, String> verbs = new LinkedHashMap<>();
        verbs.put("ate", "eat");
        verbs.put("eat", "eat");
        verbs.put("drank", "drink");
        verbs.put("drink", "drink");
        verbs.put("bought", "buy");
        verbs.put("buy", "buy");
        verbs.put("returned", "return");
        verbs.put("read", "read");
        verbs.put("watched", "watch");
        verbs.put("watch", "watch");
        verbs.put("played", "play");
        verbs.put("play", "play");
        verbs.put("visited", "visit");
        verbs.put("visit", "visit");
        verbs.put("cooked", "cook");
        verbs.put("cook", "cook");
        verbs.put("liked", "like");
        verbs.put("like", "like");
        verbs.put("disliked", "dislike");
        verbs.put("dislike", "dislike");
        verbs.put("quit", "quit");
        verbs.put("started", "start");
        verbs.put("stopped", "stop");
        return verbs;
    }
}
