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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.ConflictKind;
import me.golemcore.memory.domain.model.DerivedView;
import me.golemcore.memory.domain.model.ViewConflict;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds pairs of active views that cannot both be true.
 *
 * <p>
 * Two programmatic rules, no inference:
 * <ul>
 * <li><b>antonym</b>: the hypotheses take opposite sides of a configured
 * antonym pair (喜欢/不喜欢, always/never, ...) about the same subject. The
 * negative forms are stripped before a positive form is looked for, so
 * "不喜欢" never counts as "喜欢".</li>
 * <li><b>categorical</b>: one view places the user in a category (是素食主义者)
 * and the other is about something that category excludes, or places the user
 * in a mutually exclusive category. Suppressed when both views carry different
 * explicit context tags.</li>
 * </ul>
 * Each pair is reported at most once.
 */
@Service
@Slf4j
public class ConflictDetectorService {

    private static final Pattern CN_CATEGORY = Pattern.compile("(?<![总还就也都只不])是(?:一个|一名|个)?(.+)");
    private static final Pattern EN_CATEGORY = Pattern.compile("\\bis an? (.+)");
    private static final Pattern TIME_PHRASE = Pattern.compile("在\\d{1,2}点左右");
    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{P}\\p{S}]");
    private static final Pattern EN_FILLER = Pattern.compile("\\b(s|es|the|a|an|does|do|not|is|to)\\b");
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final List<String> NEGATION_MARKERS = List.of("不", "没", "别", "never", "not ", "don't");
    private static final List<String> SUBJECT_NOISE = List.of(
            "用户", "user", "的频率在增加", "的频率在减少", "吃", "喝", "买", "去", "看", "玩", "用", "穿", "听", "读",
            "做", "eats", "eat", "drinks", "drink", "buys", "buy");

    private final List<AntonymPair> antonymPairs;
    private final List<String> negativeForms;
    private final List<String> positiveForms;
    private final Map<String, List<String>> categoryExclusions;
    private final List<List<String>> exclusiveGroups;

    public ConflictDetectorService(MemoryProperties properties) {
        MemoryProperties.ConflictProperties config = properties.getConflicts();
        this.antonymPairs = config.getAntonymPairs().stream()
                .map(ConflictDetectorService::parsePair)
                .flatMap(Optional::stream)
                .toList();
        this.negativeForms = antonymPairs.stream().map(AntonymPair::negative).distinct()
                .sorted(Comparator.comparingInt(String::length).reversed()).toList();
        this.positiveForms = antonymPairs.stream().map(AntonymPair::positive).distinct()
                .sorted(Comparator.comparingInt(String::length).reversed()).toList();
        this.categoryExclusions = config.getCategoryExclusions();
        this.exclusiveGroups = config.getExclusiveCategoryGroups().stream()
                .map(group -> Arrays.stream(group.split(":")).map(String::trim).filter(s -> !s.isEmpty()).toList())
                .filter(group -> group.size() > 1)
                .toList();
    }

    public List<ViewConflict> findConflicts(List<DerivedView> views) {
        List<ViewConflict> conflicts = new ArrayList<>();
        for (int i = 0; i < views.size(); i++) {
            for (int j = i + 1; j < views.size(); j++) {
                DerivedView first = views.get(i);
                DerivedView second = views.get(j);
                if (!first.isActive() || !second.isActive()) {
                    continue;
                }
                Optional<ViewConflict> conflict = antonymConflict(first, second)
                        .or(() -> categoricalConflict(first, second));
                conflict.ifPresent(found -> {
                    log.debug("[Conflict] {} conflict on '{}' between {} and {}", found.kind(), found.subject(),
                            found.firstViewId(), found.secondViewId());
                    conflicts.add(found);
                });
            }
        }
        return conflicts;
    }

    Optional<ViewConflict> antonymConflict(DerivedView first, DerivedView second) {
        String firstText = normalize(first.getHypothesis());
        String secondText = normalize(second.getHypothesis());
        for (AntonymPair pair : antonymPairs) {
            Side firstSide = sideOf(firstText, pair);
            Side secondSide = sideOf(secondText, pair);
            if (firstSide == Side.NONE || secondSide == Side.NONE || firstSide == secondSide) {
                continue;
            }
            String firstSubject = subjectOf(first);
            String secondSubject = subjectOf(second);
            if (sameSubject(firstSubject, secondSubject)) {
                return Optional.of(new ViewConflict(first.getViewId(), second.getViewId(),
                        shorter(firstSubject, secondSubject), ConflictKind.ANTONYM));
            }
        }
        return Optional.empty();
    }

    Optional<ViewConflict> categoricalConflict(DerivedView first, DerivedView second) {
        if (hasText(first.getContextTag()) && hasText(second.getContextTag())
                && !first.getContextTag().equals(second.getContextTag())) {
            return Optional.empty();
        }
        Optional<String> firstCategory = categoryOf(first);
        Optional<String> secondCategory = categoryOf(second);

        if (firstCategory.isPresent() && secondCategory.isPresent()
                && mutuallyExclusive(firstCategory.get(), secondCategory.get())) {
            return Optional.of(new ViewConflict(first.getViewId(), second.getViewId(),
                    firstCategory.get() + "/" + secondCategory.get(), ConflictKind.CATEGORICAL));
        }
        if (firstCategory.isPresent()) {
            Optional<String> excluded = excludedSubject(firstCategory.get(), second);
            if (excluded.isPresent()) {
                return Optional.of(new ViewConflict(first.getViewId(), second.getViewId(), excluded.get(),
                        ConflictKind.CATEGORICAL));
            }
        }
        if (secondCategory.isPresent()) {
            Optional<String> excluded = excludedSubject(secondCategory.get(), first);
            if (excluded.isPresent()) {
                return Optional.of(new ViewConflict(first.getViewId(), second.getViewId(), excluded.get(),
                        ConflictKind.CATEGORICAL));
            }
        }
        return Optional.empty();
    }

    Optional<String> categoryOf(DerivedView view) {
        if (hasText(view.getCategory())) {
            return Optional.of(view.getCategory().trim());
        }
        String text = normalize(view.getHypothesis());
        if (text.contains("不是") || text.contains("is not")) {
            return Optional.empty();
        }
        for (Pattern pattern : List.of(CN_CATEGORY, EN_CATEGORY)) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                String category = PUNCTUATION.matcher(matcher.group(1)).replaceAll("").trim();
                if (!category.isEmpty()) {
                    return Optional.of(category);
                }
            }
        }
        return Optional.empty();
    }

    String subjectOf(DerivedView view) {
        if (hasText(view.getSubject())) {
            return normalize(view.getSubject());
        }
        String text = normalize(view.getHypothesis());
        for (String form : negativeForms) {
            text = text.replace(form, " ");
        }
        for (String form : positiveForms) {
            text = text.replace(form, " ");
        }
        text = TIME_PHRASE.matcher(text).replaceAll(" ");
        for (String noise : SUBJECT_NOISE) {
            text = text.replace(noise, " ");
        }
        text = PUNCTUATION.matcher(text).replaceAll(" ");
        text = EN_FILLER.matcher(text).replaceAll(" ");
        return SPACES.matcher(text).replaceAll(" ").trim();
    }

    private Optional<String> excludedSubject(String category, DerivedView other) {
        if (hasNegation(other)) {
            return Optional.empty();
        }
        String subject = subjectOf(other);
        if (subject.isEmpty()) {
            return Optional.empty();
        }
        for (Map.Entry<String, List<String>> exclusion : categoryExclusions.entrySet()) {
            if (!category.contains(normalize(exclusion.getKey()))) {
                continue;
            }
            for (String term : exclusion.getValue()) {
                if (subject.contains(normalize(term))) {
                    return Optional.of(subject);
                }
            }
        }
        return Optional.empty();
    }

    private boolean mutuallyExclusive(String firstCategory, String secondCategory) {
        for (List<String> group : exclusiveGroups) {
            int firstIndex = memberIndex(group, firstCategory);
            int secondIndex = memberIndex(group, secondCategory);
            if (firstIndex >= 0 && secondIndex >= 0 && firstIndex != secondIndex) {
                return true;
            }
        }
        return false;
    }

    private int memberIndex(List<String> group, String category) {
        String normalized = normalize(category);
        for (int i = 0; i < group.size(); i++) {
            if (normalized.contains(normalize(group.get(i)))) {
                return i;
            }
        }
        return -1;
    }

    private Side sideOf(String text, AntonymPair pair) {
        if (text.contains(pair.negative())) {
            return Side.NEGATIVE;
        }
        String stripped = text;
        for (String form : negativeForms) {
            stripped = stripped.replace(form, " ");
        }
        return stripped.contains(pair.positive()) ? Side.POSITIVE : Side.NONE;
    }

    private boolean hasNegation(DerivedView view) {
        String text = normalize(view.getHypothesis());
        return NEGATION_MARKERS.stream().anyMatch(text::contains)
                || negativeForms.stream().anyMatch(text::contains);
    }

    private static boolean sameSubject(String first, String second) {
        if (first.isEmpty() || second.isEmpty()) {
            return false;
        }
        return first.contains(second) || second.contains(first);
    }

    private static String shorter(String first, String second) {
        return first.length() <= second.length() ? first : second;
    }

    private static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT).trim();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static Optional<AntonymPair> parsePair(String definition) {
        String[] parts = definition.split(":", 2);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            log.warn("[Conflict] Ignoring malformed antonym pair '{}'", definition);
            return Optional.empty();
        }
        return Optional.of(new AntonymPair(normalize(parts[0]), normalize(parts[1])));
    }

    private enum Side {
        POSITIVE, NEGATIVE, NONE
    }

    private record AntonymPair(String positive, String negative) {
    }
}
