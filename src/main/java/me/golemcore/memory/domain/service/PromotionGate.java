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
import me.golemcore.memory.domain.model.DerivedView;
import me.golemcore.memory.domain.model.GateDecision;
import me.golemcore.memory.domain.model.GateVerdict;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a derived view becomes a stable concept.
 *
 * <p>
 * Pure: the decision depends only on the view, {@code now} and the ids of
 * conflicting active views, so evaluating unchanged state twice yields the same
 * verdict. Rules, first match wins:
 * <ol>
 * <li>a closed view keeps the verdict of its terminal status</li>
 * <li>no supporting evidence, or counter-evidence ratio above
 * {@code reject-counter-ratio}: reject</li>
 * <li>confidence above {@code min-confidence}, age at least
 * {@code min-age-days}, at least {@code min-validations} validations,
 * counter-evidence ratio at most {@code max-counter-ratio-for-promotion} and
 * no conflicting active view: promote</li>
 * <li>past {@code expiresAt}: expire</li>
 * <li>otherwise keep active</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
public class PromotionGate {

    private final MemoryProperties properties;

    public GateDecision evaluate(DerivedView view, Instant now, Collection<String> conflictingViewIds) {
        List<String> conflicts = conflictingViewIds == null ? List.of() : List.copyOf(conflictingViewIds);
        double ratio = reportedRatio(view);

        if (!view.isActive()) {
            return decision(view, GateVerdict.forStatus(view.getStatus()),
                    "already " + view.getStatus().name().toLowerCase(Locale.ROOT), conflicts, ratio, now);
        }
        if (view.getDerivedFrom() == null || view.getDerivedFrom().isEmpty()) {
            return decision(view, GateVerdict.REJECT, "no supporting evidence", conflicts, ratio, now);
        }

        MemoryProperties.GateProperties config = properties.getGate();
        if (ratio > config.getRejectCounterRatio()) {
            return decision(view, GateVerdict.REJECT,
                    String.format(Locale.ROOT, "counter-evidence ratio %.2f above %.2f", ratio,
                            config.getRejectCounterRatio()),
                    conflicts, ratio, now);
        }

        boolean qualifies = view.getConfidence() > config.getMinConfidence()
                && ageOf(view, now).compareTo(Duration.ofDays(config.getMinAgeDays())) >= 0
                && view.getValidationCount() >= config.getMinValidations()
                && ratio <= config.getMaxCounterRatioForPromotion();
        if (qualifies && conflicts.isEmpty()) {
            return decision(view, GateVerdict.PROMOTE,
                    String.format(Locale.ROOT, "confidence %.3f, %d validations", view.getConfidence(),
                            view.getValidationCount()),
                    conflicts, ratio, now);
        }

        if (view.getExpiresAt() != null && !now.isBefore(view.getExpiresAt())) {
            return decision(view, GateVerdict.EXPIRE, "validity window elapsed", conflicts, ratio, now);
        }
        if (qualifies) {
            return decision(view, GateVerdict.KEEP_ACTIVE, "promotion blocked by conflicting view(s) " + conflicts,
                    conflicts, ratio, now);
        }
        return decision(view, GateVerdict.KEEP_ACTIVE, "thresholds not met", conflicts, ratio, now);
    }

    private Duration ageOf(DerivedView view, Instant now) {
        if (view.getCreatedAt() == null) {
            return Duration.ZERO;
        }
        return Duration.between(view.getCreatedAt(), now);
    }

    // Infinity does not survive a JSON round trip; a view without evidence is fully contradicted.
    private double reportedRatio(DerivedView view) {
        double ratio = view.getCounterEvidenceRatio();
        return Double.isInfinite(ratio) ? 1.0 : ratio;
    }

    private GateDecision decision(DerivedView view, GateVerdict verdict, String reason, List<String> conflicts,
            double ratio, Instant now) {
        return new GateDecision(view.getViewId(), verdict, reason, conflicts, ratio, now);
    }
}
