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
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Component;

/**
 * Confidence arithmetic for derived views:
 * {@code clamp(prior + log10(validations) * w - counterEvidence * p, 0, 1)}.
 *
 * <p>
 * Repeated confirmation is rewarded logarithmically and contradiction is
 * penalized linearly, so a single counterexample cannot destroy a well
 * supported hypothesis but several will. {@code prior} is the neutral 0.5 for
 * views without a detector score, otherwise the detector's discounted score.
 */
@Component
@RequiredArgsConstructor
public class ConfidenceModel {

    private final MemoryProperties properties;

    public double recalculate(double prior, int validationCount, int counterEvidenceCount) {
        MemoryProperties.ViewProperties config = properties.getViews();
        double reward = validationCount > 0 ? Math.log10(validationCount) * config.getValidationWeight() : 0.0;
        double penalty = counterEvidenceCount * config.getCounterEvidencePenalty();
        return clamp(prior + reward - penalty);
    }

    public double recalculate(DerivedView view) {
        return recalculate(view.getPriorConfidence(), view.getValidationCount(), view.getCounterEvidence().size());
    }

    public double neutralPrior() {
        return properties.getViews().getNeutralPrior();
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
