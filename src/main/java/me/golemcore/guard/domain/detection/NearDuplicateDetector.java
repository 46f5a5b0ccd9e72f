package me.golemcore.guard.domain.detection;

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
import me.golemcore.guard.domain.model.SlidingWindowEntry;
import me.golemcore.guard.domain.model.ViolationSeverity;
import me.golemcore.guard.domain.model.ViolationType;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import me.golemcore.guard.window.MessageFingerprints;
import me.golemcore.guard.window.SlidingWindowTracker;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Flags messages that are slight variations of earlier ones: token-set Jaccard
 * similarity at or above {@code guard.detection.similarity-threshold} against
 * at least {@code guard.detection.similar-match-threshold} earlier messages in
 * the similarity window. Exact repeats are left to
 * {@link IdenticalMessageSpamDetector}.
 */
@Component
@RequiredArgsConstructor
public class NearDuplicateDetector implements ViolationDetector {

    static final String NAME = "near-duplicate";

    private final SlidingWindowTracker windowTracker;
    private final GuardProperties properties;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DetectorResult detect(DetectionContext context) {
        GuardProperties.DetectionProperties detection = properties.getDetection();
        if (context.content().trim().length() < detection.getMinLengthForAnalysis()) {
            return DetectorResult.none(NAME);
        }
        SlidingWindowEntry current = context.currentEntry();
        if (current.tokens().isEmpty()) {
            return DetectorResult.none(NAME);
        }

        int matches = 0;
        double best = 0.0;
        for (SlidingWindowEntry entry : windowTracker.recentEntries(context.userKey(),
                detection.getSimilarityWindow(), context.now())) {
            if (entry == current || entry.fingerprint().equals(current.fingerprint())) {
                continue;
            }
            double similarity = MessageFingerprints.jaccard(current.tokens(), entry.tokens());
            if (similarity >= detection.getSimilarityThreshold()) {
                matches++;
                best = Math.max(best, similarity);
            }
        }

        if (matches < detection.getSimilarMatchThreshold()) {
            return DetectorResult.none(NAME);
        }
        return DetectorResult.finding(NAME, context.violation(ViolationType.REPEATED_CONTENT,
                ViolationSeverity.MINOR,
                Map.of("similarMessages", matches, "maxSimilarity", Math.round(best * 100) / 100.0)));
    }
}
