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
import me.golemcore.guard.domain.model.ViolationSeverity;
import me.golemcore.guard.domain.model.ViolationType;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import me.golemcore.guard.security.PatternLibrary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scores phishing language: two points per phishing phrase, one per urgency
 * word. A score of {@code guard.detection.phishing-score-threshold} or more is
 * a critical violation.
 */
@Component
@RequiredArgsConstructor
public class PhishingDetector implements ViolationDetector {

    static final String NAME = "phishing";

    private static final int KEYWORD_POINTS = 2;
    private static final int URGENCY_POINTS = 1;

    private final GuardProperties properties;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DetectorResult detect(DetectionContext context) {
        String lower = context.lowerContent();
        if (lower.isBlank()) {
            return DetectorResult.none(NAME);
        }
        PatternLibrary patterns = context.patterns();

        int score = 0;
        List<String> keywords = new ArrayList<>();
        for (String keyword : patterns.getPhishingKeywords()) {
            if (lower.contains(keyword)) {
                score += KEYWORD_POINTS;
                keywords.add(keyword);
            }
        }
        List<String> urgency = new ArrayList<>();
        for (Pattern pattern : patterns.getUrgencyPatterns()) {
            if (pattern.matcher(lower).find()) {
                score += URGENCY_POINTS;
                urgency.add(pattern.pattern());
            }
        }

        if (score < properties.getDetection().getPhishingScoreThreshold()) {
            return DetectorResult.none(NAME);
        }
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("phishingScore", score);
        evidence.put("keywords", keywords);
        evidence.put("urgencyMatches", urgency.size());
        return DetectorResult.finding(NAME, context.violation(ViolationType.PHISHING, ViolationSeverity.CRITICAL,
                evidence));
    }
}
