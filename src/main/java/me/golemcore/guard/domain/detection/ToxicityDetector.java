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

import me.golemcore.guard.domain.model.ViolationSeverity;
import me.golemcore.guard.domain.model.ViolationType;
import me.golemcore.guard.security.PatternLibrary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Pattern families checked from least to most severe. The most severe
 * matching family decides type and severity; all matched families go into the
 * evidence.
 */
@Component
public class ToxicityDetector implements ViolationDetector {

    static final String NAME = "toxicity";

    private static final List<Family> FAMILIES = List.of(
            new Family("insult", ViolationType.TOXIC_LANGUAGE, ViolationSeverity.MODERATE,
                    PatternLibrary::getInsultPatterns),
            new Family("harassment", ViolationType.HARASSMENT, ViolationSeverity.SERIOUS,
                    PatternLibrary::getHarassmentPatterns),
            new Family("threat", ViolationType.THREATS, ViolationSeverity.SEVERE,
                    PatternLibrary::getThreatPatterns),
            new Family("hate-speech", ViolationType.HATE_SPEECH, ViolationSeverity.CRITICAL,
                    PatternLibrary::getHateSpeechPatterns));

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DetectorResult detect(DetectionContext context) {
        String content = context.content();
        if (content.isBlank()) {
            return DetectorResult.none(NAME);
        }

        Family worst = null;
        String worstPattern = null;
        List<String> matchedFamilies = new ArrayList<>();
        for (Family family : FAMILIES) {
            Optional<String> match = PatternLibrary.firstMatch(family.patterns().apply(context.patterns()), content);
            if (match.isPresent()) {
                matchedFamilies.add(family.name());
                worst = family;
                worstPattern = match.get();
            }
        }
        if (worst == null) {
            return DetectorResult.none(NAME);
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("family", worst.name());
        evidence.put("pattern", worstPattern);
        evidence.put("matchedFamilies", matchedFamilies);
        return DetectorResult.finding(NAME, context.violation(worst.type(), worst.severity(), evidence));
    }

    private record Family(String name, ViolationType type, ViolationSeverity severity,
            Function<PatternLibrary, List<Pattern>> patterns) {
    }
}
