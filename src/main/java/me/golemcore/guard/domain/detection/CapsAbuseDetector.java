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
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Flags shouting: the share of upper-case letters among all letters reaches
 * {@code guard.detection.caps-ratio-threshold} on a message of at least
 * {@code guard.detection.caps-min-length} characters.
 */
@Component
@RequiredArgsConstructor
public class CapsAbuseDetector implements ViolationDetector {

    static final String NAME = "caps-abuse";

    private final GuardProperties properties;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DetectorResult detect(DetectionContext context) {
        GuardProperties.DetectionProperties detection = properties.getDetection();
        String content = context.content();
        if (content.length() < detection.getCapsMinLength()) {
            return DetectorResult.none(NAME);
        }

        int letters = 0;
        int upper = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (Character.isLetter(c)) {
                letters++;
                if (Character.isUpperCase(c)) {
                    upper++;
                }
            }
        }
        if (letters == 0) {
            return DetectorResult.none(NAME);
        }

        double ratio = (double) upper / letters;
        if (ratio < detection.getCapsRatioThreshold()) {
            return DetectorResult.none(NAME);
        }
        return DetectorResult.finding(NAME, context.violation(ViolationType.CAPS_ABUSE, ViolationSeverity.MINOR,
                Map.of("capsRatio", Math.round(ratio * 100) / 100.0, "letters", letters)));
    }
}
