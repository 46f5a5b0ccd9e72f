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

import java.util.List;
import java.util.Map;

/**
 * Flags mass mentions. Severity rises from MINOR to MODERATE at
 * {@code guard.detection.mention-severe-limit} distinct mentions.
 */
@Component
@RequiredArgsConstructor
public class MentionSpamDetector implements ViolationDetector {

    static final String NAME = "mention-spam";

    private final GuardProperties properties;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DetectorResult detect(DetectionContext context) {
        List<String> mentions = context.message().getMentions();
        if (mentions == null || mentions.isEmpty()) {
            return DetectorResult.none(NAME);
        }
        GuardProperties.DetectionProperties detection = properties.getDetection();
        long distinct = mentions.stream().filter(m -> m != null && !m.isBlank()).distinct().count();
        if (distinct < detection.getMentionLimit()) {
            return DetectorResult.none(NAME);
        }
        ViolationSeverity severity = distinct >= detection.getMentionSevereLimit()
                ? ViolationSeverity.MODERATE
                : ViolationSeverity.MINOR;
        return DetectorResult.finding(NAME, context.violation(ViolationType.MENTION_SPAM, severity,
                Map.of("mentionCount", distinct)));
    }
}
