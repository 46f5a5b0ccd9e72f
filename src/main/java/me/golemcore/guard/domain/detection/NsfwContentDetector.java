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

import java.util.Map;

/**
 * Keyword-based NSFW content check, switched off with
 * {@code guard.detection.nsfw-enabled=false}.
 */
@Component
@RequiredArgsConstructor
public class NsfwContentDetector implements ViolationDetector {

    static final String NAME = "nsfw-content";

    private final GuardProperties properties;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DetectorResult detect(DetectionContext context) {
        if (!properties.getDetection().isNsfwEnabled()) {
            return DetectorResult.none(NAME);
        }
        return PatternLibrary.firstMatch(context.patterns().getNsfwPatterns(), context.content())
                .map(pattern -> DetectorResult.finding(NAME, context.violation(ViolationType.NSFW_CONTENT,
                        ViolationSeverity.MODERATE, Map.of("pattern", pattern))))
                .orElseGet(() -> DetectorResult.none(NAME));
    }
}
