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

import java.util.Map;

/**
 * Recognizes self-harm and crisis language. The record it produces is routed to
 * supportive handling and never lowers trust.
 */
@Component
public class DistressSignalDetector implements ViolationDetector {

    static final String NAME = "distress-signal";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DetectorResult detect(DetectionContext context) {
        return PatternLibrary.firstMatch(context.patterns().getDistressPatterns(), context.content())
                .map(pattern -> DetectorResult.finding(NAME, context.violation(ViolationType.EMOTIONAL_DISTRESS,
                        ViolationSeverity.MINOR, Map.of("pattern", pattern))))
                .orElseGet(() -> DetectorResult.none(NAME));
    }
}
