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
import me.golemcore.guard.window.SlidingWindowTracker;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Flags the same message (after normalization) sent
 * {@code guard.detection.spam-threshold} times within
 * {@code guard.detection.spam-timeframe}, the current one included. Applies at
 * any message length.
 */
@Component
@RequiredArgsConstructor
public class IdenticalMessageSpamDetector implements ViolationDetector {

    static final String NAME = "identical-spam";

    private final SlidingWindowTracker windowTracker;
    private final GuardProperties properties;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DetectorResult detect(DetectionContext context) {
        GuardProperties.DetectionProperties detection = properties.getDetection();
        int count = identicalCount(windowTracker, detection, context);
        if (count < detection.getSpamThreshold()) {
            return DetectorResult.none(NAME);
        }
        return DetectorResult.finding(NAME, context.violation(ViolationType.SPAM, ViolationSeverity.MODERATE,
                Map.of("identicalMessages", count,
                        "timeframeSeconds", detection.getSpamTimeframe().toSeconds())));
    }

    static int identicalCount(SlidingWindowTracker windowTracker, GuardProperties.DetectionProperties detection,
            DetectionContext context) {
        return windowTracker.countMatching(context.userKey(), context.currentEntry().fingerprint(),
                detection.getSpamTimeframe(), context.now());
    }
}
