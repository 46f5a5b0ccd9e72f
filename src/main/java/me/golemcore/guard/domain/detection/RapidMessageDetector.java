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
 * Flags more than {@code guard.detection.rapid-message-limit} messages within
 * {@code guard.detection.rapid-timeframe}. Stays silent when the identical
 * message rule already fires, so one message yields at most one SPAM record.
 */
@Component
@RequiredArgsConstructor
public class RapidMessageDetector implements ViolationDetector {

    static final String NAME = "rapid-message";

    private final SlidingWindowTracker windowTracker;
    private final GuardProperties properties;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DetectorResult detect(DetectionContext context) {
        GuardProperties.DetectionProperties detection = properties.getDetection();
        int count = windowTracker.countRecent(context.userKey(), detection.getRapidTimeframe(), context.now());
        if (count <= detection.getRapidMessageLimit()) {
            return DetectorResult.none(NAME);
        }
        if (IdenticalMessageSpamDetector.identicalCount(windowTracker, detection, context) >= detection
                .getSpamThreshold()) {
            return DetectorResult.none(NAME);
        }
        return DetectorResult.finding(NAME, context.violation(ViolationType.SPAM, ViolationSeverity.MINOR,
                Map.of("messagesInWindow", count,
                        "timeframeSeconds", detection.getRapidTimeframe().toSeconds())));
    }
}
