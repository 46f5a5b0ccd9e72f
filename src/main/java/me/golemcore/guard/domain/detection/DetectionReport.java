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

import me.golemcore.guard.domain.model.ViolationRecord;

import java.util.List;

/**
 * All violations found for one message, the primary one used for escalation,
 * and the detectors that failed or ran out of time.
 */
public record DetectionReport(
        List<ViolationRecord> violations,
        ViolationRecord primary,
        List<String> degradedDetectors,
        long patternVersion) {

    public DetectionReport {
        violations = List.copyOf(violations);
        degradedDetectors = List.copyOf(degradedDetectors);
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }
}
