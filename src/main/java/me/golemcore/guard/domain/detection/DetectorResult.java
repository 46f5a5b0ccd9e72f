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

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of running one detector: a finding, nothing, or a failure that the
 * pipeline treats as "no finding".
 */
public record DetectorResult(String detector, Status status, ViolationRecord violation, String failureReason) {

    public enum Status {
        FINDING, NONE, FAILED
    }

    public DetectorResult {
        Objects.requireNonNull(detector, "detector");
        Objects.requireNonNull(status, "status");
        if (status == Status.FINDING && violation == null) {
            throw new IllegalArgumentException("A finding needs a violation record");
        }
    }

    public static DetectorResult finding(String detector, ViolationRecord violation) {
        return new DetectorResult(detector, Status.FINDING, violation, null);
    }

    public static DetectorResult none(String detector) {
        return new DetectorResult(detector, Status.NONE, null, null);
    }

    public static DetectorResult failed(String detector, String reason) {
        return new DetectorResult(detector, Status.FAILED, null, reason);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public Optional<ViolationRecord> findViolation() {
        return Optional.ofNullable(violation);
    }
}
