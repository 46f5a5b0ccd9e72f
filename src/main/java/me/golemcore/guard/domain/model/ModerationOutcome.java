package me.golemcore.guard.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of evaluating one message: every violation found, the decision, and
 * the user's updated standing.
 *
 * <ul>
 * <li>{@code unpersisted} - the profile could not be read from or written to
 * the store and will be reconciled by the sweep</li>
 * <li>{@code deleteMessage} - whether the executor should delete the source
 * message; false when the message was already deleted or edited</li>
 * <li>{@code degradedDetectors} - detectors that failed or ran out of time and
 * were treated as "no finding"</li>
 * </ul>
 */
@Data
@Builder
public class ModerationOutcome {

    private String messageId;
    private ProfileKey profileKey;

    @Builder.Default
    private List<ViolationRecord> violations = new ArrayList<>();

    private ViolationRecord primaryViolation;
    private PunishmentDecision decision;
    private double updatedTrustScore;
    private RiskLevel updatedRiskLevel;
    private double riskScore;
    private boolean unpersisted;
    private boolean deleteMessage;

    @Builder.Default
    private List<String> degradedDetectors = new ArrayList<>();

    private Instant evaluatedAt;

    public boolean hasViolations() {
        return violations != null && !violations.isEmpty();
    }

    public boolean requiresAction() {
        return decision != null && decision.type() != PunishmentType.NONE;
    }
}
