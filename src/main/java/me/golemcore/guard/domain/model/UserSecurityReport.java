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

/**
 * Operator-facing summary of one user's security standing.
 */
@Data
@Builder
public class UserSecurityReport {

    private ProfileKey profileKey;
    private double trustScore;
    private boolean trusted;
    private int punishmentLevel;
    private int totalViolations;
    private long recentViolations24h;
    private int violationStreak;
    private long positiveContributions;
    private boolean quarantined;
    private Instant quarantineUntil;
    private Instant lastViolationAt;
    private double averageMessageLength;
    private int channelDiversity;
    private RiskAssessment risk;
}
