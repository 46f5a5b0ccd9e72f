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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-user security state: trust score, bounded violation history, quarantine
 * and behavioral aggregates.
 *
 * <p>
 * The trusted flag is deliberately not a field. It is always derived from
 * {@link #getTrustScore()} against the configured threshold, see
 * {@link #isTrustedAt(double)}.
 *
 * <p>
 * Mutation happens only through
 * {@link me.golemcore.guard.domain.service.TrustRiskEngine}, which works on
 * copies, and only inside the per-user moderation queue.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SecurityProfile {

    public static final double MAX_TRUST = 100.0;
    public static final double MIN_TRUST = 0.0;
    public static final int MAX_PUNISHMENT_LEVEL = 7;

    private String userId;
    private String guildId;

    @Builder.Default
    private double trustScore = MAX_TRUST;

    @Builder.Default
    private List<ViolationRecord> violationHistory = new ArrayList<>();

    private int punishmentLevel;
    private Instant quarantineUntil;
    private Instant lastViolationAt;
    private Instant lastRecoveryAt;
    private Instant lastActivityAt;
    private Instant createdAt;

    @Builder.Default
    private BehavioralAggregates aggregates = new BehavioralAggregates();

    /**
     * Set when the profile could not be read from or written to the store and
     * needs reconciliation. Never serialized.
     */
    @JsonIgnore
    private boolean unpersisted;

    public static SecurityProfile newProfile(ProfileKey key, Instant now) {
        return SecurityProfile.builder()
                .userId(key.userId())
                .guildId(key.guildId())
                .createdAt(now)
                .lastActivityAt(now)
                .build();
    }

    @JsonIgnore
    public ProfileKey getKey() {
        return new ProfileKey(guildId, userId);
    }

    public boolean isTrustedAt(double trustThreshold) {
        return trustScore >= trustThreshold;
    }

    public boolean isQuarantinedAt(Instant now) {
        return quarantineUntil != null && now.isBefore(quarantineUntil);
    }

    /**
     * Deep copy; violation records are immutable and shared.
     */
    public SecurityProfile copy() {
        return toBuilder()
                .violationHistory(violationHistory != null ? new ArrayList<>(violationHistory) : new ArrayList<>())
                .aggregates(aggregates != null ? aggregates.copy() : new BehavioralAggregates())
                .build();
    }
}
