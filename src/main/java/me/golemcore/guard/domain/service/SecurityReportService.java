package me.golemcore.guard.domain.service;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.guard.domain.model.ProfileKey;
import me.golemcore.guard.domain.model.SecurityProfile;
import me.golemcore.guard.domain.model.SecurityStats;
import me.golemcore.guard.domain.model.UserSecurityReport;
import me.golemcore.guard.domain.model.ViolationRecord;
import me.golemcore.guard.port.outbound.StoreUnavailableException;
import me.golemcore.guard.security.PatternLibraryHolder;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Operator-facing views over security profiles: aggregate statistics,
 * per-user reports and the manual override (pardon).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SecurityReportService {

    private static final Duration RECENT = Duration.ofHours(24);

    private final ProfileRepository profileRepository;
    private final TrustRiskEngine trustRiskEngine;
    private final UserModerationCoordinator coordinator;
    private final ModerationAuditService auditService;
    private final PatternLibraryHolder patternLibraryHolder;

    public SecurityStats getStats(Instant now) {
        int tracked = 0;
        int trusted = 0;
        int quarantined = 0;
        long totalViolations = 0;
        long recentViolations = 0;
        double trustSum = 0.0;

        for (ProfileKey key : profileRepository.listKeys()) {
            Optional<SecurityProfile> profile = safePeek(key);
            if (profile.isEmpty()) {
                continue;
            }
            SecurityProfile p = profile.get();
            tracked++;
            trustSum += p.getTrustScore();
            if (trustRiskEngine.isTrusted(p)) {
                trusted++;
            }
            if (p.isQuarantinedAt(now)) {
                quarantined++;
            }
            totalViolations += p.getViolationHistory().size();
            recentViolations += countSince(p, now.minus(RECENT), now);
        }

        double averageTrust = tracked > 0 ? trustSum / tracked : SecurityProfile.MAX_TRUST;
        return new SecurityStats(tracked, trusted, quarantined, totalViolations, recentViolations, averageTrust,
                patternLibraryHolder.current().getVersion());
    }

    public Optional<UserSecurityReport> getReport(ProfileKey key, Instant now) {
        return safePeek(key).map(profile -> UserSecurityReport.builder()
                .profileKey(key)
                .trustScore(profile.getTrustScore())
                .trusted(trustRiskEngine.isTrusted(profile))
                .punishmentLevel(profile.getPunishmentLevel())
                .totalViolations(profile.getViolationHistory().size())
                .recentViolations24h(countSince(profile, now.minus(RECENT), now))
                .violationStreak(profile.getAggregates().getViolationStreak())
                .positiveContributions(profile.getAggregates().getPositiveContributions())
                .quarantined(profile.isQuarantinedAt(now))
                .quarantineUntil(profile.getQuarantineUntil())
                .lastViolationAt(profile.getLastViolationAt())
                .averageMessageLength(profile.getAggregates().getAverageMessageLength())
                .channelDiversity(profile.getAggregates().getChannelIds().size())
                .risk(trustRiskEngine.assess(profile, now))
                .build());
    }

    /**
     * Manual override: restore the user's standing. Runs in the user's
     * moderation queue.
     */
    public CompletableFuture<SecurityProfile> pardon(ProfileKey key, String moderatorId, String reason, Instant now) {
        return coordinator.submit(key, () -> {
            ProfileRepository.LoadedProfile loaded = profileRepository.load(key, now);
            SecurityProfile pardoned = trustRiskEngine.pardon(loaded.profile(), now);
            profileRepository.save(pardoned, loaded.verified(), now);
            auditService.recordManualOverride(pardoned, moderatorId, reason, now);
            log.info("[Moderation] {} pardoned by {}: {}", key, moderatorId, reason);
            return pardoned;
        });
    }

    private Optional<SecurityProfile> safePeek(ProfileKey key) {
        try {
            return profileRepository.peek(key);
        } catch (StoreUnavailableException e) {
            log.warn("[Store] Skipping {} in report: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private static long countSince(SecurityProfile profile, Instant from, Instant now) {
        return profile.getViolationHistory().stream()
                .filter(ViolationRecord::isPunitive)
                .filter(v -> !v.timestamp().isBefore(from) && !v.timestamp().isAfter(now))
                .count();
    }
}
