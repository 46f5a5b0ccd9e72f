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
import me.golemcore.guard.domain.model.BehavioralAggregates;
import me.golemcore.guard.domain.model.ChatMessage;
import me.golemcore.guard.domain.model.RiskAssessment;
import me.golemcore.guard.domain.model.RiskLevel;
import me.golemcore.guard.domain.model.SecurityProfile;
import me.golemcore.guard.domain.model.ViolationRecord;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Owns trust scores, quarantine, risk assessment and behavioral aggregates.
 *
 * <p>
 * Every operation returns an updated copy and leaves its input untouched.
 * Trust is clamped to [0, 100] by every mutation, and while a quarantine is
 * active recovery never lifts trust above the quarantine threshold.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrustRiskEngine {

    private static final double FREQUENCY_WEIGHT = 0.4;
    private static final double TRUST_WEIGHT = 0.4;
    private static final double IMPROVEMENT_WEIGHT = 0.2;
    private static final double CRITICAL_RISK = 0.8;
    private static final double HIGH_RISK = 0.6;
    private static final double MEDIUM_RISK = 0.3;

    private final GuardProperties properties;

    public SecurityProfile applyViolation(SecurityProfile profile, ViolationRecord violation) {
        return applyViolations(profile, List.of(violation), violation);
    }

    /**
     * Append every record of one evaluation and charge a single penalty, taken
     * from the primary record. Non-punitive records never change trust or
     * streaks.
     */
    public SecurityProfile applyViolations(SecurityProfile profile, List<ViolationRecord> violations,
            ViolationRecord primary) {
        SecurityProfile updated = profile.copy();
        updated.getViolationHistory().addAll(violations);
        capHistory(updated);

        if (primary == null || !primary.isPunitive()) {
            return updated;
        }

        GuardProperties.TrustProperties trust = properties.getTrust();
        double penalty = trust.getPenalties().getOrDefault(primary.severity(), 0.0);
        updated.setTrustScore(clampTrust(updated.getTrustScore() - penalty));
        BehavioralAggregates aggregates = updated.getAggregates();
        aggregates.setViolationStreak(aggregates.getViolationStreak() + 1);
        aggregates.setImprovementStreak(0);
        updated.setLastViolationAt(latest(updated.getLastViolationAt(), primary.timestamp()));

        if (updated.getTrustScore() <= trust.getQuarantineThreshold()) {
            Instant until = primary.timestamp().plus(trust.getQuarantineDuration());
            updated.setQuarantineUntil(latest(updated.getQuarantineUntil(), until));
            log.info("[Trust] User {} quarantined until {} (trust={})", updated.getKey(), updated.getQuarantineUntil(),
                    updated.getTrustScore());
        }
        log.debug("[Trust] User {} penalized {} for {} ({} -> {})", updated.getKey(), penalty, primary.type(),
                profile.getTrustScore(), updated.getTrustScore());
        return updated;
    }

    /**
     * Passive recovery for every whole recovery interval in {@code elapsed}.
     */
    public SecurityProfile recover(SecurityProfile profile, Duration elapsed) {
        SecurityProfile updated = profile.copy();
        long intervals = wholeIntervals(elapsed);
        applyRecovery(updated, intervals);
        return updated;
    }

    /**
     * Catch up recovery from {@code max(lastViolationAt, lastRecoveryAt)} to
     * {@code now}. The anchor advances by whole intervals only, so repeated
     * calls never lose a partial interval. An expired quarantine is cleared
     * first.
     */
    public SecurityProfile recoverUntil(SecurityProfile profile, Instant now) {
        SecurityProfile updated = profile.copy();
        if (updated.getQuarantineUntil() != null && !now.isBefore(updated.getQuarantineUntil())) {
            updated.setQuarantineUntil(null);
            log.debug("[Trust] Quarantine expired for {}", updated.getKey());
        }

        Instant anchor = latest(updated.getLastViolationAt(), updated.getLastRecoveryAt());
        if (anchor == null) {
            anchor = updated.getCreatedAt();
        }
        if (anchor == null || !now.isAfter(anchor)) {
            return updated;
        }

        long intervals = wholeIntervals(Duration.between(anchor, now));
        if (intervals == 0) {
            return updated;
        }
        applyRecovery(updated, intervals);
        updated.setLastRecoveryAt(anchor.plus(properties.getTrust().getRecoveryInterval().multipliedBy(intervals)));
        return updated;
    }

    public RiskAssessment assess(SecurityProfile profile, Instant now) {
        GuardProperties.TrustProperties trust = properties.getTrust();
        Instant from = now.minus(trust.getRiskWindow());
        long recent = profile.getViolationHistory().stream()
                .filter(ViolationRecord::isPunitive)
                .filter(v -> !v.timestamp().isBefore(from) && !v.timestamp().isAfter(now))
                .count();
        double frequency = Math.min(1.0, (double) recent / trust.getRiskFrequencyCap());
        double improvement = 1.0 / (1 + profile.getAggregates().getImprovementStreak());
        double score = FREQUENCY_WEIGHT * frequency
                + TRUST_WEIGHT * (1 - profile.getTrustScore() / SecurityProfile.MAX_TRUST)
                + IMPROVEMENT_WEIGHT * improvement;
        score = Math.max(0.0, Math.min(1.0, score));
        return new RiskAssessment(score, riskLevel(score));
    }

    public boolean isTrusted(SecurityProfile profile) {
        return profile.isTrustedAt(properties.getTrust().getTrustThreshold());
    }

    /**
     * Fold one message into the behavioral aggregates.
     */
    public SecurityProfile observeMessage(SecurityProfile profile, ChatMessage message) {
        SecurityProfile updated = profile.copy();
        BehavioralAggregates aggregates = updated.getAggregates();
        int length = message.getContentOrEmpty().length();
        if (aggregates.getMessageCount() == 0) {
            aggregates.setAverageMessageLength(length);
        } else {
            double alpha = properties.getTrust().getMessageLengthSmoothing();
            aggregates.setAverageMessageLength((1 - alpha) * aggregates.getAverageMessageLength() + alpha * length);
        }
        aggregates.setMessageCount(aggregates.getMessageCount() + 1);

        String channelId = message.getChannelId();
        if (channelId != null) {
            Set<String> channels = aggregates.getChannelIds();
            if (!channels.contains(channelId) && channels.size() >= BehavioralAggregates.MAX_TRACKED_CHANNELS) {
                Iterator<String> oldest = channels.iterator();
                oldest.next();
                oldest.remove();
            }
            channels.add(channelId);
        }
        if (message.getTimestamp() != null) {
            updated.setLastActivityAt(latest(updated.getLastActivityAt(), message.getTimestamp()));
        }
        return updated;
    }

    public SecurityProfile creditPositiveContribution(SecurityProfile profile) {
        SecurityProfile updated = profile.copy();
        BehavioralAggregates aggregates = updated.getAggregates();
        aggregates.setPositiveContributions(aggregates.getPositiveContributions() + 1);
        return updated;
    }

    /**
     * Drop records older than the retention horizon and cap the history size.
     */
    public SecurityProfile pruneHistory(SecurityProfile profile, Instant now) {
        SecurityProfile updated = profile.copy();
        Instant cutoff = now.minus(properties.getRetention().getViolationHorizon());
        updated.getViolationHistory().removeIf(v -> v.timestamp().isBefore(cutoff));
        capHistory(updated);
        return updated;
    }

    /**
     * Manual override by an operator: trust is restored to at least the trusted
     * threshold, quarantine and streaks are cleared. History is kept.
     */
    public SecurityProfile pardon(SecurityProfile profile, Instant now) {
        SecurityProfile updated = profile.copy();
        updated.setTrustScore(clampTrust(Math.max(updated.getTrustScore(),
                properties.getTrust().getTrustThreshold())));
        updated.setQuarantineUntil(null);
        updated.setPunishmentLevel(0);
        updated.getAggregates().setViolationStreak(0);
        updated.setLastRecoveryAt(now);
        return updated;
    }

    private void applyRecovery(SecurityProfile profile, long intervals) {
        if (intervals <= 0) {
            return;
        }
        GuardProperties.TrustProperties trust = properties.getTrust();
        double ceiling = profile.getQuarantineUntil() != null
                ? trust.getQuarantineThreshold()
                : SecurityProfile.MAX_TRUST;
        double score = profile.getTrustScore();
        if (score < ceiling) {
            profile.setTrustScore(clampTrust(Math.min(ceiling, score + trust.getRecoveryStep() * intervals)));
        }

        BehavioralAggregates aggregates = profile.getAggregates();
        int steps = (int) Math.min(Integer.MAX_VALUE, intervals);
        aggregates.setViolationStreak(Math.max(0, aggregates.getViolationStreak() - steps));
        aggregates.setImprovementStreak((int) Math.min(Integer.MAX_VALUE,
                (long) aggregates.getImprovementStreak() + intervals));
    }

    private long wholeIntervals(Duration elapsed) {
        if (elapsed == null || elapsed.isNegative() || elapsed.isZero()) {
            return 0;
        }
        return elapsed.toMillis() / properties.getTrust().getRecoveryInterval().toMillis();
    }

    private int capHistorySize() {
        return properties.getRetention().getMaxHistoryPerProfile();
    }

    private void capHistory(SecurityProfile profile) {
        List<ViolationRecord> history = profile.getViolationHistory();
        int overflow = history.size() - capHistorySize();
        if (overflow > 0) {
            history.subList(0, overflow).clear();
        }
    }

    private static RiskLevel riskLevel(double score) {
        if (score >= CRITICAL_RISK) {
            return RiskLevel.CRITICAL;
        }
        if (score >= HIGH_RISK) {
            return RiskLevel.HIGH;
        }
        if (score >= MEDIUM_RISK) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    private static double clampTrust(double value) {
        return Math.max(SecurityProfile.MIN_TRUST, Math.min(SecurityProfile.MAX_TRUST, value));
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }
}
