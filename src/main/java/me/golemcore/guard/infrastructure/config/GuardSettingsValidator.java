package me.golemcore.guard.infrastructure.config;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.guard.domain.model.PunishmentType;
import me.golemcore.guard.domain.model.ViolationSeverity;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates {@link GuardProperties} once at startup and refuses to start with
 * an inconsistent penalty table, threshold or timeout table.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GuardSettingsValidator {

    private static final int FIRST_TIMEOUT_LEVEL = 3;
    private static final int LAST_TIMEOUT_LEVEL = 6;

    private final GuardProperties properties;

    @PostConstruct
    public void validate() {
        List<String> errors = new ArrayList<>();
        validateDetection(properties.getDetection(), errors);
        validateTrust(properties.getTrust(), errors);
        validatePunishment(properties.getPunishment(), errors);
        validateLimits(errors);

        if (!errors.isEmpty()) {
            errors.forEach(error -> log.error("[Config] {}", error));
            throw new ModerationConfigurationException("Invalid guard configuration: " + String.join("; ", errors));
        }
        log.info("[Config] Moderation settings validated");
    }

    private void validateDetection(GuardProperties.DetectionProperties detection, List<String> errors) {
        requirePositive(detection.getEvaluationBudget(), "guard.detection.evaluation-budget", errors);
        requirePositive(detection.getSpamTimeframe(), "guard.detection.spam-timeframe", errors);
        requirePositive(detection.getRapidTimeframe(), "guard.detection.rapid-timeframe", errors);
        requirePositive(detection.getSimilarityWindow(), "guard.detection.similarity-window", errors);
        if (detection.getSpamThreshold() < 2) {
            errors.add("guard.detection.spam-threshold must be at least 2");
        }
        if (detection.getRapidMessageLimit() < 1) {
            errors.add("guard.detection.rapid-message-limit must be positive");
        }
        if (detection.getSimilarityThreshold() <= 0 || detection.getSimilarityThreshold() > 1) {
            errors.add("guard.detection.similarity-threshold must be in (0, 1]");
        }
        if (detection.getSimilarMatchThreshold() < 1) {
            errors.add("guard.detection.similar-match-threshold must be positive");
        }
        if (detection.getCapsRatioThreshold() <= 0 || detection.getCapsRatioThreshold() > 1) {
            errors.add("guard.detection.caps-ratio-threshold must be in (0, 1]");
        }
        if (detection.getMentionLimit() < 1 || detection.getMentionSevereLimit() < detection.getMentionLimit()) {
            errors.add("guard.detection.mention-severe-limit must be >= mention-limit >= 1");
        }
        if (detection.getPhishingScoreThreshold() < 1) {
            errors.add("guard.detection.phishing-score-threshold must be positive");
        }
    }

    private void validateTrust(GuardProperties.TrustProperties trust, List<String> errors) {
        Map<ViolationSeverity, Double> penalties = trust.getPenalties();
        double previous = 0.0;
        for (ViolationSeverity severity : ViolationSeverity.values()) {
            Double penalty = penalties != null ? penalties.get(severity) : null;
            if (penalty == null) {
                errors.add("guard.trust.penalties is missing " + severity);
                continue;
            }
            if (penalty < previous) {
                errors.add("guard.trust.penalties must not decrease with severity (" + severity + ")");
            }
            previous = penalty;
        }
        if (!inTrustRange(trust.getTrustThreshold())) {
            errors.add("guard.trust.trust-threshold must be in [0, 100]");
        }
        if (!inTrustRange(trust.getQuarantineThreshold())
                || trust.getQuarantineThreshold() >= trust.getTrustThreshold()) {
            errors.add("guard.trust.quarantine-threshold must be in [0, trust-threshold)");
        }
        if (trust.getRecoveryStep() <= 0) {
            errors.add("guard.trust.recovery-step must be positive");
        }
        requirePositive(trust.getRecoveryInterval(), "guard.trust.recovery-interval", errors);
        requirePositive(trust.getQuarantineDuration(), "guard.trust.quarantine-duration", errors);
        requirePositive(trust.getRiskWindow(), "guard.trust.risk-window", errors);
        if (trust.getRiskFrequencyCap() < 1) {
            errors.add("guard.trust.risk-frequency-cap must be positive");
        }
        if (trust.getMessageLengthSmoothing() <= 0 || trust.getMessageLengthSmoothing() > 1) {
            errors.add("guard.trust.message-length-smoothing must be in (0, 1]");
        }
    }

    private void validatePunishment(GuardProperties.PunishmentProperties punishment, List<String> errors) {
        Map<Integer, Duration> timeouts = punishment.getTimeoutDurations();
        Duration previous = Duration.ZERO;
        for (int level = FIRST_TIMEOUT_LEVEL; level <= LAST_TIMEOUT_LEVEL; level++) {
            Duration duration = timeouts != null ? timeouts.get(level) : null;
            if (duration == null || duration.isNegative() || duration.isZero()) {
                errors.add("guard.punishment.timeout-durations needs a positive duration for level " + level);
                continue;
            }
            if (duration.compareTo(previous) < 0) {
                errors.add("guard.punishment.timeout-durations must not shrink at level " + level);
            }
            previous = duration;
        }
        if (punishment.getMaxLevelAction() != PunishmentType.KICK
                && punishment.getMaxLevelAction() != PunishmentType.BAN) {
            errors.add("guard.punishment.max-level-action must be KICK or BAN");
        }
        requirePositive(punishment.getEscalationWindow(), "guard.punishment.escalation-window", errors);
        if (punishment.getEscalationStep() < 0 || punishment.getEscalationCap() < 0) {
            errors.add("guard.punishment.escalation-step and escalation-cap must not be negative");
        }
    }

    private void validateLimits(List<String> errors) {
        if (properties.getWindow().getCapacity() < 1) {
            errors.add("guard.window.capacity must be positive");
        }
        if (properties.getRetention().getMaxHistoryPerProfile() < 1) {
            errors.add("guard.retention.max-history-per-profile must be positive");
        }
        requirePositive(properties.getRetention().getViolationHorizon(), "guard.retention.violation-horizon", errors);
        requirePositive(properties.getCache().getTtl(), "guard.cache.ttl", errors);
        if (properties.getCache().getMaxSize() < 1) {
            errors.add("guard.cache.max-size must be positive");
        }
        requirePositive(properties.getSweep().getInterval(), "guard.sweep.interval", errors);
        if (properties.getStore().getMaxRetries() < 0) {
            errors.add("guard.store.max-retries must not be negative");
        }
        if (properties.getConcurrency().getMaxQueuedPerUser() < 1
                || properties.getConcurrency().getModerationThreads() < 1
                || properties.getConcurrency().getDetectorThreads() < 1) {
            errors.add("guard.concurrency limits must be positive");
        }
        GuardProperties.ThreatIntelProperties threatIntel = properties.getThreatIntel();
        if (threatIntel.isEnabled() && (threatIntel.getUrl() == null || threatIntel.getUrl().isBlank())) {
            errors.add("guard.threat-intel.url is required when threat intel is enabled");
        }
        requirePositive(threatIntel.getTimeout(), "guard.threat-intel.timeout", errors);
        Duration budget = properties.getDetection().getEvaluationBudget();
        if (threatIntel.getTimeout() != null && budget != null && threatIntel.getTimeout().compareTo(budget) >= 0) {
            errors.add("guard.threat-intel.timeout must be shorter than guard.detection.evaluation-budget");
        }
    }

    private static boolean inTrustRange(double value) {
        return value >= 0 && value <= 100;
    }

    private static void requirePositive(Duration duration, String name, List<String> errors) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            errors.add(name + " must be a positive duration");
        }
    }
}
