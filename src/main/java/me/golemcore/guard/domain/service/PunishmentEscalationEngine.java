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
import me.golemcore.guard.domain.model.PunishmentDecision;
import me.golemcore.guard.domain.model.PunishmentType;
import me.golemcore.guard.domain.model.SecurityProfile;
import me.golemcore.guard.domain.model.ViolationRecord;
import me.golemcore.guard.domain.model.ViolationSeverity;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns the primary violation of an evaluation into a punishment decision.
 *
 * <p>
 * {@code level = clamp(round(severity + min(recent * step, cap) + (100 - trust) / 100), 0, 7)}
 * where {@code recent} counts punitive records of the last escalation window
 * before the primary's timestamp, not counting the records of the current
 * evaluation. Levels map to actions:
 *
 * <pre>
 * 0-1 reminder   2 warning   3 timeout 30m   4 timeout 1h
 * 5 timeout 2h   6 timeout 6h   7 kick (or ban)
 * </pre>
 *
 * <p>
 * Pure: the reference time is the primary violation's timestamp, never the
 * wall clock, so equal inputs always produce equal decisions.
 */
@Service
@RequiredArgsConstructor
public class PunishmentEscalationEngine {

    static final int REMINDER_MAX_LEVEL = 1;
    static final int WARNING_LEVEL = 2;
    static final int CRITICAL_FLOOR_LEVEL = 3;
    static final int UNVERIFIED_CAP_LEVEL = 6;

    private final GuardProperties properties;

    public PunishmentDecision decide(SecurityProfile profile, ViolationRecord primary, List<ViolationRecord> all) {
        if (primary == null) {
            return PunishmentDecision.none();
        }
        if (!primary.isPunitive()) {
            return PunishmentDecision.supportive("supportive handling for " + primary.type());
        }

        GuardProperties.PunishmentProperties punishment = properties.getPunishment();
        Instant reference = primary.timestamp();
        long recent = countRecentPunitive(profile, all, reference, punishment.getEscalationWindow());

        int base = primary.severity().getLevel();
        double escalation = Math.min(recent * punishment.getEscalationStep(), punishment.getEscalationCap());
        double trustFactor = (SecurityProfile.MAX_TRUST - profile.getTrustScore()) / SecurityProfile.MAX_TRUST;
        int level = clampLevel(Math.round(base + escalation + trustFactor));

        if (primary.severity() == ViolationSeverity.CRITICAL) {
            level = Math.max(level, CRITICAL_FLOOR_LEVEL);
        }
        if (profile.isQuarantinedAt(reference)) {
            level = Math.max(level, WARNING_LEVEL);
        }

        String rationale = String.format(Locale.ROOT, "%s/%s, %d recent, trust %.1f -> level %d",
                primary.type(), primary.severity(), recent, profile.getTrustScore(), level);
        return forLevel(level, rationale);
    }

    /**
     * Kick and ban are never issued from a profile that could not be read from
     * the store; they become the longest timeout instead.
     */
    public PunishmentDecision capForUnverifiedProfile(PunishmentDecision decision) {
        if (!decision.type().isRemoval()) {
            return decision;
        }
        return new PunishmentDecision(PunishmentType.TIMEOUT, timeoutFor(UNVERIFIED_CAP_LEVEL), UNVERIFIED_CAP_LEVEL,
                decision.rationale() + " (capped: profile unverified)");
    }

    PunishmentDecision forLevel(int level, String rationale) {
        if (level <= REMINDER_MAX_LEVEL) {
            return new PunishmentDecision(PunishmentType.REMINDER, null, level, rationale);
        }
        if (level == WARNING_LEVEL) {
            return new PunishmentDecision(PunishmentType.WARNING, null, level, rationale);
        }
        if (level < SecurityProfile.MAX_PUNISHMENT_LEVEL) {
            return new PunishmentDecision(PunishmentType.TIMEOUT, timeoutFor(level), level, rationale);
        }
        return new PunishmentDecision(properties.getPunishment().getMaxLevelAction(), null, level, rationale);
    }

    private Duration timeoutFor(int level) {
        Duration duration = properties.getPunishment().getTimeoutDurations().get(level);
        if (duration == null) {
            throw new IllegalStateException("No timeout configured for level " + level);
        }
        return duration;
    }

    private static long countRecentPunitive(SecurityProfile profile, List<ViolationRecord> currentBatch,
            Instant reference, Duration window) {
        Set<ViolationRecord> batch = Collections.newSetFromMap(new IdentityHashMap<>());
        if (currentBatch != null) {
            batch.addAll(currentBatch);
        }
        Instant from = reference.minus(window);
        return profile.getViolationHistory().stream()
                .filter(ViolationRecord::isPunitive)
                .filter(v -> !batch.contains(v))
                .filter(v -> !v.timestamp().isBefore(from) && !v.timestamp().isAfter(reference))
                .count();
    }

    private static int clampLevel(long level) {
        return (int) Math.max(0, Math.min(SecurityProfile.MAX_PUNISHMENT_LEVEL, level));
    }
}
