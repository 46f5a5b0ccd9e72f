package me.golemcore.guard.domain.service;

import me.golemcore.guard.domain.model.ChatMessage;
import me.golemcore.guard.domain.model.RiskAssessment;
import me.golemcore.guard.domain.model.RiskLevel;
import me.golemcore.guard.domain.model.SecurityProfile;
import me.golemcore.guard.domain.model.ViolationRecord;
import me.golemcore.guard.domain.model.ViolationSeverity;
import me.golemcore.guard.domain.model.ViolationType;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static me.golemcore.guard.domain.service.ServiceFixtures.T0;
import static me.golemcore.guard.domain.service.ServiceFixtures.profile;
import static me.golemcore.guard.domain.service.ServiceFixtures.violation;
import static org.junit.jupiter.api.Assertions.*;

class TrustRiskEngineTest {

    private GuardProperties properties;
    private TrustRiskEngine engine;

    @BeforeEach
    void setUp() {
        properties = new GuardProperties();
        engine = new TrustRiskEngine(properties);
    }

    // ===== Penalties =====

    @Test
    void penaltyMatchesSeverityTable() {
        SecurityProfile updated = engine.applyViolation(profile(100),
                violation(ViolationType.SPAM, ViolationSeverity.MODERATE, T0));

        assertEquals(85.0, updated.getTrustScore());
        assertEquals(1, updated.getViolationHistory().size());
        assertEquals(1, updated.getAggregates().getViolationStreak());
        assertEquals(T0, updated.getLastViolationAt());
    }

    @Test
    void higherSeverityNeverCostsLess() {
        double previous = -1;
        for (ViolationSeverity severity : ViolationSeverity.values()) {
            SecurityProfile updated = engine.applyViolation(profile(100),
                    violation(ViolationType.TOXIC_LANGUAGE, severity, T0));
            double penalty = 100 - updated.getTrustScore();
            assertTrue(penalty >= previous, "penalty for " + severity);
            previous = penalty;
        }
    }

    @Test
    void trustIsClampedAtZero() {
        SecurityProfile updated = engine.applyViolation(profile(10),
                violation(ViolationType.PHISHING, ViolationSeverity.CRITICAL, T0));

        assertEquals(0.0, updated.getTrustScore());
    }

    @Test
    void onlyPrimaryIsChargedButAllRecordsAreKept() {
        ViolationRecord primary = violation(ViolationType.PHISHING, ViolationSeverity.CRITICAL, T0);
        ViolationRecord caps = violation(ViolationType.CAPS_ABUSE, ViolationSeverity.MINOR, T0);

        SecurityProfile updated = engine.applyViolations(profile(100), List.of(caps, primary), primary);

        assertEquals(25.0, updated.getTrustScore());
        assertEquals(2, updated.getViolationHistory().size());
    }

    @Test
    void distressNeverChangesTrust() {
        SecurityProfile original = profile(60);
        ViolationRecord distress = violation(ViolationType.EMOTIONAL_DISTRESS, ViolationSeverity.MINOR, T0);

        SecurityProfile updated = engine.applyViolation(original, distress);

        assertEquals(60.0, updated.getTrustScore());
        assertEquals(0, updated.getAggregates().getViolationStreak());
        assertNull(updated.getLastViolationAt());
        assertEquals(1, updated.getViolationHistory().size());
    }

    @Test
    void inputProfileIsNotMutated() {
        SecurityProfile original = profile(100);

        engine.applyViolation(original, violation(ViolationType.SPAM, ViolationSeverity.MODERATE, T0));

        assertEquals(100.0, original.getTrustScore());
        assertTrue(original.getViolationHistory().isEmpty());
    }

    @Test
    void historyIsCapped() {
        properties.getRetention().setMaxHistoryPerProfile(3);
        SecurityProfile profile = profile(100);
        for (int i = 0; i < 5; i++) {
            profile = engine.applyViolation(profile,
                    violation(ViolationType.CAPS_ABUSE, ViolationSeverity.MINOR, T0.plusSeconds(i)));
        }

        assertEquals(3, profile.getViolationHistory().size());
        assertEquals(T0.plusSeconds(2), profile.getViolationHistory().get(0).timestamp());
    }

    // ===== Quarantine =====

    @Test
    void droppingToQuarantineThresholdStartsQuarantine() {
        SecurityProfile updated = engine.applyViolation(profile(55),
                violation(ViolationType.HARASSMENT, ViolationSeverity.SERIOUS, T0));

        assertEquals(25.0, updated.getTrustScore());
        assertEquals(T0.plus(Duration.ofHours(24)), updated.getQuarantineUntil());
        assertTrue(updated.isQuarantinedAt(T0.plusSeconds(1)));
    }

    @Test
    void recoveryDuringQuarantineStopsAtQuarantineThreshold() {
        SecurityProfile quarantined = engine.applyViolation(profile(40),
                violation(ViolationType.HARASSMENT, ViolationSeverity.SERIOUS, T0));
        assertEquals(10.0, quarantined.getTrustScore());

        SecurityProfile recovered = engine.recoverUntil(quarantined, T0.plus(Duration.ofHours(23)));

        assertTrue(recovered.isQuarantinedAt(T0.plus(Duration.ofHours(23))));
        assertTrue(recovered.getTrustScore() <= properties.getTrust().getQuarantineThreshold());
    }

    @Test
    void expiredQuarantineIsCleared() {
        SecurityProfile quarantined = engine.applyViolation(profile(40),
                violation(ViolationType.HARASSMENT, ViolationSeverity.SERIOUS, T0));

        SecurityProfile recovered = engine.recoverUntil(quarantined, T0.plus(Duration.ofHours(25)));

        assertNull(recovered.getQuarantineUntil());
    }

    // ===== Recovery =====

    @Test
    void recoveryAddsStepPerWholeInterval() {
        SecurityProfile recovered = engine.recover(profile(40), Duration.ofHours(24));

        assertEquals(48.0, recovered.getTrustScore());
        assertFalse(engine.isTrusted(recovered));
    }

    @Test
    void partialIntervalRecoversNothing() {
        SecurityProfile recovered = engine.recover(profile(40), Duration.ofHours(5));

        assertEquals(40.0, recovered.getTrustScore());
    }

    @Test
    void recoveryNeverExceedsMaximum() {
        SecurityProfile recovered = engine.recover(profile(99), Duration.ofDays(30));

        assertEquals(100.0, recovered.getTrustScore());
    }

    @Test
    void recoverUntilKeepsPartialIntervalsForLaterCalls() {
        SecurityProfile penalized = engine.applyViolation(profile(100),
                violation(ViolationType.SPAM, ViolationSeverity.MODERATE, T0));

        SecurityProfile first = engine.recoverUntil(penalized, T0.plus(Duration.ofHours(9)));
        SecurityProfile second = engine.recoverUntil(first, T0.plus(Duration.ofHours(12)));

        assertEquals(87.0, first.getTrustScore());
        assertEquals(T0.plus(Duration.ofHours(6)), first.getLastRecoveryAt());
        assertEquals(89.0, second.getTrustScore());
    }

    @Test
    void recoveryDecaysStreakAndBuildsImprovement() {
        SecurityProfile penalized = engine.applyViolation(profile(100),
                violation(ViolationType.SPAM, ViolationSeverity.MODERATE, T0));

        SecurityProfile recovered = engine.recoverUntil(penalized, T0.plus(Duration.ofHours(18)));

        assertEquals(0, recovered.getAggregates().getViolationStreak());
        assertEquals(3, recovered.getAggregates().getImprovementStreak());
    }

    // ===== Risk =====

    @Test
    void cleanProfileIsLowRisk() {
        RiskAssessment risk = engine.assess(profile(100), T0);

        assertEquals(0.2, risk.riskScore(), 1e-9);
        assertEquals(RiskLevel.LOW, risk.riskLevel());
    }

    @Test
    void frequentViolationsWithLowTrustAreCritical() {
        SecurityProfile profile = profile(100);
        for (int i = 0; i < 5; i++) {
            profile = engine.applyViolation(profile,
                    violation(ViolationType.SPAM, ViolationSeverity.MODERATE, T0.minusSeconds(60L * i)));
        }

        RiskAssessment risk = engine.assess(profile, T0);

        assertEquals(25.0, profile.getTrustScore());
        assertEquals(RiskLevel.CRITICAL, risk.riskLevel());
        assertTrue(risk.riskScore() <= 1.0);
    }

    @Test
    void violationsOutsideRiskWindowAreIgnored() {
        SecurityProfile profile = engine.applyViolation(profile(100),
                violation(ViolationType.SPAM, ViolationSeverity.MODERATE, T0.minus(Duration.ofDays(2))));

        RiskAssessment risk = engine.assess(profile, T0);

        assertEquals(0.4 * 0.15 + 0.2, risk.riskScore(), 1e-9);
    }

    // ===== Aggregates =====

    @Test
    void observeMessageTracksLengthAndChannels() {
        SecurityProfile profile = profile(100);
        profile = engine.observeMessage(profile, chat("hello", "general"));
        profile = engine.observeMessage(profile, chat("hello world, fifteen", "random"));

        assertEquals(2, profile.getAggregates().getMessageCount());
        assertEquals(0.9 * 5 + 0.1 * 20, profile.getAggregates().getAverageMessageLength(), 1e-9);
        assertEquals(2, profile.getAggregates().getChannelIds().size());
        assertEquals(T0, profile.getLastActivityAt());
    }

    @Test
    void pardonRestoresStanding() {
        SecurityProfile penalized = engine.applyViolation(profile(30),
                violation(ViolationType.HARASSMENT, ViolationSeverity.SERIOUS, T0));
        penalized.setPunishmentLevel(5);

        SecurityProfile pardoned = engine.pardon(penalized, T0.plusSeconds(60));

        assertEquals(70.0, pardoned.getTrustScore());
        assertTrue(engine.isTrusted(pardoned));
        assertNull(pardoned.getQuarantineUntil());
        assertEquals(0, pardoned.getPunishmentLevel());
        assertEquals(1, pardoned.getViolationHistory().size());
    }

    @Test
    void pruneHistoryDropsRecordsPastHorizon() {
        SecurityProfile profile = engine.applyViolation(profile(100),
                violation(ViolationType.SPAM, ViolationSeverity.MINOR, T0.minus(Duration.ofDays(8))));
        profile = engine.applyViolation(profile, violation(ViolationType.SPAM, ViolationSeverity.MINOR, T0));

        SecurityProfile pruned = engine.pruneHistory(profile, T0);

        assertEquals(1, pruned.getViolationHistory().size());
        assertEquals(T0, pruned.getViolationHistory().get(0).timestamp());
    }

    private static ChatMessage chat(String content, String channel) {
        return ChatMessage.builder()
                .messageId("m")
                .userId("alice")
                .guildId("guild-1")
                .channelId(channel)
                .content(content)
                .timestamp(T0)
                .build();
    }
}
