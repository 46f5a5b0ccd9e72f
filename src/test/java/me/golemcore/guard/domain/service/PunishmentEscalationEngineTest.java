package me.golemcore.guard.domain.service;

import me.golemcore.guard.domain.model.PunishmentDecision;
import me.golemcore.guard.domain.model.PunishmentType;
import me.golemcore.guard.domain.model.SecurityProfile;
import me.golemcore.guard.domain.model.ViolationRecord;
import me.golemcore.guard.domain.model.ViolationSeverity;
import me.golemcore.guard.domain.model.ViolationType;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.List;

import static me.golemcore.guard.domain.service.ServiceFixtures.T0;
import static me.golemcore.guard.domain.service.ServiceFixtures.profile;
import static me.golemcore.guard.domain.service.ServiceFixtures.violation;
import static org.junit.jupiter.api.Assertions.*;

class PunishmentEscalationEngineTest {

    private GuardProperties properties;
    private PunishmentEscalationEngine engine;

    @BeforeEach
    void setUp() {
        properties = new GuardProperties();
        engine = new PunishmentEscalationEngine(properties);
    }

    @Test
    void firstModerateOffenseIsWarning() {
        ViolationRecord spam = violation(ViolationType.SPAM, ViolationSeverity.MODERATE, T0);
        SecurityProfile profile = withHistory(85, spam);

        PunishmentDecision decision = engine.decide(profile, spam, List.of(spam));

        assertEquals(PunishmentType.WARNING, decision.type());
        assertEquals(2, decision.level());
        assertNull(decision.duration());
    }

    @Test
    void recentOffensesEscalate() {
        ViolationRecord earlier1 = violation(ViolationType.SPAM, ViolationSeverity.MODERATE, T0.minusSeconds(3600));
        ViolationRecord earlier2 = violation(ViolationType.SPAM, ViolationSeverity.MODERATE, T0.minusSeconds(600));
        ViolationRecord current = violation(ViolationType.SPAM, ViolationSeverity.MODERATE, T0);
        SecurityProfile profile = withHistory(70, earlier1, earlier2, current);

        PunishmentDecision decision = engine.decide(profile, current, List.of(current));

        assertEquals(PunishmentType.TIMEOUT, decision.type());
        assertEquals(3, decision.level());
        assertEquals(Duration.ofMinutes(30), decision.duration());
        assertTrue(decision.rationale().contains("2 recent"));
    }

    @Test
    void offensesOutsideEscalationWindowDoNotCount() {
        ViolationRecord old = violation(ViolationType.SPAM, ViolationSeverity.MODERATE, T0.minus(Duration.ofHours(30)));
        ViolationRecord current = violation(ViolationType.SPAM, ViolationSeverity.MODERATE, T0);
        SecurityProfile profile = withHistory(85, old, current);

        assertEquals(2, engine.decide(profile, current, List.of(current)).level());
    }

    @Test
    void distressPrimaryIsSupportive() {
        ViolationRecord distress = violation(ViolationType.EMOTIONAL_DISTRESS, ViolationSeverity.MINOR, T0);

        PunishmentDecision decision = engine.decide(withHistory(20, distress), distress, List.of(distress));

        assertEquals(PunishmentType.SUPPORTIVE, decision.type());
        assertEquals(0, decision.level());
        assertFalse(decision.type().isPunitive());
    }

    @Test
    void noPrimaryMeansNoAction() {
        assertEquals(PunishmentType.NONE, engine.decide(profile(100), null, List.of()).type());
    }

    @Test
    void criticalIsAtLeastTimeout() {
        ViolationRecord phishing = violation(ViolationType.PHISHING, ViolationSeverity.CRITICAL, T0);

        PunishmentDecision decision = engine.decide(withHistory(100, phishing), phishing, List.of(phishing));

        assertTrue(decision.level() >= PunishmentEscalationEngine.CRITICAL_FLOOR_LEVEL);
        assertEquals(PunishmentType.TIMEOUT, decision.type());
    }

    @Test
    void quarantinedUserGetsAtLeastWarning() {
        ViolationRecord caps = violation(ViolationType.CAPS_ABUSE, ViolationSeverity.MINOR, T0);
        SecurityProfile profile = withHistory(90, caps);
        profile.setQuarantineUntil(T0.plus(Duration.ofHours(2)));

        PunishmentDecision decision = engine.decide(profile, caps, List.of(caps));

        assertEquals(PunishmentType.WARNING, decision.type());
    }

    @Test
    void minorFirstOffenseIsReminder() {
        ViolationRecord caps = violation(ViolationType.CAPS_ABUSE, ViolationSeverity.MINOR, T0);

        PunishmentDecision decision = engine.decide(withHistory(95, caps), caps, List.of(caps));

        assertEquals(PunishmentType.REMINDER, decision.type());
        assertEquals(1, decision.level());
    }

    @Test
    void topLevelUsesConfiguredRemovalAction() {
        ViolationRecord threat = violation(ViolationType.THREATS, ViolationSeverity.SEVERE, T0);
        SecurityProfile profile = withHistory(0,
                violation(ViolationType.SPAM, ViolationSeverity.MODERATE, T0.minusSeconds(300)),
                violation(ViolationType.SPAM, ViolationSeverity.MODERATE, T0.minusSeconds(200)),
                violation(ViolationType.SPAM, ViolationSeverity.MODERATE, T0.minusSeconds(100)),
                violation(ViolationType.SPAM, ViolationSeverity.MODERATE, T0.minusSeconds(50)),
                threat);

        assertEquals(PunishmentType.KICK, engine.decide(profile, threat, List.of(threat)).type());

        properties.getPunishment().setMaxLevelAction(PunishmentType.BAN);
        PunishmentDecision decision = engine.decide(profile, threat, List.of(threat));
        assertEquals(PunishmentType.BAN, decision.type());
        assertEquals(7, decision.level());
    }

    @Test
    void decisionIsDeterministic() {
        ViolationRecord current = violation(ViolationType.HARASSMENT, ViolationSeverity.SERIOUS, T0);
        SecurityProfile profile = withHistory(45,
                violation(ViolationType.SPAM, ViolationSeverity.MINOR, T0.minusSeconds(120)), current);

        assertEquals(engine.decide(profile, current, List.of(current)),
                engine.decide(profile.copy(), current, List.of(current)));
    }

    @ParameterizedTest
    @CsvSource({
            "0, REMINDER, ",
            "1, REMINDER, ",
            "2, WARNING, ",
            "3, TIMEOUT, PT30M",
            "4, TIMEOUT, PT1H",
            "5, TIMEOUT, PT2H",
            "6, TIMEOUT, PT6H",
            "7, KICK, "
    })
    void levelsMapToActions(int level, PunishmentType type, Duration duration) {
        PunishmentDecision decision = engine.forLevel(level, "");

        assertEquals(type, decision.type());
        assertEquals(duration, decision.duration());
        assertEquals(level, decision.level());
    }

    @Test
    void unverifiedProfileNeverGetsRemoval() {
        PunishmentDecision kick = engine.forLevel(7, "too many offenses");

        PunishmentDecision capped = engine.capForUnverifiedProfile(kick);

        assertEquals(PunishmentType.TIMEOUT, capped.type());
        assertEquals(6, capped.level());
        assertEquals(Duration.ofHours(6), capped.duration());
        assertTrue(capped.rationale().endsWith("(capped: profile unverified)"));

        PunishmentDecision warning = engine.forLevel(2, "");
        assertSame(warning, engine.capForUnverifiedProfile(warning));
    }

    private static SecurityProfile withHistory(double trust, ViolationRecord... records) {
        SecurityProfile profile = profile(trust);
        profile.getViolationHistory().addAll(List.of(records));
        return profile;
    }
}
