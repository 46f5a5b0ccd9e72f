package me.golemcore.guard.infrastructure.config;

import me.golemcore.guard.domain.model.PunishmentType;
import me.golemcore.guard.domain.model.ViolationSeverity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class GuardSettingsValidatorTest {

    private GuardProperties properties;
    private GuardSettingsValidator validator;

    @BeforeEach
    void setUp() {
        properties = new GuardProperties();
        validator = new GuardSettingsValidator(properties);
    }

    @Test
    void defaultsAreValid() {
        assertDoesNotThrow(() -> validator.validate());
    }

    @Test
    void shouldRejectSpamThresholdBelowTwo() {
        properties.getDetection().setSpamThreshold(1);

        ModerationConfigurationException ex = assertThrows(ModerationConfigurationException.class,
                () -> validator.validate());
        assertTrue(ex.getMessage().contains("guard.detection.spam-threshold"));
    }

    @Test
    void shouldRejectDecreasingPenalties() {
        properties.getTrust().getPenalties().put(ViolationSeverity.SEVERE, 10.0);

        ModerationConfigurationException ex = assertThrows(ModerationConfigurationException.class,
                () -> validator.validate());
        assertTrue(ex.getMessage().contains("must not decrease"));
    }

    @Test
    void shouldRejectMissingPenalty() {
        properties.getTrust().getPenalties().remove(ViolationSeverity.CRITICAL);

        ModerationConfigurationException ex = assertThrows(ModerationConfigurationException.class,
                () -> validator.validate());
        assertTrue(ex.getMessage().contains("missing CRITICAL"));
    }

    @Test
    void shouldRejectQuarantineAboveTrustThreshold() {
        properties.getTrust().setQuarantineThreshold(80.0);

        assertThrows(ModerationConfigurationException.class, () -> validator.validate());
    }

    @Test
    void shouldRejectThreatIntelTimeoutNotBelowEvaluationBudget() {
        properties.getDetection().setEvaluationBudget(Duration.ofMillis(50));
        properties.getThreatIntel().setTimeout(Duration.ofMillis(50));

        ModerationConfigurationException ex = assertThrows(ModerationConfigurationException.class,
                () -> validator.validate());
        assertTrue(ex.getMessage().contains("guard.threat-intel.timeout must be shorter"));
    }

    @Test
    void shouldRejectShrinkingTimeouts() {
        properties.getPunishment().getTimeoutDurations().put(5, Duration.ofMinutes(10));

        ModerationConfigurationException ex = assertThrows(ModerationConfigurationException.class,
                () -> validator.validate());
        assertTrue(ex.getMessage().contains("level 5"));
    }

    @Test
    void shouldRejectNonRemovalMaxLevelAction() {
        properties.getPunishment().setMaxLevelAction(PunishmentType.TIMEOUT);

        assertThrows(ModerationConfigurationException.class, () -> validator.validate());
    }

    @Test
    void shouldAcceptBanAsMaxLevelAction() {
        properties.getPunishment().setMaxLevelAction(PunishmentType.BAN);

        assertDoesNotThrow(() -> validator.validate());
    }

    @Test
    void shouldRequireUrlWhenThreatIntelEnabled() {
        properties.getThreatIntel().setEnabled(true);
        properties.getThreatIntel().setUrl("");

        ModerationConfigurationException ex = assertThrows(ModerationConfigurationException.class,
                () -> validator.validate());
        assertTrue(ex.getMessage().contains("guard.threat-intel.url"));
    }

    @Test
    void shouldReportEveryProblemAtOnce() {
        properties.getWindow().setCapacity(0);
        properties.getSweep().setInterval(Duration.ZERO);

        ModerationConfigurationException ex = assertThrows(ModerationConfigurationException.class,
                () -> validator.validate());
        assertTrue(ex.getMessage().contains("guard.window.capacity"));
        assertTrue(ex.getMessage().contains("guard.sweep.interval"));
    }
}
