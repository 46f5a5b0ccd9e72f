package me.golemcore.guard.domain.service;

import me.golemcore.guard.domain.model.ProfileKey;
import me.golemcore.guard.domain.model.RiskLevel;
import me.golemcore.guard.domain.model.SecurityProfile;
import me.golemcore.guard.domain.model.SecurityStats;
import me.golemcore.guard.domain.model.UserSecurityReport;
import me.golemcore.guard.domain.model.ViolationSeverity;
import me.golemcore.guard.domain.model.ViolationType;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import me.golemcore.guard.security.PatternLibraryFactory;
import me.golemcore.guard.security.PatternLibraryHolder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Optional;

import static me.golemcore.guard.domain.service.ServiceFixtures.ALICE;
import static me.golemcore.guard.domain.service.ServiceFixtures.T0;
import static me.golemcore.guard.domain.service.ServiceFixtures.profile;
import static me.golemcore.guard.domain.service.ServiceFixtures.violation;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SecurityReportServiceTest {

    private static final ProfileKey BOB = ProfileKey.of("guild-1", "bob");

    private InMemoryProfileStore store;
    private ProfileRepository repository;
    private ModerationAuditService auditService;
    private SecurityReportService reportService;

    @BeforeEach
    void setUp() {
        GuardProperties properties = new GuardProperties();
        properties.getStore().setMaxRetries(1);
        properties.getStore().setFirstBackoff(Duration.ofMillis(1));
        store = new InMemoryProfileStore();
        repository = new ProfileRepository(store, new ProfileCache(properties), properties);
        auditService = mock(ModerationAuditService.class);
        PatternLibraryHolder holder = new PatternLibraryHolder(
                new PatternLibraryFactory(properties, Clock.fixed(T0, ZoneOffset.UTC)));
        reportService = new SecurityReportService(repository, new TrustRiskEngine(properties),
                new UserModerationCoordinator(Runnable::run, properties), auditService, holder);
    }

    private SecurityProfile troubledAlice() {
        SecurityProfile alice = profile(40.0);
        alice.setPunishmentLevel(4);
        alice.setQuarantineUntil(T0.plus(Duration.ofHours(1)));
        alice.setLastViolationAt(T0.minus(Duration.ofMinutes(60)));
        alice.getAggregates().setViolationStreak(3);
        alice.getViolationHistory().add(violation(ViolationType.SPAM, ViolationSeverity.MODERATE,
                T0.minus(Duration.ofHours(30))));
        alice.getViolationHistory().add(violation(ViolationType.HARASSMENT, ViolationSeverity.SERIOUS,
                T0.minus(Duration.ofHours(3))));
        alice.getViolationHistory().add(violation(ViolationType.TOXIC_LANGUAGE, ViolationSeverity.MODERATE,
                T0.minus(Duration.ofHours(2))));
        alice.getViolationHistory().add(violation(ViolationType.SPAM, ViolationSeverity.MODERATE,
                T0.minus(Duration.ofHours(1))));
        alice.getViolationHistory().add(violation(ViolationType.EMOTIONAL_DISTRESS, ViolationSeverity.MINOR,
                T0.minus(Duration.ofMinutes(30))));
        return alice;
    }

    // ===== Stats =====

    @Test
    void statsAggregateStoredProfiles() {
        store.put(troubledAlice());
        store.put(SecurityProfile.newProfile(BOB, T0));

        SecurityStats stats = reportService.getStats(T0);

        assertEquals(2, stats.totalTrackedUsers());
        assertEquals(1, stats.trustedUsers());
        assertEquals(1, stats.quarantinedUsers());
        assertEquals(5, stats.totalViolations());
        assertEquals(3, stats.violationsLast24h());
        assertEquals(70.0, stats.averageTrustScore(), 1e-9);
        assertEquals(1, stats.patternLibraryVersion());
    }

    @Test
    void emptyStoreReportsFullAverageTrust() {
        SecurityStats stats = reportService.getStats(T0);

        assertEquals(0, stats.totalTrackedUsers());
        assertEquals(100.0, stats.averageTrustScore());
    }

    @Test
    void unverifiedProfilesAreLeftOutOfStats() {
        store.setAvailable(false);
        repository.load(BOB, T0);

        SecurityStats stats = reportService.getStats(T0);

        assertEquals(0, stats.totalTrackedUsers());
    }

    // ===== Per-user report =====

    @Test
    void reportDescribesTheUser() {
        store.put(troubledAlice());

        UserSecurityReport report = reportService.getReport(ALICE, T0).orElseThrow();

        assertEquals(40.0, report.getTrustScore());
        assertFalse(report.isTrusted());
        assertEquals(4, report.getPunishmentLevel());
        assertEquals(5, report.getTotalViolations());
        assertEquals(3, report.getRecentViolations24h());
        assertEquals(3, report.getViolationStreak());
        assertTrue(report.isQuarantined());
        assertEquals(T0.plus(Duration.ofHours(1)), report.getQuarantineUntil());
        // 0.4 * 3/5 + 0.4 * 0.6 + 0.2
        assertEquals(0.68, report.getRisk().riskScore(), 1e-9);
        assertEquals(RiskLevel.HIGH, report.getRisk().riskLevel());
    }

    @Test
    void unknownUserHasNoReport() {
        Optional<UserSecurityReport> report = reportService.getReport(BOB, T0);

        assertTrue(report.isEmpty());
    }

    // ===== Pardon =====

    @Test
    void pardonRestoresStandingAndIsAudited() {
        store.put(troubledAlice());

        SecurityProfile pardoned = reportService.pardon(ALICE, "mod-1", "appeal accepted", T0).join();

        assertEquals(70.0, pardoned.getTrustScore());
        assertNull(pardoned.getQuarantineUntil());
        assertEquals(0, pardoned.getPunishmentLevel());
        assertEquals(0, pardoned.getAggregates().getViolationStreak());
        assertEquals(5, pardoned.getViolationHistory().size());

        SecurityProfile stored = store.stored(ALICE);
        assertEquals(70.0, stored.getTrustScore());
        assertNull(stored.getQuarantineUntil());

        ArgumentCaptor<SecurityProfile> audited = ArgumentCaptor.forClass(SecurityProfile.class);
        verify(auditService).recordManualOverride(audited.capture(), eq("mod-1"), eq("appeal accepted"), eq(T0));
        assertEquals(70.0, audited.getValue().getTrustScore());
    }
}
