package me.golemcore.guard.domain.service;

import me.golemcore.guard.domain.model.ProfileKey;
import me.golemcore.guard.domain.model.SecurityProfile;
import me.golemcore.guard.domain.model.SlidingWindowEntry;
import me.golemcore.guard.domain.model.SweepReport;
import me.golemcore.guard.domain.model.ViolationSeverity;
import me.golemcore.guard.domain.model.ViolationType;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import me.golemcore.guard.window.InMemorySlidingWindowTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Set;

import static me.golemcore.guard.domain.service.ServiceFixtures.ALICE;
import static me.golemcore.guard.domain.service.ServiceFixtures.T0;
import static me.golemcore.guard.domain.service.ServiceFixtures.profile;
import static me.golemcore.guard.domain.service.ServiceFixtures.violation;
import static org.junit.jupiter.api.Assertions.*;

class ModerationSweepServiceTest {

    private static final ProfileKey BOB = ProfileKey.of("guild-1", "bob");

    private GuardProperties properties;
    private InMemoryProfileStore store;
    private ProfileCache cache;
    private ProfileRepository repository;
    private InMemorySlidingWindowTracker tracker;
    private MessageLifecycleRegistry lifecycleRegistry;
    private ModerationSweepService sweepService;

    @BeforeEach
    void setUp() {
        properties = new GuardProperties();
        properties.getStore().setMaxRetries(1);
        properties.getStore().setFirstBackoff(Duration.ofMillis(1));
        store = new InMemoryProfileStore();
        cache = new ProfileCache(properties);
        repository = new ProfileRepository(store, cache, properties);
        tracker = new InMemorySlidingWindowTracker(properties);
        lifecycleRegistry = new MessageLifecycleRegistry();
        sweepService = new ModerationSweepService(tracker, repository, cache, new TrustRiskEngine(properties),
                new UserModerationCoordinator(Runnable::run, properties), lifecycleRegistry, properties);
    }

    // ===== Profiles =====

    @Test
    void inactiveProfileWithoutHistoryIsDeleted() {
        SecurityProfile stale = SecurityProfile.newProfile(ALICE, T0.minus(Duration.ofDays(8)));
        store.put(stale);

        SweepReport report = sweepService.sweep(T0);

        assertEquals(1, report.profilesVisited());
        assertEquals(1, report.profilesEvicted());
        assertNull(store.stored(ALICE));
    }

    @Test
    void passiveRecoveryIsPersisted() {
        SecurityProfile recovering = profile(60.0);
        recovering.setLastActivityAt(T0.minus(Duration.ofHours(13)));
        recovering.setLastViolationAt(T0.minus(Duration.ofHours(13)));
        recovering.getViolationHistory().add(violation(ViolationType.SPAM, ViolationSeverity.MODERATE,
                T0.minus(Duration.ofHours(13))));
        store.put(recovering);

        SweepReport report = sweepService.sweep(T0);

        assertEquals(1, report.profilesUpdated());
        SecurityProfile stored = store.stored(ALICE);
        assertEquals(64.0, stored.getTrustScore());
        assertEquals(T0.minus(Duration.ofHours(1)), stored.getLastRecoveryAt());
        assertEquals(1, stored.getViolationHistory().size());
    }

    @Test
    void violationsPastTheHorizonArePruned() {
        SecurityProfile old = profile(100.0);
        old.setLastActivityAt(T0.minus(Duration.ofHours(1)));
        old.getViolationHistory().add(violation(ViolationType.SPAM, ViolationSeverity.MODERATE,
                T0.minus(Duration.ofDays(8))));
        store.put(old);

        SweepReport report = sweepService.sweep(T0);

        assertEquals(1, report.profilesUpdated());
        assertTrue(store.stored(ALICE).getViolationHistory().isEmpty());
    }

    @Test
    void activeCleanProfileIsLeftAlone() {
        store.put(profile(100.0));
        store.put(SecurityProfile.newProfile(BOB, T0.minus(Duration.ofMinutes(5))));

        SweepReport report = sweepService.sweep(T0);

        assertEquals(2, report.profilesVisited());
        assertEquals(0, report.profilesUpdated());
        assertEquals(0, report.profilesEvicted());
        assertEquals(0, report.profilesFailed());
    }

    @Test
    void storeOutageCountsAsFailure() {
        SecurityProfile recovering = profile(60.0);
        recovering.setLastViolationAt(T0.minus(Duration.ofHours(13)));
        recovering.getViolationHistory().add(violation(ViolationType.SPAM, ViolationSeverity.MODERATE,
                T0.minus(Duration.ofHours(13))));
        store.put(recovering);
        repository.load(ALICE, T0);
        store.setAvailable(false);

        SweepReport report = sweepService.sweep(T0);

        assertEquals(1, report.profilesVisited());
        assertEquals(1, report.profilesFailed());
        assertEquals(60.0, store.stored(ALICE).getTrustScore());
    }

    @Test
    void unverifiedProfileIsReconciledOnceStoreReturns() {
        store.setAvailable(false);
        ProfileRepository.LoadedProfile loaded = repository.load(ALICE, T0);
        assertFalse(loaded.verified());
        SecurityProfile local = loaded.profile();
        local.setTrustScore(85.0);
        repository.save(local, false, T0);
        store.setAvailable(true);

        SweepReport report = sweepService.sweep(T0);

        assertEquals(0, report.profilesFailed());
        assertEquals(85.0, store.stored(ALICE).getTrustScore());
        assertFalse(cache.peek(ALICE).map(ProfileCache.CachedProfile::dirty).orElse(false));
    }

    // ===== Transient state =====

    @Test
    void expiredWindowEntriesCacheEntriesAndMarkersAreEvicted() {
        tracker.record(ALICE, new SlidingWindowEntry("fp", Set.of("hello"), T0.minus(Duration.ofHours(1)),
                "general"));
        tracker.record(ALICE, new SlidingWindowEntry("fp", Set.of("hello"), T0.minusSeconds(5), "general"));
        lifecycleRegistry.markDeleted("m-old", T0.minus(Duration.ofHours(2)));
        lifecycleRegistry.markDeleted("m-new", T0.minusSeconds(30));
        store.put(profile(100.0));
        repository.load(ALICE, T0.minus(Duration.ofHours(1)));

        SweepReport report = sweepService.sweep(T0);

        assertEquals(1, report.windowEntriesEvicted());
        assertEquals(1, report.cacheEntriesEvicted());
        assertEquals(1, report.messageMarkersEvicted());
        assertFalse(lifecycleRegistry.isWithdrawn("m-old"));
        assertTrue(lifecycleRegistry.isWithdrawn("m-new"));
        assertEquals(0, cache.size());
    }
}
