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
import me.golemcore.guard.domain.model.SweepReport;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import me.golemcore.guard.port.outbound.StoreUnavailableException;
import me.golemcore.guard.window.SlidingWindowTracker;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Periodic maintenance, independent of any scheduler: the host or
 * {@code ModerationSweepScheduler} calls {@link #sweep(Instant)}.
 *
 * <p>
 * One sweep evicts stale window entries, retries dirty profile writes, applies
 * passive recovery, prunes old history, deletes inactive profiles with no
 * history, and trims the profile cache and message markers. Profile changes run
 * through the per-user moderation queue.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModerationSweepService {

    enum ProfileSweepResult {
        UNCHANGED, UPDATED, EVICTED, FAILED
    }

    private final SlidingWindowTracker windowTracker;
    private final ProfileRepository profileRepository;
    private final ProfileCache profileCache;
    private final TrustRiskEngine trustRiskEngine;
    private final UserModerationCoordinator coordinator;
    private final MessageLifecycleRegistry lifecycleRegistry;
    private final GuardProperties properties;

    public SweepReport sweep(Instant now) {
        int windowEvicted = windowTracker.evictOlderThan(now.minus(properties.getDetection().longestWindow()));

        Map<ProfileKey, CompletableFuture<ProfileSweepResult>> tasks = new LinkedHashMap<>();
        for (ProfileKey key : profileRepository.listKeys()) {
            tasks.put(key, coordinator.submit(key, () -> sweepProfile(key, now)));
        }

        int updated = 0;
        int evicted = 0;
        int failed = 0;
        for (Map.Entry<ProfileKey, CompletableFuture<ProfileSweepResult>> task : tasks.entrySet()) {
            ProfileSweepResult result;
            try {
                result = task.getValue().join();
            } catch (CompletionException e) {
                log.warn("[Sweep] Profile {} skipped: {}", task.getKey(), e.getMessage());
                result = ProfileSweepResult.FAILED;
            }
            switch (result) {
            case UPDATED -> updated++;
            case EVICTED -> evicted++;
            case FAILED -> failed++;
            default -> {
                // unchanged
            }
            }
        }

        int cacheEvicted = profileCache.evictIdle(now);
        int markersEvicted = lifecycleRegistry.evictOlderThan(
                now.minus(properties.getRetention().getMessageMarkerTtl()));

        SweepReport report = new SweepReport(now, windowEvicted, tasks.size(), updated, evicted, failed,
                cacheEvicted, markersEvicted);
        log.info("[Sweep] visited={} updated={} evicted={} failed={} windowEntries={} cacheEntries={}",
                report.profilesVisited(), updated, evicted, failed, windowEvicted, cacheEvicted);
        return report;
    }

    ProfileSweepResult sweepProfile(ProfileKey key, Instant now) {
        boolean reconciled = profileRepository.reconcile(key, now);
        Optional<SecurityProfile> current;
        try {
            current = profileRepository.peek(key);
        } catch (StoreUnavailableException e) {
            log.debug("[Sweep] Profile {} unavailable: {}", key, e.getMessage());
            return ProfileSweepResult.FAILED;
        }
        if (current.isEmpty()) {
            return reconciled ? ProfileSweepResult.UNCHANGED : ProfileSweepResult.FAILED;
        }

        SecurityProfile original = current.get();
        SecurityProfile swept = trustRiskEngine.recoverUntil(original, now);
        swept = trustRiskEngine.pruneHistory(swept, now);

        try {
            if (isInactive(swept, now)) {
                profileRepository.delete(key);
                log.debug("[Sweep] Deleted inactive profile {}", key);
                return ProfileSweepResult.EVICTED;
            }
            if (swept.equals(original)) {
                return ProfileSweepResult.UNCHANGED;
            }
            profileRepository.writeThrough(swept);
            return ProfileSweepResult.UPDATED;
        } catch (StoreUnavailableException e) {
            log.warn("[Sweep] Failed to persist sweep of {}: {}", key, e.getMessage());
            return ProfileSweepResult.FAILED;
        }
    }

    private boolean isInactive(SecurityProfile profile, Instant now) {
        if (!profile.getViolationHistory().isEmpty()) {
            return false;
        }
        Instant lastSeen = profile.getLastActivityAt() != null ? profile.getLastActivityAt() : profile.getCreatedAt();
        return lastSeen == null
                || lastSeen.isBefore(now.minus(properties.getRetention().getInactiveProfileTtl()));
    }
}
