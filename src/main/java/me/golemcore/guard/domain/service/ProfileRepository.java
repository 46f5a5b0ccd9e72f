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
import me.golemcore.guard.domain.model.ViolationRecord;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import me.golemcore.guard.port.outbound.ProfileStorePort;
import me.golemcore.guard.port.outbound.StoreUnavailableException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Profile access for the moderation engine: {@link ProfileCache} in front of
 * {@link ProfileStorePort}, with exponential-backoff retries on the store.
 *
 * <p>
 * When the store stays unreachable a fresh profile is used instead. It is
 * marked unverified and is never written over the stored document; the sweep
 * merges it into the stored profile once the store is back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProfileRepository {

    /**
     * A profile and whether it reflects the stored state.
     */
    public record LoadedProfile(SecurityProfile profile, boolean verified) {
    }

    private final ProfileStorePort profileStore;
    private final ProfileCache cache;
    private final GuardProperties properties;

    public LoadedProfile load(ProfileKey key, Instant now) {
        Optional<ProfileCache.CachedProfile> cached = cache.get(key, now);
        if (cached.isPresent() && cached.get().verified()) {
            return new LoadedProfile(cached.get().profile().copy(), true);
        }
        if (cached.isPresent() && reconcile(key, now)) {
            return new LoadedProfile(cache.peek(key).orElseThrow().profile().copy(), true);
        }
        if (cached.isPresent()) {
            return new LoadedProfile(cached.get().profile().copy(), false);
        }

        try {
            SecurityProfile profile = withRetry("load", key, () -> profileStore.find(key))
                    .orElseGet(() -> SecurityProfile.newProfile(key, now));
            cache.put(key, profile, true, false, now);
            return new LoadedProfile(profile.copy(), true);
        } catch (StoreUnavailableException e) {
            log.warn("[Store] Profile {} unavailable, continuing with an unverified profile: {}", key,
                    e.getMessage());
            SecurityProfile fallback = SecurityProfile.newProfile(key, now);
            fallback.setUnpersisted(true);
            cache.put(key, fallback, false, true, now);
            return new LoadedProfile(fallback.copy(), false);
        }
    }

    /**
     * Persist a profile. Unverified profiles are kept in the cache only.
     *
     * @return true when the store accepted the write
     */
    public boolean save(SecurityProfile profile, boolean verified, Instant now) {
        ProfileKey key = profile.getKey();
        if (!verified) {
            profile.setUnpersisted(true);
            cache.put(key, profile.copy(), false, true, now);
            return false;
        }
        try {
            withRetry("save", key, () -> {
                profileStore.save(profile);
                return Boolean.TRUE;
            });
            profile.setUnpersisted(false);
            cache.put(key, profile.copy(), true, false, now);
            return true;
        } catch (StoreUnavailableException e) {
            log.warn("[Store] Failed to save profile {}, will retry on sweep: {}", key, e.getMessage());
            profile.setUnpersisted(true);
            cache.put(key, profile.copy(), true, true, now);
            return false;
        }
    }

    /**
     * Bring a dirty cache entry back in line with the store. Unverified entries
     * are merged into the stored profile first.
     *
     * @return true when the entry is clean afterwards
     */
    public boolean reconcile(ProfileKey key, Instant now) {
        Optional<ProfileCache.CachedProfile> cached = cache.peek(key);
        if (cached.isEmpty() || !cached.get().dirty()) {
            return true;
        }
        ProfileCache.CachedProfile entry = cached.get();
        try {
            SecurityProfile target = entry.profile().copy();
            if (!entry.verified()) {
                Optional<SecurityProfile> stored = withRetry("load", key, () -> profileStore.find(key));
                target = stored.map(s -> merge(s, entry.profile())).orElse(target);
            }
            target.setUnpersisted(false);
            SecurityProfile toSave = target;
            withRetry("save", key, () -> {
                profileStore.save(toSave);
                return Boolean.TRUE;
            });
            cache.put(key, toSave, true, false, now);
            log.info("[Store] Reconciled profile {}", key);
            return true;
        } catch (StoreUnavailableException e) {
            log.debug("[Store] Profile {} still unavailable: {}", key, e.getMessage());
            return false;
        }
    }

    /**
     * Read a profile without touching cache recency. Used by maintenance and
     * reporting.
     *
     * @return empty when no profile exists or only an unverified copy does
     */
    public Optional<SecurityProfile> peek(ProfileKey key) {
        Optional<ProfileCache.CachedProfile> cached = cache.peek(key);
        if (cached.isPresent()) {
            return cached.get().verified() ? Optional.of(cached.get().profile().copy()) : Optional.empty();
        }
        return withRetry("load", key, () -> profileStore.find(key));
    }

    /**
     * Write a maintenance update through to the store. A cached copy is
     * refreshed but keeps its last-access time.
     */
    public void writeThrough(SecurityProfile profile) {
        withRetry("save", profile.getKey(), () -> {
            profileStore.save(profile);
            return Boolean.TRUE;
        });
        cache.refresh(profile.getKey(), profile.copy());
    }

    public void delete(ProfileKey key) {
        withRetry("delete", key, () -> {
            profileStore.delete(key);
            return Boolean.TRUE;
        });
        cache.invalidate(key);
    }

    /**
     * Keys known to the store plus keys that only exist in the cache.
     */
    public List<ProfileKey> listKeys() {
        Set<ProfileKey> keys = new LinkedHashSet<>();
        try {
            keys.addAll(withRetry("list", null, profileStore::listKeys));
        } catch (StoreUnavailableException e) {
            log.warn("[Store] Listing profiles failed, using cached keys only: {}", e.getMessage());
        }
        keys.addAll(cache.keys());
        return new ArrayList<>(keys);
    }

    /**
     * Stored profile plus whatever happened locally while the store was
     * unreachable. Trust takes the lower value and history is the union.
     */
    static SecurityProfile merge(SecurityProfile stored, SecurityProfile local) {
        SecurityProfile merged = stored.copy();
        Set<ViolationRecord> history = new LinkedHashSet<>(merged.getViolationHistory());
        history.addAll(local.getViolationHistory());
        List<ViolationRecord> ordered = new ArrayList<>(history);
        ordered.sort(Comparator.comparing(ViolationRecord::timestamp));
        merged.setViolationHistory(ordered);

        merged.setTrustScore(Math.min(stored.getTrustScore(), local.getTrustScore()));
        merged.setPunishmentLevel(Math.max(stored.getPunishmentLevel(), local.getPunishmentLevel()));
        merged.setQuarantineUntil(latest(stored.getQuarantineUntil(), local.getQuarantineUntil()));
        merged.setLastViolationAt(latest(stored.getLastViolationAt(), local.getLastViolationAt()));
        merged.setLastActivityAt(latest(stored.getLastActivityAt(), local.getLastActivityAt()));
        merged.getAggregates().setMessageCount(
                stored.getAggregates().getMessageCount() + local.getAggregates().getMessageCount());
        merged.getAggregates().setViolationStreak(
                stored.getAggregates().getViolationStreak() + local.getAggregates().getViolationStreak());
        if (local.getAggregates().getViolationStreak() > 0) {
            merged.getAggregates().setImprovementStreak(0);
        }
        return merged;
    }

    private <T> T withRetry(String operation, ProfileKey key, Callable<T> call) {
        GuardProperties.StoreProperties store = properties.getStore();
        String target = key != null ? key.toString() : "profiles";
        try {
            return Mono.fromCallable(call)
                    .retryWhen(Retry.backoff(store.getMaxRetries(), store.getFirstBackoff())
                            .filter(StoreUnavailableException.class::isInstance)
                            .doBeforeRetry(signal -> log.debug("[Store] Retrying {} of {} (attempt {}): {}",
                                    operation, target, signal.totalRetries() + 1, signal.failure().getMessage()))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .block(store.getOperationTimeout());
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreUnavailableException(operation + " failed for " + target, e);
        }
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
