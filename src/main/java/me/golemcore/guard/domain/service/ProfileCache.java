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
import me.golemcore.guard.infrastructure.config.GuardProperties;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded TTL cache of security profiles in front of the profile store.
 *
 * <p>
 * Entries are only touched from inside the owning user's moderation queue.
 * Dirty entries (writes the store has not accepted yet) are never evicted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProfileCache {

    /**
     * Cached profile plus its persistence state. {@code verified} is false when
     * the profile was created because the store could not be read.
     */
    public record CachedProfile(SecurityProfile profile, boolean verified, boolean dirty, Instant lastAccess) {
    }

    private final GuardProperties properties;
    private final Map<ProfileKey, CachedProfile> entries = new ConcurrentHashMap<>();

    public Optional<CachedProfile> get(ProfileKey key, Instant now) {
        CachedProfile cached = entries.computeIfPresent(key,
                (k, entry) -> new CachedProfile(entry.profile(), entry.verified(), entry.dirty(), now));
        return Optional.ofNullable(cached);
    }

    public Optional<CachedProfile> peek(ProfileKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public void put(ProfileKey key, SecurityProfile profile, boolean verified, boolean dirty, Instant now) {
        entries.put(key, new CachedProfile(profile, verified, dirty, now));
        if (entries.size() > properties.getCache().getMaxSize()) {
            evictOverflow();
        }
    }

    /**
     * Replace the profile of an existing entry and mark it clean, keeping its
     * last-access time.
     */
    public void refresh(ProfileKey key, SecurityProfile profile) {
        entries.computeIfPresent(key, (k, entry) -> new CachedProfile(profile, true, false, entry.lastAccess()));
    }

    public void invalidate(ProfileKey key) {
        entries.remove(key);
    }

    public List<ProfileKey> keys() {
        return List.copyOf(entries.keySet());
    }

    /**
     * Remove clean entries not accessed within {@code guard.cache.ttl}.
     *
     * @return number of evicted entries
     */
    public int evictIdle(Instant now) {
        Instant cutoff = now.minus(properties.getCache().getTtl());
        int before = entries.size();
        entries.entrySet().removeIf(e -> !e.getValue().dirty() && e.getValue().lastAccess().isBefore(cutoff));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }

    private void evictOverflow() {
        int overflow = entries.size() - properties.getCache().getMaxSize();
        if (overflow <= 0) {
            return;
        }
        List<ProfileKey> victims = entries.entrySet().stream()
                .filter(e -> !e.getValue().dirty())
                .sorted(Comparator.comparing(e -> e.getValue().lastAccess()))
                .limit(overflow)
                .map(Map.Entry::getKey)
                .toList();
        victims.forEach(entries::remove);
        log.debug("[Cache] Evicted {} least recently used profiles", victims.size());
    }
}
