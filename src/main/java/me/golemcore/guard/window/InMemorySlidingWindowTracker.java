package me.golemcore.guard.window;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.guard.domain.model.ProfileKey;
import me.golemcore.guard.domain.model.SlidingWindowEntry;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link SlidingWindowTracker}. Each user's window is bounded by
 * {@code guard.window.capacity} entries and by the longest configured
 * detection window.
 */
@Component
@Slf4j
public class InMemorySlidingWindowTracker implements SlidingWindowTracker {

    private final Map<ProfileKey, UserMessageWindow> windows = new ConcurrentHashMap<>();
    private final int capacity;
    private final Duration retention;

    public InMemorySlidingWindowTracker(GuardProperties properties) {
        this.capacity = properties.getWindow().getCapacity();
        this.retention = properties.getDetection().longestWindow();
    }

    @Override
    public void record(ProfileKey user, SlidingWindowEntry entry) {
        windows.compute(user, (key, window) -> {
            UserMessageWindow target = window != null ? window : new UserMessageWindow(capacity, retention);
            target.add(entry);
            return target;
        });
    }

    @Override
    public int countMatching(ProfileKey user, String fingerprint, Duration window, Instant now) {
        UserMessageWindow userWindow = windows.get(user);
        if (userWindow == null) {
            return 0;
        }
        return userWindow.count(window, now, entry -> entry.fingerprint().equals(fingerprint));
    }

    @Override
    public int countRecent(ProfileKey user, Duration window, Instant now) {
        UserMessageWindow userWindow = windows.get(user);
        if (userWindow == null) {
            return 0;
        }
        return userWindow.count(window, now, entry -> true);
    }

    @Override
    public List<SlidingWindowEntry> recentEntries(ProfileKey user, Duration window, Instant now) {
        UserMessageWindow userWindow = windows.get(user);
        if (userWindow == null) {
            return List.of();
        }
        return userWindow.snapshot(window, now);
    }

    @Override
    public int evictOlderThan(Instant cutoff) {
        AtomicInteger removed = new AtomicInteger();
        for (ProfileKey key : windows.keySet()) {
            windows.computeIfPresent(key, (k, window) -> {
                removed.addAndGet(window.evictOlderThan(cutoff));
                return window.isEmpty() ? null : window;
            });
        }
        if (removed.get() > 0) {
            log.debug("[Window] Evicted {} entries older than {}", removed.get(), cutoff);
        }
        return removed.get();
    }

    @Override
    public int trackedUsers() {
        return windows.size();
    }
}
