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

import me.golemcore.guard.domain.model.ProfileKey;
import me.golemcore.guard.domain.model.SlidingWindowEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Per-user, time-ordered buffers of recent message fingerprints.
 *
 * <p>
 * Window queries count entries with {@code now - window <= timestamp <= now}.
 * Every operation is O(window size) and users never share a lock.
 */
public interface SlidingWindowTracker {

    void record(ProfileKey user, SlidingWindowEntry entry);

    int countMatching(ProfileKey user, String fingerprint, Duration window, Instant now);

    int countRecent(ProfileKey user, Duration window, Instant now);

    List<SlidingWindowEntry> recentEntries(ProfileKey user, Duration window, Instant now);

    /**
     * Drop entries older than the cutoff and forget users left with no entries.
     *
     * @return number of entries removed
     */
    int evictOlderThan(Instant cutoff);

    int trackedUsers();
}
