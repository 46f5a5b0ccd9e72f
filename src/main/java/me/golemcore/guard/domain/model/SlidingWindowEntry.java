package me.golemcore.guard.domain.model;

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

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * One remembered message in a user's sliding window. Only the fingerprint and
 * the normalized token set are kept, never the full content.
 */
public record SlidingWindowEntry(String fingerprint, Set<String> tokens, Instant timestamp, String channelId) {

    public SlidingWindowEntry {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(timestamp, "timestamp");
        tokens = tokens == null ? Set.of() : Set.copyOf(tokens);
    }

    public boolean isOlderThan(Instant cutoff) {
        return timestamp.isBefore(cutoff);
    }
}
