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

import me.golemcore.guard.domain.model.SlidingWindowEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Bounded message window of one user, guarded by its own monitor.
 *
 * <p>
 * Entries older than the retention span (relative to the newest write) are
 * dropped on every write. Reads scan the whole deque, so out-of-order
 * timestamps are still counted correctly.
 */
final class UserMessageWindow {

    private final Deque<SlidingWindowEntry> entries = new ArrayDeque<>();
    private final int capacity;
    private final Duration retention;

    UserMessageWindow(int capacity, Duration retention) {
        this.capacity = capacity;
        this.retention = retention;
    }

    synchronized void add(SlidingWindowEntry entry) {
        evictOlderThanLocked(entry.timestamp().minus(retention));
        while (entries.size() >= capacity) {
            entries.removeFirst();
        }
        entries.addLast(entry);
    }

    synchronized int count(Duration window, Instant now, Predicate<SlidingWindowEntry> filter) {
        Instant from = now.minus(window);
        int count = 0;
        for (SlidingWindowEntry entry : entries) {
            if (inRange(entry, from, now) && filter.test(entry)) {
                count++;
            }
        }
        return count;
    }

    synchronized List<SlidingWindowEntry> snapshot(Duration window, Instant now) {
        Instant from = now.minus(window);
        List<SlidingWindowEntry> result = new ArrayList<>();
        for (SlidingWindowEntry entry : entries) {
            if (inRange(entry, from, now)) {
                result.add(entry);
            }
        }
        return result;
    }

    synchronized int evictOlderThan(Instant cutoff) {
        return evictOlderThanLocked(cutoff);
    }

    synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    synchronized int size() {
        return entries.size();
    }

    private int evictOlderThanLocked(Instant cutoff) {
        int removed = 0;
        Iterator<SlidingWindowEntry> iterator = entries.iterator();
        while (iterator.hasNext()) {
            if (iterator.next().isOlderThan(cutoff)) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    private static boolean inRange(SlidingWindowEntry entry, Instant from, Instant now) {
        return !entry.timestamp().isBefore(from) && !entry.timestamp().isAfter(now);
    }
}
