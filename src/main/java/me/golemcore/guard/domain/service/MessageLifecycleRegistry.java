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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers messages deleted or edited by their author while an evaluation may
 * still be running, so that the outcome does not ask to delete them again.
 */
@Component
@Slf4j
public class MessageLifecycleRegistry {

    private final Map<String, Instant> withdrawn = new ConcurrentHashMap<>();

    public void markDeleted(String messageId, Instant now) {
        mark(messageId, now, "deleted");
    }

    public void markEdited(String messageId, Instant now) {
        mark(messageId, now, "edited");
    }

    public boolean isWithdrawn(String messageId) {
        return messageId != null && withdrawn.containsKey(messageId);
    }

    public int evictOlderThan(Instant cutoff) {
        int before = withdrawn.size();
        withdrawn.values().removeIf(markedAt -> markedAt.isBefore(cutoff));
        return before - withdrawn.size();
    }

    private void mark(String messageId, Instant now, String reason) {
        if (messageId == null) {
            return;
        }
        withdrawn.put(messageId, now);
        log.debug("[Moderation] Message {} {} by author", messageId, reason);
    }
}
