package me.golemcore.guard.domain.detection;

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

import me.golemcore.guard.domain.model.ChatMessage;
import me.golemcore.guard.domain.model.ProfileKey;
import me.golemcore.guard.domain.model.SecurityProfile;
import me.golemcore.guard.domain.model.SlidingWindowEntry;
import me.golemcore.guard.domain.model.ViolationRecord;
import me.golemcore.guard.domain.model.ViolationSeverity;
import me.golemcore.guard.domain.model.ViolationType;
import me.golemcore.guard.security.PatternLibrary;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * Everything a detector may look at for one message. The profile is a
 * read-only snapshot and the window already contains {@code currentEntry}.
 */
public record DetectionContext(
        ChatMessage message,
        ProfileKey userKey,
        SecurityProfile profile,
        PatternLibrary patterns,
        SlidingWindowEntry currentEntry,
        Instant now) {

    public String content() {
        return message.getContentOrEmpty();
    }

    public String lowerContent() {
        return content().toLowerCase(Locale.ROOT);
    }

    public ViolationRecord violation(ViolationType type, ViolationSeverity severity, Map<String, Object> evidence) {
        return new ViolationRecord(
                message.getUserId(),
                message.getGuildId(),
                message.getChannelId(),
                message.getMessageId(),
                type,
                severity,
                message.getContent(),
                now,
                evidence);
    }
}
