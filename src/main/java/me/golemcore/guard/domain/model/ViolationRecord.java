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

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of one detected violation. Appended to a profile's history
 * and never modified afterwards.
 */
public record ViolationRecord(
        String userId,
        String guildId,
        String channelId,
        String messageId,
        ViolationType type,
        ViolationSeverity severity,
        String messageExcerpt,
        Instant timestamp,
        Map<String, Object> evidence) {

    public static final int MAX_EXCERPT_LENGTH = 200;

    public ViolationRecord {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(timestamp, "timestamp");
        messageExcerpt = excerpt(messageExcerpt);
        evidence = evidence == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
    }

    @JsonIgnore
    public boolean isPunitive() {
        return type.isPunitive();
    }

    @JsonIgnore
    public ProfileKey profileKey() {
        return new ProfileKey(guildId, userId);
    }

    public static String excerpt(String content) {
        if (content == null) {
            return "";
        }
        if (content.length() <= MAX_EXCERPT_LENGTH) {
            return content;
        }
        return content.substring(0, MAX_EXCERPT_LENGTH);
    }
}
