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

/**
 * Kinds of violations the detection pipeline can report.
 *
 * <p>
 * {@code tiePriority} decides which record becomes primary when several
 * records share the highest severity (higher wins). Emotional distress has the
 * lowest priority and is the only non-punitive type.
 */
public enum ViolationType {

    EMOTIONAL_DISTRESS(0, false),

    HATE_SPEECH(1, true),

    THREATS(1, true),

    PHISHING(2, true),

    MALICIOUS_LINKS(3, true),

    HARASSMENT(4, true),

    TOXIC_LANGUAGE(4, true),

    NSFW_CONTENT(4, true),

    SPAM(5, true),

    REPEATED_CONTENT(5, true),

    CAPS_ABUSE(6, true),

    MENTION_SPAM(6, true);

    private final int tiePriority;
    private final boolean punitive;

    ViolationType(int tiePriority, boolean punitive) {
        this.tiePriority = tiePriority;
        this.punitive = punitive;
    }

    public int getTiePriority() {
        return tiePriority;
    }

    public boolean isPunitive() {
        return punitive;
    }
}
