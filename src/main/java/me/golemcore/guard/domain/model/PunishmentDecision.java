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

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of the escalation engine for one evaluation. Value object: equal
 * inputs produce equal decisions.
 */
public record PunishmentDecision(PunishmentType type, Duration duration, int level, String rationale) {

    public PunishmentDecision {
        Objects.requireNonNull(type, "type");
        if (level < 0 || level > SecurityProfile.MAX_PUNISHMENT_LEVEL) {
            throw new IllegalArgumentException("Punishment level out of range: " + level);
        }
        rationale = rationale == null ? "" : rationale;
    }

    public static PunishmentDecision none() {
        return new PunishmentDecision(PunishmentType.NONE, null, 0, "no violations");
    }

    public static PunishmentDecision supportive(String rationale) {
        return new PunishmentDecision(PunishmentType.SUPPORTIVE, null, 0, rationale);
    }

    public boolean hasDuration() {
        return duration != null && !duration.isZero();
    }
}
