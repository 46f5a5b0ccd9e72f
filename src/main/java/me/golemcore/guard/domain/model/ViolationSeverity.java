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
 * Ordinal severity of a single violation. The numeric level is the base
 * punishment level used by escalation.
 */
public enum ViolationSeverity {

    MINOR(1),

    MODERATE(2),

    SERIOUS(3),

    SEVERE(4),

    CRITICAL(5);

    private final int level;

    ViolationSeverity(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }
}
