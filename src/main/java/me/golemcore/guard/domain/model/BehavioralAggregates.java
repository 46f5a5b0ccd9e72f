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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Running behavioral statistics kept on a security profile.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BehavioralAggregates {

    public static final int MAX_TRACKED_CHANNELS = 50;

    private double averageMessageLength;
    private long messageCount;

    @Builder.Default
    private Set<String> channelIds = new LinkedHashSet<>();

    private long positiveContributions;

    /**
     * Consecutive violations, decremented by passive recovery.
     */
    private int violationStreak;

    /**
     * Recovery intervals elapsed since the last violation.
     */
    private int improvementStreak;

    public BehavioralAggregates copy() {
        return BehavioralAggregates.builder()
                .averageMessageLength(averageMessageLength)
                .messageCount(messageCount)
                .channelIds(channelIds != null ? new LinkedHashSet<>(channelIds) : new LinkedHashSet<>())
                .positiveContributions(positiveContributions)
                .violationStreak(violationStreak)
                .improvementStreak(improvementStreak)
                .build();
    }
}
