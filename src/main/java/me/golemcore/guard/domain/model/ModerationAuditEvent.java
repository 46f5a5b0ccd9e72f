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

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One line of the moderation audit trail (serialized as JSONL).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModerationAuditEvent {

    private String id;
    private AuditEventType type;
    private Instant timestamp;
    private String guildId;
    private String userId;
    private String messageId;

    @Builder.Default
    private List<ViolationRecord> violations = new ArrayList<>();

    private PunishmentDecision decision;
    private Double trustScore;
    private RiskLevel riskLevel;

    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();
}
