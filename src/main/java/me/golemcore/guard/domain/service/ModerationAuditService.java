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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.guard.domain.model.AuditEventType;
import me.golemcore.guard.domain.model.ModerationAuditEvent;
import me.golemcore.guard.domain.model.ModerationOutcome;
import me.golemcore.guard.domain.model.ProfileKey;
import me.golemcore.guard.domain.model.SecurityProfile;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import me.golemcore.guard.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Moderation audit trail. Each event is one JSON line in a daily file under
 * the audit directory ({@code moderation-yyyy-MM-dd.jsonl}, UTC dates).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModerationAuditService {

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd")
            .withZone(ZoneOffset.UTC);

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final GuardProperties properties;

    public void recordEvaluation(ModerationOutcome outcome) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("deleteMessage", outcome.isDeleteMessage());
        details.put("unpersisted", outcome.isUnpersisted());
        if (!outcome.getDegradedDetectors().isEmpty()) {
            details.put("degradedDetectors", outcome.getDegradedDetectors());
        }
        write(baseEvent(AuditEventType.EVALUATION, outcome.getProfileKey(), outcome.getEvaluatedAt())
                .messageId(outcome.getMessageId())
                .violations(outcome.getViolations())
                .decision(outcome.getDecision())
                .trustScore(outcome.getUpdatedTrustScore())
                .riskLevel(outcome.getUpdatedRiskLevel())
                .details(details)
                .build());
    }

    public void recordActionFailure(ModerationOutcome outcome, String error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", error);
        write(baseEvent(AuditEventType.ACTION_FAILED, outcome.getProfileKey(), outcome.getEvaluatedAt())
                .messageId(outcome.getMessageId())
                .decision(outcome.getDecision())
                .details(details)
                .build());
    }

    public void recordStoreUnavailable(ProfileKey key, String operation, Instant now) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", operation);
        write(baseEvent(AuditEventType.STORE_UNAVAILABLE, key, now).details(details).build());
    }

    public void recordEvaluationDropped(ProfileKey key, String messageId, String reason, Instant now) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason);
        write(baseEvent(AuditEventType.EVALUATION_DROPPED, key, now)
                .messageId(messageId)
                .details(details)
                .build());
    }

    public void recordManualOverride(SecurityProfile profile, String moderatorId, String reason, Instant now) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("moderatorId", moderatorId);
        details.put("reason", reason);
        write(baseEvent(AuditEventType.MANUAL_OVERRIDE, profile.getKey(), now)
                .trustScore(profile.getTrustScore())
                .details(details)
                .build());
    }

    private ModerationAuditEvent.ModerationAuditEventBuilder baseEvent(AuditEventType type, ProfileKey key,
            Instant timestamp) {
        return ModerationAuditEvent.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .timestamp(timestamp)
                .guildId(key.guildId())
                .userId(key.userId());
    }

    private void write(ModerationAuditEvent event) {
        GuardProperties.AuditProperties audit = properties.getAudit();
        if (!audit.isEnabled()) {
            return;
        }
        String line;
        try {
            line = objectMapper.writeValueAsString(event) + "\n";
        } catch (JsonProcessingException e) {
            log.error("[Audit] Failed to serialize {} event: {}", event.getType(), e.getMessage());
            return;
        }
        String file = "moderation-" + FILE_DATE.format(event.getTimestamp()) + ".jsonl";
        storagePort.appendText(audit.getDirectory(), file, line)
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        log.error("[Audit] Failed to append {} event for {}/{}: {}", event.getType(),
                                event.getGuildId(), event.getUserId(), error.getMessage());
                    }
                });
    }
}
