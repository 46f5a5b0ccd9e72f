package me.golemcore.guard.adapter.outbound.action;

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
import me.golemcore.guard.domain.model.ChatMessage;
import me.golemcore.guard.domain.model.ModerationOutcome;
import me.golemcore.guard.domain.model.PunishmentDecision;
import me.golemcore.guard.port.outbound.ActionExecutorPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Default action executor: records what would be done on the platform. Hosts
 * with a real platform client provide their own {@link ActionExecutorPort}
 * and set {@code guard.action.executor} to something else.
 */
@Component
@ConditionalOnProperty(prefix = "guard.action", name = "executor", havingValue = "logging", matchIfMissing = true)
@Slf4j
public class LoggingActionExecutorAdapter implements ActionExecutorPort {

    @Override
    public CompletableFuture<Void> apply(ModerationOutcome outcome, ChatMessage message) {
        PunishmentDecision decision = outcome.getDecision();
        if (outcome.isDeleteMessage()) {
            log.info("[Action] Delete message {} in channel {}", message.getMessageId(), message.getChannelId());
        }
        if (decision != null) {
            if (decision.hasDuration()) {
                log.info("[Action] {} {} for {} (level {}): {}", decision.type(), outcome.getProfileKey(),
                        decision.duration(), decision.level(), decision.rationale());
            } else {
                log.info("[Action] {} {} (level {}): {}", decision.type(), outcome.getProfileKey(),
                        decision.level(), decision.rationale());
            }
        }
        return CompletableFuture.completedFuture(null);
    }
}
