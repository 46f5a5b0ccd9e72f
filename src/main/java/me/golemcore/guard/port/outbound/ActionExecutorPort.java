package me.golemcore.guard.port.outbound;

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
import me.golemcore.guard.domain.model.ModerationOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * Port for applying a moderation outcome on the host platform (delete the
 * message, time the member out, kick, ban, or send a supportive reply).
 *
 * <p>
 * Implementations complete the returned future exceptionally with
 * {@link ActionExecutionException} when the platform rejects the action.
 */
public interface ActionExecutorPort {

    CompletableFuture<Void> apply(ModerationOutcome outcome, ChatMessage message);
}
