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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Inbound chat message as delivered by the host platform adapter.
 *
 * <p>
 * {@code mentions} holds the ids of mentioned users and roles, {@code urls}
 * the links the platform already extracted (the link detector also scans the
 * content itself).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    private String messageId;
    private String userId;
    private String guildId;
    private String channelId;
    private String content;
    private Instant timestamp;

    @Builder.Default
    private List<String> mentions = new ArrayList<>();

    @Builder.Default
    private List<String> urls = new ArrayList<>();

    @JsonIgnore
    public ProfileKey getProfileKey() {
        return new ProfileKey(guildId, userId);
    }

    @JsonIgnore
    public String getContentOrEmpty() {
        return content != null ? content : "";
    }
}
