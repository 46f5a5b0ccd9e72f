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

import java.util.Objects;

/**
 * Identifies a security profile: a user, optionally scoped to one guild. A
 * {@code null} guild means the profile is global for that user.
 */
public record ProfileKey(String guildId, String userId) {

    private static final String GLOBAL_SCOPE = "global";

    public ProfileKey {
        Objects.requireNonNull(userId, "userId");
        if (userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
    }

    public static ProfileKey global(String userId) {
        return new ProfileKey(null, userId);
    }

    public static ProfileKey of(String guildId, String userId) {
        return new ProfileKey(guildId, userId);
    }

    /**
     * Filesystem-safe name used by storage adapters.
     */
    @JsonIgnore
    public String toStorageName() {
        String scope = guildId == null || guildId.isBlank() ? GLOBAL_SCOPE : sanitize(guildId);
        return scope + "__" + sanitize(userId);
    }

    public static ProfileKey fromStorageName(String name) {
        int separator = name.indexOf("__");
        if (separator <= 0 || separator + 2 >= name.length()) {
            throw new IllegalArgumentException("Not a profile storage name: " + name);
        }
        String scope = name.substring(0, separator);
        String user = name.substring(separator + 2);
        return new ProfileKey(GLOBAL_SCOPE.equals(scope) ? null : scope, user);
    }

    private static String sanitize(String value) {
        return value.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    @Override
    public String toString() {
        return (guildId == null ? GLOBAL_SCOPE : guildId) + "/" + userId;
    }
}
