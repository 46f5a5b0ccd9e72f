package me.golemcore.guard.adapter.outbound.profile;

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
import me.golemcore.guard.domain.model.ProfileKey;
import me.golemcore.guard.domain.model.SecurityProfile;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import me.golemcore.guard.port.outbound.ProfileStorePort;
import me.golemcore.guard.port.outbound.StoragePort;
import me.golemcore.guard.port.outbound.StoreUnavailableException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Profile store that keeps one JSON document per profile in the workspace
 * {@code profiles/} directory, written atomically through {@link StoragePort}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageProfileStoreAdapter implements ProfileStorePort {

    private static final String FILE_SUFFIX = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final GuardProperties properties;

    @Override
    public Optional<SecurityProfile> find(ProfileKey key) {
        String json;
        try {
            json = storagePort.getText(directory(), fileName(key)).join();
        } catch (CompletionException e) {
            throw new StoreUnavailableException("Failed to read profile " + key, unwrap(e));
        }
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            SecurityProfile profile = objectMapper.readValue(json, SecurityProfile.class);
            if (profile.getViolationHistory() == null) {
                profile.setViolationHistory(new ArrayList<>());
            }
            return Optional.of(profile);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Corrupted profile document " + key, e);
        }
    }

    @Override
    public void save(SecurityProfile profile) {
        ProfileKey key = profile.getKey();
        try {
            String json = objectMapper.writeValueAsString(profile);
            storagePort.putTextAtomic(directory(), fileName(key), json, false).join();
            log.debug("[Store] Saved profile {}", key);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Profile is not serializable: " + key, e);
        } catch (CompletionException e) {
            throw new StoreUnavailableException("Failed to write profile " + key, unwrap(e));
        }
    }

    @Override
    public void delete(ProfileKey key) {
        try {
            storagePort.deleteObject(directory(), fileName(key)).join();
        } catch (CompletionException e) {
            throw new StoreUnavailableException("Failed to delete profile " + key, unwrap(e));
        }
    }

    @Override
    public List<ProfileKey> listKeys() {
        List<String> files;
        try {
            files = storagePort.listObjects(directory(), "").join();
        } catch (CompletionException e) {
            throw new StoreUnavailableException("Failed to list profiles", unwrap(e));
        }
        List<ProfileKey> keys = new ArrayList<>();
        for (String file : files) {
            if (!file.endsWith(FILE_SUFFIX)) {
                continue;
            }
            String name = file.substring(0, file.length() - FILE_SUFFIX.length());
            try {
                keys.add(ProfileKey.fromStorageName(name));
            } catch (IllegalArgumentException e) {
                log.warn("[Store] Skipping unrecognized profile file: {}", file);
            }
        }
        return keys;
    }

    private String directory() {
        return properties.getStore().getDirectory();
    }

    private static String fileName(ProfileKey key) {
        return key.toStorageName() + FILE_SUFFIX;
    }

    private static Throwable unwrap(CompletionException e) {
        return e.getCause() != null ? e.getCause() : e;
    }
}
