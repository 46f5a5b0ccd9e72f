package me.golemcore.guard.adapter.outbound.threatintel;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import me.golemcore.guard.port.outbound.ThreatIntelPort;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Domain reputation lookups over HTTP.
 *
 * <p>
 * Calls {@code GET {guard.threat-intel.url}/domains/{domain}} and expects a
 * JSON body with a boolean {@code malicious} field. The optional API key is
 * sent as a bearer token. Verdicts are kept in a bounded LRU cache so repeated
 * links do not hit the service again.
 *
 * <p>
 * Failures (transport errors, non-2xx responses, unparsable bodies) complete
 * the future exceptionally; the link detector treats them as unknown.
 */
@Component
@Slf4j
public class HttpThreatIntelAdapter implements ThreatIntelPort {

    private final GuardProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Map<String, Boolean> verdicts;

    public HttpThreatIntelAdapter(GuardProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        int cacheSize = Math.max(1, properties.getThreatIntel().getCacheSize());
        this.verdicts = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > cacheSize;
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> isMaliciousDomain(String domain) {
        if (!isEnabled()) {
            return CompletableFuture.completedFuture(false);
        }
        Boolean cached = verdicts.get(domain);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }

        return CompletableFuture.supplyAsync(() -> {
            boolean malicious = lookup(domain);
            verdicts.put(domain, malicious);
            return malicious;
        });
    }

    @Override
    public boolean isEnabled() {
        GuardProperties.ThreatIntelProperties threatIntel = properties.getThreatIntel();
        return threatIntel.isEnabled() && threatIntel.getUrl() != null && !threatIntel.getUrl().isBlank();
    }

    private boolean lookup(String domain) {
        HttpUrl base = HttpUrl.parse(properties.getThreatIntel().getUrl());
        if (base == null) {
            throw new IllegalStateException("Invalid threat intel url: " + properties.getThreatIntel().getUrl());
        }
        HttpUrl url = base.newBuilder()
                .addPathSegment("domains")
                .addPathSegment(domain)
                .build();

        Request.Builder requestBuilder = new Request.Builder().url(url).get();
        String apiKey = properties.getThreatIntel().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }

        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IllegalStateException("Threat intel lookup failed: HTTP " + response.code());
            }
            JsonNode node = objectMapper.readTree(body.string());
            JsonNode malicious = node.get("malicious");
            if (malicious == null || !malicious.isBoolean()) {
                throw new IllegalStateException("Threat intel response has no 'malicious' flag");
            }
            log.debug("[ThreatIntel] {} -> {}", domain, malicious.asBoolean());
            return malicious.asBoolean();
        } catch (IOException e) {
            throw new UncheckedIOException("Threat intel lookup failed for " + domain, e);
        }
    }

    int cachedVerdicts() {
        return verdicts.size();
    }
}
