package me.golemcore.guard.domain.detection;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.guard.domain.model.ViolationSeverity;
import me.golemcore.guard.domain.model.ViolationType;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import me.golemcore.guard.port.outbound.ThreatIntelPort;
import me.golemcore.guard.security.PatternLibrary;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks every link of a message: the platform-extracted URLs plus any URL
 * found in the content.
 *
 * <p>
 * A link is flagged when its domain is blacklisted, is a link shortener,
 * impersonates a platform, ends in a suspicious TLD, or is reported by the
 * threat-intel service. Trusted domains are never flagged. Local rule sets
 * are checked first; threat intel is only consulted when no local rule
 * matched, with all lookups sharing one {@code guard.threat-intel.timeout}
 * deadline. A slow or failing lookup counts as "unknown".
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MaliciousLinkDetector implements ViolationDetector {

    static final String NAME = "malicious-link";

    private static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s<>\"']+", Pattern.CASE_INSENSITIVE);

    private final ThreatIntelPort threatIntelPort;
    private final GuardProperties properties;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DetectorResult detect(DetectionContext context) {
        Set<String> urls = collectUrls(context);
        if (urls.isEmpty()) {
            return DetectorResult.none(NAME);
        }

        PatternLibrary patterns = context.patterns();
        List<String> flagged = new ArrayList<>();
        List<String> reasons = new ArrayList<>();
        Map<String, String> unknown = new LinkedHashMap<>();
        Set<String> checkedDomains = new LinkedHashSet<>();
        for (String url : urls) {
            Optional<String> domain = extractDomain(url);
            if (domain.isEmpty() || !checkedDomains.add(domain.get())) {
                continue;
            }
            if (patterns.isTrusted(domain.get())) {
                continue;
            }
            Optional<String> reason = classifyLocally(domain.get(), patterns);
            if (reason.isPresent()) {
                flagged.add(url);
                reasons.add(reason.get() + ":" + domain.get());
            } else {
                unknown.put(domain.get(), url);
            }
        }

        if (flagged.isEmpty() && !unknown.isEmpty()) {
            for (String domain : lookUpThreatIntel(unknown.keySet())) {
                flagged.add(unknown.get(domain));
                reasons.add("threat-intel:" + domain);
            }
        }

        if (flagged.isEmpty()) {
            return DetectorResult.none(NAME);
        }
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("urls", flagged);
        evidence.put("reasons", reasons);
        return DetectorResult.finding(NAME, context.violation(ViolationType.MALICIOUS_LINKS,
                ViolationSeverity.SERIOUS, evidence));
    }

    /**
     * Checks a domain against the local rule sets only. Trusted domains must be
     * filtered out by the caller.
     */
    Optional<String> classifyLocally(String domain, PatternLibrary patterns) {
        if (patterns.isBlacklisted(domain)) {
            return Optional.of("blacklisted");
        }
        if (patterns.isShortener(domain)) {
            return Optional.of("shortener");
        }
        Optional<String> impersonated = patterns.impersonatedPlatform(domain);
        if (impersonated.isPresent()) {
            return Optional.of("impersonation-" + impersonated.get());
        }
        if (patterns.hasSuspiciousTld(domain)) {
            return Optional.of("suspicious-tld");
        }
        return Optional.empty();
    }

    /**
     * Queries threat intel for all domains at once and waits for them against
     * one shared deadline. Slow, failed or missing verdicts count as "not
     * reported".
     */
    private List<String> lookUpThreatIntel(Set<String> domains) {
        if (!threatIntelPort.isEnabled()) {
            return List.of();
        }
        Duration timeout = properties.getThreatIntel().getTimeout();
        Map<String, CompletableFuture<Boolean>> verdicts = new LinkedHashMap<>();
        for (String domain : domains) {
            verdicts.put(domain, boundedVerdict(domain, timeout));
        }
        CompletableFuture.allOf(verdicts.values().toArray(new CompletableFuture[0])).join();

        List<String> reported = new ArrayList<>();
        verdicts.forEach((domain, verdict) -> {
            if (Boolean.TRUE.equals(verdict.join())) {
                reported.add(domain);
            }
        });
        return reported;
    }

    private CompletableFuture<Boolean> boundedVerdict(String domain, Duration timeout) {
        CompletableFuture<Boolean> lookup;
        try {
            lookup = threatIntelPort.isMaliciousDomain(domain);
        } catch (RuntimeException e) {
            log.debug("[ThreatIntel] Lookup for {} failed: {}", domain, e.getMessage());
            return CompletableFuture.completedFuture(false);
        }
        if (lookup == null) {
            return CompletableFuture.completedFuture(false);
        }
        // timeout completes a dependent stage; the adapter future is left untouched
        return lookup.thenApply(Boolean.TRUE::equals)
                .exceptionally(error -> {
                    log.debug("[ThreatIntel] Lookup for {} failed: {}", domain, error.getMessage());
                    return false;
                })
                .completeOnTimeout(false, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static Set<String> collectUrls(DetectionContext context) {
        Set<String> urls = new LinkedHashSet<>();
        List<String> provided = context.message().getUrls();
        if (provided != null) {
            provided.stream().filter(url -> url != null && !url.isBlank()).map(String::trim).forEach(urls::add);
        }
        Matcher matcher = URL_PATTERN.matcher(context.content());
        while (matcher.find()) {
            urls.add(matcher.group());
        }
        return urls;
    }

    static Optional<String> extractDomain(String url) {
        String candidate = url.contains("://") ? url : "https://" + url;
        try {
            String host = new URI(candidate).getHost();
            if (host == null || host.isBlank()) {
                return Optional.empty();
            }
            String normalized = host.toLowerCase(Locale.ROOT);
            if (normalized.endsWith(".")) {
                normalized = normalized.substring(0, normalized.length() - 1);
            }
            return Optional.of(normalized.startsWith("www.") ? normalized.substring(4) : normalized);
        } catch (URISyntaxException e) {
            log.debug("[Detection] Ignoring malformed URL: {}", url);
            return Optional.empty();
        }
    }
}
