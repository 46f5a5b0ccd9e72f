package me.golemcore.guard.security;

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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Compiled, versioned detection rules. Instances are immutable and shared by
 * reference between concurrent evaluations; a refresh publishes a new instance
 * through {@link PatternLibraryHolder}.
 *
 * <p>
 * Phishing keywords are lower-case phrases matched against lower-cased
 * content; every other word rule is a case-insensitive pattern.
 * Domain sets match the domain itself and all of its subdomains.
 */
@Value
@Builder
public class PatternLibrary {

    long version;
    Instant builtAt;

    List<Pattern> insultPatterns;
    List<Pattern> harassmentPatterns;
    List<Pattern> threatPatterns;
    List<Pattern> hateSpeechPatterns;
    List<Pattern> distressPatterns;

    List<String> phishingKeywords;
    List<Pattern> urgencyPatterns;
    List<Pattern> nsfwPatterns;

    Set<String> linkShorteners;
    Set<String> blacklistedDomains;
    Set<String> trustedDomains;
    Set<String> officialPlatformDomains;
    List<String> platformNames;
    List<String> suspiciousTlds;

    /**
     * Returns the source of the first pattern found in the text.
     */
    public static Optional<String> firstMatch(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return Optional.of(pattern.pattern());
            }
        }
        return Optional.empty();
    }

    public boolean isTrusted(String domain) {
        return matchesDomain(domain, trustedDomains);
    }

    public boolean isBlacklisted(String domain) {
        return matchesDomain(domain, blacklistedDomains);
    }

    public boolean isShortener(String domain) {
        return matchesDomain(domain, linkShorteners);
    }

    public boolean hasSuspiciousTld(String domain) {
        String normalized = domain.toLowerCase(Locale.ROOT);
        for (String tld : suspiciousTlds) {
            if (normalized.endsWith(tld)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A domain that mentions a platform name without belonging to one of the
     * platform's official domains.
     */
    public Optional<String> impersonatedPlatform(String domain) {
        String normalized = domain.toLowerCase(Locale.ROOT);
        if (matchesDomain(normalized, officialPlatformDomains)) {
            return Optional.empty();
        }
        for (String name : platformNames) {
            if (normalized.contains(name)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    static boolean matchesDomain(String domain, Set<String> domains) {
        String candidate = domain.toLowerCase(Locale.ROOT);
        while (true) {
            if (domains.contains(candidate)) {
                return true;
            }
            int dot = candidate.indexOf('.');
            if (dot < 0) {
                return false;
            }
            candidate = candidate.substring(dot + 1);
        }
    }
}
