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

import lombok.RequiredArgsConstructor;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds {@link PatternLibrary} versions from the built-in rule sets merged
 * with the extras configured under {@code guard.patterns.*}.
 */
@Component
@RequiredArgsConstructor
public class PatternLibraryFactory {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<String> INSULT_PATTERNS = List.of(
            "\\b(idiot|stupid|dumb|moron|loser|trash|garbage|noob)\\b",
            "\\b(shut up|stfu|gtfo)\\b",
            "\\b(pathetic|worthless|useless|waste of space)\\b");

    private static final List<String> HARASSMENT_PATTERNS = List.of(
            "\\bhate you\\b",
            "\\bgo die\\b",
            "\\bnobody likes you\\b",
            "\\bkys\\b",
            "\\bkill yourself\\b",
            "\\bget lost\\b");

    private static final List<String> THREAT_PATTERNS = List.of(
            "\\b(kill|murder|hurt|harm|destroy|eliminate)\\s+(you|him|her|them)\\b",
            "\\bthreaten(s|ed|ing)?\\b",
            "\\bgonna get you\\b",
            "\\bwatch your back\\b");

    private static final List<String> HATE_SPEECH_PATTERNS = List.of(
            "\\b(nazi|hitler|holocaust|genocide)\\b",
            "\\bsieg heil\\b",
            "\\bwhite power\\b");

    // first-person phrasing only
    private static final List<String> DISTRESS_PATTERNS = List.of(
            "\\bi(?:'m| am) (?:so |really )?(?:depressed|hopeless|overwhelmed|breaking down)\\b",
            "\\b(?:feel|feeling) (?:so |really )?(?:depressed|hopeless|overwhelmed)\\b",
            "\\bkill myself\\b",
            "\\bend it all\\b",
            "\\bsuicid(?:e|al)\\b",
            "\\bi hate myself\\b",
            "\\bi can'?t take it\\b");

    private static final List<String> PHISHING_KEYWORDS = List.of(
            "free nitro", "discord nitro", "claim now", "limited time", "verify account",
            "suspended account", "unusual activity", "click here", "urgent", "immediate action",
            "expires soon", "security alert");

    private static final List<String> URGENCY_WORDS = List.of(
            "urgent", "immediate", "now", "quickly", "expires", "limited");

    private static final List<String> NSFW_KEYWORDS = List.of(
            "nsfw", "porn", "xxx", "adult content", "explicit");

    private static final List<String> LINK_SHORTENERS = List.of(
            "bit.ly", "tinyurl.com", "t.co", "short.link", "grabify.link");

    private static final List<String> BLACKLISTED_DOMAINS = List.of(
            "discordapp.gift", "discord-nitro.com", "grabify.link", "discordnitro.info", "discord-gift.com",
            "steamcommunity.ru", "discord-app.net", "discordgift.site", "steam-rewards.com");

    private static final List<String> TRUSTED_DOMAINS = List.of(
            "discord.com", "discord.gg", "youtube.com", "youtu.be", "github.com", "reddit.com",
            "wikipedia.org", "google.com", "twitch.tv", "twitter.com");

    private static final List<String> OFFICIAL_PLATFORM_DOMAINS = List.of(
            "discord.com", "discord.gg", "discordapp.com", "discordapp.net", "discord.media",
            "steampowered.com", "steamcommunity.com");

    private static final List<String> PLATFORM_NAMES = List.of(
            "discord", "steamcommunity", "steampowered");

    private static final List<String> SUSPICIOUS_TLDS = List.of(
            ".tk", ".ml", ".ga", ".cf", ".gq", ".pw", ".top", ".download");

    private final GuardProperties properties;
    private final Clock clock;

    public PatternLibrary build(long version) {
        GuardProperties.PatternProperties extras = properties.getPatterns();
        return PatternLibrary.builder()
                .version(version)
                .builtAt(clock.instant())
                .insultPatterns(compile(merge(INSULT_PATTERNS, extras.getInsultPatterns())))
                .harassmentPatterns(compile(merge(HARASSMENT_PATTERNS, extras.getHarassmentPatterns())))
                .threatPatterns(compile(merge(THREAT_PATTERNS, extras.getThreatPatterns())))
                .hateSpeechPatterns(compile(merge(HATE_SPEECH_PATTERNS, extras.getHateSpeechPatterns())))
                .distressPatterns(compile(merge(DISTRESS_PATTERNS, extras.getDistressPatterns())))
                .phishingKeywords(lowerCase(merge(PHISHING_KEYWORDS, extras.getPhishingKeywords())))
                .urgencyPatterns(compile(wordPatterns(merge(URGENCY_WORDS, extras.getUrgencyWords()))))
                .nsfwPatterns(compile(wordPatterns(merge(NSFW_KEYWORDS, extras.getNsfwKeywords()))))
                .linkShorteners(domainSet(merge(LINK_SHORTENERS, extras.getLinkShorteners())))
                .blacklistedDomains(domainSet(merge(BLACKLISTED_DOMAINS, extras.getBlacklistedDomains())))
                .trustedDomains(domainSet(merge(TRUSTED_DOMAINS, extras.getTrustedDomains())))
                .officialPlatformDomains(domainSet(OFFICIAL_PLATFORM_DOMAINS))
                .platformNames(PLATFORM_NAMES)
                .suspiciousTlds(lowerCase(merge(SUSPICIOUS_TLDS, extras.getSuspiciousTlds())))
                .build();
    }

    private static List<String> merge(List<String> defaults, List<String> extras) {
        Set<String> merged = new LinkedHashSet<>(defaults);
        if (extras != null) {
            for (String extra : extras) {
                if (extra != null && !extra.isBlank()) {
                    merged.add(extra.trim());
                }
            }
        }
        return new ArrayList<>(merged);
    }

    private static List<Pattern> compile(List<String> sources) {
        return sources.stream()
                .map(source -> Pattern.compile(source, FLAGS))
                .toList();
    }

    private static List<String> wordPatterns(List<String> words) {
        return words.stream()
                .map(word -> "\\b" + Pattern.quote(word.toLowerCase(Locale.ROOT)) + "\\b")
                .toList();
    }

    private static List<String> lowerCase(List<String> values) {
        return values.stream()
                .map(value -> value.toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
    }

    private static Set<String> domainSet(List<String> domains) {
        Set<String> set = new LinkedHashSet<>();
        for (String domain : domains) {
            String normalized = domain.toLowerCase(Locale.ROOT);
            set.add(normalized.startsWith("www.") ? normalized.substring(4) : normalized);
        }
        return Set.copyOf(set);
    }
}
