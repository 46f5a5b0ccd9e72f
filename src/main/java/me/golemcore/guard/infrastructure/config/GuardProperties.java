package me.golemcore.guard.infrastructure.config;

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

import lombok.Data;
import me.golemcore.guard.domain.model.PunishmentType;
import me.golemcore.guard.domain.model.ViolationSeverity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the moderation engine.
 *
 * <p>
 * All settings live under the {@code guard.*} prefix in
 * {@code application.properties}:
 * <ul>
 * <li>{@code guard.detection.*} - detector thresholds and windows</li>
 * <li>{@code guard.patterns.*} - extra domains and keywords merged into the
 * built-in pattern library</li>
 * <li>{@code guard.trust.*} - penalty table, thresholds, recovery</li>
 * <li>{@code guard.punishment.*} - timeout durations per escalation level</li>
 * <li>{@code guard.retention.*}, {@code guard.cache.*},
 * {@code guard.sweep.*} - memory management</li>
 * <li>{@code guard.store.*}, {@code guard.storage.*} - profile persistence</li>
 * <li>{@code guard.threat-intel.*}, {@code guard.http.*} - optional domain
 * reputation lookups</li>
 * </ul>
 *
 * <p>
 * Values are checked once at startup by {@link GuardSettingsValidator}.
 */
@ConfigurationProperties(prefix = "guard")
@Data
public class GuardProperties {

    private DetectionProperties detection = new DetectionProperties();
    private PatternProperties patterns = new PatternProperties();
    private TrustProperties trust = new TrustProperties();
    private PunishmentProperties punishment = new PunishmentProperties();
    private WindowProperties window = new WindowProperties();
    private RetentionProperties retention = new RetentionProperties();
    private CacheProperties cache = new CacheProperties();
    private SweepProperties sweep = new SweepProperties();
    private StoreProperties store = new StoreProperties();
    private ConcurrencyProperties concurrency = new ConcurrencyProperties();
    private ThreatIntelProperties threatIntel = new ThreatIntelProperties();
    private AuditProperties audit = new AuditProperties();
    private ActionProperties action = new ActionProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class DetectionProperties {
        private Duration evaluationBudget = Duration.ofMillis(50);
        private int spamThreshold = 3;
        private Duration spamTimeframe = Duration.ofSeconds(30);
        private int rapidMessageLimit = 5;
        private Duration rapidTimeframe = Duration.ofSeconds(10);
        private double similarityThreshold = 0.7;
        private Duration similarityWindow = Duration.ofSeconds(60);
        private int similarMatchThreshold = 2;
        private int minLengthForAnalysis = 5;
        private double capsRatioThreshold = 0.8;
        private int capsMinLength = 10;
        private int mentionLimit = 4;
        private int mentionSevereLimit = 8;
        private int phishingScoreThreshold = 4;
        private boolean nsfwEnabled = true;
        private List<String> disabledDetectors = new ArrayList<>();

        /**
         * Longest window any detector looks back over; bounds the message
         * window retention.
         */
        public Duration longestWindow() {
            Duration longest = spamTimeframe;
            if (rapidTimeframe.compareTo(longest) > 0) {
                longest = rapidTimeframe;
            }
            if (similarityWindow.compareTo(longest) > 0) {
                longest = similarityWindow;
            }
            return longest;
        }
    }

    @Data
    public static class PatternProperties {
        private List<String> blacklistedDomains = new ArrayList<>();
        private List<String> trustedDomains = new ArrayList<>();
        private List<String> linkShorteners = new ArrayList<>();
        private List<String> suspiciousTlds = new ArrayList<>();
        private List<String> phishingKeywords = new ArrayList<>();
        private List<String> urgencyWords = new ArrayList<>();
        private List<String> nsfwKeywords = new ArrayList<>();
        private List<String> insultPatterns = new ArrayList<>();
        private List<String> harassmentPatterns = new ArrayList<>();
        private List<String> threatPatterns = new ArrayList<>();
        private List<String> hateSpeechPatterns = new ArrayList<>();
        private List<String> distressPatterns = new ArrayList<>();
    }

    @Data
    public static class TrustProperties {
        private Map<ViolationSeverity, Double> penalties = defaultPenalties();
        private double trustThreshold = 70.0;
        private double quarantineThreshold = 25.0;
        private Duration quarantineDuration = Duration.ofHours(24);
        private double recoveryStep = 2.0;
        private Duration recoveryInterval = Duration.ofHours(6);
        private Duration riskWindow = Duration.ofHours(24);
        private int riskFrequencyCap = 5;
        private double messageLengthSmoothing = 0.1;

        private static Map<ViolationSeverity, Double> defaultPenalties() {
            Map<ViolationSeverity, Double> penalties = new EnumMap<>(ViolationSeverity.class);
            penalties.put(ViolationSeverity.MINOR, 5.0);
            penalties.put(ViolationSeverity.MODERATE, 15.0);
            penalties.put(ViolationSeverity.SERIOUS, 30.0);
            penalties.put(ViolationSeverity.SEVERE, 50.0);
            penalties.put(ViolationSeverity.CRITICAL, 75.0);
            return penalties;
        }
    }

    @Data
    public static class PunishmentProperties {
        private Map<Integer, Duration> timeoutDurations = defaultTimeouts();
        private PunishmentType maxLevelAction = PunishmentType.KICK;
        private Duration escalationWindow = Duration.ofHours(24);
        private double escalationStep = 0.5;
        private double escalationCap = 2.0;

        private static Map<Integer, Duration> defaultTimeouts() {
            Map<Integer, Duration> timeouts = new LinkedHashMap<>();
            timeouts.put(3, Duration.ofMinutes(30));
            timeouts.put(4, Duration.ofHours(1));
            timeouts.put(5, Duration.ofHours(2));
            timeouts.put(6, Duration.ofHours(6));
            return timeouts;
        }
    }

    @Data
    public static class WindowProperties {
        private int capacity = 100;
    }

    @Data
    public static class RetentionProperties {
        private Duration violationHorizon = Duration.ofDays(7);
        private int maxHistoryPerProfile = 50;
        private Duration inactiveProfileTtl = Duration.ofDays(7);
        private Duration messageMarkerTtl = Duration.ofHours(1);
    }

    @Data
    public static class CacheProperties {
        private Duration ttl = Duration.ofMinutes(30);
        private int maxSize = 10_000;
    }

    @Data
    public static class SweepProperties {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(30);
    }

    @Data
    public static class StoreProperties {
        private String directory = "profiles";
        private int maxRetries = 3;
        private Duration firstBackoff = Duration.ofMillis(50);
        private Duration operationTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class ConcurrencyProperties {
        private int maxQueuedPerUser = 100;
        private int moderationThreads = 4;
        private int detectorThreads = 4;
    }

    @Data
    public static class ThreatIntelProperties {
        private boolean enabled = false;
        private String url = "";
        private String apiKey = "";
        private Duration timeout = Duration.ofMillis(20);
        private int cacheSize = 1_000;
    }

    @Data
    public static class AuditProperties {
        private boolean enabled = true;
        private String directory = "audit";
    }

    @Data
    public static class ActionProperties {
        private String executor = "logging";
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/guard";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 2000;
        private long readTimeout = 2000;
        private long writeTimeout = 2000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
