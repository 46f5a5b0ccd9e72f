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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.guard.domain.model.ChatMessage;
import me.golemcore.guard.domain.model.ProfileKey;
import me.golemcore.guard.domain.model.SecurityProfile;
import me.golemcore.guard.domain.model.SlidingWindowEntry;
import me.golemcore.guard.domain.model.ViolationRecord;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import me.golemcore.guard.security.PatternLibrary;
import me.golemcore.guard.security.PatternLibraryHolder;
import me.golemcore.guard.window.MessageFingerprints;
import me.golemcore.guard.window.SlidingWindowTracker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every enabled {@link ViolationDetector} against one message.
 *
 * <p>
 * The message is recorded into the sliding window once, before any detector
 * runs, so window counts include it. Detectors then run concurrently on the
 * detector executor and the pipeline waits at most
 * {@code guard.detection.evaluation-budget} for them. A detector that throws,
 * fails, or misses the budget is logged as degraded and contributes no
 * finding. {@link #evaluate} never throws.
 *
 * <p>
 * The primary violation has the highest severity; ties go to the type with the
 * higher {@link me.golemcore.guard.domain.model.ViolationType#getTiePriority()}.
 */
@Component
@Slf4j
public class ViolationDetectionPipeline {

    static final Comparator<ViolationRecord> PRIMARY_ORDER = Comparator
            .comparingInt((ViolationRecord v) -> v.severity().getLevel())
            .thenComparingInt(v -> v.type().getTiePriority());

    private final List<ViolationDetector> detectors;
    private final SlidingWindowTracker windowTracker;
    private final PatternLibraryHolder patternLibraryHolder;
    private final GuardProperties properties;
    private final Executor detectorExecutor;
    private final Clock clock;

    public ViolationDetectionPipeline(List<ViolationDetector> detectors, SlidingWindowTracker windowTracker,
            PatternLibraryHolder patternLibraryHolder, GuardProperties properties,
            @Qualifier("detectorExecutor") Executor detectorExecutor, Clock clock) {
        this.detectors = List.copyOf(detectors);
        this.windowTracker = windowTracker;
        this.patternLibraryHolder = patternLibraryHolder;
        this.properties = properties;
        this.detectorExecutor = detectorExecutor;
        this.clock = clock;
    }

    public DetectionReport evaluate(ChatMessage message, SecurityProfile profileSnapshot) {
        Instant now = message.getTimestamp() != null ? message.getTimestamp() : clock.instant();
        ProfileKey userKey = message.getProfileKey();
        PatternLibrary patterns = patternLibraryHolder.current();

        String content = message.getContentOrEmpty();
        SlidingWindowEntry entry = new SlidingWindowEntry(
                MessageFingerprints.fingerprint(content),
                MessageFingerprints.tokens(content),
                now,
                message.getChannelId());
        windowTracker.record(userKey, entry);

        DetectionContext context = new DetectionContext(message, userKey, profileSnapshot, patterns, entry, now);

        Map<String, CompletableFuture<DetectorResult>> running = new LinkedHashMap<>();
        for (ViolationDetector detector : activeDetectors()) {
            running.put(detector.getName(),
                    CompletableFuture.supplyAsync(() -> runSafely(detector, context), detectorExecutor));
        }

        List<ViolationRecord> violations = new ArrayList<>();
        List<String> degraded = new ArrayList<>();
        long deadline = System.nanoTime() + properties.getDetection().getEvaluationBudget().toNanos();
        for (Map.Entry<String, CompletableFuture<DetectorResult>> task : running.entrySet()) {
            DetectorResult result = await(task.getKey(), task.getValue(), deadline);
            if (result.isFailed()) {
                log.warn("[Detection] Detector '{}' degraded: {}", result.detector(), result.failureReason());
                degraded.add(result.detector());
                continue;
            }
            result.findViolation().ifPresent(violations::add);
        }

        ViolationRecord primary = violations.stream().max(PRIMARY_ORDER).orElse(null);
        if (primary != null) {
            log.debug("[Detection] {} violation(s) for user {}, primary={}/{}", violations.size(), userKey,
                    primary.type(), primary.severity());
        }
        return new DetectionReport(violations, primary, degraded, patterns.getVersion());
    }

    private List<ViolationDetector> activeDetectors() {
        Set<String> disabled = Set.copyOf(properties.getDetection().getDisabledDetectors());
        return detectors.stream()
                .filter(detector -> !disabled.contains(detector.getName()))
                .toList();
    }

    private DetectorResult runSafely(ViolationDetector detector, DetectionContext context) {
        try {
            DetectorResult result = detector.detect(context);
            return result != null ? result : DetectorResult.none(detector.getName());
        } catch (RuntimeException e) { // NOSONAR - a broken detector must not fail the evaluation
            return DetectorResult.failed(detector.getName(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private DetectorResult await(String name, CompletableFuture<DetectorResult> future, long deadline) {
        long remaining = Math.max(0L, deadline - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return DetectorResult.failed(name, "evaluation budget exceeded");
        } catch (ExecutionException e) {
            return DetectorResult.failed(name, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DetectorResult.failed(name, "interrupted");
        }
    }
}
