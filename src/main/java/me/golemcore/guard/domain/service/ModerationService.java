package me.golemcore.guard.domain.service;

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
import me.golemcore.guard.domain.detection.DetectionReport;
import me.golemcore.guard.domain.detection.ViolationDetectionPipeline;
import me.golemcore.guard.domain.model.ActionExecutionFailedEvent;
import me.golemcore.guard.domain.model.ChatMessage;
import me.golemcore.guard.domain.model.ModerationOutcome;
import me.golemcore.guard.domain.model.ProfileKey;
import me.golemcore.guard.domain.model.PunishmentDecision;
import me.golemcore.guard.domain.model.RiskAssessment;
import me.golemcore.guard.domain.model.SecurityProfile;
import me.golemcore.guard.domain.model.ViolationRecord;
import me.golemcore.guard.infrastructure.event.SpringEventBus;
import me.golemcore.guard.port.outbound.ActionExecutorPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point of the moderation engine.
 *
 * <p>
 * Every inbound message becomes one evaluation task, serialized per user by
 * {@link UserModerationCoordinator}:
 * <ol>
 * <li>load the profile and catch up passive recovery</li>
 * <li>run the detection pipeline</li>
 * <li>apply the violations to trust and decide the punishment</li>
 * <li>save the profile, write the audit trail, hand the outcome to the
 * {@link ActionExecutorPort}</li>
 * </ol>
 *
 * <p>
 * Action failures are logged, audited and published as
 * {@link ActionExecutionFailedEvent}; they never fail the evaluation itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModerationService {

    private final UserModerationCoordinator coordinator;
    private final ViolationDetectionPipeline pipeline;
    private final TrustRiskEngine trustRiskEngine;
    private final PunishmentEscalationEngine escalationEngine;
    private final ProfileRepository profileRepository;
    private final ModerationAuditService auditService;
    private final MessageLifecycleRegistry lifecycleRegistry;
    private final ActionExecutorPort actionExecutor;
    private final SpringEventBus eventBus;
    private final Clock clock;

    public CompletableFuture<ModerationOutcome> moderate(ChatMessage message) {
        Objects.requireNonNull(message, "message");
        if (message.getTimestamp() == null) {
            message.setTimestamp(clock.instant());
        }
        ProfileKey key = message.getProfileKey();
        return coordinator.submit(key, () -> evaluate(message))
                .whenComplete((outcome, error) -> {
                    if (error instanceof RejectedExecutionException) {
                        auditService.recordEvaluationDropped(key, message.getMessageId(), error.getMessage(),
                                clock.instant());
                    }
                });
    }

    /**
     * The author deleted the message; a pending evaluation will not request
     * its deletion.
     */
    public void onMessageDeleted(String messageId) {
        lifecycleRegistry.markDeleted(messageId, clock.instant());
    }

    public void onMessageEdited(String messageId) {
        lifecycleRegistry.markEdited(messageId, clock.instant());
    }

    /**
     * Record a helpful contribution by the user (called by the host).
     */
    public CompletableFuture<SecurityProfile> creditPositiveContribution(ProfileKey key) {
        return coordinator.submit(key, () -> {
            Instant now = clock.instant();
            ProfileRepository.LoadedProfile loaded = profileRepository.load(key, now);
            SecurityProfile updated = trustRiskEngine.creditPositiveContribution(loaded.profile());
            profileRepository.save(updated, loaded.verified(), now);
            return updated;
        });
    }

    ModerationOutcome evaluate(ChatMessage message) {
        Instant now = message.getTimestamp();
        ProfileKey key = message.getProfileKey();

        ProfileRepository.LoadedProfile loaded = profileRepository.load(key, now);
        SecurityProfile profile = trustRiskEngine.recoverUntil(loaded.profile(), now);
        profile = trustRiskEngine.observeMessage(profile, message);

        DetectionReport report = pipeline.evaluate(message, profile.copy());

        PunishmentDecision decision = PunishmentDecision.none();
        if (report.hasViolations()) {
            profile = trustRiskEngine.applyViolations(profile, report.violations(), report.primary());
            decision = escalationEngine.decide(profile, report.primary(), report.violations());
            if (!loaded.verified()) {
                decision = escalationEngine.capForUnverifiedProfile(decision);
            }
            if (decision.type().isPunitive()) {
                profile.setPunishmentLevel(decision.level());
            }
        }

        boolean saved = profileRepository.save(profile, loaded.verified(), now);
        if (!saved) {
            auditService.recordStoreUnavailable(key, loaded.verified() ? "save" : "load", now);
        }

        RiskAssessment risk = trustRiskEngine.assess(profile, now);
        boolean punitive = report.violations().stream().anyMatch(ViolationRecord::isPunitive);
        boolean withdrawn = lifecycleRegistry.isWithdrawn(message.getMessageId());

        ModerationOutcome outcome = ModerationOutcome.builder()
                .messageId(message.getMessageId())
                .profileKey(key)
                .violations(report.violations())
                .primaryViolation(report.primary())
                .decision(decision)
                .updatedTrustScore(profile.getTrustScore())
                .updatedRiskLevel(risk.riskLevel())
                .riskScore(risk.riskScore())
                .unpersisted(!saved)
                .deleteMessage(punitive && !withdrawn)
                .degradedDetectors(report.degradedDetectors())
                .evaluatedAt(now)
                .build();

        if (report.hasViolations() || !report.degradedDetectors().isEmpty()) {
            auditService.recordEvaluation(outcome);
        }
        if (report.hasViolations()) {
            log.info("[Moderation] {} -> {} (level {}, trust {}, risk {}){}", key, decision.type(), decision.level(),
                    profile.getTrustScore(), risk.riskLevel(), withdrawn ? " [message withdrawn]" : "");
        }
        if (outcome.requiresAction() || outcome.isDeleteMessage()) {
            dispatch(outcome, message);
        }
        return outcome;
    }

    private void dispatch(ModerationOutcome outcome, ChatMessage message) {
        CompletableFuture<Void> applied;
        try {
            applied = actionExecutor.apply(outcome, message);
        } catch (RuntimeException e) {
            applied = CompletableFuture.failedFuture(e);
        }
        applied.whenComplete((ignored, error) -> {
            if (error != null) {
                handleActionFailure(outcome, unwrap(error));
            }
        });
    }

    private void handleActionFailure(ModerationOutcome outcome, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        log.error("[Moderation] Failed to apply {} for {} (message {}): {}", outcome.getDecision().type(),
                outcome.getProfileKey(), outcome.getMessageId(), message, error);
        auditService.recordActionFailure(outcome, message);
        eventBus.publish(new ActionExecutionFailedEvent(outcome, message));
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
