package me.golemcore.guard.adapter.outbound.action;

import me.golemcore.guard.domain.model.ChatMessage;
import me.golemcore.guard.domain.model.ModerationOutcome;
import me.golemcore.guard.domain.model.ProfileKey;
import me.golemcore.guard.domain.model.PunishmentDecision;
import me.golemcore.guard.domain.model.PunishmentType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class LoggingActionExecutorAdapterTest {

    private final LoggingActionExecutorAdapter adapter = new LoggingActionExecutorAdapter();

    private static ChatMessage message() {
        return ChatMessage.builder()
                .messageId("m-1")
                .userId("alice")
                .guildId("guild-1")
                .channelId("general")
                .content("gg")
                .build();
    }

    @Test
    void timeoutWithDeletionCompletes() {
        ModerationOutcome outcome = ModerationOutcome.builder()
                .messageId("m-1")
                .profileKey(ProfileKey.of("guild-1", "alice"))
                .decision(new PunishmentDecision(PunishmentType.TIMEOUT, Duration.ofMinutes(30), 3, "spam"))
                .deleteMessage(true)
                .build();

        CompletableFuture<Void> applied = adapter.apply(outcome, message());

        assertTrue(applied.isDone());
        assertFalse(applied.isCompletedExceptionally());
    }

    @Test
    void supportiveOutcomeCompletes() {
        ModerationOutcome outcome = ModerationOutcome.builder()
                .messageId("m-1")
                .profileKey(ProfileKey.of("guild-1", "alice"))
                .decision(PunishmentDecision.supportive("distress signal"))
                .build();

        assertDoesNotThrow(() -> adapter.apply(outcome, message()).join());
    }
}
