package me.golemcore.guard.domain.detection;

import me.golemcore.guard.domain.model.ViolationRecord;
import me.golemcore.guard.domain.model.ViolationSeverity;
import me.golemcore.guard.domain.model.ViolationType;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.golemcore.guard.domain.detection.DetectionFixtures.T0;
import static me.golemcore.guard.domain.detection.DetectionFixtures.context;
import static me.golemcore.guard.domain.detection.DetectionFixtures.message;
import static me.golemcore.guard.domain.detection.DetectionFixtures.messageWithMentions;
import static org.junit.jupiter.api.Assertions.*;

class ContentRuleDetectorsTest {

    private GuardProperties properties;

    @BeforeEach
    void setUp() {
        properties = new GuardProperties();
    }

    // ===== Caps =====

    @Test
    void capsAbuseAboveRatio() {
        CapsAbuseDetector detector = new CapsAbuseDetector(properties);

        ViolationRecord violation = detector.detect(context(message("WHY IS NOBODY ANSWERING", T0), properties))
                .findViolation().orElseThrow();

        assertEquals(ViolationType.CAPS_ABUSE, violation.type());
        assertEquals(ViolationSeverity.MINOR, violation.severity());
    }

    @Test
    void capsIgnoresShortMessagesAndDigits() {
        CapsAbuseDetector detector = new CapsAbuseDetector(properties);

        assertFalse(detector.detect(context(message("OK THEN", T0), properties)).findViolation().isPresent());
        assertFalse(detector.detect(context(message("1234567890 !!!", T0), properties)).findViolation()
                .isPresent());
        assertFalse(detector.detect(context(message("Hello There Everyone", T0), properties)).findViolation()
                .isPresent());
    }

    // ===== Mentions =====

    @Test
    void mentionSpamCountsDistinctMentions() {
        MentionSpamDetector detector = new MentionSpamDetector(properties);

        assertFalse(detector.detect(context(messageWithMentions("hi", List.of("a", "b", "b", "c")), properties))
                .findViolation().isPresent());

        ViolationRecord minor = detector.detect(context(messageWithMentions("hi", List.of("a", "b", "c", "d")),
                properties)).findViolation().orElseThrow();
        assertEquals(ViolationType.MENTION_SPAM, minor.type());
        assertEquals(ViolationSeverity.MINOR, minor.severity());

        ViolationRecord moderate = detector.detect(context(messageWithMentions("hi",
                List.of("a", "b", "c", "d", "e", "f", "g", "h")), properties)).findViolation().orElseThrow();
        assertEquals(ViolationSeverity.MODERATE, moderate.severity());
    }

    // ===== NSFW =====

    @Test
    void nsfwKeywordIsFlagged() {
        NsfwContentDetector detector = new NsfwContentDetector(properties);

        ViolationRecord violation = detector.detect(context(message("check my nsfw pics", T0), properties))
                .findViolation().orElseThrow();

        assertEquals(ViolationType.NSFW_CONTENT, violation.type());
    }

    @Test
    void nsfwDetectionCanBeDisabled() {
        properties.getDetection().setNsfwEnabled(false);
        NsfwContentDetector detector = new NsfwContentDetector(properties);

        assertFalse(detector.detect(context(message("check my nsfw pics", T0), properties)).findViolation()
                .isPresent());
    }

    // ===== Distress =====

    @Test
    void distressSignalIsNonPunitive() {
        DistressSignalDetector detector = new DistressSignalDetector();

        ViolationRecord violation = detector.detect(context(message("i feel so hopeless today", T0), properties))
                .findViolation().orElseThrow();

        assertEquals(ViolationType.EMOTIONAL_DISTRESS, violation.type());
        assertEquals(ViolationSeverity.MINOR, violation.severity());
        assertFalse(violation.isPunitive());
    }

    @Test
    void distressIgnoresThirdPersonStatements() {
        DistressSignalDetector detector = new DistressSignalDetector();

        assertFalse(detector.detect(context(message("this patch notes thread is depressing", T0), properties))
                .findViolation().isPresent());
    }
}
