package me.golemcore.guard.domain.detection;

import me.golemcore.guard.domain.model.ViolationRecord;
import me.golemcore.guard.domain.model.ViolationSeverity;
import me.golemcore.guard.domain.model.ViolationType;
import me.golemcore.guard.infrastructure.config.GuardProperties;
import me.golemcore.guard.window.InMemorySlidingWindowTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static me.golemcore.guard.domain.detection.DetectionFixtures.T0;
import static me.golemcore.guard.domain.detection.DetectionFixtures.message;
import static me.golemcore.guard.domain.detection.DetectionFixtures.recorded;
import static org.junit.jupiter.api.Assertions.*;

class IdenticalMessageSpamDetectorTest {

    private GuardProperties properties;
    private InMemorySlidingWindowTracker tracker;
    private IdenticalMessageSpamDetector detector;

    @BeforeEach
    void setUp() {
        properties = new GuardProperties();
        tracker = new InMemorySlidingWindowTracker(properties);
        detector = new IdenticalMessageSpamDetector(tracker, properties);
    }

    @Test
    void thirdIdenticalMessageWithinTimeframeIsSpam() {
        assertFalse(detector.detect(recorded(message("gg", T0), tracker, properties)).findViolation().isPresent());
        assertFalse(detector.detect(recorded(message("gg", T0.plusSeconds(5)), tracker, properties))
                .findViolation().isPresent());

        DetectorResult third = detector.detect(recorded(message("GG ", T0.plusSeconds(10)), tracker, properties));

        ViolationRecord violation = third.findViolation().orElseThrow();
        assertEquals(ViolationType.SPAM, violation.type());
        assertEquals(ViolationSeverity.MODERATE, violation.severity());
        assertEquals(3, violation.evidence().get("identicalMessages"));
    }

    @Test
    void messagesOutsideTimeframeDoNotCount() {
        recorded(message("gg", T0), tracker, properties);
        recorded(message("gg", T0.plusSeconds(5)), tracker, properties);

        DetectorResult result = detector.detect(recorded(message("gg", T0.plusSeconds(36)), tracker, properties));

        assertFalse(result.findViolation().isPresent());
    }

    @Test
    void differentTextIsNotCounted() {
        recorded(message("gg", T0), tracker, properties);
        recorded(message("good game", T0.plusSeconds(1)), tracker, properties);

        DetectorResult result = detector.detect(recorded(message("gg", T0.plusSeconds(2)), tracker, properties));

        assertFalse(result.findViolation().isPresent());
    }
}
