package io.taskrunner4j.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HumanDurationTest {

    @Test
    void parseSpelledOutDurationShouldWork() {
        assertEquals(Duration.ofMinutes(5), HumanDuration.parse("5 minutes"));
        assertEquals(Duration.ofHours(27), HumanDuration.parse("1 day 3 hours"));
    }

    @Test
    void parseCompactChainedUnitsShouldWork() {
        assertEquals(Duration.ofMinutes(90), HumanDuration.parse("1h30m"));
        assertEquals(Duration.ofSeconds(30), HumanDuration.parse("30s"));
    }

    @Test
    void plainNumberShouldMeanSeconds() {
        assertEquals(Duration.ofSeconds(90), HumanDuration.parse("90"));
    }

    @Test
    void invalidInputShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> HumanDuration.parse(""));
        assertThrows(IllegalArgumentException.class, () -> HumanDuration.parse("0"));
        assertThrows(IllegalArgumentException.class, () -> HumanDuration.parse("2 months"));
        assertThrows(IllegalArgumentException.class, () -> HumanDuration.parse("5m 3m"));
        assertThrows(IllegalArgumentException.class, () -> HumanDuration.parse("every 5 minutes"));
    }

    @Test
    void overflowingAmountShouldBeRejectedAsOutOfRange() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> HumanDuration.parse("9999999999999999 weeks"));
        assertEquals("Interval value out of range: 9999999999999999 weeks", ex.getMessage());
    }
}
