package com.siafu;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ScheduleTimeTest {

    private static final Instant NOW = Instant.parse("2025-05-05T10:00:00Z");

    @Test
    void shouldParseSimpleDelay() {
        ScheduleTime time = ScheduleTime.parse("delay:10s");

        assertEquals(ScheduleTime.delay(Duration.ofSeconds(10)), time);
        assertEquals(NOW.plusSeconds(10), time.resolve(NOW));
    }

    @Test
    void shouldSumCompoundDelayTerms() {
        assertEquals(Duration.ofMinutes(90), ((ScheduleTime.Delay) ScheduleTime.parse("delay:1h 30m")).duration());
        assertEquals(Duration.ofDays(14), ((ScheduleTime.Delay) ScheduleTime.parse("delay:2w")).duration());
        assertEquals(Duration.ofMillis(1500), ((ScheduleTime.Delay) ScheduleTime.parse("delay: 1s 500ms ")).duration());
    }

    @Test
    void shouldParseTimestampWithOffset() {
        assertEquals(ScheduleTime.at(Instant.parse("2025-05-05T12:00:00Z")), ScheduleTime.parse("at:2025-05-05T12:00:00Z"));
        assertEquals(Instant.parse("2025-05-05T12:00:00Z"),
                ScheduleTime.parse("at:2025-05-05T14:00:00+02:00").resolve(NOW));
    }

    @Test
    void shouldAcceptTagInAnyCase() {
        assertEquals(ScheduleTime.delay(Duration.ofMinutes(5)), ScheduleTime.parse("DELAY:5m"));
    }

    @Test
    void shouldRejectInputWithoutTag() {
        SchedulingException missingColon = assertThrows(SchedulingException.class, () -> ScheduleTime.parse("10s"));
        assertEquals(ErrorKind.INVALID_FORMAT, missingColon.getKind());

        SchedulingException emptyTag = assertThrows(SchedulingException.class, () -> ScheduleTime.parse(":10s"));
        assertEquals(ErrorKind.INVALID_FORMAT, emptyTag.getKind());
    }

    @Test
    void shouldRejectUnknownTag() {
        assertThatThrownBy(() -> ScheduleTime.parse("later:10s"))
                .isInstanceOf(SchedulingException.class)
                .extracting(e -> ((SchedulingException) e).getKind())
                .isEqualTo(ErrorKind.UNKNOWN_TAG);
    }

    @Test
    void shouldRejectMalformedValues() {
        assertEquals(ErrorKind.INVALID_DURATION,
                assertThrows(SchedulingException.class, () -> ScheduleTime.parse("delay:soon")).getKind());
        assertEquals(ErrorKind.INVALID_DURATION,
                assertThrows(SchedulingException.class, () -> ScheduleTime.parse("delay:-5s")).getKind());
        assertEquals(ErrorKind.INVALID_TIMESTAMP,
                assertThrows(SchedulingException.class, () -> ScheduleTime.parse("at:tomorrow")).getKind());
    }

    @Test
    void shouldRenderTextualFormThatParsesBack() {
        ScheduleTime delay = ScheduleTime.delay(Duration.ofMinutes(90));
        ScheduleTime at = ScheduleTime.at(Instant.parse("2025-05-05T12:00:00Z"));

        assertThat(delay.toString()).isEqualTo("delay:1h 30m");
        assertThat(at.toString()).isEqualTo("at:2025-05-05T12:00:00Z");
        assertThat(ScheduleTime.parse(delay.toString())).isEqualTo(delay);
        assertThat(ScheduleTime.parse(at.toString())).isEqualTo(at);
        assertThat(ScheduleTime.delay(Duration.ZERO).toString()).isEqualTo("delay:0s");
    }
}
