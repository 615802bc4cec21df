package dev.shellspec.engine.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesSeconds() {
        Optional<Duration> duration = DurationParser.parse("30s");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ofSeconds(30), duration.get());
    }

    @Test
    void parsesMinutesAndHours() {
        assertEquals(Optional.of(Duration.ofMinutes(2)), DurationParser.parse("2m"));
        assertEquals(Optional.of(Duration.ofHours(1)), DurationParser.parse("1h"));
    }

    @Test
    void parsesMillisecondsByDefault() {
        assertEquals(Optional.of(Duration.ofMillis(1500)), DurationParser.parse("1500"));
        assertEquals(Optional.of(Duration.ofMillis(250)), DurationParser.parse("250ms"));
    }

    @Test
    void zeroAndNoneMeanNoTimeout() {
        assertTrue(DurationParser.parse("0").isEmpty());
        assertTrue(DurationParser.parse("none").isEmpty());
        assertTrue(DurationParser.parse(null).isEmpty());
    }

    @Test
    void rejectsGarbageAndNegativeValues() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("soon"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("-5s"));
    }

    @Test
    void formatsWithLargestExactUnit() {
        assertEquals("2m", DurationParser.format(Duration.ofSeconds(120)));
        assertEquals("90s", DurationParser.format(Duration.ofSeconds(90)));
        assertEquals("1500ms", DurationParser.format(Duration.ofMillis(1500)));
    }
}
