package deferq.queue.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

import static org.junit.jupiter.api.Assertions.*;

class FrequencyTest {

    @Test
    void parsesSignAmountAndUnit() {
        Frequency f = Frequency.parse("+1 hour");
        assertEquals(1, f.sign());
        assertEquals(1, f.amount());
        assertEquals(ChronoUnit.HOURS, f.unit());
        assertTrue(f.isForward());
    }

    @Test
    void signIsOptionalAndUnitsMayBePlural() {
        Frequency f = Frequency.parse("30 minutes");
        assertEquals(1, f.sign());
        assertEquals(30, f.amount());
        assertEquals(ChronoUnit.MINUTES, f.unit());
    }

    @Test
    void parsingIsCaseInsensitiveAndToleratesWhitespace() {
        Frequency f = Frequency.parse("  + 2   DAYS ");
        assertEquals(2, f.amount());
        assertEquals(ChronoUnit.DAYS, f.unit());
    }

    @Test
    void allUnitsAreKnown() {
        assertEquals(ChronoUnit.SECONDS, Frequency.parse("+5 seconds").unit());
        assertEquals(ChronoUnit.WEEKS, Frequency.parse("+1 week").unit());
        assertEquals(ChronoUnit.MONTHS, Frequency.parse("+1 month").unit());
        assertEquals(ChronoUnit.YEARS, Frequency.parse("+1 year").unit());
    }

    @Test
    void backwardAndZeroAreNotForward() {
        assertFalse(Frequency.parse("-1 hour").isForward());
        assertFalse(Frequency.parse("+0 days").isForward());
    }

    @Test
    void rejectsSpansBeyondAThousandYears() {
        assertThrows(IllegalArgumentException.class, () -> Frequency.parse("+9223372036854775807 hours"));
        assertThrows(IllegalArgumentException.class, () -> Frequency.parse("+999999999 years"));
        assertThrows(IllegalArgumentException.class, () -> Frequency.parse("+1001 years"));
        assertThrows(IllegalArgumentException.class, () -> Frequency.parse("+99999999999999999999 seconds"));

        assertEquals(1000, Frequency.parse("+1000 years").amount());
        assertEquals(12000, Frequency.parse("+12000 months").amount());
    }

    @Test
    void rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> Frequency.parse("every hour"));
        assertThrows(IllegalArgumentException.class, () -> Frequency.parse("+1 fortnight"));
        assertThrows(IllegalArgumentException.class, () -> Frequency.parse(""));
        assertThrows(IllegalArgumentException.class, () -> Frequency.parse(null));
    }

    @Test
    void stepSecondsOnlyForTimeBasedUnits() {
        assertEquals(7200, Frequency.parse("+2 hours").stepSeconds());
        assertThrows(IllegalStateException.class, () -> Frequency.parse("+1 day").stepSeconds());
    }

    @Test
    void calendarUnitsKeepLocalTimeAcrossDst() {
        ZoneId paris = ZoneId.of("Europe/Paris");
        Instant before = Instant.parse("2023-03-25T03:00:00Z"); // 04:00+01:00

        Instant next = Frequency.parse("+1 day").addTo(before, paris, 1);

        assertEquals(Instant.parse("2023-03-26T02:00:00Z"), next); // 04:00+02:00
    }

    @Test
    void hoursMoveOnTheInstantTimeline() {
        Instant start = Instant.parse("2023-03-26T00:30:00Z");
        Instant next = Frequency.parse("+1 hour").addTo(start, ZoneId.of("Europe/Paris"), 3);
        assertEquals(Instant.parse("2023-03-26T03:30:00Z"), next);
    }

    @Test
    void monthsFromTheEndOfMonth() {
        Instant jan31 = Instant.parse("2023-01-31T10:00:00Z");
        Frequency monthly = Frequency.parse("+1 month");
        assertEquals(Instant.parse("2023-02-28T10:00:00Z"), monthly.addTo(jan31, ZoneOffset.UTC, 1));
        assertEquals(Instant.parse("2023-03-31T10:00:00Z"), monthly.addTo(jan31, ZoneOffset.UTC, 2));
    }

    @Test
    void toStringIsNormalized() {
        assertEquals("+3 days", Frequency.parse("3 day").toString());
        assertEquals("-1 hours", Frequency.parse("-1 hour").toString());
    }
}
