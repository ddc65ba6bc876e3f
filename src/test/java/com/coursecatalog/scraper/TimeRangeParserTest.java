package com.coursecatalog.scraper;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Time notation parsing, fallback order and PM coercion.
 */
public class TimeRangeParserTest {
    private final TimeRangeParser parser = new TimeRangeParser();

    @ParameterizedTest
    @ValueSource(strings = {"1:10 PM-2:25 PM", "1:10PM-2:25PM", "13:10-14:25", "1310-1425", "13:10 to 14:25",
        "1:10 pm – 2:25 pm", "1:10-2:25 pm"})
    void testEquivalentNotations(String text) {
        TimeRange range = parser.parse(text, text);
        assertEquals("13:10", range.startTime(), text);
        assertEquals("14:25", range.endTime(), text);
    }

    @Test
    void testPmCoercionOnFullLine() {
        String line = "4118    001  10270  3     OPERATING SYSTEMS I           F     1:10-2:25 pm      301";
        TimeRange range = parser.parse(line, "1:10-2:25 pm");
        assertEquals("13:10", range.startTime());
        assertEquals("14:25", range.endTime());
        assertEquals(TimeRange.Source.FULL_LINE, range.source());
    }

    @Test
    void testMorningPmPropagation() {
        TimeRange range = parser.parse("11:00-1:15 PM", "11:00-1:15 PM");
        assertEquals("11:00", range.startTime());
        assertEquals("13:15", range.endTime());
    }

    @Test
    void testAmRangeKeepsMorning() {
        TimeRange range = parser.parse("10:10am-11:00am", "10:10am-11:00am");
        assertEquals("10:10", range.startTime());
        assertEquals("11:00", range.endTime());
        assertEquals(TimeGrammar.MERIDIEM_RANGE, range.grammar());
    }

    @Test
    void testSingleTimeDuplicates() {
        TimeRange range = parser.parse("14:10", "14:10");
        assertEquals("14:10", range.startTime());
        assertEquals("14:10", range.endTime());
        assertEquals(TimeGrammar.SINGLE_TIME, range.grammar());
    }

    @ParameterizedTest
    @ValueSource(strings = {"TBA", "tbd", "", "see department", "2:25-1:10"})
    void testUnparseableIsTba(String text) {
        TimeRange range = parser.parse(text, text);
        assertNull(range.startTime());
        assertNull(range.endTime());
        assertFalse(range.isAnnounced());
    }

    @Test
    void testFallsBackToTimeColumn() {
        // "9-10" has no meridiem on the line, so only the column's 24-hour form is usable
        TimeRange range = parser.parse("3134 001 10234 sec 9-10 x", "09:00-10:00");
        assertEquals("09:00", range.startTime());
        assertEquals("10:00", range.endTime());
        assertEquals(TimeRange.Source.TIME_COLUMN, range.source());
    }

    @Test
    void testPlaceholderElsewhereOnLineDoesNotHideTimeColumn() {
        TimeRange range = parser.parse("3134 001 10234 3 DATA STRUCTURES F 1410 TBA Mudd Blaer, Paul", "1410");
        assertEquals("14:10", range.startTime());
        assertEquals("14:10", range.endTime());
        assertEquals(TimeRange.Source.TIME_COLUMN, range.source());

        TimeRange tba = parser.parse("3134 001 10234 3 DATA STRUCTURES F TBA TBA Mudd Blaer, Paul", "TBA");
        assertFalse(tba.isAnnounced());
        assertEquals(TimeRange.Source.NONE, tba.source());
    }

    @Test
    void testDecreasingRangeFallsThrough() {
        assertEquals(TimeParseOutcome.Status.NOT_INCREASING, TimeRangeParser.matchTwentyFourHourRange("14:25-13:10").status());
        assertEquals(TimeParseOutcome.Status.NOT_INCREASING, TimeRangeParser.matchDigitRange("1425-1310").status());
    }

    @Test
    void testGrammarsIndependently() {
        assertEquals(TimeParseOutcome.matched(TimeGrammar.MERIDIEM_RANGE, "09:00", "10:15"),
            TimeRangeParser.matchMeridiemRange("9-10:15am"));
        assertEquals(TimeParseOutcome.Status.NO_MATCH, TimeRangeParser.matchMeridiemRange("13:10-14:25").status());
        assertEquals(TimeParseOutcome.Status.NO_MATCH, TimeRangeParser.matchSingleTime("10:10 11:00").status());
        assertEquals(TimeParseOutcome.Status.NO_MATCH, TimeRangeParser.matchSingleTime("call 10234 room 501").status());
        assertEquals(TimeParseOutcome.Status.PLACEHOLDER, TimeRangeParser.matchPlaceholder("To be announced").status());
    }

    @Test
    void testSeparatorNormalization() {
        assertEquals("1:10-2:25", TimeRangeParser.normalizeSeparators("1:10 — 2:25"));
        assertEquals("1:10-2:25", TimeRangeParser.normalizeSeparators("1:10 to 2:25"));
        assertEquals("", TimeRangeParser.normalizeSeparators(null));
    }

    @Test
    void testMeridiemConflictIsFlagged() {
        TimeRange range = parser.parse("MW 1:10-2:25 pm", "1:10am-2:25am");
        assertTrue(range.meridiemConflict());
        assertEquals("13:10", range.startTime());
    }

    @ParameterizedTest
    @ValueSource(strings = {"12:00pm-1:15pm", "11:40-12:55", "8:40am-9:55am", "7:10pm-9:40pm", "1:10-2:25 pm",
        "0900-1015", "6-9pm"})
    void testResultIsIncreasing(String text) {
        TimeRange range = parser.parse(text, text);
        if (range.isAnnounced()) {
            assertTrue(TimeRange.toMinutes(range.endTime()) > TimeRange.toMinutes(range.startTime()), text);
        } else {
            assertNull(range.endTime());
        }
    }
}
