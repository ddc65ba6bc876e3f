package com.coursecatalog.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the free-form time notation of a listing line into a 24-hour start/end pair.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Dash variants and the word "to" between times are normalized to a single {@code -}.</li>
 *   <li>The grammars of {@link TimeGrammar} are tried in order; a range grammar only counts if its
 *   end is strictly after its start.</li>
 *   <li>The full line is tried first, then the isolated Time column. If neither yields a value
 *   the result is {@link TimeRange#TBA}, never a guess.</li>
 *   <li>When the matched text says "pm" and never "am", morning times are moved to the afternoon.</li>
 * </ul>
 * Stateless and safe to share between threads.
 *
 * @author Course Catalog Scraper Team
 * @since 1.0
 */
public class TimeRangeParser {
    private static final Logger logger = LoggerFactory.getLogger(TimeRangeParser.class);

    private static final int NOON = 12 * 60;

    private static final Pattern UNICODE_DASHES = Pattern.compile("[‐‑‒–—―−]");
    private static final Pattern TO_SEPARATOR = Pattern.compile("(?i)(?<=\\S)\\s+to\\s+(?=\\d)");
    private static final Pattern SPACED_DASH = Pattern.compile("\\s*-\\s*");

    private static final Pattern MERIDIEM_RANGE = Pattern.compile(
        "(?i)(?<![\\d:])(\\d{1,2})(?::([0-5]\\d))?\\s*(?:([ap])\\.?m\\.?)?"
            + "-(\\d{1,2})(?::([0-5]\\d))?\\s*(?:([ap])\\.?m\\.?)?(?![a-z0-9])");
    private static final Pattern TWENTY_FOUR_HOUR_RANGE = Pattern.compile(
        "(?<![\\d:])([01]?\\d|2[0-3]):([0-5]\\d)-([01]?\\d|2[0-3]):([0-5]\\d)(?![\\d:])");
    private static final Pattern DIGIT_RANGE = Pattern.compile("(?<![\\d:])(\\d{3,4})-(\\d{3,4})(?![\\d:])");
    private static final Pattern SINGLE_CLOCK = Pattern.compile(
        "(?i)(?<![\\d:])(\\d{1,2})(?::([0-5]\\d))?\\s*(?:([ap])\\.?m\\.?)?(?![a-z0-9:])");
    private static final Pattern DIGIT_TOKEN = Pattern.compile("\\d{3,4}");
    private static final Pattern PLACEHOLDER = Pattern.compile("(?i)\\b(?:TBA|TBD|ARR)\\b|to be announced");

    private static final Pattern PM_TOKEN = Pattern.compile("(?i)(?<![a-z])p\\.?m\\b\\.?");
    private static final Pattern AM_TOKEN = Pattern.compile("(?i)(?<![a-z])a\\.?m\\b\\.?");

    private record Step(TimeGrammar grammar, Function<String, TimeParseOutcome> matcher) {}

    private static final List<Step> STEPS = List.of(
        new Step(TimeGrammar.MERIDIEM_RANGE, TimeRangeParser::matchMeridiemRange),
        new Step(TimeGrammar.TWENTY_FOUR_HOUR_RANGE, TimeRangeParser::matchTwentyFourHourRange),
        new Step(TimeGrammar.DIGIT_RANGE, TimeRangeParser::matchDigitRange),
        new Step(TimeGrammar.SINGLE_TIME, TimeRangeParser::matchSingleTime),
        new Step(TimeGrammar.TBA, TimeRangeParser::matchPlaceholder)
    );

    /**
     * Parses the meeting time of one listing line.
     * @param fullLine The complete source line (may be null)
     * @param timeColumn The Time column cut from that line (may be null)
     * @return Normalized TimeRange; {@link TimeRange#TBA} if nothing trustworthy was found
     */
    public TimeRange parse(String fullLine, String timeColumn) {
        String line = normalizeSeparators(fullLine);
        String column = normalizeSeparators(timeColumn);
        boolean conflict = hasMeridiem(line) && hasMeridiem(column) && isPmOnly(line) != isPmOnly(column);
        if (conflict) {
            logger.debug("Meridiem markers disagree between line '{}' and time column '{}'", line, column);
        }

        TimeParseOutcome outcome = attempt(line);
        TimeRange.Source source = TimeRange.Source.FULL_LINE;
        String matchedText = line;
        // a TBA anywhere on the line (room, title) must not hide a readable Time column
        if (!outcome.isMatched()) {
            logger.debug("Full line gave {} for '{}', retrying on time column '{}'", outcome.status(), line, column);
            outcome = attempt(column);
            source = TimeRange.Source.TIME_COLUMN;
            matchedText = column;
        }
        if (!outcome.isMatched()) {
            return TimeRange.TBA.withSource(TimeRange.Source.NONE, conflict);
        }

        String start = outcome.startTime();
        String end = outcome.endTime();
        if (isPmOnly(matchedText)) {
            String coercedStart = toAfternoon(start);
            String coercedEnd = toAfternoon(end);
            if (outcome.grammar().isRange() && TimeRange.toMinutes(coercedEnd) <= TimeRange.toMinutes(coercedStart)) {
                logger.debug("PM coercion of {}-{} would reverse the range; keeping it", start, end);
            } else {
                start = coercedStart;
                end = coercedEnd;
            }
        }
        return new TimeRange(start, end, outcome.grammar(), source, matchedText, conflict);
    }

    /**
     * Runs the grammars in order over one text.
     * @return The first MATCHED or PLACEHOLDER outcome, otherwise NOT_INCREASING if any range was
     * rejected for running backwards, otherwise NO_MATCH
     */
    TimeParseOutcome attempt(String text) {
        if (text == null || text.isBlank()) return TimeParseOutcome.noMatch(TimeGrammar.TBA);
        TimeParseOutcome failure = TimeParseOutcome.noMatch(TimeGrammar.TBA);
        for (Step step : STEPS) {
            TimeParseOutcome outcome = step.matcher().apply(text);
            if (outcome.isMatched() || outcome.status() == TimeParseOutcome.Status.PLACEHOLDER) {
                return outcome;
            }
            if (outcome.status() == TimeParseOutcome.Status.NOT_INCREASING) {
                failure = outcome;
            }
        }
        return failure;
    }

    static String normalizeSeparators(String text) {
        if (text == null) return "";
        String s = UNICODE_DASHES.matcher(text).replaceAll("-");
        s = TO_SEPARATOR.matcher(s).replaceAll("-");
        return SPACED_DASH.matcher(s).replaceAll("-");
    }

    // --- grammars ---

    static TimeParseOutcome matchMeridiemRange(String text) {
        Matcher m = MERIDIEM_RANGE.matcher(normalizeSeparators(text));
        boolean sawRange = false;
        while (m.find()) {
            Character mer1 = meridiem(m.group(3));
            Character mer2 = meridiem(m.group(6));
            if (mer1 == null && mer2 == null) continue;
            int h1 = Integer.parseInt(m.group(1));
            int min1 = minutes(m.group(2));
            int h2 = Integer.parseInt(m.group(4));
            int min2 = minutes(m.group(5));
            if (h1 < 1 || h1 > 12 || h2 < 1 || h2 > 12) continue;

            if (mer1 == null) {
                mer1 = inferMeridiem(h1, min1, h2, min2, mer2, true);
            } else if (mer2 == null) {
                mer2 = inferMeridiem(h2, min2, h1, min1, mer1, false);
            }
            int start = to24(h1, min1, mer1);
            int end = to24(h2, min2, mer2);
            sawRange = true;
            if (end > start) {
                return TimeParseOutcome.matched(TimeGrammar.MERIDIEM_RANGE, TimeRange.fromMinutes(start), TimeRange.fromMinutes(end));
            }
        }
        return sawRange ? TimeParseOutcome.notIncreasing(TimeGrammar.MERIDIEM_RANGE) : TimeParseOutcome.noMatch(TimeGrammar.MERIDIEM_RANGE);
    }

    /**
     * Meridiem for the unmarked side of a range.
     * An explicit PM with a larger hour on the other side ("11:00-1:15 PM") keeps that side PM only
     * if the range still runs forwards; anything else copies the explicit marker.
     */
    private static char inferMeridiem(int hour, int min, int explicitHour, int explicitMin, char explicit, boolean otherIsStart) {
        if (explicit == 'p' && hour > explicitHour) {
            int other = to24(hour, min, 'p');
            int known = to24(explicitHour, explicitMin, 'p');
            boolean increasing = otherIsStart ? known > other : other > known;
            return increasing ? 'p' : 'a';
        }
        return explicit;
    }

    static TimeParseOutcome matchTwentyFourHourRange(String text) {
        Matcher m = TWENTY_FOUR_HOUR_RANGE.matcher(normalizeSeparators(text));
        boolean sawRange = false;
        while (m.find()) {
            int start = Integer.parseInt(m.group(1)) * 60 + Integer.parseInt(m.group(2));
            int end = Integer.parseInt(m.group(3)) * 60 + Integer.parseInt(m.group(4));
            sawRange = true;
            if (end > start) {
                return TimeParseOutcome.matched(TimeGrammar.TWENTY_FOUR_HOUR_RANGE, TimeRange.fromMinutes(start), TimeRange.fromMinutes(end));
            }
        }
        return sawRange ? TimeParseOutcome.notIncreasing(TimeGrammar.TWENTY_FOUR_HOUR_RANGE) : TimeParseOutcome.noMatch(TimeGrammar.TWENTY_FOUR_HOUR_RANGE);
    }

    static TimeParseOutcome matchDigitRange(String text) {
        Matcher m = DIGIT_RANGE.matcher(normalizeSeparators(text));
        boolean sawRange = false;
        while (m.find()) {
            int start = hhmm(m.group(1));
            int end = hhmm(m.group(2));
            if (start < 0 || end < 0) continue;
            sawRange = true;
            if (end > start) {
                return TimeParseOutcome.matched(TimeGrammar.DIGIT_RANGE, TimeRange.fromMinutes(start), TimeRange.fromMinutes(end));
            }
        }
        return sawRange ? TimeParseOutcome.notIncreasing(TimeGrammar.DIGIT_RANGE) : TimeParseOutcome.noMatch(TimeGrammar.DIGIT_RANGE);
    }

    /**
     * Exactly one clock time in the text ({@code 14:10}, {@code 2:10 PM}, {@code 2pm}); a bare
     * {@code HHMM} token only counts when it is the whole text, so course and call numbers on a
     * full line are never read as times.
     */
    static TimeParseOutcome matchSingleTime(String text) {
        String s = normalizeSeparators(text).trim();
        if (DIGIT_TOKEN.matcher(s).matches()) {
            int t = hhmm(s);
            return t < 0 ? TimeParseOutcome.noMatch(TimeGrammar.SINGLE_TIME)
                : TimeParseOutcome.matched(TimeGrammar.SINGLE_TIME, TimeRange.fromMinutes(t), TimeRange.fromMinutes(t));
        }
        Matcher m = SINGLE_CLOCK.matcher(s);
        int found = 0;
        int value = -1;
        while (m.find()) {
            Character mer = meridiem(m.group(3));
            if (m.group(2) == null && mer == null) continue;
            int h = Integer.parseInt(m.group(1));
            int min = minutes(m.group(2));
            if (mer != null ? (h < 1 || h > 12) : h > 23) continue;
            found++;
            value = mer != null ? to24(h, min, mer) : h * 60 + min;
        }
        if (found != 1) return TimeParseOutcome.noMatch(TimeGrammar.SINGLE_TIME);
        String t = TimeRange.fromMinutes(value);
        return TimeParseOutcome.matched(TimeGrammar.SINGLE_TIME, t, t);
    }

    static TimeParseOutcome matchPlaceholder(String text) {
        return PLACEHOLDER.matcher(text).find() ? TimeParseOutcome.placeholder() : TimeParseOutcome.noMatch(TimeGrammar.TBA);
    }

    // --- helpers ---

    static boolean isPmOnly(String text) {
        return text != null && PM_TOKEN.matcher(text).find() && !AM_TOKEN.matcher(text).find();
    }

    static boolean hasMeridiem(String text) {
        return text != null && (PM_TOKEN.matcher(text).find() || AM_TOKEN.matcher(text).find());
    }

    private static String toAfternoon(String hhmm) {
        int t = TimeRange.toMinutes(hhmm);
        return t >= 0 && t < NOON ? TimeRange.fromMinutes(t + NOON) : hhmm;
    }

    private static Character meridiem(String group) {
        return group == null ? null : Character.toLowerCase(group.charAt(0));
    }

    private static int minutes(String group) {
        return group == null ? 0 : Integer.parseInt(group);
    }

    private static int to24(int hour, int min, char meridiem) {
        int h = hour % 12;
        if (meridiem == 'p') h += 12;
        return h * 60 + min;
    }

    // HHMM / HMM token to minutes, -1 if it is not a valid clock value
    private static int hhmm(String token) {
        int v = Integer.parseInt(token);
        int h = v / 100;
        int m = v % 100;
        if (h > 23 || m > 59) return -1;
        return h * 60 + m;
    }
}
