package com.coursecatalog.scraper;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Meeting time as 24-hour {@code HH:MM} strings. Both null means "to be announced".
 *
 * @param startTime       start, or null
 * @param endTime         end, or null
 * @param grammar         which time grammar produced the value
 * @param source          whether the full line or the Time column matched
 * @param matchedText     the text the grammar matched, kept for the meridiem coercion
 * @param meridiemConflict the full line and the Time column disagree about AM/PM
 */
public record TimeRange(String startTime, String endTime, TimeGrammar grammar, Source source,
                        String matchedText, boolean meridiemConflict) {

    public enum Source { FULL_LINE, TIME_COLUMN, NONE }

    public static final TimeRange TBA = new TimeRange(null, null, TimeGrammar.TBA, Source.NONE, null, false);

    @JsonIgnore
    public boolean isAnnounced() {
        return startTime != null && endTime != null;
    }

    TimeRange withSource(Source newSource, boolean conflict) {
        return new TimeRange(startTime, endTime, grammar, newSource, matchedText, conflict);
    }

    /**
     * Minutes since midnight for an {@code HH:MM} value, or -1 if the value is null/malformed.
     */
    public static int toMinutes(String hhmm) {
        if (hhmm == null || !hhmm.matches("\\d{2}:\\d{2}")) return -1;
        int h = Integer.parseInt(hhmm.substring(0, 2));
        int m = Integer.parseInt(hhmm.substring(3));
        return h * 60 + m;
    }

    public static String fromMinutes(int minutes) {
        return String.format("%02d:%02d", minutes / 60, minutes % 60);
    }
}
