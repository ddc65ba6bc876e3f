package com.coursecatalog.scraper;

/**
 * Time notations understood by {@link TimeRangeParser}, in the order they are tried.
 */
public enum TimeGrammar {
    /** {@code 1:10 PM-2:25 PM}, {@code 1:10-2:25pm}, {@code 11am to 12:15pm} */
    MERIDIEM_RANGE(true),
    /** {@code 13:10-14:25} */
    TWENTY_FOUR_HOUR_RANGE(true),
    /** {@code 1310-1425} */
    DIGIT_RANGE(true),
    /** A lone time, duplicated into start and end. */
    SINGLE_TIME(false),
    /** TBA and friends. */
    TBA(false);

    private final boolean range;

    TimeGrammar(boolean range) {
        this.range = range;
    }

    /**
     * Range grammars must produce an end strictly later than the start.
     */
    public boolean isRange() {
        return range;
    }
}
