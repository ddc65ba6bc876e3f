package com.coursecatalog.scraper;

/**
 * Tagged result of running one {@link TimeGrammar} over a piece of text.
 */
public record TimeParseOutcome(Status status, TimeGrammar grammar, String startTime, String endTime) {

    public enum Status {
        /** The grammar matched and the values are usable. */
        MATCHED,
        /** A range matched syntactically but its end is not after its start. */
        NOT_INCREASING,
        /** The grammar did not match at all. */
        NO_MATCH,
        /** A placeholder such as TBA matched: no times. */
        PLACEHOLDER
    }

    public static TimeParseOutcome matched(TimeGrammar grammar, String start, String end) {
        return new TimeParseOutcome(Status.MATCHED, grammar, start, end);
    }

    public static TimeParseOutcome notIncreasing(TimeGrammar grammar) {
        return new TimeParseOutcome(Status.NOT_INCREASING, grammar, null, null);
    }

    public static TimeParseOutcome noMatch(TimeGrammar grammar) {
        return new TimeParseOutcome(Status.NO_MATCH, grammar, null, null);
    }

    public static TimeParseOutcome placeholder() {
        return new TimeParseOutcome(Status.PLACEHOLDER, TimeGrammar.TBA, null, null);
    }

    public boolean isMatched() {
        return status == Status.MATCHED;
    }
}
