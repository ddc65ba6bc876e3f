package com.coursecatalog.scraper;

/**
 * Outcome of linking one recitation candidate to its lecture.
 */
public record LinkResult(Status status, String parentCourseCode, Source source) {

    public enum Status {
        LINKED,
        /** More than one lecture has the same normalized title. */
        UNLINKED_AMBIGUOUS,
        /** No lecture matched. */
        UNLINKED_NO_CANDIDATE
    }

    public enum Source { DETAIL_PAGE, TITLE_MATCH, NONE }

    public static LinkResult linked(String parent, Source source) {
        return new LinkResult(Status.LINKED, parent, source);
    }

    public static LinkResult ambiguous() {
        return new LinkResult(Status.UNLINKED_AMBIGUOUS, null, Source.NONE);
    }

    public static LinkResult noCandidate() {
        return new LinkResult(Status.UNLINKED_NO_CANDIDATE, null, Source.NONE);
    }

    public boolean isLinked() {
        return status == Status.LINKED;
    }
}
