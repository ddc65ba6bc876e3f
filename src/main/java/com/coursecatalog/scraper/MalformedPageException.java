package com.coursecatalog.scraper;

/**
 * Raised when a listing page has no recognisable header line.
 * The page is skipped; the rest of the batch carries on.
 */
public class MalformedPageException extends Exception {
    private final String pageId;

    public MalformedPageException(String pageId, String message) {
        super(message);
        this.pageId = pageId;
    }

    public String getPageId() {
        return pageId;
    }
}
