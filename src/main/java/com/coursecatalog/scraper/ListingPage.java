package com.coursecatalog.scraper;

/**
 * One fetched subject listing, plain text or HTML.
 */
public record ListingPage(String subject, String term, String text) {
    public String pageId() {
        return (subject == null ? "" : subject.trim()) + " " + (term == null ? "" : term.trim());
    }
}
