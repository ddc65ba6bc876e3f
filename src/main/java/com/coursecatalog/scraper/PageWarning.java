package com.coursecatalog.scraper;

/**
 * A page the pipeline skipped, and why.
 */
public record PageWarning(String pageId, String message) {
}
