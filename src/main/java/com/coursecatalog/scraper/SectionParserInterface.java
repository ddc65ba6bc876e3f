package com.coursecatalog.scraper;

/**
 * Interface for turning one subject listing page into section records.
 */
public interface SectionParserInterface {
    /**
     * Parses a listing page.
     * @param subject Subject code the page belongs to (e.g. "COMS")
     * @param term Term label (e.g. "Fall 2025")
     * @param text Plain-text listing, or the HTML page wrapping it
     * @return Accepted sections in source order, with the page's counters
     * @throws MalformedPageException if the page has no header line
     */
    PageParseResult parsePage(String subject, String term, String text) throws MalformedPageException;
}
