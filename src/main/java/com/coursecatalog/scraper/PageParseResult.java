package com.coursecatalog.scraper;

import java.util.List;

/**
 * Sections parsed from one listing page, in source order, with the page's counters.
 */
public record PageParseResult(String pageId, List<SectionRecord> sections, ParseStats stats) {
    public PageParseResult {
        sections = List.copyOf(sections);
    }
}
