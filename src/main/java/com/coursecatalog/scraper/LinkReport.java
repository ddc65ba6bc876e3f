package com.coursecatalog.scraper;

import java.util.List;

/**
 * Linked sections of one subject batch, in input order, plus the pass's counters.
 */
public record LinkReport(List<SectionRecord> sections, LinkStats stats) {
    public LinkReport {
        sections = List.copyOf(sections);
    }
}
