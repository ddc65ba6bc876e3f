package com.coursecatalog.scraper;

import java.util.List;

/**
 * Interface for turning listing pages into linked section records.
 */
public interface CatalogPipelineInterface {
    /**
     * Parses every page, then links recitations per subject.
     * A malformed page becomes a warning; the other pages are still returned.
     * @param pages listing pages in any subject order
     * @return Sections, skipped-page warnings and counters
     */
    PipelineResult run(List<ListingPage> pages);
}
