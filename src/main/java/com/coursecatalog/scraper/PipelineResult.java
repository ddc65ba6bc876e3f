package com.coursecatalog.scraper;

import java.util.List;

/**
 * Output of one {@link CatalogPipeline} run.
 * @param sections    linked sections, grouped by subject in first-seen order
 * @param warnings    pages that were skipped
 * @param parseStats  counters summed over all parsed pages
 * @param linkStats   counters summed over all subjects
 */
public record PipelineResult(List<SectionRecord> sections, List<PageWarning> warnings,
                             ParseStats parseStats, LinkStats linkStats) {
    public PipelineResult {
        sections = List.copyOf(sections);
        warnings = List.copyOf(warnings);
    }
}
