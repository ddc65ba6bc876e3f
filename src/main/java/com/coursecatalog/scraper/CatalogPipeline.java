package com.coursecatalog.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs listing pages through parsing and recitation linkage.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Pages are parsed on a fixed pool; results are collected in input order.</li>
 *   <li>A {@link MalformedPageException} turns into a {@link PageWarning} and the page is skipped.</li>
 *   <li>Sections are grouped by subject, first-seen order, and each group is linked once all its pages are parsed.</li>
 * </ul>
 * The same pages always yield the same output, whatever the pool size.
 *
 * @author Course Catalog Scraper Team
 * @since 1.0
 */
public class CatalogPipeline implements CatalogPipelineInterface {
    private static final Logger logger = LoggerFactory.getLogger(CatalogPipeline.class);

    private final SectionParserInterface parser;
    private final RecitationLinker linker;
    private final int parseThreads;

    public CatalogPipeline(SectionParserInterface parser, RecitationLinker linker, int parseThreads) {
        this.parser = parser;
        this.linker = linker;
        this.parseThreads = Math.max(1, parseThreads);
    }

    /**
     * Wires the default services from a configuration.
     * @param config  runtime settings
     * @param fetcher detail-page source, or null to link by title only
     * @return CatalogPipeline
     */
    public static CatalogPipeline create(CatalogConfig config, PageFetchServiceInterface fetcher) {
        return new CatalogPipeline(
            new SectionParser(new CatalogUrls(config.getBaseUrl())),
            new RecitationLinker(fetcher, config),
            config.getParseThreads());
    }

    @Override
    public PipelineResult run(List<ListingPage> pages) {
        if (pages == null) {
            logger.warn("run called with null pages.");
            throw new IllegalArgumentException("Pages cannot be null");
        }
        List<PageWarning> warnings = new ArrayList<>();
        ParseStats parseStats = new ParseStats();
        Map<String, List<SectionRecord>> bySubject = new LinkedHashMap<>();

        for (PageOutcome outcome : parseAll(pages)) {
            if (outcome.warning() != null) {
                warnings.add(outcome.warning());
                continue;
            }
            PageParseResult result = outcome.result();
            parseStats.add(result.stats());
            for (SectionRecord s : result.sections()) {
                bySubject.computeIfAbsent(s.subject(), k -> new ArrayList<>()).add(s);
            }
        }

        LinkStats linkStats = new LinkStats();
        List<SectionRecord> sections = new ArrayList<>();
        for (Map.Entry<String, List<SectionRecord>> e : bySubject.entrySet()) {
            LinkReport report = linker.linkWithReport(e.getValue());
            linkStats.add(report.stats());
            sections.addAll(report.sections());
        }
        logger.info("Pipeline finished: {} page(s), {} section(s), {} warning(s)", pages.size(), sections.size(), warnings.size());
        return new PipelineResult(sections, warnings, parseStats, linkStats);
    }

    private List<PageOutcome> parseAll(List<ListingPage> pages) {
        List<PageOutcome> outcomes = new ArrayList<>(pages.size());
        if (pages.isEmpty()) return outcomes;
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parseThreads, pages.size()));
        try {
            List<Future<PageParseResult>> futures = new ArrayList<>(pages.size());
            for (ListingPage page : pages) {
                futures.add(pool.submit(() -> parser.parsePage(page.subject(), page.term(), page.text())));
            }
            for (int i = 0; i < futures.size(); i++) {
                ListingPage page = pages.get(i);
                try {
                    outcomes.add(new PageOutcome(futures.get(i).get(), null));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof MalformedPageException mpe) {
                        logger.warn("Skipping page {}: {}", mpe.getPageId(), mpe.getMessage());
                        outcomes.add(new PageOutcome(null, new PageWarning(mpe.getPageId(), mpe.getMessage())));
                    } else if (cause instanceof RuntimeException re) {
                        throw re;
                    } else {
                        throw new IllegalStateException("Failed to parse " + page.pageId(), cause);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while parsing " + page.pageId(), e);
                }
            }
        } finally {
            pool.shutdownNow();
        }
        return outcomes;
    }

    private record PageOutcome(PageParseResult result, PageWarning warning) { }
}
