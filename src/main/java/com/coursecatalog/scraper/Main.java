package com.coursecatalog.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point for the course catalog scraper.
 * Parses subject listings, links recitations, prints the sections as JSON on stdout
 * and logs a validation report.
 * <p>
 * Usage: {@code Main <subject> <term> [listing-file...] [--offline]}
 * <ul>
 *   <li>With listing files, each file is parsed as one page of the subject.</li>
 *   <li>Without files, the subject's text listing is downloaded from the catalog.</li>
 *   <li>{@code --offline} disables every network call; recitations are linked by title only.</li>
 * </ul>
 *
 * @author Course Catalog Scraper Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String USAGE = "Usage: Main <subject> <term> [listing-file...] [--offline]";

    /**
     * Parsed command line.
     */
    record Arguments(String subject, String term, List<Path> files, boolean offline) {
        static Arguments parse(String[] args) {
            List<String> positional = new ArrayList<>();
            boolean offline = false;
            for (String a : args == null ? new String[0] : args) {
                if ("--offline".equals(a)) offline = true;
                else positional.add(a);
            }
            if (positional.size() < 2) {
                throw new IllegalArgumentException(USAGE);
            }
            String subject = Utils.normalizeSubject(positional.get(0));
            if (subject.isEmpty()) throw new IllegalArgumentException("Subject cannot be empty");
            List<Path> files = new ArrayList<>();
            for (String f : positional.subList(2, positional.size())) files.add(Paths.get(f));
            if (files.isEmpty() && offline) {
                throw new IllegalArgumentException("--offline needs at least one listing file");
            }
            return new Arguments(subject, positional.get(1).trim(), files, offline);
        }
    }

    /**
     * Loads the listing pages named on the command line, or downloads the subject listing.
     * @param arguments Parsed arguments
     * @param fetcher   Page source used when no files are given
     * @param urls      Catalog URL builder
     * @return Pages in argument order
     * @throws IOException if a file or the listing cannot be read
     */
    static List<ListingPage> loadPages(Arguments arguments, PageFetchServiceInterface fetcher, CatalogUrls urls) throws IOException {
        List<ListingPage> pages = new ArrayList<>();
        if (arguments.files().isEmpty()) {
            String url = urls.listingTextUrl(arguments.subject(), arguments.term());
            logger.info("Downloading listing {}", url);
            pages.add(new ListingPage(arguments.subject(), arguments.term(), fetcher.fetchText(url)));
            return pages;
        }
        for (Path file : arguments.files()) {
            logger.info("Reading listing {}", file);
            pages.add(new ListingPage(arguments.subject(), arguments.term(), Utils.readListing(file)));
        }
        return pages;
    }

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
            return;
        }

        CatalogConfig config = CatalogConfig.load();
        CatalogUrls urls = new CatalogUrls(config.getBaseUrl());
        PageFetchServiceInterface fetcher = arguments.offline() ? null : new PageFetchService(config);

        try {
            List<ListingPage> pages = loadPages(arguments, fetcher, urls);
            PipelineResult result = CatalogPipeline.create(config, fetcher).run(pages);
            for (PageWarning w : result.warnings()) {
                logger.warn("Page {} skipped: {}", w.pageId(), w.message());
            }
            logger.info("Parse counters: {}", result.parseStats());
            logger.info("Link counters: {}", result.linkStats());
            logger.info("\n{}", new SectionValidator().generateValidationReport(result.sections()));
            System.out.println(Utils.toJson(result.sections()));
        } catch (IOException e) {
            logger.error("Failed to load listing for {} {}: {}", arguments.subject(), arguments.term(), e.getMessage());
            System.exit(1);
        }
    }
}
