package com.coursecatalog.scraper;

import com.coursecatalog.sitetext.ListingTextExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a column-aligned subject listing into {@link SectionRecord}s.
 * <p>
 * Workflow:
 * <ul>
 *   <li>HTML input is reduced to its {@code <pre>} text by {@link ListingTextExtractor}.</li>
 *   <li>The header line is located and turned into a {@link ColumnIndex}, once per page.</li>
 *   <li>Every following line is sliced into a {@link RawRow}; wrapped instructor names are joined by
 *   {@link ContinuationMerger}; {@link RowAcceptance} drops banners and footers.</li>
 *   <li>Accepted rows go through the field repairs: {@link TimeRangeParser} for the meeting time,
 *   {@link FieldNormalizer} for days, location and points.</li>
 * </ul>
 * Line order matters inside a page, so a page is parsed on one thread. Separate pages can be parsed
 * concurrently with the same parser instance.
 *
 * @author Course Catalog Scraper Team
 * @since 1.0
 */
public class SectionParser implements SectionParserInterface {
    private static final Logger logger = LoggerFactory.getLogger(SectionParser.class);

    private final CatalogUrls urls;
    private final TimeRangeParser timeParser = new TimeRangeParser();
    private final FieldNormalizer normalizer = new FieldNormalizer();

    public SectionParser(CatalogUrls urls) {
        this.urls = urls == null ? new CatalogUrls(CatalogConfig.DEFAULT_BASE_URL) : urls;
    }

    public SectionParser() {
        this(new CatalogUrls(CatalogConfig.DEFAULT_BASE_URL));
    }

    @Override
    public PageParseResult parsePage(String subject, String term, String text) throws MalformedPageException {
        if (subject == null || subject.isBlank()) {
            logger.warn("parsePage called without a subject code.");
            throw new IllegalArgumentException("Subject cannot be null or empty");
        }
        String pageId = subject.trim() + " " + (term == null ? "" : term.trim());
        String plain = ListingTextExtractor.toPlainText(text);
        List<String> lines = List.of(plain.split("\\R", -1));

        int headerAt = ColumnIndex.locateHeader(pageId, lines);
        ColumnIndex index = ColumnIndex.fromHeader(lines.get(headerAt));
        logger.debug("Column index for {}: {}", pageId, index);

        ParseStats stats = new ParseStats();
        ContinuationMerger merger = new ContinuationMerger();
        List<PendingSection> pending = new ArrayList<>();

        for (int i = headerAt + 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank() || ColumnIndex.isHeaderLine(line)) continue;

            RawRow row = RawRow.slice(index, line);
            boolean accepted = RowAcceptance.accept(row);
            boolean merged = merger.absorb(row);
            if (merged) stats.continuationMerge();
            if (!accepted) {
                if (!merged) {
                    stats.rejectedRow();
                    logger.debug("Dropped non-course line {} of {}: '{}'", i + 1, pageId, line.trim());
                }
                continue;
            }
            stats.acceptedRow();
            PendingSection section = new PendingSection(buildSection(subject.trim(), term, row, merged, stats));
            pending.add(section);
            merger.emitted(section);
        }

        List<SectionRecord> sections = new ArrayList<>(pending.size());
        for (PendingSection p : pending) sections.add(p.toRecord());
        logger.info("Parsed {} section(s) from {} ({})", sections.size(), pageId, stats);
        return new PageParseResult(pageId, sections, stats);
    }

    private SectionRecord buildSection(String subject, String term, RawRow row, boolean facultyConsumed, ParseStats stats) {
        String number = emptyToNull(row.number());
        String section = emptyToNull(row.section());

        TimeRange time = timeParser.parse(row.line(), row.time());
        if (!time.isAnnounced()) {
            stats.unannouncedTime();
            if (!row.time().isBlank() && !TimeRangeParser.matchPlaceholder(row.time()).status().equals(TimeParseOutcome.Status.PLACEHOLDER)) {
                stats.ambiguousTime();
                logger.debug("Could not read time '{}' for {} {}; treating as TBA", row.time(), subject, number);
            }
        }
        if (time.meridiemConflict()) stats.meridiemConflict();

        switch (normalizer.classifyLocation(row.room(), row.building())) {
            case ANNOUNCED_LATER -> stats.announcedLaterLocation();
            case LETTER_DRIFT -> stats.repairedLocation();
            case UNRESOLVED_DRIFT -> stats.ambiguousLocation();
            default -> { }
        }
        Location location = normalizer.repairLocation(row.room(), row.building());

        return new SectionRecord(
            subject,
            number,
            number == null ? null : subject + number,
            section,
            RowAcceptance.parseCallNumber(row.callNumberText()),
            term,
            row.title(),
            normalizer.parseCredits(row.points()),
            normalizer.canonicalizeDays(row.day()),
            time.startTime(),
            time.endTime(),
            location.room(),
            location.building(),
            facultyConsumed ? "" : row.faculty(),
            false,
            null,
            urls.detailUrl(subject, term, number, section)
        );
    }

    private static String emptyToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
