package com.coursecatalog.scraper;

import com.coursecatalog.sitetext.ListingTextExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags recitation sections and links each one to the lecture it belongs to.
 * <p>
 * Workflow:
 * <ul>
 *   <li>A section is a recitation when its section code is {@code R} plus digits, or its credits are exactly zero.</li>
 *   <li>Detail pages of flagged sections are fetched on a bounded pool; a "Required recitation ... enrolled in
 *   SUBJ NUMBER" sentence names the parent directly.</li>
 *   <li>Otherwise the normalized title is matched against the non-recitation sections of the same batch.
 *   Exactly one lecture links; none or several leave the section unlinked.</li>
 * </ul>
 * Fetch failures, timeouts and an exhausted budget only switch a section to the title fallback.
 * The batch itself never fails.
 *
 * @author Course Catalog Scraper Team
 * @since 1.0
 */
public class RecitationLinker {
    private static final Logger logger = LoggerFactory.getLogger(RecitationLinker.class);

    private static final Pattern REQUIRED_RECITATION = Pattern.compile(
        "(?is)required\\s+recitation.{0,300}?enrolled\\s+in\\s*[\\[(]?\\s*([A-Z]{2,5})\\s*[\\])]?\\s*[\\[(]?\\s*([A-Z]?\\d{3,5}[A-Z]?)\\s*[\\])]?");
    private static final Pattern QUALIFIERS = Pattern.compile(
        "(?i)\\b(?:recitations?|recit|rec|laboratory|lab|discussion|tutorial|problem\\s+sessions?)\\b");

    private final PageFetchServiceInterface fetcher;
    private final int concurrency;
    private final Duration fetchTimeout;
    private final Duration budget;

    /**
     * @param fetcher detail-page source, or null to link by title only
     * @param config  concurrency, per-request timeout and overall budget
     */
    public RecitationLinker(PageFetchServiceInterface fetcher, CatalogConfig config) {
        this.fetcher = fetcher;
        this.concurrency = config.getLinkConcurrency();
        this.fetchTimeout = config.getFetchTimeout();
        this.budget = config.getLinkBudget();
    }

    public static boolean isRecitationCandidate(SectionRecord record) {
        return Component.classify(record.section(), record.credits(), record.title()) == Component.RECITATION;
    }

    /**
     * Links one subject's sections.
     * @param records sections of a single subject, in listing order
     * @return New records in the same order, each with its recitation flag resolved
     */
    public List<SectionRecord> linkRecitations(List<SectionRecord> records) {
        return linkWithReport(records).sections();
    }

    public LinkReport linkWithReport(List<SectionRecord> records) {
        if (records == null) {
            logger.warn("linkRecitations called with null records.");
            throw new IllegalArgumentException("Records cannot be null");
        }
        LinkStats stats = new LinkStats();
        List<Integer> flagged = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            if (isRecitationCandidate(records.get(i))) {
                flagged.add(i);
                stats.flagged();
            }
        }
        if (flagged.isEmpty()) {
            List<SectionRecord> out = new ArrayList<>(records.size());
            for (SectionRecord r : records) out.add(r.withLinkage(false, null));
            return new LinkReport(out, stats);
        }

        Map<Integer, String> detailTexts = fetchDetailPages(records, flagged, stats);

        List<SectionRecord> out = new ArrayList<>(records.size());
        Set<Integer> flaggedSet = new LinkedHashSet<>(flagged);
        for (int i = 0; i < records.size(); i++) {
            SectionRecord r = records.get(i);
            if (!flaggedSet.contains(i)) {
                out.add(r.withLinkage(false, null));
                continue;
            }
            LinkResult result = link(r, records, detailTexts.get(i));
            stats.record(result);
            if (!result.isLinked()) {
                logger.debug("Recitation {} {} left unlinked: {}", r.courseCode(), r.section(), result.status());
            }
            out.add(r.withLinkage(true, result.parentCourseCode()));
        }
        logger.info("Linked recitations of {}: {}", records.isEmpty() ? "?" : records.get(0).subject(), stats);
        return new LinkReport(out, stats);
    }

    /**
     * Resolves the parent of one flagged section.
     * @param flagged    the recitation section
     * @param batch      all sections of the same subject
     * @param detailText text of the section's detail page, or null when unavailable
     * @return Tri-state link outcome
     */
    public LinkResult link(SectionRecord flagged, List<SectionRecord> batch, String detailText) {
        String fromPage = parentFromDetailPage(detailText);
        if (fromPage != null) return LinkResult.linked(fromPage, LinkResult.Source.DETAIL_PAGE);

        String key = normalizeTitle(flagged.title());
        if (key.isEmpty()) return LinkResult.noCandidate();
        Set<String> candidates = new LinkedHashSet<>();
        for (SectionRecord other : batch) {
            if (other == flagged || isRecitationCandidate(other) || other.courseCode() == null) continue;
            if (flagged.subject() != null && !flagged.subject().equals(other.subject())) continue;
            if (key.equals(normalizeTitle(other.title()))) candidates.add(other.courseCode());
        }
        if (candidates.size() == 1) return LinkResult.linked(candidates.iterator().next(), LinkResult.Source.TITLE_MATCH);
        return candidates.isEmpty() ? LinkResult.noCandidate() : LinkResult.ambiguous();
    }

    static String parentFromDetailPage(String detailText) {
        if (detailText == null || detailText.isBlank()) return null;
        Matcher m = REQUIRED_RECITATION.matcher(ListingTextExtractor.toSearchableText(detailText));
        if (!m.find()) return null;
        return m.group(1).toUpperCase(Locale.ROOT) + m.group(2).toUpperCase(Locale.ROOT);
    }

    static String normalizeTitle(String title) {
        if (title == null) return "";
        String t = QUALIFIERS.matcher(title).replaceAll(" ");
        t = t.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ");
        return t.trim().replaceAll("\\s+", " ");
    }

    private Map<Integer, String> fetchDetailPages(List<SectionRecord> records, List<Integer> flagged, LinkStats stats) {
        Map<Integer, String> texts = new LinkedHashMap<>();
        if (fetcher == null) return texts;

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, flagged.size()));
        try {
            Map<Integer, Future<String>> futures = new LinkedHashMap<>();
            for (int i : flagged) {
                String url = records.get(i).detailUrl();
                if (url == null || url.isBlank()) continue;
                futures.put(i, pool.submit(() -> fetcher.fetchText(url)));
            }
            long deadline = budget.isZero() ? Long.MAX_VALUE : System.nanoTime() + budget.toNanos();
            boolean stopped = false;
            for (Map.Entry<Integer, Future<String>> e : futures.entrySet()) {
                Future<String> future = e.getValue();
                long remaining = deadline - System.nanoTime();
                if (stopped || remaining <= 0) {
                    if (!stopped) logger.warn("Detail-page budget of {} exhausted; remaining recitations use title matching", budget);
                    stopped = true;
                    if (future.isDone() && !future.isCancelled()) {
                        collect(e.getKey(), future, texts, stats);
                    } else {
                        future.cancel(true);
                        stats.fetchSkipped();
                    }
                    continue;
                }
                long wait = Math.min(fetchTimeout.toNanos(), remaining);
                try {
                    texts.put(e.getKey(), future.get(wait, TimeUnit.NANOSECONDS));
                } catch (TimeoutException ex) {
                    future.cancel(true);
                    stats.fetchTimeout();
                    logger.warn("Detail page timed out: {}", records.get(e.getKey()).detailUrl());
                } catch (ExecutionException ex) {
                    stats.fetchFailure();
                    logger.warn("Detail page failed: {} ({})", records.get(e.getKey()).detailUrl(), ex.getCause().getMessage());
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted while fetching detail pages; falling back to title matching");
                    stopped = true;
                }
            }
        } finally {
            pool.shutdownNow();
        }
        return texts;
    }

    private void collect(int index, Future<String> future, Map<Integer, String> texts, LinkStats stats) {
        try {
            texts.put(index, future.get());
        } catch (ExecutionException ex) {
            stats.fetchFailure();
            logger.warn("Detail page failed: {}", ex.getCause().getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
