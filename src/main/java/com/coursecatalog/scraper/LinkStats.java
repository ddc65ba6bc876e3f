package com.coursecatalog.scraper;

/**
 * Counters for one linkage pass.
 */
public class LinkStats {
    private int flagged;
    private int linkedByDetailPage;
    private int linkedByTitle;
    private int ambiguous;
    private int noCandidate;
    private int fetchFailures;
    private int fetchTimeouts;
    private int fetchesSkipped;

    void flagged() { flagged++; }
    void record(LinkResult result) {
        switch (result.status()) {
            case LINKED -> {
                if (result.source() == LinkResult.Source.DETAIL_PAGE) linkedByDetailPage++;
                else linkedByTitle++;
            }
            case UNLINKED_AMBIGUOUS -> ambiguous++;
            case UNLINKED_NO_CANDIDATE -> noCandidate++;
        }
    }
    void fetchFailure() { fetchFailures++; }
    void fetchTimeout() { fetchTimeouts++; }
    void fetchSkipped() { fetchesSkipped++; }

    public int getFlagged() { return flagged; }
    public int getLinkedByDetailPage() { return linkedByDetailPage; }
    public int getLinkedByTitle() { return linkedByTitle; }
    public int getAmbiguous() { return ambiguous; }
    public int getNoCandidate() { return noCandidate; }
    public int getFetchFailures() { return fetchFailures; }
    public int getFetchTimeouts() { return fetchTimeouts; }
    public int getFetchesSkipped() { return fetchesSkipped; }

    public synchronized void add(LinkStats other) {
        flagged += other.flagged;
        linkedByDetailPage += other.linkedByDetailPage;
        linkedByTitle += other.linkedByTitle;
        ambiguous += other.ambiguous;
        noCandidate += other.noCandidate;
        fetchFailures += other.fetchFailures;
        fetchTimeouts += other.fetchTimeouts;
        fetchesSkipped += other.fetchesSkipped;
    }

    @Override
    public String toString() {
        return String.format("flagged=%d detailLinks=%d titleLinks=%d ambiguous=%d noCandidate=%d "
                + "fetchFailures=%d fetchTimeouts=%d fetchesSkipped=%d",
            flagged, linkedByDetailPage, linkedByTitle, ambiguous, noCandidate, fetchFailures, fetchTimeouts, fetchesSkipped);
    }
}
