package com.coursecatalog.scraper;

/**
 * Counters for the conditions the parser degrades on instead of failing.
 */
public class ParseStats {
    private int acceptedRows;
    private int rejectedRows;
    private int continuationMerges;
    private int unannouncedTimes;
    private int ambiguousTimes;
    private int meridiemConflicts;
    private int announcedLaterLocations;
    private int repairedLocations;
    private int ambiguousLocations;

    void acceptedRow() { acceptedRows++; }
    void rejectedRow() { rejectedRows++; }
    void continuationMerge() { continuationMerges++; }
    void unannouncedTime() { unannouncedTimes++; }
    void ambiguousTime() { ambiguousTimes++; }
    void meridiemConflict() { meridiemConflicts++; }
    void announcedLaterLocation() { announcedLaterLocations++; }
    void repairedLocation() { repairedLocations++; }
    void ambiguousLocation() { ambiguousLocations++; }

    public int getAcceptedRows() { return acceptedRows; }
    public int getRejectedRows() { return rejectedRows; }
    public int getContinuationMerges() { return continuationMerges; }
    public int getUnannouncedTimes() { return unannouncedTimes; }
    public int getAmbiguousTimes() { return ambiguousTimes; }
    public int getMeridiemConflicts() { return meridiemConflicts; }
    public int getAnnouncedLaterLocations() { return announcedLaterLocations; }
    public int getRepairedLocations() { return repairedLocations; }
    public int getAmbiguousLocations() { return ambiguousLocations; }

    /**
     * Adds another page's counters to this one.
     */
    public synchronized void add(ParseStats other) {
        acceptedRows += other.acceptedRows;
        rejectedRows += other.rejectedRows;
        continuationMerges += other.continuationMerges;
        unannouncedTimes += other.unannouncedTimes;
        ambiguousTimes += other.ambiguousTimes;
        meridiemConflicts += other.meridiemConflicts;
        announcedLaterLocations += other.announcedLaterLocations;
        repairedLocations += other.repairedLocations;
        ambiguousLocations += other.ambiguousLocations;
    }

    @Override
    public String toString() {
        return String.format("accepted=%d rejected=%d merges=%d tbaTimes=%d ambiguousTimes=%d meridiemConflicts=%d "
                + "announcedLater=%d repairedLocations=%d ambiguousLocations=%d",
            acceptedRows, rejectedRows, continuationMerges, unannouncedTimes, ambiguousTimes, meridiemConflicts,
            announcedLaterLocations, repairedLocations, ambiguousLocations);
    }
}
