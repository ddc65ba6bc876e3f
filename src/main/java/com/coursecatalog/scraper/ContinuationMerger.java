package com.coursecatalog.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-joins instructor names that the listing wrapped onto the next line.
 * <p>
 * The listing breaks a long Faculty cell after a comma ("Lee," / "Ey"). When the last emitted
 * section's instructor ends with a comma, the Faculty text of the next line is appended to it and
 * that line contributes no instructor of its own. Only the immediately preceding emitted section is
 * consulted. One instance per page; not thread-safe.
 */
public class ContinuationMerger {
    private static final Logger logger = LoggerFactory.getLogger(ContinuationMerger.class);

    private PendingSection previous;
    private int merges;

    /**
     * Tries to fold the Faculty cell of {@code row} into the previous section.
     * @param row Current line, accepted or not
     * @return true if the Faculty text was consumed as a name continuation
     */
    public boolean absorb(RawRow row) {
        if (previous == null || row == null) return false;
        String faculty = row.faculty();
        if (faculty == null || faculty.isBlank()) return false;
        if (!previous.instructor().trim().endsWith(",")) return false;
        logger.debug("Joining wrapped instructor '{}' + '{}'", previous.instructor(), faculty);
        previous.appendInstructor(faculty);
        merges++;
        return true;
    }

    void emitted(PendingSection section) {
        previous = section;
    }

    public int getMerges() {
        return merges;
    }
}
