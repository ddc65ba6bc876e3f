package com.coursecatalog.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

public class ContinuationMergerTest {

    private static RawRow facultyOnly(String faculty) {
        return new RawRow("", "", "", "", "", "", "", "", "", "", faculty);
    }

    private static PendingSection pending(String instructor) {
        return new PendingSection(new SectionRecord("COMS", "3134", "COMS3134", "R01", 10235, "Fall 2025",
            "DATA STRUCTURES", null, null, null, null, null, null, instructor, false, null, null));
    }

    @Test
    void testWrappedNameIsJoined() {
        ContinuationMerger merger = new ContinuationMerger();
        PendingSection previous = pending("Lee,");
        merger.emitted(previous);
        RawRow continuation = facultyOnly("Ey");
        assertFalse(RowAcceptance.accept(continuation));
        assertTrue(merger.absorb(continuation));
        assertEquals("Lee, Ey", previous.toRecord().instructor());
        assertEquals(1, merger.getMerges());
    }

    @Test
    void testNoMergeWithoutTrailingComma() {
        ContinuationMerger merger = new ContinuationMerger();
        PendingSection previous = pending("Blaer, Paul");
        merger.emitted(previous);
        assertFalse(merger.absorb(facultyOnly("Ey")));
        assertEquals("Blaer, Paul", previous.toRecord().instructor());
    }

    @Test
    void testNoMergeWithoutPreviousOrFaculty() {
        ContinuationMerger merger = new ContinuationMerger();
        assertFalse(merger.absorb(facultyOnly("Ey")));
        merger.emitted(pending("Lee,"));
        assertFalse(merger.absorb(facultyOnly("")));
        assertEquals(0, merger.getMerges());
    }

    @Test
    void testOnlyImmediatePredecessorIsConsulted() {
        ContinuationMerger merger = new ContinuationMerger();
        PendingSection first = pending("Lee,");
        merger.emitted(first);
        merger.emitted(pending("Kim, Martha"));
        assertFalse(merger.absorb(facultyOnly("Ey")));
        assertEquals("Lee,", first.toRecord().instructor());
    }
}
