package com.coursecatalog.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

public class ComponentTest {

    @Test
    void testRecitationBySectionOrZeroPoints() {
        assertEquals(Component.RECITATION, Component.classify("R01", Credits.fixed(3), "DATA STRUCTURES"));
        assertEquals(Component.RECITATION, Component.classify(" r12 ", null, "DATA STRUCTURES"));
        assertEquals(Component.RECITATION, Component.classify("002", Credits.fixed(0), "DATA STRUCTURES"));
    }

    @Test
    void testLabBySectionOrTitle() {
        assertEquals(Component.LAB, Component.classify("L01", Credits.fixed(1), "INTRO TO DIGITAL SYSTEMS"));
        assertEquals(Component.LAB, Component.classify("001", Credits.fixed(1), "PHYSICS LABORATORY"));
        assertEquals(Component.LAB, Component.classify("001", Credits.fixed(1), "DIGITAL SYSTEMS LAB"));
        assertEquals(Component.LECTURE, Component.classify("001", Credits.fixed(3), "COLLABORATIVE DESIGN"));
    }

    @Test
    void testZeroPointLabIsRecitation() {
        assertEquals(Component.RECITATION, Component.classify("001", Credits.fixed(0), "CHEMISTRY LAB"));
    }

    @Test
    void testDefaultsToLecture() {
        assertEquals(Component.LECTURE, Component.classify(null, null, null));
        assertEquals(Component.LECTURE, Component.classify("001", new Credits(1, 3), "OPERATING SYSTEMS I"));
        assertEquals("lecture", Component.LECTURE.label());
    }

    @Test
    void testRecordExposesComponent() {
        SectionRecord r = new SectionRecord("COMS", "3134", "COMS3134", "R01", 10235, "Fall 2025", "DATA STRUCTURES",
            Credits.fixed(0), null, null, null, null, null, null, false, null, null);
        assertEquals(Component.RECITATION, r.component());
        assertTrue(RecitationLinker.isRecitationCandidate(r));
    }
}
